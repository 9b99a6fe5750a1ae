package com.phillippitts.dialogaugment.service.transform.translation;

import com.phillippitts.dialogaugment.config.transform.TranslationProperties;
import com.phillippitts.dialogaugment.exception.TransformException;
import com.phillippitts.dialogaugment.exception.TransformExceptionBuilder;
import com.phillippitts.dialogaugment.util.LogSanitizer;
import com.phillippitts.dialogaugment.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * {@link TranslationClient} for LibreTranslate compatible HTTP APIs.
 *
 * <p>Endpoints used:
 * <ul>
 *   <li>{@code POST {base-url}/translate} with {@code {q, source, target, format, api_key?}},
 *       answering {@code {translatedText}}</li>
 *   <li>{@code GET {base-url}/languages}, answering {@code [{code, name}, ...]}</li>
 * </ul>
 *
 * <p>Requests are spaced at least {@code augment.translation.request-interval} apart across all
 * worker threads. HTTP 429, 5xx and connection failures are transient; other 4xx responses
 * are permanent.
 */
@Component
@ConditionalOnProperty(name = "augment.transform.type", havingValue = "back-translation")
public class LibreTranslateClient implements TranslationClient {

    private static final Logger LOG = LogManager.getLogger(LibreTranslateClient.class);

    static final String TRANSFORM = "back-translation";
    private static final int TOO_MANY_REQUESTS = 429;
    private static final int BODY_SNIPPET_MAX_CHARS = 512;

    private final RestTemplate restTemplate;
    private final TranslationProperties props;
    private final String baseUrl;
    private final Object throttleLock = new Object();
    private long nextRequestNanos = Long.MIN_VALUE;

    @Autowired
    public LibreTranslateClient(RestTemplateBuilder restTemplateBuilder, TranslationProperties props) {
        this(restTemplateBuilder
                .setConnectTimeout(props.connectTimeout())
                .setReadTimeout(props.readTimeout())
                .build(), props);
    }

    LibreTranslateClient(RestTemplate restTemplate, TranslationProperties props) {
        this.restTemplate = Objects.requireNonNull(restTemplate, "restTemplate");
        this.props = Objects.requireNonNull(props, "props");
        this.baseUrl = stripTrailingSlash(props.baseUrl());
    }

    @Override
    public String translate(String text, String sourceLanguage, String targetLanguage) {
        JSONObject body = new JSONObject()
                .put("q", text)
                .put("source", sourceLanguage)
                .put("target", targetLanguage)
                .put("format", "text");
        if (props.apiKey() != null && !props.apiKey().isBlank()) {
            body.put("api_key", props.apiKey());
        }

        String url = baseUrl + "/translate";
        String response = exchange(url, HttpMethod.POST, body.toString());
        try {
            return new JSONObject(response).optString("translatedText", "");
        } catch (JSONException e) {
            throw TransformExceptionBuilder.create("Malformed translation response")
                    .transform(TRANSFORM)
                    .cause(e)
                    .metadata("url", url)
                    .metadata("body", snippet(response))
                    .build();
        }
    }

    @Override
    public Set<String> supportedLanguages() {
        String url = baseUrl + "/languages";
        String response = exchange(url, HttpMethod.GET, null);
        Set<String> codes = new LinkedHashSet<>();
        try {
            JSONArray languages = new JSONArray(response);
            for (int i = 0; i < languages.length(); i++) {
                JSONObject language = languages.optJSONObject(i);
                if (language != null && language.has("code")) {
                    codes.add(language.getString("code"));
                }
            }
        } catch (JSONException e) {
            throw TransformExceptionBuilder.create("Malformed language list")
                    .transform(TRANSFORM)
                    .permanent()
                    .cause(e)
                    .metadata("url", url)
                    .build();
        }
        return codes;
    }

    private String exchange(String url, HttpMethod method, String jsonBody) {
        awaitRequestSlot();

        HttpHeaders headers = new HttpHeaders();
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        if (jsonBody != null) {
            headers.setContentType(MediaType.APPLICATION_JSON);
        }

        long start = System.nanoTime();
        try {
            ResponseEntity<String> resp = restTemplate.exchange(
                    url, method, new HttpEntity<>(jsonBody, headers), String.class);
            LOG.debug("{} {} -> {} in {} ms", method, url, resp.getStatusCode().value(),
                    TimeUtils.elapsedMillis(start));
            return Objects.requireNonNullElse(resp.getBody(), "");
        } catch (HttpStatusCodeException e) {
            throw httpError(url, e.getStatusCode(), e.getResponseBodyAsString(), start, e);
        } catch (ResourceAccessException e) {
            throw TransformExceptionBuilder.create("Translation service unreachable")
                    .transform(TRANSFORM)
                    .cause(e)
                    .durationMs(TimeUtils.elapsedMillis(start))
                    .metadata("url", url)
                    .build();
        } catch (RestClientException e) {
            throw TransformExceptionBuilder.create("Translation request failed: " + e.getMessage())
                    .transform(TRANSFORM)
                    .cause(e)
                    .durationMs(TimeUtils.elapsedMillis(start))
                    .metadata("url", url)
                    .build();
        }
    }

    private TransformException httpError(String url, HttpStatusCode status, String body, long start,
                                         Throwable cause) {
        TransformExceptionBuilder builder = TransformExceptionBuilder.create("HTTP " + status.value())
                .transform(TRANSFORM)
                .cause(cause)
                .durationMs(TimeUtils.elapsedMillis(start))
                .metadata("url", url)
                .metadata("body", snippet(body));
        if (isRetryable(status)) {
            return builder.build();
        }
        return builder.permanent().build();
    }

    static boolean isRetryable(HttpStatusCode status) {
        return status.value() == TOO_MANY_REQUESTS || status.is5xxServerError();
    }

    /**
     * Blocks until the configured spacing since the previous request has elapsed.
     */
    private void awaitRequestSlot() {
        long intervalNanos = props.requestInterval().toNanos();
        if (intervalNanos <= 0) {
            return;
        }
        synchronized (throttleLock) {
            long now = System.nanoTime();
            if (nextRequestNanos != Long.MIN_VALUE && now < nextRequestNanos) {
                long waitMs = TimeUtils.nanosToMillis(nextRequestNanos - now);
                try {
                    Thread.sleep(Math.max(waitMs, 1));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw TransformExceptionBuilder.create("Interrupted while throttling")
                            .transform(TRANSFORM)
                            .cause(e)
                            .build();
                }
                now = System.nanoTime();
            }
            nextRequestNanos = now + intervalNanos;
        }
    }

    private static String snippet(String body) {
        return LogSanitizer.truncate(body, BODY_SNIPPET_MAX_CHARS);
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
