package com.phillippitts.dialogaugment.service.transform.translation;

import com.phillippitts.dialogaugment.config.transform.TranslationProperties;
import com.phillippitts.dialogaugment.exception.PermanentTransformException;
import com.phillippitts.dialogaugment.service.transform.AbstractTextTransform;
import com.phillippitts.dialogaugment.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

/**
 * Paraphrases an utterance by translating it to a pivot language and back
 * (source, intermediate, source).
 *
 * <p>If the round trip produces an empty string the original text is kept, so every unit
 * still yields an artifact.
 */
@Component
@ConditionalOnProperty(name = "augment.transform.type", havingValue = "back-translation")
public class BackTranslationTransform extends AbstractTextTransform {

    private static final Logger LOG = LogManager.getLogger(BackTranslationTransform.class);

    public static final String NAME = "back-translation";

    private final TranslationClient client;
    private final TranslationProperties props;

    public BackTranslationTransform(TranslationClient client, TranslationProperties props) {
        this.client = Objects.requireNonNull(client, "client");
        this.props = Objects.requireNonNull(props, "props");
    }

    @Override
    protected void doInitialize() {
        Set<String> languages = client.supportedLanguages();
        for (String code : new String[]{props.sourceLanguage(), props.intermediateLanguage()}) {
            if (!languages.contains(code)) {
                throw new PermanentTransformException("Translation service does not support language '"
                        + code + "' (available: " + languages + ")", NAME);
            }
        }
        LOG.info("Back-translation transform initialized: url={}, route={}->{}->{}",
                props.baseUrl(), props.sourceLanguage(), props.intermediateLanguage(), props.sourceLanguage());
    }

    @Override
    protected String transformText(String payload) {
        String pivot = client.translate(payload, props.sourceLanguage(), props.intermediateLanguage());
        if (pivot == null || pivot.isBlank()) {
            LOG.debug("Empty pivot translation; keeping original: '{}'", LogSanitizer.preview(payload, 60));
            return payload;
        }
        String back = client.translate(pivot, props.intermediateLanguage(), props.sourceLanguage());
        if (back == null || back.isBlank()) {
            LOG.debug("Empty back translation; keeping original: '{}'", LogSanitizer.preview(payload, 60));
            return payload;
        }
        return back.trim();
    }

    @Override
    protected void doClose() {
        LOG.debug("Back-translation transform closed");
    }

    @Override
    public String getTransformName() {
        return NAME;
    }

    @Override
    public Map<String, String> parameters() {
        Map<String, String> params = new TreeMap<>();
        params.put("transform", NAME);
        params.put("source", props.sourceLanguage());
        params.put("intermediate", props.intermediateLanguage());
        return params;
    }

    @Override
    public RewriteMode rewriteMode() {
        return RewriteMode.ADD_FIELD;
    }

    @Override
    public String rewriteField() {
        return props.outputField();
    }
}
