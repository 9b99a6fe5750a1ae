package com.phillippitts.dialogaugment.service.identity;

import com.phillippitts.dialogaugment.config.properties.IdentityProperties;
import com.phillippitts.dialogaugment.domain.WorkUnit;
import com.phillippitts.dialogaugment.service.transform.UtteranceTransform;
import com.phillippitts.dialogaugment.util.Digests;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.HexFormat;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.regex.Pattern;

/**
 * Derives deterministic content ids for work units.
 *
 * <p>The hash is the lowercase hex SHA-256 over the UTF-8 payload followed by the transform's
 * parameters in key order, truncated to {@code augment.identity.hash-length}. The id is
 * composed as {@code {shard}_{sequence}_{tag}_{hash}} where shard is the shard file stem and
 * shard and tag are reduced to {@code [A-Za-z0-9-]}. Identical payloads under identical
 * parameters always share the same hash.
 */
@Service
public class ContentIdentityService {

    private static final Pattern UNSAFE = Pattern.compile("[^A-Za-z0-9-]");
    private static final char SEPARATOR = '_';

    private final int hashLength;
    private final Map<String, String> parameters;

    @Autowired
    public ContentIdentityService(IdentityProperties props, UtteranceTransform transform) {
        this(props.hashLength(), transform.parameters());
    }

    public ContentIdentityService(int hashLength, Map<String, String> parameters) {
        if (hashLength < 1 || hashLength > 64) {
            throw new IllegalArgumentException("hashLength must be in [1, 64]: " + hashLength);
        }
        this.hashLength = hashLength;
        this.parameters = new TreeMap<>(Objects.requireNonNull(parameters, "parameters"));
    }

    public String contentId(WorkUnit unit) {
        return contentId(unit.payload(), unit.shardId(), unit.sequenceIndex(), unit.tag());
    }

    public String contentId(String payload, String shardId, int sequenceIndex, String tag) {
        return sanitize(stem(shardId)) + SEPARATOR + sequenceIndex + SEPARATOR + sanitize(tag)
                + SEPARATOR + hash(payload);
    }

    /**
     * Content hash prefix of a payload under the configured transform parameters.
     */
    public String hash(String payload) {
        Objects.requireNonNull(payload, "payload");
        MessageDigest digest = Digests.sha256();
        digest.update(payload.getBytes(StandardCharsets.UTF_8));
        for (Map.Entry<String, String> e : parameters.entrySet()) {
            digest.update((byte) 0);
            digest.update((e.getKey() + "=" + e.getValue()).getBytes(StandardCharsets.UTF_8));
        }
        return HexFormat.of().formatHex(digest.digest()).substring(0, hashLength);
    }

    /** File name of an artifact with the given id. */
    public static String artifactFileName(String contentId, String extension) {
        return contentId + "." + extension;
    }

    static String stem(String shardId) {
        int dot = shardId.lastIndexOf('.');
        return dot > 0 ? shardId.substring(0, dot) : shardId;
    }

    static String sanitize(String value) {
        if (value == null || value.isBlank()) {
            return "UNKNOWN";
        }
        return UNSAFE.matcher(value).replaceAll("-");
    }
}
