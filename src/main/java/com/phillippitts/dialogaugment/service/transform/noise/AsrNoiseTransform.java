package com.phillippitts.dialogaugment.service.transform.noise;

import com.phillippitts.dialogaugment.config.transform.AsrNoiseProperties;
import com.phillippitts.dialogaugment.service.transform.AbstractTextTransform;
import com.phillippitts.dialogaugment.util.Digests;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Random;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Simulates speech recognition errors by swapping words for homophones.
 *
 * <p>Each word found in the homophone table is replaced with probability
 * {@code augment.asr-noise.probability} by one of its candidates. The random source is seeded
 * from the payload (and the configured seed), so the same utterance always yields the same
 * variant. Capitalization of the first letter is preserved.
 */
@Component
@ConditionalOnProperty(name = "augment.transform.type", havingValue = "asr-noise")
public class AsrNoiseTransform extends AbstractTextTransform {

    private static final Logger LOG = LogManager.getLogger(AsrNoiseTransform.class);

    public static final String NAME = "asr-noise";

    private static final Pattern WORD = Pattern.compile("[\\p{Alpha}']+");

    private final double probability;
    private final long seed;
    private final Map<String, List<String>> homophones;

    public AsrNoiseTransform(AsrNoiseProperties props) {
        this.probability = props.probability();
        this.seed = props.seed();
        Map<String, List<String>> table = new TreeMap<>();
        props.homophones().forEach((word, candidates) -> {
            List<String> usable = candidates.stream()
                    .map(String::trim)
                    .filter(c -> !c.isEmpty())
                    .toList();
            if (!usable.isEmpty()) {
                table.put(word.toLowerCase(Locale.ROOT), usable);
            }
        });
        this.homophones = Map.copyOf(table);
    }

    @Override
    protected void doInitialize() {
        if (homophones.isEmpty()) {
            LOG.warn("ASR noise transform has an empty homophone table; output will equal input");
        }
        LOG.info("ASR noise transform initialized: words={}, probability={}", homophones.size(), probability);
    }

    @Override
    protected String transformText(String payload) {
        Random random = new Random(Digests.sha256Long(payload) ^ seed);
        Matcher m = WORD.matcher(payload);
        StringBuilder out = new StringBuilder(payload.length());
        int last = 0;
        while (m.find()) {
            out.append(payload, last, m.start());
            String word = m.group();
            List<String> candidates = homophones.get(word.toLowerCase(Locale.ROOT));
            // Draw for every table hit so the sequence does not depend on earlier outcomes
            if (candidates != null) {
                double roll = random.nextDouble();
                int pick = random.nextInt(candidates.size());
                out.append(roll < probability ? matchCase(word, candidates.get(pick)) : word);
            } else {
                out.append(word);
            }
            last = m.end();
        }
        out.append(payload, last, payload.length());
        return out.toString();
    }

    static String matchCase(String original, String replacement) {
        if (replacement.isEmpty() || !Character.isUpperCase(original.charAt(0))) {
            return replacement;
        }
        return Character.toUpperCase(replacement.charAt(0)) + replacement.substring(1);
    }

    @Override
    protected void doClose() {
        LOG.debug("ASR noise transform closed");
    }

    @Override
    public String getTransformName() {
        return NAME;
    }

    @Override
    public Map<String, String> parameters() {
        Map<String, String> params = new TreeMap<>();
        params.put("transform", NAME);
        params.put("probability", Double.toString(probability));
        params.put("seed", Long.toString(seed));
        params.put("table", Digests.sha256Hex(new TreeMap<>(homophones).toString()).substring(0, 16));
        return params;
    }

    @Override
    public RewriteMode rewriteMode() {
        return RewriteMode.REPLACE;
    }
}
