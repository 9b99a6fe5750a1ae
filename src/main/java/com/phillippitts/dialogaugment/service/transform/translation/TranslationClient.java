package com.phillippitts.dialogaugment.service.transform.translation;

import java.util.Set;

/**
 * Machine translation backend.
 *
 * <p>Implementations throw {@link com.phillippitts.dialogaugment.exception.TransientTransformException}
 * for rate limiting and outages, and
 * {@link com.phillippitts.dialogaugment.exception.PermanentTransformException} for rejected requests.
 */
public interface TranslationClient {

    /**
     * Translates {@code text}.
     *
     * @return translated text, possibly empty
     */
    String translate(String text, String sourceLanguage, String targetLanguage);

    /** Language codes the backend can translate from. */
    Set<String> supportedLanguages();
}
