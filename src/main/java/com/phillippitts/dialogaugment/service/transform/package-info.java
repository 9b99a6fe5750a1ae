/**
 * Pluggable utterance transforms. Exactly one implementation is active per run, selected by
 * {@code augment.transform.type}:
 * <ul>
 *   <li>{@code synthesis} - text to speech through an external process (default)</li>
 *   <li>{@code back-translation} - round trip through a translation service</li>
 *   <li>{@code asr-noise} - homophone substitution simulating recognition errors</li>
 * </ul>
 */
package com.phillippitts.dialogaugment.service.transform;
