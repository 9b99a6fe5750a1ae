/**
 * Speech synthesis through an external TTS process.
 */
package com.phillippitts.dialogaugment.service.transform.synthesis;
