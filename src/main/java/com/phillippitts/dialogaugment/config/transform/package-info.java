/**
 * Per-transform configuration. Only the section of the selected
 * {@code augment.transform.type} is used at runtime.
 */
package com.phillippitts.dialogaugment.config.transform;
