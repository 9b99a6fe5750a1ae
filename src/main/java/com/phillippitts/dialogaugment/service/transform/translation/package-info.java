/**
 * Back-translation through a LibreTranslate compatible HTTP service.
 */
package com.phillippitts.dialogaugment.service.transform.translation;
