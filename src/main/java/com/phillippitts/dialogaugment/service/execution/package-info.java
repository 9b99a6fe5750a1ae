/**
 * Per-unit execution: artifact reuse, retry with capped exponential backoff and atomic
 * artifact publication.
 */
package com.phillippitts.dialogaugment.service.execution;
