/**
 * Batching, fan-out to the worker pool and shard commit bookkeeping.
 */
package com.phillippitts.dialogaugment.service.scheduling;
