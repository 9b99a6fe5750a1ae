/**
 * Durable progress tracking at shard granularity.
 */
package com.phillippitts.dialogaugment.service.checkpoint;
