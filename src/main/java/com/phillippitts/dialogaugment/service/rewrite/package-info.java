/**
 * Rewritten shard documents for text transforms.
 */
package com.phillippitts.dialogaugment.service.rewrite;
