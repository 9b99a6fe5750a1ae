/**
 * Domain model of the augmentation pipeline: work units, artifacts, unit outcomes and the
 * checkpoint. Records are immutable; {@link com.phillippitts.dialogaugment.domain.Checkpoint}
 * is owned and mutated by a single thread.
 */
package com.phillippitts.dialogaugment.domain;
