/**
 * Application-specific exception hierarchy.
 *
 * <p>All exceptions are unchecked and extend
 * {@link com.phillippitts.dialogaugment.exception.DialogAugmentException}.
 *
 * <p>Scopes:
 * <ul>
 *   <li>Shard scope: {@link com.phillippitts.dialogaugment.exception.DecodeException} - shard skipped</li>
 *   <li>Unit scope: {@link com.phillippitts.dialogaugment.exception.ValidationException},
 *       {@link com.phillippitts.dialogaugment.exception.TransientTransformException},
 *       {@link com.phillippitts.dialogaugment.exception.PermanentTransformException},
 *       {@link com.phillippitts.dialogaugment.exception.TransformFailedException} -
 *       recorded in the run summary, never propagated past the scheduler</li>
 *   <li>Run scope (fatal): {@link com.phillippitts.dialogaugment.exception.InitializationException},
 *       {@link com.phillippitts.dialogaugment.exception.CheckpointWriteException} - mapped to
 *       non-zero exit codes</li>
 * </ul>
 *
 * @since 1.0
 */
package com.phillippitts.dialogaugment.exception;
