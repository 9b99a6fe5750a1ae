/**
 * Deterministic naming of artifacts from payload content and unit position.
 */
package com.phillippitts.dialogaugment.service.identity;
