/**
 * Homophone substitution noise.
 */
package com.phillippitts.dialogaugment.service.transform.noise;
