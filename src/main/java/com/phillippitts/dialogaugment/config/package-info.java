/**
 * Spring configuration: worker pool, exit code mapping and bound properties.
 */
package com.phillippitts.dialogaugment.config;
