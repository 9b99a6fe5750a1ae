/**
 * Pipeline services. Data flows from {@code enumerate} through {@code scheduling} and
 * {@code execution} to artifacts and the {@code checkpoint}; {@code pipeline} owns the run.
 */
package com.phillippitts.dialogaugment.service;
