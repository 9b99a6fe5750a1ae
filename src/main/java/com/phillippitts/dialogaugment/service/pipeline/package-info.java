/**
 * Run lifecycle: the driver and the application runner that invokes it.
 */
package com.phillippitts.dialogaugment.service.pipeline;
