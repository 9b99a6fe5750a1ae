/**
 * Work unit enumeration: shard discovery, document parsing, payload validation and the
 * group budget.
 */
package com.phillippitts.dialogaugment.service.enumerate;
