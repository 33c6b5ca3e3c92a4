/**
 * Validation helpers used by configuration records.
 */
package ca.gc.cra.rpx.validation;
