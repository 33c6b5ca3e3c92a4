/**
 * Sample source adapters feeding the spectrum pipeline.
 */
package ca.gc.cra.rpx.infrastructure.source;
