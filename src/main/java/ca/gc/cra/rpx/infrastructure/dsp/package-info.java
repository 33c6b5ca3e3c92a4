/**
 * Pure-Java spectral estimation backing {@link ca.gc.cra.rpx.application.port.SpectrumEstimator}.
 */
package ca.gc.cra.rpx.infrastructure.dsp;
