package ca.gc.cra.rpx.application.session;

/**
 * Outcome of one {@link BroadcastRouter#flush(int)} pass.
 *
 * @param written payloads fully transmitted and removed from the buffer
 * @param failed {@code true} when a partial write removed the connection
 * @since 0.1.0
 */
public record FlushResult(int written, boolean failed) {
  /** Result for a client that is no longer registered. */
  public static final FlushResult NOT_CONNECTED = new FlushResult(0, false);
}
