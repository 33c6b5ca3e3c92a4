package ca.gc.cra.rpx.domain.command;

/**
 * Raised when an inbound client message cannot be parsed into a {@link ClientCommand}.
 * <p>Recoverable and local to one message: callers log it and drop the message.</p>
 *
 * @since 0.1.0
 */
public final class CommandParseException extends Exception {
  private static final long serialVersionUID = 1L;

  private final String rawMessage;

  /**
   * Creates a parse failure.
   *
   * @param rawMessage offending client message
   * @param reason human-readable reason
   * @param cause underlying number format failure
   */
  public CommandParseException(String rawMessage, String reason, Throwable cause) {
    super(reason, cause);
    this.rawMessage = rawMessage;
  }

  /**
   * Returns the client message that failed to parse.
   *
   * @return raw message text
   */
  public String rawMessage() {
    return rawMessage;
  }
}
