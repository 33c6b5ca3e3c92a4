package ca.gc.cra.rpx.domain.command;

import java.util.Objects;

/**
 * <strong>What:</strong> Parsed inbound client instruction of the form {@code <command>:<integerParameter>}.
 * <p><strong>Why:</strong> Gives command handlers a typed view of the browser's text messages.</p>
 * <p><strong>Role:</strong> Domain value object produced by the session handler and consumed by
 * {@code CommandHandler} implementations.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param command command name; everything before the first colon (may be empty)
 * @param parameter integer argument; {@code 0} when the message carries no colon
 * @since 0.1.0
 */
public record ClientCommand(String command, int parameter) {

  private static final char SEPARATOR = ':';

  public ClientCommand {
    command = Objects.requireNonNull(command, "command");
  }

  /**
   * Parses a raw client message.
   *
   * <p>The message is split at the first colon. Without a colon the whole message is the command and the
   * parameter defaults to zero. Surrounding whitespace around the parameter is ignored; anything else that is
   * not a base-10 {@code int} is rejected.</p>
   *
   * @param raw message text; must not be {@code null}
   * @return parsed command
   * @throws CommandParseException when the parameter is present but not an integer
   */
  public static ClientCommand parse(String raw) throws CommandParseException {
    Objects.requireNonNull(raw, "raw");
    int idx = raw.indexOf(SEPARATOR);
    if (idx < 0) {
      return new ClientCommand(raw, 0);
    }
    String command = raw.substring(0, idx);
    String parameter = raw.substring(idx + 1).trim();
    try {
      return new ClientCommand(command, Integer.parseInt(parameter));
    } catch (NumberFormatException ex) {
      throw new CommandParseException(raw, "parameter is not an integer: '" + parameter + "'", ex);
    }
  }
}
