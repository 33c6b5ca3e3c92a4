package ca.gc.cra.rpx.application.port;

import ca.gc.cra.rpx.domain.command.ClientCommand;

/**
 * Extension point receiving parsed client commands.
 * <p>Invoked on the reactor thread; implementations must not block.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface CommandHandler {
  /**
   * Handles one parsed client command.
   *
   * @param clientId sender of the command
   * @param command parsed command
   */
  void handle(int clientId, ClientCommand command);
}
