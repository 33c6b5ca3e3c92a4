package ca.gc.cra.rpx.application.session;

import ca.gc.cra.rpx.application.port.CommandHandler;
import ca.gc.cra.rpx.domain.command.ClientCommand;
import ca.gc.cra.rpx.logging.Logs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default {@link CommandHandler} that records each command at INFO and takes no other action.
 *
 * @since 0.1.0
 */
public final class LoggingCommandHandler implements CommandHandler {
  private static final Logger log = LoggerFactory.getLogger(LoggingCommandHandler.class);

  @Override
  public void handle(int clientId, ClientCommand command) {
    log.info("cmd: {} par: {}", Logs.truncate(command.command(), 128), command.parameter());
  }
}
