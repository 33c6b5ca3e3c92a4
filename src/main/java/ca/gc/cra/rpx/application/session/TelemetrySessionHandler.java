package ca.gc.cra.rpx.application.session;

import ca.gc.cra.rpx.application.port.CommandHandler;
import ca.gc.cra.rpx.application.port.MetricsPort;
import ca.gc.cra.rpx.application.port.TransportListener;
import ca.gc.cra.rpx.domain.command.ClientCommand;
import ca.gc.cra.rpx.domain.command.CommandParseException;
import ca.gc.cra.rpx.domain.session.Connection;
import ca.gc.cra.rpx.logging.Logs;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Reactor-side callback context that turns transport events into registry and router calls.
 * <p><strong>Why:</strong> Passed to the transport at start so each server instance owns its own callbacks and
 * registry; multiple instances in one JVM never share state.</p>
 * <p><strong>Role:</strong> Application adapter implementing {@link TransportListener}.</p>
 * <p><strong>Error containment:</strong> Connection-scoped failures (duplicate connects, bad commands, handler
 * exceptions) are logged and counted; none of them propagate into the reactor loop.</p>
 * <p><strong>Thread-safety:</strong> Invoked on the transport's reactor thread, one event at a time.</p>
 *
 * @since 0.1.0
 */
public final class TelemetrySessionHandler implements TransportListener {
  private static final Logger log = LoggerFactory.getLogger(TelemetrySessionHandler.class);
  private static final int MAX_LOGGED_MESSAGE_BYTES = 256;

  private final ConnectionRegistry registry;
  private final BroadcastRouter router;
  private final CommandHandler commandHandler;
  private final Set<String> defaultPermissions;
  private final MetricsPort metrics;

  /**
   * Creates the handler.
   *
   * @param registry registry owning connection state
   * @param router router used to flush buffers on writable events
   * @param commandHandler receiver for parsed client commands
   * @param defaultPermissions capabilities granted to every new connection
   * @param metrics metrics sink; {@code null} falls back to {@link MetricsPort#NO_OP}
   */
  public TelemetrySessionHandler(
      ConnectionRegistry registry,
      BroadcastRouter router,
      CommandHandler commandHandler,
      Set<String> defaultPermissions,
      MetricsPort metrics) {
    this.registry = Objects.requireNonNull(registry, "registry");
    this.router = Objects.requireNonNull(router, "router");
    this.commandHandler = Objects.requireNonNull(commandHandler, "commandHandler");
    this.defaultPermissions = Set.copyOf(Objects.requireNonNull(defaultPermissions, "defaultPermissions"));
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
  }

  @Override
  public void onConnect(int clientId) {
    Connection connection;
    try {
      connection = registry.onConnect(clientId);
    } catch (DuplicateConnectionException ex) {
      metrics.increment("session.connect.duplicate");
      log.error("Rejected duplicate connect for client {}; keeping existing connection", clientId);
      return;
    }
    defaultPermissions.forEach(connection::grant);
    log.info("Client {} connected ({} active)", clientId, registry.size());
  }

  @Override
  public void onMessage(int clientId, String message) {
    ClientCommand command;
    try {
      command = ClientCommand.parse(message);
    } catch (CommandParseException ex) {
      metrics.increment("session.command.invalid");
      log.warn("Ignoring message from client {}: {} ({})",
          clientId, Logs.truncate(ex.rawMessage(), MAX_LOGGED_MESSAGE_BYTES), ex.getMessage());
      return;
    }
    metrics.increment("session.command.received");
    try {
      commandHandler.handle(clientId, command);
    } catch (RuntimeException ex) {
      log.error("Command handler failed for client {} command {}", clientId, command.command(), ex);
    }
  }

  @Override
  public void onWritable(int clientId) {
    FlushResult result = router.flush(clientId);
    if (result.failed()) {
      log.warn("Client {} removed after failed write; {} payload(s) delivered this pass",
          clientId, result.written());
    }
  }

  @Override
  public void onDisconnect(int clientId) {
    if (registry.onDisconnect(clientId)) {
      log.info("Client {} disconnected ({} active)", clientId, registry.size());
    }
  }

  @Override
  public void onError(int clientId, String message) {
    registry.onError(clientId, message);
  }
}
