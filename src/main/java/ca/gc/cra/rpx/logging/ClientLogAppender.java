package ca.gc.cra.rpx.logging;

import ch.qos.logback.classic.PatternLayout;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.AppenderBase;
import java.util.Objects;

/**
 * Logback appender relaying formatted events to browser clients through a {@link LogBridge}.
 *
 * <p>Events logged while a relay is already in progress on the same thread are skipped, so logging performed by
 * the router or transport cannot recurse back into this appender.</p>
 *
 * @since 0.1.0
 */
public final class ClientLogAppender extends AppenderBase<ILoggingEvent> {
  /** Appender name used when attaching to the root logger. */
  public static final String NAME = "CLIENTS";
  static final String DEFAULT_PATTERN = "[%d{HH:mm:ss}] %logger{0}: %msg";

  private static final ThreadLocal<Boolean> RELAYING = ThreadLocal.withInitial(() -> Boolean.FALSE);

  private final LogBridge bridge;
  private String pattern = DEFAULT_PATTERN;
  private PatternLayout layout;

  public ClientLogAppender(LogBridge bridge) {
    this.bridge = Objects.requireNonNull(bridge, "bridge");
    setName(NAME);
  }

  public void setPattern(String pattern) {
    this.pattern = Objects.requireNonNull(pattern, "pattern");
  }

  public LogBridge bridge() {
    return bridge;
  }

  @Override
  public void start() {
    PatternLayout patternLayout = new PatternLayout();
    patternLayout.setContext(getContext());
    patternLayout.setPattern(pattern);
    patternLayout.start();
    this.layout = patternLayout;
    super.start();
  }

  @Override
  public void stop() {
    super.stop();
    if (layout != null) {
      layout.stop();
    }
  }

  @Override
  protected void append(ILoggingEvent event) {
    if (!bridge.isAttached() || RELAYING.get()) {
      return;
    }
    RELAYING.set(Boolean.TRUE);
    try {
      bridge.forward(layout.doLayout(event));
    } catch (RuntimeException ex) {
      addError("Failed to relay log event to clients", ex);
    } finally {
      RELAYING.set(Boolean.FALSE);
    }
  }
}
