package ca.gc.cra.rpx.testing;

import ca.gc.cra.rpx.application.port.TransportInitException;
import ca.gc.cra.rpx.application.port.TransportListener;
import ca.gc.cra.rpx.application.port.TransportPort;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory transport that records writes and writable requests.
 * <p>Writes are accepted in full unless a per-client byte limit was set with {@link #limitWrites(int, int)}.</p>
 */
public final class FakeTransport implements TransportPort {
  private final Map<Integer, List<String>> written = new ConcurrentHashMap<>();
  private final Map<Integer, Integer> writeLimits = new ConcurrentHashMap<>();
  private final List<Integer> writableRequests = new CopyOnWriteArrayList<>();
  private final AtomicInteger awaitCalls = new AtomicInteger();
  private volatile TransportListener listener;
  private volatile boolean closed;
  private volatile TransportInitException startFailure;

  @Override
  public void start(TransportListener listener) throws TransportInitException {
    if (startFailure != null) {
      throw startFailure;
    }
    this.listener = listener;
  }

  @Override
  public int write(int clientId, byte[] payload) {
    Integer limit = writeLimits.get(clientId);
    if (limit != null && payload.length > limit) {
      return limit;
    }
    written.computeIfAbsent(clientId, id -> new CopyOnWriteArrayList<>())
        .add(new String(payload, StandardCharsets.UTF_8));
    return payload.length;
  }

  @Override
  public void requestWritable(int clientId) {
    writableRequests.add(clientId);
  }

  @Override
  public boolean awaitActivity(Duration timeout) throws InterruptedException {
    awaitCalls.incrementAndGet();
    Thread.sleep(Math.min(5L, timeout.toMillis()));
    return false;
  }

  @Override
  public void close() {
    closed = true;
  }

  public void limitWrites(int clientId, int maxBytes) {
    writeLimits.put(clientId, maxBytes);
  }

  public void failStartWith(TransportInitException failure) {
    this.startFailure = failure;
  }

  public List<String> writtenTo(int clientId) {
    return new ArrayList<>(written.getOrDefault(clientId, List.of()));
  }

  public List<Integer> writableRequests() {
    return new ArrayList<>(writableRequests);
  }

  public int awaitCalls() {
    return awaitCalls.get();
  }

  public TransportListener listener() {
    return listener;
  }

  public boolean isClosed() {
    return closed;
  }
}
