package ca.gc.cra.hostbridge.application.exec;

import ca.gc.cra.hostbridge.application.port.MetricsPort;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-flight marshaled call: the closure, its result slot and its lifecycle state.
 *
 * <p>State moves {@code PENDING -> RUNNING -> DONE}, or {@code PENDING -> CANCELLED} when the waiter abandons
 * the call before the loop reaches it. A cancelled invocation never runs. The result slot is a
 * {@link CompletableFuture}; it is written at most once, either by the host thread or by {@link #abandon()}, and a
 * late result arriving after abandonment is discarded and counted.</p>
 *
 * @param <T> result type
 */
final class PendingInvocation<T> implements Runnable {
  private static final Logger log = LoggerFactory.getLogger(PendingInvocation.class);

  enum State { PENDING, RUNNING, DONE, CANCELLED }

  private final String label;
  private final HostCall<T> call;
  private final MetricsPort metrics;
  private final CancellationToken token = new CancellationToken();
  private final CompletableFuture<T> result = new CompletableFuture<>();
  private final AtomicReference<State> state = new AtomicReference<>(State.PENDING);

  PendingInvocation(String label, HostCall<T> call, MetricsPort metrics) {
    this.label = Objects.requireNonNull(label, "label");
    this.call = Objects.requireNonNull(call, "call");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  @Override
  public void run() {
    if (!state.compareAndSet(State.PENDING, State.RUNNING)) {
      metrics.increment("bridge.invocation.dropped");
      log.debug("Dropping abandoned invocation {} before it ran", label);
      return;
    }
    try {
      T value = call.call(token);
      if (!result.complete(value)) {
        discardLate();
      }
    } catch (Exception ex) {
      if (!result.completeExceptionally(ex)) {
        discardLate();
      }
    } catch (Error err) {
      result.completeExceptionally(err);
      throw err;
    } finally {
      state.set(State.DONE);
    }
  }

  /**
   * Gives up on the invocation. Cancels it if it has not started; otherwise signals its token so that the
   * running handler can stop, and closes the result slot so its eventual result is discarded.
   *
   * @return {@code true} when the invocation was dropped before running
   */
  boolean abandon() {
    token.cancel();
    boolean dropped = state.compareAndSet(State.PENDING, State.CANCELLED);
    result.cancel(false);
    return dropped;
  }

  CompletableFuture<T> result() {
    return result;
  }

  State state() {
    return state.get();
  }

  String label() {
    return label;
  }

  private void discardLate() {
    metrics.increment("bridge.invocation.late");
    log.warn("Discarding late result of invocation {}; the caller already timed out", label);
  }
}
