package ca.gc.cra.hostbridge.application.exec;

import ca.gc.cra.hostbridge.application.port.HostLoop;
import ca.gc.cra.hostbridge.application.port.MetricsPort;
import ca.gc.cra.hostbridge.domain.error.BridgeException;
import ca.gc.cra.hostbridge.domain.error.ErrorKind;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Runs a call on the host loop and returns its result to a session thread.
 * <p><strong>Why:</strong> The scene graph may only be touched from the host thread, while requests arrive on one
 * background thread per connection.</p>
 * <p><strong>How:</strong> The call is wrapped in a {@link PendingInvocation}, posted to the {@link HostLoop}, and
 * awaited on its future for at most the configured bound. On timeout the invocation is abandoned: dropped if
 * still queued, otherwise its token is cancelled and its late result discarded. Calls made from the host thread
 * itself run inline.</p>
 * <p><strong>Errors:</strong> Every outcome is a value or a {@link BridgeException}: {@code TIMEOUT},
 * {@code CANCELLED} (caller interrupted), {@code HOST_UNAVAILABLE} (loop stopped), {@code HOST_EXCEPTION}
 * (handler threw; message forwarded verbatim), or the handler's own {@code BridgeException}.</p>
 * <p><strong>Thread-safety:</strong> Stateless apart from configuration; shared by all sessions.</p>
 * <p><strong>Observability:</strong> {@code bridge.invocation.timeout}, {@code bridge.invocation.waitNanos}.</p>
 *
 * @since 0.1.0
 */
public final class MainThreadExecutor {
  private static final Logger log = LoggerFactory.getLogger(MainThreadExecutor.class);

  private final HostLoop hostLoop;
  private final Duration timeout;
  private final MetricsPort metrics;

  /**
   * Creates an executor.
   *
   * @param hostLoop loop owning the mutation-safe thread
   * @param timeout upper bound on the wait for each invocation; must be positive
   * @param metrics metrics sink
   */
  public MainThreadExecutor(HostLoop hostLoop, Duration timeout, MetricsPort metrics) {
    this.hostLoop = Objects.requireNonNull(hostLoop, "hostLoop");
    this.timeout = Objects.requireNonNull(timeout, "timeout");
    if (timeout.isNegative() || timeout.isZero()) {
      throw new IllegalArgumentException("timeout must be positive");
    }
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
  }

  /**
   * Executes {@code call} on the host thread and waits for its outcome.
   *
   * @param label short description for logs, usually the command name
   * @param call body to run
   * @param <T> result type
   * @return the call's result
   * @throws BridgeException on timeout, interruption, stopped loop or handler failure
   */
  public <T> T execute(String label, HostCall<T> call) {
    Objects.requireNonNull(call, "call");
    if (hostLoop.isHostThread()) {
      return runInline(label, call);
    }
    PendingInvocation<T> invocation = new PendingInvocation<>(label, call, metrics);
    try {
      hostLoop.post(invocation);
    } catch (RejectedExecutionException ex) {
      throw new BridgeException(ErrorKind.HOST_UNAVAILABLE, "Host loop is not running", ex);
    }
    long start = System.nanoTime();
    try {
      return invocation.result().get(timeout.toNanos(), TimeUnit.NANOSECONDS);
    } catch (TimeoutException ex) {
      boolean dropped = invocation.abandon();
      metrics.increment("bridge.invocation.timeout");
      log.warn("Invocation {} timed out after {} ms ({})", label, timeout.toMillis(),
          dropped ? "dropped before running" : "still running; result will be discarded");
      throw new BridgeException(ErrorKind.TIMEOUT,
          "Command execution timeout after " + timeout.toMillis() + " ms");
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      invocation.abandon();
      throw new BridgeException(ErrorKind.CANCELLED, "Interrupted while waiting for the host loop", ex);
    } catch (ExecutionException ex) {
      throw translate(ex.getCause());
    } finally {
      metrics.observe("bridge.invocation.waitNanos", System.nanoTime() - start);
    }
  }

  public Duration timeout() {
    return timeout;
  }

  private static <T> T runInline(String label, HostCall<T> call) {
    log.trace("Running {} inline on the host thread", label);
    try {
      return call.call(new CancellationToken());
    } catch (Exception ex) {
      throw translate(ex);
    }
  }

  /**
   * Maps a handler failure to the exception reported to the client.
   *
   * @param cause failure raised by the host call
   * @return bridge exception preserving the handler's message
   */
  static BridgeException translate(Throwable cause) {
    if (cause instanceof BridgeException bridge) {
      return bridge;
    }
    String message = cause.getMessage();
    if (message == null || message.isBlank()) {
      message = cause.getClass().getSimpleName();
    }
    return new BridgeException(ErrorKind.HOST_EXCEPTION, message, cause);
  }
}
