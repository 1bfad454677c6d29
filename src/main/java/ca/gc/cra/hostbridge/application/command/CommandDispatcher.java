package ca.gc.cra.hostbridge.application.command;

import ca.gc.cra.hostbridge.application.exec.MainThreadExecutor;
import ca.gc.cra.hostbridge.application.port.MetricsPort;
import ca.gc.cra.hostbridge.domain.error.BridgeException;
import ca.gc.cra.hostbridge.domain.error.ErrorKind;
import ca.gc.cra.hostbridge.domain.protocol.CommandEnvelope;
import ca.gc.cra.hostbridge.domain.protocol.CommandResponse;
import ca.gc.cra.hostbridge.logging.Logs;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Use case turning one decoded envelope into exactly one response.
 * <p><strong>How:</strong> The registry lookup happens on the calling session thread, so unknown commands never
 * touch the host loop. The handler and the flattening of its result then run through the
 * {@link MainThreadExecutor}.</p>
 * <p><strong>Errors:</strong> Never throws. {@link BridgeException}s become failures of their own kind; anything
 * else becomes {@link ErrorKind#INTERNAL}.</p>
 * <p><strong>Thread-safety:</strong> Stateless; shared by all sessions.</p>
 * <p><strong>Observability:</strong> {@code bridge.command.dispatched}, {@code bridge.command.succeeded},
 * {@code bridge.command.failed}, {@code bridge.command.failed.<kind>}, {@code bridge.command.latencyNanos}.</p>
 *
 * @since 0.1.0
 */
public final class CommandDispatcher {
  private static final Logger log = LoggerFactory.getLogger(CommandDispatcher.class);

  private final CommandRegistry registry;
  private final MainThreadExecutor executor;
  private final ResultFlattener flattener;
  private final MetricsPort metrics;

  public CommandDispatcher(CommandRegistry registry, MainThreadExecutor executor, MetricsPort metrics) {
    this.registry = Objects.requireNonNull(registry, "registry");
    this.executor = Objects.requireNonNull(executor, "executor");
    this.flattener = new ResultFlattener();
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
  }

  /**
   * Dispatches a request.
   *
   * @param envelope decoded request
   * @return success or failure response carrying the request id
   */
  public CommandResponse dispatch(CommandEnvelope envelope) {
    Objects.requireNonNull(envelope, "envelope");
    String command = envelope.command();
    metrics.increment("bridge.command.dispatched");
    long start = System.nanoTime();
    try {
      CommandHandler handler = registry.require(command);
      CommandParams params = new CommandParams(envelope.params());
      if (log.isDebugEnabled()) {
        log.debug("Dispatching {} params={}", command, Logs.summarize(envelope.params()));
      }
      Object result = executor.execute(command,
          token -> flattener.flatten(handler.handle(new CommandContext(command, params, token))));
      metrics.increment("bridge.command.succeeded");
      return CommandResponse.success(envelope.id(), result);
    } catch (BridgeException ex) {
      log.debug("Command {} failed: {} {}", command, ex.kind(), ex.getMessage());
      return failure(envelope.id(), ex.kind(), ex.getMessage());
    } catch (RuntimeException ex) {
      log.error("Unexpected failure dispatching {}", command, ex);
      return failure(envelope.id(), ErrorKind.INTERNAL, "Internal error: " + ex.getMessage());
    } finally {
      metrics.observe("bridge.command.latencyNanos", System.nanoTime() - start);
    }
  }

  /**
   * Builds a failure response and records it.
   *
   * @param id request id, if known
   * @param kind failure kind
   * @param message client-facing message
   * @return failure response
   */
  public CommandResponse failure(Object id, ErrorKind kind, String message) {
    metrics.increment("bridge.command.failed");
    metrics.increment("bridge.command.failed." + kind.metricSuffix());
    return CommandResponse.failure(id, kind, message);
  }

  public CommandRegistry registry() {
    return registry;
  }
}
