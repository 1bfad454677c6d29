package ca.gc.cra.hostbridge.application.exec;

/**
 * Body of a marshaled invocation, run on the host thread.
 *
 * @param <T> result type
 */
@FunctionalInterface
public interface HostCall<T> {

  /**
   * Runs the call.
   *
   * @param token cancellation signal for the invocation
   * @return result value, possibly {@code null}
   * @throws Exception any failure; reported to the caller as a host exception
   */
  T call(CancellationToken token) throws Exception;
}
