package ca.gc.cra.hostbridge.application.exec;

import ca.gc.cra.hostbridge.domain.error.BridgeException;
import ca.gc.cra.hostbridge.domain.error.ErrorKind;

/**
 * Cooperative cancellation signal handed to every host call.
 *
 * <p>The executor cancels the token when the caller stops waiting. Long-running handlers, such as batch
 * commands, poll it between steps and stop early; short handlers may ignore it since their late result is
 * discarded anyway.</p>
 */
public final class CancellationToken {
  private volatile boolean cancelled;

  public boolean isCancelled() {
    return cancelled;
  }

  /**
   * Throws when the token has been cancelled.
   *
   * @throws BridgeException of kind {@link ErrorKind#CANCELLED}
   */
  public void throwIfCancelled() {
    if (cancelled) {
      throw new BridgeException(ErrorKind.CANCELLED, "Command cancelled after the caller stopped waiting");
    }
  }

  void cancel() {
    cancelled = true;
  }
}
