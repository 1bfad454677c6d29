package ca.gc.cra.hostbridge.application.port;

import java.util.concurrent.RejectedExecutionException;

/**
 * <strong>What:</strong> The host's single mutation-safe execution context.
 * <p><strong>Role:</strong> Port through which every scene-graph mutation is funneled. The bridge never runs
 * graph code on a session thread; it posts work here and waits through the main-thread executor.</p>
 * <p><strong>Ordering:</strong> Tasks posted from one thread run in posting order. Tasks posted from different
 * threads interleave in the order the loop received them.</p>
 *
 * @since 0.1.0
 */
public interface HostLoop {

  /**
   * Enqueues a task for the next loop cycle.
   *
   * @param task work to run on the host thread
   * @throws RejectedExecutionException when the loop has stopped
   */
  void post(Runnable task);

  /**
   * Returns whether the calling thread is the loop's own thread.
   *
   * @return {@code true} on the host thread
   */
  boolean isHostThread();
}
