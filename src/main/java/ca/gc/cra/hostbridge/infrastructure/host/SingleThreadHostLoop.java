package ca.gc.cra.hostbridge.infrastructure.host;

import ca.gc.cra.hostbridge.application.port.HostLoop;
import ca.gc.cra.hostbridge.infrastructure.exec.ExecutorFactories;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> The shipped host: one dedicated thread draining a FIFO task queue in cycles.
 * <p><strong>Role:</strong> Single writer for the scene graph. Each cycle takes every task queued so far and runs
 * them in order, like a frame update draining a work list.</p>
 * <p><strong>Lifecycle:</strong> {@link #start()} launches the thread; {@link #close()} rejects new posts, lets
 * the thread run whatever was already queued, and joins it.</p>
 * <p><strong>Thread-safety:</strong> {@link #post(Runnable)} may be called from any thread.</p>
 *
 * @since 0.1.0
 */
public final class SingleThreadHostLoop implements HostLoop, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(SingleThreadHostLoop.class);
  private static final long IDLE_POLL_MILLIS = 50L;

  private final BlockingQueue<Runnable> queue = new LinkedBlockingQueue<>();
  private final AtomicLong cycles = new AtomicLong();
  private final Thread thread;
  private volatile boolean running;

  public SingleThreadHostLoop() {
    this("hostbridge-main");
  }

  public SingleThreadHostLoop(String threadName) {
    this.thread = ExecutorFactories.newNamedThread(Objects.requireNonNull(threadName, "threadName"), this::runLoop);
  }

  /**
   * Starts the loop thread.
   *
   * @return this loop
   * @throws IllegalStateException when already started
   */
  public synchronized SingleThreadHostLoop start() {
    if (thread.isAlive() || running) {
      throw new IllegalStateException("host loop already started");
    }
    running = true;
    thread.start();
    log.info("Host loop started on thread {}", thread.getName());
    return this;
  }

  /**
   * Queues a task. The running check and the enqueue share the monitor {@link #close()} takes, so an accepted
   * task is always drained.
   *
   * @param task task to run on the loop thread
   * @throws RejectedExecutionException when the loop is stopped or stopping
   */
  @Override
  public synchronized void post(Runnable task) {
    Objects.requireNonNull(task, "task");
    if (!running) {
      throw new RejectedExecutionException("host loop is not running");
    }
    queue.add(task);
  }

  @Override
  public boolean isHostThread() {
    return Thread.currentThread() == thread;
  }

  public boolean isRunning() {
    return running;
  }

  /** Number of completed drain cycles, for diagnostics. */
  public long cycles() {
    return cycles.get();
  }

  @Override
  public void close() {
    synchronized (this) {
      if (!running) {
        return;
      }
      running = false;
    }
    if (isHostThread()) {
      return;
    }
    try {
      thread.join(TimeUnit.SECONDS.toMillis(5));
      if (thread.isAlive()) {
        log.warn("Host loop thread did not stop within 5 seconds");
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.warn("Interrupted while stopping the host loop");
    }
    log.info("Host loop stopped after {} cycles", cycles.get());
  }

  private void runLoop() {
    List<Runnable> batch = new ArrayList<>();
    try {
      while (running || !queue.isEmpty()) {
        Runnable first = queue.poll(IDLE_POLL_MILLIS, TimeUnit.MILLISECONDS);
        if (first != null) {
          runBatch(first, batch);
        }
      }
    } catch (InterruptedException ex) {
      log.debug("Host loop interrupted; draining queued tasks");
      synchronized (this) {
        running = false;
      }
      Runnable next;
      while ((next = queue.poll()) != null) {
        runBatch(next, batch);
      }
      Thread.currentThread().interrupt();
    }
  }

  private void runBatch(Runnable first, List<Runnable> batch) {
    try {
      batch.add(first);
      queue.drainTo(batch);
      for (Runnable task : batch) {
        runSafely(task);
      }
      cycles.incrementAndGet();
    } finally {
      batch.clear();
    }
  }

  private static void runSafely(Runnable task) {
    try {
      task.run();
    } catch (RuntimeException ex) {
      log.error("Host task failed", ex);
    }
  }
}
