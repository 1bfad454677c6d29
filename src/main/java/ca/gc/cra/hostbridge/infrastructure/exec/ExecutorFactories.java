package ca.gc.cra.hostbridge.infrastructure.exec;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Factory helpers for the bridge's threads: one pool for client sessions and named single threads for the
 * acceptor and the host loop.
 */
public final class ExecutorFactories {
  private static final Logger log = LoggerFactory.getLogger(ExecutorFactories.class);

  private ExecutorFactories() {}

  /**
   * Builds an unbounded pool of daemon session threads. Idle threads are reclaimed after 60 seconds.
   *
   * @param prefix thread-name prefix
   * @param handler uncaught exception handler installed on each thread; {@code null} logs the failure
   * @return configured executor service
   */
  public static ExecutorService newSessionPool(String prefix, UncaughtExceptionHandler handler) {
    ThreadFactory factory = threadFactory(prefix == null || prefix.isBlank() ? "hostbridge-session" : prefix,
        handler);
    return new ThreadPoolExecutor(
        0,
        Integer.MAX_VALUE,
        60L,
        TimeUnit.SECONDS,
        new SynchronousQueue<>(),
        factory,
        new ThreadPoolExecutor.AbortPolicy());
  }

  /**
   * Creates a thread factory producing daemon threads named {@code prefix-N}.
   *
   * @param prefix thread-name prefix
   * @param handler uncaught exception handler; {@code null} logs the failure
   * @return thread factory
   */
  public static ThreadFactory threadFactory(String prefix, UncaughtExceptionHandler handler) {
    Objects.requireNonNull(prefix, "prefix");
    UncaughtExceptionHandler effectiveHandler = Objects.requireNonNullElse(handler,
        (t, ex) -> log.error("Uncaught exception on {}", t.getName(), ex));
    AtomicInteger index = new AtomicInteger();
    return runnable -> {
      Thread thread = new Thread(runnable);
      thread.setName(prefix + "-" + index.getAndIncrement());
      thread.setDaemon(true);
      thread.setUncaughtExceptionHandler(effectiveHandler);
      return thread;
    };
  }

  /**
   * Creates one named daemon thread.
   *
   * @param name thread name
   * @param body thread body
   * @return unstarted thread
   */
  public static Thread newNamedThread(String name, Runnable body) {
    Thread thread = new Thread(Objects.requireNonNull(body, "body"), Objects.requireNonNull(name, "name"));
    thread.setDaemon(true);
    thread.setUncaughtExceptionHandler((t, ex) -> log.error("Uncaught exception on {}", t.getName(), ex));
    return thread;
  }
}
