package ca.gc.cra.hostbridge.application.exec;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.hostbridge.application.port.HostLoop;
import ca.gc.cra.hostbridge.domain.error.BridgeException;
import ca.gc.cra.hostbridge.domain.error.ErrorKind;
import ca.gc.cra.hostbridge.infrastructure.host.SingleThreadHostLoop;
import ca.gc.cra.hostbridge.support.RecordingMetrics;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MainThreadExecutorTest {
  private SingleThreadHostLoop loop;
  private RecordingMetrics metrics;

  @BeforeEach
  void setUp() {
    loop = new SingleThreadHostLoop("executor-test").start();
    metrics = new RecordingMetrics();
  }

  @AfterEach
  void tearDown() {
    loop.close();
  }

  @Test
  void returnsValueComputedOnHostThread() {
    MainThreadExecutor executor = new MainThreadExecutor(loop, Duration.ofSeconds(2), metrics);

    Boolean onHost = executor.execute("probe", token -> loop.isHostThread());

    assertTrue(onHost);
    assertEquals(1, metrics.observed("bridge.invocation.waitNanos").size());
  }

  @Test
  void timesOutWithinBound() {
    long boundMillis = 200;
    MainThreadExecutor executor = new MainThreadExecutor(loop, Duration.ofMillis(boundMillis), metrics);
    CountDownLatch release = new CountDownLatch(1);

    long start = System.nanoTime();
    BridgeException ex = assertThrows(BridgeException.class,
        () -> executor.execute("slow", token -> release.await(5, TimeUnit.SECONDS)));
    long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
    release.countDown();

    assertEquals(ErrorKind.TIMEOUT, ex.kind());
    assertEquals("Command execution timeout after 200 ms", ex.getMessage());
    assertTrue(elapsedMillis <= boundMillis + 50, "waited " + elapsedMillis + " ms");
    assertEquals(1, metrics.count("bridge.invocation.timeout"));
  }

  @Test
  void queuedInvocationIsDroppedAfterTimeout() throws Exception {
    MainThreadExecutor executor = new MainThreadExecutor(loop, Duration.ofMillis(100), metrics);
    CountDownLatch blockerRunning = new CountDownLatch(1);
    CountDownLatch releaseBlocker = new CountDownLatch(1);
    loop.post(() -> {
      blockerRunning.countDown();
      try {
        releaseBlocker.await(5, TimeUnit.SECONDS);
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
      }
    });
    assertTrue(blockerRunning.await(2, TimeUnit.SECONDS));

    AtomicBoolean ran = new AtomicBoolean();
    BridgeException ex = assertThrows(BridgeException.class,
        () -> executor.execute("queued", token -> {
          ran.set(true);
          return null;
        }));
    releaseBlocker.countDown();
    drain(executor);

    assertEquals(ErrorKind.TIMEOUT, ex.kind());
    assertFalse(ran.get());
    assertEquals(1, metrics.count("bridge.invocation.dropped"));
  }

  @Test
  void lateResultIsDiscardedAndTokenCancelled() throws Exception {
    MainThreadExecutor executor = new MainThreadExecutor(loop, Duration.ofMillis(100), metrics);
    CountDownLatch started = new CountDownLatch(1);
    CountDownLatch release = new CountDownLatch(1);
    AtomicBoolean cancelledSeen = new AtomicBoolean();

    assertThrows(BridgeException.class, () -> executor.execute("late", token -> {
      started.countDown();
      release.await(5, TimeUnit.SECONDS);
      cancelledSeen.set(token.isCancelled());
      return "too late";
    }));
    assertTrue(started.await(1, TimeUnit.SECONDS));
    release.countDown();
    drain(executor);

    assertTrue(cancelledSeen.get());
    assertEquals(1, metrics.count("bridge.invocation.late"));
  }

  @Test
  void handlerExceptionMessageIsForwarded() {
    MainThreadExecutor executor = new MainThreadExecutor(loop, Duration.ofSeconds(2), metrics);

    BridgeException ex = assertThrows(BridgeException.class, () -> executor.execute("boom", token -> {
      throw new IllegalStateException("Missing reference on PlayerController");
    }));

    assertEquals(ErrorKind.HOST_EXCEPTION, ex.kind());
    assertEquals("Missing reference on PlayerController", ex.getMessage());
  }

  @Test
  void bridgeExceptionsPassThroughUnchanged() {
    MainThreadExecutor executor = new MainThreadExecutor(loop, Duration.ofSeconds(2), metrics);

    BridgeException ex = assertThrows(BridgeException.class, () -> executor.execute("missing", token -> {
      throw new BridgeException(ErrorKind.ENTITY_NOT_FOUND, "Entity not found: Ghost");
    }));

    assertEquals(ErrorKind.ENTITY_NOT_FOUND, ex.kind());
  }

  @Test
  void nestedCallOnHostThreadRunsInline() {
    MainThreadExecutor executor = new MainThreadExecutor(loop, Duration.ofSeconds(2), metrics);

    Integer result = executor.execute("outer", token -> executor.execute("inner", inner -> 41) + 1);

    assertEquals(42, result);
  }

  @Test
  void stoppedLoopReportsHostUnavailable() {
    HostLoop stopped = new HostLoop() {
      @Override
      public void post(Runnable task) {
        throw new RejectedExecutionException("stopped");
      }

      @Override
      public boolean isHostThread() {
        return false;
      }
    };
    MainThreadExecutor executor = new MainThreadExecutor(stopped, Duration.ofSeconds(1), metrics);

    BridgeException ex = assertThrows(BridgeException.class, () -> executor.execute("ping", token -> "pong"));

    assertEquals(ErrorKind.HOST_UNAVAILABLE, ex.kind());
  }

  @Test
  void rejectsNonPositiveTimeout() {
    assertThrows(IllegalArgumentException.class, () -> new MainThreadExecutor(loop, Duration.ZERO, metrics));
  }

  @Test
  void tokenThrowsOnceCancelled() {
    CancellationToken token = new CancellationToken();
    token.throwIfCancelled();
    token.cancel();

    BridgeException ex = assertThrows(BridgeException.class, token::throwIfCancelled);
    assertEquals(ErrorKind.CANCELLED, ex.kind());
  }

  private static void drain(MainThreadExecutor executor) {
    executor.execute("drain", token -> null);
  }
}
