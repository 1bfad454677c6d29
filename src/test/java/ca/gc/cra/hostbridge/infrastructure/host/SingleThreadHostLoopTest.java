package ca.gc.cra.hostbridge.infrastructure.host;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class SingleThreadHostLoopTest {

  @Test
  void tasksRunInPostingOrderOnLoopThread() throws Exception {
    try (SingleThreadHostLoop loop = new SingleThreadHostLoop("order-test").start()) {
      List<Integer> seen = new CopyOnWriteArrayList<>();
      CountDownLatch done = new CountDownLatch(1);
      for (int i = 0; i < 20; i++) {
        int value = i;
        loop.post(() -> seen.add(value));
      }
      loop.post(() -> {
        seen.add(loop.isHostThread() ? -1 : -2);
        done.countDown();
      });

      assertTrue(done.await(2, TimeUnit.SECONDS));
      assertEquals(21, seen.size());
      assertEquals(19, seen.get(19));
      assertEquals(-1, seen.get(20));
      assertFalse(loop.isHostThread());
    }
  }

  @Test
  void failingTaskDoesNotStopLoop() throws Exception {
    try (SingleThreadHostLoop loop = new SingleThreadHostLoop("failure-test").start()) {
      CountDownLatch after = new CountDownLatch(1);
      loop.post(() -> {
        throw new IllegalStateException("boom");
      });
      loop.post(after::countDown);

      assertTrue(after.await(2, TimeUnit.SECONDS));
      assertTrue(loop.isRunning());
    }
  }

  @Test
  void closeDrainsQueueAndRejectsNewPosts() throws Exception {
    SingleThreadHostLoop loop = new SingleThreadHostLoop("close-test").start();
    CountDownLatch release = new CountDownLatch(1);
    CountDownLatch drained = new CountDownLatch(1);
    loop.post(() -> {
      try {
        release.await(2, TimeUnit.SECONDS);
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
      }
    });
    loop.post(drained::countDown);

    release.countDown();
    loop.close();

    assertTrue(drained.await(0, TimeUnit.SECONDS));
    assertThrows(RejectedExecutionException.class, () -> loop.post(() -> { }));
    assertFalse(loop.isRunning());
  }

  @Test
  void postsRacingCloseAreEitherRejectedOrRun() throws Exception {
    SingleThreadHostLoop loop = new SingleThreadHostLoop("race-test").start();
    AtomicInteger accepted = new AtomicInteger();
    AtomicInteger ran = new AtomicInteger();
    CountDownLatch posting = new CountDownLatch(4);
    ExecutorService posters = Executors.newFixedThreadPool(4);
    try {
      for (int i = 0; i < 4; i++) {
        posters.execute(() -> {
          posting.countDown();
          while (true) {
            try {
              loop.post(ran::incrementAndGet);
              accepted.incrementAndGet();
            } catch (RejectedExecutionException ex) {
              return;
            }
          }
        });
      }
      assertTrue(posting.await(2, TimeUnit.SECONDS));
      Thread.sleep(20);
      loop.close();
      posters.shutdown();
      assertTrue(posters.awaitTermination(5, TimeUnit.SECONDS));
    } finally {
      posters.shutdownNow();
    }

    assertTrue(accepted.get() > 0);
    assertEquals(accepted.get(), ran.get());
  }

  @Test
  void startTwiceFails() {
    try (SingleThreadHostLoop loop = new SingleThreadHostLoop("twice-test").start()) {
      assertThrows(IllegalStateException.class, loop::start);
    }
  }
}
