package ca.gc.cra.fragmenter.infrastructure.exec;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.Test;

class ExecutorFactoriesTest {

  @Test
  void workerThreadsCarryPrefix() throws Exception {
    ExecutorService executor = ExecutorFactories.newWorkerPool(2, "unit-worker", null);
    try {
      String name = executor.submit(() -> Thread.currentThread().getName()).get(5, TimeUnit.SECONDS);
      assertTrue(name.startsWith("unit-worker-"), name);
    } finally {
      executor.shutdownNow();
    }
  }

  @Test
  void blankPrefixFallsBackToDefault() throws Exception {
    ExecutorService executor = ExecutorFactories.newWorkerPool(1, " ", null);
    try {
      String name = executor.submit(() -> Thread.currentThread().getName()).get(5, TimeUnit.SECONDS);
      assertEquals("fragment-worker-0", name);
    } finally {
      executor.shutdownNow();
    }
  }

  @Test
  void nonPositiveSizeIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> ExecutorFactories.newWorkerPool(0, "x", null));
  }

  @Test
  void handlerSeesExecutedFailuresButNotSubmittedOnes() throws Exception {
    CountDownLatch handled = new CountDownLatch(1);
    AtomicReference<Throwable> seen = new AtomicReference<>();
    ExecutorService executor = ExecutorFactories.newWorkerPool(1, "unit-worker", (thread, ex) -> {
      seen.set(ex);
      handled.countDown();
    });
    try {
      Callable<String> failing = () -> {
        throw new IllegalStateException("submitted");
      };
      Future<String> future = executor.submit(failing);
      ExecutionException failure =
          assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));
      assertEquals("submitted", failure.getCause().getMessage());
      assertFalse(handled.await(200, TimeUnit.MILLISECONDS));

      executor.execute(() -> {
        throw new IllegalStateException("executed");
      });
      assertTrue(handled.await(5, TimeUnit.SECONDS));
      assertEquals("executed", seen.get().getMessage());
    } finally {
      executor.shutdownNow();
    }
  }
}
