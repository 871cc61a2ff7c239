package com.onthegomap.tilemosaic.worker;

import static org.junit.jupiter.api.Assertions.*;

import com.onthegomap.tilemosaic.util.Exceptions;
import com.onthegomap.tilemosaic.util.LogUtil;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

class WorkerPoolTest {

  private final WorkerPool pool = new WorkerPool("worker", 2);

  @AfterEach
  void close() {
    pool.close();
    LogUtil.clearStage();
  }

  @Test
  @Timeout(10)
  void testBoundsConcurrency() throws Exception {
    AtomicInteger running = new AtomicInteger();
    AtomicInteger maxRunning = new AtomicInteger();
    List<CompletableFuture<Integer>> futures = new ArrayList<>();
    for (int i = 0; i < 10; i++) {
      int n = i;
      futures.add(pool.submit(() -> {
        maxRunning.accumulateAndGet(running.incrementAndGet(), Math::max);
        try {
          Thread.sleep(10);
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
        }
        running.decrementAndGet();
        return n;
      }));
    }
    WorkerPool.joinFutures(futures).get();
    assertTrue(maxRunning.get() <= 2, "max running " + maxRunning.get());
    assertEquals(45, futures.stream().mapToInt(CompletableFuture::join).sum());
  }

  @Test
  @Timeout(10)
  void testPropagatesLogStage() throws Exception {
    LogUtil.setStage("mosaic");
    assertEquals("mosaic:worker", pool.submit(LogUtil::getStage).get());
    LogUtil.clearStage();
    assertEquals("worker", pool.submit(LogUtil::getStage).get());
  }

  @Test
  @Timeout(10)
  void testJoinFailsFast() throws Exception {
    CountDownLatch never = new CountDownLatch(1);
    CompletableFuture<Object> slow = pool.submit(() -> {
      try {
        never.await();
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
      return null;
    });
    CompletableFuture<Object> failing = pool.submit(() -> {
      throw new IllegalStateException("boom");
    });
    var joined = WorkerPool.joinFutures(slow, failing);
    var error = assertThrows(ExecutionException.class, () -> joined.get(5, TimeUnit.SECONDS));
    assertInstanceOf(IllegalStateException.class, Exceptions.unwrap(error));
    assertTrue(slow.isCancelled());
  }
}
