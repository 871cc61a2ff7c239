package com.onthegomap.tilemosaic.worker;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.onthegomap.tilemosaic.util.LogUtil;
import java.io.Closeable;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Supplier;

/**
 * A fixed pool of daemon threads that runs tasks with the log stage of the thread that submitted them.
 * <p>
 * The pool size bounds how many tasks run at once no matter how many are submitted.
 */
public class WorkerPool implements Closeable {

  private final String prefix;
  private final ExecutorService executor;

  public WorkerPool(String prefix, int threads) {
    this.prefix = prefix;
    this.executor = Executors.newFixedThreadPool(threads, new ThreadFactoryBuilder()
      .setNameFormat(prefix + "-%d")
      .setDaemon(true)
      .build());
  }

  /** Runs {@code task} on this pool. */
  public <T> CompletableFuture<T> submit(Supplier<T> task) {
    String parentStage = LogUtil.getStage();
    return CompletableFuture.supplyAsync(() -> LogUtil.withStage(parentStage, prefix, task), executor);
  }

  /**
   * Returns a future that completes successfully when all {@code futures} complete, or fails immediately when the first
   * one fails, cancelling the rest.
   */
  public static CompletableFuture<Void> joinFutures(CompletableFuture<?>... futures) {
    return joinFutures(List.of(futures));
  }

  /**
   * Returns a future that completes successfully when all {@code futures} complete, or fails immediately when the first
   * one fails, cancelling the rest.
   */
  public static CompletableFuture<Void> joinFutures(Collection<? extends CompletableFuture<?>> futures) {
    CompletableFuture<Void> result = CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new));
    // fail fast on exceptions
    for (CompletableFuture<?> f : futures) {
      f.whenComplete((res, ex) -> {
        if (ex != null) {
          result.completeExceptionally(ex);
          futures.forEach(other -> other.cancel(true));
        }
      });
    }
    return result;
  }

  @Override
  public void close() {
    executor.shutdownNow();
  }
}
