package com.onthegomap.tilemosaic.fetch;

import com.onthegomap.tilemosaic.util.Exceptions;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import javax.annotation.concurrent.ThreadSafe;

/**
 * Collapses concurrent loads of the same key into one.
 * <p>
 * The first caller for a key runs the loader on its own thread; callers arriving while it runs wait for and share its
 * outcome, value or exception. The key is released once the load finishes so later calls load again.
 */
@ThreadSafe
public class SingleFlight<K, V> {

  private final Map<K, CompletableFuture<V>> inFlight = new ConcurrentHashMap<>();

  public V get(K key, Callable<V> loader) {
    CompletableFuture<V> ours = new CompletableFuture<>();
    CompletableFuture<V> existing = inFlight.putIfAbsent(key, ours);
    if (existing != null) {
      return await(existing);
    }
    try {
      V value = loader.call();
      ours.complete(value);
      return value;
    } catch (Throwable e) {
      ours.completeExceptionally(e);
      return Exceptions.throwFatalException(e);
    } finally {
      inFlight.remove(key, ours);
    }
  }

  private static <V> V await(CompletableFuture<V> future) {
    try {
      return future.get();
    } catch (InterruptedException | ExecutionException e) {
      return Exceptions.throwFatalException(e);
    }
  }

  /** Number of loads currently running. */
  public int inFlight() {
    return inFlight.size();
  }
}
