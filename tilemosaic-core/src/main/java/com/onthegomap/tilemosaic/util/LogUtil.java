package com.onthegomap.tilemosaic.util;

import java.util.function.Supplier;
import org.slf4j.MDC;

/**
 * Tags log lines from the current thread with a {@code [stage]} prefix through the SLF4J {@link MDC}.
 * <p>
 * Nested stages are shown as {@code [parent:child]}, so a tile fetched during a mosaic run logs as
 * {@code [mosaic:fetch]}.
 */
public class LogUtil {

  private static final String STAGE_KEY = "stage";

  private LogUtil() {}

  /** Tags subsequent logs from this thread with {@code [stage]}. */
  public static void setStage(String stage) {
    MDC.put(STAGE_KEY, "[" + stage + "] ");
  }

  /** Tags subsequent logs from this thread with {@code [parent:child]}, or {@code [child]} when parent is null. */
  public static void setStage(String parent, String child) {
    setStage(parent == null ? child : parent + ":" + child);
  }

  public static void clearStage() {
    MDC.remove(STAGE_KEY);
  }

  /** Returns the stage logs from this thread are tagged with, or null. */
  public static String getStage() {
    String tag = MDC.get(STAGE_KEY);
    return tag == null ? null : tag.substring(1, tag.length() - 2);
  }

  /**
   * Runs {@code task} with logs tagged {@code [parent:child]} and restores the previous tag afterwards.
   */
  public static <T> T withStage(String parent, String child, Supplier<T> task) {
    String previous = getStage();
    setStage(parent, child);
    try {
      return task.get();
    } finally {
      if (previous == null) {
        clearStage();
      } else {
        setStage(previous);
      }
    }
  }

  /** Like {@link #withStage(String, String, Supplier)}, nesting {@code stage} under the current one. */
  public static <T> T withStage(String stage, Supplier<T> task) {
    return withStage(getStage(), stage, task);
  }
}
