package com.onthegomap.tilemosaic;

import static java.util.Map.entry;

import java.util.Arrays;
import java.util.Locale;
import java.util.Map;

/**
 * Main entry-point for the executable jar, which delegates to the {@code public static void main(String[] args)}
 * method of the task named by the first argument.
 */
public class Main {

  private static final EntryPoint DEFAULT_TASK = TileMosaic::main;
  private static final Map<String, EntryPoint> ENTRY_POINTS = Map.ofEntries(
    entry("generate", TileMosaic::main),
    entry("mosaic", TileMosaic::main),

    entry("resolve", RegionLookup::main),
    entry("lookup", RegionLookup::main)
  );

  public static void main(String[] args) throws Exception {
    EntryPoint task = DEFAULT_TASK;

    if (args.length > 0) {
      String maybeTask = args[0].trim().toLowerCase(Locale.ROOT);
      EntryPoint taskFromArg0 = ENTRY_POINTS.get(maybeTask);
      if (taskFromArg0 != null) {
        args = Arrays.copyOfRange(args, 1, args.length);
        task = taskFromArg0;
      } else if (!maybeTask.contains("=") && !maybeTask.startsWith("-")) {
        System.err.println("Unrecognized task: " + maybeTask);
        System.err.println("possibilities: " + ENTRY_POINTS.keySet());
        System.exit(1);
      }
    }

    task.main(args);
  }

  @FunctionalInterface
  private interface EntryPoint {

    void main(String[] args) throws Exception;
  }
}
