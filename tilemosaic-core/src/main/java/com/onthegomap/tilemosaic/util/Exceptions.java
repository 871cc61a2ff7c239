package com.onthegomap.tilemosaic.util;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Exception-handling utilities.
 */
public class Exceptions {
  private Exceptions() {}

  /**
   * Re-throw a caught exception, handling interrupts and wrapping in a {@link FatalMosaicException} if checked.
   * <p>
   * Wrappers added by futures ({@link ExecutionException}, {@link CompletionException}) are unwrapped first so the
   * caller sees the error the task actually raised.
   *
   * @param exception The original exception
   * @param <T>       Return type if caller requires it
   */
  public static <T> T throwFatalException(Throwable exception) {
    exception = unwrap(exception);
    if (exception instanceof InterruptedException) {
      Thread.currentThread().interrupt();
    }
    if (exception instanceof RuntimeException runtimeException) {
      throw runtimeException;
    } else if (exception instanceof IOException ioe) {
      throw new UncheckedIOException(ioe);
    } else if (exception instanceof Error error) {
      throw error;
    }
    throw new FatalMosaicException(exception);
  }

  /** Returns the first cause of {@code exception} that is not a future completion wrapper. */
  public static Throwable unwrap(Throwable exception) {
    while ((exception instanceof ExecutionException || exception instanceof CompletionException) &&
      exception.getCause() != null) {
      exception = exception.getCause();
    }
    return exception;
  }

  /**
   * Fatal exception that will result in the run exiting early and shutting down.
   */
  public static class FatalMosaicException extends RuntimeException {
    public FatalMosaicException(Throwable exception) {
      super(exception);
    }
  }
}
