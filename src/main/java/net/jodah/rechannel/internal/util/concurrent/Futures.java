package net.jodah.rechannel.internal.util.concurrent;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import net.jodah.rechannel.internal.util.Exceptions;

public final class Futures {
  private Futures() {
  }

  /**
   * Waits for the {@code future}, forever if the {@code timeout} is null. A timed out future is
   * cancelled.
   * 
   * @throws IOException if the future failed, timed out or the wait was interrupted
   */
  public static <T> T await(CompletableFuture<T> future, Duration timeout, Object operation)
      throws IOException {
    try {
      return timeout == null ? future.get() : future.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
    } catch (ExecutionException e) {
      throw Exceptions.toIOException(e.getCause());
    } catch (TimeoutException e) {
      future.cancel(false);
      throw new IOException(String.format("Timed out after %s waiting for %s", timeout, operation),
          e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      InterruptedIOException iioe = new InterruptedIOException("Interrupted waiting for "
          + operation);
      iioe.initCause(e);
      throw iioe;
    }
  }
}
