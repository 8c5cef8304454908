package net.jodah.rechannel.internal.util.concurrent;

import java.util.concurrent.CompletableFuture;

/**
 * Holds exactly one live completion signal. Replacing the signal fails the previous one if it is
 * still unresolved, so a waiter on an old signal is never left hanging.
 */
public class CompletionSlot<T> {
  private CompletableFuture<T> current = new CompletableFuture<T>();

  public synchronized CompletableFuture<T> current() {
    return current;
  }

  /**
   * Fails the current signal with the {@code failure} unless it is already resolved, then installs
   * and returns a new one.
   */
  public synchronized CompletableFuture<T> replace(Throwable failure) {
    current.completeExceptionally(failure);
    current = new CompletableFuture<T>();
    return current;
  }
}
