package net.jodah.rechannel.internal.util.concurrent;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.BiConsumer;

/**
 * Tracks the futures of outstanding broker operations so that they can be failed in bulk.
 * Registries form a tree: a root registry per connection and a child per channel. An operation
 * registered through a child is also tracked by each of the child's ancestors, so rejecting a
 * child fails only the operations registered through that child (or its descendants), while
 * rejecting the root fails every operation on the connection.
 */
public class OperationRegistry {
  private final OperationRegistry parent;
  private final Set<CompletableFuture<?>> operations = ConcurrentHashMap.newKeySet();

  /** Creates a root registry. */
  public OperationRegistry() {
    this(null);
  }

  private OperationRegistry(OperationRegistry parent) {
    this.parent = parent;
  }

  /**
   * Returns a new registry whose operations are disjoint from those of its siblings and are also
   * tracked by this registry.
   */
  public OperationRegistry getChild() {
    return new OperationRegistry(this);
  }

  /**
   * Tracks the {@code future} in this registry and its ancestors until it completes.
   */
  public <T> CompletableFuture<T> register(CompletableFuture<T> future) {
    for (OperationRegistry registry = this; registry != null; registry = registry.parent)
      registry.track(future);
    return future;
  }

  /**
   * Fails every unresolved operation tracked by this registry with the {@code failure} and forgets
   * them. Operations registered after this call returns are not affected.
   */
  public void rejectAll(Throwable failure) {
    List<CompletableFuture<?>> pending = new ArrayList<CompletableFuture<?>>(operations);
    operations.removeAll(pending);
    for (CompletableFuture<?> future : pending)
      future.completeExceptionally(failure);
  }

  public boolean isEmpty() {
    return operations.isEmpty();
  }

  public int size() {
    return operations.size();
  }

  private void track(final CompletableFuture<?> future) {
    operations.add(future);

    // Runs immediately when the future is already complete
    future.whenComplete(new BiConsumer<Object, Throwable>() {
      @Override
      public void accept(Object result, Throwable failure) {
        operations.remove(future);
      }
    });
  }
}
