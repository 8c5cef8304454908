package net.jodah.rechannel;

import net.jodah.rechannel.internal.util.concurrent.OperationRegistry;

/**
 * Creates the {@link ChannelSession} a {@link RobustChannel} speaks to the broker through.
 */
public interface SessionFactory {
  /**
   * Returns a new session that registers its in-flight broker operations with the
   * {@code operations} registry.
   */
  ChannelSession newSession(OperationRegistry operations);
}
