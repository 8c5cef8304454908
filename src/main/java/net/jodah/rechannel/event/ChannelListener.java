package net.jodah.rechannel.event;

import net.jodah.rechannel.RobustChannel;

/**
 * Listens for {@link RobustChannel} related events.
 */
public interface ChannelListener {
  /**
   * Called when the {@code channel} is successfully created.
   */
  void onCreate(RobustChannel channel);

  /**
   * Called when recovery of the {@code channel} onto a new connection is started.
   */
  void onRecoveryStarted(RobustChannel channel);

  /**
   * Called when the {@code channel} has been re-opened on the new connection and its QoS reapplied,
   * but before its exchanges and queues are recovered.
   */
  void onRecovery(RobustChannel channel);

  /**
   * Called when recovery of the {@code channel} along with its exchanges and queues is completed.
   */
  void onRecoveryCompleted(RobustChannel channel);

  /**
   * Called when the {@code channel} fails to recover onto a new connection.
   */
  void onRecoveryFailure(RobustChannel channel, Throwable failure);
}
