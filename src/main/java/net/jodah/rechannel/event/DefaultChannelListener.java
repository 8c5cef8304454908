package net.jodah.rechannel.event;

import net.jodah.rechannel.RobustChannel;

/**
 * No-op channel listener for sub-classing.
 */
public abstract class DefaultChannelListener implements ChannelListener {
  @Override
  public void onCreate(RobustChannel channel) {
  }

  @Override
  public void onRecovery(RobustChannel channel) {
  }

  @Override
  public void onRecoveryCompleted(RobustChannel channel) {
  }

  @Override
  public void onRecoveryFailure(RobustChannel channel, Throwable failure) {
  }

  @Override
  public void onRecoveryStarted(RobustChannel channel) {
  }
}
