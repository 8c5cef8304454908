package net.jodah.rechannel.config;

import java.util.Collection;

import net.jodah.rechannel.EntityFactory;
import net.jodah.rechannel.RobustChannel;
import net.jodah.rechannel.event.ChannelListener;

/**
 * {@link RobustChannel} related configuration.
 */
public interface ChannelConfig {
  /**
   * Returns the channel's listeners else empty list if none were configured.
   * 
   * @see #withChannelListeners(ChannelListener...)
   */
  Collection<ChannelListener> getChannelListeners();

  /**
   * Returns the factory that creates the channel's exchanges and queues. Defaults to
   * {@link net.jodah.rechannel.EntityFactories#robust()}.
   * 
   * @see #withEntityFactory(EntityFactory)
   */
  EntityFactory getEntityFactory();

  /**
   * Returns whether recoverable exchange declarations are remembered and re-declared on reconnect.
   * Defaults to true.
   * 
   * @see #withExchangeRecovery(boolean)
   */
  boolean isExchangeRecoveryEnabled();

  /**
   * Returns whether recoverable queue declarations are remembered and re-declared on reconnect.
   * Defaults to true.
   * 
   * @see #withQueueRecovery(boolean)
   */
  boolean isQueueRecoveryEnabled();

  /**
   * Sets the {@code channelListeners} to call on channel related events.
   */
  ChannelConfig withChannelListeners(ChannelListener... channelListeners);

  /**
   * Sets the {@code entityFactory} that creates the channel's exchanges and queues.
   */
  ChannelConfig withEntityFactory(EntityFactory entityFactory);

  /**
   * Sets whether exchange recovery is enabled or not.
   */
  ChannelConfig withExchangeRecovery(boolean enabled);

  /**
   * Sets whether queue recovery is enabled or not.
   */
  ChannelConfig withQueueRecovery(boolean enabled);
}
