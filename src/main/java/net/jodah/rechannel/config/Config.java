package net.jodah.rechannel.config;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;

import net.jodah.rechannel.EntityFactories;
import net.jodah.rechannel.EntityFactory;
import net.jodah.rechannel.event.ChannelListener;
import net.jodah.rechannel.internal.util.Assert;

/**
 * Rechannel configuration. Settings left unset on a config are read from its parent, if any, at
 * the time they are needed, so later changes to a parent show through to its children.
 */
public class Config implements ChannelConfig {
  private final Config parent;
  private volatile Collection<ChannelListener> listeners;
  private volatile EntityFactory entityFactory;
  private volatile Boolean exchangeRecovery;
  private volatile Boolean queueRecovery;

  public Config() {
    this.parent = null;
  }

  /**
   * Creates a config whose unset settings are read from the {@code parent}.
   */
  public Config(Config parent) {
    this.parent = Assert.notNull(parent, "parent");
  }

  @Override
  public Collection<ChannelListener> getChannelListeners() {
    if (listeners != null)
      return listeners;
    return parent == null ? Collections.<ChannelListener>emptyList() : parent.getChannelListeners();
  }

  @Override
  public EntityFactory getEntityFactory() {
    if (entityFactory != null)
      return entityFactory;
    return parent == null ? EntityFactories.robust() : parent.getEntityFactory();
  }

  @Override
  public boolean isExchangeRecoveryEnabled() {
    if (exchangeRecovery != null)
      return exchangeRecovery.booleanValue();
    return parent == null || parent.isExchangeRecoveryEnabled();
  }

  @Override
  public boolean isQueueRecoveryEnabled() {
    if (queueRecovery != null)
      return queueRecovery.booleanValue();
    return parent == null || parent.isQueueRecoveryEnabled();
  }

  @Override
  public Config withChannelListeners(ChannelListener... channelListeners) {
    listeners = Collections.unmodifiableList(Arrays.asList(channelListeners));
    return this;
  }

  @Override
  public Config withEntityFactory(EntityFactory entityFactory) {
    this.entityFactory = Assert.notNull(entityFactory, "entityFactory");
    return this;
  }

  @Override
  public Config withExchangeRecovery(boolean enabled) {
    exchangeRecovery = enabled;
    return this;
  }

  @Override
  public Config withQueueRecovery(boolean enabled) {
    queueRecovery = enabled;
    return this;
  }
}
