package net.jodah.rechannel;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import net.jodah.rechannel.config.Config;
import net.jodah.rechannel.internal.AmqpChannelSession;
import net.jodah.rechannel.internal.util.Assert;
import net.jodah.rechannel.internal.util.concurrent.OperationRegistry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.rabbitmq.client.Connection;

/**
 * Owns the {@link RobustChannel}s created on a connection and moves them onto a replacement
 * connection. Detecting that a connection was lost and establishing its replacement is left to the
 * caller, which hands the replacement to {@link #onReconnect(Connection)}.
 */
public class RobustConnection {
  private static final AtomicInteger CONNECTION_COUNTER = new AtomicInteger();

  private final Logger log = LoggerFactory.getLogger(getClass());
  private final OperationRegistry operations = new OperationRegistry();
  private final List<RobustChannel> channels = new CopyOnWriteArrayList<RobustChannel>();
  private final Config config;
  private final SessionFactory sessionFactory;
  private final String connectionName;
  private volatile Connection delegate;

  public RobustConnection(Connection delegate, Config config) {
    this(delegate, config, AmqpChannelSession.FACTORY);
  }

  public RobustConnection(Connection delegate, Config config, SessionFactory sessionFactory) {
    this.delegate = Assert.notNull(delegate, "delegate");
    this.config = Assert.notNull(config, "config");
    this.sessionFactory = Assert.notNull(sessionFactory, "sessionFactory");
    this.connectionName = String.format("cxn-%s", CONNECTION_COUNTER.incrementAndGet());
  }

  /**
   * Creates and initializes a channel on a number chosen by the connection.
   */
  public RobustChannel createChannel() throws IOException {
    return createChannel(0);
  }

  /**
   * Creates and initializes a channel on the {@code channelNumber}.
   */
  public RobustChannel createChannel(int channelNumber) throws IOException {
    RobustChannel channel = new RobustChannel(delegate, channelNumber, operations, sessionFactory,
        new Config(config));
    try {
      channel.initialize(null);
    } catch (IOException e) {
      log.error("Failed to create channel on {}", this, e);
      throw e;
    }

    channel.owner = this;
    channels.add(channel);
    log.info("Created {}", channel);
    channel.notifyCreate();
    return channel;
  }

  /**
   * Moves every channel onto the {@code connection}, keeping each channel's number, one channel at
   * a time.
   *
   * @throws IOException the first channel recovery failure, after which no further channels are
   *           recovered
   */
  public void onReconnect(Connection connection) throws IOException {
    delegate = Assert.notNull(connection, "connection");
    log.info("Recovering channels of {} onto {}", this, connection);
    for (RobustChannel channel : channels)
      channel.onReconnect(connection, channel.getChannelNumber());
  }

  /**
   * Fails every pending operation on the connection's channels with the {@code failure}.
   */
  public void rejectAll(Throwable failure) {
    operations.rejectAll(failure);
  }

  /**
   * Closes each channel and then the connection.
   */
  public void close() throws IOException {
    IOException failure = null;
    for (RobustChannel channel : new ArrayList<RobustChannel>(channels))
      try {
        channel.close();
      } catch (IOException e) {
        log.warn("Failed to close {}", channel, e);
        failure = e;
      }

    log.info("Closing {}", this);
    if (delegate.isOpen())
      delegate.close();
    if (failure != null)
      throw failure;
  }

  public List<RobustChannel> getChannels() {
    return new ArrayList<RobustChannel>(channels);
  }

  public Connection getDelegate() {
    return delegate;
  }

  @Override
  public String toString() {
    return connectionName;
  }

  void removeChannel(RobustChannel channel) {
    channels.remove(channel);
  }
}
