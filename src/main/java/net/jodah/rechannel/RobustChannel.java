package net.jodah.rechannel;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import net.jodah.rechannel.config.ChannelConfig;
import net.jodah.rechannel.event.ChannelListener;
import net.jodah.rechannel.internal.AmqpChannelSession;
import net.jodah.rechannel.internal.util.Assert;
import net.jodah.rechannel.internal.util.Collections;
import net.jodah.rechannel.internal.util.Exceptions;
import net.jodah.rechannel.internal.util.concurrent.CompletionSlot;
import net.jodah.rechannel.internal.util.concurrent.Futures;
import net.jodah.rechannel.internal.util.concurrent.OperationRegistry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.BuiltinExchangeType;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ShutdownListener;
import com.rabbitmq.client.ShutdownSignalException;

/**
 * A channel whose declared state survives the replacement of its connection. The channel remembers
 * its QoS settings along with the exchanges and queues declared through it as recoverable, and
 * when {@link #onReconnect(Connection, int) notified} of a new connection it fails its pending
 * operations, re-opens itself, reapplies its QoS, then re-declares its exchanges followed by its
 * queues.
 */
public class RobustChannel {
  private final Logger log = LoggerFactory.getLogger(getClass());
  private final ChannelConfig config;
  private final EntityFactory entityFactory;
  private final OperationRegistry operations;
  private final ChannelSession session;
  private final CompletionSlot<Void> closing = new CompletionSlot<Void>();
  private final Map<String, Exchange> exchanges = Collections.synchronizedLinkedMap();
  private final Map<String, Queue> queues = Collections.synchronizedLinkedMap();
  private volatile Connection connection;
  private volatile int channelNumber;
  private volatile Qos qos = Qos.DEFAULT;
  private volatile boolean closed;
  private CompletableFuture<Void> openedClosing;
  volatile RobustConnection owner;

  private static final class Qos {
    static final Qos DEFAULT = new Qos(0, 0);
    final int prefetchCount;
    final int prefetchSize;

    Qos(int prefetchCount, int prefetchSize) {
      this.prefetchCount = prefetchCount;
      this.prefetchSize = prefetchSize;
    }
  }

  /**
   * Creates a channel that speaks to the broker through the RabbitMQ client.
   *
   * @param channelNumber the channel number to open with, or {@code 0} to let the connection pick
   * @param connectionOperations the registry of the connection's pending operations
   */
  public RobustChannel(Connection connection, int channelNumber,
      OperationRegistry connectionOperations, ChannelConfig config) {
    this(connection, channelNumber, connectionOperations, AmqpChannelSession.FACTORY, config);
  }

  /**
   * Creates a channel that speaks to the broker through a session created by the
   * {@code sessionFactory}.
   *
   * @param channelNumber the channel number to open with, or {@code 0} to let the connection pick
   * @param connectionOperations the registry of the connection's pending operations
   */
  public RobustChannel(Connection connection, int channelNumber,
      OperationRegistry connectionOperations, SessionFactory sessionFactory, ChannelConfig config) {
    Assert.isTrue(channelNumber >= 0, "channelNumber must be >= 0");
    this.connection = Assert.notNull(connection, "connection");
    this.channelNumber = channelNumber;
    this.config = Assert.notNull(config, "config");
    this.entityFactory = Assert.notNull(config.getEntityFactory(), "entityFactory");
    this.operations = Assert.notNull(connectionOperations, "connectionOperations").getChild();
    this.session = Assert.notNull(sessionFactory, "sessionFactory").newSession(operations);
  }

  /**
   * Moves the channel onto the {@code connection}. Fails the channel's pending operations and any
   * unresolved closing signal with a {@link ConnectionLostException}, re-opens the channel with the
   * {@code channelNumber}, reapplies its QoS, then recovers each remembered exchange followed by
   * each remembered queue, one at a time. A channel that has been closed is moved but not
   * re-opened.
   *
   * @throws IOException if re-opening the channel or recovering any exchange or queue fails, in
   *           which case nothing after the failure is recovered
   */
  public synchronized void onReconnect(Connection connection, int channelNumber)
      throws IOException {
    ConnectionLostException connectionLost = new ConnectionLostException(String.format(
        "Connection of %s was replaced", this));
    closing.replace(connectionLost);
    operations.rejectAll(connectionLost);
    this.connection = Assert.notNull(connection, "connection");
    this.channelNumber = channelNumber;

    if (closed) {
      log.debug("Not recovering {} since it was closed", this);
      return;
    }

    log.info("Recovering {}", this);
    notifyRecoveryStarted();

    try {
      initialize(null);
      notifyRecovery();

      for (Exchange exchange : Collections.snapshotValues(exchanges))
        exchange.onReconnect(session);

      for (Map.Entry<String, Queue> entry : Collections.snapshot(queues).entrySet()) {
        Queue queue = entry.getValue();
        queue.onReconnect(session);

        // Server named queues are renamed by re-declaration
        if (!entry.getKey().equals(queue.getName()))
          synchronized (queues) {
            if (queues.remove(entry.getKey(), queue))
              queues.put(queue.getName(), queue);
          }
      }

      log.info("Recovered {}", this);
      notifyRecoveryCompleted();
    } catch (Exception e) {
      log.error("Failed to recover {}", this, e);
      notifyRecoveryFailure(e);
      throw e;
    }
  }

  /**
   * Opens the channel on its current connection, then applies the last requested QoS, which is
   * {@code (0, 0)} if none was ever requested.
   *
   * @param timeout how long to wait for the QoS to be applied, else null to wait forever
   */
  public RobustChannel initialize(Duration timeout) throws IOException {
    open();
    Qos current = qos;
    setQos(current.prefetchCount, current.prefetchSize, false, timeout);
    return this;
  }

  /**
   * Sets the channel's QoS. The settings are remembered before they are sent, so a reconnect always
   * reapplies the most recently requested settings.
   *
   * @param allChannels must be false since QoS is only recovered per channel
   * @param timeout how long to wait for the broker, else null to wait forever
   * @throws UnsupportedOperationException if {@code allChannels} is true
   */
  public void setQos(int prefetchCount, int prefetchSize, boolean allChannels, Duration timeout)
      throws IOException {
    if (allChannels)
      throw new UnsupportedOperationException("QoS for all channels cannot be recovered by "
          + getClass().getSimpleName());
    Assert.isTrue(prefetchCount >= 0, "prefetchCount must be >= 0");
    Assert.isTrue(prefetchSize >= 0, "prefetchSize must be >= 0");

    qos = new Qos(prefetchCount, prefetchSize);
    session.basicQos(prefetchCount, prefetchSize, false, timeout);
  }

  public void setQos(int prefetchCount) throws IOException {
    setQos(prefetchCount, 0, false, null);
  }

  /**
   * Closes the channel and waits for the close to complete. Closing an already closed channel does
   * nothing. A close that starts while the channel is being recovered takes effect once the
   * recovery finishes. The handle reference is released however the wait ends.
   *
   * @throws IOException if the channel did not close normally, such as when its connection was
   *           replaced while closing
   */
  public void close() throws IOException {
    CompletableFuture<Void> lifetimeClosing = beginClose();
    if (lifetimeClosing == null)
      return;

    try {
      Futures.await(lifetimeClosing, null, "close of " + this);
    } finally {
      session.release();
      RobustConnection owner = this.owner;
      if (owner != null)
        owner.removeChannel(this);
    }
  }

  /**
   * Declares an exchange, remembering it for recovery if it is {@code recoverable} and not internal.
   *
   * @param timeout how long to wait for the broker, else null to wait forever
   * @param recoverable false for exchanges that should not be re-declared on reconnect
   */
  public Exchange declareExchange(ExchangeDeclaration declaration, Duration timeout,
      boolean recoverable) throws IOException {
    ensureNotClosed();
    Exchange exchange = entityFactory.newExchange(session, Assert.notNull(declaration,
        "declaration"));
    exchange.declare(timeout);

    if (recoverable && !declaration.isInternal() && config.isExchangeRecoveryEnabled())
      exchanges.put(declaration.getName(), exchange);
    return exchange;
  }

  public Exchange declareExchange(ExchangeDeclaration declaration) throws IOException {
    return declareExchange(declaration, null, true);
  }

  public Exchange declareExchange(String name, BuiltinExchangeType type) throws IOException {
    return declareExchange(new ExchangeDeclaration(name).withType(type));
  }

  /**
   * Deletes the exchange and forgets it, regardless of how it was declared, so that it is never
   * re-declared by a later reconnect.
   *
   * @return the broker's reply, else null when {@code nowait} is set
   */
  public AMQP.Exchange.DeleteOk exchangeDelete(String name, boolean ifUnused, boolean nowait,
      Duration timeout) throws IOException {
    ensureNotClosed();
    AMQP.Exchange.DeleteOk result = session.exchangeDelete(name, ifUnused, nowait, timeout);
    exchanges.remove(name);
    return result;
  }

  public AMQP.Exchange.DeleteOk exchangeDelete(String name) throws IOException {
    return exchangeDelete(name, false, false, null);
  }

  /**
   * Declares a queue, remembering it for recovery under its resulting name if it is
   * {@code recoverable}.
   *
   * @param timeout how long to wait for the broker, else null to wait forever
   * @param recoverable false for queues that should not be re-declared on reconnect
   */
  public Queue declareQueue(QueueDeclaration declaration, Duration timeout, boolean recoverable)
      throws IOException {
    ensureNotClosed();
    Queue queue = entityFactory.newQueue(session, Assert.notNull(declaration, "declaration"));
    queue.declare(timeout);

    if (recoverable && config.isQueueRecoveryEnabled())
      queues.put(queue.getName(), queue);
    return queue;
  }

  public Queue declareQueue(QueueDeclaration declaration) throws IOException {
    return declareQueue(declaration, null, true);
  }

  public Queue declareQueue(String name) throws IOException {
    return declareQueue(new QueueDeclaration(name));
  }

  /**
   * Declares a queue with a server generated name.
   */
  public Queue declareQueue() throws IOException {
    return declareQueue(new QueueDeclaration());
  }

  /**
   * Deletes the queue and forgets it, regardless of how it was declared, so that it is never
   * re-declared by a later reconnect.
   *
   * @return the broker's reply, else null when {@code nowait} is set
   */
  public AMQP.Queue.DeleteOk queueDelete(String name, boolean ifUnused, boolean ifEmpty,
      boolean nowait, Duration timeout) throws IOException {
    ensureNotClosed();
    AMQP.Queue.DeleteOk result = session.queueDelete(name, ifUnused, ifEmpty, nowait, timeout);
    queues.remove(name);
    return result;
  }

  public AMQP.Queue.DeleteOk queueDelete(String name) throws IOException {
    return queueDelete(name, false, false, false, null);
  }

  public int getChannelNumber() {
    return channelNumber;
  }

  /**
   * Returns the signal that completes when the channel's current handle finishes closing. The
   * signal fails with a {@link ConnectionLostException} if the connection is replaced first.
   */
  public CompletableFuture<Void> getClosing() {
    return closing.current();
  }

  public int getPrefetchCount() {
    return qos.prefetchCount;
  }

  public int getPrefetchSize() {
    return qos.prefetchSize;
  }

  /**
   * Returns the exchanges that will be recovered on reconnect, by name, in recovery order.
   */
  public Map<String, Exchange> getRecoverableExchanges() {
    return java.util.Collections.unmodifiableMap(Collections.snapshot(exchanges));
  }

  /**
   * Returns the queues that will be recovered on reconnect, by name, in recovery order.
   */
  public Map<String, Queue> getRecoverableQueues() {
    return java.util.Collections.unmodifiableMap(Collections.snapshot(queues));
  }

  public boolean isClosed() {
    return closed;
  }

  public boolean isOpen() {
    return !closed && session.isOpen();
  }

  @Override
  public String toString() {
    return String.format("channel-%s on %s", channelNumber, connection);
  }

  void notifyCreate() {
    for (ChannelListener listener : config.getChannelListeners())
      try {
        listener.onCreate(this);
      } catch (Exception e) {
        log.warn("Channel listener failed on creation of {}", this, e);
      }
  }

  /**
   * Opens a handle for the current lifetime, whose shutdown resolves only that lifetime's closing
   * signal.
   */
  private synchronized void open() throws IOException {
    ensureNotClosed();
    final CompletableFuture<Void> lifetimeClosing = closing.current();
    session.open(connection, channelNumber, new ShutdownListener() {
      @Override
      public void shutdownCompleted(ShutdownSignalException e) {
        if (e.isInitiatedByApplication())
          lifetimeClosing.complete(null);
        else {
          if (Exceptions.isConnectionClosure(e))
            log.info("Channel {} was closed by its connection", RobustChannel.this);
          else
            log.error("Channel {} was closed unexpectedly", RobustChannel.this);
          lifetimeClosing.completeExceptionally(e);
        }
      }
    });
    openedClosing = lifetimeClosing;
    channelNumber = session.getChannelNumber();
  }

  /**
   * Marks the channel closed and asks the current lifetime's handle to close.
   *
   * @return the closing signal to await, else null if the channel was already closed
   */
  private synchronized CompletableFuture<Void> beginClose() {
    if (closed)
      return null;

    closed = true;
    CompletableFuture<Void> lifetimeClosing = closing.current();
    log.info("Closing {}", this);

    // No handle was opened since the last reconnect, so none will report its shutdown
    if (lifetimeClosing != openedClosing)
      lifetimeClosing.complete(null);
    else
      try {
        session.close();
      } catch (IOException e) {
        lifetimeClosing.completeExceptionally(e);
      }

    return lifetimeClosing;
  }

  private void ensureNotClosed() {
    Assert.state(!closed, "{} is closed", this);
  }

  private void notifyRecoveryStarted() {
    for (ChannelListener listener : config.getChannelListeners())
      try {
        listener.onRecoveryStarted(this);
      } catch (Exception e) {
        log.warn("Channel listener failed on recovery start of {}", this, e);
      }
  }

  private void notifyRecovery() {
    for (ChannelListener listener : config.getChannelListeners())
      try {
        listener.onRecovery(this);
      } catch (Exception e) {
        log.warn("Channel listener failed on recovery of {}", this, e);
      }
  }

  private void notifyRecoveryCompleted() {
    for (ChannelListener listener : config.getChannelListeners())
      try {
        listener.onRecoveryCompleted(this);
      } catch (Exception e) {
        log.warn("Channel listener failed on recovery completion of {}", this, e);
      }
  }

  private void notifyRecoveryFailure(Exception failure) {
    for (ChannelListener listener : config.getChannelListeners())
      try {
        listener.onRecoveryFailure(this, failure);
      } catch (Exception e) {
        log.warn("Channel listener failed on recovery failure of {}", this, e);
      }
  }
}
