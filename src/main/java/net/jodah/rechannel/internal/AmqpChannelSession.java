package net.jodah.rechannel.internal;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeoutException;

import net.jodah.rechannel.ChannelSession;
import net.jodah.rechannel.ExchangeDeclaration;
import net.jodah.rechannel.QueueDeclaration;
import net.jodah.rechannel.SessionFactory;
import net.jodah.rechannel.internal.util.Assert;
import net.jodah.rechannel.internal.util.concurrent.Futures;
import net.jodah.rechannel.internal.util.concurrent.OperationRegistry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.AlreadyClosedException;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Command;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.Consumer;
import com.rabbitmq.client.Method;
import com.rabbitmq.client.ShutdownListener;

/**
 * A {@link ChannelSession} over a RabbitMQ client {@link Channel}. Broker RPCs are issued
 * asynchronously, registered with the session's {@link OperationRegistry}, then awaited, so that a
 * reconnect can fail them in bulk.
 */
public class AmqpChannelSession implements ChannelSession {
  public static final SessionFactory FACTORY = new SessionFactory() {
    @Override
    public ChannelSession newSession(OperationRegistry operations) {
      return new AmqpChannelSession(operations);
    }
  };

  private final Logger log = LoggerFactory.getLogger(getClass());
  private final OperationRegistry operations;
  private volatile Channel delegate;

  public AmqpChannelSession(OperationRegistry operations) {
    this.operations = Assert.notNull(operations, "operations");
  }

  @Override
  public void open(Connection connection, int channelNumber, ShutdownListener shutdownListener)
      throws IOException {
    Channel channel = channelNumber > 0 ? connection.createChannel(channelNumber)
        : connection.createChannel();
    if (channel == null)
      throw new IOException(channelNumber > 0 ? String.format(
          "Channel number %s is already in use on %s", channelNumber, connection)
          : "No channel numbers are available on " + connection);

    channel.addShutdownListener(shutdownListener);
    delegate = channel;
    log.debug("Opened channel-{} on {}", channel.getChannelNumber(), connection);
  }

  @Override
  public void close() throws IOException {
    Channel channel = delegate;
    if (channel == null || !channel.isOpen())
      return;

    try {
      channel.close();
    } catch (AlreadyClosedException e) {
      log.debug("Channel-{} was closed before it could be closed", channel.getChannelNumber());
    } catch (TimeoutException e) {
      throw new IOException("Timed out closing channel-" + channel.getChannelNumber(), e);
    }
  }

  @Override
  public void release() {
    delegate = null;
  }

  @Override
  public boolean isOpen() {
    Channel channel = delegate;
    return channel != null && channel.isOpen();
  }

  @Override
  public int getChannelNumber() {
    Channel channel = delegate;
    return channel == null ? 0 : channel.getChannelNumber();
  }

  @Override
  public void basicQos(int prefetchCount, int prefetchSize, boolean global, Duration timeout)
      throws IOException {
    rpc(new AMQP.Basic.Qos.Builder().prefetchCount(prefetchCount)
        .prefetchSize(prefetchSize)
        .global(global)
        .build(), timeout);
  }

  @Override
  public AMQP.Exchange.DeclareOk exchangeDeclare(ExchangeDeclaration declaration, Duration timeout)
      throws IOException {
    return (AMQP.Exchange.DeclareOk) rpc(new AMQP.Exchange.Declare.Builder().exchange(
        declaration.getName())
        .type(declaration.getType())
        .durable(declaration.isDurable())
        .autoDelete(declaration.isAutoDelete())
        .internal(declaration.isInternal())
        .passive(declaration.isPassive())
        .arguments(declaration.getArguments())
        .build(), timeout);
  }

  @Override
  public AMQP.Exchange.DeleteOk exchangeDelete(String exchange, boolean ifUnused, boolean nowait,
      Duration timeout) throws IOException {
    if (nowait) {
      channel().exchangeDeleteNoWait(exchange, ifUnused);
      return null;
    }

    return (AMQP.Exchange.DeleteOk) rpc(new AMQP.Exchange.Delete.Builder().exchange(exchange)
        .ifUnused(ifUnused)
        .build(), timeout);
  }

  @Override
  public AMQP.Exchange.BindOk exchangeBind(String destination, String source, String routingKey,
      Map<String, Object> arguments, Duration timeout) throws IOException {
    return (AMQP.Exchange.BindOk) rpc(new AMQP.Exchange.Bind.Builder().destination(destination)
        .source(source)
        .routingKey(routingKey)
        .arguments(arguments)
        .build(), timeout);
  }

  @Override
  public AMQP.Exchange.UnbindOk exchangeUnbind(String destination, String source,
      String routingKey, Map<String, Object> arguments, Duration timeout) throws IOException {
    return (AMQP.Exchange.UnbindOk) rpc(new AMQP.Exchange.Unbind.Builder().destination(destination)
        .source(source)
        .routingKey(routingKey)
        .arguments(arguments)
        .build(), timeout);
  }

  @Override
  public AMQP.Queue.DeclareOk queueDeclare(QueueDeclaration declaration, Duration timeout)
      throws IOException {
    return (AMQP.Queue.DeclareOk) rpc(new AMQP.Queue.Declare.Builder().queue(declaration.getName())
        .durable(declaration.isDurable())
        .exclusive(declaration.isExclusive())
        .autoDelete(declaration.isAutoDelete())
        .passive(declaration.isPassive())
        .arguments(declaration.getArguments())
        .build(), timeout);
  }

  @Override
  public AMQP.Queue.DeleteOk queueDelete(String queue, boolean ifUnused, boolean ifEmpty,
      boolean nowait, Duration timeout) throws IOException {
    if (nowait) {
      channel().queueDeleteNoWait(queue, ifUnused, ifEmpty);
      return null;
    }

    return (AMQP.Queue.DeleteOk) rpc(new AMQP.Queue.Delete.Builder().queue(queue)
        .ifUnused(ifUnused)
        .ifEmpty(ifEmpty)
        .build(), timeout);
  }

  @Override
  public AMQP.Queue.BindOk queueBind(String queue, String exchange, String routingKey,
      Map<String, Object> arguments, Duration timeout) throws IOException {
    return (AMQP.Queue.BindOk) rpc(new AMQP.Queue.Bind.Builder().queue(queue)
        .exchange(exchange)
        .routingKey(routingKey)
        .arguments(arguments)
        .build(), timeout);
  }

  @Override
  public AMQP.Queue.UnbindOk queueUnbind(String queue, String exchange, String routingKey,
      Map<String, Object> arguments, Duration timeout) throws IOException {
    return (AMQP.Queue.UnbindOk) rpc(new AMQP.Queue.Unbind.Builder().queue(queue)
        .exchange(exchange)
        .routingKey(routingKey)
        .arguments(arguments)
        .build(), timeout);
  }

  @Override
  public String basicConsume(String queue, boolean autoAck, boolean exclusive, String consumerTag,
      Map<String, Object> arguments, Consumer consumer) throws IOException {
    return channel().basicConsume(queue, autoAck, consumerTag == null ? "" : consumerTag, false,
        exclusive, arguments, consumer);
  }

  @Override
  public void basicCancel(String consumerTag) throws IOException {
    channel().basicCancel(consumerTag);
  }

  @Override
  public String toString() {
    return "channel-" + getChannelNumber();
  }

  private Channel channel() {
    Channel channel = delegate;
    Assert.state(channel != null, "Channel session has not been opened");
    return channel;
  }

  private Method rpc(Method method, Duration timeout) throws IOException {
    CompletableFuture<Command> future = operations.register(channel().asyncCompletableRpc(method));
    return Futures.await(future, timeout, method.protocolMethodName()).getMethod();
  }
}
