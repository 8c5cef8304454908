package net.jodah.rechannel;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;

import net.jodah.rechannel.internal.util.Assert;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Consumer;

/**
 * A queue declared through a {@link RobustChannel}. On reconnect the queue re-declares itself. Use
 * a {@link RobustQueue} to have its bindings and consumers recovered as well.
 * 
 * <p>
 * A queue declared without a name takes the name the broker generates for it, and takes a newly
 * generated name each time it is re-declared.
 */
public class Queue implements Recoverable {
  final Logger log = LoggerFactory.getLogger(getClass());
  final QueueDeclaration declaration;
  volatile ChannelSession session;
  private volatile String name;

  public Queue(ChannelSession session, QueueDeclaration declaration) {
    this.session = Assert.notNull(session, "session");
    this.declaration = Assert.notNull(declaration, "declaration");
    this.name = declaration.getName();
  }

  /**
   * Returns the queue's name, which for a server named queue is empty until it has been declared.
   */
  public String getName() {
    return name;
  }

  public QueueDeclaration getDeclaration() {
    return declaration;
  }

  public AMQP.Queue.DeclareOk declare(Duration timeout) throws IOException {
    AMQP.Queue.DeclareOk result = session.queueDeclare(declaration, timeout);
    name = result.getQueue();
    return result;
  }

  /**
   * Binds the queue to the {@code exchange}. A null {@code routingKey} binds with the queue's name.
   */
  public AMQP.Queue.BindOk bind(String exchange, String routingKey, Map<String, Object> arguments,
      Duration timeout) throws IOException {
    return session.queueBind(name, exchange, routingKeyFor(routingKey), arguments, timeout);
  }

  public AMQP.Queue.BindOk bind(Exchange exchange, String routingKey) throws IOException {
    return bind(exchange.getName(), routingKey, null, null);
  }

  public AMQP.Queue.UnbindOk unbind(String exchange, String routingKey,
      Map<String, Object> arguments, Duration timeout) throws IOException {
    return session.queueUnbind(name, exchange, routingKeyFor(routingKey), arguments, timeout);
  }

  /**
   * Starts the {@code consumer} on the queue.
   * 
   * @param consumerTag the tag to consume with, else null to have the broker generate one
   * @return the consumer tag
   */
  public String consume(Consumer consumer, boolean autoAck, boolean exclusive,
      Map<String, Object> arguments, String consumerTag) throws IOException {
    return session.basicConsume(name, autoAck, exclusive, consumerTag, arguments,
        Assert.notNull(consumer, "consumer"));
  }

  public String consume(Consumer consumer) throws IOException {
    return consume(consumer, false, false, null, null);
  }

  public void cancel(String consumerTag) throws IOException {
    session.basicCancel(consumerTag);
  }

  @Override
  public void onReconnect(ChannelSession session) throws IOException {
    this.session = session;
    log.debug("Recovering {} via {}", this, session);
    declare(null);
  }

  @Override
  public String toString() {
    return "queue-" + name;
  }

  String routingKeyFor(String routingKey) {
    return routingKey == null ? name : routingKey;
  }
}
