package net.jodah.rechannel;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.Set;

import net.jodah.rechannel.internal.Binding;
import net.jodah.rechannel.internal.ConsumerDeclaration;
import net.jodah.rechannel.internal.util.Collections;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Consumer;

/**
 * A queue that remembers the bindings and consumers made through it. On reconnect it re-declares
 * itself, then re-binds, then restarts its consumers under their original consumer tags.
 */
public class RobustQueue extends Queue {
  private final Set<Binding> bindings = Collections.synchronizedLinkedSet();
  private final Map<String, ConsumerDeclaration> consumers = Collections.synchronizedLinkedMap();

  public RobustQueue(ChannelSession session, QueueDeclaration declaration) {
    super(session, declaration);
  }

  @Override
  public AMQP.Queue.BindOk bind(String exchange, String routingKey, Map<String, Object> arguments,
      Duration timeout) throws IOException {
    return bind(exchange, routingKey, arguments, timeout, true);
  }

  /**
   * Binds the queue to the {@code exchange}, remembering the binding for recovery if
   * {@code recoverable}. A null {@code routingKey} is remembered as such and resolves to the
   * queue's name at the time of each re-bind.
   */
  public AMQP.Queue.BindOk bind(String exchange, String routingKey, Map<String, Object> arguments,
      Duration timeout, boolean recoverable) throws IOException {
    AMQP.Queue.BindOk result = super.bind(exchange, routingKey, arguments, timeout);
    if (recoverable)
      bindings.add(new Binding(exchange, routingKey, arguments));
    return result;
  }

  @Override
  public AMQP.Queue.UnbindOk unbind(String exchange, String routingKey,
      Map<String, Object> arguments, Duration timeout) throws IOException {
    AMQP.Queue.UnbindOk result = super.unbind(exchange, routingKey, arguments, timeout);
    bindings.remove(new Binding(exchange, routingKey, arguments));
    return result;
  }

  @Override
  public String consume(Consumer consumer, boolean autoAck, boolean exclusive,
      Map<String, Object> arguments, String consumerTag) throws IOException {
    return consume(consumer, autoAck, exclusive, arguments, consumerTag, true);
  }

  /**
   * Starts the {@code consumer} on the queue, remembering it for recovery if {@code recoverable}.
   */
  public String consume(Consumer consumer, boolean autoAck, boolean exclusive,
      Map<String, Object> arguments, String consumerTag, boolean recoverable) throws IOException {
    String tag = super.consume(consumer, autoAck, exclusive, arguments, consumerTag);
    if (recoverable)
      consumers.put(tag, new ConsumerDeclaration(consumer, autoAck, exclusive, arguments));
    log.info("Created consumer-{} of {} via {}", tag, this, session);
    return tag;
  }

  @Override
  public void cancel(String consumerTag) throws IOException {
    super.cancel(consumerTag);
    consumers.remove(consumerTag);
  }

  @Override
  public void onReconnect(ChannelSession session) throws IOException {
    super.onReconnect(session);

    for (Binding binding : Collections.snapshot(bindings)) {
      log.debug("Recovering {} of {} via {}", binding, this, session);
      session.queueBind(getName(), binding.source, routingKeyFor(binding.routingKey),
          binding.arguments, null);
    }

    for (Map.Entry<String, ConsumerDeclaration> entry : Collections.snapshot(consumers).entrySet()) {
      ConsumerDeclaration consumer = entry.getValue();
      log.info("Recovering consumer-{} of {} via {}", entry.getKey(), this, session);
      session.basicConsume(getName(), consumer.autoAck, consumer.exclusive, entry.getKey(),
          consumer.arguments, consumer.consumer);
    }
  }

  Set<Binding> getBindings() {
    return bindings;
  }

  Map<String, ConsumerDeclaration> getConsumers() {
    return consumers;
  }
}
