package net.jodah.rechannel.internal;

import java.util.Map;

import com.rabbitmq.client.Consumer;

/**
 * Represents a consumer declaration.
 */
public final class ConsumerDeclaration {
  public final Consumer consumer;
  public final boolean autoAck;
  public final boolean exclusive;
  public final Map<String, Object> arguments;

  public ConsumerDeclaration(Consumer consumer, boolean autoAck, boolean exclusive,
      Map<String, Object> arguments) {
    this.consumer = consumer;
    this.autoAck = autoAck;
    this.exclusive = exclusive;
    this.arguments = arguments;
  }

  @Override
  public String toString() {
    return "ConsumerDeclaration [consumer=" + consumer + "]";
  }
}
