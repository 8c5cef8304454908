package net.jodah.rechannel;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.Set;

import net.jodah.rechannel.internal.Binding;
import net.jodah.rechannel.internal.util.Collections;

import com.rabbitmq.client.AMQP;

/**
 * An exchange that remembers the exchange-to-exchange bindings made through it and replays them
 * after re-declaring itself on reconnect.
 */
public class RobustExchange extends Exchange {
  private final Set<Binding> bindings = Collections.synchronizedLinkedSet();

  public RobustExchange(ChannelSession session, ExchangeDeclaration declaration) {
    super(session, declaration);
  }

  @Override
  public AMQP.Exchange.BindOk bind(String source, String routingKey,
      Map<String, Object> arguments, Duration timeout) throws IOException {
    AMQP.Exchange.BindOk result = super.bind(source, routingKey, arguments, timeout);
    bindings.add(new Binding(source, routingKey, arguments));
    return result;
  }

  @Override
  public AMQP.Exchange.UnbindOk unbind(String source, String routingKey,
      Map<String, Object> arguments, Duration timeout) throws IOException {
    AMQP.Exchange.UnbindOk result = super.unbind(source, routingKey, arguments, timeout);
    bindings.remove(new Binding(source, routingKey, arguments));
    return result;
  }

  @Override
  public void onReconnect(ChannelSession session) throws IOException {
    super.onReconnect(session);
    for (Binding binding : Collections.snapshot(bindings)) {
      log.debug("Recovering {} of {} via {}", binding, this, session);
      session.exchangeBind(getName(), binding.source, binding.routingKey, binding.arguments, null);
    }
  }

  Set<Binding> getBindings() {
    return bindings;
  }
}
