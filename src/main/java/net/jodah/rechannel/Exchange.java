package net.jodah.rechannel;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;

import net.jodah.rechannel.internal.util.Assert;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.rabbitmq.client.AMQP;

/**
 * An exchange declared through a {@link RobustChannel}. On reconnect the exchange re-declares
 * itself. Use a {@link RobustExchange} to have its bindings recovered as well.
 */
public class Exchange implements Recoverable {
  final Logger log = LoggerFactory.getLogger(getClass());
  final ExchangeDeclaration declaration;
  volatile ChannelSession session;

  public Exchange(ChannelSession session, ExchangeDeclaration declaration) {
    this.session = Assert.notNull(session, "session");
    this.declaration = Assert.notNull(declaration, "declaration");
  }

  public String getName() {
    return declaration.getName();
  }

  public ExchangeDeclaration getDeclaration() {
    return declaration;
  }

  public AMQP.Exchange.DeclareOk declare(Duration timeout) throws IOException {
    return session.exchangeDeclare(declaration, timeout);
  }

  /**
   * Binds this exchange to the {@code source} exchange.
   */
  public AMQP.Exchange.BindOk bind(String source, String routingKey, Map<String, Object> arguments,
      Duration timeout) throws IOException {
    return session.exchangeBind(getName(), source, routingKey, arguments, timeout);
  }

  public AMQP.Exchange.UnbindOk unbind(String source, String routingKey,
      Map<String, Object> arguments, Duration timeout) throws IOException {
    return session.exchangeUnbind(getName(), source, routingKey, arguments, timeout);
  }

  @Override
  public void onReconnect(ChannelSession session) throws IOException {
    this.session = session;
    log.debug("Recovering {} via {}", this, session);
    declare(null);
  }

  @Override
  public String toString() {
    return "exchange-" + getName();
  }
}
