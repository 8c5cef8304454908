package net.jodah.rechannel;

/**
 * Creates the exchanges and queues a {@link RobustChannel} declares, selecting which variant of
 * each is used.
 * 
 * @see EntityFactories
 */
public interface EntityFactory {
  Exchange newExchange(ChannelSession session, ExchangeDeclaration declaration);

  Queue newQueue(ChannelSession session, QueueDeclaration declaration);
}
