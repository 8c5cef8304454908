package net.jodah.rechannel;

/**
 * {@link EntityFactory} implementations.
 */
public final class EntityFactories {
  private static final EntityFactory PLAIN = new EntityFactory() {
    @Override
    public Exchange newExchange(ChannelSession session, ExchangeDeclaration declaration) {
      return new Exchange(session, declaration);
    }

    @Override
    public Queue newQueue(ChannelSession session, QueueDeclaration declaration) {
      return new Queue(session, declaration);
    }
  };

  private static final EntityFactory ROBUST = new EntityFactory() {
    @Override
    public Exchange newExchange(ChannelSession session, ExchangeDeclaration declaration) {
      return new RobustExchange(session, declaration);
    }

    @Override
    public Queue newQueue(ChannelSession session, QueueDeclaration declaration) {
      return new RobustQueue(session, declaration);
    }
  };

  private EntityFactories() {
  }

  /**
   * Returns a factory whose entities only re-declare themselves on reconnect.
   */
  public static EntityFactory plain() {
    return PLAIN;
  }

  /**
   * Returns a factory whose entities also recover their bindings and, for queues, their consumers.
   */
  public static EntityFactory robust() {
    return ROBUST;
  }
}
