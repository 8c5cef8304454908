package net.jodah.rechannel;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.Consumer;
import com.rabbitmq.client.ShutdownListener;

/**
 * The primitive operations of a channel, spoken directly to the broker over the current
 * connection. A session outlives its underlying channel handle: each {@link #open} replaces the
 * handle with one on the given connection.
 * 
 * <p>
 * Timeouts are passed through as given. A null timeout waits forever.
 */
public interface ChannelSession {
  /**
   * Opens a channel handle on the {@code connection}.
   * 
   * @param channelNumber the number to open the channel with, or {@code 0} to let the connection
   *          pick one
   * @param shutdownListener notified when the opened handle shuts down
   * @throws IOException if the channel cannot be opened
   */
  void open(Connection connection, int channelNumber, ShutdownListener shutdownListener)
      throws IOException;

  /**
   * Requests the current handle to close. Completion is reported to the handle's shutdown
   * listener. Does nothing if the handle is not open.
   */
  void close() throws IOException;

  /**
   * Drops the reference to the current handle.
   */
  void release();

  boolean isOpen();

  /**
   * Returns the number of the current handle, else {@code 0} if none has been opened.
   */
  int getChannelNumber();

  void basicQos(int prefetchCount, int prefetchSize, boolean global, Duration timeout)
      throws IOException;

  AMQP.Exchange.DeclareOk exchangeDeclare(ExchangeDeclaration declaration, Duration timeout)
      throws IOException;

  /**
   * @return the broker's reply, else null when {@code nowait} is set
   */
  AMQP.Exchange.DeleteOk exchangeDelete(String exchange, boolean ifUnused, boolean nowait,
      Duration timeout) throws IOException;

  AMQP.Exchange.BindOk exchangeBind(String destination, String source, String routingKey,
      Map<String, Object> arguments, Duration timeout) throws IOException;

  AMQP.Exchange.UnbindOk exchangeUnbind(String destination, String source, String routingKey,
      Map<String, Object> arguments, Duration timeout) throws IOException;

  AMQP.Queue.DeclareOk queueDeclare(QueueDeclaration declaration, Duration timeout)
      throws IOException;

  /**
   * @return the broker's reply, else null when {@code nowait} is set
   */
  AMQP.Queue.DeleteOk queueDelete(String queue, boolean ifUnused, boolean ifEmpty, boolean nowait,
      Duration timeout) throws IOException;

  AMQP.Queue.BindOk queueBind(String queue, String exchange, String routingKey,
      Map<String, Object> arguments, Duration timeout) throws IOException;

  AMQP.Queue.UnbindOk queueUnbind(String queue, String exchange, String routingKey,
      Map<String, Object> arguments, Duration timeout) throws IOException;

  /**
   * Starts the {@code consumer} on the {@code queue}.
   * 
   * @param consumerTag the tag to consume with, or an empty string to have the broker generate one
   * @return the consumer tag
   */
  String basicConsume(String queue, boolean autoAck, boolean exclusive, String consumerTag,
      Map<String, Object> arguments, Consumer consumer) throws IOException;

  void basicCancel(String consumerTag) throws IOException;
}
