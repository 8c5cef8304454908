package net.jodah.rechannel.internal.util;

import java.io.IOException;

import com.rabbitmq.client.AlreadyClosedException;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ShutdownSignalException;

public final class Exceptions {
  private Exceptions() {}

  /**
   * Reliably returns whether the shutdown signal represents a connection closure.
   */
  public static boolean isConnectionClosure(ShutdownSignalException e) {
    return e instanceof AlreadyClosedException ? e.getReference() instanceof Connection : e
        .isHardError();
  }

  /**
   * Returns the {@code failure} of an asynchronous broker operation as an {@code IOException}, the
   * way the RabbitMQ client reports failures of its blocking calls. Errors are rethrown as is.
   */
  public static IOException toIOException(Throwable failure) {
    if (failure instanceof IOException)
      return (IOException) failure;
    if (failure instanceof Error)
      throw (Error) failure;
    return new IOException(failure);
  }
}
