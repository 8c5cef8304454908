package net.jodah.rechannel;

import java.io.IOException;

/**
 * Thrown when the connection an operation was issued on has been replaced before the operation
 * completed. The broker-side outcome of the operation is unknown and should be assumed not to have
 * happened.
 */
public class ConnectionLostException extends IOException {
  private static final long serialVersionUID = 2412739563287745630L;

  public ConnectionLostException(String message) {
    super(message);
  }
}
