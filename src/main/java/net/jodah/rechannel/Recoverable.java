package net.jodah.rechannel;

import java.io.IOException;

/**
 * An entity that can re-assert itself against a freshly opened channel session.
 */
public interface Recoverable {
  /**
   * Re-issues the entity's declaration, and anything registered through it, against the
   * {@code session}. Called once per reconnect after the session has been opened and its QoS
   * reapplied.
   * 
   * @throws IOException if the broker rejects the re-declaration, failing the reconnect
   */
  void onReconnect(ChannelSession session) throws IOException;
}
