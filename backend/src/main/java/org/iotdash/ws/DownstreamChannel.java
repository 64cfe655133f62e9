package org.iotdash.ws;

/**
 * Outbound side of one downstream connection. {@link #send} must not block the
 * caller waiting for the peer.
 */
public interface DownstreamChannel {

    String id();

    boolean isOpen();

    void send(String text);
}
