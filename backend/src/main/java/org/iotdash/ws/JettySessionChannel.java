package org.iotdash.ws;

import org.eclipse.jetty.websocket.api.Session;
import org.eclipse.jetty.websocket.api.WriteCallback;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link DownstreamChannel} over a Jetty WebSocket session. Sends are asynchronous;
 * failures are logged and otherwise dropped.
 */
public class JettySessionChannel implements DownstreamChannel {
    private static final Logger logger = LoggerFactory.getLogger(JettySessionChannel.class);
    private static final AtomicLong SEQUENCE = new AtomicLong();

    private final Session session;
    private final String id;

    public JettySessionChannel(Session session) {
        this.session = session;
        this.id = "ws-" + SEQUENCE.incrementAndGet();
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public boolean isOpen() {
        return session.isOpen();
    }

    @Override
    public void send(String text) {
        session.getRemote().sendString(text, new WriteCallback() {
            @Override
            public void writeFailed(Throwable x) {
                logger.debug("Send to {} failed: {}", id, x.getMessage());
            }

            @Override
            public void writeSuccess() {
                // nothing to do
            }
        });
    }

    @Override
    public String toString() {
        return id + "[" + session.getRemoteAddress() + "]";
    }
}
