package com.amqpit.receiver;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import io.vertx.proton.ProtonConnection;
import io.vertx.proton.ProtonDelivery;
import io.vertx.proton.ProtonReceiver;
import org.apache.qpid.proton.message.Message;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Message handler of the receiving link.
 *
 * Decodes up to the expected number of messages, then closes the link and the connection.
 * Deliveries still in flight once the link is closed, after the bound or after a decoding
 * failure, are counted but not decoded.
 * Called only from the connection's event loop, so the counter and result list are unsynchronized.
 */
public class TypesReceiver {

    private static final Logger log = LoggerFactory.getLogger(TypesReceiver.class);

    private final MessageDecoder decoder;
    private final long expected;
    private final ArrayNode receivedValues = JsonNodeFactory.instance.arrayNode();
    private long received;
    private boolean closed;

    private ProtonReceiver receiver;
    private ProtonConnection connection;

    public TypesReceiver(MessageDecoder decoder, long expected) {
        this.decoder = decoder;
        this.expected = expected;
    }

    /**
     * Binds the link and connection closed once the expected count is reached. When nothing is
     * expected they are closed right away.
     */
    public void attach(ProtonReceiver receiver, ProtonConnection connection) {
        this.receiver = receiver;
        this.connection = connection;
        if (received >= expected) {
            log.debug("Expected count {} already reached on attach", expected);
            close();
        }
    }

    public void onMessage(ProtonDelivery delivery, Message message) {
        try {
            if (received < expected && !closed) {
                receivedValues.add(decoder.decode(message));
            } else {
                log.debug("Ignoring delivery {} after the link was closed", received + 1);
            }
            received++;
            if (received >= expected) {
                close();
            }
        } catch (RuntimeException e) {
            close();
            throw e;
        }
    }

    private void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (receiver != null) {
            receiver.close();
        }
        if (connection != null) {
            connection.close();
        }
    }

    public long getReceived() {
        return received;
    }

    public long getExpected() {
        return expected;
    }

    /**
     * Rendered values in receipt order.
     */
    public ArrayNode getReceivedValues() {
        return receivedValues;
    }
}
