package com.amqpit.receiver;

import io.vertx.core.AsyncResult;
import org.apache.qpid.proton.amqp.transport.ErrorCondition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes failures reported by the AMQP engine to the diagnostic log. Reporting never changes control flow.
 */
public class ReceiverErrorReporter {

    private static final Logger log = LoggerFactory.getLogger(ReceiverErrorReporter.class);

    public void connectionError(Object detail) {
        log.error("AmqpReceiver connection error: {}", detail);
    }

    public void sessionError(Object detail) {
        log.error("AmqpReceiver session error: {}", detail);
    }

    public void receiverError(Object detail) {
        log.error("AmqpReceiver receiver error: {}", detail);
    }

    public void transportError(Object detail) {
        log.error("AmqpReceiver transport error: {}", detail);
    }

    /**
     * Error text of a failed close result, preferring the remote error condition when one was sent.
     * Returns null when the close carried no error.
     */
    static Object describe(AsyncResult<?> result, ErrorCondition remoteCondition) {
        if (remoteCondition != null && remoteCondition.getCondition() != null) {
            return remoteCondition.getDescription() != null
                    ? remoteCondition.getCondition() + ": " + remoteCondition.getDescription()
                    : remoteCondition.getCondition();
        }
        if (result.failed()) {
            return result.cause() != null ? result.cause().getMessage() : "unknown error";
        }
        return null;
    }
}
