package com.amqpit.receiver;

import com.amqpit.config.BrokerAddress;
import com.amqpit.config.ReceiverConfig;
import com.fasterxml.jackson.databind.node.ArrayNode;
import io.vertx.core.Vertx;
import io.vertx.proton.ProtonClient;
import io.vertx.proton.ProtonConnection;
import io.vertx.proton.ProtonReceiver;
import io.vertx.proton.ProtonSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Connects to the broker, attaches a receiving link to the queue and feeds deliveries to a
 * {@link TypesReceiver} until the connection is closed.
 *
 * All link callbacks run on the connection's event loop; the calling thread only waits.
 */
public class AmqpTypesReceiverClient {

    private static final Logger log = LoggerFactory.getLogger(AmqpTypesReceiverClient.class);

    private final Vertx vertx;
    private final boolean ownsVertx;
    private final ReceiverConfig config;
    private final BrokerAddress address;
    private final String queueName;
    private final TypesReceiver typesReceiver;
    private final ReceiverErrorReporter errorReporter;

    public AmqpTypesReceiverClient(ReceiverConfig config, BrokerAddress address, String queueName,
                                   TypesReceiver typesReceiver) {
        this(Vertx.vertx(), true, config, address, queueName, typesReceiver, new ReceiverErrorReporter());
    }

    /**
     * Uses a caller-owned {@link Vertx}, which is left open after {@link #run()}.
     */
    public AmqpTypesReceiverClient(Vertx vertx, ReceiverConfig config, BrokerAddress address, String queueName,
                                   TypesReceiver typesReceiver, ReceiverErrorReporter errorReporter) {
        this(vertx, false, config, address, queueName, typesReceiver, errorReporter);
    }

    private AmqpTypesReceiverClient(Vertx vertx, boolean ownsVertx, ReceiverConfig config, BrokerAddress address,
                                    String queueName, TypesReceiver typesReceiver,
                                    ReceiverErrorReporter errorReporter) {
        this.vertx = vertx;
        this.ownsVertx = ownsVertx;
        this.config = config;
        this.address = address;
        this.queueName = queueName;
        this.typesReceiver = typesReceiver;
        this.errorReporter = errorReporter;
    }

    /**
     * Runs until the connection is closed or lost.
     *
     * @return the rendered values received, in order
     * @throws RuntimeException the decoding failure that aborted the session, if any
     */
    public ArrayNode run() throws InterruptedException {
        CountDownLatch done = new CountDownLatch(1);
        AtomicReference<RuntimeException> failure = new AtomicReference<>();
        AtomicBoolean remotelyClosed = new AtomicBoolean(false);

        log.info("Connecting to {} to receive {} message(s) from {}", address, typesReceiver.getExpected(), queueName);

        try {
            ProtonClient client = ProtonClient.create(vertx);
            client.connect(config.toClientOptions(address), address.getHost(), address.getPort(),
                    address.getUsername(), address.getPassword(), res -> {
                if (res.failed()) {
                    errorReporter.transportError(res.cause() != null ? res.cause().getMessage() : "connect failed");
                    done.countDown();
                    return;
                }
                ProtonConnection conn = res.result();
                conn.setContainer(config.getContainerId());
                conn.openHandler(openRes -> {
                    if (openRes.succeeded()) {
                        log.debug("Connection to {} opened", address);
                        openReceiver(conn, failure);
                    } else {
                        errorReporter.connectionError(openRes.cause() != null
                                ? openRes.cause().getMessage() : "connection open failed");
                    }
                });
                conn.closeHandler(closeRes -> {
                    remotelyClosed.set(true);
                    Object error = ReceiverErrorReporter.describe(closeRes, conn.getRemoteCondition());
                    if (error != null) {
                        errorReporter.connectionError(error);
                    }
                    conn.close();
                    conn.disconnect();
                    done.countDown();
                });
                conn.disconnectHandler(c -> {
                    if (!remotelyClosed.get()) {
                        errorReporter.transportError("connection to " + address + " lost");
                    }
                    done.countDown();
                });
                conn.open();
            });

            done.await();
        } finally {
            if (ownsVertx) {
                vertx.close();
            }
        }

        if (failure.get() != null) {
            throw failure.get();
        }
        log.info("Received {} message(s) from {}", typesReceiver.getReceived(), queueName);
        return typesReceiver.getReceivedValues();
    }

    private void openReceiver(ProtonConnection conn, AtomicReference<RuntimeException> failure) {
        ProtonSession session = conn.createSession();
        session.closeHandler(res -> {
            Object error = ReceiverErrorReporter.describe(res, session.getRemoteCondition());
            if (error != null) {
                errorReporter.sessionError(error);
            }
        });
        session.open();

        ProtonReceiver receiver = session.createReceiver(queueName);
        receiver.setPrefetch(config.getPrefetch());
        receiver.handler((delivery, message) -> {
            try {
                typesReceiver.onMessage(delivery, message);
            } catch (RuntimeException e) {
                log.debug("Decoding failed, closing link to {}", queueName, e);
                failure.compareAndSet(null, e);
            }
        });
        receiver.openHandler(res -> {
            if (res.succeeded()) {
                log.debug("Receiver attached to {}", queueName);
                if (config.getPrefetch() == 0 && typesReceiver.getExpected() > 0) {
                    receiver.flow((int) Math.min(typesReceiver.getExpected(), Integer.MAX_VALUE));
                }
                typesReceiver.attach(receiver, conn);
            } else {
                errorReporter.receiverError(res.cause() != null ? res.cause().getMessage() : "attach failed");
            }
        });
        receiver.closeHandler(res -> {
            Object error = ReceiverErrorReporter.describe(res, receiver.getRemoteCondition());
            if (error != null) {
                errorReporter.receiverError(error);
            }
            // a link the peer has closed delivers nothing more
            conn.close();
        });
        receiver.open();
    }
}
