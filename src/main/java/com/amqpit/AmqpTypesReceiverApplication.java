package com.amqpit;

import com.amqpit.config.ReceiverArguments;
import com.amqpit.config.ReceiverConfig;
import com.amqpit.receiver.AmqpTypesReceiverClient;
import com.amqpit.receiver.MessageDecoder;
import com.amqpit.receiver.TypesReceiver;
import com.amqpit.types.AmqpTypeName;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.Map;

/**
 * Receiver shim of the AMQP types interoperability test.
 *
 * Args: 1: Broker address (host:port)
 *       2: Queue name
 *       3: AMQP type
 *       4: Expected number of test values to receive
 *
 * Prints the AMQP type on one line and the received values as a JSON array on the next.
 */
public class AmqpTypesReceiverApplication {
    private static final Logger logger = LoggerFactory.getLogger(AmqpTypesReceiverApplication.class);

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.getenv()));
    }

    /**
     * Runs one receive session and returns the process exit code.
     */
    static int run(String[] args, PrintStream out, Map<String, String> env) {
        try {
            ReceiverArguments arguments = ReceiverArguments.parse(args);
            ReceiverConfig config = new ReceiverConfig(env);
            config.loadFromProperties(System.getProperties());
            logger.debug("Configuration: {}", config.toMap());

            AmqpTypeName amqpType = AmqpTypeName.fromName(arguments.getAmqpType());
            TypesReceiver typesReceiver = new TypesReceiver(new MessageDecoder(amqpType),
                    arguments.getExpectedCount());
            AmqpTypesReceiverClient client = new AmqpTypesReceiverClient(config,
                    arguments.getBrokerAddress(), arguments.getQueueName(), typesReceiver);

            ArrayNode receivedValues = client.run();

            out.println(arguments.getAmqpType());
            out.println(MAPPER.writeValueAsString(receivedValues));
            out.flush();
            return 0;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.error("AmqpReceiver error: interrupted");
            return 1;
        } catch (Exception e) {
            logger.error("AmqpReceiver error: {}", e.getMessage());
            logger.debug("Failure detail", e);
            return 1;
        }
    }
}
