package com.amqpit.receiver;

import com.amqpit.errors.InteropTestException;
import com.amqpit.types.AmqpTypeName;
import com.fasterxml.jackson.databind.JsonNode;
import org.apache.qpid.proton.amqp.messaging.AmqpSequence;
import org.apache.qpid.proton.amqp.messaging.AmqpValue;
import org.apache.qpid.proton.amqp.messaging.Data;
import org.apache.qpid.proton.amqp.messaging.Section;
import org.apache.qpid.proton.message.Message;

/**
 * Checks that a received message body has the declared AMQP type and renders it.
 */
public class MessageDecoder {

    private final AmqpTypeName expectedType;

    /**
     * @throws InteropTestException UnsupportedAmqpTypeError when {@code expectedType} is {@code array}
     */
    public MessageDecoder(AmqpTypeName expectedType) {
        if (expectedType == AmqpTypeName.ARRAY) {
            throw InteropTestException.unsupportedAmqpType(expectedType.getName());
        }
        this.expectedType = expectedType;
    }

    public AmqpTypeName getExpectedType() {
        return expectedType;
    }

    /**
     * @throws InteropTestException IncorrectMessageBodyTypeError when the body type differs from the
     *         declared type, IncorrectValueTypeError when a list or map holds an unsupported member
     */
    public JsonNode decode(Message message) {
        Object value = bodyValue(message.getBody());
        if (!expectedType.matches(value)) {
            throw InteropTestException.incorrectMessageBodyType(expectedType.getName(), AmqpTypeName.describe(value));
        }
        return expectedType.render(value);
    }

    /**
     * Value carried by a body section. A data section is a binary, a sequence section a list.
     */
    static Object bodyValue(Section body) {
        if (body == null) {
            return null;
        }
        if (body instanceof AmqpValue) {
            return ((AmqpValue) body).getValue();
        }
        if (body instanceof Data) {
            return ((Data) body).getValue();
        }
        if (body instanceof AmqpSequence) {
            return ((AmqpSequence) body).getValue();
        }
        return body;
    }
}
