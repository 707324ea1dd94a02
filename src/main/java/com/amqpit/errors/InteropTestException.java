package com.amqpit.errors;

/**
 * Failure raised while validating arguments or decoding received messages.
 * The {@link InteropErrorKind} identifies what went wrong; all kinds share this one class.
 */
public class InteropTestException extends RuntimeException {

    private final InteropErrorKind kind;

    public InteropTestException(InteropErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public InteropErrorKind getKind() {
        return kind;
    }

    public static InteropTestException argument(String message) {
        return new InteropTestException(InteropErrorKind.ARGUMENT_ERROR, message);
    }

    public static InteropTestException unknownAmqpType(String typeName) {
        return new InteropTestException(InteropErrorKind.UNKNOWN_AMQP_TYPE_ERROR,
                "Unknown AMQP type \"" + typeName + "\"");
    }

    public static InteropTestException unsupportedAmqpType(String typeName) {
        return new InteropTestException(InteropErrorKind.UNSUPPORTED_AMQP_TYPE_ERROR,
                "Unsupported AMQP type \"" + typeName + "\"");
    }

    public static InteropTestException incorrectMessageBodyType(String expected, String found) {
        return new InteropTestException(InteropErrorKind.INCORRECT_MESSAGE_BODY_TYPE_ERROR,
                "Incorrect AMQP type found in message body: expected: " + expected + "; found: " + found);
    }

    public static InteropTestException incorrectValueType(String found) {
        return new InteropTestException(InteropErrorKind.INCORRECT_VALUE_TYPE_ERROR,
                "Incorrect value type received: " + found);
    }

    @Override
    public String toString() {
        return kind.getLabel() + ": " + getMessage();
    }
}
