package com.amqpit.errors;

/**
 * Closed set of failures the types receiver can raise.
 */
public enum InteropErrorKind {
    ARGUMENT_ERROR("ArgumentError"),
    UNKNOWN_AMQP_TYPE_ERROR("UnknownAmqpTypeError"),
    UNSUPPORTED_AMQP_TYPE_ERROR("UnsupportedAmqpTypeError"),
    INCORRECT_MESSAGE_BODY_TYPE_ERROR("IncorrectMessageBodyTypeError"),
    INCORRECT_VALUE_TYPE_ERROR("IncorrectValueTypeError");

    private final String label;

    InteropErrorKind(String label) {
        this.label = label;
    }

    /**
     * Name reported to the test harness, e.g. {@code IncorrectValueTypeError}.
     */
    public String getLabel() {
        return label;
    }
}
