package com.amqpit.config;

import com.amqpit.errors.InteropTestException;

/**
 * Positional command line arguments of the receiver:
 * broker address, queue name, AMQP type name and expected message count.
 */
public class ReceiverArguments {

    private static final int ARGUMENT_COUNT = 4;

    private final BrokerAddress brokerAddress;
    private final String queueName;
    private final String amqpType;
    private final long expectedCount;

    public ReceiverArguments(BrokerAddress brokerAddress, String queueName, String amqpType, long expectedCount) {
        this.brokerAddress = brokerAddress;
        this.queueName = queueName;
        this.amqpType = amqpType;
        this.expectedCount = expectedCount;
    }

    public static ReceiverArguments parse(String[] args) {
        if (args == null || args.length != ARGUMENT_COUNT) {
            throw InteropTestException.argument("Incorrect number of arguments");
        }
        return new ReceiverArguments(BrokerAddress.parse(args[0]), args[1], args[2], parseCount(args[3]));
    }

    /**
     * Lenient unsigned parse of the expected count.
     *
     * Leading whitespace and a sign are allowed, {@code 0x} selects hex and a leading
     * {@code 0} octal. Parsing stops at the first character that is not a digit of the
     * base; no digits at all yields 0. The result wraps to an unsigned 32-bit value.
     */
    public static long parseCount(String text) {
        int i = 0;
        int len = text.length();
        while (i < len && Character.isWhitespace(text.charAt(i))) {
            i++;
        }
        boolean negative = false;
        if (i < len && (text.charAt(i) == '+' || text.charAt(i) == '-')) {
            negative = text.charAt(i) == '-';
            i++;
        }

        int radix = 10;
        if (i + 1 < len && text.charAt(i) == '0'
                && (text.charAt(i + 1) == 'x' || text.charAt(i + 1) == 'X')
                && i + 2 < len && Character.digit(text.charAt(i + 2), 16) >= 0) {
            radix = 16;
            i += 2;
        } else if (i < len && text.charAt(i) == '0') {
            radix = 8;
        }

        long value = 0;
        boolean overflow = false;
        for (; i < len; i++) {
            int digit = Character.digit(text.charAt(i), radix);
            if (digit < 0) {
                break;
            }
            if (!overflow) {
                // unsigned 64-bit accumulation, saturating like strtoul
                overflow = Long.compareUnsigned(value, Long.divideUnsigned(-1L - digit, radix)) > 0;
                value = value * radix + digit;
            }
        }
        if (overflow) {
            return 0xFFFFFFFFL;
        }
        return (negative ? -value : value) & 0xFFFFFFFFL;
    }

    public BrokerAddress getBrokerAddress() {
        return brokerAddress;
    }

    public String getQueueName() {
        return queueName;
    }

    public String getAmqpType() {
        return amqpType;
    }

    public long getExpectedCount() {
        return expectedCount;
    }
}
