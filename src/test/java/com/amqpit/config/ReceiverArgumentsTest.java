package com.amqpit.config;

import com.amqpit.errors.InteropErrorKind;
import com.amqpit.errors.InteropTestException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@DisplayName("Receiver Arguments Tests")
class ReceiverArgumentsTest {

    @Nested
    @DisplayName("Positional Argument Tests")
    class PositionalTests {

        @Test
        @DisplayName("Four arguments are parsed in order")
        void testParse() {
            ReceiverArguments args = ReceiverArguments.parse(
                    new String[]{"localhost:5672", "jms.queue.qpid-interop", "int", "3"});

            assertThat(args.getBrokerAddress().getHost()).isEqualTo("localhost");
            assertThat(args.getQueueName()).isEqualTo("jms.queue.qpid-interop");
            assertThat(args.getAmqpType()).isEqualTo("int");
            assertThat(args.getExpectedCount()).isEqualTo(3);
        }

        @Test
        @DisplayName("Wrong argument count fails with ArgumentError")
        void testWrongCount() {
            assertThatThrownBy(() -> ReceiverArguments.parse(new String[]{"localhost:5672", "q", "int"}))
                    .isInstanceOf(InteropTestException.class)
                    .hasMessage("Incorrect number of arguments")
                    .satisfies(e -> assertThat(((InteropTestException) e).getKind())
                            .isEqualTo(InteropErrorKind.ARGUMENT_ERROR));
            assertThatThrownBy(() -> ReceiverArguments.parse(new String[]{"a", "b", "c", "1", "e"}))
                    .isInstanceOf(InteropTestException.class);
            assertThatThrownBy(() -> ReceiverArguments.parse(new String[0]))
                    .isInstanceOf(InteropTestException.class);
        }

        @Test
        @DisplayName("Type name is not validated while parsing arguments")
        void testTypeNameKeptVerbatim() {
            ReceiverArguments args = ReceiverArguments.parse(new String[]{"h:1", "q", "no-such-type", "1"});

            assertThat(args.getAmqpType()).isEqualTo("no-such-type");
        }
    }

    @Nested
    @DisplayName("Expected Count Parsing Tests")
    class CountParsingTests {

        @Test
        @DisplayName("Decimal, hex and octal forms")
        void testBases() {
            assertThat(ReceiverArguments.parseCount("42")).isEqualTo(42);
            assertThat(ReceiverArguments.parseCount("0x1f")).isEqualTo(31);
            assertThat(ReceiverArguments.parseCount("0X10")).isEqualTo(16);
            assertThat(ReceiverArguments.parseCount("010")).isEqualTo(8);
            assertThat(ReceiverArguments.parseCount("0")).isEqualTo(0);
        }

        @Test
        @DisplayName("Leading whitespace and sign, trailing garbage ignored")
        void testLenient() {
            assertThat(ReceiverArguments.parseCount("  7")).isEqualTo(7);
            assertThat(ReceiverArguments.parseCount("+5")).isEqualTo(5);
            assertThat(ReceiverArguments.parseCount("12abc")).isEqualTo(12);
            assertThat(ReceiverArguments.parseCount("09")).isEqualTo(0);
            assertThat(ReceiverArguments.parseCount("0x")).isEqualTo(0);
        }

        @Test
        @DisplayName("No digits yields zero")
        void testNoDigits() {
            assertThat(ReceiverArguments.parseCount("")).isEqualTo(0);
            assertThat(ReceiverArguments.parseCount("abc")).isEqualTo(0);
        }

        @Test
        @DisplayName("Negative and oversized values wrap to 32 bits")
        void testWrap() {
            assertThat(ReceiverArguments.parseCount("-1")).isEqualTo(0xFFFFFFFFL);
            assertThat(ReceiverArguments.parseCount("4294967295")).isEqualTo(0xFFFFFFFFL);
            assertThat(ReceiverArguments.parseCount("4294967296")).isEqualTo(0);
            assertThat(ReceiverArguments.parseCount("4294967297")).isEqualTo(1);
            assertThat(ReceiverArguments.parseCount("0x100000005")).isEqualTo(5);
        }

        @Test
        @DisplayName("Values beyond 64 bits saturate before narrowing")
        void testSaturate() {
            assertThat(ReceiverArguments.parseCount("18446744073709551615")).isEqualTo(0xFFFFFFFFL);
            assertThat(ReceiverArguments.parseCount("18446744073709551616")).isEqualTo(0xFFFFFFFFL);
            assertThat(ReceiverArguments.parseCount("99999999999999999999999")).isEqualTo(0xFFFFFFFFL);
        }
    }
}
