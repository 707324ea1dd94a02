package com.amqpit.types;

import com.amqpit.errors.InteropTestException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import org.apache.qpid.proton.amqp.Binary;
import org.apache.qpid.proton.amqp.Decimal128;
import org.apache.qpid.proton.amqp.Decimal32;
import org.apache.qpid.proton.amqp.Decimal64;
import org.apache.qpid.proton.amqp.Symbol;
import org.apache.qpid.proton.amqp.UnsignedByte;
import org.apache.qpid.proton.amqp.UnsignedInteger;
import org.apache.qpid.proton.amqp.UnsignedLong;
import org.apache.qpid.proton.amqp.UnsignedShort;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * The AMQP 1.0 types a test run can declare.
 *
 * Each constant knows which proton-j class a decoded value of that type arrives as,
 * and how such a value is reported back to the test harness.
 */
public enum AmqpTypeName {

    NULL("null", null) {
        @Override
        public boolean matches(Object value) {
            return value == null;
        }

        @Override
        public JsonNode render(Object value) {
            return text("None");
        }
    },
    BOOLEAN("boolean", Boolean.class) {
        @Override
        public JsonNode render(Object value) {
            return text((Boolean) value ? "True" : "False");
        }
    },
    UBYTE("ubyte", UnsignedByte.class) {
        @Override
        public JsonNode render(Object value) {
            return text(HexStrings.toFixedWidthHex(((UnsignedByte) value).byteValue(), 1));
        }
    },
    USHORT("ushort", UnsignedShort.class) {
        @Override
        public JsonNode render(Object value) {
            return text(HexStrings.toFixedWidthHex(((UnsignedShort) value).shortValue(), 2));
        }
    },
    UINT("uint", UnsignedInteger.class) {
        @Override
        public JsonNode render(Object value) {
            return text(HexStrings.toFixedWidthHex(((UnsignedInteger) value).intValue(), 4));
        }
    },
    ULONG("ulong", UnsignedLong.class) {
        @Override
        public JsonNode render(Object value) {
            return text(HexStrings.toFixedWidthHex(((UnsignedLong) value).longValue(), 8));
        }
    },
    BYTE("byte", Byte.class) {
        @Override
        public JsonNode render(Object value) {
            return text(HexStrings.toFixedWidthHex((Byte) value, 1));
        }
    },
    SHORT("short", Short.class) {
        @Override
        public JsonNode render(Object value) {
            return text(HexStrings.toFixedWidthHex((Short) value, 2));
        }
    },
    INT("int", Integer.class) {
        @Override
        public JsonNode render(Object value) {
            return text(HexStrings.toFixedWidthHex((Integer) value, 4));
        }
    },
    LONG("long", Long.class) {
        @Override
        public JsonNode render(Object value) {
            return text(HexStrings.toFixedWidthHex((Long) value, 8));
        }
    },
    FLOAT("float", Float.class) {
        @Override
        public JsonNode render(Object value) {
            return text(HexStrings.toFixedWidthHex(Float.floatToRawIntBits((Float) value), 4));
        }
    },
    DOUBLE("double", Double.class) {
        @Override
        public JsonNode render(Object value) {
            return text(HexStrings.toFixedWidthHex(Double.doubleToRawLongBits((Double) value), 8));
        }
    },
    DECIMAL32("decimal32", Decimal32.class) {
        @Override
        public JsonNode render(Object value) {
            return text(HexStrings.toFixedWidthHex(((Decimal32) value).getBits(), 4));
        }
    },
    DECIMAL64("decimal64", Decimal64.class) {
        @Override
        public JsonNode render(Object value) {
            return text(HexStrings.toFixedWidthHex(((Decimal64) value).getBits(), 8));
        }
    },
    DECIMAL128("decimal128", Decimal128.class) {
        @Override
        public JsonNode render(Object value) {
            Decimal128 decimal = (Decimal128) value;
            byte[] bytes = ByteBuffer.allocate(16)
                    .putLong(decimal.getMostSignificantBits())
                    .putLong(decimal.getLeastSignificantBits())
                    .array();
            return text(HexStrings.toHex(bytes));
        }
    },
    CHAR("char", Character.class) {
        @Override
        public JsonNode render(Object value) {
            char c = (Character) value;
            if (c >= 0x20 && c < 0x7f) {
                return text(String.valueOf(c));
            }
            return text(Integer.toHexString(c));
        }
    },
    TIMESTAMP("timestamp", Date.class) {
        @Override
        public JsonNode render(Object value) {
            return text(HexStrings.toHex(((Date) value).getTime()));
        }
    },
    UUID("uuid", UUID.class) {
        @Override
        public JsonNode render(Object value) {
            return text(value.toString());
        }
    },
    BINARY("binary", Binary.class) {
        @Override
        public JsonNode render(Object value) {
            Binary binary = (Binary) value;
            return text(new String(binary.getArray(), binary.getArrayOffset(), binary.getLength(),
                    StandardCharsets.ISO_8859_1));
        }
    },
    STRING("string", String.class) {
        @Override
        public JsonNode render(Object value) {
            return text((String) value);
        }
    },
    SYMBOL("symbol", Symbol.class) {
        @Override
        public JsonNode render(Object value) {
            return text(value.toString());
        }
    },
    LIST("list", List.class) {
        @Override
        public JsonNode render(Object value) {
            return CompositeRenderer.renderList((List<?>) value);
        }
    },
    MAP("map", Map.class) {
        @Override
        public JsonNode render(Object value) {
            return CompositeRenderer.renderMap((Map<?, ?>) value);
        }
    },
    ARRAY("array", null) {
        @Override
        public boolean matches(Object value) {
            return value != null && value.getClass().isArray();
        }

        @Override
        public JsonNode render(Object value) {
            throw InteropTestException.unsupportedAmqpType(getName());
        }
    };

    private final String name;
    private final Class<?> javaType;

    AmqpTypeName(String name, Class<?> javaType) {
        this.name = name;
        this.javaType = javaType;
    }

    /**
     * The AMQP type name as given on the command line.
     */
    public String getName() {
        return name;
    }

    /**
     * Whether a value decoded by proton-j is of this AMQP type.
     */
    public boolean matches(Object value) {
        return javaType.isInstance(value);
    }

    /**
     * Reporting form of a value already known to match this type.
     */
    public abstract JsonNode render(Object value);

    /**
     * Resolves a declared type name.
     *
     * @throws InteropTestException UnknownAmqpTypeError when the name is not an AMQP type
     */
    public static AmqpTypeName fromName(String name) {
        for (AmqpTypeName type : values()) {
            if (type.name.equals(name)) {
                return type;
            }
        }
        throw InteropTestException.unknownAmqpType(name);
    }

    /**
     * The AMQP type of a decoded value, or null when proton-j produced something
     * outside this vocabulary (a described type, for instance).
     */
    public static AmqpTypeName of(Object value) {
        for (AmqpTypeName type : values()) {
            if (type.matches(value)) {
                return type;
            }
        }
        return null;
    }

    /**
     * Type name for diagnostics; falls back to the Java class for values outside the vocabulary.
     */
    public static String describe(Object value) {
        AmqpTypeName type = of(value);
        return type != null ? type.name : value.getClass().getName();
    }

    @Override
    public String toString() {
        return name;
    }

    private static JsonNode text(String value) {
        return JsonNodeFactory.instance.textNode(value);
    }
}
