package com.amqpit.types;

/**
 * Hexadecimal text forms used when reporting received values.
 */
public final class HexStrings {

    private static final char[] DIGITS = "0123456789abcdef".toCharArray();

    private HexStrings() {
    }

    /**
     * Formats the low {@code byteWidth} bytes of {@code bits} as {@code 0x} followed by
     * exactly {@code 2 * byteWidth} lowercase hex digits. Negative values show their bit pattern.
     */
    public static String toFixedWidthHex(long bits, int byteWidth) {
        if (byteWidth < 1 || byteWidth > 8) {
            throw new IllegalArgumentException("byteWidth must be between 1 and 8 (was " + byteWidth + ")");
        }
        char[] out = new char[2 + byteWidth * 2];
        out[0] = '0';
        out[1] = 'x';
        for (int i = out.length - 1; i >= 2; i--) {
            out[i] = DIGITS[(int) (bits & 0xF)];
            bits >>>= 4;
        }
        return new String(out);
    }

    /**
     * Formats a byte sequence as {@code 0x} followed by two hex digits per byte, in order.
     */
    public static String toHex(byte[] bytes) {
        StringBuilder sb = new StringBuilder(2 + bytes.length * 2);
        sb.append("0x");
        for (byte b : bytes) {
            sb.append(DIGITS[(b >> 4) & 0xF]).append(DIGITS[b & 0xF]);
        }
        return sb.toString();
    }

    /**
     * {@code 0x} followed by the minimal lowercase hex form of {@code value}, unpadded.
     */
    public static String toHex(long value) {
        return "0x" + Long.toHexString(value);
    }
}
