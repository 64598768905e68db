package org.pragmatica.urlkit.path;

import java.nio.charset.StandardCharsets;

/**
 * Percent-encoding for a single path segment.
 *
 * <p>Letters, digits and {@code - _ . ~ $ & + : = @} are kept; every other byte of the
 * UTF-8 encoding becomes {@code %XX} with upper-case hex. In particular {@code /},
 * {@code ?}, {@code ;}, {@code ,} and spaces are always escaped, so a parameter value can
 * never introduce a new segment or start the query.
 */
public final class PathEscaper {
    private static final char[] HEX = "0123456789ABCDEF".toCharArray();

    private PathEscaper() {}

    public static String escapeSegment(String value) {
        var bytes = value.getBytes(StandardCharsets.UTF_8);
        var builder = new StringBuilder(bytes.length + 8);
        for (var b : bytes) {
            int c = b & 0xFF;
            if (isRetained(c)) {
                builder.append((char) c);
            } else {
                builder.append('%')
                       .append(HEX[c >> 4])
                       .append(HEX[c & 0x0F]);
            }
        }
        return builder.toString();
    }

    private static boolean isRetained(int c) {
        if ((c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9')) {
            return true;
        }
        return switch (c) {
            case '-', '_', '.', '~', '$', '&', '+', ':', '=', '@' -> true;
            default -> false;
        };
    }
}
