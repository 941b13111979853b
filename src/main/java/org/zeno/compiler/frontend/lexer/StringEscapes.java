package org.zeno.compiler.frontend.lexer;

/**
 * Interprets escape sequences in the raw text of a string literal.
 *
 * <p>Supported: {@code \n \t \r \\ \"}, the unicode escape with exactly four hex digits and
 * {@code \xXX} (exactly two hex digits). Anything else, including a malformed hex escape and a
 * trailing backslash, is kept verbatim.
 */
public final class StringEscapes {

    private StringEscapes() {}

    /**
     * Strips the surrounding quotes of a string token's text and processes its escapes.
     * @param tokenText The raw token text including both quotes.
     * @return The literal's value.
     */
    public static String unquote(String tokenText) {
        String body = tokenText;
        if (body.length() >= 2 && body.startsWith("\"") && body.endsWith("\"")) {
            body = body.substring(1, body.length() - 1);
        }
        return process(body);
    }

    /**
     * Processes escape sequences in a raw string body.
     * @param raw The text between the quotes.
     * @return The processed value.
     */
    public static String process(String raw) {
        StringBuilder out = new StringBuilder(raw.length());
        int i = 0;
        while (i < raw.length()) {
            char c = raw.charAt(i);
            if (c != '\\' || i + 1 >= raw.length()) {
                out.append(c);
                i++;
                continue;
            }
            char next = raw.charAt(i + 1);
            switch (next) {
                case 'n' -> { out.append('\n'); i += 2; }
                case 't' -> { out.append('\t'); i += 2; }
                case 'r' -> { out.append('\r'); i += 2; }
                case '\\' -> { out.append('\\'); i += 2; }
                case '"' -> { out.append('"'); i += 2; }
                case 'u' -> i = appendHex(raw, i, 4, out);
                case 'x' -> i = appendHex(raw, i, 2, out);
                default -> {
                    out.append('\\').append(next);
                    i += 2;
                }
            }
        }
        return out.toString();
    }

    private static int appendHex(String raw, int backslash, int digits, StringBuilder out) {
        int start = backslash + 2;
        int end = start + digits;
        if (end <= raw.length() && isHex(raw, start, end)) {
            out.append((char) Integer.parseInt(raw.substring(start, end), 16));
            return end;
        }
        out.append('\\').append(raw.charAt(backslash + 1));
        return backslash + 2;
    }

    private static boolean isHex(String s, int start, int end) {
        for (int i = start; i < end; i++) {
            if (Character.digit(s.charAt(i), 16) < 0) return false;
        }
        return true;
    }

    /**
     * Escapes a value for inclusion in a Java string literal, including the quotes.
     * @param value The string value.
     * @return A Java source literal.
     */
    public static String toJavaLiteral(String value) {
        StringBuilder sb = new StringBuilder(value.length() + 2).append('"');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '\n' -> sb.append("\\n");
                case '\t' -> sb.append("\\t");
                case '\r' -> sb.append("\\r");
                case '\\' -> sb.append("\\\\");
                case '"' -> sb.append("\\\"");
                default -> {
                    if (c < 0x20 || c > 0x7e) {
                        sb.append(String.format("\\u%04x", (int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        return sb.append('"').toString();
    }

    /**
     * Escapes a value back into Zeno string literal syntax, including the quotes.
     * @param value The string value.
     * @return A Zeno source literal.
     */
    public static String toZenoLiteral(String value) {
        StringBuilder sb = new StringBuilder(value.length() + 2).append('"');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '\n' -> sb.append("\\n");
                case '\t' -> sb.append("\\t");
                case '\r' -> sb.append("\\r");
                case '\\' -> sb.append("\\\\");
                case '"' -> sb.append("\\\"");
                default -> {
                    if (c < 0x20) {
                        sb.append(String.format("\\u%04x", (int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        return sb.append('"').toString();
    }
}
