package io.healing.util;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Minimal JSON codec for flat string maps. Keys and values must be strings; {@code null}
 * values are dropped on decode.
 */
final class DefaultPayloadCodec implements PayloadCodec {
    static final DefaultPayloadCodec INSTANCE = new DefaultPayloadCodec();

    private DefaultPayloadCodec() {
    }

    @Override
    public String encode(Map<String, String> data) {
        if (data == null || data.isEmpty()) {
            return "{}";
        }
        StringBuilder out = new StringBuilder("{");
        String separator = "";
        for (Map.Entry<String, String> entry : data.entrySet()) {
            if (entry.getKey() == null) {
                throw new IllegalArgumentException("job data cannot contain null keys");
            }
            out.append(separator);
            appendQuoted(out, entry.getKey());
            out.append(':');
            if (entry.getValue() == null) {
                out.append("null");
            } else {
                appendQuoted(out, entry.getValue());
            }
            separator = ",";
        }
        return out.append('}').toString();
    }

    @Override
    public Map<String, String> decode(String json) {
        if (json == null || json.isBlank() || "null".equals(json.trim())) {
            return Collections.emptyMap();
        }
        Cursor cursor = new Cursor(json.trim());
        cursor.expect('{');
        Map<String, String> data = new LinkedHashMap<>();
        if (cursor.tryConsume('}')) {
            return data;
        }
        do {
            String key = cursor.readString();
            cursor.expect(':');
            if (cursor.tryConsumeLiteral("null")) {
                continue;
            }
            data.put(key, cursor.readString());
        } while (cursor.tryConsume(','));
        cursor.expect('}');
        if (!cursor.atEnd()) {
            throw new IllegalArgumentException("Trailing content after JSON object");
        }
        return data;
    }

    private static void appendQuoted(StringBuilder out, String value) {
        out.append('"');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '"' -> out.append("\\\"");
                case '\\' -> out.append("\\\\");
                case '\n' -> out.append("\\n");
                case '\r' -> out.append("\\r");
                case '\t' -> out.append("\\t");
                case '\b' -> out.append("\\b");
                case '\f' -> out.append("\\f");
                default -> {
                    if (c < 0x20) {
                        out.append(String.format("\\u%04x", (int) c));
                    } else {
                        out.append(c);
                    }
                }
            }
        }
        out.append('"');
    }

    private static final class Cursor {
        private final String text;
        private int pos;

        Cursor(String text) {
            this.text = text;
        }

        boolean atEnd() {
            skipWhitespace();
            return pos >= text.length();
        }

        void expect(char expected) {
            if (!tryConsume(expected)) {
                throw new IllegalArgumentException("Expected '" + expected + "' at position " + pos);
            }
        }

        boolean tryConsume(char expected) {
            skipWhitespace();
            if (pos < text.length() && text.charAt(pos) == expected) {
                pos++;
                return true;
            }
            return false;
        }

        boolean tryConsumeLiteral(String literal) {
            skipWhitespace();
            if (text.startsWith(literal, pos)) {
                pos += literal.length();
                return true;
            }
            return false;
        }

        String readString() {
            expect('"');
            StringBuilder value = new StringBuilder();
            while (pos < text.length()) {
                char c = text.charAt(pos++);
                if (c == '"') {
                    return value.toString();
                }
                if (c != '\\') {
                    value.append(c);
                    continue;
                }
                if (pos >= text.length()) {
                    throw new IllegalArgumentException("Invalid escape sequence");
                }
                char escaped = text.charAt(pos++);
                switch (escaped) {
                    case '"', '\\', '/' -> value.append(escaped);
                    case 'n' -> value.append('\n');
                    case 'r' -> value.append('\r');
                    case 't' -> value.append('\t');
                    case 'b' -> value.append('\b');
                    case 'f' -> value.append('\f');
                    case 'u' -> value.append(readUnicode());
                    default -> throw new IllegalArgumentException("Unsupported escape sequence: \\" + escaped);
                }
            }
            throw new IllegalArgumentException("Unterminated string");
        }

        private char readUnicode() {
            if (pos + 4 > text.length()) {
                throw new IllegalArgumentException("Invalid unicode escape");
            }
            String hex = text.substring(pos, pos + 4);
            pos += 4;
            try {
                return (char) Integer.parseInt(hex, 16);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid unicode escape", e);
            }
        }

        private void skipWhitespace() {
            while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) {
                pos++;
            }
        }
    }
}
