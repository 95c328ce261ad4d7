package com.raditha.luaforge.model;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Set;

/**
 * Decoding and quoting of Lua string literals. Lua strings are byte sequences;
 * source characters outside ASCII are stored as their UTF-8 encoding.
 */
public final class LuaStrings {

    private static final Set<String> KEYWORDS = Set.of(
            "and", "break", "do", "else", "elseif", "end", "false", "for", "function",
            "if", "in", "local", "nil", "not", "or", "repeat", "return", "then", "true",
            "until", "while");

    private LuaStrings() {
    }

    /**
     * Decode the raw text of a string token (quotes or long brackets included).
     */
    public static byte[] decode(String raw) {
        if (raw.startsWith("[")) {
            int level = raw.indexOf('[', 1) - 1;
            String content = raw.substring(level + 2, raw.length() - level - 2);
            if (content.startsWith("\r\n") || content.startsWith("\n\r")) {
                content = content.substring(2);
            } else if (content.startsWith("\n") || content.startsWith("\r")) {
                content = content.substring(1);
            }
            return content.getBytes(StandardCharsets.UTF_8);
        }
        return unescape(raw.substring(1, raw.length() - 1));
    }

    /**
     * Process the escape sequences of quoted string content.
     */
    public static byte[] unescape(String content) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        int i = 0;
        while (i < content.length()) {
            char c = content.charAt(i);
            if (c != '\\' || i + 1 >= content.length()) {
                int codePoint = content.codePointAt(i);
                writeUtf8(out, codePoint);
                i += Character.charCount(codePoint);
                continue;
            }
            char escaped = content.charAt(i + 1);
            i += 2;
            switch (escaped) {
                case 'a' -> out.write(7);
                case 'b' -> out.write(8);
                case 'f' -> out.write(12);
                case 'n' -> out.write('\n');
                case 'r' -> out.write('\r');
                case 't' -> out.write('\t');
                case 'v' -> out.write(11);
                case '\n' -> {
                    out.write('\n');
                    if (i < content.length() && content.charAt(i) == '\r') {
                        i++;
                    }
                }
                case '\r' -> {
                    out.write('\n');
                    if (i < content.length() && content.charAt(i) == '\n') {
                        i++;
                    }
                }
                case 'x' -> {
                    int end = Math.min(i + 2, content.length());
                    out.write(Integer.parseInt(content.substring(i, end), 16));
                    i = end;
                }
                case 'z' -> {
                    while (i < content.length() && Character.isWhitespace(content.charAt(i))) {
                        i++;
                    }
                }
                case 'u' -> {
                    int close = content.indexOf('}', i);
                    writeUtf8(out, Integer.parseInt(content.substring(i + 1, close), 16));
                    i = close + 1;
                }
                default -> {
                    if (escaped >= '0' && escaped <= '9') {
                        int start = i - 1;
                        int end = start + 1;
                        while (end < content.length() && end - start < 3 && Character.isDigit(content.charAt(end))) {
                            end++;
                        }
                        out.write(Integer.parseInt(content.substring(start, end)) & 0xFF);
                        i = end;
                    } else {
                        writeUtf8(out, escaped);
                    }
                }
            }
        }
        return out.toByteArray();
    }

    /**
     * Produce a quoted literal for the given bytes.
     */
    public static String quote(byte[] value) {
        boolean hasDouble = false;
        boolean hasSingle = false;
        for (byte b : value) {
            hasDouble |= b == '"';
            hasSingle |= b == '\'';
        }
        char quote = hasDouble && !hasSingle ? '\'' : '"';
        StringBuilder sb = new StringBuilder().append(quote);
        String text = isValidUtf8(value) ? new String(value, StandardCharsets.UTF_8) : null;
        if (text != null) {
            text.codePoints().forEach(codePoint -> appendEscaped(sb, codePoint, quote));
        } else {
            for (byte b : value) {
                int unsigned = b & 0xFF;
                appendEscaped(sb, unsigned >= 0x80 ? -unsigned : unsigned, quote);
            }
        }
        return sb.append(quote).toString();
    }

    private static void appendEscaped(StringBuilder sb, int codePoint, char quote) {
        if (codePoint < 0) {
            sb.append(String.format("\\%03d", -codePoint));
            return;
        }
        switch (codePoint) {
            case '\\' -> sb.append("\\\\");
            case '\n' -> sb.append("\\n");
            case '\r' -> sb.append("\\r");
            case '\t' -> sb.append("\\t");
            default -> {
                if (codePoint == quote) {
                    sb.append('\\').append(quote);
                } else if (codePoint < 0x20 || codePoint == 0x7F) {
                    sb.append(String.format("\\%03d", codePoint));
                } else {
                    sb.appendCodePoint(codePoint);
                }
            }
        }
    }

    public static boolean isValidUtf8(byte[] value) {
        try {
            StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(value));
            return true;
        } catch (CharacterCodingException e) {
            return false;
        }
    }

    /**
     * Whether the text can be written as a Lua name: ASCII letters, digits and
     * underscores, not starting with a digit and not a reserved word.
     */
    public static boolean isValidIdentifier(String text) {
        if (text.isEmpty() || KEYWORDS.contains(text)) {
            return false;
        }
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            boolean letter = (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
            boolean digit = c >= '0' && c <= '9';
            if (!letter && !(digit && i > 0)) {
                return false;
            }
        }
        return true;
    }

    public static boolean isKeyword(String text) {
        return KEYWORDS.contains(text);
    }

    private static void writeUtf8(ByteArrayOutputStream out, int codePoint) {
        byte[] bytes = new String(Character.toChars(codePoint)).getBytes(StandardCharsets.UTF_8);
        out.write(bytes, 0, bytes.length);
    }
}
