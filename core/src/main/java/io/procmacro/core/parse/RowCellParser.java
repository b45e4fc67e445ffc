package io.procmacro.core.parse;

import io.procmacro.core.error.DirectiveParseException;
import io.procmacro.core.model.Row;
import io.procmacro.core.model.Value;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Parses the {@code key=value ...} cells of a {@code @ROW} directive into a typed {@link Row}.
 *
 * <p>Cell values are typed once, here, and never re-inferred at use sites:
 * <ul>
 * <li>{@code "..."} or {@code '...'} → {@link Value.Str} (may contain spaces, {@code \"} escapes)
 * <li>{@code 42}, {@code -3} → {@link Value.Int}
 * <li>{@code 1.5}, {@code -0.25} → {@link Value.Real}
 * <li>{@code true} / {@code false} (any case) → {@link Value.Bool}
 * <li>any other bare token, e.g. {@code CH1} → {@link Value.Ident}
 * </ul>
 *
 * <p>Thread-safe and stateless: all methods are static.
 */
public final class RowCellParser {

    private static final Pattern KEY = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final Pattern INTEGER = Pattern.compile("-?\\d+");
    private static final Pattern DECIMAL = Pattern.compile("-?\\d+\\.\\d+");

    private RowCellParser() {}

    /**
     * Parses the cell text following {@code @ROW NAME}.
     *
     * @param cells cell text, may be empty for a row without cells
     * @param line  authored line, for error reporting
     * @throws DirectiveParseException on a malformed cell, an empty value or a repeated key
     */
    public static Row parse(String cells, int line) {
        Map<String, Value> values = new LinkedHashMap<>();
        int pos = 0;
        int length = cells.length();
        while (true) {
            while (pos < length && Character.isWhitespace(cells.charAt(pos))) {
                pos++;
            }
            if (pos >= length) {
                return new Row(values);
            }
            int eq = cells.indexOf('=', pos);
            int nextSpace = indexOfWhitespace(cells, pos);
            if (eq < 0 || (nextSpace >= 0 && nextSpace < eq)) {
                String token = cells.substring(pos, nextSpace < 0 ? length : nextSpace);
                throw new DirectiveParseException("row cell '" + token + "' is not of the form key=value", line);
            }
            String key = cells.substring(pos, eq);
            if (!KEY.matcher(key).matches()) {
                throw new DirectiveParseException("invalid row key '" + key + "'", line);
            }
            pos = eq + 1;
            Value value;
            if (pos < length && (cells.charAt(pos) == '"' || cells.charAt(pos) == '\'')) {
                char quote = cells.charAt(pos);
                StringBuilder sb = new StringBuilder();
                pos++;
                boolean closed = false;
                while (pos < length) {
                    char c = cells.charAt(pos++);
                    if (c == '\\' && pos < length) {
                        sb.append(cells.charAt(pos++));
                    } else if (c == quote) {
                        closed = true;
                        break;
                    } else {
                        sb.append(c);
                    }
                }
                if (!closed) {
                    throw new DirectiveParseException("unterminated quoted value for row key '" + key + "'", line);
                }
                if (pos < length && !Character.isWhitespace(cells.charAt(pos))) {
                    throw new DirectiveParseException(
                            "unexpected text after quoted value for row key '" + key + "'", line);
                }
                value = new Value.Str(sb.toString());
            } else {
                int end = indexOfWhitespace(cells, pos);
                String raw = cells.substring(pos, end < 0 ? length : end);
                pos = end < 0 ? length : end;
                if (raw.isEmpty()) {
                    throw new DirectiveParseException("empty value for row key '" + key + "'", line);
                }
                value = typeBareValue(raw, key, line);
            }
            if (values.putIfAbsent(key, value) != null) {
                throw new DirectiveParseException("row key '" + key + "' appears more than once", line);
            }
        }
    }

    private static Value typeBareValue(String raw, String key, int line) {
        if (INTEGER.matcher(raw).matches()) {
            try {
                return new Value.Int(Long.parseLong(raw));
            } catch (NumberFormatException e) {
                throw new DirectiveParseException("integer value for row key '" + key + "' is out of range", line);
            }
        }
        if (DECIMAL.matcher(raw).matches()) {
            return new Value.Real(Double.parseDouble(raw));
        }
        String lower = raw.toLowerCase(Locale.ROOT);
        if (lower.equals("true") || lower.equals("false")) {
            return Value.of(Boolean.parseBoolean(lower));
        }
        return new Value.Ident(raw);
    }

    private static int indexOfWhitespace(String s, int from) {
        for (int i = from; i < s.length(); i++) {
            if (Character.isWhitespace(s.charAt(i))) {
                return i;
            }
        }
        return -1;
    }
}
