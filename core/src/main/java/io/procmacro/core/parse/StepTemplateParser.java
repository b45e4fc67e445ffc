package io.procmacro.core.parse;

import io.procmacro.core.error.DirectiveParseException;
import io.procmacro.core.model.StepTemplate;
import java.util.ArrayList;
import java.util.List;

/**
 * Splits a literal step line into text, {@code ${expr}} substitutions and {@code {expr}} ID markers.
 * {@code {{} and {@code }}} are literal braces. Marker bodies are parsed with
 * {@link ExpressionParser} but not evaluated.
 *
 * <p>Thread-safe and stateless: all methods are static.
 */
public final class StepTemplateParser {

    private StepTemplateParser() {}

    /**
     * Parses one literal line.
     *
     * @param text the step text (already trimmed)
     * @param line authored line, for error reporting
     * @throws DirectiveParseException on an unterminated, empty or malformed marker or a stray
     *     {@code }}
     */
    public static StepTemplate parse(String text, int line) {
        List<StepTemplate.Segment> segments = new ArrayList<>();
        StringBuilder literal = new StringBuilder();
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            char next = i + 1 < text.length() ? text.charAt(i + 1) : '\0';
            if (c == '$' && next == '{') {
                int close = findClose(text, i + 2, line);
                String body = markerBody(text, i + 2, close, "${}", line);
                flush(literal, segments);
                segments.add(new StepTemplate.Substitution(ExpressionParser.parse(body, line), body));
                i = close + 1;
            } else if (c == '{' && next == '{') {
                literal.append('{');
                i += 2;
            } else if (c == '}' && next == '}') {
                literal.append('}');
                i += 2;
            } else if (c == '{') {
                int close = findClose(text, i + 1, line);
                String body = markerBody(text, i + 1, close, "{}", line);
                boolean leading = segments.isEmpty() && literal.toString().isBlank();
                flush(literal, segments);
                segments.add(new StepTemplate.IdMarker(ExpressionParser.parse(body, line), body, leading));
                i = close + 1;
            } else if (c == '}') {
                throw new DirectiveParseException("unmatched '}' (write '}}' for a literal brace)", line);
            } else {
                literal.append(c);
                i++;
            }
        }
        flush(literal, segments);
        return new StepTemplate(text, segments);
    }

    /** Index of the '}' closing a marker body starting at {@code from}, skipping quoted text. */
    private static int findClose(String text, int from, int line) {
        char quote = 0;
        for (int i = from; i < text.length(); i++) {
            char c = text.charAt(i);
            if (quote != 0) {
                if (c == '\\') {
                    i++;
                } else if (c == quote) {
                    quote = 0;
                }
            } else if (c == '"' || c == '\'') {
                quote = c;
            } else if (c == '}') {
                return i;
            }
        }
        throw new DirectiveParseException("unterminated marker starting at column " + from, line);
    }

    private static String markerBody(String text, int from, int close, String marker, int line) {
        String body = text.substring(from, close);
        if (body.isBlank()) {
            throw new DirectiveParseException("empty " + marker + " marker", line);
        }
        return body.trim();
    }

    private static void flush(StringBuilder literal, List<StepTemplate.Segment> segments) {
        if (literal.length() > 0) {
            segments.add(new StepTemplate.Literal(literal.toString()));
            literal.setLength(0);
        }
    }
}
