package io.procmacro.core.parse;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Splits expression source into tokens. Keywords ({@code AND OR NOT true false}) are
 * case-insensitive; identifiers are case-sensitive.
 */
final class ExpressionLexer {

    private static final Map<String, Token.Type> KEYWORDS = Map.of(
            "AND", Token.Type.AND,
            "OR", Token.Type.OR,
            "NOT", Token.Type.NOT,
            "TRUE", Token.Type.TRUE,
            "FALSE", Token.Type.FALSE);

    private final String source;
    private int pos;

    ExpressionLexer(String source) {
        this.source = source;
    }

    /**
     * Tokenizes the whole source, ending with an EOF token.
     *
     * @throws ExpressionSyntaxError on an unexpected or unterminated token
     */
    List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        while (true) {
            Token token = next();
            tokens.add(token);
            if (token.type() == Token.Type.EOF) {
                return tokens;
            }
        }
    }

    private Token next() {
        while (pos < source.length() && Character.isWhitespace(source.charAt(pos))) {
            pos++;
        }
        if (pos >= source.length()) {
            return new Token(Token.Type.EOF, "", pos);
        }
        int start = pos;
        char c = source.charAt(pos);

        if (Character.isLetter(c) || c == '_') {
            while (pos < source.length() && isIdentPart(source.charAt(pos))) {
                pos++;
            }
            String word = source.substring(start, pos);
            Token.Type keyword = KEYWORDS.get(word.toUpperCase(Locale.ROOT));
            return new Token(keyword != null ? keyword : Token.Type.IDENT, word, start);
        }
        if (Character.isDigit(c)) {
            return number(start);
        }
        if (c == '"' || c == '\'') {
            return string(start, c);
        }

        pos++;
        return switch (c) {
            case '(' -> new Token(Token.Type.LPAREN, "(", start);
            case ')' -> new Token(Token.Type.RPAREN, ")", start);
            case '.' -> new Token(Token.Type.DOT, ".", start);
            case '+' -> new Token(Token.Type.PLUS, "+", start);
            case '-' -> new Token(Token.Type.MINUS, "-", start);
            case '*' -> new Token(Token.Type.STAR, "*", start);
            case '/' -> new Token(Token.Type.SLASH, "/", start);
            case '%' -> new Token(Token.Type.PERCENT, "%", start);
            case '=' -> {
                if (!match('=')) {
                    throw new ExpressionSyntaxError("'=' is not an operator, use '=='", start);
                }
                yield new Token(Token.Type.EQ, "==", start);
            }
            case '!' -> {
                if (!match('=')) {
                    throw new ExpressionSyntaxError("'!' is not an operator, use NOT", start);
                }
                yield new Token(Token.Type.NE, "!=", start);
            }
            case '<' -> match('=') ? new Token(Token.Type.LE, "<=", start) : new Token(Token.Type.LT, "<", start);
            case '>' -> match('=') ? new Token(Token.Type.GE, ">=", start) : new Token(Token.Type.GT, ">", start);
            default -> throw new ExpressionSyntaxError("unexpected character '" + c + "'", start);
        };
    }

    private Token number(int start) {
        while (pos < source.length() && Character.isDigit(source.charAt(pos))) {
            pos++;
        }
        boolean real = false;
        if (pos + 1 < source.length() && source.charAt(pos) == '.' && Character.isDigit(source.charAt(pos + 1))) {
            real = true;
            pos++;
            while (pos < source.length() && Character.isDigit(source.charAt(pos))) {
                pos++;
            }
        }
        String text = source.substring(start, pos);
        return new Token(real ? Token.Type.REAL : Token.Type.INT, text, start);
    }

    private Token string(int start, char quote) {
        pos++;
        StringBuilder sb = new StringBuilder();
        while (pos < source.length()) {
            char ch = source.charAt(pos++);
            if (ch == quote) {
                return new Token(Token.Type.STRING, sb.toString(), start);
            }
            if (ch == '\\' && pos < source.length()) {
                char escaped = source.charAt(pos++);
                sb.append(escaped == 'n' ? '\n' : escaped == 't' ? '\t' : escaped);
            } else {
                sb.append(ch);
            }
        }
        throw new ExpressionSyntaxError("unterminated string literal", start);
    }

    private boolean match(char expected) {
        if (pos < source.length() && source.charAt(pos) == expected) {
            pos++;
            return true;
        }
        return false;
    }

    static boolean isIdentPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }
}
