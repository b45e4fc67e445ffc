package io.procmacro.core.parse;

import io.procmacro.core.error.DirectiveParseException;
import io.procmacro.core.expr.Expr;
import io.procmacro.core.expr.Expr.BinaryOp;
import io.procmacro.core.expr.Expr.UnaryOp;
import java.util.List;
import java.util.Locale;

/**
 * Recursive-descent parser for the closed expression grammar:
 *
 * <pre>
 * or         := and ( OR and )*
 * and        := not ( AND not )*
 * not        := NOT not | comparison
 * comparison := additive ( ( == | != | &lt; | &lt;= | &gt; | &gt;= ) additive )?
 * additive   := term ( ( + | - ) term )*
 * term       := unary ( ( * | / | % ) unary )*
 * unary      := - unary | primary
 * primary    := INT | REAL | STRING | true | false | COUNT ( IDENT )
 *             | IDENT ( . IDENT )? | ( or )
 * </pre>
 *
 * <p>Parsing never evaluates. {@code COUNT} is the only function; any other call is rejected here.
 *
 * <p>Thread-safe and stateless: all public methods are static.
 */
public final class ExpressionParser {

    static final String COUNT_FUNCTION = "COUNT";

    private final List<Token> tokens;
    private int index;

    private ExpressionParser(List<Token> tokens) {
        this.tokens = tokens;
    }

    /**
     * Parses {@code source} into an expression tree.
     *
     * @param source the expression text
     * @param line   authored line, for error reporting
     * @throws DirectiveParseException if the text is not a well-formed expression
     */
    public static Expr parse(String source, int line) {
        String trimmed = source.trim();
        if (trimmed.isEmpty()) {
            throw new DirectiveParseException("empty expression", line);
        }
        try {
            ExpressionParser parser = new ExpressionParser(new ExpressionLexer(trimmed).tokenize());
            Expr expr = parser.parseOr();
            parser.expect(Token.Type.EOF);
            return expr;
        } catch (ExpressionSyntaxError e) {
            throw new DirectiveParseException(
                    "invalid expression '" + trimmed + "': " + e.getMessage() + " at column " + (e.column() + 1),
                    line);
        }
    }

    private Expr parseOr() {
        Expr left = parseAnd();
        while (accept(Token.Type.OR)) {
            left = new Expr.Binary(BinaryOp.OR, left, parseAnd());
        }
        return left;
    }

    private Expr parseAnd() {
        Expr left = parseNot();
        while (accept(Token.Type.AND)) {
            left = new Expr.Binary(BinaryOp.AND, left, parseNot());
        }
        return left;
    }

    private Expr parseNot() {
        if (accept(Token.Type.NOT)) {
            return new Expr.Unary(UnaryOp.NOT, parseNot());
        }
        return parseComparison();
    }

    private Expr parseComparison() {
        Expr left = parseAdditive();
        BinaryOp op = comparisonOp(peek().type());
        if (op == null) {
            return left;
        }
        index++;
        Expr right = parseAdditive();
        if (comparisonOp(peek().type()) != null) {
            throw new ExpressionSyntaxError("comparisons cannot be chained", peek().column());
        }
        return new Expr.Binary(op, left, right);
    }

    private Expr parseAdditive() {
        Expr left = parseTerm();
        while (true) {
            if (accept(Token.Type.PLUS)) {
                left = new Expr.Binary(BinaryOp.ADD, left, parseTerm());
            } else if (accept(Token.Type.MINUS)) {
                left = new Expr.Binary(BinaryOp.SUBTRACT, left, parseTerm());
            } else {
                return left;
            }
        }
    }

    private Expr parseTerm() {
        Expr left = parseUnary();
        while (true) {
            if (accept(Token.Type.STAR)) {
                left = new Expr.Binary(BinaryOp.MULTIPLY, left, parseUnary());
            } else if (accept(Token.Type.SLASH)) {
                left = new Expr.Binary(BinaryOp.DIVIDE, left, parseUnary());
            } else if (accept(Token.Type.PERCENT)) {
                left = new Expr.Binary(BinaryOp.REMAINDER, left, parseUnary());
            } else {
                return left;
            }
        }
    }

    private Expr parseUnary() {
        if (accept(Token.Type.MINUS)) {
            return new Expr.Unary(UnaryOp.NEGATE, parseUnary());
        }
        return parsePrimary();
    }

    private Expr parsePrimary() {
        Token token = peek();
        index++;
        return switch (token.type()) {
            case INT -> new Expr.IntLiteral(parseLong(token));
            case REAL -> new Expr.RealLiteral(Double.parseDouble(token.text()));
            case STRING -> new Expr.StrLiteral(token.text());
            case TRUE -> new Expr.BoolLiteral(true);
            case FALSE -> new Expr.BoolLiteral(false);
            case LPAREN -> {
                Expr inner = parseOr();
                expect(Token.Type.RPAREN);
                yield inner;
            }
            case IDENT -> {
                if (peek().type() == Token.Type.LPAREN) {
                    yield parseCall(token);
                }
                if (accept(Token.Type.DOT)) {
                    yield new Expr.SymbolRef(token.text(), expect(Token.Type.IDENT).text());
                }
                yield new Expr.SymbolRef(token.text(), null);
            }
            default -> throw new ExpressionSyntaxError("unexpected " + token, token.column());
        };
    }

    private static long parseLong(Token token) {
        try {
            return Long.parseLong(token.text());
        } catch (NumberFormatException e) {
            throw new ExpressionSyntaxError("integer literal out of range", token.column());
        }
    }

    private Expr parseCall(Token function) {
        if (!COUNT_FUNCTION.equals(function.text().toUpperCase(Locale.ROOT))) {
            throw new ExpressionSyntaxError(
                    "unknown function '" + function.text() + "' (only COUNT is available)", function.column());
        }
        expect(Token.Type.LPAREN);
        Token table = expect(Token.Type.IDENT);
        expect(Token.Type.RPAREN);
        return new Expr.CountCall(table.text());
    }

    private static BinaryOp comparisonOp(Token.Type type) {
        return switch (type) {
            case EQ -> BinaryOp.EQ;
            case NE -> BinaryOp.NE;
            case LT -> BinaryOp.LT;
            case LE -> BinaryOp.LE;
            case GT -> BinaryOp.GT;
            case GE -> BinaryOp.GE;
            default -> null;
        };
    }

    private Token peek() {
        return tokens.get(index);
    }

    private boolean accept(Token.Type type) {
        if (peek().type() == type) {
            index++;
            return true;
        }
        return false;
    }

    private Token expect(Token.Type type) {
        Token token = peek();
        if (token.type() != type) {
            throw new ExpressionSyntaxError("expected " + describe(type) + " but found " + token, token.column());
        }
        index++;
        return token;
    }

    private static String describe(Token.Type type) {
        return switch (type) {
            case EOF -> "end of expression";
            case IDENT -> "identifier";
            case LPAREN -> "'('";
            case RPAREN -> "')'";
            default -> type.name().toLowerCase(Locale.ROOT);
        };
    }
}
