package io.procmacro.core.parse;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.procmacro.core.error.DirectiveParseException;
import io.procmacro.core.expr.Expr;
import io.procmacro.core.expr.Expr.BinaryOp;
import io.procmacro.core.expr.Expr.UnaryOp;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

@DisplayName("ExpressionParser")
class ExpressionParserTest {

    private static Expr parse(String text) {
        return ExpressionParser.parse(text, 1);
    }

    @Nested
    @DisplayName("Precedence")
    class Precedence {

        @Test
        @DisplayName("* binds tighter than +")
        void multiplicationBeforeAddition() {
            assertThat(parse("1 + 2 * 3"))
                    .isEqualTo(new Expr.Binary(
                            BinaryOp.ADD,
                            new Expr.IntLiteral(1),
                            new Expr.Binary(BinaryOp.MULTIPLY, new Expr.IntLiteral(2), new Expr.IntLiteral(3))));
        }

        @Test
        @DisplayName("Additive operators are left-associative")
        void leftAssociative() {
            assertThat(parse("10 - 3 - 2"))
                    .isEqualTo(new Expr.Binary(
                            BinaryOp.SUBTRACT,
                            new Expr.Binary(BinaryOp.SUBTRACT, new Expr.IntLiteral(10), new Expr.IntLiteral(3)),
                            new Expr.IntLiteral(2)));
        }

        @Test
        @DisplayName("OR < AND < NOT < comparison")
        void logicalPrecedence() {
            Expr expr = parse("NOT a > 1 AND b OR c");

            assertThat(expr).isInstanceOf(Expr.Binary.class);
            Expr.Binary or = (Expr.Binary) expr;
            assertThat(or.op()).isEqualTo(BinaryOp.OR);
            Expr.Binary and = (Expr.Binary) or.left();
            assertThat(and.op()).isEqualTo(BinaryOp.AND);
            Expr.Unary not = (Expr.Unary) and.left();
            assertThat(not.op()).isEqualTo(UnaryOp.NOT);
            assertThat(((Expr.Binary) not.operand()).op()).isEqualTo(BinaryOp.GT);
        }

        @Test
        @DisplayName("Parentheses override precedence")
        void parentheses() {
            assertThat(parse("(1 + 2) * 3"))
                    .isEqualTo(new Expr.Binary(
                            BinaryOp.MULTIPLY,
                            new Expr.Binary(BinaryOp.ADD, new Expr.IntLiteral(1), new Expr.IntLiteral(2)),
                            new Expr.IntLiteral(3)));
        }

        @Test
        @DisplayName("Unary minus binds tighter than multiplication")
        void unaryMinus() {
            assertThat(parse("-2 * 3"))
                    .isEqualTo(new Expr.Binary(
                            BinaryOp.MULTIPLY,
                            new Expr.Unary(UnaryOp.NEGATE, new Expr.IntLiteral(2)),
                            new Expr.IntLiteral(3)));
        }
    }

    @Nested
    @DisplayName("Primaries")
    class Primaries {

        @Test
        void literals() {
            assertThat(parse("42")).isEqualTo(new Expr.IntLiteral(42));
            assertThat(parse("1.25")).isEqualTo(new Expr.RealLiteral(1.25));
            assertThat(parse("'a b'")).isEqualTo(new Expr.StrLiteral("a b"));
            assertThat(parse("\"q\\\"x\"")).isEqualTo(new Expr.StrLiteral("q\"x"));
            assertThat(parse("TRUE")).isEqualTo(new Expr.BoolLiteral(true));
            assertThat(parse("false")).isEqualTo(new Expr.BoolLiteral(false));
        }

        @Test
        void symbolsAndMembers() {
            assertThat(parse("BASE")).isEqualTo(new Expr.SymbolRef("BASE", null));
            assertThat(parse("row.io")).isEqualTo(new Expr.SymbolRef("row", "io"));
        }

        @Test
        void countIsCaseInsensitive() {
            assertThat(parse("COUNT(T)")).isEqualTo(new Expr.CountCall("T"));
            assertThat(parse("count( T )")).isEqualTo(new Expr.CountCall("T"));
        }

        @Test
        void symbolsCollectsNamesInOrder() {
            assertThat(Expr.symbols(parse("BASE + i * STEP + row.io + BASE"))).containsExactly("BASE", "i", "STEP", "row");
        }
    }

    @Nested
    @DisplayName("Errors")
    class Errors {

        @ParameterizedTest
        @ValueSource(strings = {"1 +", "(1", "a = 1", "!a", "1 < 2 < 3", "'open", "x.", "1 2", "#"})
        @DisplayName("Malformed expressions are parse errors")
        void malformed(String text) {
            assertThatThrownBy(() -> ExpressionParser.parse(text, 9))
                    .isInstanceOf(DirectiveParseException.class)
                    .satisfies(e -> assertThat(((DirectiveParseException) e).line()).isEqualTo(9));
        }

        @Test
        @DisplayName("Only COUNT may be called")
        void unknownFunction() {
            assertThatThrownBy(() -> parse("NOW()"))
                    .isInstanceOf(DirectiveParseException.class)
                    .hasMessageContaining("unknown function 'NOW'");
        }

        @Test
        @DisplayName("Empty expression")
        void empty() {
            assertThatThrownBy(() -> parse("   "))
                    .isInstanceOf(DirectiveParseException.class)
                    .hasMessageContaining("empty expression");
        }

        @Test
        @DisplayName("Lone '=' suggests '=='")
        void singleEquals() {
            assertThatThrownBy(() -> parse("a = 1")).hasMessageContaining("use '=='");
        }
    }
}
