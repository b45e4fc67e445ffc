package io.procmacro.core.expr;

import io.procmacro.core.error.EvaluationException;
import io.procmacro.core.error.ExpressionTypeException;
import io.procmacro.core.model.Value;
import java.util.List;
import java.util.Objects;

/**
 * Evaluates an {@link Expr} against an {@link EvaluationScope}. Pure: the result depends only on the
 * expression and the scope's bindings.
 *
 * <p>Integer arithmetic stays integral ({@code /} truncates, overflow is an error); any {@link
 * Value.Real} operand promotes the operation to double. {@code AND}/{@code OR} short-circuit.
 */
public final class Evaluator implements Expr.Visitor<Value> {

    private final EvaluationScope scope;

    public Evaluator(EvaluationScope scope) {
        this.scope = Objects.requireNonNull(scope, "scope must not be null");
    }

    /** Convenience for a one-off evaluation. */
    public static Value evaluate(Expr expr, EvaluationScope scope) {
        return expr.accept(new Evaluator(scope));
    }

    public Value evaluate(Expr expr) {
        return expr.accept(this);
    }

    @Override
    public Value visitInt(Expr.IntLiteral e) {
        return Value.of(e.value());
    }

    @Override
    public Value visitReal(Expr.RealLiteral e) {
        return Value.of(e.value());
    }

    @Override
    public Value visitBool(Expr.BoolLiteral e) {
        return Value.of(e.value());
    }

    @Override
    public Value visitStr(Expr.StrLiteral e) {
        return Value.of(e.value());
    }

    @Override
    public Value visitSymbol(Expr.SymbolRef e) {
        return e.hasMember() ? scope.lookupMember(e.name(), e.member()) : scope.lookup(e.name());
    }

    @Override
    public Value visitCount(Expr.CountCall e) {
        return Value.of(scope.rowCount(e.table()));
    }

    @Override
    public Value visitUnary(Expr.Unary e) {
        Value operand = e.operand().accept(this);
        return switch (e.op()) {
            case NOT -> Value.of(!requireBool(operand, e.op().symbol()));
            case NEGATE -> negate(operand);
        };
    }

    @Override
    public Value visitBinary(Expr.Binary e) {
        Expr.BinaryOp op = e.op();
        if (op == Expr.BinaryOp.AND || op == Expr.BinaryOp.OR) {
            return logical(op, e);
        }
        Value left = e.left().accept(this);
        Value right = e.right().accept(this);
        if (op.isArithmetic()) {
            return arithmetic(op, left, right);
        }
        return Value.of(compare(op, left, right));
    }

    // --- operators ---

    private Value logical(Expr.BinaryOp op, Expr.Binary e) {
        boolean left = requireBool(e.left().accept(this), op.symbol());
        if (op == Expr.BinaryOp.AND && !left) {
            return Value.of(false);
        }
        if (op == Expr.BinaryOp.OR && left) {
            return Value.of(true);
        }
        return Value.of(requireBool(e.right().accept(this), op.symbol()));
    }

    private static Value negate(Value operand) {
        if (operand instanceof Value.Int i) {
            if (i.value() == Long.MIN_VALUE) {
                throw new EvaluationException("integer overflow in unary '-'");
            }
            return Value.of(-i.value());
        }
        if (operand instanceof Value.Real r) {
            return Value.of(-r.value());
        }
        throw new ExpressionTypeException("-", List.of(operand.typeName()));
    }

    private static Value arithmetic(Expr.BinaryOp op, Value left, Value right) {
        if (!left.isNumeric() || !right.isNumeric()) {
            throw new ExpressionTypeException(op.symbol(), List.of(left.typeName(), right.typeName()));
        }
        if (left instanceof Value.Int a && right instanceof Value.Int b) {
            return Value.of(integral(op, a.value(), b.value()));
        }
        double a = asDouble(left);
        double b = asDouble(right);
        double result = switch (op) {
            case ADD -> a + b;
            case SUBTRACT -> a - b;
            case MULTIPLY -> a * b;
            case DIVIDE -> {
                requireNonZero(b == 0.0);
                yield a / b;
            }
            case REMAINDER -> {
                requireNonZero(b == 0.0);
                yield a % b;
            }
            default -> throw new IllegalStateException("not arithmetic: " + op);
        };
        if (Double.isNaN(result) || Double.isInfinite(result)) {
            throw new EvaluationException("non-finite result of '" + op.symbol() + "'");
        }
        return Value.of(result);
    }

    private static long integral(Expr.BinaryOp op, long a, long b) {
        try {
            return switch (op) {
                case ADD -> Math.addExact(a, b);
                case SUBTRACT -> Math.subtractExact(a, b);
                case MULTIPLY -> Math.multiplyExact(a, b);
                case DIVIDE -> {
                    requireNonZero(b == 0);
                    if (a == Long.MIN_VALUE && b == -1) {
                        throw new ArithmeticException("long overflow");
                    }
                    yield a / b;
                }
                case REMAINDER -> {
                    requireNonZero(b == 0);
                    yield a % b;
                }
                default -> throw new IllegalStateException("not arithmetic: " + op);
            };
        } catch (ArithmeticException e) {
            throw new EvaluationException("integer overflow in '" + op.symbol() + "'");
        }
    }

    private static boolean compare(Expr.BinaryOp op, Value left, Value right) {
        int order;
        if (left.isNumeric() && right.isNumeric()) {
            order = (left instanceof Value.Int a && right instanceof Value.Int b)
                    ? Long.compare(a.value(), b.value())
                    : Double.compare(asDouble(left), asDouble(right));
        } else if (left.isText() && right.isText()) {
            order = left.render().compareTo(right.render());
        } else if (left instanceof Value.Bool a
                && right instanceof Value.Bool b
                && (op == Expr.BinaryOp.EQ || op == Expr.BinaryOp.NE)) {
            order = a.value() == b.value() ? 0 : 1;
        } else {
            throw new ExpressionTypeException(op.symbol(), List.of(left.typeName(), right.typeName()));
        }
        return switch (op) {
            case EQ -> order == 0;
            case NE -> order != 0;
            case LT -> order < 0;
            case LE -> order <= 0;
            case GT -> order > 0;
            case GE -> order >= 0;
            default -> throw new IllegalStateException("not a comparison: " + op);
        };
    }

    private static boolean requireBool(Value value, String operator) {
        if (value instanceof Value.Bool b) {
            return b.value();
        }
        throw new ExpressionTypeException(operator, List.of(value.typeName()));
    }

    private static void requireNonZero(boolean zero) {
        if (zero) {
            throw new EvaluationException(EvaluationException.DIVISION_BY_ZERO);
        }
    }

    private static double asDouble(Value numeric) {
        return numeric instanceof Value.Int i ? i.value() : ((Value.Real) numeric).value();
    }
}
