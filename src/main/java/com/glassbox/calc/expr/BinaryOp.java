package com.glassbox.calc.expr;

import com.glassbox.calc.util.Diagnostic.Kind;

/** Infix operators. Comparisons yield 1 or 0. */
enum BinaryOp {
    ADD("+"), SUB("-"), MUL("*"), DIV("/"), POW("^"),
    LT("<"), LE("<="), GT(">"), GE(">="), EQ("=="), NE("!=");

    private final String symbol;

    BinaryOp(String symbol) {
        this.symbol = symbol;
    }

    String symbol() {
        return symbol;
    }

    /**
     * @throws EvaluationException when finite operands give an infinite or NaN
     *                             result, so that comparisons and functions never
     *                             see one
     */
    double apply(double a, double b, int period) {
        double r = switch (this) {
            case ADD -> a + b;
            case SUB -> a - b;
            case MUL -> a * b;
            case DIV -> {
                if (b == 0.0)
                    throw new EvaluationException(Kind.ARITHMETIC_FAULT, "Division by zero", period);
                yield a / b;
            }
            case POW -> Math.pow(a, b);
            case LT -> a < b ? 1 : 0;
            case LE -> a <= b ? 1 : 0;
            case GT -> a > b ? 1 : 0;
            case GE -> a >= b ? 1 : 0;
            case EQ -> a == b ? 1 : 0;
            case NE -> a != b ? 1 : 0;
        };
        if (!Double.isFinite(r) && Double.isFinite(a) && Double.isFinite(b))
            throw new EvaluationException(Kind.ARITHMETIC_FAULT, "Invalid operation: " + a + " " + symbol + " " + b,
                    period);
        return r;
    }

    static BinaryOp of(TokenType t) {
        return switch (t) {
            case PLUS -> ADD;
            case MINUS -> SUB;
            case STAR -> MUL;
            case SLASH -> DIV;
            case CARET -> POW;
            case LT -> LT;
            case LE -> LE;
            case GT -> GT;
            case GE -> GE;
            case EQ -> EQ;
            case NE -> NE;
            default -> throw new IllegalArgumentException("Not an operator: " + t);
        };
    }
}
