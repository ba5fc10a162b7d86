package com.glassbox.calc.expr;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.glassbox.calc.namespace.Ref;
import com.glassbox.calc.util.Diagnostic.Kind;

/**
 * Recursive-descent parser.
 *
 * <pre>
 * comparison     := additive (( '&lt;' | '&lt;=' | '&gt;' | '&gt;=' | '==' | '!=' ) additive)*
 * additive       := multiplicative (( '+' | '-' ) multiplicative)*
 * multiplicative := unary (( '*' | '/' ) unary)*
 * unary          := ( '-' | '+' ) unary | power
 * power          := primary ( '^' unary )?
 * primary        := NUMBER | REF | FUNCTION '(' args ')' | '(' comparison ')'
 * </pre>
 *
 * {@code ^} is right-associative and binds tighter than unary minus, so
 * {@code -2^2} is {@code -4}.
 */
final class Parser {
    private final List<Token> tokens;
    private final FormulaLimits limits;
    private final Map<String, Integer> slots = new LinkedHashMap<>();
    private final List<Ref> refs = new ArrayList<>();
    private int pos;
    private int depth;
    private int nodes;

    Parser(List<Token> tokens, FormulaLimits limits) {
        this.tokens = tokens;
        this.limits = limits;
    }

    static Formula parse(String source, FormulaLimits limits) {
        if (source == null)
            throw new FormulaSyntaxException("Formula is missing", -1);
        if (source.length() > limits.maxFormulaLength())
            throw new FormulaSyntaxException("Formula length " + source.length() + " exceeds limit "
                    + limits.maxFormulaLength(), -1, Kind.BUDGET_EXCEEDED);
        if (source.isBlank())
            throw new FormulaSyntaxException("Formula is empty", 0);
        Parser p = new Parser(new Lexer(source).tokenize(), limits);
        ExprNode root = p.comparison();
        Token t = p.peek();
        if (t.type() != TokenType.EOF)
            throw new FormulaSyntaxException("Unexpected " + t, t.pos());
        return new Formula(source, root, p.refs, p.nodes);
    }

    private ExprNode comparison() {
        enter();
        try {
            ExprNode left = additive();
            while (true) {
                TokenType t = peek().type();
                if (t != TokenType.LT && t != TokenType.LE && t != TokenType.GT && t != TokenType.GE
                        && t != TokenType.EQ && t != TokenType.NE)
                    return left;
                next();
                left = node(new BinaryNode(BinaryOp.of(t), left, additive()));
            }
        } finally {
            depth--;
        }
    }

    private ExprNode additive() {
        ExprNode left = multiplicative();
        while (peek().type() == TokenType.PLUS || peek().type() == TokenType.MINUS) {
            TokenType t = next().type();
            left = node(new BinaryNode(BinaryOp.of(t), left, multiplicative()));
        }
        return left;
    }

    private ExprNode multiplicative() {
        ExprNode left = unary();
        while (peek().type() == TokenType.STAR || peek().type() == TokenType.SLASH) {
            TokenType t = next().type();
            left = node(new BinaryNode(BinaryOp.of(t), left, unary()));
        }
        return left;
    }

    private ExprNode unary() {
        TokenType t = peek().type();
        if (t == TokenType.MINUS || t == TokenType.PLUS) {
            next();
            enter();
            try {
                return node(new UnaryNode(t == TokenType.MINUS, unary()));
            } finally {
                depth--;
            }
        }
        return power();
    }

    private ExprNode power() {
        ExprNode base = primary();
        if (peek().type() == TokenType.CARET) {
            next();
            enter();
            try {
                return node(new BinaryNode(BinaryOp.POW, base, unary()));
            } finally {
                depth--;
            }
        }
        return base;
    }

    private ExprNode primary() {
        Token t = next();
        switch (t.type()) {
            case NUMBER:
                return node(new NumberNode(t.number()));
            case REF:
                return node(refNode(t.text()));
            case FUNCTION:
                return call(t);
            case LPAREN: {
                ExprNode inner = comparison();
                expect(TokenType.RPAREN, "')'");
                return inner;
            }
            default:
                throw new FormulaSyntaxException("Unexpected " + t, t.pos());
        }
    }

    private ExprNode call(Token name) {
        expect(TokenType.LPAREN, "'('");
        List<ExprNode> args = new ArrayList<>();
        if (peek().type() != TokenType.RPAREN) {
            args.add(comparison());
            while (peek().type() == TokenType.COMMA) {
                next();
                args.add(comparison());
            }
        }
        expect(TokenType.RPAREN, "')'");

        ArrayFunction af = ArrayFunction.lookup(name.text());
        if (af != null) {
            int expected = af.windowed() ? 2 : 1;
            if (args.size() != expected)
                throw new FormulaSyntaxException(af + " takes " + expected + " argument"
                        + (expected > 1 ? "s" : "") + ", got " + args.size(), name.pos());
            ExprNode window = af.windowed() ? args.get(1) : null;
            if (window != null && !(window instanceof RefNode) && hasRefs(window))
                throw new FormulaSyntaxException(af + " window must be a number or a single reference", name.pos());
            return node(new ArrayCallNode(af, args.get(0), window));
        }
        ScalarFunction sf = ScalarFunction.lookup(name.text());
        if (sf == null)
            throw new FormulaSyntaxException("Unknown function '" + name.text() + "'", name.pos());
        if (!sf.accepts(args.size()))
            throw new FormulaSyntaxException(sf + " does not take " + args.size() + " argument(s)", name.pos());
        return node(new CallNode(sf, List.copyOf(args)));
    }

    private static boolean hasRefs(ExprNode n) {
        boolean[] found = new boolean[1];
        n.collectRefs((ref, lagged) -> found[0] = true, false);
        return found[0];
    }

    private RefNode refNode(String key) {
        Integer slot = slots.get(key);
        if (slot == null) {
            slot = refs.size();
            slots.put(key, slot);
            refs.add(Ref.parse(key));
        }
        return new RefNode(refs.get(slot), slot);
    }

    private <T extends ExprNode> T node(T n) {
        if (++nodes > limits.maxAstNodes())
            throw new FormulaSyntaxException("Formula has more than " + limits.maxAstNodes() + " nodes", -1,
                    Kind.BUDGET_EXCEEDED);
        return n;
    }

    private void enter() {
        if (++depth > limits.maxParseDepth())
            throw new FormulaSyntaxException("Formula nesting exceeds depth " + limits.maxParseDepth(),
                    peek().pos(), Kind.BUDGET_EXCEEDED);
    }

    private Token peek() {
        return tokens.get(pos);
    }

    private Token next() {
        Token t = tokens.get(pos);
        if (t.type() != TokenType.EOF)
            pos++;
        return t;
    }

    private void expect(TokenType type, String what) {
        Token t = next();
        if (t.type() != type)
            throw new FormulaSyntaxException("Expected " + what + " but found " + t, t.pos());
    }
}
