package com.randomtable.engine.parser;

/**
 * One parsed unit of a pattern: the expression payload plus, for any non-switch
 * payload, optional trailing {@code .switch[...]}/{@code .else[...]} modifiers that
 * are applied to the payload's value after it is computed.
 */
public final class ExpressionToken {

    public final Expr.ExprInterface expr;
    public final SwitchModifiers switchModifiers; // may be null

    public ExpressionToken(Expr.ExprInterface expr, SwitchModifiers switchModifiers) {
        this.expr = expr;
        this.switchModifiers = switchModifiers;
    }

    public static ExpressionToken of(Expr.ExprInterface expr) {
        return new ExpressionToken(expr, null);
    }

    public static ExpressionToken literal(String text) {
        return new ExpressionToken(new Expr.Literal(text), null);
    }

    public boolean isLiteral() {
        return expr instanceof Expr.Literal;
    }

    public boolean hasSwitchModifiers() {
        return switchModifiers != null;
    }
}
