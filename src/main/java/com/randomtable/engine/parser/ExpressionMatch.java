package com.randomtable.engine.parser;

/** A {@code {{...}}} span found in a pattern. {@code end} is exclusive. */
public final class ExpressionMatch {
    public final int start;
    public final int end;
    public final String expression; // trimmed body
    public final String raw;        // including braces

    public ExpressionMatch(int start, int end, String expression, String raw) {
        this.start = start;
        this.end = end;
        this.expression = expression;
        this.raw = raw;
    }

    @Override
    public String toString() {
        return raw + "@" + start + ".." + end;
    }
}
