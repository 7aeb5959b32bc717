package com.randomtable.engine.parser;

import java.util.Collections;
import java.util.List;

/** Ordered switch clauses plus an optional else result. First matching clause wins. */
public final class SwitchModifiers {

    public static final class Clause {
        public final String condition;
        public final String resultExpr;

        public Clause(String condition, String resultExpr) {
            this.condition = condition;
            this.resultExpr = resultExpr;
        }

        @Override
        public String toString() {
            return condition + ":" + resultExpr;
        }
    }

    public final List<Clause> clauses;
    public final String elseExpr; // may be null

    public SwitchModifiers(List<Clause> clauses, String elseExpr) {
        this.clauses = Collections.unmodifiableList(clauses);
        this.elseExpr = elseExpr;
    }

    public boolean hasElse() {
        return elseExpr != null;
    }
}
