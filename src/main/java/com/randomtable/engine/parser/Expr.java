package com.randomtable.engine.parser;

import java.util.Collections;
import java.util.List;

/**
 * Payload variants of a parsed {@code {{...}}} expression. Consumers dispatch
 * through {@link ExprVisitor}.
 */
public class Expr {

    public interface ExprInterface {
        <R> R accept(ExprVisitor<R> visitor);
    }

    public interface ExprVisitor<R> {
        R visitLiteralExpr(Literal expr);
        R visitTableRefExpr(TableRef expr);
        R visitDiceExpr(Dice expr);
        R visitMathExpr(MathExpr expr);
        R visitVariableExpr(Variable expr);
        R visitPlaceholderExpr(Placeholder expr);
        R visitAgainExpr(Again expr);
        R visitMultiRollExpr(MultiRoll expr);
        R visitInstanceExpr(Instance expr);
        R visitCaptureMultiRollExpr(CaptureMultiRoll expr);
        R visitCaptureAccessExpr(CaptureAccess expr);
        R visitCollectExpr(Collect expr);
        R visitSwitchExpr(Switch expr);
    }

    /** Builds the lookup reference for a table token: {@code ns.id}, {@code alias.id} or {@code id}. */
    static String qualify(String namespace, String alias, String tableId) {
        if (namespace != null) return namespace + "." + tableId;
        if (alias != null) return alias + "." + tableId;
        return tableId;
    }

    private static List<String> props(List<String> properties) {
        return properties == null ? Collections.emptyList() : Collections.unmodifiableList(properties);
    }

    // -------------------------
    // Plain text and leaves
    // -------------------------

    public static final class Literal implements ExprInterface {
        public final String text;

        public Literal(String text) {
            this.text = text;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitLiteralExpr(this);
        }
    }

    public static final class Dice implements ExprInterface {
        public final String expression;

        public Dice(String expression) {
            this.expression = expression;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitDiceExpr(this);
        }
    }

    public static final class MathExpr implements ExprInterface {
        public final String expression;

        public MathExpr(String expression) {
            this.expression = expression;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitMathExpr(this);
        }
    }

    /** {@code $name} or {@code $alias.name}. */
    public static final class Variable implements ExprInterface {
        public final String name;
        public final String alias; // may be null

        public Variable(String name, String alias) {
            this.name = name;
            this.alias = alias;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitVariableExpr(this);
        }
    }

    /** {@code @name}, {@code @name.prop}, {@code @name.prop.@nested}. Properties are stored without '@'. */
    public static final class Placeholder implements ExprInterface {
        public final String name;
        public final List<String> properties;

        public Placeholder(String name, List<String> properties) {
            this.name = name;
            this.properties = props(properties);
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitPlaceholderExpr(this);
        }
    }

    // -------------------------
    // Table rolls
    // -------------------------

    public static final class TableRef implements ExprInterface {
        public final String tableId;
        public final String alias;     // may be null
        public final String namespace; // may be null
        public final List<String> properties;

        public TableRef(String tableId, String alias, String namespace, List<String> properties) {
            this.tableId = tableId;
            this.alias = alias;
            this.namespace = namespace;
            this.properties = props(properties);
        }

        public String ref() {
            return qualify(namespace, alias, tableId);
        }

        public boolean hasProperties() {
            return !properties.isEmpty();
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitTableRefExpr(this);
        }
    }

    public static final class Again implements ExprInterface {
        public final Integer count; // null means 1
        public final boolean unique;
        public final String separator; // null means ", "

        public Again(Integer count, boolean unique, String separator) {
            this.count = count;
            this.unique = unique;
            this.separator = separator;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitAgainExpr(this);
        }
    }

    /**
     * Repeat count of a multi-roll. Exactly one source applies, checked in the order
     * dice expression, variable reference, literal.
     */
    public static final class RollCount {
        public final int literal;
        public final String variable;   // "name" or "name.count", without '$'
        public final String diceCount;  // e.g. "1d4", "2d6+1"

        private RollCount(int literal, String variable, String diceCount) {
            this.literal = literal;
            this.variable = variable;
            this.diceCount = diceCount;
        }

        public static RollCount literal(int n) { return new RollCount(n, null, null); }
        public static RollCount variable(String name) { return new RollCount(0, name, null); }
        public static RollCount dice(String expression) { return new RollCount(0, null, expression); }

        @Override
        public String toString() {
            if (diceCount != null) return "dice:" + diceCount;
            if (variable != null) return "$" + variable;
            return String.valueOf(literal);
        }
    }

    public static final class MultiRoll implements ExprInterface {
        public final RollCount count;
        public final String tableId;
        public final String alias;
        public final String namespace;
        public final boolean unique;
        public final String separator;

        public MultiRoll(RollCount count, String tableId, String alias, String namespace,
                         boolean unique, String separator) {
            this.count = count;
            this.tableId = tableId;
            this.alias = alias;
            this.namespace = namespace;
            this.unique = unique;
            this.separator = separator;
        }

        public String ref() {
            return qualify(namespace, alias, tableId);
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitMultiRollExpr(this);
        }
    }

    /** {@code table#name}: memoized roll. */
    public static final class Instance implements ExprInterface {
        public final String tableId;
        public final String instanceName;

        public Instance(String tableId, String instanceName) {
            this.tableId = tableId;
            this.instanceName = instanceName;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitInstanceExpr(this);
        }
    }

    // -------------------------
    // Captures
    // -------------------------

    /** {@code N*table >> $var}, optionally {@code |silent} or {@code |"sep"}. */
    public static final class CaptureMultiRoll implements ExprInterface {
        public final RollCount count;
        public final String tableId;
        public final String alias;
        public final String namespace;
        public final boolean unique;
        public final String captureVar;
        public final String separator;
        public final boolean silent;

        public CaptureMultiRoll(RollCount count, String tableId, String alias, String namespace,
                                boolean unique, String captureVar, String separator, boolean silent) {
            this.count = count;
            this.tableId = tableId;
            this.alias = alias;
            this.namespace = namespace;
            this.unique = unique;
            this.captureVar = captureVar;
            this.separator = separator;
            this.silent = silent;
        }

        public String ref() {
            return qualify(namespace, alias, tableId);
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitCaptureMultiRollExpr(this);
        }
    }

    /** {@code $var}, {@code $var[i]}, {@code $var.count}, {@code $var[i].@prop.@nested}, {@code $var|"sep"}. */
    public static final class CaptureAccess implements ExprInterface {
        public final String varName;
        public final Integer index; // may be negative; null when absent
        public final List<String> properties;
        public final String separator;

        public CaptureAccess(String varName, Integer index, List<String> properties, String separator) {
            this.varName = varName;
            this.index = index;
            this.properties = props(properties);
            this.separator = separator;
        }

        public String label() {
            StringBuilder sb = new StringBuilder("$").append(varName);
            if (index != null) sb.append('[').append(index).append(']');
            for (String p : properties) sb.append(".@").append(p);
            return sb.toString();
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitCaptureAccessExpr(this);
        }
    }

    /** {@code collect:$var.@prop|unique|"sep"}. */
    public static final class Collect implements ExprInterface {
        public final String varName;
        public final String property;
        public final boolean unique;
        public final String separator;

        public Collect(String varName, String property, boolean unique, String separator) {
            this.varName = varName;
            this.property = property;
            this.unique = unique;
            this.separator = separator;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitCollectExpr(this);
        }
    }

    // -------------------------
    // Conditionals
    // -------------------------

    /** Standalone {@code switch[cond:result].switch[...].else[...]}. */
    public static final class Switch implements ExprInterface {
        public final SwitchModifiers modifiers;

        public Switch(SwitchModifiers modifiers) {
            this.modifiers = modifiers;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitSwitchExpr(this);
        }
    }
}
