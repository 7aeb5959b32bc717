package com.randomtable.engine.runtime;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Boolean {@code when} expressions used by switch clauses.
 *
 * Precedence, loosest first: {@code ||}, {@code &&}, comparison. A leading
 * {@code !} negates everything after it; a leading parenthesized group is
 * evaluated first and then combined with the rest.
 *
 * Operands: {@code @name[.prop]}, {@code $name.@prop}, {@code $name}, else a
 * literal (a number when it starts with one). Missing values are the empty
 * string, which is falsy, as is numeric zero.
 */
public final class ConditionalEvaluator {

    private static final Pattern SHARED_PROPERTY = Pattern.compile("^\\$([a-zA-Z_][a-zA-Z0-9_]*)\\.@([a-zA-Z_][a-zA-Z0-9_]*)$");
    private static final Pattern FLOAT_PREFIX = Pattern.compile("^\\s*[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");
    private static final Pattern NUMBER_LITERAL = Pattern.compile("^[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?$");

    private ConditionalEvaluator() {}

    public static boolean evaluateWhenClause(String when, GenerationContext context) {
        return evaluateTokens(tokenize(when), context);
    }

    // ===================== TOKENIZER =====================

    static List<String> tokenize(String expr) {
        List<String> tokens = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean inQuote = false;
        char quoteChar = 0;

        for (int i = 0; i < expr.length(); i++) {
            char c = expr.charAt(i);
            char next = i + 1 < expr.length() ? expr.charAt(i + 1) : '\0';

            if (inQuote) {
                if (c == quoteChar) {
                    tokens.add(current.toString());
                    current.setLength(0);
                    inQuote = false;
                } else {
                    current.append(c);
                }
            } else if (c == '"' || c == '\'') {
                flush(tokens, current);
                inQuote = true;
                quoteChar = c;
            } else if (c == ' ' || c == '\t') {
                flush(tokens, current);
            } else if (c == '(' || c == ')') {
                flush(tokens, current);
                tokens.add(String.valueOf(c));
            } else if ((c == '&' && next == '&') || (c == '|' && next == '|')
                    || (c == '=' && next == '=') || (c == '!' && next == '=')
                    || (c == '>' && next == '=') || (c == '<' && next == '=')) {
                flush(tokens, current);
                tokens.add("" + c + next);
                i++;
            } else if (c == '!' || c == '>' || c == '<') {
                flush(tokens, current);
                tokens.add(String.valueOf(c));
            } else {
                current.append(c);
            }
        }
        flush(tokens, current);
        tokens.removeIf(String::isEmpty);
        return tokens;
    }

    private static void flush(List<String> tokens, StringBuilder current) {
        if (current.length() > 0) {
            tokens.add(current.toString());
            current.setLength(0);
        }
    }

    // ===================== EVALUATION =====================

    private static boolean evaluateTokens(List<String> tokens, GenerationContext context) {
        if (tokens.isEmpty()) return false;

        if (tokens.get(0).equals("!")) {
            return !evaluateTokens(tokens.subList(1, tokens.size()), context);
        }

        if (tokens.get(0).equals("(")) {
            int depth = 1;
            int i = 1;
            while (i < tokens.size() && depth > 0) {
                if (tokens.get(i).equals("(")) depth++;
                if (tokens.get(i).equals(")")) depth--;
                i++;
            }
            boolean inner = evaluateTokens(tokens.subList(1, Math.max(1, i - 1)), context);
            List<String> rest = tokens.subList(i, tokens.size());
            if (rest.isEmpty()) return inner;
            if (rest.get(0).equals("&&")) return inner && evaluateTokens(rest.subList(1, rest.size()), context);
            if (rest.get(0).equals("||")) return inner || evaluateTokens(rest.subList(1, rest.size()), context);
            return inner;
        }

        int depth = 0;
        int orIndex = -1;
        int andIndex = -1;
        for (int i = 0; i < tokens.size(); i++) {
            String t = tokens.get(i);
            if (t.equals("(")) depth++;
            else if (t.equals(")")) depth--;
            else if (depth == 0) {
                if (t.equals("||") && orIndex == -1) orIndex = i;
                else if (t.equals("&&") && andIndex == -1) andIndex = i;
            }
        }

        if (orIndex != -1) {
            boolean left = evaluateTokens(tokens.subList(0, orIndex), context);
            boolean right = evaluateTokens(tokens.subList(orIndex + 1, tokens.size()), context);
            return left || right;
        }
        if (andIndex != -1) {
            boolean left = evaluateTokens(tokens.subList(0, andIndex), context);
            boolean right = evaluateTokens(tokens.subList(andIndex + 1, tokens.size()), context);
            return left && right;
        }

        if (tokens.size() >= 3) {
            Object left = resolveValue(tokens.get(0), context);
            String op = tokens.get(1);
            Object right = resolveValue(String.join(" ", tokens.subList(2, tokens.size())), context);
            return compare(left, op, right);
        }
        if (tokens.size() == 1) {
            return truthy(resolveValue(tokens.get(0), context));
        }
        return false;
    }

    /** String, Double, or null when a reference does not resolve. */
    private static Object resolveValue(String ref, GenerationContext context) {
        if (ref.startsWith("@")) {
            String[] parts = ref.substring(1).split("\\.", -1);
            return context.getPlaceholder(parts[0], parts.length > 1 ? parts[1] : null);
        }
        if (ref.startsWith("$")) {
            Matcher m = SHARED_PROPERTY.matcher(ref);
            if (m.matches()) {
                CaptureItem shared = context.getSharedVariable(m.group(1));
                if (shared != null) {
                    return CaptureItem.textOf(shared.sets.get(m.group(2)));
                }
            }
            return context.resolveVariable(ref.substring(1));
        }
        Matcher num = FLOAT_PREFIX.matcher(ref);
        if (num.find()) {
            double d = Double.parseDouble(num.group().trim());
            if (Double.isFinite(d)) return d;
        }
        return ref;
    }

    private static boolean compare(Object left, String op, Object right) {
        if (left == null) left = "";
        if (right == null) right = "";
        switch (op) {
            case "==": return asString(left).equals(asString(right));
            case "!=": return !asString(left).equals(asString(right));
            case ">": return asNumber(left) > asNumber(right);
            case "<": return asNumber(left) < asNumber(right);
            case ">=": return asNumber(left) >= asNumber(right);
            case "<=": return asNumber(left) <= asNumber(right);
            case "contains": return asString(left).toLowerCase().contains(asString(right).toLowerCase());
            case "matches":
                try {
                    return Pattern.compile(asString(right), Pattern.CASE_INSENSITIVE).matcher(asString(left)).find();
                } catch (PatternSyntaxException e) {
                    return false;
                }
            default:
                return false;
        }
    }

    private static boolean truthy(Object v) {
        if (v == null) return false;
        if (v instanceof Double) {
            double d = (Double) v;
            return d != 0 && !Double.isNaN(d);
        }
        return !asString(v).isEmpty();
    }

    /** Integral doubles print without a fraction, so {@code 1 == "1"} holds. */
    static String asString(Object v) {
        if (v instanceof Double) {
            double d = (Double) v;
            if (d == Math.rint(d) && !Double.isInfinite(d) && Math.abs(d) < 1e15) {
                return String.valueOf((long) d);
            }
            return String.valueOf(d);
        }
        return String.valueOf(v);
    }

    /** Strict numeric reading; NaN for anything that is not a whole number literal. Blank is 0. */
    static double asNumber(Object v) {
        if (v instanceof Double) return (Double) v;
        String s = String.valueOf(v).trim();
        if (s.isEmpty()) return 0;
        if (!NUMBER_LITERAL.matcher(s).matches()) return Double.NaN;
        return Double.parseDouble(s);
    }
}
