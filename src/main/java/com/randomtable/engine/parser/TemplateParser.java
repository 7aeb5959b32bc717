package com.randomtable.engine.parser;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.randomtable.debug.Debug;
import com.randomtable.engine.TableEngineException;
import com.randomtable.engine.parser.Expr.Again;
import com.randomtable.engine.parser.Expr.CaptureAccess;
import com.randomtable.engine.parser.Expr.CaptureMultiRoll;
import com.randomtable.engine.parser.Expr.Collect;
import com.randomtable.engine.parser.Expr.Instance;
import com.randomtable.engine.parser.Expr.MultiRoll;
import com.randomtable.engine.parser.Expr.RollCount;
import com.randomtable.engine.parser.Expr.TableRef;

/**
 * Pattern front end: finds {@code {{...}}} spans in a pattern and classifies each
 * expression body into an {@link ExpressionToken}.
 *
 * Classification is order sensitive; see {@link #parseExpression(String)}.
 * Only malformed switch syntax (and a handful of unparseable capture forms) is an
 * error. Anything else that is not recognized falls through to a table reference.
 */
public final class TemplateParser {

    private static final String TAG = "TemplateParser";

    private static final Pattern DICE_MULTI_ROLL = Pattern.compile("^[^*]+\\*[a-zA-Z]");
    private static final Pattern COUNTED_AGAIN = Pattern.compile("\\*again(\\|\\s*\"[^\"]*\")?$");
    private static final Pattern LITERAL_COUNT = Pattern.compile("^\\d+\\*");
    private static final Pattern VARIABLE_COUNT = Pattern.compile("^\\$\\w+(\\.\\w+)?\\*");
    private static final Pattern DIGITS = Pattern.compile("^\\d+$");
    private static final Pattern BARE_ARITHMETIC = Pattern.compile("^[\\d\\s+\\-*/()]*\\d[\\d\\s+\\-*/()]*$");

    private static final Pattern AGAIN_SEPARATOR = Pattern.compile("\\|\\s*\"([^\"]*)\"$");
    private static final Pattern TRAILING_SEPARATOR = Pattern.compile("\\|\"([^\"]*)\"$");
    private static final Pattern ANY_SEPARATOR = Pattern.compile("\\|\"([^\"]*)\"");

    private static final Pattern CAPTURE_MULTI_ROLL = Pattern.compile("(.+?)\\s*>>\\s*\\$(\\w+)(.*)$");
    private static final Pattern CAPTURE_SEPARATOR = Pattern.compile("^(.+?)\\|\"([^\"]*)\"$");
    private static final Pattern CAPTURE_INDEXED = Pattern.compile("^(\\w+)\\[(-?\\d+)\\](?:\\.(.+))?$");
    private static final Pattern CAPTURE_PROPERTY = Pattern.compile("^(\\w+)\\.(.+)$");
    private static final Pattern CAPTURE_SIMPLE = Pattern.compile("^(\\w+)$");
    private static final Pattern COLLECT = Pattern.compile("^\\$(\\w+)\\.(@?\\w+)(.*)$");
    private static final Pattern STANDALONE_SWITCH = Pattern.compile("^switch\\[(.+)\\]$", Pattern.DOTALL);

    private TemplateParser() {}

    // ===================== EXTRACTION =====================

    /**
     * Finds top-level {@code {{...}}} spans. Nested braces are kept inside the outer
     * span; {@code \{{} and {@code \}}} are skipped.
     */
    public static List<ExpressionMatch> extractExpressions(String text) {
        List<ExpressionMatch> matches = new ArrayList<>();
        if (text == null || text.isEmpty()) return matches;

        int i = 0;
        while (i < text.length()) {
            if (text.charAt(i) == '\\' && text.startsWith("{{", i + 1)) {
                i += 3;
                continue;
            }
            if (!text.startsWith("{{", i)) {
                i++;
                continue;
            }

            int start = i;
            i += 2;
            int depth = 1;
            int exprStart = i;
            while (i < text.length() && depth > 0) {
                if (text.charAt(i) == '\\' && text.startsWith("}}", i + 1)) {
                    i += 3;
                    continue;
                }
                if (text.startsWith("{{", i)) {
                    depth++;
                    i += 2;
                } else if (text.startsWith("}}", i)) {
                    depth--;
                    if (depth == 0) {
                        matches.add(new ExpressionMatch(start, i + 2,
                                text.substring(exprStart, i).trim(), text.substring(start, i + 2)));
                    }
                    i += 2;
                } else {
                    i++;
                }
            }
        }
        return matches;
    }

    /** Literal runs (unescaped, empty runs dropped) interleaved with parsed expressions. */
    public static List<ExpressionToken> parseTemplate(String pattern) {
        List<ExpressionToken> tokens = new ArrayList<>();
        if (pattern == null) return tokens;

        int lastEnd = 0;
        for (ExpressionMatch match : extractExpressions(pattern)) {
            if (match.start > lastEnd) {
                addLiteral(tokens, pattern.substring(lastEnd, match.start));
            }
            tokens.add(parseExpression(match.expression));
            lastEnd = match.end;
        }
        if (lastEnd < pattern.length()) {
            addLiteral(tokens, pattern.substring(lastEnd));
        }
        return tokens;
    }

    private static void addLiteral(List<ExpressionToken> tokens, String raw) {
        String text = unescapeBraces(raw);
        if (!text.isEmpty()) tokens.add(ExpressionToken.literal(text));
    }

    public static String unescapeBraces(String text) {
        return text.replace("\\{{", "{{").replace("\\}}", "}}");
    }

    public static boolean hasExpressions(String text) {
        return !extractExpressions(text).isEmpty();
    }

    // ===================== CLASSIFICATION =====================

    /**
     * Classifies one expression body (without braces).
     *
     * Precedence: standalone switch, trailing switch/else modifiers, collect,
     * capture multi-roll, capture access, dice, math, variable, placeholder, again,
     * instance, multi-roll, table reference.
     */
    public static ExpressionToken parseExpression(String expr) {
        String trimmed = expr.trim();

        if (trimmed.startsWith("switch[")) {
            return ExpressionToken.of(new Expr.Switch(parseSwitchExpression(trimmed)));
        }

        String[] remaining = new String[] { trimmed };
        SwitchModifiers modifiers = extractSwitchModifiers(remaining);
        if (modifiers != null) {
            return new ExpressionToken(parseBaseExpression(remaining[0]), modifiers);
        }
        return ExpressionToken.of(parseBaseExpression(trimmed));
    }

    private static Expr.ExprInterface parseBaseExpression(String expr) {
        String trimmed = expr.trim();

        if (trimmed.startsWith("collect:")) {
            return parseCollect(trimmed);
        }

        if (isCaptureMultiRoll(trimmed)) {
            return parseCaptureMultiRoll(trimmed);
        }

        if (trimmed.startsWith("$") && !trimmed.contains("*") && isCaptureAccessPattern(trimmed)) {
            return parseCaptureAccess(trimmed);
        }

        if (trimmed.startsWith("dice:")) {
            String afterDice = trimmed.substring(5).trim();
            if (DICE_MULTI_ROLL.matcher(afterDice).find()) {
                if (isCaptureMultiRoll(afterDice)) {
                    return parseCaptureMultiRoll(trimmed);
                }
                return parseMultiRollWithDiceCount(afterDice);
            }
            return new Expr.Dice(afterDice);
        }

        if (trimmed.startsWith("math:")) {
            return new Expr.MathExpr(trimmed.substring(5).trim());
        }

        if (isBareArithmetic(trimmed)) {
            return new Expr.MathExpr(trimmed);
        }

        if (trimmed.startsWith("$") && !trimmed.contains("*")) {
            String varExpr = trimmed.substring(1);
            int dot = varExpr.indexOf('.');
            if (dot > 0) {
                return new Expr.Variable(varExpr.substring(dot + 1), varExpr.substring(0, dot));
            }
            return new Expr.Variable(varExpr, null);
        }

        if (trimmed.startsWith("@")) {
            String body = trimmed.substring(1);
            int dot = body.indexOf('.');
            if (dot > 0) {
                return new Expr.Placeholder(body.substring(0, dot), parsePropertyChain(body.substring(dot + 1)));
            }
            return new Expr.Placeholder(body, null);
        }

        if (trimmed.equals("again") || trimmed.startsWith("again|") || COUNTED_AGAIN.matcher(trimmed).find()) {
            return parseAgain(trimmed);
        }

        if (trimmed.contains("#")) {
            int separatorStart = trimmed.indexOf("|\"");
            int hashIndex = trimmed.indexOf('#');
            if (separatorStart == -1 || hashIndex < separatorStart) {
                String[] parts = trimmed.split("#", -1);
                return new Instance(parts[0].trim(), parts[1].trim());
            }
        }

        if (LITERAL_COUNT.matcher(trimmed).find() || VARIABLE_COUNT.matcher(trimmed).find()) {
            return parseMultiRoll(trimmed);
        }

        return parseTableReference(trimmed);
    }

    private static boolean isCaptureMultiRoll(String expr) {
        return expr.contains(" >> $") || expr.contains(">>$");
    }

    /** Digits, whitespace, {@code + - * /} and parentheses only, with at least one operator. */
    private static boolean isBareArithmetic(String expr) {
        if (!BARE_ARITHMETIC.matcher(expr).matches()) return false;
        for (int i = 0; i < expr.length(); i++) {
            char c = expr.charAt(i);
            if (c == '+' || c == '-' || c == '*' || c == '/' || c == '(') return true;
        }
        return false;
    }

    private static boolean isCaptureAccessPattern(String expr) {
        String afterDollar = expr.substring(1);
        return afterDollar.contains("[")
                || afterDollar.endsWith(".count")
                || afterDollar.endsWith(".value")
                || afterDollar.contains("|\"")
                || afterDollar.contains(".@");
    }

    private static List<String> parsePropertyChain(String propPart) {
        List<String> out = new ArrayList<>();
        for (String part : propPart.split("\\.", -1)) {
            out.add(part.startsWith("@") ? part.substring(1) : part);
        }
        return out;
    }

    private static Again parseAgain(String expr) {
        String separator = null;
        String mainExpr = expr;
        Matcher sep = AGAIN_SEPARATOR.matcher(expr);
        if (sep.find()) {
            separator = sep.group(1);
            mainExpr = expr.substring(0, expr.indexOf('|'));
        }
        if (mainExpr.equals("again")) {
            return new Again(null, false, separator);
        }

        List<String> parts = Arrays.asList(mainExpr.split("\\*", -1));
        Integer count = null;
        boolean unique = false;
        if (parts.size() >= 2) {
            if (DIGITS.matcher(parts.get(0)).matches()) {
                count = repeatCount(parts.get(0));
            }
            unique = parts.contains("unique");
        }
        return new Again(count, unique, separator);
    }

    private static MultiRoll parseMultiRollWithDiceCount(String expr) {
        String separator = null;
        String mainExpr = expr;
        Matcher sep = TRAILING_SEPARATOR.matcher(expr);
        if (sep.find()) {
            separator = sep.group(1);
            mainExpr = expr.substring(0, expr.indexOf('|'));
        }

        List<String> parts = Arrays.asList(mainExpr.split("\\*", -1));
        TableRef ref = parseTableReference(tableExpression(parts));
        return new MultiRoll(RollCount.dice(parts.get(0)), ref.tableId, ref.alias, ref.namespace,
                parts.contains("unique"), separator);
    }

    private static MultiRoll parseMultiRoll(String expr) {
        String separator = null;
        String mainExpr = expr;
        Matcher sep = TRAILING_SEPARATOR.matcher(expr);
        if (sep.find()) {
            separator = sep.group(1);
            mainExpr = expr.substring(0, expr.indexOf('|'));
        }

        List<String> parts = Arrays.asList(mainExpr.split("\\*", -1));
        TableRef ref = parseTableReference(tableExpression(parts));
        return new MultiRoll(parseCount(parts.get(0)), ref.tableId, ref.alias, ref.namespace,
                parts.contains("unique"), separator);
    }

    /** Last {@code *}-separated part, skipping a trailing {@code unique}. */
    private static String tableExpression(List<String> parts) {
        String tableExpr = parts.get(parts.size() - 1);
        if (tableExpr.equals("unique") && parts.size() > 2) {
            tableExpr = parts.get(parts.size() - 2);
        }
        return tableExpr;
    }

    private static RollCount parseCount(String countPart) {
        if (DIGITS.matcher(countPart).matches()) return RollCount.literal(repeatCount(countPart));
        if (countPart.startsWith("$")) return RollCount.variable(countPart.substring(1));
        return RollCount.literal(1);
    }

    /** Literal repeat count; one roll when the digits do not fit an int. */
    private static int repeatCount(String digits) {
        int n = clampedInt(digits);
        if (n == Integer.MAX_VALUE) {
            Debug.get().w(TAG, "Roll count out of range: " + digits + ", rolling once");
            return 1;
        }
        return n;
    }

    /** Signed decimal, saturated to the int range. */
    static int clampedInt(String s) {
        boolean negative = s.startsWith("-");
        String digits = negative ? s.substring(1) : s;
        int start = 0;
        while (start < digits.length() - 1 && digits.charAt(start) == '0') start++;
        digits = digits.substring(start);
        if (digits.length() > 10) return negative ? Integer.MIN_VALUE : Integer.MAX_VALUE;
        long value = Long.parseLong(digits);
        if (negative) value = -value;
        return (int) Math.max(Integer.MIN_VALUE, Math.min(Integer.MAX_VALUE, value));
    }

    /**
     * {@code id}, {@code alias.id}, {@code ns.seg.id}, each optionally followed by
     * an {@code .@prop.@prop} chain. The first '@' segment starts the chain.
     */
    public static TableRef parseTableReference(String expr) {
        String[] parts = expr.split("\\.", -1);
        if (parts.length == 1) {
            return new TableRef(parts[0], null, null, null);
        }

        int firstAt = -1;
        for (int i = 0; i < parts.length; i++) {
            if (parts[i].startsWith("@")) {
                firstAt = i;
                break;
            }
        }

        if (firstAt != -1) {
            List<String> properties = new ArrayList<>();
            for (int i = firstAt; i < parts.length; i++) {
                properties.add(parts[i].startsWith("@") ? parts[i].substring(1) : parts[i]);
            }
            String[] tableParts = Arrays.copyOfRange(parts, 0, firstAt);
            if (tableParts.length == 0) {
                // Unresolvable at runtime; kept as a plain id
                return new TableRef(expr, null, null, null);
            }
            return tableRef(tableParts, properties);
        }
        return tableRef(parts, null);
    }

    private static TableRef tableRef(String[] parts, List<String> properties) {
        if (parts.length == 1) {
            return new TableRef(parts[0], null, null, properties);
        }
        if (parts.length == 2) {
            return new TableRef(parts[1], parts[0], null, properties);
        }
        String namespace = String.join(".", Arrays.copyOfRange(parts, 0, parts.length - 1));
        return new TableRef(parts[parts.length - 1], null, namespace, properties);
    }

    private static CaptureMultiRoll parseCaptureMultiRoll(String expr) {
        Matcher m = CAPTURE_MULTI_ROLL.matcher(expr);
        if (!m.find()) {
            throw TableEngineException.parse("Invalid capture multi-roll syntax: " + expr);
        }
        String multiRollPart = m.group(1).trim();
        String captureVar = m.group(2);
        String modifierPart = m.group(3);

        String separator = null;
        boolean silent = false;
        if (!modifierPart.isEmpty()) {
            String mod = modifierPart.trim();
            silent = mod.contains("|silent");
            Matcher sep = ANY_SEPARATOR.matcher(mod);
            if (sep.find()) separator = sep.group(1);
        }

        String diceCount = null;
        String mainExpr = multiRollPart;
        if (multiRollPart.startsWith("dice:")) {
            mainExpr = multiRollPart.substring(5).trim();
            int star = mainExpr.indexOf('*');
            if (star > 0) {
                diceCount = mainExpr.substring(0, star);
                mainExpr = mainExpr.substring(star + 1);
            }
        }

        List<String> parts = Arrays.asList(mainExpr.split("\\*", -1));
        boolean unique = parts.contains("unique");

        RollCount count;
        String tableExpr;
        if (diceCount != null) {
            count = RollCount.dice(diceCount);
            tableExpr = "";
            for (String p : parts) {
                if (!p.equals("unique")) tableExpr = p;
            }
        } else {
            count = parseCount(parts.get(0));
            tableExpr = tableExpression(parts);
        }

        TableRef ref = parseTableReference(tableExpr);
        return new CaptureMultiRoll(count, ref.tableId, ref.alias, ref.namespace, unique, captureVar,
                silent ? null : separator, silent);
    }

    private static CaptureAccess parseCaptureAccess(String expr) {
        String content = expr.substring(1);
        String separator = null;
        String main = content;
        Matcher sep = CAPTURE_SEPARATOR.matcher(content);
        if (sep.find()) {
            main = sep.group(1);
            separator = sep.group(2);
        }

        Matcher indexed = CAPTURE_INDEXED.matcher(main);
        if (indexed.find()) {
            List<String> properties = indexed.group(3) != null ? parsePropertyChain(indexed.group(3)) : null;
            return new CaptureAccess(indexed.group(1), clampedInt(indexed.group(2)), properties, separator);
        }
        Matcher prop = CAPTURE_PROPERTY.matcher(main);
        if (prop.find()) {
            return new CaptureAccess(prop.group(1), null, parsePropertyChain(prop.group(2)), separator);
        }
        Matcher simple = CAPTURE_SIMPLE.matcher(main);
        if (simple.find()) {
            return new CaptureAccess(simple.group(1), null, null, separator);
        }
        throw TableEngineException.parse("Invalid capture access syntax: " + expr);
    }

    private static Collect parseCollect(String expr) {
        String content = expr.substring(8).trim();
        Matcher m = COLLECT.matcher(content);
        if (!m.find()) {
            throw TableEngineException.parse("Invalid collect syntax: " + expr);
        }
        String prop = m.group(2);
        String property = prop.startsWith("@") ? prop.substring(1) : prop;
        String modifierPart = m.group(3);

        boolean unique = modifierPart.contains("|unique");
        String separator = null;
        Matcher sep = ANY_SEPARATOR.matcher(modifierPart);
        if (sep.find()) separator = sep.group(1);
        return new Collect(m.group(1), property, unique, separator);
    }

    // ===================== SWITCH =====================

    /**
     * Strips trailing {@code .else[...]} and {@code .switch[...]} modifiers from
     * {@code expr[0]}, leaving the base expression in {@code expr[0]}.
     * Returns null when there are none.
     */
    private static SwitchModifiers extractSwitchModifiers(String[] expr) {
        String remaining = expr[0];
        String elseExpr = null;

        String[] elseMatch = extractTrailingModifier(remaining, "else");
        if (elseMatch != null) {
            elseExpr = elseMatch[0];
            remaining = elseMatch[1];
        }

        List<SwitchModifiers.Clause> clauses = new ArrayList<>();
        remaining = stripSwitchClauses(remaining, clauses);

        if (clauses.isEmpty() && elseExpr == null) {
            return null;
        }
        expr[0] = remaining;
        return new SwitchModifiers(clauses, elseExpr);
    }

    private static SwitchModifiers parseSwitchExpression(String expr) {
        String remaining = expr;
        String elseExpr = null;

        String[] elseMatch = extractTrailingModifier(remaining, "else");
        if (elseMatch != null) {
            elseExpr = elseMatch[0];
            remaining = elseMatch[1];
        }

        List<SwitchModifiers.Clause> clauses = new ArrayList<>();
        remaining = stripSwitchClauses(remaining, clauses);

        Matcher initial = STANDALONE_SWITCH.matcher(remaining);
        if (initial.matches()) {
            clauses.add(0, clause(initial.group(1), "switch["));
        } else if (!remaining.isEmpty()) {
            throw TableEngineException.parse("Invalid switch expression: " + expr);
        }

        if (clauses.isEmpty()) {
            throw TableEngineException.parse("Switch expression has no clauses: " + expr);
        }
        return new SwitchModifiers(clauses, elseExpr);
    }

    /** Peels {@code .switch[...]} suffixes right to left, prepending so declared order is kept. */
    private static String stripSwitchClauses(String remaining, List<SwitchModifiers.Clause> clauses) {
        while (true) {
            String[] match = extractTrailingModifier(remaining, "switch");
            if (match == null) return remaining;
            clauses.add(0, clause(match[0], ".switch["));
            remaining = match[1];
        }
    }

    private static SwitchModifiers.Clause clause(String content, String prefix) {
        int colon = findUnquotedColon(content);
        if (colon == -1) {
            throw TableEngineException.parse("Invalid switch syntax - missing colon: " + prefix + content + "]");
        }
        return new SwitchModifiers.Clause(content.substring(0, colon).trim(), content.substring(colon + 1).trim());
    }

    /** First ':' outside quotes and outside any {@code [ ( {} nesting, or -1. */
    static int findUnquotedColon(String str) {
        int depth = 0;
        boolean inQuote = false;
        char quoteChar = 0;
        for (int i = 0; i < str.length(); i++) {
            char c = str.charAt(i);
            char prev = i > 0 ? str.charAt(i - 1) : 0;
            if (inQuote) {
                if (c == quoteChar && prev != '\\') inQuote = false;
            } else if (c == '"' || c == '\'') {
                inQuote = true;
                quoteChar = c;
            } else if (c == '[' || c == '(' || c == '{') {
                depth++;
            } else if (c == ']' || c == ')' || c == '}') {
                depth--;
            } else if (c == ':' && depth == 0) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Finds a {@code .name[...]} block that closes exactly at the end of {@code expr}.
     * Returns {content, remainingPrefix} or null.
     */
    static String[] extractTrailingModifier(String expr, String name) {
        String suffix = "." + name + "[";
        int searchPos = expr.length();
        while (searchPos > 0) {
            int modStart = expr.lastIndexOf(suffix, searchPos - 1);
            if (modStart == -1) return null;

            int depth = 1;
            int i = modStart + suffix.length();
            boolean inQuote = false;
            char quoteChar = 0;
            while (i < expr.length() && depth > 0) {
                char c = expr.charAt(i);
                char prev = i > 0 ? expr.charAt(i - 1) : 0;
                if (inQuote) {
                    if (c == quoteChar && prev != '\\') inQuote = false;
                } else if (c == '"' || c == '\'') {
                    inQuote = true;
                    quoteChar = c;
                } else if (c == '[') {
                    depth++;
                } else if (c == ']') {
                    depth--;
                }
                i++;
            }

            if (depth == 0 && i == expr.length()) {
                return new String[] {
                        expr.substring(modStart + suffix.length(), i - 1),
                        expr.substring(0, modStart)
                };
            }
            searchPos = modStart;
        }
        return null;
    }

    // ===================== INTROSPECTION =====================

    /** Table ids referenced by table, multi-roll, instance and capture multi-roll tokens. */
    public static List<String> getReferencedTables(String pattern) {
        Set<String> ids = new LinkedHashSet<>();
        for (ExpressionToken token : parseTemplate(pattern)) {
            Expr.ExprInterface e = token.expr;
            if (e instanceof TableRef) ids.add(((TableRef) e).tableId);
            else if (e instanceof MultiRoll) ids.add(((MultiRoll) e).tableId);
            else if (e instanceof Instance) ids.add(((Instance) e).tableId);
            else if (e instanceof CaptureMultiRoll) ids.add(((CaptureMultiRoll) e).tableId);
        }
        return new ArrayList<>(ids);
    }

    /** Variable names (without '$') read or written by a pattern. */
    public static List<String> getReferencedVariables(String pattern) {
        Set<String> names = new LinkedHashSet<>();
        for (ExpressionToken token : parseTemplate(pattern)) {
            Expr.ExprInterface e = token.expr;
            if (e instanceof Expr.Variable) {
                names.add(((Expr.Variable) e).name);
            } else if (e instanceof MultiRoll) {
                String v = ((MultiRoll) e).count.variable;
                if (v != null) names.add(v);
            } else if (e instanceof CaptureMultiRoll) {
                CaptureMultiRoll c = (CaptureMultiRoll) e;
                if (c.count.variable != null) names.add(c.count.variable);
                names.add(c.captureVar);
            } else if (e instanceof CaptureAccess) {
                names.add(((CaptureAccess) e).varName);
            } else if (e instanceof Collect) {
                names.add(((Collect) e).varName);
            }
        }
        return new ArrayList<>(names);
    }
}
