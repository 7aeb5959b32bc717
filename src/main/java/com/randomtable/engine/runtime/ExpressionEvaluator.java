package com.randomtable.engine.runtime;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.randomtable.debug.Debug;
import com.randomtable.engine.RollResult;
import com.randomtable.engine.TableEngineException;
import com.randomtable.engine.dice.DiceResult;
import com.randomtable.engine.dice.DiceRoller;
import com.randomtable.engine.model.Table;
import com.randomtable.engine.model.Template;
import com.randomtable.engine.parser.Expr.Again;
import com.randomtable.engine.parser.Expr.CaptureAccess;
import com.randomtable.engine.parser.Expr.CaptureMultiRoll;
import com.randomtable.engine.parser.Expr.Collect;
import com.randomtable.engine.parser.Expr.Dice;
import com.randomtable.engine.parser.Expr.ExprVisitor;
import com.randomtable.engine.parser.Expr.Instance;
import com.randomtable.engine.parser.Expr.Literal;
import com.randomtable.engine.parser.Expr.MathExpr;
import com.randomtable.engine.parser.Expr.MultiRoll;
import com.randomtable.engine.parser.Expr.Placeholder;
import com.randomtable.engine.parser.Expr.RollCount;
import com.randomtable.engine.parser.Expr.Switch;
import com.randomtable.engine.parser.Expr.TableRef;
import com.randomtable.engine.parser.Expr.Variable;
import com.randomtable.engine.parser.ExpressionMatch;
import com.randomtable.engine.parser.ExpressionToken;
import com.randomtable.engine.parser.SwitchModifiers;
import com.randomtable.engine.parser.TemplateParser;
import com.randomtable.engine.resolver.TableResolution;
import com.randomtable.engine.resolver.TemplateResolution;
import com.randomtable.engine.trace.TraceNode;
import com.randomtable.engine.trace.TraceNodeType;

import static com.randomtable.engine.trace.TraceNode.meta;

/**
 * Turns parsed {@code {{...}}} tokens into text.
 *
 * The visitor methods read the context and collection of the token being
 * evaluated from two fields that {@link #evaluateToken} swaps in and restores,
 * so nested evaluations (isolated template scopes, set values) can re-enter.
 */
public class ExpressionEvaluator implements ExprVisitor<String> {

    private static final String TAG = "Evaluator";
    private static final String DEFAULT_SEPARATOR = ", ";

    private static final Pattern BASE_VALUE_REF = Pattern.compile("\\$(?![a-zA-Z_])");
    private static final Pattern DICE_MODIFIER = Pattern.compile("([+\\-*])(\\d+)$");
    private static final Pattern DICE_COUNT = Pattern.compile("^(\\d+)d");

    private static final ObjectMapper JSON = new ObjectMapper();

    private final EvaluatorDependencies deps;
    private final DiceRoller dice;
    private final MathEvaluator math;

    // Scope of the token currently being evaluated
    private GenerationContext context;
    private String collectionId;

    public ExpressionEvaluator(EvaluatorDependencies deps, DiceRoller dice) {
        this.deps = deps;
        this.dice = dice;
        this.math = new MathEvaluator(dice);
    }

    /** Text of an evaluated pattern plus the output of each expression, in order. */
    public static final class PatternOutput {
        public final String text;
        public final List<String> expressionOutputs;

        PatternOutput(String text, List<String> expressionOutputs) {
            this.text = text;
            this.expressionOutputs = Collections.unmodifiableList(expressionOutputs);
        }
    }

    // ===================== PATTERNS =====================

    public String evaluatePattern(String pattern, GenerationContext ctx, String collId) {
        StringBuilder out = new StringBuilder();
        for (ExpressionToken token : TemplateParser.parseTemplate(pattern)) {
            if (token.isLiteral()) {
                out.append(((Literal) token.expr).text);
            } else {
                out.append(evaluateToken(token, ctx, collId));
            }
        }
        return out.toString();
    }

    /** Like {@link #evaluatePattern}, also keeping each expression's output for segment mapping. */
    public PatternOutput evaluatePatternWithOutputs(String pattern, GenerationContext ctx, String collId) {
        List<String> outputs = new ArrayList<>();
        StringBuilder out = new StringBuilder();
        int last = 0;
        for (ExpressionMatch m : TemplateParser.extractExpressions(pattern)) {
            if (m.start > last) out.append(TemplateParser.unescapeBraces(pattern.substring(last, m.start)));
            String value = evaluateToken(TemplateParser.parseExpression(m.expression), ctx, collId);
            out.append(value);
            outputs.add(value);
            last = m.end;
        }
        if (last < pattern.length()) out.append(TemplateParser.unescapeBraces(pattern.substring(last)));
        return new PatternOutput(out.toString(), outputs);
    }

    public boolean evaluateWhenClause(String expr, GenerationContext ctx) {
        return ConditionalEvaluator.evaluateWhenClause(expr, ctx);
    }

    public Integer evaluateMath(String expr, GenerationContext ctx) {
        return math.evaluate(expr, ctx);
    }

    public String evaluateToken(ExpressionToken token, GenerationContext ctx, String collId) {
        GenerationContext prevContext = this.context;
        String prevCollection = this.collectionId;
        this.context = ctx;
        this.collectionId = collId;
        try {
            String result = token.expr.accept(this);
            if (token.expr instanceof Switch || !token.hasSwitchModifiers()) {
                return result;
            }
            return evaluateSwitchModifiers(result, token.switchModifiers, ctx, collId);
        } finally {
            this.context = prevContext;
            this.collectionId = prevCollection;
        }
    }

    // ===================== SETS =====================

    /**
     * Evaluates an entry's merged sets in declaration order, merging each into the
     * placeholders of {@code tableId} as soon as it is known so later sets can read
     * earlier ones. A value that is exactly one table reference keeps the whole roll
     * as a nested {@link CaptureItem}. A set already being evaluated (a cycle) keeps
     * its raw text.
     */
    public Map<String, Object> evaluateSetValues(Map<String, String> sets, GenerationContext ctx,
                                                 String collId, String tableId) {
        Map<String, Object> evaluated = new LinkedHashMap<>();

        for (Map.Entry<String, String> e : sets.entrySet()) {
            String key = e.getKey();
            String value = e.getValue() == null ? "" : e.getValue();

            if (!value.contains("{{")) {
                evaluated.put(key, value);
                ctx.setPlaceholder(tableId, key, value);
                continue;
            }

            String setKey = tableId + "." + key;
            GenerationContext.SetEvaluationScope scope = ctx.enterSetEvaluation(setKey);
            if (scope == null) {
                Debug.get().w(TAG, "Cycle while evaluating set " + setKey + ", keeping raw value");
                evaluated.put(key, value);
                ctx.setPlaceholder(tableId, key, value);
                continue;
            }

            try (scope) {
                TableResolution single = singleTableReference(value, collId);
                Object result;
                if (single != null) {
                    TableRollResult roll = deps.rollTable(single.table, ctx, single.collectionId);
                    result = new CaptureItem(roll.text, roll.placeholders, null);
                } else {
                    result = evaluatePattern(value, ctx, collId);
                }
                evaluated.put(key, result);
                ctx.setPlaceholder(tableId, key, result);
            }
        }
        return evaluated;
    }

    /** Resolution of {@code pattern} when it is nothing but {@code {{tableRef}}}, else null. */
    private TableResolution singleTableReference(String pattern, String collId) {
        List<ExpressionMatch> matches = TemplateParser.extractExpressions(pattern);
        if (matches.size() != 1 || !pattern.trim().equals(matches.get(0).raw)) return null;

        ExpressionToken token = TemplateParser.parseExpression(matches.get(0).expression);
        if (!(token.expr instanceof TableRef) || token.hasSwitchModifiers()) return null;
        TableRef ref = (TableRef) token.expr;
        if (ref.hasProperties()) return null;
        return deps.resolveTableRef(ref.ref(), collId);
    }

    // ===================== SHARED VARIABLES =====================

    /** Evaluates document-level shared variables, in order, once per generation. */
    public void evaluateSharedVariables(Map<String, String> shared, GenerationContext ctx, String collId) {
        for (Map.Entry<String, String> e : shared.entrySet()) {
            evaluateSharedVariable(stripDollar(e.getKey()), e.getValue(), ctx, collId);
        }
    }

    /**
     * Binds {@code $varName} to the full result of {@code expression}. Single table,
     * template, nested capture or switch-to-table expressions keep their sets; anything
     * else is stored as text with no sets.
     */
    public void evaluateSharedVariable(String varName, String expression, GenerationContext ctx, String collId) {
        List<ExpressionMatch> matches = TemplateParser.extractExpressions(expression);

        if (matches.size() == 1) {
            ExpressionToken token = TemplateParser.parseExpression(matches.get(0).expression);

            if (token.expr instanceof TableRef) {
                TableRef ref = (TableRef) token.expr;
                CaptureItem item = captureTableOrTemplate(ref.ref(), ctx, collId);
                if (item != null) {
                    ctx.setSharedVariable(varName, item);
                    return;
                }
            }

            if (token.expr instanceof CaptureAccess) {
                CaptureAccess access = (CaptureAccess) token.expr;
                CaptureItem source = ctx.getSharedVariable(access.varName);
                if (source != null && !access.properties.isEmpty()
                        && !CaptureItem.isTerminal(access.properties.get(access.properties.size() - 1))) {
                    CaptureItem nested = getNestedCaptureItem(source, access.properties);
                    if (nested != null) {
                        ctx.setSharedVariable(varName, nested);
                        return;
                    }
                }
            }

            if (token.expr instanceof Switch) {
                String winner = evaluateSwitchToResultExpr(((Switch) token.expr).modifiers, ctx, collId);
                if (winner != null) {
                    ctx.setSharedVariable(varName, captureSwitchResult(winner, ctx, collId));
                    return;
                }
            }
        }

        ctx.setSharedVariable(varName, CaptureItem.text(evaluatePattern(expression, ctx, collId)));
    }

    private CaptureItem captureSwitchResult(String winner, GenerationContext ctx, String collId) {
        String resultExpr = winner.trim();

        if (!resultExpr.startsWith("\"") && !resultExpr.startsWith("'") && !resultExpr.contains("{{")) {
            TableResolution table = deps.resolveTableRef(resultExpr, collId);
            if (table != null) return rollAndCapture(table, ctx);
        }

        if (resultExpr.contains("{{")) {
            List<ExpressionMatch> inner = TemplateParser.extractExpressions(resultExpr);
            if (inner.size() == 1 && resultExpr.equals(inner.get(0).raw)) {
                ExpressionToken token = TemplateParser.parseExpression(inner.get(0).expression);
                if (token.expr instanceof TableRef) {
                    CaptureItem item = captureTableOrTemplate(((TableRef) token.expr).ref(), ctx, collId);
                    if (item != null) return item;
                }
            }
        }

        return CaptureItem.text(evaluateSwitchResult(winner, ctx, collId));
    }

    /** Rolls the table, or evaluates the template, named by {@code ref}; null if neither exists. */
    private CaptureItem captureTableOrTemplate(String ref, GenerationContext ctx, String collId) {
        TableResolution table = deps.resolveTableRef(ref, collId);
        if (table != null) return rollAndCapture(table, ctx);

        TemplateResolution template = deps.resolveTemplateRef(ref, collId);
        if (template != null) return evaluateTemplateWithCapture(template.template, template.collectionId, ctx);
        return null;
    }

    /** Rolls once and keeps text, sets and the first description the roll produced. */
    private CaptureItem rollAndCapture(TableResolution table, GenerationContext ctx) {
        int before = ctx.descriptionCount();
        TableRollResult roll = deps.rollTable(table.table, ctx, table.collectionId);
        return new CaptureItem(roll.text, roll.placeholders, ctx.firstDescriptionSince(before));
    }

    /**
     * Table- or template-level shared variables, evaluated when the owner is rolled.
     * Shadowing a document shared variable or a static variable is fatal; a name
     * already bound (by an enclosing roll) is left alone.
     */
    public void evaluateTableLevelShared(Map<String, String> shared, GenerationContext ctx,
                                         String collId, String sourceId) {
        for (Map.Entry<String, String> e : shared.entrySet()) {
            String name = e.getKey();
            String varName = stripDollar(name);

            if (ctx.wouldShadowDocumentShared(name) || ctx.wouldShadowDocumentShared(varName)) {
                throw new TableEngineException(TableEngineException.ErrorType.SHARED_SHADOW,
                        "SHARED_SHADOW in " + sourceId + ": Table/template-level shared variable '" + name
                                + "' would shadow document-level shared variable. "
                                + "Document-level shared variables take precedence.");
            }
            if (ctx.hasStaticVariable(varName)) {
                throw new TableEngineException(TableEngineException.ErrorType.SHARED_SHADOW,
                        "SHARED_SHADOW in " + sourceId + ": Shared variable '" + name
                                + "' would shadow static variable.");
            }
            if (ctx.hasSharedVariable(varName)) continue;

            evaluateSharedVariable(varName, e.getValue(), ctx, collId);
        }
    }

    private static String stripDollar(String name) {
        return name.startsWith("$") ? name.substring(1) : name;
    }

    // ===================== LEAVES =====================

    @Override
    public String visitLiteralExpr(Literal expr) {
        return expr.text;
    }

    @Override
    public String visitDiceExpr(Dice expr) {
        DiceResult result = dice.roll(expr.expression, context.config().maxExplodingDice);

        Map<String, Object> modifier = null;
        Matcher mod = DICE_MODIFIER.matcher(expr.expression);
        if (mod.find()) {
            modifier = meta("operator", mod.group(1), "value", Integer.parseInt(mod.group(2)));
        }
        Matcher countMatch = DICE_COUNT.matcher(expr.expression.trim().toLowerCase());
        int declared = countMatch.find() ? Integer.parseInt(countMatch.group(1)) : 1;

        context.traceLeaf(TraceNodeType.DICE_ROLL, "Dice: " + expr.expression, expr.expression,
                TraceNode.Output.of(result.total),
                meta("type", "dice",
                        "expression", result.expression,
                        "rolls", result.rolls,
                        "kept", result.kept,
                        "modifier", modifier,
                        "exploded", result.rolls.size() > declared,
                        "breakdown", result.breakdown));

        return String.valueOf(result.total);
    }

    @Override
    public String visitMathExpr(MathExpr expr) {
        Integer result = math.evaluate(expr.expression, context);
        return result != null ? String.valueOf(result) : "[math error]";
    }

    /** Capture (all values joined), then shared, then static; unknown is empty. */
    @Override
    public String visitVariableExpr(Variable expr) {
        String label = "$" + (expr.alias != null ? expr.alias + "." : "") + expr.name;

        CaptureVariable capture = context.getCaptureVariable(expr.name);
        if (capture != null) {
            List<String> values = new ArrayList<>();
            for (CaptureItem item : capture.items) values.add(item.value);
            String result = String.join(DEFAULT_SEPARATOR, values);
            traceVariable(label, expr, result, "capture");
            return result;
        }

        CaptureItem shared = context.getSharedVariable(expr.name);
        if (shared != null) {
            traceVariable(label, expr, shared.value, "captureShared");
            return shared.value;
        }

        String value = context.resolveVariable(expr.name);
        String result = value != null ? value : "";
        traceVariable(label, expr, result, context.hasStaticVariable(expr.name) ? "static" : "undefined");
        return result;
    }

    private void traceVariable(String label, Variable expr, String value, String source) {
        if (!context.isTraceEnabled()) return;
        context.traceLeaf(TraceNodeType.VARIABLE_ACCESS, label, expr.name, TraceNode.Output.of(value),
                meta("type", "variable", "name", expr.name, "alias", expr.alias, "source", source));
    }

    @Override
    public String visitPlaceholderExpr(Placeholder expr) {
        List<String> props = expr.properties;
        StringBuilder label = new StringBuilder("@").append(expr.name);
        for (String p : props) label.append(".@").append(p);

        if (expr.name.equals("self")) {
            return evaluateSelfPlaceholder(props.isEmpty() ? null : props.get(0));
        }

        if (props.size() > 1) {
            String first = props.get(0);
            CaptureItem item = context.getPlaceholderCaptureItem(expr.name, first);
            if (item == null) {
                Debug.get().w(TAG, "Cannot chain through non-CaptureItem property: @" + expr.name + "." + first);
                context.traceLeaf(TraceNodeType.PLACEHOLDER_ACCESS, label.toString(), expr.name,
                        TraceNode.Output.error("", "Cannot chain through non-CaptureItem"),
                        meta("type", "placeholder", "name", expr.name, "property", String.join(".", props), "found", false));
                return "";
            }
            String result = traversePropertyChain(item, props.subList(1, props.size()), "@" + expr.name + ".@" + first);
            context.traceLeaf(TraceNodeType.PLACEHOLDER_ACCESS, label.toString(), expr.name,
                    TraceNode.Output.of(result),
                    meta("type", "placeholder", "name", expr.name, "property", String.join(".", props), "found", !result.isEmpty()));
            return result;
        }

        String prop = props.isEmpty() ? null : props.get(0);
        String value = context.getPlaceholder(expr.name, prop);
        String result = value != null ? value : "";
        context.traceLeaf(TraceNodeType.PLACEHOLDER_ACCESS, label.toString(), expr.name,
                TraceNode.Output.of(result),
                meta("type", "placeholder", "name", expr.name, "property", prop, "found", value != null));
        return result;
    }

    /** {@code @self.value} is the raw entry text; {@code @self.description} is evaluated. */
    private String evaluateSelfPlaceholder(String prop) {
        if ("description".equals(prop)) {
            String raw = context.currentEntryDescription();
            String result = raw == null || raw.isEmpty() ? "" : evaluatePattern(raw, context, collectionId);
            context.traceLeaf(TraceNodeType.PLACEHOLDER_ACCESS, "@self.description", "self",
                    TraceNode.Output.of(result),
                    meta("type", "placeholder", "name", "self", "property", "description", "found", raw != null && !raw.isEmpty()));
            return result;
        }
        if ("value".equals(prop)) {
            String raw = context.currentEntryValue() == null ? "" : context.currentEntryValue();
            context.traceLeaf(TraceNodeType.PLACEHOLDER_ACCESS, "@self.value", "self",
                    TraceNode.Output.of(raw),
                    meta("type", "placeholder", "name", "self", "property", "value", "found", !raw.isEmpty()));
            return raw;
        }
        return "";
    }

    // ===================== TABLES AND TEMPLATES =====================

    @Override
    public String visitTableRefExpr(TableRef expr) {
        String ref = expr.ref();

        TableResolution table = deps.resolveTableRef(ref, collectionId);
        if (table != null) {
            TableRollResult result = deps.rollTable(table.table, context, table.collectionId);
            if (expr.hasProperties()) {
                return accessPropertyFromPlaceholders(result.placeholders, expr.properties, ref);
            }
            return result.text;
        }

        TemplateResolution template = deps.resolveTemplateRef(ref, collectionId);
        if (template != null) {
            if (expr.hasProperties()) {
                Map<String, Object> placeholders =
                        evaluateTemplateForPropertyAccess(template.template, template.collectionId, context);
                return accessPropertyFromPlaceholders(placeholders, expr.properties, ref);
            }
            return evaluateTemplateInternal(template.template, template.collectionId, context);
        }

        Debug.get().w(TAG, "Table or template not found: " + ref);
        return "";
    }

    private String accessPropertyFromPlaceholders(Map<String, Object> placeholders, List<String> properties,
                                                  String sourceRef) {
        if (placeholders == null || properties.isEmpty()) return "";

        String first = properties.get(0);
        Object value = placeholders.get(first);
        if (value == null) {
            Debug.get().w(TAG, "Property @" + first + " not found in " + sourceRef);
            return "";
        }
        if (properties.size() == 1) {
            return CaptureItem.textOf(value);
        }
        if (!(value instanceof CaptureItem)) {
            Debug.get().w(TAG, "Cannot chain through string property: " + sourceRef + ".@" + first);
            return "";
        }
        return traversePropertyChain((CaptureItem) value, properties.subList(1, properties.size()),
                sourceRef + ".@" + first);
    }

    /**
     * Runs a template in the caller's scope and returns its shared variables as
     * properties. {@code $}-prefixed single-table shared values keep their sets.
     */
    private Map<String, Object> evaluateTemplateForPropertyAccess(Template template, String collId,
                                                                  GenerationContext ctx) {
        try (GenerationContext.RecursionScope ignored = ctx.enterRecursion(template.id)) {
            if (deps.getCollection(collId) == null) return null;

            Map<String, Object> properties = new LinkedHashMap<>();
            for (Map.Entry<String, String> e : template.shared.entrySet()) {
                String key = e.getKey();
                String varName = stripDollar(key);

                if (key.startsWith("$")) {
                    TableResolution single = singleTableReference(e.getValue(), collId);
                    if (single != null) {
                        TableRollResult roll = deps.rollTable(single.table, ctx, single.collectionId);
                        properties.put(varName, new CaptureItem(roll.text, roll.placeholders, null));
                        continue;
                    }
                }
                properties.put(varName, evaluatePattern(e.getValue(), ctx, collId));
            }

            evaluatePattern(template.pattern, ctx, collId);
            return properties;
        }
    }

    /** Evaluates a referenced template in an isolated scope so its placeholders stay local. */
    String evaluateTemplateInternal(Template template, String collId, GenerationContext ctx) {
        try (GenerationContext.RecursionScope ignored = ctx.enterRecursion(template.id)) {
            if (deps.getCollection(collId) == null) return "";

            beginTemplateTrace(template, collId, ctx);
            try {
                GenerationContext isolated = isolatedTemplateScope(template, collId, ctx);
                String text = evaluatePattern(template.pattern, isolated, collId);
                ctx.endTrace(TraceNode.Output.of(text), null);
                return text;
            } catch (RuntimeException e) {
                ctx.endTrace(TraceNode.Output.error("", String.valueOf(e.getMessage())), null);
                throw e;
            }
        }
    }

    /** Like {@link #evaluateTemplateInternal}, keeping the template's shared variables as sets. */
    CaptureItem evaluateTemplateWithCapture(Template template, String collId, GenerationContext ctx) {
        try (GenerationContext.RecursionScope ignored = ctx.enterRecursion(template.id)) {
            if (deps.getCollection(collId) == null) return CaptureItem.text("");

            beginTemplateTrace(template, collId, ctx);
            try {
                GenerationContext isolated = isolatedTemplateScope(template, collId, ctx);
                String text = evaluatePattern(template.pattern, isolated, collId);

                Map<String, Object> sets = new LinkedHashMap<>();
                for (String name : template.shared.keySet()) {
                    String varName = stripDollar(name);
                    CaptureItem item = isolated.getSharedVariable(varName);
                    if (item != null) sets.put(varName, item);
                }

                ctx.endTrace(TraceNode.Output.of(text), null);
                return new CaptureItem(text, sets, null);
            } catch (RuntimeException e) {
                ctx.endTrace(TraceNode.Output.error("", String.valueOf(e.getMessage())), null);
                throw e;
            }
        }
    }

    private void beginTemplateTrace(Template template, String collId, GenerationContext ctx) {
        ctx.beginTrace(TraceNodeType.TEMPLATE_REF, "Template: " + template.displayName(), template.id,
                meta("collectionId", collId, "templateId", template.id, "pattern", template.pattern));
    }

    /** Isolated copy with the template's own shared names unbound, then re-evaluated inside it. */
    private GenerationContext isolatedTemplateScope(Template template, String collId, GenerationContext ctx) {
        GenerationContext isolated = ctx.isolatedCopy();
        if (!template.shared.isEmpty()) {
            for (String name : template.shared.keySet()) {
                isolated.removeSharedVariable(stripDollar(name));
            }
            evaluateTableLevelShared(template.shared, isolated, collId, template.id);
        }
        return isolated;
    }

    // ===================== MULTI-ROLL / AGAIN / INSTANCE =====================

    /** Resolved repeat count and where it came from: literal, variable or dice. */
    private static final class ResolvedCount {
        final int count;
        final String source;

        ResolvedCount(int count, String source) {
            this.count = count;
            this.source = source;
        }
    }

    private ResolvedCount resolveCount(RollCount count) {
        if (count.diceCount != null) {
            return new ResolvedCount(dice.roll(count.diceCount, context.config().maxExplodingDice).total, "dice");
        }
        if (count.variable == null) {
            return new ResolvedCount(count.literal, "literal");
        }

        String name = count.variable;
        int dot = name.indexOf('.');
        if (dot >= 0) {
            String varName = name.substring(0, dot);
            String property = name.substring(dot + 1);

            CaptureVariable capture = context.getCaptureVariable(varName);
            if (capture != null) {
                if (property.equals(CaptureItem.COUNT)) return new ResolvedCount(capture.count, "variable");
                Debug.get().w(TAG, "Cannot use capture property '$" + name + "' as multi-roll count");
                return new ResolvedCount(1, "variable");
            }
            if (context.getSharedVariable(varName) != null) {
                if (!property.equals(CaptureItem.COUNT)) {
                    Debug.get().w(TAG, "Cannot use capture property '$" + name + "' as multi-roll count");
                }
                return new ResolvedCount(1, "variable");
            }
        }

        // Unparseable or zero counts fall back to one roll
        Long parsed = MathEvaluator.parseLeadingInt(context.resolveVariable(name));
        int n = parsed == null || parsed == 0 ? 1 : (int) (long) parsed;
        return new ResolvedCount(n, "variable");
    }

    @Override
    public String visitMultiRollExpr(MultiRoll expr) {
        ResolvedCount count = resolveCount(expr.count);
        String ref = expr.ref();
        String separator = expr.separator != null ? expr.separator : DEFAULT_SEPARATOR;

        TableResolution table = deps.resolveTableRef(ref, collectionId);
        if (table == null) {
            TemplateResolution template = deps.resolveTemplateRef(ref, collectionId);
            if (template != null) {
                return evaluateMultiRollTemplate(template, count, expr, separator);
            }
            Debug.get().w(TAG, "Table or template not found: " + ref);
            return "";
        }

        context.beginTrace(TraceNodeType.MULTI_ROLL, count.count + "x " + expr.tableId, expr.count + "*" + expr.tableId,
                meta("count", count.count, "tableId", expr.tableId, "unique", expr.unique));

        List<String> results = new ArrayList<>();
        Set<String> usedIds = new HashSet<>();
        for (int i = 0; i < count.count; i++) {
            TableRollResult result = deps.rollTable(table.table, context, table.collectionId,
                    expr.unique, expr.unique ? usedIds : null);
            if (!result.text.isEmpty()) {
                results.add(result.text);
                if (result.entryId != null) usedIds.add(result.entryId);
            }
        }

        String text = String.join(separator, results);
        context.endTrace(TraceNode.Output.of(text),
                meta("type", "multi_roll", "tableId", expr.tableId, "countSource", count.source,
                        "count", count.count, "unique", expr.unique, "separator", separator));
        return text;
    }

    /** Repeats a template; uniqueness does not apply since templates have no entries. */
    private String evaluateMultiRollTemplate(TemplateResolution template, ResolvedCount count, MultiRoll expr,
                                             String separator) {
        context.beginTrace(TraceNodeType.MULTI_ROLL, count.count + "x " + expr.tableId + " (template)",
                expr.count + "*" + expr.tableId,
                meta("count", count.count, "tableId", expr.tableId, "unique", expr.unique, "isTemplate", true));

        List<String> results = new ArrayList<>();
        for (int i = 0; i < count.count; i++) {
            String text = evaluateTemplateInternal(template.template, template.collectionId, context);
            if (!text.isEmpty()) results.add(text);
        }

        String text = String.join(separator, results);
        context.endTrace(TraceNode.Output.of(text),
                meta("type", "multi_roll", "tableId", expr.tableId, "countSource", count.source,
                        "count", count.count, "unique", false, "separator", separator));
        return text;
    }

    @Override
    public String visitAgainExpr(Again expr) {
        String tableId = context.currentTableId();
        if (tableId == null) {
            Debug.get().w(TAG, "{{again}} used outside of table context");
            return "";
        }
        Table table = deps.getTable(tableId, collectionId);
        if (table == null) return "";

        Set<String> excludeIds = new HashSet<>();
        if (context.currentEntryId() != null) excludeIds.add(context.currentEntryId());

        int count = expr.count != null ? expr.count : 1;
        List<String> results = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            TableRollResult result = deps.rollTable(table, context, collectionId, expr.unique, excludeIds);
            if (!result.text.isEmpty()) {
                results.add(result.text);
                if (result.entryId != null && expr.unique) excludeIds.add(result.entryId);
            }
        }
        return String.join(expr.separator != null ? expr.separator : DEFAULT_SEPARATOR, results);
    }

    @Override
    public String visitInstanceExpr(Instance expr) {
        String raw = expr.tableId + "#" + expr.instanceName;

        RollResult existing = context.getInstance(expr.instanceName);
        if (existing != null) {
            context.traceLeaf(TraceNodeType.INSTANCE, "Instance: " + expr.instanceName + " (cached)", raw,
                    TraceNode.Output.cached(existing.text, true),
                    meta("type", "instance", "name", expr.instanceName, "cached", true, "tableId", expr.tableId));
            return existing.text;
        }

        TableResolution table = deps.resolveTableRef(expr.tableId, collectionId);
        if (table == null) {
            Debug.get().w(TAG, "Table not found: " + expr.tableId);
            return "";
        }

        context.beginTrace(TraceNodeType.INSTANCE, "Instance: " + expr.instanceName, raw,
                meta("tableId", expr.tableId, "instanceName", expr.instanceName));

        TableRollResult result = deps.rollTable(table.table, context, table.collectionId);
        context.setInstance(expr.instanceName, new RollResult(result.text, result.resultType, result.assets,
                result.placeholders,
                new RollResult.Metadata(expr.tableId, table.collectionId, System.currentTimeMillis(), result.entryId)));

        context.endTrace(TraceNode.Output.cached(result.text, false),
                meta("type", "instance", "name", expr.instanceName, "cached", false, "tableId", expr.tableId));
        return result.text;
    }

    // ===================== CAPTURES =====================

    /** {@code N*table >> $var}: rolls N times and stores every result as a capture. */
    @Override
    public String visitCaptureMultiRollExpr(CaptureMultiRoll expr) {
        String conflict = context.hasVariableConflict(expr.captureVar);
        if (conflict != null) {
            Debug.get().w(TAG, "Capture variable '$" + expr.captureVar + "' overwrites existing " + conflict + " variable");
        }

        ResolvedCount count = resolveCount(expr.count);
        String ref = expr.ref();
        TableResolution table = deps.resolveTableRef(ref, collectionId);
        if (table == null) {
            Debug.get().w(TAG, "Table not found: " + ref);
            return "";
        }

        String raw = expr.count + "*" + expr.tableId + " >> $" + expr.captureVar;
        context.beginTrace(TraceNodeType.CAPTURE_MULTI_ROLL, count.count + "x " + expr.tableId + " >> $" + expr.captureVar,
                raw, meta("count", count.count, "tableId", expr.tableId, "captureVar", expr.captureVar,
                        "unique", expr.unique, "silent", expr.silent));

        List<CaptureItem> items = new ArrayList<>();
        List<String> results = new ArrayList<>();
        Set<String> usedIds = new HashSet<>();
        for (int i = 0; i < count.count; i++) {
            int before = context.descriptionCount();
            TableRollResult result = deps.rollTable(table.table, context, table.collectionId,
                    expr.unique, expr.unique ? usedIds : null);
            if (!result.text.isEmpty()) {
                results.add(result.text);
                items.add(new CaptureItem(result.text, result.placeholders, context.firstDescriptionSince(before)));
                if (result.entryId != null) usedIds.add(result.entryId);
            }
        }

        context.setCaptureVariable(expr.captureVar, new CaptureVariable(items));

        String separator = expr.separator != null ? expr.separator : DEFAULT_SEPARATOR;
        String text = expr.silent ? "" : String.join(separator, results);

        if (context.isTraceEnabled()) {
            List<Map<String, Object>> captured = new ArrayList<>();
            for (CaptureItem item : items) captured.add(meta("value", item.value, "sets", item.sets));
            context.endTrace(TraceNode.Output.of(text),
                    meta("type", "capture_multi_roll", "tableId", expr.tableId, "captureVar", expr.captureVar,
                            "count", items.size(), "unique", expr.unique, "silent", expr.silent,
                            "separator", separator, "capturedItems", captured));
        }
        return text;
    }

    /**
     * {@code $var}, {@code $var[i]}, {@code $var.count}, {@code $var[i].@prop...} and
     * {@code $var.@prop} over captures, falling back to a shared variable as a single item.
     */
    @Override
    public String visitCaptureAccessExpr(CaptureAccess expr) {
        String label = expr.label();
        CaptureVariable capture = context.getCaptureVariable(expr.varName);

        if (capture == null) {
            CaptureItem shared = context.getSharedVariable(expr.varName);
            if (shared != null) {
                String result = expr.properties.isEmpty()
                        ? shared.value
                        : traversePropertyChain(shared, expr.properties, "$" + expr.varName);
                traceCaptureAccess(label, expr, TraceNode.Output.of(result), true, 1, true);
                return result;
            }

            Debug.get().w(TAG, "Capture variable not found: $" + expr.varName + " (forward reference?)");
            traceCaptureAccess(label, expr, TraceNode.Output.error("", "Variable not found"), false, null, null);
            return "";
        }

        String first = expr.properties.isEmpty() ? null : expr.properties.get(0);
        int size = capture.items.size();

        if (CaptureItem.COUNT.equals(first) && expr.index == null) {
            String result = String.valueOf(capture.count);
            traceCaptureAccess(label, expr, TraceNode.Output.of(result), true, size, null);
            return result;
        }

        if (expr.index != null) {
            int resolved = expr.index < 0 ? size + expr.index : expr.index;
            if (resolved < 0 || resolved >= size) {
                Debug.get().w(TAG, "Capture access out of bounds: $" + expr.varName + "[" + expr.index + "] (length: " + size + ")");
                traceCaptureAccess(label, expr, TraceNode.Output.error("", "Index out of bounds (" + size + " items)"),
                        false, size, null);
                return "";
            }
            CaptureItem item = capture.items.get(resolved);
            String result = expr.properties.isEmpty()
                    ? item.value
                    : traversePropertyChain(item, expr.properties, "$" + expr.varName + "[" + expr.index + "]");
            traceCaptureAccess(label, expr, TraceNode.Output.of(result), true, size, null);
            return result;
        }

        String separator = expr.separator != null ? expr.separator : DEFAULT_SEPARATOR;
        List<String> values = new ArrayList<>();
        if (first != null && !first.equals(CaptureItem.VALUE)) {
            for (CaptureItem item : capture.items) {
                String v = traversePropertyChain(item, expr.properties, "$" + expr.varName);
                if (!v.isEmpty()) values.add(v);
            }
        } else {
            for (CaptureItem item : capture.items) values.add(item.value);
        }
        String result = String.join(separator, values);
        traceCaptureAccess(label, expr, TraceNode.Output.of(result), true, size, null);
        return result;
    }

    private void traceCaptureAccess(String label, CaptureAccess expr, TraceNode.Output output, boolean found,
                                    Integer totalItems, Boolean isCaptureShared) {
        if (!context.isTraceEnabled()) return;
        String property = expr.properties.isEmpty() ? CaptureItem.VALUE : expr.properties.get(0);
        context.traceLeaf(TraceNodeType.CAPTURE_ACCESS, label, label, output,
                meta("type", "capture_access", "varName", expr.varName, "index", expr.index, "property", property,
                        "found", found, "totalItems", totalItems, "isCaptureShared", isCaptureShared));
    }

    /**
     * Follows {@code properties} through nested items. {@code value}, {@code count} and
     * {@code description} end the chain; anything after them, a missing property or a
     * plain-text link yields empty text and a warning.
     */
    String traversePropertyChain(CaptureItem item, List<String> properties, String pathPrefix) {
        CaptureItem current = item;
        String path = pathPrefix;

        for (int i = 0; i < properties.size(); i++) {
            String prop = properties.get(i);
            String currentPath = path + ".@" + prop;
            boolean last = i == properties.size() - 1;

            if (CaptureItem.isTerminal(prop)) {
                if (!last) {
                    Debug.get().w(TAG, "Cannot access properties after ." + prop + ": " + currentPath);
                    return "";
                }
                if (prop.equals(CaptureItem.VALUE)) return current.value;
                if (prop.equals(CaptureItem.COUNT)) return "1";
                return current.description != null ? current.description : "";
            }

            Object value = current.sets.get(prop);
            if (value == null) {
                Debug.get().w(TAG, "Property not found: " + currentPath);
                return "";
            }
            if (last) return CaptureItem.textOf(value);

            if (!(value instanceof CaptureItem)) {
                Debug.get().w(TAG, "Cannot chain through string property: " + currentPath);
                return "";
            }
            current = (CaptureItem) value;
            path = currentPath;
        }
        return current.value;
    }

    /** The item at the end of {@code properties}, or null if any link is terminal or plain text. */
    static CaptureItem getNestedCaptureItem(CaptureItem item, List<String> properties) {
        CaptureItem current = item;
        for (String prop : properties) {
            if (CaptureItem.isTerminal(prop)) return null;
            Object value = current.sets.get(prop);
            if (!(value instanceof CaptureItem)) return null;
            current = (CaptureItem) value;
        }
        return current;
    }

    /** {@code collect:$var.@prop}: one property across all captured items, blanks dropped. */
    @Override
    public String visitCollectExpr(Collect expr) {
        String label = "collect:$" + expr.varName + "." + expr.property + (expr.unique ? "|unique" : "");
        String separator = expr.separator != null ? expr.separator : DEFAULT_SEPARATOR;

        CaptureVariable capture = context.getCaptureVariable(expr.varName);
        List<CaptureItem> items;
        if (capture != null) {
            items = capture.items;
        } else {
            CaptureItem shared = context.getSharedVariable(expr.varName);
            if (shared == null) {
                Debug.get().w(TAG, "Capture variable not found: $" + expr.varName + " (forward reference?)");
                traceCollect(label, expr, separator, TraceNode.Output.error("", "Variable not found"),
                        Collections.emptyList(), Collections.emptyList());
                return "";
            }
            items = Collections.singletonList(shared);
        }

        List<String> all = new ArrayList<>();
        for (CaptureItem item : items) {
            String v = collectProperty(item, expr.property);
            if (!v.isEmpty()) all.add(v);
        }
        List<String> values = expr.unique ? new ArrayList<>(new LinkedHashSet<>(all)) : all;

        String result = String.join(separator, values);
        traceCollect(label, expr, separator, TraceNode.Output.of(result), all, values);
        return result;
    }

    private static String collectProperty(CaptureItem item, String property) {
        if (property.equals(CaptureItem.VALUE)) return item.value;
        if (property.equals(CaptureItem.DESCRIPTION)) return item.description != null ? item.description : "";
        String v = CaptureItem.textOf(item.sets.get(property));
        return v != null ? v : "";
    }

    private void traceCollect(String label, Collect expr, String separator, TraceNode.Output output,
                              List<String> allValues, List<String> resultValues) {
        if (!context.isTraceEnabled()) return;
        context.traceLeaf(TraceNodeType.COLLECT, label, label, output,
                meta("type", "collect", "varName", expr.varName, "property", expr.property, "unique", expr.unique,
                        "separator", separator, "allValues", allValues, "resultValues", resultValues));
    }

    // ===================== SWITCH =====================

    /** Standalone switch: first true clause, else the else clause, else empty. */
    @Override
    public String visitSwitchExpr(Switch expr) {
        SwitchModifiers modifiers = expr.modifiers;
        for (SwitchModifiers.Clause clause : modifiers.clauses) {
            if (evaluateSwitchCondition(clause.condition, null, context, collectionId)) {
                return evaluateSwitchResult(clause.resultExpr, context, collectionId);
            }
        }
        if (modifiers.hasElse()) {
            return evaluateSwitchResult(modifiers.elseExpr, context, collectionId);
        }
        Debug.get().w(TAG, "Switch expression: no clause matched and no else provided");
        return "";
    }

    /** Unevaluated result expression of the winning clause, or null. */
    private String evaluateSwitchToResultExpr(SwitchModifiers modifiers, GenerationContext ctx, String collId) {
        for (SwitchModifiers.Clause clause : modifiers.clauses) {
            if (evaluateSwitchCondition(clause.condition, null, ctx, collId)) {
                return clause.resultExpr;
            }
        }
        return modifiers.elseExpr;
    }

    /** Attached switch: {@code $} in conditions is the base result, which is also the default. */
    private String evaluateSwitchModifiers(String baseResult, SwitchModifiers modifiers,
                                           GenerationContext ctx, String collId) {
        for (SwitchModifiers.Clause clause : modifiers.clauses) {
            if (evaluateSwitchCondition(clause.condition, baseResult, ctx, collId)) {
                return evaluateSwitchResult(clause.resultExpr, ctx, collId);
            }
        }
        if (modifiers.hasElse()) {
            return evaluateSwitchResult(modifiers.elseExpr, ctx, collId);
        }
        return baseResult;
    }

    private boolean evaluateSwitchCondition(String condition, String baseResult,
                                            GenerationContext ctx, String collId) {
        String prepared = condition;
        if (baseResult != null) {
            String quoted = Matcher.quoteReplacement(jsonQuote(baseResult));
            prepared = BASE_VALUE_REF.matcher(condition).replaceAll(quoted);
        }
        return ConditionalEvaluator.evaluateWhenClause(evaluatePattern(prepared, ctx, collId), ctx);
    }

    private static String jsonQuote(String value) {
        try {
            return JSON.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot quote switch value: " + value, e);
        }
    }

    /**
     * Quoted results are literal unless they contain {@code {{}}}, in which case they
     * are interpolated. Unquoted results are evaluated as an expression.
     */
    private String evaluateSwitchResult(String resultExpr, GenerationContext ctx, String collId) {
        String trimmed = resultExpr.trim();

        if (trimmed.length() >= 2
                && ((trimmed.startsWith("\"") && trimmed.endsWith("\""))
                || (trimmed.startsWith("'") && trimmed.endsWith("'")))) {
            String inner = trimmed.substring(1, trimmed.length() - 1);
            return inner.contains("{{") ? evaluatePattern(inner, ctx, collId) : inner;
        }

        if (!trimmed.contains("{{")) {
            return evaluatePattern("{{" + trimmed + "}}", ctx, collId);
        }
        return evaluatePattern(trimmed, ctx, collId);
    }
}
