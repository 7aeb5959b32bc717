package com.randomtable.engine.runtime;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.randomtable.engine.EngineConfig;
import com.randomtable.engine.RollResult;
import com.randomtable.engine.TableEngineException;
import com.randomtable.engine.trace.RollTrace;
import com.randomtable.engine.trace.TraceNode;
import com.randomtable.engine.trace.TraceNodeType;
import com.randomtable.engine.trace.TraceRecorder;

/**
 * Mutable environment threaded through one generation.
 *
 * Generation-wide fields live in a shared {@link GenerationState}. Two maps are
 * per scope: shared variables and placeholders. {@link #isolatedCopy()} gives a
 * scope with empty placeholders and a copy of the shared variables, used when a
 * template is evaluated from another pattern.
 *
 * Self state (current table, entry, value, description, collection) is never
 * inherited by an isolated scope.
 */
public final class GenerationContext {

    private final GenerationState state;

    private final Map<String, CaptureItem> sharedVariables;
    private final Map<String, Map<String, Object>> placeholders;

    private String currentTableId;
    private String currentEntryId;
    private String currentEntryDescription;
    private String currentEntryValue;
    private String currentCollectionId;

    private GenerationContext(GenerationState state,
                              Map<String, CaptureItem> sharedVariables,
                              Map<String, Map<String, Object>> placeholders) {
        this.state = state;
        this.sharedVariables = sharedVariables;
        this.placeholders = placeholders;
    }

    public static GenerationContext create(EngineConfig config, Map<String, String> staticVariables, boolean enableTrace) {
        return new GenerationContext(new GenerationState(config, staticVariables, enableTrace),
                new LinkedHashMap<>(), new LinkedHashMap<>());
    }

    public static GenerationContext create(EngineConfig config, Map<String, String> staticVariables) {
        return create(config, staticVariables, false);
    }

    /** Scope for a cross-pattern template: empty placeholders, copied shared variables, shared state. */
    public GenerationContext isolatedCopy() {
        return new GenerationContext(state, new LinkedHashMap<>(sharedVariables), new LinkedHashMap<>());
    }

    public EngineConfig config() {
        return state.config;
    }

    // ===================== VARIABLES =====================

    public Map<String, String> staticVariables() {
        return state.staticVariables;
    }

    public boolean hasStaticVariable(String name) {
        return state.staticVariables.containsKey(name);
    }

    /** Shared value first, then static value; null when neither exists. */
    public String resolveVariable(String name) {
        CaptureItem shared = sharedVariables.get(name);
        if (shared != null) return shared.value;
        return state.staticVariables.get(name);
    }

    public CaptureItem getSharedVariable(String name) {
        return sharedVariables.get(name);
    }

    public void setSharedVariable(String name, CaptureItem item) {
        sharedVariables.put(name, item);
    }

    public boolean hasSharedVariable(String name) {
        return sharedVariables.containsKey(name);
    }

    public void removeSharedVariable(String name) {
        sharedVariables.remove(name);
    }

    public void registerDocumentSharedName(String name) {
        state.documentSharedNames.add(name);
    }

    public boolean wouldShadowDocumentShared(String name) {
        return state.documentSharedNames.contains(name);
    }

    // ===================== PLACEHOLDERS =====================

    /**
     * Text of {@code @name.prop}; {@code prop} defaults to {@code value}.
     * Returns null when the table or property is unknown.
     */
    public String getPlaceholder(String name, String prop) {
        Map<String, Object> sets = placeholders.get(name);
        if (sets == null) return null;
        return CaptureItem.textOf(sets.get(prop == null ? CaptureItem.VALUE : prop));
    }

    /** The nested item behind {@code @name.prop}, or null if absent or plain text. */
    public CaptureItem getPlaceholderCaptureItem(String name, String prop) {
        Map<String, Object> sets = placeholders.get(name);
        if (sets == null) return null;
        Object v = sets.get(prop);
        return v instanceof CaptureItem ? (CaptureItem) v : null;
    }

    public Map<String, Object> getPlaceholders(String name) {
        Map<String, Object> sets = placeholders.get(name);
        return sets == null ? null : Collections.unmodifiableMap(sets);
    }

    /** Adds {@code sets} to the existing placeholders of {@code name}. */
    public void setPlaceholders(String name, Map<String, Object> sets) {
        placeholders.computeIfAbsent(name, k -> new LinkedHashMap<>()).putAll(sets);
    }

    public void setPlaceholder(String name, String key, Object value) {
        placeholders.computeIfAbsent(name, k -> new LinkedHashMap<>()).put(key, value);
    }

    /** New sets win over existing ones. */
    public void mergePlaceholderSets(String name, Map<String, Object> sets) {
        Map<String, Object> merged = new LinkedHashMap<>();
        Map<String, Object> existing = placeholders.get(name);
        if (existing != null) merged.putAll(existing);
        merged.putAll(sets);
        placeholders.put(name, merged);
    }

    // ===================== RECURSION =====================

    /** Scoped recursion slot; closing releases it. */
    public final class RecursionScope implements AutoCloseable {
        private boolean closed;

        @Override
        public void close() {
            if (closed) return;
            closed = true;
            decrementRecursion();
        }
    }

    /**
     * Takes one recursion slot for {@code sourceId}, or throws RECURSION_LIMIT.
     * Use with try-with-resources.
     */
    public RecursionScope enterRecursion(String sourceId) {
        if (!incrementRecursion()) {
            decrementRecursion();
            throw TableEngineException.recursionLimit(sourceId, state.config.maxRecursionDepth);
        }
        return new RecursionScope();
    }

    /** Increments and reports whether the depth is still within the limit. */
    public boolean incrementRecursion() {
        state.recursionDepth++;
        return state.recursionDepth <= state.config.maxRecursionDepth;
    }

    public void decrementRecursion() {
        state.recursionDepth = Math.max(0, state.recursionDepth - 1);
    }

    public int recursionDepth() {
        return state.recursionDepth;
    }

    // ===================== UNIQUENESS / INSTANCES =====================

    public Set<String> getUsedEntries(String tableId) {
        return state.usedEntries.computeIfAbsent(tableId, k -> new HashSet<>());
    }

    public void markEntryUsed(String tableId, String entryId) {
        getUsedEntries(tableId).add(entryId);
    }

    public void clearUsedEntries(String tableId) {
        state.usedEntries.remove(tableId);
    }

    public void setInstance(String name, RollResult result) {
        state.instances.put(name, result);
    }

    public RollResult getInstance(String name) {
        return state.instances.get(name);
    }

    // ===================== CAPTURES =====================

    public CaptureVariable getCaptureVariable(String name) {
        return state.captureVariables.get(name);
    }

    /** Stores the capture, overwriting. Returns whether a capture of that name existed. */
    public boolean setCaptureVariable(String name, CaptureVariable capture) {
        return state.captureVariables.put(name, capture) != null;
    }

    public Map<String, CaptureVariable> captureVariables() {
        return Collections.unmodifiableMap(state.captureVariables);
    }

    /** Kind of existing binding for {@code name}: "capture", "shared", "static", or null. */
    public String hasVariableConflict(String name) {
        if (state.captureVariables.containsKey(name)) return "capture";
        if (sharedVariables.containsKey(name)) return "shared";
        if (state.staticVariables.containsKey(name)) return "static";
        return null;
    }

    // ===================== SELF STATE =====================

    public void setCurrentTable(String tableId, String entryId) {
        this.currentTableId = tableId;
        this.currentEntryId = entryId;
    }

    public String currentTableId() { return currentTableId; }
    public String currentEntryId() { return currentEntryId; }

    public void setCurrentEntryDescription(String description) { this.currentEntryDescription = description; }
    public String currentEntryDescription() { return currentEntryDescription; }

    public void setCurrentEntryValue(String value) { this.currentEntryValue = value; }
    public String currentEntryValue() { return currentEntryValue; }

    public void setCurrentCollection(String collectionId) { this.currentCollectionId = collectionId; }
    public String currentCollectionId() { return currentCollectionId; }

    // ===================== DESCRIPTIONS =====================

    /** Records a description at the current recursion depth. */
    public void addDescription(String tableName, String tableId, String rolledValue, String description) {
        addDescription(tableName, tableId, rolledValue, description, state.recursionDepth);
    }

    public void addDescription(String tableName, String tableId, String rolledValue, String description, int depth) {
        state.collectedDescriptions.add(new EntryDescription(tableName, tableId, rolledValue, description, depth));
    }

    public List<EntryDescription> collectedDescriptions() {
        return Collections.unmodifiableList(state.collectedDescriptions);
    }

    public int descriptionCount() {
        return state.collectedDescriptions.size();
    }

    /** Description of the first entry recorded at or after {@code fromIndex}, or null. */
    public String firstDescriptionSince(int fromIndex) {
        List<EntryDescription> all = state.collectedDescriptions;
        return fromIndex < all.size() ? all.get(fromIndex).description : null;
    }

    public void clearDescriptions() {
        state.collectedDescriptions.clear();
    }

    // ===================== SET CYCLE DETECTION =====================

    /** Marks {@code key} in flight. False if it already was, i.e. a cycle. */
    public boolean beginSetEvaluation(String key) {
        return state.evaluatingSetKeys.add(key);
    }

    /** Scoped form of {@link #beginSetEvaluation}: null on a cycle, else a guard releasing the key. */
    public SetEvaluationScope enterSetEvaluation(String key) {
        return beginSetEvaluation(key) ? new SetEvaluationScope(key) : null;
    }

    public final class SetEvaluationScope implements AutoCloseable {
        private final String key;

        private SetEvaluationScope(String key) {
            this.key = key;
        }

        @Override
        public void close() {
            endSetEvaluation(key);
        }
    }

    public void endSetEvaluation(String key) {
        state.evaluatingSetKeys.remove(key);
    }

    public Set<String> evaluatingSetKeys() {
        return Collections.unmodifiableSet(state.evaluatingSetKeys);
    }

    // ===================== TRACE =====================

    public boolean isTraceEnabled() {
        return state.trace != null;
    }

    public void beginTrace(TraceNodeType type, String label, String raw, Map<String, Object> parsed) {
        TraceRecorder t = state.trace;
        if (t != null) t.begin(type, label, new TraceNode.Input(raw, parsed));
    }

    public void endTrace(TraceNode.Output output, Map<String, Object> metadata) {
        TraceRecorder t = state.trace;
        if (t != null) t.end(output, metadata);
    }

    public void traceLeaf(TraceNodeType type, String label, String raw, TraceNode.Output output, Map<String, Object> metadata) {
        TraceRecorder t = state.trace;
        if (t != null) t.leaf(type, label, new TraceNode.Input(raw, null), output, metadata);
    }

    public RollTrace extractTrace() {
        TraceRecorder t = state.trace;
        return t == null ? null : t.extract();
    }
}
