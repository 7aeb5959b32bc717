package com.randomtable.engine;

import static com.randomtable.engine.trace.TraceNode.meta;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.randomtable.debug.Debug;
import com.randomtable.engine.dice.DiceRoller;
import com.randomtable.engine.model.CollectionTable;
import com.randomtable.engine.model.CompositeTable;
import com.randomtable.engine.model.DocumentLoader;
import com.randomtable.engine.model.Import;
import com.randomtable.engine.model.RandomTableDocument;
import com.randomtable.engine.model.SimpleTable;
import com.randomtable.engine.model.Table;
import com.randomtable.engine.model.Template;
import com.randomtable.engine.resolver.LoadedCollection;
import com.randomtable.engine.resolver.ReferenceResolver;
import com.randomtable.engine.resolver.TableResolution;
import com.randomtable.engine.resolver.TemplateResolution;
import com.randomtable.engine.runtime.CaptureItem;
import com.randomtable.engine.runtime.EntryDescription;
import com.randomtable.engine.runtime.EvaluatorDependencies;
import com.randomtable.engine.runtime.ExpressionEvaluator;
import com.randomtable.engine.runtime.GenerationContext;
import com.randomtable.engine.runtime.TableRollResult;
import com.randomtable.engine.tables.CollectionTableRoller;
import com.randomtable.engine.tables.CompositeTableRoller;
import com.randomtable.engine.tables.SelectedEntry;
import com.randomtable.engine.tables.SimpleTableRoller;
import com.randomtable.engine.tables.TableInheritance;
import com.randomtable.engine.tables.WeightedEntry;
import com.randomtable.engine.trace.TraceNode;
import com.randomtable.engine.trace.TraceNodeType;
import com.randomtable.engine.validator.DocumentValidator;
import com.randomtable.engine.validator.ValidationResult;

/**
 * Random table engine.
 *
 * - Collections: documents registered under an id, wired together through their imports
 * - Rolls: a table, a template, or a raw pattern, each in a fresh generation context
 * - Config: engine defaults, overridden per document by its metadata
 *
 * Not thread-safe. One engine, one caller at a time.
 */
public class RandomTableEngine {

    private static final String TAG = "Engine";
    private static final String PREVIEW_SOURCE = "__preview__";

    private final Map<String, LoadedCollection> collections = new LinkedHashMap<>();
    private final EngineConfig config;
    private Map<String, String> importPaths;

    private final ReferenceResolver resolver;
    private final ExpressionEvaluator evaluator;
    private final SimpleTableRoller simpleRoller;
    private final CompositeTableRoller compositeRoller;
    private final CollectionTableRoller collectionRoller;
    private final TableInheritance inheritance;

    public RandomTableEngine() {
        this(new EngineConfig(), new Random());
    }

    public RandomTableEngine(EngineConfig config, Random random) {
        this.config = config == null ? new EngineConfig() : config.copy();
        Random rng = random == null ? new Random() : random;

        this.resolver = new ReferenceResolver(collections);
        this.evaluator = new ExpressionEvaluator(new Dependencies(), new DiceRoller(rng));
        this.simpleRoller = new SimpleTableRoller(rng);
        this.compositeRoller = new CompositeTableRoller(rng);
        this.collectionRoller = new CollectionTableRoller(rng);
        this.inheritance = new TableInheritance(resolver, this::maxInheritanceDepth);
    }

    // ===================== CONFIG =====================

    public EngineConfig config() { return config; }

    public RandomTableEngine setMaxRecursionDepth(int depth) { config.maxRecursionDepth = depth; return this; }

    public RandomTableEngine setMaxExplodingDice(int max) { config.maxExplodingDice = max; return this; }

    public RandomTableEngine setMaxInheritanceDepth(int depth) {
        config.maxInheritanceDepth = depth;
        inheritance.clear();
        return this;
    }

    public RandomTableEngine setUniqueOverflowBehavior(UniqueOverflowBehavior behavior) {
        config.uniqueOverflowBehavior = behavior == null ? UniqueOverflowBehavior.STOP : behavior;
        return this;
    }

    private int maxInheritanceDepth(String collectionId) {
        LoadedCollection c = collections.get(collectionId);
        if (c != null && c.document().metadata != null && c.document().metadata.maxInheritanceDepth != null) {
            return c.document().metadata.maxInheritanceDepth;
        }
        return config.maxInheritanceDepth;
    }

    // ===================== COLLECTIONS =====================

    public void loadCollection(RandomTableDocument document, String id, boolean isPreloaded) {
        if (document == null) {
            throw new TableEngineException(TableEngineException.ErrorType.INVALID_DOCUMENT, "Document is null: " + id);
        }
        collections.put(id, new LoadedCollection(id, document, isPreloaded));
        inheritance.clear();
        Debug.get().d(TAG, "Loaded collection " + id + " (" + document.tables.size() + " tables, "
                + document.templates.size() + " templates)");
    }

    public void loadCollection(RandomTableDocument document, String id) {
        loadCollection(document, id, false);
    }

    /** Parses and validates {@code json}; the collection is loaded only when it is valid. */
    public ValidationResult loadFromJson(String json, String id, boolean isPreloaded) throws JsonProcessingException {
        RandomTableDocument document = DocumentLoader.fromJson(json);
        ValidationResult validation = validate(document);
        if (validation.valid) {
            loadCollection(document, id, isPreloaded);
        } else {
            Debug.get().w(TAG, "Collection " + id + " not loaded: " + validation.errors().size() + " validation error(s)");
        }
        return validation;
    }

    public ValidationResult loadFromJson(String json, String id) throws JsonProcessingException {
        return loadFromJson(json, id, false);
    }

    public boolean unloadCollection(String id) {
        boolean removed = collections.remove(id) != null;
        if (removed) inheritance.clear();
        return removed;
    }

    public boolean hasCollection(String id) {
        return collections.containsKey(id);
    }

    public LoadedCollection getCollection(String id) {
        return collections.get(id);
    }

    /** Replaces a loaded collection's document in place and re-wires imports. Unknown ids are ignored. */
    public void updateDocument(String id, RandomTableDocument document) {
        LoadedCollection existing = collections.get(id);
        if (existing == null) return;
        existing.setDocument(document);
        inheritance.clear();
        resolveImports();
    }

    public List<CollectionInfo> listCollections() {
        List<CollectionInfo> out = new ArrayList<>();
        for (LoadedCollection c : collections.values()) {
            out.add(new CollectionInfo(c.id, c.name(), c.isPreloaded));
        }
        return out;
    }

    /** Re-wires imports with the most recently supplied path mapping, if any. */
    public void resolveImports() {
        resolveImports(importPaths);
    }

    /**
     * Wires each collection's import aliases to loaded collections. An import path is
     * looked up in {@code pathToId} first, then matched against namespaces, then
     * against collection ids. Unmatched imports stay unwired. The mapping is kept for
     * later re-wiring.
     */
    public void resolveImports(Map<String, String> pathToId) {
        if (pathToId != null) importPaths = new LinkedHashMap<>(pathToId);
        for (LoadedCollection collection : collections.values()) {
            List<Import> imports = collection.document().imports;
            if (imports == null || imports.isEmpty()) continue;

            collection.imports.clear();
            for (Import imp : imports) {
                LoadedCollection target = null;

                if (pathToId != null) {
                    String targetId = pathToId.get(imp.path);
                    if (targetId != null) target = collections.get(targetId);
                }
                if (target == null) {
                    for (LoadedCollection candidate : collections.values()) {
                        if (imp.path != null && imp.path.equals(candidate.namespace())) {
                            target = candidate;
                            break;
                        }
                    }
                }
                if (target == null) target = collections.get(imp.path);

                if (target != null) {
                    collection.imports.put(imp.alias, target);
                } else {
                    Debug.get().w(TAG, "Unresolved import '" + imp.alias + "' (" + imp.path + ") in " + collection.id);
                }
            }
        }
    }

    public ValidationResult validate(RandomTableDocument document) {
        return DocumentValidator.validate(document);
    }

    // ===================== QUERIES =====================

    public Table getTable(String tableId, String collectionId) {
        return resolver.getTable(tableId, collectionId);
    }

    public Template getTemplate(String templateId, String collectionId) {
        return resolver.getTemplate(templateId, collectionId);
    }

    /** Tables of one collection, or of all collections when {@code collectionId} is null. */
    public List<TableInfo> listTables(String collectionId, boolean includeHidden) {
        List<TableInfo> out = new ArrayList<>();
        if (collectionId != null) {
            LoadedCollection c = collections.get(collectionId);
            if (c != null) addTableInfos(c, includeHidden, null, out);
        } else {
            for (LoadedCollection c : collections.values()) addTableInfos(c, includeHidden, null, out);
        }
        return out;
    }

    public List<TemplateInfo> listTemplates(String collectionId) {
        List<TemplateInfo> out = new ArrayList<>();
        LoadedCollection c = collections.get(collectionId);
        if (c != null) addTemplateInfos(c, null, out);
        return out;
    }

    /** Tables reachable through {@code collectionId}'s imports, nested aliases joined with dots. */
    public List<TableInfo> listImportedTables(String collectionId, boolean includeHidden) {
        List<TableInfo> out = new ArrayList<>();
        LoadedCollection c = collections.get(collectionId);
        if (c == null) return out;
        List<String> visited = new ArrayList<>();
        visited.add(collectionId);
        for (Map.Entry<String, LoadedCollection> e : c.imports.entrySet()) {
            collectImported(e.getValue(), e.getKey(), visited, out, null, includeHidden);
        }
        return out;
    }

    public List<TemplateInfo> listImportedTemplates(String collectionId) {
        List<TemplateInfo> out = new ArrayList<>();
        LoadedCollection c = collections.get(collectionId);
        if (c == null) return out;
        List<String> visited = new ArrayList<>();
        visited.add(collectionId);
        for (Map.Entry<String, LoadedCollection> e : c.imports.entrySet()) {
            collectImported(e.getValue(), e.getKey(), visited, null, out, true);
        }
        return out;
    }

    private void collectImported(LoadedCollection collection, String alias, List<String> visited,
                                 List<TableInfo> tables, List<TemplateInfo> templates, boolean includeHidden) {
        if (visited.contains(collection.id)) return;
        visited.add(collection.id);

        if (tables != null) addTableInfos(collection, includeHidden, alias, tables);
        if (templates != null) addTemplateInfos(collection, alias, templates);

        for (Map.Entry<String, LoadedCollection> e : collection.imports.entrySet()) {
            collectImported(e.getValue(), alias + "." + e.getKey(), visited, tables, templates, includeHidden);
        }
    }

    private static void addTableInfos(LoadedCollection c, boolean includeHidden, String alias, List<TableInfo> out) {
        for (Table t : c.document().tables) {
            if (!includeHidden && t.hidden) continue;
            TableInfo info = new TableInfo();
            info.id = t.id;
            info.name = t.name;
            info.type = t.type();
            info.description = t.description;
            info.tags = t.tags;
            info.hidden = t.hidden;
            info.entryCount = t instanceof SimpleTable ? ((SimpleTable) t).entries.size() : null;
            info.resultType = t.resultType;
            if (alias != null) {
                info.alias = alias;
                info.sourceNamespace = c.namespace();
                info.sourceCollectionName = c.name();
            }
            out.add(info);
        }
    }

    private static void addTemplateInfos(LoadedCollection c, String alias, List<TemplateInfo> out) {
        for (Template t : c.document().templates) {
            TemplateInfo info = new TemplateInfo();
            info.id = t.id;
            info.name = t.name;
            info.description = t.description;
            info.tags = t.tags;
            info.resultType = t.resultType;
            if (alias != null) {
                info.alias = alias;
                info.sourceNamespace = c.namespace();
                info.sourceCollectionName = c.name();
            }
            out.add(info);
        }
    }

    // ===================== ROLLING =====================

    public RollResult roll(String tableId, String collectionId) {
        return roll(tableId, collectionId, RollOptions.DEFAULT);
    }

    public RollResult roll(String tableId, String collectionId, RollOptions options) {
        LoadedCollection collection = requireCollection(collectionId);
        Table table = collection.table(tableId);
        if (table == null) {
            throw new TableEngineException(TableEngineException.ErrorType.TABLE_NOT_FOUND,
                    "Table not found: " + tableId + " in collection " + collectionId);
        }

        GenerationContext ctx = createContext(collection, options);
        ctx.setCurrentCollection(collectionId);
        // document shared variables may have rolled tables this roll never uses
        ctx.clearDescriptions();

        ctx.beginTrace(TraceNodeType.ROOT, "Roll: " + table.displayName(), tableId,
                meta("collectionId", collectionId, "tableType", table.type()));

        TableRollResult result = rollTable(table, ctx, collectionId, false, null);

        ctx.endTrace(TraceNode.Output.of(result.text), null);

        RollResult out = new RollResult(result.text, result.resultType, result.assets, result.placeholders,
                new RollResult.Metadata(tableId, collectionId, System.currentTimeMillis(), result.entryId));
        return finish(out, ctx);
    }

    public RollResult rollTemplate(String templateId, String collectionId) {
        return rollTemplate(templateId, collectionId, RollOptions.DEFAULT);
    }

    public RollResult rollTemplate(String templateId, String collectionId, RollOptions options) {
        LoadedCollection collection = requireCollection(collectionId);
        Template template = collection.template(templateId);
        if (template == null) {
            throw new TableEngineException(TableEngineException.ErrorType.TEMPLATE_NOT_FOUND,
                    "Template not found: " + templateId + " in collection " + collectionId);
        }

        GenerationContext ctx = createContext(collection, options);
        ctx.setCurrentCollection(collectionId);
        ctx.clearDescriptions();

        ctx.beginTrace(TraceNodeType.ROOT, "Template: " + template.displayName(), templateId,
                meta("collectionId", collectionId, "pattern", template.pattern));

        if (template.shared != null && !template.shared.isEmpty()) {
            evaluator.evaluateTableLevelShared(template.shared, ctx, collectionId, templateId);
        }

        String text = evaluator.evaluatePattern(template.pattern == null ? "" : template.pattern, ctx, collectionId);

        ctx.endTrace(TraceNode.Output.of(text), null);

        RollResult out = new RollResult(text, template.resultType, null, null,
                new RollResult.Metadata(templateId, collectionId, System.currentTimeMillis(), null));
        return finish(out, ctx);
    }

    public RollResult evaluateRawPattern(String pattern, String collectionId) {
        return evaluateRawPattern(pattern, collectionId, null, RollOptions.DEFAULT);
    }

    /**
     * Evaluates {@code pattern} as if it were a template of {@code collectionId}.
     * {@code shared} plays the role of template-level shared variables and is
     * evaluated before the root trace node. The result carries each expression's output.
     */
    public RollResult evaluateRawPattern(String pattern, String collectionId, Map<String, String> shared,
                                         RollOptions options) {
        LoadedCollection collection = requireCollection(collectionId);

        GenerationContext ctx = createContext(collection, options);
        ctx.setCurrentCollection(collectionId);
        ctx.clearDescriptions();

        if (shared != null && !shared.isEmpty()) {
            evaluator.evaluateTableLevelShared(shared, ctx, collectionId, PREVIEW_SOURCE);
        }

        ctx.beginTrace(TraceNodeType.ROOT, "Pattern Preview", pattern,
                meta("collectionId", collectionId, "pattern", pattern));

        ExpressionEvaluator.PatternOutput output = evaluator.evaluatePatternWithOutputs(pattern, ctx, collectionId);

        ctx.endTrace(TraceNode.Output.of(output.text), null);

        RollResult out = new RollResult(output.text, null, null, null,
                new RollResult.Metadata(PREVIEW_SOURCE, collectionId, System.currentTimeMillis(), null));
        out.expressionOutputs = output.expressionOutputs;
        return finish(out, ctx);
    }

    private LoadedCollection requireCollection(String collectionId) {
        LoadedCollection collection = collections.get(collectionId);
        if (collection == null) {
            throw new TableEngineException(TableEngineException.ErrorType.COLLECTION_NOT_FOUND,
                    "Collection not found: " + collectionId);
        }
        return collection;
    }

    /** Static variables, document config overrides, then document shared variables evaluated once. */
    private GenerationContext createContext(LoadedCollection collection, RollOptions options) {
        RandomTableDocument doc = collection.document();
        EngineConfig effective = config.withOverrides(doc.metadata);
        GenerationContext ctx = GenerationContext.create(effective, doc.variablesOrEmpty(),
                options != null && options.enableTrace);

        Map<String, String> shared = doc.sharedOrEmpty();
        if (!shared.isEmpty()) {
            // all names first so a table-level variable rolled mid-way cannot shadow a later one
            for (String name : shared.keySet()) {
                ctx.registerDocumentSharedName(name.startsWith("$") ? name.substring(1) : name);
            }
            evaluator.evaluateSharedVariables(shared, ctx, collection.id);
        }
        return ctx;
    }

    private static RollResult finish(RollResult out, GenerationContext ctx) {
        out.trace = ctx.extractTrace();
        if (!ctx.captureVariables().isEmpty()) {
            out.captures = new LinkedHashMap<>(ctx.captureVariables());
        }
        if (ctx.descriptionCount() > 0) {
            List<EntryDescription> descriptions = new ArrayList<>(ctx.collectedDescriptions());
            descriptions.sort(Comparator.comparingInt(d -> d.depth));
            out.descriptions = descriptions;
        }
        return out;
    }

    // ===================== TABLE ROLLS =====================

    private TableRollResult rollTable(Table table, GenerationContext ctx, String collectionId,
                                      boolean unique, Set<String> excludeIds) {
        try (GenerationContext.RecursionScope ignored = ctx.enterRecursion(table.id)) {
            ctx.beginTrace(TraceNodeType.TABLE_ROLL, "Table: " + table.displayName(), table.id,
                    meta("type", table.type(), "name", table.name));

            // the caller's @self and {{again}} target survive nested rolls
            String outerTable = ctx.currentTableId();
            String outerEntry = ctx.currentEntryId();
            String outerDescription = ctx.currentEntryDescription();
            String outerValue = ctx.currentEntryValue();
            try {
                ctx.setCurrentTable(table.id, null);

                if (table.shared != null && !table.shared.isEmpty()) {
                    evaluator.evaluateTableLevelShared(table.shared, ctx, collectionId, table.id);
                }

                TableRollResult result;
                if (table instanceof SimpleTable) {
                    result = rollSimple((SimpleTable) table, ctx, collectionId, unique, excludeIds);
                } else if (table instanceof CompositeTable) {
                    result = rollComposite((CompositeTable) table, ctx, collectionId, unique, excludeIds);
                } else if (table instanceof CollectionTable) {
                    result = rollCollection((CollectionTable) table, ctx, collectionId, unique, excludeIds);
                } else {
                    throw new TableEngineException(TableEngineException.ErrorType.INVALID_DOCUMENT,
                            "Unknown table type: " + table.type());
                }

                ctx.endTrace(TraceNode.Output.of(result.text), null);
                return result;
            } catch (RuntimeException e) {
                ctx.endTrace(TraceNode.Output.error("", String.valueOf(e.getMessage())), null);
                throw e;
            } finally {
                ctx.setCurrentTable(outerTable, outerEntry);
                ctx.setCurrentEntryDescription(outerDescription);
                ctx.setCurrentEntryValue(outerValue);
            }
        }
    }

    private TableRollResult rollSimple(SimpleTable table, GenerationContext ctx, String collectionId,
                                       boolean unique, Set<String> excludeIds) {
        SimpleTable resolved = inheritance.resolve(table, collectionId);

        List<WeightedEntry> pool = SimpleTableRoller.buildWeightedPool(resolved.entries, resolved.id, excludeIds);
        double totalWeight = SimpleTableRoller.totalWeight(pool);

        SelectedEntry selected = simpleRoller.roll(resolved, ctx, unique, excludeIds);
        if (selected == null) {
            ctx.traceLeaf(TraceNodeType.ENTRY_SELECT, "No entry selected", table.id, TraceNode.Output.of(""),
                    entrySelectMeta(table.id, "", 0, totalWeight, pool.size(), unique, excludeIds));
            return TableRollResult.EMPTY;
        }

        double selectedWeight = 1;
        for (WeightedEntry e : pool) {
            if (e.id.equals(selected.id)) {
                selectedWeight = e.weight;
                break;
            }
        }
        ctx.traceLeaf(TraceNodeType.ENTRY_SELECT, "Selected: " + selected.id, table.id,
                TraceNode.Output.of(selected.entry.value),
                entrySelectMeta(table.id, selected.id, selectedWeight, totalWeight, pool.size(), unique, excludeIds));

        TableRollResult result = evaluateSelected(selected, table.id, ctx, collectionId);

        if (selected.entry.description != null && !selected.entry.description.isEmpty()) {
            String description = evaluator.evaluatePattern(selected.entry.description, ctx, collectionId);
            ctx.addDescription(resolved.displayName(), resolved.id, result.text, description);
        }
        return result;
    }

    private TableRollResult rollComposite(CompositeTable table, GenerationContext ctx, String collectionId,
                                          boolean unique, Set<String> excludeIds) {
        List<CompositeTable.Source> pool = CompositeTableRoller.buildSourcePool(table);
        double total = CompositeTableRoller.totalWeight(pool);

        CompositeTable.Source source = compositeRoller.selectSource(table);
        if (source == null) return TableRollResult.EMPTY;

        if (ctx.isTraceEnabled()) {
            List<Map<String, Object>> sources = new ArrayList<>();
            for (CompositeTable.Source s : pool) {
                double w = CompositeTableRoller.weightOf(s);
                sources.add(meta("tableId", s.tableId, "weight", w, "probability", total > 0 ? w / total : 0.0));
            }
            ctx.traceLeaf(TraceNodeType.COMPOSITE_SELECT, "Source: " + source.tableId, table.id,
                    TraceNode.Output.of(source.tableId),
                    meta("type", "composite_select", "sources", sources, "selectedTableId", source.tableId));
        }

        TableResolution ref = resolver.resolveTableRef(source.tableId, collectionId);
        if (ref == null) {
            throw new TableEngineException(TableEngineException.ErrorType.TABLE_NOT_FOUND,
                    "Source table not found: " + source.tableId + " (composite '" + table.id + "')");
        }

        TableRollResult result = rollTable(ref.table, ctx, ref.collectionId, unique, excludeIds);

        String resultType = result.resultType;
        if (resultType == null) resultType = ref.table.resultType;
        if (resultType == null) resultType = table.resultType;
        return new TableRollResult(result.text, resultType, result.assets, result.placeholders, result.entryId);
    }

    private TableRollResult rollCollection(CollectionTable table, GenerationContext ctx, String collectionId,
                                           boolean unique, Set<String> excludeIds) {
        List<SimpleTable> sources = new ArrayList<>();
        for (String id : table.collections) {
            TableResolution ref = resolver.resolveTableRef(id, collectionId);
            if (ref == null || !(ref.table instanceof SimpleTable)) {
                Debug.get().w(TAG, "Collection '" + table.id + "' skips '" + id + "': not a loaded simple table");
                continue;
            }
            sources.add(inheritance.resolve((SimpleTable) ref.table, ref.collectionId));
        }

        int totalEntries = 0;
        double totalWeight = 0;
        for (SimpleTable s : sources) {
            List<WeightedEntry> pool = SimpleTableRoller.buildWeightedPool(s.entries, s.id, null);
            totalEntries += pool.size();
            totalWeight += SimpleTableRoller.totalWeight(pool);
        }
        ctx.traceLeaf(TraceNodeType.COLLECTION_MERGE, "Merged " + table.collections.size() + " tables", table.id,
                TraceNode.Output.of(totalEntries + " entries"),
                meta("type", "collection_merge", "sourceTables", table.collections,
                        "totalEntries", totalEntries, "totalWeight", totalWeight));

        SelectedEntry selected = collectionRoller.roll(table, sources, ctx, unique, excludeIds);
        if (selected == null) return TableRollResult.EMPTY;

        double selectedWeight = selected.entry.effectiveWeight();
        ctx.traceLeaf(TraceNodeType.ENTRY_SELECT, "Selected: " + selected.id, table.id,
                TraceNode.Output.of(selected.entry.value),
                entrySelectMeta(table.id, selected.id, selectedWeight, totalWeight, totalEntries, unique, excludeIds));

        TableRollResult result = evaluateSelected(selected, table.id, ctx, collectionId);

        if (selected.entry.description != null && !selected.entry.description.isEmpty()) {
            String tableName = selected.sourceTableId;
            for (SimpleTable s : sources) {
                if (s.id.equals(selected.sourceTableId)) {
                    tableName = s.displayName();
                    break;
                }
            }
            String description = evaluator.evaluatePattern(selected.entry.description, ctx, collectionId);
            ctx.addDescription(tableName, selected.sourceTableId, result.text, description);
        }
        return result;
    }

    /**
     * Exposes the entry to {@code @self}, evaluates and merges its sets under
     * {@code tableId}, then renders its value. The enclosing {@link #rollTable}
     * restores the caller's self state.
     */
    private TableRollResult evaluateSelected(SelectedEntry selected, String tableId, GenerationContext ctx,
                                             String collectionId) {
        ctx.setCurrentTable(tableId, selected.id);
        ctx.setCurrentEntryDescription(selected.entry.description);
        ctx.setCurrentEntryValue(selected.entry.value);

        // value is rendered once, after the other sets, and doubles as the text
        Map<String, String> sets = new LinkedHashMap<>(selected.mergedSets);
        sets.remove(CaptureItem.VALUE);
        Map<String, Object> evaluated = sets.isEmpty()
                ? new LinkedHashMap<>()
                : evaluator.evaluateSetValues(sets, ctx, collectionId, tableId);

        String text = evaluator.evaluatePattern(selected.entry.value == null ? "" : selected.entry.value,
                ctx, collectionId);
        evaluated.put(CaptureItem.VALUE, text);
        ctx.mergePlaceholderSets(tableId, evaluated);
        return new TableRollResult(text, selected.resultType, selected.assets, evaluated, selected.id);
    }

    private static Map<String, Object> entrySelectMeta(String tableId, String entryId, double selectedWeight,
                                                       double totalWeight, int poolSize, boolean unique,
                                                       Set<String> excludeIds) {
        return meta("type", "entry_select",
                "tableId", tableId,
                "entryId", entryId,
                "selectedWeight", selectedWeight,
                "totalWeight", totalWeight,
                "probability", totalWeight > 0 ? selectedWeight / totalWeight : 0.0,
                "poolSize", poolSize,
                "unique", unique,
                "excludedIds", excludeIds == null ? null : new ArrayList<>(excludeIds));
    }

    // ===================== EVALUATOR CALLBACKS =====================

    private final class Dependencies implements EvaluatorDependencies {

        @Override
        public TableResolution resolveTableRef(String ref, String collectionId) {
            return resolver.resolveTableRef(ref, collectionId);
        }

        @Override
        public TemplateResolution resolveTemplateRef(String ref, String collectionId) {
            return resolver.resolveTemplateRef(ref, collectionId);
        }

        @Override
        public TableRollResult rollTable(Table table, GenerationContext context, String collectionId,
                                         boolean unique, Set<String> excludeIds) {
            return RandomTableEngine.this.rollTable(table, context, collectionId, unique, excludeIds);
        }

        @Override
        public LoadedCollection getCollection(String id) {
            return collections.get(id);
        }

        @Override
        public Table getTable(String tableId, String collectionId) {
            return resolver.getTable(tableId, collectionId);
        }
    }
}
