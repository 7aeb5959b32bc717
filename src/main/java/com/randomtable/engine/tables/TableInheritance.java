package com.randomtable.engine.tables;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.function.ToIntFunction;

import com.randomtable.engine.TableEngineException;
import com.randomtable.engine.model.Entry;
import com.randomtable.engine.model.SimpleTable;
import com.randomtable.engine.resolver.ReferenceResolver;
import com.randomtable.engine.resolver.TableResolution;

/**
 * Flattens {@code extends} chains of simple tables.
 *
 * Parent entries come first; a child entry with the same id is merged over the
 * parent's. Entries without an id get {@code tableId} plus a three digit index.
 * Default sets merge parent first. Results are cached per {@code collectionId:tableId}.
 */
public final class TableInheritance {

    private final ReferenceResolver resolver;
    private final ToIntFunction<String> maxDepthForCollection;
    private final Map<String, SimpleTable> cache = new HashMap<>();

    public TableInheritance(ReferenceResolver resolver, ToIntFunction<String> maxDepthForCollection) {
        this.resolver = resolver;
        this.maxDepthForCollection = maxDepthForCollection;
    }

    public SimpleTable resolve(SimpleTable table, String collectionId) {
        return resolve(table, collectionId, 0, new LinkedHashSet<>());
    }

    private SimpleTable resolve(SimpleTable table, String collectionId, int depth, Set<String> chain) {
        if (table.extendsId == null) return table;

        String cacheKey = collectionId + ":" + table.id;
        SimpleTable cached = cache.get(cacheKey);
        if (cached != null) return cached;

        if (!chain.add(cacheKey)) {
            throw new TableEngineException(TableEngineException.ErrorType.INHERITANCE_ERROR,
                    "Circular inheritance detected for table '" + table.id + "': " + String.join(" -> ", chain));
        }

        int maxDepth = maxDepthForCollection.applyAsInt(collectionId);
        if (depth >= maxDepth) {
            throw new TableEngineException(TableEngineException.ErrorType.INHERITANCE_ERROR,
                    "Inheritance depth limit exceeded for table '" + table.id + "' (max: " + maxDepth + ")");
        }

        TableResolution parentRef = resolver.resolveTableRef(table.extendsId, collectionId);
        if (parentRef == null) {
            throw new TableEngineException(TableEngineException.ErrorType.INHERITANCE_ERROR,
                    "Parent table not found: '" + table.extendsId + "' for table '" + table.id + "'");
        }
        if (!(parentRef.table instanceof SimpleTable)) {
            throw new TableEngineException(TableEngineException.ErrorType.INHERITANCE_ERROR,
                    "Cannot extend non-simple table: '" + table.extendsId + "' (type: " + parentRef.table.type() + ")");
        }

        SimpleTable parent = resolve((SimpleTable) parentRef.table, parentRef.collectionId, depth + 1, chain);

        Map<String, Entry> byId = new LinkedHashMap<>();
        for (int i = 0; i < parent.entries.size(); i++) {
            Entry e = parent.entries.get(i).copy();
            e.id = SimpleTableRoller.entryId(e, i, parent.id);
            byId.put(e.id, e);
        }
        for (int i = 0; i < table.entries.size(); i++) {
            Entry child = table.entries.get(i);
            String id = SimpleTableRoller.entryId(child, i, table.id);
            Entry base = byId.get(id);
            Entry merged = base != null ? overlay(base, child) : child.copy();
            merged.id = id;
            byId.put(id, merged);
        }

        SimpleTable resolved = new SimpleTable();
        resolved.id = table.id;
        resolved.name = table.name;
        resolved.description = table.description;
        resolved.tags = table.tags;
        resolved.hidden = table.hidden;
        resolved.resultType = table.resultType;
        resolved.shared = table.shared;
        resolved.entries = new ArrayList<>(byId.values());
        resolved.defaultSets = new LinkedHashMap<>(parent.defaultSets);
        resolved.defaultSets.putAll(table.defaultSets);
        resolved.extendsId = null;

        cache.put(cacheKey, resolved);
        return resolved;
    }

    /** Child fields that are present replace the parent's. */
    private static Entry overlay(Entry parent, Entry child) {
        Entry e = parent.copy();
        if (child.value != null) e.value = child.value;
        if (child.weight != null) e.weight = child.weight;
        if (child.range != null) e.range = child.range;
        if (child.description != null) e.description = child.description;
        if (child.tags != null && !child.tags.isEmpty()) e.tags = new ArrayList<>(child.tags);
        if (child.sets != null && !child.sets.isEmpty()) e.sets = new LinkedHashMap<>(child.sets);
        if (child.assets != null && !child.assets.isEmpty()) e.assets = new LinkedHashMap<>(child.assets);
        if (child.resultType != null) e.resultType = child.resultType;
        return e;
    }

    public void clear() {
        cache.clear();
    }
}
