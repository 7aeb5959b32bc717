package com.randomtable.engine.tables;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

import com.randomtable.engine.TableEngineException;
import com.randomtable.engine.UniqueOverflowBehavior;
import com.randomtable.engine.model.CollectionTable;
import com.randomtable.engine.model.SimpleTable;
import com.randomtable.engine.runtime.GenerationContext;

/**
 * Rolls over the union of several simple tables' entries. Pool ids are
 * {@code sourceTableId.entryId} so entries from different tables never collide.
 */
public final class CollectionTableRoller {

    private final Random random;

    public CollectionTableRoller(Random random) {
        this.random = random;
    }

    public static List<WeightedEntry> mergeTableEntries(List<SimpleTable> sources, Set<String> excludeIds) {
        List<WeightedEntry> merged = new ArrayList<>();
        for (SimpleTable source : sources) {
            for (WeightedEntry e : SimpleTableRoller.buildWeightedPool(source.entries, source.id, null)) {
                String prefixed = source.id + "." + e.id;
                if (excludeIds != null && excludeIds.contains(prefixed)) continue;
                merged.add(new WeightedEntry(e.entry, e.weight, prefixed, source.id));
            }
        }
        return merged;
    }

    /**
     * Picks from the merged pool of {@code sources} (already resolved simple tables),
     * with the same uniqueness and overflow rules as a simple table.
     */
    public SelectedEntry roll(CollectionTable table, List<SimpleTable> sources, GenerationContext context,
                              boolean unique, Set<String> excludeIds) {
        if (sources.isEmpty()) return null;

        Set<String> exclude = new HashSet<>();
        if (excludeIds != null) exclude.addAll(excludeIds);
        if (unique) exclude.addAll(context.getUsedEntries(table.id));

        List<WeightedEntry> pool = mergeTableEntries(sources, exclude);

        if (pool.isEmpty()) {
            if (!unique) return null;
            UniqueOverflowBehavior behavior = context.config().uniqueOverflowBehavior;
            if (behavior == UniqueOverflowBehavior.ERROR) {
                throw new TableEngineException(TableEngineException.ErrorType.UNIQUE_OVERFLOW,
                        "Unique selection overflow: no more entries available in collection '" + table.id + "'");
            }
            if (behavior == UniqueOverflowBehavior.CYCLE) {
                context.clearUsedEntries(table.id);
                if (mergeTableEntries(sources, null).isEmpty()) return null;
                return roll(table, sources, context, true, null);
            }
            return null;
        }

        WeightedEntry selected = SimpleTableRoller.selectByWeight(pool, random);
        if (selected == null) return null;
        if (unique) context.markEntryUsed(table.id, selected.id);

        SimpleTable source = null;
        for (SimpleTable s : sources) {
            if (s.id.equals(selected.sourceTableId)) {
                source = s;
                break;
            }
        }

        Map<String, String> merged = new LinkedHashMap<>();
        if (source != null) merged.putAll(source.defaultSets);
        merged.putAll(table.defaultSets);
        merged.putAll(selected.entry.sets);
        merged.put("value", selected.entry.value);

        String resultType = selected.entry.resultType;
        if (resultType == null && source != null) resultType = source.resultType;
        if (resultType == null) resultType = table.resultType;

        return new SelectedEntry(selected.entry, selected.id, selected.sourceTableId, merged,
                selected.entry.assets, resultType);
    }
}
