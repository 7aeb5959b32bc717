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
import com.randomtable.engine.model.Entry;
import com.randomtable.engine.model.SimpleTable;
import com.randomtable.engine.runtime.GenerationContext;

/**
 * Weighted selection over a simple table's entries.
 *
 * Entries weigh {@code max-min+1} for a range, else their weight (default 1).
 * Entries at weight zero or below never appear in a pool.
 */
public final class SimpleTableRoller {

    private final Random random;

    public SimpleTableRoller(Random random) {
        this.random = random;
    }

    /** Id of the entry at {@code index}: its own id, else table id plus a three digit index. */
    public static String entryId(Entry entry, int index, String tableId) {
        return entry.id != null ? entry.id : tableId + String.format("%03d", index);
    }

    public static List<WeightedEntry> buildWeightedPool(List<Entry> entries, String tableId, Set<String> excludeIds) {
        List<WeightedEntry> pool = new ArrayList<>();
        for (int i = 0; i < entries.size(); i++) {
            Entry entry = entries.get(i);
            double weight = entry.effectiveWeight();
            if (weight <= 0) continue;
            String id = entryId(entry, i, tableId);
            if (excludeIds != null && excludeIds.contains(id)) continue;
            pool.add(new WeightedEntry(entry, weight, id, tableId));
        }
        return pool;
    }

    public static double totalWeight(List<WeightedEntry> pool) {
        double sum = 0;
        for (WeightedEntry e : pool) sum += e.weight;
        return sum;
    }

    /** Cumulative-weight pick; null for an empty or weightless pool. */
    public static WeightedEntry selectByWeight(List<WeightedEntry> pool, Random random) {
        if (pool.isEmpty()) return null;
        double total = totalWeight(pool);
        if (total <= 0) return null;

        double roll = random.nextDouble() * total;
        double cumulative = 0;
        for (WeightedEntry e : pool) {
            cumulative += e.weight;
            if (roll < cumulative) return e;
        }
        return pool.get(pool.size() - 1);
    }

    /**
     * Picks an entry, or returns null when nothing can be picked. With {@code unique}
     * the table's used entries are excluded and the pick is marked used; an exhausted
     * pool then follows the configured overflow behavior.
     */
    public SelectedEntry roll(SimpleTable table, GenerationContext context, boolean unique, Set<String> excludeIds) {
        Set<String> exclude = new HashSet<>();
        if (excludeIds != null) exclude.addAll(excludeIds);
        if (unique) exclude.addAll(context.getUsedEntries(table.id));

        List<WeightedEntry> pool = buildWeightedPool(table.entries, table.id, exclude);

        if (pool.isEmpty()) {
            if (!unique) return null;
            UniqueOverflowBehavior behavior = context.config().uniqueOverflowBehavior;
            if (behavior == UniqueOverflowBehavior.ERROR) {
                throw new TableEngineException(TableEngineException.ErrorType.UNIQUE_OVERFLOW,
                        "Unique selection overflow: no more entries available in table '" + table.id + "'");
            }
            if (behavior == UniqueOverflowBehavior.CYCLE) {
                context.clearUsedEntries(table.id);
                if (buildWeightedPool(table.entries, table.id, null).isEmpty()) return null;
                return roll(table, context, true, null);
            }
            return null;
        }

        WeightedEntry selected = selectByWeight(pool, random);
        if (selected == null) return null;
        if (unique) context.markEntryUsed(table.id, selected.id);

        Map<String, String> merged = new LinkedHashMap<>(table.defaultSets);
        merged.putAll(selected.entry.sets);
        merged.put("value", selected.entry.value);

        String resultType = selected.entry.resultType != null ? selected.entry.resultType : table.resultType;
        return new SelectedEntry(selected.entry, selected.id, table.id, merged, selected.entry.assets, resultType);
    }

    public static List<EntryProbability> probabilities(SimpleTable table) {
        List<WeightedEntry> pool = buildWeightedPool(table.entries, table.id, null);
        double total = totalWeight(pool);
        List<EntryProbability> out = new ArrayList<>();
        if (total <= 0) return out;
        for (WeightedEntry e : pool) {
            out.add(new EntryProbability(e.id, e.entry.value, e.weight, e.weight / total));
        }
        return out;
    }
}
