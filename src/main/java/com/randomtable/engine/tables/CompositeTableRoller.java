package com.randomtable.engine.tables;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import com.randomtable.engine.model.CompositeTable;

/** Chooses which source table a composite table rolls on. */
public final class CompositeTableRoller {

    private final Random random;

    public CompositeTableRoller(Random random) {
        this.random = random;
    }

    /** Sources with positive weight (default 1), in declaration order. */
    public static List<CompositeTable.Source> buildSourcePool(CompositeTable table) {
        List<CompositeTable.Source> pool = new ArrayList<>();
        for (CompositeTable.Source s : table.sources) {
            if (weightOf(s) > 0) pool.add(s);
        }
        return pool;
    }

    public static double weightOf(CompositeTable.Source source) {
        return source.weight != null ? source.weight : 1.0;
    }

    public static double totalWeight(List<CompositeTable.Source> pool) {
        double sum = 0;
        for (CompositeTable.Source s : pool) sum += weightOf(s);
        return sum;
    }

    /** The chosen source, or null when no source has weight. */
    public CompositeTable.Source selectSource(CompositeTable table) {
        List<CompositeTable.Source> pool = buildSourcePool(table);
        if (pool.isEmpty()) return null;
        double total = totalWeight(pool);
        if (total <= 0) return null;

        double roll = random.nextDouble() * total;
        double cumulative = 0;
        for (CompositeTable.Source s : pool) {
            cumulative += weightOf(s);
            if (roll < cumulative) return s;
        }
        return pool.get(pool.size() - 1);
    }
}
