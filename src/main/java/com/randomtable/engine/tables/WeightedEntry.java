package com.randomtable.engine.tables;

import com.randomtable.engine.model.Entry;

/** An entry in a selection pool, with its effective weight and pool id. */
public final class WeightedEntry {
    public final Entry entry;
    public final double weight;
    /** Entry id, generated when absent; prefixed with the source table id in collection pools. */
    public final String id;
    /** Owning table; differs from the rolled table only for collection tables. */
    public final String sourceTableId;

    public WeightedEntry(Entry entry, double weight, String id, String sourceTableId) {
        this.entry = entry;
        this.weight = weight;
        this.id = id;
        this.sourceTableId = sourceTableId;
    }
}
