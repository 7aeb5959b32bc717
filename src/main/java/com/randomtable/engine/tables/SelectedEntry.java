package com.randomtable.engine.tables;

import java.util.Map;

import com.randomtable.engine.model.Entry;

/** Outcome of a table roller: the picked entry and its merged, still unevaluated sets. */
public final class SelectedEntry {
    public final Entry entry;
    public final String id;
    public final String sourceTableId;
    /** Default sets, then entry sets, then {@code value}. */
    public final Map<String, String> mergedSets;
    public final Map<String, String> assets;
    public final String resultType;

    public SelectedEntry(Entry entry, String id, String sourceTableId, Map<String, String> mergedSets,
                         Map<String, String> assets, String resultType) {
        this.entry = entry;
        this.id = id;
        this.sourceTableId = sourceTableId;
        this.mergedSets = mergedSets;
        this.assets = assets;
        this.resultType = resultType;
    }
}
