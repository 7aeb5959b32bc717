package com.randomtable.engine.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

public class Entry {
    public String id;
    public String value;
    public Double weight;
    /** Inclusive {@code [min, max]}; its width replaces the weight. */
    public int[] range;
    public String description;
    public List<String> tags = new ArrayList<>();
    public LinkedHashMap<String, String> sets = new LinkedHashMap<>();
    public LinkedHashMap<String, String> assets = new LinkedHashMap<>();
    public String resultType;

    public Entry() {}

    public Entry(String id, String value) {
        this.id = id;
        this.value = value;
    }

    /** Selection weight: range width when a range is given, else weight (default 1). */
    public double effectiveWeight() {
        if (range != null && range.length == 2) return range[1] - range[0] + 1;
        return weight != null ? weight : 1.0;
    }

    /** Shallow copy with fresh set/asset maps. */
    public Entry copy() {
        Entry e = new Entry(id, value);
        e.weight = weight;
        e.range = range;
        e.description = description;
        e.tags = tags == null ? new ArrayList<>() : new ArrayList<>(tags);
        e.sets = sets == null ? new LinkedHashMap<>() : new LinkedHashMap<>(sets);
        e.assets = assets == null ? new LinkedHashMap<>() : new LinkedHashMap<>(assets);
        e.resultType = resultType;
        return e;
    }
}
