package com.randomtable.engine.tables;

import java.util.Locale;

/** Chance of one pool member being picked. */
public final class EntryProbability {
    public final String id;
    public final String value;
    public final double weight;
    public final double probability;

    public EntryProbability(String id, String value, double weight, double probability) {
        this.id = id;
        this.value = value;
        this.weight = weight;
        this.probability = probability;
    }

    /** e.g. {@code 25.00%} */
    public String percentage() {
        return String.format(Locale.ROOT, "%.2f%%", probability * 100);
    }
}
