package com.randomtable.engine.model;

import java.util.ArrayList;
import java.util.List;

/** Picks one source table by weight and rolls it. */
public class CompositeTable extends Table {

    public static class Source {
        public String tableId;
        public Double weight;

        public Source() {}

        public Source(String tableId, Double weight) {
            this.tableId = tableId;
            this.weight = weight;
        }
    }

    public List<Source> sources = new ArrayList<>();

    @Override
    public String type() {
        return "composite";
    }
}
