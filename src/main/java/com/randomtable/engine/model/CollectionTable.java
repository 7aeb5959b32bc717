package com.randomtable.engine.model;

import java.util.ArrayList;
import java.util.List;

/** Rolls once over the merged entry pool of several tables. */
public class CollectionTable extends Table {
    public List<String> collections = new ArrayList<>();

    @Override
    public String type() {
        return "collection";
    }
}
