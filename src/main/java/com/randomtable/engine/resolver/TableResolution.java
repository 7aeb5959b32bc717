package com.randomtable.engine.resolver;

import com.randomtable.engine.model.Table;

/** A resolved table and the collection it was found in. */
public final class TableResolution {
    public final Table table;
    public final String collectionId;

    public TableResolution(Table table, String collectionId) {
        this.table = table;
        this.collectionId = collectionId;
    }
}
