package com.randomtable.engine.runtime;

/** Description text of a rolled entry, recorded with the nesting depth it was rolled at. */
public final class EntryDescription {
    public final String tableName;
    public final String tableId;
    public final String rolledValue;
    public final String description;
    public final int depth;

    public EntryDescription(String tableName, String tableId, String rolledValue, String description, int depth) {
        this.tableName = tableName;
        this.tableId = tableId;
        this.rolledValue = rolledValue;
        this.description = description;
        this.depth = depth;
    }
}
