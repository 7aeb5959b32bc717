package com.randomtable.engine.model;

/** Reference to another document, addressed in patterns as {@code alias.tableId}. */
public class Import {
    public String path;
    public String alias;
    public String description;

    public Import() {}

    public Import(String path, String alias) {
        this.path = path;
        this.alias = alias;
    }
}
