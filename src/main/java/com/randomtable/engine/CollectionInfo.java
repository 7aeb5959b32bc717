package com.randomtable.engine;

public final class CollectionInfo {
    public final String id;
    public final String name;
    public final boolean isPreloaded;

    public CollectionInfo(String id, String name, boolean isPreloaded) {
        this.id = id;
        this.name = name;
        this.isPreloaded = isPreloaded;
    }
}
