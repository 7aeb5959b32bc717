package com.randomtable.engine.resolver;

import java.util.LinkedHashMap;
import java.util.Map;

import com.randomtable.engine.model.RandomTableDocument;
import com.randomtable.engine.model.Table;
import com.randomtable.engine.model.Template;

/**
 * A document registered with the engine under an id, with id indexes over its
 * tables and templates and the collections its import aliases point at.
 */
public final class LoadedCollection {
    public final String id;
    public final boolean isPreloaded;
    public final String source;

    /** alias → imported collection, filled by import resolution. */
    public final Map<String, LoadedCollection> imports = new LinkedHashMap<>();

    private RandomTableDocument document;
    private final Map<String, Table> tableIndex = new LinkedHashMap<>();
    private final Map<String, Template> templateIndex = new LinkedHashMap<>();

    public LoadedCollection(String id, RandomTableDocument document, boolean isPreloaded) {
        this.id = id;
        this.isPreloaded = isPreloaded;
        this.source = isPreloaded ? "preloaded" : id;
        setDocument(document);
    }

    public RandomTableDocument document() {
        return document;
    }

    /** Replaces the document and rebuilds both indexes. Import wiring is left to the caller. */
    public void setDocument(RandomTableDocument document) {
        this.document = document;
        tableIndex.clear();
        templateIndex.clear();
        for (Table t : document.tables) tableIndex.put(t.id, t);
        for (Template t : document.templates) templateIndex.put(t.id, t);
    }

    public Table table(String tableId) {
        return tableIndex.get(tableId);
    }

    public Template template(String templateId) {
        return templateIndex.get(templateId);
    }

    public String namespace() {
        return document.metadata == null ? null : document.metadata.namespace;
    }

    public String name() {
        return document.metadata == null ? null : document.metadata.name;
    }
}
