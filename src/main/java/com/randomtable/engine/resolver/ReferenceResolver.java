package com.randomtable.engine.resolver;

import java.util.Map;
import java.util.Objects;
import java.util.function.BiFunction;

import com.randomtable.engine.model.Import;
import com.randomtable.engine.model.Table;
import com.randomtable.engine.model.Template;

/**
 * Maps {@code id}, {@code alias.id} and {@code name.space.id} references to a table
 * or template and the collection that owns it.
 *
 * Dotted references try, in order: the import alias named by the first segment,
 * a collection whose namespace is everything before the last segment, and a
 * declared but unwired import whose path names a collection by namespace or id.
 * Every reference then falls back to the current collection and finally to any
 * loaded collection.
 */
public final class ReferenceResolver {

    private final Map<String, LoadedCollection> collections;

    public ReferenceResolver(Map<String, LoadedCollection> collections) {
        this.collections = collections;
    }

    public TableResolution resolveTableRef(String ref, String collectionId) {
        return resolve(ref, collectionId, LoadedCollection::table, TableResolution::new);
    }

    public TemplateResolution resolveTemplateRef(String ref, String collectionId) {
        return resolve(ref, collectionId, LoadedCollection::template, TemplateResolution::new);
    }

    private <T, R> R resolve(String ref, String collectionId,
                             BiFunction<LoadedCollection, String, T> lookup,
                             BiFunction<T, String, R> result) {
        if (ref == null) return null;
        LoadedCollection current = collections.get(collectionId);

        int lastDot = ref.lastIndexOf('.');
        if (lastDot > 0) {
            String first = ref.substring(0, ref.indexOf('.'));
            String namespace = ref.substring(0, lastDot);
            String id = ref.substring(lastDot + 1);

            if (current != null) {
                LoadedCollection imported = current.imports.get(first);
                if (imported != null) {
                    T found = lookup.apply(imported, id);
                    if (found != null) return result.apply(found, imported.id);
                }
            }

            for (LoadedCollection c : collections.values()) {
                if (Objects.equals(c.namespace(), namespace)) {
                    T found = lookup.apply(c, id);
                    if (found != null) return result.apply(found, c.id);
                }
            }

            if (current != null) {
                Import declared = current.document().findImport(first);
                if (declared != null) {
                    for (LoadedCollection c : collections.values()) {
                        if (c.id.equals(collectionId)) continue;
                        if (Objects.equals(c.namespace(), declared.path) || c.id.equals(declared.path)) {
                            T found = lookup.apply(c, id);
                            if (found != null) return result.apply(found, c.id);
                        }
                    }
                }
            }
        }

        if (current != null) {
            T found = lookup.apply(current, ref);
            if (found != null) return result.apply(found, collectionId);
        }

        for (LoadedCollection c : collections.values()) {
            T found = lookup.apply(c, ref);
            if (found != null) return result.apply(found, c.id);
        }
        return null;
    }

    /** Table by plain id, in one collection when {@code collectionId} is given, else in any. */
    public Table getTable(String tableId, String collectionId) {
        if (collectionId != null) {
            LoadedCollection c = collections.get(collectionId);
            return c == null ? null : c.table(tableId);
        }
        for (LoadedCollection c : collections.values()) {
            Table t = c.table(tableId);
            if (t != null) return t;
        }
        return null;
    }

    public Template getTemplate(String templateId, String collectionId) {
        LoadedCollection c = collections.get(collectionId);
        return c == null ? null : c.template(templateId);
    }
}
