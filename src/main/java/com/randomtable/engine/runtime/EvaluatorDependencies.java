package com.randomtable.engine.runtime;

import java.util.Set;

import com.randomtable.engine.model.Table;
import com.randomtable.engine.resolver.LoadedCollection;
import com.randomtable.engine.resolver.TableResolution;
import com.randomtable.engine.resolver.TemplateResolution;

/**
 * What the expression evaluator needs from the engine. Implemented by the engine
 * so the evaluator can roll tables without depending on it directly.
 */
public interface EvaluatorDependencies {

    TableResolution resolveTableRef(String ref, String collectionId);

    TemplateResolution resolveTemplateRef(String ref, String collectionId);

    /**
     * Rolls {@code table}. With {@code unique} the table's used entries are excluded
     * and the pick is marked used; {@code excludeIds} may be null.
     */
    TableRollResult rollTable(Table table, GenerationContext context, String collectionId,
                              boolean unique, Set<String> excludeIds);

    default TableRollResult rollTable(Table table, GenerationContext context, String collectionId) {
        return rollTable(table, context, collectionId, false, null);
    }

    LoadedCollection getCollection(String id);

    Table getTable(String tableId, String collectionId);
}
