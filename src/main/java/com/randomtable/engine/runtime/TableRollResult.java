package com.randomtable.engine.runtime;

import java.util.Collections;
import java.util.Map;

/** Result of one table roll as seen by the evaluator. */
public final class TableRollResult {

    public static final TableRollResult EMPTY = new TableRollResult("", null, null, null, null);

    public final String text;
    public final String resultType;
    public final Map<String, String> assets;
    /** Evaluated sets of the selected entry (String or CaptureItem values). */
    public final Map<String, Object> placeholders;
    public final String entryId;

    public TableRollResult(String text, String resultType, Map<String, String> assets,
                           Map<String, Object> placeholders, String entryId) {
        this.text = text == null ? "" : text;
        this.resultType = resultType;
        this.assets = assets;
        this.placeholders = placeholders == null ? Collections.emptyMap() : placeholders;
        this.entryId = entryId;
    }
}
