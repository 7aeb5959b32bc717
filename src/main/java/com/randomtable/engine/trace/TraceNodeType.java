package com.randomtable.engine.trace;

import com.fasterxml.jackson.annotation.JsonValue;

public enum TraceNodeType {
    ROOT("root"),
    TABLE_ROLL("table_roll"),
    TEMPLATE_REF("template_ref"),
    ENTRY_SELECT("entry_select"),
    DICE_ROLL("dice_roll"),
    VARIABLE_ACCESS("variable_access"),
    PLACEHOLDER_ACCESS("placeholder_access"),
    MULTI_ROLL("multi_roll"),
    INSTANCE("instance"),
    COMPOSITE_SELECT("composite_select"),
    COLLECTION_MERGE("collection_merge"),
    CAPTURE_MULTI_ROLL("capture_multi_roll"),
    CAPTURE_ACCESS("capture_access"),
    COLLECT("collect");

    private final String wireName;

    TraceNodeType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
