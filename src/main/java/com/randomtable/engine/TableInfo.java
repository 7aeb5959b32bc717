package com.randomtable.engine;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Listing entry for a table. The import fields are set only for tables listed
 * through another collection's imports, where {@code alias} is the prefix to
 * reference them with.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class TableInfo {
    public String id;
    public String name;
    public String type;
    public String description;
    public List<String> tags;
    public boolean hidden;
    public Integer entryCount;
    public String resultType;

    public String alias;
    public String sourceNamespace;
    public String sourceCollectionName;
}
