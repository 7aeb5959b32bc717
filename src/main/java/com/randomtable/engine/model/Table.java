package com.randomtable.engine.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Base of the three table kinds, discriminated by the JSON {@code type} property.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type", defaultImpl = SimpleTable.class)
@JsonSubTypes({
        @JsonSubTypes.Type(value = SimpleTable.class, name = "simple"),
        @JsonSubTypes.Type(value = CompositeTable.class, name = "composite"),
        @JsonSubTypes.Type(value = CollectionTable.class, name = "collection")
})
public abstract class Table {
    public String id;
    public String name;
    public String description;
    public List<String> tags = new ArrayList<>();
    public boolean hidden;
    /** Parent table id (simple tables only). */
    @JsonProperty("extends")
    public String extendsId;
    public LinkedHashMap<String, String> defaultSets = new LinkedHashMap<>();
    public String resultType;
    /** Table-level shared variables, evaluated lazily on each roll of this table. */
    public LinkedHashMap<String, String> shared = new LinkedHashMap<>();

    public abstract String type();

    public String displayName() {
        return name != null && !name.isEmpty() ? name : id;
    }
}
