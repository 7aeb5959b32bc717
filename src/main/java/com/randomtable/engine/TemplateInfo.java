package com.randomtable.engine;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;

/** Listing entry for a template; import fields as in {@link TableInfo}. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class TemplateInfo {
    public String id;
    public String name;
    public String description;
    public List<String> tags;
    public String resultType;

    public String alias;
    public String sourceNamespace;
    public String sourceCollectionName;
}
