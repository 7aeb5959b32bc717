package com.randomtable.engine.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

/** Named pattern, rendered in an isolated scope when referenced from another pattern. */
public class Template {
    public String id;
    public String name;
    public String pattern;
    public String description;
    public List<String> tags = new ArrayList<>();
    public String resultType;
    public LinkedHashMap<String, String> shared = new LinkedHashMap<>();

    public String displayName() {
        return name != null && !name.isEmpty() ? name : id;
    }
}
