package com.randomtable.engine.model;

import java.util.ArrayList;
import java.util.List;

import com.randomtable.engine.UniqueOverflowBehavior;

/** Document metadata. The four engine settings, when present, override the engine defaults for rolls in this document. */
public class Metadata {
    public String name;
    public String namespace;
    public String version;
    public String specVersion;
    public String author;
    public String description;
    public String instructions;
    public List<String> tags = new ArrayList<>();
    public String created;
    public String updated;

    public Integer maxRecursionDepth;
    public Integer maxExplodingDice;
    public Integer maxInheritanceDepth;
    public UniqueOverflowBehavior uniqueOverflowBehavior;
}
