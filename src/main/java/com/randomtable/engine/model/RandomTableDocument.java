package com.randomtable.engine.model;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Root of a random-table JSON document.
 *
 * Variable maps keep declaration order: shared variables are evaluated in that
 * order and later entries may read earlier ones.
 */
public class RandomTableDocument {
    public Metadata metadata = new Metadata();
    public List<Import> imports = new ArrayList<>();
    public List<Table> tables = new ArrayList<>();
    public List<Template> templates = new ArrayList<>();
    /** Static variables, {@code $name} to literal text. */
    public LinkedHashMap<String, String> variables = new LinkedHashMap<>();
    /** Document-level shared variables, {@code $name} to pattern, evaluated once per generation. */
    public LinkedHashMap<String, String> shared = new LinkedHashMap<>();

    public Table findTable(String id) {
        for (Table t : tables) {
            if (t.id != null && t.id.equals(id)) return t;
        }
        return null;
    }

    public Template findTemplate(String id) {
        for (Template t : templates) {
            if (t.id != null && t.id.equals(id)) return t;
        }
        return null;
    }

    public Import findImport(String alias) {
        for (Import imp : imports) {
            if (imp.alias != null && imp.alias.equals(alias)) return imp;
        }
        return null;
    }

    public Map<String, String> variablesOrEmpty() {
        return variables == null ? new LinkedHashMap<>() : variables;
    }

    public Map<String, String> sharedOrEmpty() {
        return shared == null ? new LinkedHashMap<>() : shared;
    }
}
