package com.randomtable.engine.model;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

/** Jackson binding for random-table documents. Unknown properties are ignored. */
public final class DocumentLoader {

    private static final ObjectMapper om = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .configure(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY, true);

    private DocumentLoader() {}

    public static RandomTableDocument fromJson(String json) throws JsonProcessingException {
        RandomTableDocument doc = om.readValue(json, RandomTableDocument.class);
        return normalize(doc);
    }

    public static RandomTableDocument fromFile(Path path) throws IOException {
        return fromJson(Files.readString(path, StandardCharsets.UTF_8));
    }

    public static String toJson(RandomTableDocument doc) throws JsonProcessingException {
        return om.writerWithDefaultPrettyPrinter().writeValueAsString(doc);
    }

    /** Explicit JSON nulls for collections become empty collections. */
    private static RandomTableDocument normalize(RandomTableDocument doc) {
        if (doc.metadata == null) doc.metadata = new Metadata();
        if (doc.imports == null) doc.imports = new ArrayList<>();
        if (doc.tables == null) doc.tables = new ArrayList<>();
        if (doc.templates == null) doc.templates = new ArrayList<>();
        if (doc.variables == null) doc.variables = new LinkedHashMap<>();
        if (doc.shared == null) doc.shared = new LinkedHashMap<>();
        for (Table t : doc.tables) {
            if (t.defaultSets == null) t.defaultSets = new LinkedHashMap<>();
            if (t.shared == null) t.shared = new LinkedHashMap<>();
            if (t instanceof SimpleTable) {
                SimpleTable st = (SimpleTable) t;
                if (st.entries == null) st.entries = new ArrayList<>();
                for (Entry e : st.entries) {
                    if (e.sets == null) e.sets = new LinkedHashMap<>();
                    if (e.assets == null) e.assets = new LinkedHashMap<>();
                }
            }
        }
        for (Template t : doc.templates) {
            if (t.shared == null) t.shared = new LinkedHashMap<>();
        }
        return doc;
    }
}
