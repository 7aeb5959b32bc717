package com.randomtable.engine;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.randomtable.engine.runtime.CaptureVariable;
import com.randomtable.engine.runtime.EntryDescription;
import com.randomtable.engine.trace.RollTrace;

/** Output of a table roll, template roll or raw pattern evaluation. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class RollResult {

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static final class Metadata {
        public final String sourceId;
        public final String collectionId;
        public final long timestamp;
        public final String entryId;

        public Metadata(String sourceId, String collectionId, long timestamp, String entryId) {
            this.sourceId = sourceId;
            this.collectionId = collectionId;
            this.timestamp = timestamp;
            this.entryId = entryId;
        }
    }

    private static final ObjectMapper om = new ObjectMapper();

    public final String text;
    public final String resultType;
    public final Map<String, String> assets;
    public final Map<String, Object> placeholders;
    public final Metadata metadata;

    public RollTrace trace;
    public Map<String, CaptureVariable> captures;
    public List<EntryDescription> descriptions;
    public List<String> expressionOutputs;

    public RollResult(String text, String resultType, Map<String, String> assets,
                      Map<String, Object> placeholders, Metadata metadata) {
        this.text = text;
        this.resultType = resultType;
        this.assets = assets;
        this.placeholders = placeholders;
        this.metadata = metadata;
    }

    public String toJson() throws JsonProcessingException {
        return om.writerWithDefaultPrettyPrinter().writeValueAsString(this);
    }

    @Override
    public String toString() {
        return text;
    }
}
