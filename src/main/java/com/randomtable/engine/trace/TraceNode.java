package com.randomtable.engine.trace;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonInclude;

/** One step of a generation, with its input, output and nested steps. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class TraceNode {

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static final class Input {
        public final String raw;
        public final Map<String, Object> parsed;

        public Input(String raw, Map<String, Object> parsed) {
            this.raw = raw;
            this.parsed = parsed;
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static final class Output {
        public final Object value;
        public final Boolean cached;
        public final String error;

        public Output(Object value, Boolean cached, String error) {
            this.value = value;
            this.cached = cached;
            this.error = error;
        }

        public static Output of(Object value) { return new Output(value, null, null); }
        public static Output cached(Object value, boolean cached) { return new Output(value, cached, null); }
        public static Output error(Object value, String error) { return new Output(value, null, error); }
    }

    public final String id;
    public final TraceNodeType type;
    public final String label;
    public final long startTime;
    public Long duration;
    public final Input input;
    public Output output = Output.of("");
    public final List<TraceNode> children = new ArrayList<>();
    public Map<String, Object> metadata;

    TraceNode(String id, TraceNodeType type, String label, long startTime, Input input) {
        this.id = id;
        this.type = type;
        this.label = label;
        this.startTime = startTime;
        this.input = input;
    }

    /** Small helper for building ordered metadata maps: {@code meta("k1", v1, "k2", v2)}. */
    public static Map<String, Object> meta(Object... kv) {
        Map<String, Object> m = new LinkedHashMap<>();
        for (int i = 0; i + 1 < kv.length; i += 2) {
            if (kv[i + 1] != null) m.put(String.valueOf(kv[i]), kv[i + 1]);
        }
        return m;
    }
}
