package com.randomtable.engine.trace;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/** Finished execution tree plus summary statistics. */
public final class RollTrace {

    public static final class Stats {
        public int nodeCount;
        public int maxDepth;
        public Map<String, Integer> typeBreakdown;
        public int diceRolled;
        public List<String> tablesAccessed;
        public List<String> variablesAccessed;
    }

    private static final ObjectMapper om = new ObjectMapper()
            .configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);

    public final TraceNode root;
    public final long totalTime;
    public final Stats stats;
    public final String version;

    public RollTrace(TraceNode root, long totalTime, Stats stats, String version) {
        this.root = root;
        this.totalTime = totalTime;
        this.stats = stats;
        this.version = version;
    }

    public String toJson() throws JsonProcessingException {
        return om.writerWithDefaultPrettyPrinter().writeValueAsString(this);
    }
}
