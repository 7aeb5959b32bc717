package com.randomtable.engine;

import com.fasterxml.jackson.annotation.JsonProperty;

/** What a unique roll does once every entry of the table has been used. */
public enum UniqueOverflowBehavior {
    /** Produce no result. */
    @JsonProperty("stop") STOP,
    /** Forget used entries and roll again. */
    @JsonProperty("cycle") CYCLE,
    /** Fail the generation. */
    @JsonProperty("error") ERROR;

    public static UniqueOverflowBehavior parse(String s) {
        if (s == null) return STOP;
        switch (s.trim().toLowerCase()) {
            case "cycle": return CYCLE;
            case "error": return ERROR;
            case "stop": return STOP;
            default: throw new IllegalArgumentException("Unknown unique overflow behavior: " + s);
        }
    }
}
