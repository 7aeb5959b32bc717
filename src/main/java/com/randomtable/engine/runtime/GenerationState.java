package com.randomtable.engine.runtime;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.randomtable.engine.EngineConfig;
import com.randomtable.engine.RollResult;
import com.randomtable.engine.trace.TraceRecorder;

/**
 * Generation-wide state. Every {@link GenerationContext} derived from the same root,
 * isolated or not, holds the same instance, so recursion accounting, uniqueness,
 * captures, descriptions and the trace stay consistent across the whole generation.
 */
final class GenerationState {
    final EngineConfig config;
    final Map<String, String> staticVariables;
    final Set<String> documentSharedNames = new HashSet<>();

    int recursionDepth = 0;

    final Map<String, Set<String>> usedEntries = new HashMap<>();
    final Map<String, RollResult> instances = new HashMap<>();
    final Map<String, CaptureVariable> captureVariables = new LinkedHashMap<>();
    final List<EntryDescription> collectedDescriptions = new ArrayList<>();
    final Set<String> evaluatingSetKeys = new LinkedHashSet<>();

    final TraceRecorder trace; // null when tracing is off

    GenerationState(EngineConfig config, Map<String, String> staticVariables, boolean enableTrace) {
        this.config = config;
        this.staticVariables = staticVariables == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(staticVariables));
        this.trace = enableTrace ? new TraceRecorder() : null;
    }
}
