package com.randomtable.engine.trace;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds the execution tree for one generation. Nodes are opened and closed in
 * strict nesting; leaves attach to the innermost open node.
 *
 * Recording never changes evaluation results.
 */
public final class TraceRecorder {

    public static final String VERSION = "1.0";

    private final Deque<TraceNode> stack = new ArrayDeque<>();
    private final long startTime = System.currentTimeMillis();
    private int idCounter = 0;
    private TraceNode root;

    private String nextId() {
        return "trace-" + (idCounter++);
    }

    public TraceNode begin(TraceNodeType type, String label, TraceNode.Input input) {
        TraceNode node = new TraceNode(nextId(), type, label, System.currentTimeMillis(), input);
        TraceNode parent = stack.peek();
        if (parent != null) parent.children.add(node);
        else root = node;
        stack.push(node);
        return node;
    }

    public void end(TraceNode.Output output, Map<String, Object> metadata) {
        TraceNode node = stack.poll();
        if (node == null) return;
        node.duration = System.currentTimeMillis() - node.startTime;
        node.output = output;
        if (metadata != null) node.metadata = metadata;
    }

    public void leaf(TraceNodeType type, String label, TraceNode.Input input,
                     TraceNode.Output output, Map<String, Object> metadata) {
        TraceNode node = new TraceNode(nextId(), type, label, System.currentTimeMillis(), input);
        node.duration = 0L;
        node.output = output;
        node.metadata = metadata;
        TraceNode parent = stack.peek();
        if (parent != null) parent.children.add(node);
    }

    public int openNodes() {
        return stack.size();
    }

    /** Snapshot of the finished tree, or null if nothing was recorded. */
    public RollTrace extract() {
        if (root == null) return null;
        return new RollTrace(root, System.currentTimeMillis() - startTime, computeStats(root), VERSION);
    }

    private static RollTrace.Stats computeStats(TraceNode root) {
        RollTrace.Stats stats = new RollTrace.Stats();
        Set<String> tables = new LinkedHashSet<>();
        Set<String> variables = new LinkedHashSet<>();
        Map<String, Integer> breakdown = new LinkedHashMap<>();
        traverse(root, 0, stats, breakdown, tables, variables);
        stats.typeBreakdown = breakdown;
        stats.tablesAccessed = new ArrayList<>(tables);
        stats.variablesAccessed = new ArrayList<>(variables);
        return stats;
    }

    private static void traverse(TraceNode node, int depth, RollTrace.Stats stats,
                                 Map<String, Integer> breakdown, Set<String> tables, Set<String> variables) {
        stats.nodeCount++;
        stats.maxDepth = Math.max(stats.maxDepth, depth);
        breakdown.merge(node.type.wireName(), 1, Integer::sum);

        Map<String, Object> meta = node.metadata;
        switch (node.type) {
            case DICE_ROLL:
                if (meta != null && meta.get("rolls") instanceof List<?>) {
                    stats.diceRolled += ((List<?>) meta.get("rolls")).size();
                }
                break;
            case TABLE_ROLL:
                tables.add(node.label.replaceFirst("^Table: ", ""));
                break;
            case VARIABLE_ACCESS:
                if (meta != null && meta.get("name") != null) variables.add(String.valueOf(meta.get("name")));
                break;
            case CAPTURE_MULTI_ROLL:
                if (meta != null && meta.get("captureVar") != null) variables.add("$" + meta.get("captureVar"));
                break;
            case CAPTURE_ACCESS:
            case COLLECT:
                if (meta != null && meta.get("varName") != null) variables.add("$" + meta.get("varName"));
                break;
            default:
                break;
        }

        for (TraceNode child : node.children) {
            traverse(child, depth + 1, stats, breakdown, tables, variables);
        }
    }
}
