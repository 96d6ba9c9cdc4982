package com.contractflow.analyzer.callgraph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Result of {@link CallGraphBuilder}: the function registry, per-function call
 * sites and low-level calls (both keyed by caller id, in id order) and the
 * coarse function-level edge set.
 */
public class CallGraph {

    private final FunctionRegistry registry;
    private final Map<Integer, List<CallSite>> callSites;
    private final Map<Integer, List<LowLevelCall>> lowLevelCalls;
    private final List<CallGraphEdge> edges;
    private final int droppedCalls;

    CallGraph(FunctionRegistry registry,
              Map<Integer, List<CallSite>> callSites,
              Map<Integer, List<LowLevelCall>> lowLevelCalls,
              List<CallGraphEdge> edges,
              int droppedCalls) {
        this.registry = registry;
        this.callSites = Collections.unmodifiableMap(callSites);
        this.lowLevelCalls = Collections.unmodifiableMap(lowLevelCalls);
        this.edges = Collections.unmodifiableList(edges);
        this.droppedCalls = droppedCalls;
    }

    public FunctionRegistry getRegistry() { return registry; }

    /** Call sites per caller id; callers without calls are absent. */
    public Map<Integer, List<CallSite>> getCallSites() { return callSites; }

    /** Low-level calls per caller id; callers without such calls are absent. */
    public Map<Integer, List<LowLevelCall>> getLowLevelCalls() { return lowLevelCalls; }

    public List<CallGraphEdge> getEdges() { return edges; }

    /** Calls that had a non-low-level kind but no usable target. */
    public int getDroppedCalls() { return droppedCalls; }

    public List<CallSite> getCallSitesOf(int callerId) {
        return callSites.getOrDefault(callerId, List.of());
    }

    public List<LowLevelCall> getLowLevelCallsOf(int callerId) {
        return lowLevelCalls.getOrDefault(callerId, List.of());
    }

    /** All call sites, caller id order, then call order. */
    public List<CallSite> getAllCallSites() {
        List<CallSite> all = new ArrayList<>();
        callSites.values().forEach(all::addAll);
        return all;
    }
}
