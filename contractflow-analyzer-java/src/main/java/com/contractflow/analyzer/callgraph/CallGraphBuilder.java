package com.contractflow.analyzer.callgraph;

import com.contractflow.analyzer.program.Function;
import com.contractflow.analyzer.program.Node;
import com.contractflow.analyzer.program.Operation;
import com.contractflow.analyzer.program.ProgramModel;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds the function-level call graph.
 *
 * Calls come from two sources: the nodes' IR operations and the front end's
 * legacy per-node call summaries. The IR is authoritative; a summary call whose
 * (callee, kind) pair the IR already produced anywhere in the same function is
 * suppressed, as is an exact repeat of a summary within one node. Low-level
 * summaries are only used for nodes whose IR has no low-level call.
 */
public class CallGraphBuilder {

    private final CallClassifier classifier;
    private final FunctionResolver resolver;

    public CallGraphBuilder(CallClassifier classifier, FunctionResolver resolver) {
        this.classifier = classifier;
        this.resolver = resolver;
    }

    public CallGraph build(ProgramModel program) {
        FunctionRegistry registry = new FunctionRegistry();
        for (Function function : program.getFunctions()) {
            registry.register(function);
        }

        Map<Integer, List<CallSite>> callSites = new LinkedHashMap<>();
        Map<Integer, List<LowLevelCall>> lowLevelCalls = new LinkedHashMap<>();
        Map<List<Integer>, Set<CallKind>> edgeKinds = new LinkedHashMap<>();
        CallSiteOrderTracker tracker = new CallSiteOrderTracker();
        int dropped = 0;

        for (Function caller : program.getFunctions()) {
            int callerId = registry.lookup(caller);
            List<Node> nodes = tracker.begin(caller);
            Set<String> irObserved = collectIrObservations(nodes);

            List<CallSite> sites = new ArrayList<>();
            List<LowLevelCall> lows = new ArrayList<>();

            for (Node node : nodes) {
                boolean irLowLevel = false;
                for (Operation op : node.getOperations()) {
                    CallKind kind = classifier.classify(op);
                    if (kind == null) continue;
                    if (kind == CallKind.LOW_LEVEL) {
                        irLowLevel = true;
                        lows.add(new LowLevelCall(tracker.nextOrder(), caller, node,
                                node.getSourceMapping(), callText(node, op)));
                        continue;
                    }
                    Function callee = usableTarget(op);
                    if (callee == null) {
                        dropped++;
                        continue;
                    }
                    sites.add(record(caller, callerId, callee, kind, node, op, tracker, registry, edgeKinds));
                }

                Set<String> nodeSummaries = new HashSet<>();
                for (Operation summary : summariesOf(node)) {
                    CallKind kind = classifier.classify(summary);
                    if (kind == null || kind == CallKind.LOW_LEVEL) continue;
                    Function callee = usableTarget(summary);
                    if (callee == null) {
                        dropped++;
                        continue;
                    }
                    String key = observationKey(callee, kind);
                    if (irObserved.contains(key) || !nodeSummaries.add(key)) continue;
                    sites.add(record(caller, callerId, callee, kind, node, summary, tracker, registry, edgeKinds));
                }

                if (!irLowLevel) {
                    for (Operation summary : node.getLowLevelCalls()) {
                        lows.add(new LowLevelCall(tracker.nextOrder(), caller, node,
                                node.getSourceMapping(), callText(node, summary)));
                    }
                }
            }

            if (!sites.isEmpty()) callSites.put(callerId, sites);
            if (!lows.isEmpty()) lowLevelCalls.put(callerId, lows);
        }

        List<CallGraphEdge> edges = new ArrayList<>();
        edgeKinds.forEach((pair, kinds) -> edges.add(new CallGraphEdge(pair.get(0), pair.get(1), kinds)));
        return new CallGraph(registry, callSites, lowLevelCalls, edges, dropped);
    }

    private Set<String> collectIrObservations(List<Node> nodes) {
        Set<String> keys = new HashSet<>();
        for (Node node : nodes) {
            for (Operation op : node.getOperations()) {
                CallKind kind = classifier.classify(op);
                if (kind == null || kind == CallKind.LOW_LEVEL) continue;
                Function callee = usableTarget(op);
                if (callee != null) keys.add(observationKey(callee, kind));
            }
        }
        return keys;
    }

    private CallSite record(Function caller, int callerId, Function callee, CallKind kind,
                            Node node, Operation op, CallSiteOrderTracker tracker,
                            FunctionRegistry registry, Map<List<Integer>, Set<CallKind>> edgeKinds) {
        // callees outside the analyzed model are registered on first sight
        int calleeId = registry.registerOrLookup(callee, true);
        edgeKinds.computeIfAbsent(List.of(callerId, calleeId), k -> EnumSet.noneOf(CallKind.class)).add(kind);
        return new CallSite(tracker.nextOrder(), kind, caller, callee, node,
                node.getSourceMapping(), callText(node, op));
    }

    /** Resolved target, or null when there is none or it has no usable name. */
    private Function usableTarget(Operation op) {
        Function callee = resolver.resolve(op.target());
        if (callee == null || callee.getName() == null || callee.getName().isBlank()) return null;
        return callee;
    }

    private static List<Operation> summariesOf(Node node) {
        List<Operation> summaries = new ArrayList<>(node.getInternalCalls());
        summaries.addAll(node.getHighLevelCalls());
        return summaries;
    }

    private static String observationKey(Function callee, CallKind kind) {
        return callee.getCanonicalName() + "|" + kind;
    }

    static String callText(Node node, Operation op) {
        String expression = node.getExpression();
        return expression != null ? expression : op.text();
    }
}
