package com.contractflow.analyzer.icfg;

import com.contractflow.analyzer.callgraph.CallClassifier;
import com.contractflow.analyzer.callgraph.CallKind;
import com.contractflow.analyzer.callgraph.FunctionResolver;
import com.contractflow.analyzer.program.Function;
import com.contractflow.analyzer.program.Node;
import com.contractflow.analyzer.program.Operation;
import com.contractflow.analyzer.program.ProgramModel;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reduces the full node-level control-flow graph to entry points and call nodes.
 *
 * <ul>
 *   <li>Intra-procedural edges connect each kept node to the nearest kept nodes
 *       reachable from it, found by a breadth-first search that stops at the
 *       first kept node on every path.</li>
 *   <li>Inter-procedural edges connect a call node to the entry point of the
 *       resolved callee, provided that entry point is in the graph.</li>
 * </ul>
 */
public class IcfgReducer {

    private final CallClassifier classifier;
    private final FunctionResolver resolver;
    private final NodeLabeler labeler;

    public IcfgReducer(CallClassifier classifier, FunctionResolver resolver, NodeLabeler labeler) {
        this.classifier = classifier;
        this.resolver = resolver;
        this.labeler = labeler;
    }

    public Icfg reduce(ProgramModel program) {
        List<Function> functions = program.getFunctions();

        // 1. Ids for interesting nodes, model order
        Map<Node, Integer> ids = new IdentityHashMap<>();
        List<IcfgNode> nodes = new ArrayList<>();
        for (Function function : functions) {
            for (Node node : nodesOf(function)) {
                if (ids.containsKey(node) || !isInteresting(node)) continue;
                int id = nodes.size();
                ids.put(node, id);
                nodes.add(new IcfgNode(id, function, node, labeler.label(node),
                        node == function.getEntryPoint()));
            }
        }

        // 2. Edges, keyed by (src, dst, type) so duplicates merge
        Map<List<Object>, IcfgEdge> edges = new LinkedHashMap<>();
        for (IcfgNode source : nodes) {
            for (Node target : nearestInteresting(source.node(), ids)) {
                addEdge(edges, IcfgEdge.intra(source.id(), ids.get(target)));
            }
            addCallEdges(source, source.node().getOperations(), ids, edges);
            addCallEdges(source, source.node().getInternalCalls(), ids, edges);
            addCallEdges(source, source.node().getHighLevelCalls(), ids, edges);
        }

        return new Icfg(nodes, new ArrayList<>(edges.values()), ids);
    }

    boolean isInteresting(Node node) {
        if (node == node.getFunction().getEntryPoint()) return true;
        if (node.hasCallSummaries()) return true;
        for (Operation op : node.getOperations()) {
            if (classifier.classify(op) != null) return true;
        }
        return false;
    }

    /**
     * Breadth-first search from the successors of {@code source}; every path ends
     * at its first interesting node. The source itself is never a destination.
     */
    private List<Node> nearestInteresting(Node source, Map<Node, Integer> ids) {
        List<Node> found = new ArrayList<>();
        Set<Node> visited = Collections.newSetFromMap(new IdentityHashMap<>());
        visited.add(source);
        Deque<Node> queue = new ArrayDeque<>();
        for (Node son : source.getSuccessors()) {
            if (visited.add(son)) queue.add(son);
        }
        while (!queue.isEmpty()) {
            Node current = queue.poll();
            if (ids.containsKey(current)) {
                found.add(current);
                continue;
            }
            for (Node son : current.getSuccessors()) {
                if (visited.add(son)) queue.add(son);
            }
        }
        return found;
    }

    private void addCallEdges(IcfgNode source, List<Operation> operations,
                              Map<Node, Integer> ids, Map<List<Object>, IcfgEdge> edges) {
        for (Operation op : operations) {
            CallKind kind = classifier.classify(op);
            if (kind == null || kind == CallKind.LOW_LEVEL) continue;
            Function callee = resolver.resolve(op.target());
            if (callee == null || callee.getEntryPoint() == null) continue;
            Integer entryId = ids.get(callee.getEntryPoint());
            if (entryId == null) continue;
            addEdge(edges, IcfgEdge.inter(source.id(), entryId, kind));
        }
    }

    private static void addEdge(Map<List<Object>, IcfgEdge> edges, IcfgEdge edge) {
        // first observation wins: IR operations are visited before summaries
        edges.putIfAbsent(List.of(edge.src(), edge.dst(), edge.type()), edge);
    }

    /** Owned nodes, with the entry point first if the front end left it out of the list. */
    private static List<Node> nodesOf(Function function) {
        Node entry = function.getEntryPoint();
        if (entry == null || function.getNodes().contains(entry)) return function.getNodes();
        List<Node> nodes = new ArrayList<>();
        nodes.add(entry);
        nodes.addAll(function.getNodes());
        return nodes;
    }
}
