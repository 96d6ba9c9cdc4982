package com.contractflow.analyzer.callgraph;

import com.contractflow.analyzer.program.Function;
import com.contractflow.analyzer.program.Node;
import com.contractflow.analyzer.program.SourceMapping;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Hands out call order numbers within one function.
 *
 * Nodes are visited by source position (first line, else start offset, else
 * last); operations inside a node keep their IR order. The counter restarts at 1
 * for every function, and only calls that are actually recorded draw a number.
 */
public class CallSiteOrderTracker {

    /** Sort key for nodes without any position information. */
    static final long MISSING_POSITION = Long.MAX_VALUE;

    private Function current;
    private int last;

    /**
     * Starts numbering {@code function} and returns its nodes in call order.
     */
    public List<Node> begin(Function function) {
        current = function;
        last = 0;
        return sortedNodes(function);
    }

    /** Next order number for the function passed to {@link #begin}. */
    public int nextOrder() {
        if (current == null) {
            throw new IllegalStateException("nextOrder() called before begin()");
        }
        return ++last;
    }

    /** Number of order values issued for the current function so far. */
    public int issued() { return last; }

    static List<Node> sortedNodes(Function function) {
        List<Node> nodes = new ArrayList<>(function.getNodes());
        // List.sort is stable: equal keys keep front-end order
        nodes.sort(Comparator.comparingLong(CallSiteOrderTracker::positionKey));
        return nodes;
    }

    static long positionKey(Node node) {
        SourceMapping mapping = node.getSourceMapping();
        if (mapping == null) return MISSING_POSITION;
        Integer line = mapping.firstLine();
        if (line != null) return line;
        Integer start = mapping.getStart();
        if (start != null) return start;
        return MISSING_POSITION;
    }
}
