package com.contractflow.analyzer.callgraph;

import java.util.Set;

/**
 * Function-level edge between two registry ids, with every call kind observed
 * between them.
 */
public record CallGraphEdge(int caller, int callee, Set<CallKind> kinds) {}
