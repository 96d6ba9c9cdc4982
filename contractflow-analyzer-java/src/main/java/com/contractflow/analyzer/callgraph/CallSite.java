package com.contractflow.analyzer.callgraph;

import com.contractflow.analyzer.program.Function;
import com.contractflow.analyzer.program.Node;
import com.contractflow.analyzer.program.SourceMapping;

/**
 * A resolved call observed inside {@code caller}.
 *
 * @param order    position of the call within the caller, starting at 1
 * @param callText source expression of the calling node, or the IR text when the
 *                 node has no expression
 */
public record CallSite(
    int order,
    CallKind kind,
    Function caller,
    Function callee,
    Node node,
    SourceMapping sourceMapping,
    String callText
) {}
