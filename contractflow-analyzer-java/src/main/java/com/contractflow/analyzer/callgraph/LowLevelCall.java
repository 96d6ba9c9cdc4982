package com.contractflow.analyzer.callgraph;

import com.contractflow.analyzer.program.Function;
import com.contractflow.analyzer.program.Node;
import com.contractflow.analyzer.program.SourceMapping;

/** A call without a statically known target. */
public record LowLevelCall(
    int order,
    Function caller,
    Node node,
    SourceMapping sourceMapping,
    String callText
) {}
