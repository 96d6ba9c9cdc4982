package com.contractflow.analyzer.icfg;

import com.contractflow.analyzer.program.Function;
import com.contractflow.analyzer.program.Node;

/** A front-end node kept in the reduced graph. */
public record IcfgNode(int id, Function function, Node node, String label, boolean entryPoint) {}
