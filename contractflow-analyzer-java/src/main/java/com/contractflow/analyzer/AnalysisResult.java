package com.contractflow.analyzer;

import com.contractflow.analyzer.callgraph.CallGraph;
import com.contractflow.analyzer.icfg.Icfg;
import com.contractflow.analyzer.program.ProgramModel;

/**
 * Aggregate result of one analysis run.
 */
public record AnalysisResult(
    ProgramModel program,
    CallGraph callGraph,
    Icfg icfg
) {}
