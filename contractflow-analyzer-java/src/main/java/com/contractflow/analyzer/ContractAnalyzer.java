package com.contractflow.analyzer;

import com.contractflow.analyzer.callgraph.CallClassifier;
import com.contractflow.analyzer.callgraph.CallGraph;
import com.contractflow.analyzer.callgraph.CallGraphBuilder;
import com.contractflow.analyzer.callgraph.FunctionResolver;
import com.contractflow.analyzer.config.AnalysisConfig;
import com.contractflow.analyzer.export.DotExporter;
import com.contractflow.analyzer.export.ExportAssembler;
import com.contractflow.analyzer.export.ExportModel;
import com.contractflow.analyzer.export.JsonExporter;
import com.contractflow.analyzer.icfg.Icfg;
import com.contractflow.analyzer.icfg.IcfgReducer;
import com.contractflow.analyzer.icfg.NodeLabeler;
import com.contractflow.analyzer.program.Function;
import com.contractflow.analyzer.program.ProgramModel;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Orchestrates one run: call graph, ICFG reduction and export.
 * Every run builds its own classifier, resolver and registry; nothing is shared
 * between runs.
 */
public class ContractAnalyzer {

    private final AnalysisConfig config;

    public ContractAnalyzer(AnalysisConfig config) {
        this.config = config != null ? config : AnalysisConfig.defaults();
    }

    public AnalysisResult analyze(ProgramModel program) {
        CallClassifier classifier = new CallClassifier();
        FunctionResolver resolver = new FunctionResolver(program);

        CallGraph callGraph = new CallGraphBuilder(classifier, resolver).build(program);

        NodeLabeler labeler = new NodeLabeler(config.getExpressionLabelLimit(), config.getIrLabelLimit());
        Icfg icfg = new IcfgReducer(classifier, resolver, labeler).reduce(program);

        List<Function> functions = program.getFunctions();
        long implemented = functions.stream().filter(Function::isImplemented).count();
        int totalNodes = functions.stream().mapToInt(f -> f.getNodes().size()).sum();
        System.err.println("[contract-flow] Discovered " + implemented + " implemented functions ("
                + functions.size() + " declared) across " + program.getContracts().size() + " contracts");
        System.err.println("[contract-flow] Call graph: " + callGraph.getRegistry().size() + " functions, "
                + callGraph.getEdges().size() + " edges, " + callGraph.getAllCallSites().size() + " call sites, "
                + callGraph.getLowLevelCalls().values().stream().mapToInt(List::size).sum() + " low-level calls");
        if (callGraph.getDroppedCalls() > 0) {
            System.err.println("[contract-flow] WARNING: " + callGraph.getDroppedCalls()
                    + " calls without a usable target dropped");
        }
        System.err.println("[contract-flow] ICFG: " + icfg.getNodes().size() + " of " + totalNodes
                + " nodes kept, " + icfg.getEdges().size() + " edges");

        return new AnalysisResult(program, callGraph, icfg);
    }

    /**
     * Writes the enabled outputs under {@code outputDir}.
     *
     * @return the written files, JSON first
     */
    public List<Path> export(AnalysisResult result, Path outputDir) {
        List<Path> written = new ArrayList<>();
        if (config.isExportJson()) {
            ExportModel.ExportRoot root = new ExportAssembler()
                    .assemble(result.program(), result.callGraph(), result.icfg());
            written.add(new JsonExporter().write(root, outputDir, config.getJsonOutput()));
        }
        if (config.isExportDot()) {
            written.add(new DotExporter().write(result.icfg(), outputDir, config.getDotOutput()));
        }
        return written;
    }
}
