package com.contractflow.analyzer.export;

import com.contractflow.analyzer.callgraph.CallGraph;
import com.contractflow.analyzer.callgraph.CallGraphEdge;
import com.contractflow.analyzer.callgraph.CallSite;
import com.contractflow.analyzer.callgraph.FunctionRegistry;
import com.contractflow.analyzer.callgraph.LowLevelCall;
import com.contractflow.analyzer.icfg.Icfg;
import com.contractflow.analyzer.icfg.IcfgEdge;
import com.contractflow.analyzer.icfg.IcfgNode;
import com.contractflow.analyzer.program.Function;
import com.contractflow.analyzer.program.ProgramModel;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Maps the analysis results onto the output document. Pure translation: every
 * value is read from the program model, the call graph or the ICFG.
 */
public class ExportAssembler {

    public ExportModel.ExportRoot assemble(ProgramModel program, CallGraph callGraph, Icfg icfg) {
        ExportModel.ExportRoot root = new ExportModel.ExportRoot();
        root.functions = program.getFunctions().stream().map(ExportAssembler::function)
                .collect(Collectors.toList());
        root.callGraph = callGraph(callGraph);
        root.icfg = icfg(icfg);
        return root;
    }

    private static ExportModel.ExportFunction function(Function f) {
        ExportModel.ExportFunction out = new ExportModel.ExportFunction();
        out.name = f.getName();
        out.fullName = f.getFullName();
        out.canonicalName = f.getCanonicalName();
        out.contract = contractName(f);
        out.visibility = f.getVisibility();
        out.stateMutability = f.getStateMutability();
        out.isImplemented = f.isImplemented();
        out.isConstructor = f.isConstructor();
        out.isFallback = f.isFallback();
        out.isReceive = f.isReceive();
        out.parameters = f.getParameters();
        out.returns = f.getReturns();
        out.modifiers = f.getModifiers();
        out.stateVariablesRead = f.getStateVariablesRead();
        out.stateVariablesWritten = f.getStateVariablesWritten();
        out.sourceMapping = f.getSourceMapping();
        return out;
    }

    private static ExportModel.ExportCallGraph callGraph(CallGraph graph) {
        FunctionRegistry registry = graph.getRegistry();
        ExportModel.ExportCallGraph out = new ExportModel.ExportCallGraph();

        out.nodes = new ArrayList<>();
        for (int id = 0; id < registry.size(); id++) {
            Function f = registry.get(id);
            ExportModel.ExportCallGraphNode node = new ExportModel.ExportCallGraphNode();
            node.id = id;
            node.name = f.getName();
            node.fullName = f.getFullName();
            node.canonicalName = f.getCanonicalName();
            node.contract = contractName(f);
            node.isImplemented = f.isImplemented();
            node.isSynthetic = registry.isSynthetic(id);
            out.nodes.add(node);
        }

        out.edges = new ArrayList<>();
        out.callSites = new ArrayList<>();
        for (Map.Entry<Integer, List<CallSite>> entry : graph.getCallSites().entrySet()) {
            ExportModel.ExportFunctionCalls calls = new ExportModel.ExportFunctionCalls();
            calls.function = entry.getKey();
            calls.functionName = registry.get(entry.getKey()).getCanonicalName();
            calls.calls = new ArrayList<>();
            for (CallSite site : entry.getValue()) {
                int calleeId = Objects.requireNonNull(registry.lookup(site.callee()),
                        "call site callee must be registered");

                ExportModel.ExportCallGraphEdge edge = new ExportModel.ExportCallGraphEdge();
                edge.src = entry.getKey();
                edge.dst = calleeId;
                edge.order = site.order();
                edge.callType = site.kind();
                edge.callSite = site.callText();
                edge.sourceMapping = site.sourceMapping();
                out.edges.add(edge);

                ExportModel.ExportCall call = new ExportModel.ExportCall();
                call.order = site.order();
                call.callType = site.kind();
                call.callee = calleeId;
                call.calleeName = site.callee().getCanonicalName();
                call.callSite = site.callText();
                call.sourceMapping = site.sourceMapping();
                calls.calls.add(call);
            }
            out.callSites.add(calls);
        }

        out.functionEdges = new ArrayList<>();
        for (CallGraphEdge edge : graph.getEdges()) {
            ExportModel.ExportFunctionEdge fe = new ExportModel.ExportFunctionEdge();
            fe.src = edge.caller();
            fe.dst = edge.callee();
            fe.callTypes = new ArrayList<>(edge.kinds());
            out.functionEdges.add(fe);
        }

        out.lowLevelCalls = new ArrayList<>();
        for (Map.Entry<Integer, List<LowLevelCall>> entry : graph.getLowLevelCalls().entrySet()) {
            for (LowLevelCall call : entry.getValue()) {
                ExportModel.ExportLowLevelCall low = new ExportModel.ExportLowLevelCall();
                low.function = entry.getKey();
                low.functionName = registry.get(entry.getKey()).getCanonicalName();
                low.order = call.order();
                low.callSite = call.callText();
                low.sourceMapping = call.sourceMapping();
                out.lowLevelCalls.add(low);
            }
        }
        return out;
    }

    private static ExportModel.ExportIcfg icfg(Icfg icfg) {
        ExportModel.ExportIcfg out = new ExportModel.ExportIcfg();
        out.nodes = new ArrayList<>();
        for (IcfgNode node : icfg.getNodes()) {
            ExportModel.ExportIcfgNode n = new ExportModel.ExportIcfgNode();
            n.id = node.id();
            n.label = node.label();
            n.function = node.function().getFullName();
            n.contract = contractName(node.function());
            n.isEntryPoint = node.entryPoint();
            out.nodes.add(n);
        }
        out.edges = new ArrayList<>();
        for (IcfgEdge edge : icfg.getEdges()) {
            ExportModel.ExportIcfgEdge e = new ExportModel.ExportIcfgEdge();
            e.src = edge.src();
            e.dst = edge.dst();
            e.type = edge.type();
            e.callType = edge.callKind();
            out.edges.add(e);
        }
        return out;
    }

    private static String contractName(Function f) {
        return f.getContract() != null ? f.getContract().getName() : null;
    }
}
