package com.contractflow.analyzer.export;

import com.contractflow.analyzer.callgraph.CallKind;
import com.contractflow.analyzer.icfg.IcfgEdgeType;
import com.contractflow.analyzer.program.SourceMapping;
import com.contractflow.analyzer.program.Variable;
import com.google.gson.annotations.SerializedName;
import java.util.List;

/**
 * POJOs of the structured output document.
 * Field names use @SerializedName for JSON snake_case mapping.
 */
public final class ExportModel {

    private ExportModel() {}

    public static class ExportRoot {
        @SerializedName("functions")  public List<ExportFunction> functions;
        @SerializedName("call_graph") public ExportCallGraph callGraph;
        @SerializedName("icfg")       public ExportIcfg icfg;
    }

    public static class ExportFunction {
        @SerializedName("name")                    public String name;
        @SerializedName("full_name")               public String fullName;
        @SerializedName("canonical_name")          public String canonicalName;
        @SerializedName("contract")                public String contract;
        @SerializedName("visibility")              public String visibility;
        @SerializedName("state_mutability")        public String stateMutability;
        @SerializedName("is_implemented")          public boolean isImplemented;
        @SerializedName("is_constructor")          public boolean isConstructor;
        @SerializedName("is_fallback")             public boolean isFallback;
        @SerializedName("is_receive")              public boolean isReceive;
        @SerializedName("parameters")              public List<Variable> parameters;
        @SerializedName("returns")                 public List<Variable> returns;
        @SerializedName("modifiers")               public List<String> modifiers;
        @SerializedName("state_variables_read")    public List<String> stateVariablesRead;
        @SerializedName("state_variables_written") public List<String> stateVariablesWritten;
        @SerializedName("source_mapping")          public SourceMapping sourceMapping;  // nullable
    }

    public static class ExportCallGraph {
        @SerializedName("nodes")           public List<ExportCallGraphNode> nodes;
        @SerializedName("edges")           public List<ExportCallGraphEdge> edges;
        @SerializedName("function_edges")  public List<ExportFunctionEdge> functionEdges;
        @SerializedName("call_sites")      public List<ExportFunctionCalls> callSites;
        @SerializedName("low_level_calls") public List<ExportLowLevelCall> lowLevelCalls;
    }

    public static class ExportCallGraphNode {
        @SerializedName("id")             public int id;
        @SerializedName("name")           public String name;
        @SerializedName("full_name")      public String fullName;
        @SerializedName("canonical_name") public String canonicalName;
        @SerializedName("contract")       public String contract;
        @SerializedName("is_implemented") public boolean isImplemented;
        @SerializedName("is_synthetic")   public boolean isSynthetic;
    }

    /** One edge per call site. */
    public static class ExportCallGraphEdge {
        @SerializedName("src")            public int src;
        @SerializedName("dst")            public int dst;
        @SerializedName("order")          public int order;
        @SerializedName("call_type")      public CallKind callType;
        @SerializedName("call_site")      public String callSite;
        @SerializedName("source_mapping") public SourceMapping sourceMapping;
    }

    public static class ExportFunctionEdge {
        @SerializedName("src")        public int src;
        @SerializedName("dst")        public int dst;
        @SerializedName("call_types") public List<CallKind> callTypes;
    }

    public static class ExportFunctionCalls {
        @SerializedName("function")      public int function;
        @SerializedName("function_name") public String functionName;
        @SerializedName("calls")         public List<ExportCall> calls;
    }

    public static class ExportCall {
        @SerializedName("order")          public int order;
        @SerializedName("call_type")      public CallKind callType;
        @SerializedName("callee")         public int callee;
        @SerializedName("callee_name")    public String calleeName;
        @SerializedName("call_site")      public String callSite;
        @SerializedName("source_mapping") public SourceMapping sourceMapping;
    }

    public static class ExportLowLevelCall {
        @SerializedName("function")       public int function;
        @SerializedName("function_name")  public String functionName;
        @SerializedName("order")          public int order;
        @SerializedName("call_site")      public String callSite;
        @SerializedName("source_mapping") public SourceMapping sourceMapping;
    }

    public static class ExportIcfg {
        @SerializedName("nodes") public List<ExportIcfgNode> nodes;
        @SerializedName("edges") public List<ExportIcfgEdge> edges;
    }

    public static class ExportIcfgNode {
        @SerializedName("id")             public int id;
        @SerializedName("label")          public String label;
        @SerializedName("function")       public String function;
        @SerializedName("contract")       public String contract;
        @SerializedName("is_entry_point") public boolean isEntryPoint;
    }

    public static class ExportIcfgEdge {
        @SerializedName("src")       public int src;
        @SerializedName("dst")       public int dst;
        @SerializedName("type")      public IcfgEdgeType type;
        @SerializedName("call_type") public CallKind callType;  // null for intra_procedural
    }
}
