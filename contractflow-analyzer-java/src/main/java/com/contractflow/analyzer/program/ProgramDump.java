package com.contractflow.analyzer.program;

import com.google.gson.JsonElement;
import com.google.gson.annotations.SerializedName;
import java.util.List;

/**
 * POJOs matching the front end's program dump.
 * Function references are canonical ids ({@code Contract.signature}); node
 * references are node ids local to the owning function.
 */
public final class ProgramDump {

    private ProgramDump() {}

    public static class DumpRoot {
        @SerializedName("contracts") public List<DumpContract> contracts;
    }

    public static class DumpContract {
        @SerializedName("name")      public String name;
        @SerializedName("kind")      public ContractKind kind;
        @SerializedName("functions") public List<DumpFunction> functions;
    }

    public static class DumpFunction {
        @SerializedName("name")                    public String name;
        @SerializedName("signature")               public String signature;   // nullable
        @SerializedName("implemented")             public Boolean implemented;
        @SerializedName("visibility")              public String visibility;
        @SerializedName("state_mutability")        public String stateMutability;
        @SerializedName("is_constructor")          public boolean isConstructor;
        @SerializedName("is_fallback")             public boolean isFallback;
        @SerializedName("is_receive")              public boolean isReceive;
        @SerializedName("parameters")              public List<Variable> parameters;
        @SerializedName("returns")                 public List<Variable> returns;
        @SerializedName("modifiers")               public List<String> modifiers;
        @SerializedName("state_variables_read")    public List<String> stateVariablesRead;
        @SerializedName("state_variables_written") public List<String> stateVariablesWritten;
        @SerializedName("source_mapping")          public SourceMapping sourceMapping;
        @SerializedName("entry_point")             public Integer entryPoint;
        @SerializedName("nodes")                   public List<DumpNode> nodes;
    }

    public static class DumpNode {
        @SerializedName("id")               public int id;
        @SerializedName("type")             public String type;
        @SerializedName("expression")       public JsonElement expression;
        @SerializedName("source_mapping")   public SourceMapping sourceMapping;
        @SerializedName("sons")             public List<Integer> sons;
        @SerializedName("irs")              public List<DumpOperation> irs;
        @SerializedName("internal_calls")   public List<String> internalCalls;
        @SerializedName("high_level_calls") public List<String> highLevelCalls;
        @SerializedName("low_level_calls")  public List<JsonElement> lowLevelCalls;
    }

    public static class DumpOperation {
        @SerializedName("type")   public OperationType type;
        @SerializedName("target") public String target;   // canonical function id, nullable
        @SerializedName("text")   public JsonElement text;
    }
}
