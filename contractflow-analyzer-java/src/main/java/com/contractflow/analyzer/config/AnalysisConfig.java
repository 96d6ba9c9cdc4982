package com.contractflow.analyzer.config;

import com.google.gson.annotations.SerializedName;

/**
 * Deserialized form of the optional analysis config file. Every setting has a
 * default, so an empty object (or no file at all) is a valid configuration.
 */
public class AnalysisConfig {

    public static final String DEFAULT_OUTPUT_DIR = "contract-flow-out";
    public static final String DEFAULT_JSON_OUTPUT = "callgraph.json";
    public static final String DEFAULT_DOT_OUTPUT = "icfg.dot";

    @SerializedName("output_dir")
    private String outputDir;

    /** Structured output file name; relative names resolve under the output dir. */
    @SerializedName("json_output")
    private String jsonOutput;

    /** Graph text output file name; relative names resolve under the output dir. */
    @SerializedName("dot_output")
    private String dotOutput;

    @SerializedName("export_json")
    private Boolean exportJson;

    @SerializedName("export_dot")
    private Boolean exportDot;

    /** Maximum characters of source expression in node labels (default: 120). */
    @SerializedName("expression_label_limit")
    private Integer expressionLabelLimit;

    /** Maximum characters of IR fallback text in node labels (default: 80). */
    @SerializedName("ir_label_limit")
    private Integer irLabelLimit;

    public static AnalysisConfig defaults() {
        return new AnalysisConfig();
    }

    public String getOutputDir()    { return outputDir  != null ? outputDir  : DEFAULT_OUTPUT_DIR; }
    public String getJsonOutput()   { return jsonOutput != null ? jsonOutput : DEFAULT_JSON_OUTPUT; }
    public String getDotOutput()    { return dotOutput  != null ? dotOutput  : DEFAULT_DOT_OUTPUT; }
    public boolean isExportJson()   { return exportJson == null || exportJson; }
    public boolean isExportDot()    { return exportDot  == null || exportDot; }
    public int getExpressionLabelLimit() { return expressionLabelLimit != null ? expressionLabelLimit : 120; }
    public int getIrLabelLimit()         { return irLabelLimit != null ? irLabelLimit : 80; }

    public void setOutputDir(String outputDir)   { this.outputDir = outputDir; }
    public void setJsonOutput(String jsonOutput) { this.jsonOutput = jsonOutput; }
    public void setDotOutput(String dotOutput)   { this.dotOutput = dotOutput; }
    public void setExportJson(boolean exportJson) { this.exportJson = exportJson; }
    public void setExportDot(boolean exportDot)   { this.exportDot = exportDot; }
}
