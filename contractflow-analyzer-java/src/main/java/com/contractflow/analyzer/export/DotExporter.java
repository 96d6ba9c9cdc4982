package com.contractflow.analyzer.export;

import com.contractflow.analyzer.icfg.Icfg;
import com.contractflow.analyzer.icfg.IcfgEdge;
import com.contractflow.analyzer.icfg.IcfgNode;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Renders the ICFG as a Graphviz digraph: one {@code nID [label="..."]} statement
 * per node and one {@code nSRC -> nDST;} statement per edge.
 */
public class DotExporter {

    public String render(Icfg icfg) {
        StringBuilder sb = new StringBuilder();
        sb.append("digraph ICFG {\n");
        sb.append("  node [shape=box,fontname=\"DejaVu Sans\"];\n");
        for (IcfgNode node : icfg.getNodes()) {
            sb.append("  n").append(node.id())
              .append(" [label=\"").append(escape(node.label())).append("\"];\n");
        }
        for (IcfgEdge edge : icfg.getEdges()) {
            sb.append("  n").append(edge.src()).append(" -> n").append(edge.dst()).append(";\n");
        }
        sb.append("}\n");
        return sb.toString();
    }

    /**
     * Writes the rendered graph to {@code fileName}, resolved under
     * {@code outputDir} when relative.
     *
     * @return the written file
     */
    public Path write(Icfg icfg, Path outputDir, String fileName) {
        try {
            Path target = OutputPaths.prepare(outputDir, fileName);
            Files.writeString(target, render(icfg), StandardCharsets.UTF_8);
            System.err.println("[contract-flow] DOT written: " + target);
            return target;
        } catch (IOException e) {
            throw new ExportException("Failed to write DOT output " + fileName + ": " + e.getMessage(), e);
        }
    }

    /** Escapes a label for a double-quoted DOT string; newlines become {@code \n}. */
    static String escape(String label) {
        StringBuilder sb = new StringBuilder(label.length() + 8);
        for (int i = 0; i < label.length(); i++) {
            char c = label.charAt(i);
            switch (c) {
                case '\\' -> sb.append("\\\\");
                case '"' -> sb.append("\\\"");
                case '\n' -> sb.append("\\n");
                case '\r' -> { }
                default -> sb.append(c);
            }
        }
        return sb.toString();
    }
}
