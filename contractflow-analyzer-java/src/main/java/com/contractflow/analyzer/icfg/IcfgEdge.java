package com.contractflow.analyzer.icfg;

import com.contractflow.analyzer.callgraph.CallKind;

/**
 * Edge between two ICFG node ids. {@code callKind} is null for intra-procedural
 * edges.
 */
public record IcfgEdge(int src, int dst, IcfgEdgeType type, CallKind callKind) {

    public static IcfgEdge intra(int src, int dst) {
        return new IcfgEdge(src, dst, IcfgEdgeType.INTRA_PROCEDURAL, null);
    }

    public static IcfgEdge inter(int src, int dst, CallKind kind) {
        return new IcfgEdge(src, dst, IcfgEdgeType.INTER_PROCEDURAL, kind);
    }
}
