package com.contractflow.analyzer.icfg;

import com.contractflow.analyzer.program.Node;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/** The reduced interprocedural control-flow graph. Node ids equal list positions. */
public class Icfg {

    private final List<IcfgNode> nodes;
    private final List<IcfgEdge> edges;
    private final Map<Node, Integer> ids;

    Icfg(List<IcfgNode> nodes, List<IcfgEdge> edges, Map<Node, Integer> ids) {
        this.nodes = Collections.unmodifiableList(nodes);
        this.edges = Collections.unmodifiableList(edges);
        this.ids = ids;
    }

    public List<IcfgNode> getNodes() { return nodes; }
    public List<IcfgEdge> getEdges() { return edges; }

    /** ICFG id of a front-end node, or null when the node was reduced away. */
    public Integer idOf(Node node) {
        return ids.get(node);
    }

    public IcfgNode node(int id) { return nodes.get(id); }
}
