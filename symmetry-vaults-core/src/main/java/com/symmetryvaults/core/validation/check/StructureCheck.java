package com.symmetryvaults.core.validation.check;

import com.symmetryvaults.core.graph.Edge;
import com.symmetryvaults.core.graph.Graph;
import com.symmetryvaults.core.graph.Node;
import com.symmetryvaults.core.model.GraphSection;
import com.symmetryvaults.core.model.GraphSection.EdgeEntry;
import com.symmetryvaults.core.model.GraphSection.NodeEntry;
import com.symmetryvaults.core.model.LevelDocument;
import com.symmetryvaults.core.validation.LevelCheck;
import com.symmetryvaults.core.validation.ValidationContext;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Required sections, graph well-formedness and the declared group order.
 *
 * <p>When the graph passes, it is rebuilt as a {@link Graph} and stored in the
 * context for the symmetry checks.
 */
public class StructureCheck implements LevelCheck {

    @Override
    public String section() {
        return "structure";
    }

    @Override
    public int getPriority() {
        return 10;
    }

    @Override
    public void check(ValidationContext context) {
        LevelDocument document = context.document();
        if (document.meta() == null) {
            context.error(section(), null, "required_section", "meta", "missing");
        } else {
            if (document.meta().id() == null) {
                context.error("meta", null, "level_id", "non-empty id", "missing");
            }
            if (document.meta().groupOrder() == null) {
                context.error("meta", null, "group_order", "integer", "missing");
            }
        }
        if (document.graph() == null) {
            context.error(section(), null, "required_section", "graph", "missing");
        } else {
            checkGraph(context, document.graph());
        }
        if (document.symmetries() == null || document.symmetries().automorphisms() == null) {
            context.error(section(), null, "required_section", "symmetries.automorphisms", "missing");
        } else if (document.meta() != null && document.meta().groupOrder() != null
            && document.meta().groupOrder() != document.symmetries().automorphisms().size()) {
            context.error("meta", null, "group_order", document.symmetries().automorphisms().size(),
                document.meta().groupOrder());
        }
    }

    private void checkGraph(ValidationContext context, GraphSection section) {
        List<NodeEntry> nodes = section.nodes() == null ? List.of() : section.nodes();
        List<EdgeEntry> edges = section.edges() == null ? List.of() : section.edges();
        boolean valid = true;

        if (nodes.size() < 2) {
            context.warning("graph", null, "graph_size", "at least 2 nodes", nodes.size());
        }
        if (nodes.size() > context.limits().maxVertices()) {
            context.warning("graph", null, "graph_size", "at most " + context.limits().maxVertices() + " nodes",
                nodes.size());
        }
        for (int i = 0; i < nodes.size(); i++) {
            NodeEntry node = nodes.get(i);
            if (node == null || node.id() == null || node.id() != i) {
                context.error("graph", null, "node_ids_dense", "id " + i + " at position " + i,
                    node == null ? null : node.id());
                valid = false;
            } else if (node.color() == null) {
                context.error("graph", null, "node_color", "color for node " + i, "missing");
                valid = false;
            }
        }

        Set<String> seen = new HashSet<>();
        for (EdgeEntry edge : edges) {
            if (edge == null || edge.from() == null || edge.to() == null
                || edge.from() < 0 || edge.to() < 0 || edge.from() >= nodes.size() || edge.to() >= nodes.size()) {
                context.error("graph", null, "edge_endpoints", "endpoints in 0.." + (nodes.size() - 1), edge);
                valid = false;
                continue;
            }
            if (edge.from().equals(edge.to())) {
                context.error("graph", null, "self_loop", "no self-loops", edge);
                valid = false;
                continue;
            }
            if (!seen.add(edgeKey(edge))) {
                context.error("graph", null, "duplicate_edge", "unique (from, to, type)", edge);
                valid = false;
            }
        }

        if (!valid || nodes.isEmpty()) {
            return;
        }
        List<Node> graphNodes = new ArrayList<>(nodes.size());
        for (NodeEntry node : nodes) {
            graphNodes.add(new Node(node.id(), node.color(), node.label()));
        }
        List<Edge> graphEdges = new ArrayList<>(edges.size());
        for (EdgeEntry edge : edges) {
            graphEdges.add(new Edge(edge.from(), edge.to(), typeOf(edge), edge.directedEdge()));
        }
        Graph graph = new Graph(graphNodes, graphEdges);
        if (!graph.isConnected()) {
            context.warning("graph", null, "connectivity", "connected graph", "disconnected");
        }
        context.graph(graph);
    }

    private static String typeOf(EdgeEntry edge) {
        return edge.type() != null ? edge.type() : Edge.STANDARD;
    }

    private static String edgeKey(EdgeEntry edge) {
        if (edge.directedEdge()) {
            return edge.from() + ">" + edge.to() + ":" + typeOf(edge);
        }
        return Math.min(edge.from(), edge.to()) + "-" + Math.max(edge.from(), edge.to()) + ":" + typeOf(edge);
    }
}
