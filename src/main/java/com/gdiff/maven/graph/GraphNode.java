package com.gdiff.maven.graph;

import java.util.List;
import java.util.Objects;

/**
 * A node of a compound graph: identifier, node class, style and an optional nested graph.
 * <p>
 * Nodes are immutable; every {@code with*} method returns a new node. A node without a
 * subgraph is a leaf (a state); a node with one is a group (a molecule holding its components).
 */
public final class GraphNode {

    private final NodeId id;
    private final NodeClass nodeClass;
    private final NodeStyle style;
    private final Graph subgraph;

    private GraphNode(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id");
        this.nodeClass = Objects.requireNonNull(builder.nodeClass, "nodeClass");
        this.style = Objects.requireNonNull(builder.style, "style");
        this.subgraph = builder.subgraph;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder().id(id).nodeClass(nodeClass).style(style).subgraph(subgraph);
    }

    public NodeId getId() {
        return id;
    }

    public NodeClass getNodeClass() {
        return nodeClass;
    }

    public NodeStyle getStyle() {
        return style;
    }

    public String getLabel() {
        return style.getLabel();
    }

    /**
     * Nested graph, or null for a leaf node.
     */
    public Graph getSubgraph() {
        return subgraph;
    }

    public boolean hasSubgraph() {
        return subgraph != null;
    }

    public List<GraphNode> getChildren() {
        return subgraph == null ? List.of() : subgraph.getNodes();
    }

    public GraphNode withId(NodeId newId) {
        return toBuilder().id(newId).build();
    }

    public GraphNode withStyle(NodeStyle newStyle) {
        return toBuilder().style(newStyle).build();
    }

    public GraphNode withFillColor(String color) {
        return withStyle(style.withFillColor(color));
    }

    public GraphNode withSubgraph(Graph newSubgraph) {
        return toBuilder().subgraph(newSubgraph).build();
    }

    @Override
    public String toString() {
        return id + " " + style + (subgraph == null ? "" : " {" + subgraph.getNodes().size() + " children}");
    }

    public static final class Builder {
        private NodeId id;
        private NodeClass nodeClass;
        private NodeStyle style;
        private Graph subgraph;

        private Builder() {
        }

        public Builder id(NodeId id) {
            this.id = id;
            return this;
        }

        public Builder id(String id) {
            return id(NodeId.of(id));
        }

        public Builder nodeClass(NodeClass nodeClass) {
            this.nodeClass = nodeClass;
            return this;
        }

        public Builder style(NodeStyle style) {
            this.style = style;
            return this;
        }

        public Builder subgraph(Graph subgraph) {
            this.subgraph = subgraph;
            return this;
        }

        public GraphNode build() {
            return new GraphNode(this);
        }
    }
}
