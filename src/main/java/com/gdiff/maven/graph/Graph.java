package com.gdiff.maven.graph;

import java.util.ArrayList;
import java.util.List;

/**
 * One nesting level of a compound graph: ordered nodes and the edges declared at this level.
 * <p>
 * {@code nextIndex} is the identifier segment the next inserted child receives. It starts one past
 * the highest segment among the children and never decreases, so allocation does not depend on
 * the order siblings are stored in.
 */
public final class Graph {

    private final String id;
    private final List<GraphNode> nodes;
    private final List<GraphEdge> edges;
    private final int nextIndex;

    private Graph(Builder builder) {
        this.id = builder.id;
        this.nodes = List.copyOf(builder.nodes);
        this.edges = List.copyOf(builder.edges);
        this.nextIndex = Math.max(builder.nextIndex, firstFreeIndex(this.nodes));
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder().id(id).nodes(nodes).edges(edges).nextIndex(nextIndex);
    }

    /**
     * Identifier of the graph element, or null when the source document had none.
     */
    public String getId() {
        return id;
    }

    public List<GraphNode> getNodes() {
        return nodes;
    }

    public List<GraphEdge> getEdges() {
        return edges;
    }

    public int getNextIndex() {
        return nextIndex;
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    public Graph withId(String newId) {
        return toBuilder().id(newId).build();
    }

    public Graph withNodes(List<GraphNode> newNodes) {
        return toBuilder().nodes(newNodes).build();
    }

    public Graph withEdges(List<GraphEdge> newEdges) {
        return toBuilder().edges(newEdges).build();
    }

    private static int firstFreeIndex(List<GraphNode> nodes) {
        int next = 0;
        for (GraphNode node : nodes) {
            if (node.getId().isHierarchical()) {
                next = Math.max(next, node.getId().lastIndex() + 1);
            }
        }
        return next;
    }

    public static final class Builder {
        private String id;
        private final List<GraphNode> nodes = new ArrayList<>();
        private final List<GraphEdge> edges = new ArrayList<>();
        private int nextIndex;

        private Builder() {
        }

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder node(GraphNode node) {
            nodes.add(node);
            return this;
        }

        public Builder nodes(List<GraphNode> newNodes) {
            nodes.clear();
            nodes.addAll(newNodes);
            return this;
        }

        public Builder edge(GraphEdge edge) {
            edges.add(edge);
            return this;
        }

        public Builder edges(List<GraphEdge> newEdges) {
            edges.clear();
            edges.addAll(newEdges);
            return this;
        }

        public Builder nextIndex(int nextIndex) {
            this.nextIndex = nextIndex;
            return this;
        }

        public Graph build() {
            return new Graph(this);
        }
    }
}
