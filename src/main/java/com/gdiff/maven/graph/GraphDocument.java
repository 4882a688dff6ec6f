package com.gdiff.maven.graph;

import java.util.Objects;

/**
 * A whole graph document: a single root graph holding the top-level nodes and edges.
 */
public final class GraphDocument {

    private final Graph root;

    public GraphDocument(Graph root) {
        this.root = Objects.requireNonNull(root, "root");
    }

    public Graph getRoot() {
        return root;
    }

    public GraphDocument withRoot(Graph newRoot) {
        return new GraphDocument(newRoot);
    }

    /**
     * Number of nodes at every nesting level.
     */
    public int nodeCount() {
        int count = 0;
        for (GraphTraversal.Visit ignored : GraphTraversal.preorder(this)) {
            count++;
        }
        return count;
    }
}
