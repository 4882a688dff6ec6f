package com.gdiff.maven.graph;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Preorder walk over every node of a document, paired with the node's label path.
 * <p>
 * Uses an explicit work stack, so nesting depth is bounded by heap rather than call stack.
 * Each call to {@link Iterable#iterator()} starts a fresh walk; siblings are visited in
 * document order.
 */
public final class GraphTraversal implements Iterable<GraphTraversal.Visit> {

    private final Graph start;
    private final LabelPath basePath;

    private GraphTraversal(Graph start, LabelPath basePath) {
        this.start = start;
        this.basePath = basePath;
    }

    public static GraphTraversal preorder(GraphDocument document) {
        return new GraphTraversal(document.getRoot(), LabelPath.root());
    }

    /**
     * Walks the nodes below {@code graph}, building label paths on top of {@code basePath}.
     */
    public static GraphTraversal preorder(Graph graph, LabelPath basePath) {
        return new GraphTraversal(graph, basePath);
    }

    @Override
    public Iterator<Visit> iterator() {
        return new PreorderIterator(start, basePath);
    }

    /**
     * One visited node together with its label path and its enclosing node (null at top level).
     */
    public static final class Visit {
        private final LabelPath path;
        private final GraphNode node;
        private final GraphNode parent;

        Visit(LabelPath path, GraphNode node, GraphNode parent) {
            this.path = path;
            this.node = node;
            this.parent = parent;
        }

        public LabelPath getPath() {
            return path;
        }

        public GraphNode getNode() {
            return node;
        }

        public GraphNode getParent() {
            return parent;
        }
    }

    private static final class PreorderIterator implements Iterator<Visit> {
        private final Deque<Visit> stack = new ArrayDeque<>();

        PreorderIterator(Graph start, LabelPath basePath) {
            pushChildren(start.getNodes(), basePath, null);
        }

        @Override
        public boolean hasNext() {
            return !stack.isEmpty();
        }

        @Override
        public Visit next() {
            if (stack.isEmpty()) {
                throw new NoSuchElementException();
            }
            Visit visit = stack.pop();
            pushChildren(visit.node.getChildren(), visit.path, visit.node);
            return visit;
        }

        // pushed in reverse so the first child is popped first
        private void pushChildren(List<GraphNode> children, LabelPath parentPath, GraphNode parent) {
            for (int i = children.size() - 1; i >= 0; i--) {
                GraphNode child = children.get(i);
                stack.push(new Visit(parentPath.append(child.getLabel()), child, parent));
            }
        }
    }
}
