package com.gdiff.maven.graph;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Produces a transformed copy of a graph tree without native recursion.
 * <p>
 * The transform is applied to every node in preorder, the parent's replacement already known.
 * Replacement nodes are then reassembled bottom-up: each replacement keeps its own subgraph
 * metadata (id, edges, allocation counter) while its children are the rebuilt replacements of the
 * original children, in their original order. The input tree is never modified.
 */
public final class GraphRebuilder {

    /**
     * Per-node transformation applied during a rebuild.
     */
    @FunctionalInterface
    public interface NodeTransform {

        /**
         * @param path              label path of the original node
         * @param node              the original node
         * @param parentReplacement replacement of the enclosing node, or null at the top of the rebuilt graph
         * @return the node to put in place of {@code node}; its children are replaced afterwards
         */
        GraphNode apply(LabelPath path, GraphNode node, GraphNode parentReplacement);
    }

    public static GraphDocument rebuild(GraphDocument document, NodeTransform transform) {
        return document.withRoot(rebuild(document.getRoot(), LabelPath.root(), null, transform));
    }

    /**
     * Rebuilds every node below {@code graph}. {@code basePath} and {@code baseParent} describe where
     * the graph sits, so paths and parent replacements seen by the transform are the ones of the full
     * tree.
     */
    public static Graph rebuild(Graph graph, LabelPath basePath, GraphNode baseParent, NodeTransform transform) {
        Deque<Frame> stack = new ArrayDeque<>();
        Frame top = new Frame(basePath, graph, baseParent, graph);
        stack.push(top);
        while (true) {
            Frame frame = stack.peek();
            if (frame.hasNextChild()) {
                GraphNode child = frame.original.getNodes().get(frame.next++);
                LabelPath path = frame.path.append(child.getLabel());
                GraphNode replacement = transform.apply(path, child, frame.owner);
                if (child.hasSubgraph()) {
                    Graph target = replacement.hasSubgraph() ? replacement.getSubgraph() : child.getSubgraph();
                    stack.push(new Frame(path, child.getSubgraph(), replacement, target));
                } else {
                    frame.built.add(replacement);
                }
                continue;
            }
            stack.pop();
            Graph rebuilt = frame.target.withNodes(frame.built);
            if (stack.isEmpty()) {
                return rebuilt;
            }
            stack.peek().built.add(frame.owner.withSubgraph(rebuilt));
        }
    }

    private static final class Frame {
        final LabelPath path;
        final Graph original;
        final GraphNode owner;
        final Graph target;
        final List<GraphNode> built = new ArrayList<>();
        int next;

        Frame(LabelPath path, Graph original, GraphNode owner, Graph target) {
            this.path = path;
            this.original = original;
            this.owner = owner;
            this.target = target;
        }

        boolean hasNextChild() {
            return next < original.getNodes().size();
        }
    }

    private GraphRebuilder() {
    }
}
