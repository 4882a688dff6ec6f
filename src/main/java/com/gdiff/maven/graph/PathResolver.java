package com.gdiff.maven.graph;

import java.util.Optional;

/**
 * Locates nodes by label path, descending one nesting level per label.
 * <p>
 * Matching is by exact, case-sensitive label equality; identifiers are never compared. A path that
 * runs past a leaf node is simply not found.
 */
public final class PathResolver {

    public static Resolution resolve(GraphDocument document, LabelPath path) {
        return resolve(document.getRoot(), path);
    }

    /**
     * Resolves {@code path} against the nodes of {@code graph}, reporting duplicate sibling labels met
     * on the way as {@link Resolution.Outcome#AMBIGUOUS}.
     */
    public static Resolution resolve(Graph graph, LabelPath path) {
        if (path.isRoot()) {
            return Resolution.root();
        }
        Graph level = graph;
        GraphNode node = null;
        LabelPath duplicatedAt = null;
        for (int depth = 0; depth < path.depth(); depth++) {
            if (level == null) {
                return duplicatedAt == null ? Resolution.absent() : Resolution.ambiguous(null, duplicatedAt);
            }
            String label = path.getLabels().get(depth);
            node = null;
            int matches = 0;
            for (GraphNode candidate : level.getNodes()) {
                if (candidate.getLabel().equals(label)) {
                    if (node == null) {
                        node = candidate;
                    }
                    matches++;
                }
            }
            if (matches > 1 && duplicatedAt == null) {
                duplicatedAt = path.prefix(depth + 1);
            }
            if (node == null) {
                return duplicatedAt == null ? Resolution.absent() : Resolution.ambiguous(null, duplicatedAt);
            }
            level = node.getSubgraph();
        }
        return duplicatedAt == null ? Resolution.found(node) : Resolution.ambiguous(node, duplicatedAt);
    }

    /**
     * First-match lookup ignoring duplicates. Empty for the root path and for unknown paths.
     */
    public static Optional<GraphNode> find(GraphDocument document, LabelPath path) {
        return resolve(document, path).getNode();
    }

    private PathResolver() {
    }
}
