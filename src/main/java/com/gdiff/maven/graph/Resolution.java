package com.gdiff.maven.graph;

import java.util.Optional;

/**
 * Outcome of resolving a label path against a document.
 * <p>
 * {@code AMBIGUOUS} means some label along the path occurs on more than one sibling. It still
 * carries the node a first-match walk would reach, if any, so callers can choose to proceed.
 */
public final class Resolution {

    public enum Outcome {
        FOUND,
        ABSENT,
        AMBIGUOUS
    }

    private static final Resolution ROOT = new Resolution(Outcome.FOUND, null, null);
    private static final Resolution ABSENT = new Resolution(Outcome.ABSENT, null, null);

    private final Outcome outcome;
    private final GraphNode node;
    private final LabelPath duplicatedAt;

    private Resolution(Outcome outcome, GraphNode node, LabelPath duplicatedAt) {
        this.outcome = outcome;
        this.node = node;
        this.duplicatedAt = duplicatedAt;
    }

    /**
     * The empty path resolves to the synthetic document root, which has no {@link GraphNode}.
     */
    public static Resolution root() {
        return ROOT;
    }

    public static Resolution found(GraphNode node) {
        return new Resolution(Outcome.FOUND, node, null);
    }

    public static Resolution absent() {
        return ABSENT;
    }

    public static Resolution ambiguous(GraphNode firstMatch, LabelPath duplicatedAt) {
        return new Resolution(Outcome.AMBIGUOUS, firstMatch, duplicatedAt);
    }

    public Outcome getOutcome() {
        return outcome;
    }

    public boolean isRoot() {
        return this == ROOT;
    }

    public boolean isFound() {
        return outcome == Outcome.FOUND;
    }

    public boolean isAmbiguous() {
        return outcome == Outcome.AMBIGUOUS;
    }

    /**
     * The resolved node; for an ambiguous outcome the first match, if the walk reached one.
     */
    public Optional<GraphNode> getNode() {
        return Optional.ofNullable(node);
    }

    public LabelPath getDuplicatedAt() {
        return duplicatedAt;
    }

    @Override
    public String toString() {
        if (isRoot()) {
            return "ROOT";
        }
        return outcome + (node == null ? "" : " " + node.getId());
    }
}
