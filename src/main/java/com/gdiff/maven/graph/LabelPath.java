package com.gdiff.maven.graph;

import java.util.ArrayList;
import java.util.List;

/**
 * Sequence of node labels from the document root down to a node.
 * <p>
 * Two nodes in different documents denote the same entity when their label paths are equal.
 * The empty path denotes the synthetic document root.
 */
public final class LabelPath {

    private static final LabelPath ROOT = new LabelPath(List.of());

    private final List<String> labels;

    private LabelPath(List<String> labels) {
        this.labels = labels;
    }

    public static LabelPath root() {
        return ROOT;
    }

    public static LabelPath of(String... labels) {
        return of(List.of(labels));
    }

    public static LabelPath of(List<String> labels) {
        return labels.isEmpty() ? ROOT : new LabelPath(List.copyOf(labels));
    }

    public LabelPath append(String label) {
        List<String> extended = new ArrayList<>(labels.size() + 1);
        extended.addAll(labels);
        extended.add(label);
        return new LabelPath(List.copyOf(extended));
    }

    public LabelPath parent() {
        if (isRoot()) {
            throw new IllegalStateException("The root path has no parent");
        }
        return of(labels.subList(0, labels.size() - 1));
    }

    public LabelPath prefix(int length) {
        return of(labels.subList(0, length));
    }

    public String last() {
        if (isRoot()) {
            throw new IllegalStateException("The root path has no label");
        }
        return labels.get(labels.size() - 1);
    }

    public boolean isRoot() {
        return labels.isEmpty();
    }

    public int depth() {
        return labels.size();
    }

    public List<String> getLabels() {
        return labels;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LabelPath)) return false;
        return labels.equals(((LabelPath) o).labels);
    }

    @Override
    public int hashCode() {
        return labels.hashCode();
    }

    @Override
    public String toString() {
        return isRoot() ? "<root>" : String.join("/", labels);
    }
}
