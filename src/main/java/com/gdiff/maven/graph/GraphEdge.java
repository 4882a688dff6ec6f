package com.gdiff.maven.graph;

import java.util.Objects;

/**
 * An edge between two node identifiers. Direction is kept as written but ignored when
 * comparing edges for duplicates.
 */
public final class GraphEdge {

    private final String id;
    private final String source;
    private final String target;

    public GraphEdge(String id, String source, String target) {
        this.id = id;
        this.source = Objects.requireNonNull(source, "source");
        this.target = Objects.requireNonNull(target, "target");
    }

    public String getId() {
        return id;
    }

    public String getSource() {
        return source;
    }

    public String getTarget() {
        return target;
    }

    /**
     * True when this edge joins {@code a} and {@code b}, in either direction.
     */
    public boolean connects(String a, String b) {
        return (source.equals(a) && target.equals(b))
                || (source.equals(b) && target.equals(a));
    }

    public GraphEdge withId(String newId) {
        return new GraphEdge(newId, source, target);
    }

    public GraphEdge withEndpoints(String newSource, String newTarget) {
        return new GraphEdge(id, newSource, newTarget);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof GraphEdge)) return false;
        GraphEdge that = (GraphEdge) o;
        return Objects.equals(id, that.id) && source.equals(that.source) && target.equals(that.target);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, source, target);
    }

    @Override
    public String toString() {
        return id + ": " + source + " -- " + target;
    }
}
