package com.gdiff.maven.diff;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.gdiff.maven.graph.MalformedDocumentException;
import com.gdiff.maven.graph.NodeId;

/**
 * Translation from node identifiers of an input document to identifiers in a diff or union document.
 * Scoped to one diff or merge invocation.
 */
public final class RenameMap {

    private final Map<NodeId, NodeId> entries = new LinkedHashMap<>();

    public RenameMap() {
    }

    public RenameMap(RenameMap other) {
        entries.putAll(other.entries);
    }

    public void put(NodeId from, NodeId to) {
        entries.put(from, to);
    }

    public boolean contains(NodeId from) {
        return entries.containsKey(from);
    }

    /**
     * Destination identifier for {@code from}.
     *
     * @throws MalformedDocumentException if nothing was recorded for {@code from}
     */
    public NodeId get(NodeId from) {
        NodeId to = entries.get(from);
        if (to == null) {
            throw new MalformedDocumentException("No node with identifier " + from + " to map an edge endpoint to");
        }
        return to;
    }

    public String get(String from) {
        return get(NodeId.of(from)).getValue();
    }

    public int size() {
        return entries.size();
    }

    public Map<NodeId, NodeId> asMap() {
        return Collections.unmodifiableMap(entries);
    }

    @Override
    public String toString() {
        return entries.toString();
    }
}
