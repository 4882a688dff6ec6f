package com.gdiff.maven.graph;

import java.util.Arrays;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Hierarchical node identifier such as {@code n0::n3::n1}.
 * <p>
 * Each segment is the position index of a node among its siblings; everything before the last
 * separator is the parent's identifier. Identifiers written by other tools that do not follow this
 * scheme are kept verbatim and only fail when an operation needs their segments.
 */
public final class NodeId {

    public static final String SEPARATOR = "::";

    private static final String SEGMENT_PREFIX = "n";
    private static final Pattern SEGMENT = Pattern.compile("n\\d+");

    private final String value;
    private final int[] segments; // null for opaque identifiers

    private NodeId(String value, int[] segments) {
        this.value = value;
        this.segments = segments;
    }

    /**
     * Wraps an identifier, splitting it into segments when it follows the hierarchical scheme.
     */
    public static NodeId of(String value) {
        if (value == null || value.isEmpty()) {
            throw new MalformedDocumentException("Node identifier must not be empty");
        }
        return new NodeId(value, split(value));
    }

    /**
     * Parses a hierarchical identifier, rejecting anything that does not follow the scheme.
     */
    public static NodeId parse(String value) {
        NodeId id = of(value);
        if (!id.isHierarchical()) {
            throw new MalformedDocumentException("Not a hierarchical node identifier: " + value);
        }
        return id;
    }

    /**
     * Identifier of a top-level node.
     */
    public static NodeId root(int index) {
        return fromSegments(new int[] { checkIndex(index) });
    }

    public NodeId child(int index) {
        int[] own = requireSegments();
        int[] extended = Arrays.copyOf(own, own.length + 1);
        extended[own.length] = checkIndex(index);
        return fromSegments(extended);
    }

    /**
     * Identifier of the enclosing node, or null for a top-level node.
     */
    public NodeId parent() {
        int[] own = requireSegments();
        if (own.length == 1) {
            return null;
        }
        return fromSegments(Arrays.copyOf(own, own.length - 1));
    }

    public int lastIndex() {
        int[] own = requireSegments();
        return own[own.length - 1];
    }

    /**
     * Moves this identifier under another parent, keeping its own trailing segment.
     */
    public NodeId withParent(NodeId newParent) {
        return newParent == null ? root(lastIndex()) : newParent.child(lastIndex());
    }

    public boolean isHierarchical() {
        return segments != null;
    }

    public int depth() {
        return requireSegments().length;
    }

    public String getValue() {
        return value;
    }

    private int[] requireSegments() {
        if (segments == null) {
            throw new MalformedDocumentException("Node identifier has no hierarchical segments: " + value);
        }
        return segments;
    }

    /**
     * Segment indexes of a hierarchical identifier, or null when the value does not follow the scheme.
     */
    private static int[] split(String value) {
        String[] parts = value.split(SEPARATOR, -1);
        for (String part : parts) {
            if (!SEGMENT.matcher(part).matches()) {
                return null;
            }
        }
        int[] result = new int[parts.length];
        for (int i = 0; i < parts.length; i++) {
            try {
                result[i] = Integer.parseInt(parts[i].substring(SEGMENT_PREFIX.length()));
            } catch (NumberFormatException e) {
                throw new MalformedDocumentException("Node identifier segment out of range: " + value);
            }
        }
        return result;
    }

    private static NodeId fromSegments(int[] segments) {
        String value = Arrays.stream(segments)
                .mapToObj(i -> SEGMENT_PREFIX + i)
                .collect(Collectors.joining(SEPARATOR));
        return new NodeId(value, segments);
    }

    private static int checkIndex(int index) {
        if (index < 0) {
            throw new IllegalArgumentException("Identifier segment must not be negative: " + index);
        }
        return index;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NodeId)) return false;
        return value.equals(((NodeId) o).value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
