package com.gdiff.maven.graph;

import java.util.Locale;

/**
 * Semantic tier of a contact map node. Palettes are keyed by this, never by a node's current color.
 */
public enum NodeClass {
    SPECIES("species"),     // molecule
    COMPONENT("component"), // site on a molecule
    STATE("state");         // state of a component

    private final String key;

    NodeClass(String key) {
        this.key = key;
    }

    /**
     * Lower-case name used in configuration files and in the written documents.
     */
    public String key() {
        return key;
    }

    public static NodeClass fromKey(String key) {
        if (key != null) {
            String normalized = key.trim().toLowerCase(Locale.ROOT);
            for (NodeClass nodeClass : values()) {
                if (nodeClass.key.equals(normalized)) {
                    return nodeClass;
                }
            }
        }
        throw new IllegalArgumentException("Unknown node class: " + key);
    }
}
