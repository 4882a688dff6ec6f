package com.gdiff.maven.graphml;

import java.util.Collections;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import com.gdiff.maven.diff.InvalidPaletteException;
import com.gdiff.maven.graph.LabelPath;
import com.gdiff.maven.graph.NodeClass;
import com.gdiff.maven.graph.UnknownColorClassException;

/**
 * Infers a node's class from the fill color a contact map generator gave it.
 * <p>
 * Only used for documents that do not carry an explicit node class.
 */
public final class ColorClassifier {

    private final Map<NodeClass, String> colors;

    public ColorClassifier(Map<NodeClass, String> colors) {
        Map<NodeClass, String> normalized = new EnumMap<>(NodeClass.class);
        Set<String> seen = new HashSet<>();
        for (NodeClass nodeClass : NodeClass.values()) {
            String color = colors.get(nodeClass);
            if (color == null || color.isBlank()) {
                throw new InvalidPaletteException("No classification color for " + nodeClass.key());
            }
            String key = normalize(color);
            if (!seen.add(key)) {
                throw new InvalidPaletteException("Classification color " + color + " is used for more than one node class");
            }
            normalized.put(nodeClass, color.trim());
        }
        this.colors = Collections.unmodifiableMap(normalized);
    }

    /**
     * Grey species, white components, yellow states.
     */
    public static ColorClassifier defaults() {
        Map<NodeClass, String> colors = new EnumMap<>(NodeClass.class);
        colors.put(NodeClass.SPECIES, "#D2D2D2");
        colors.put(NodeClass.COMPONENT, "#FFFFFF");
        colors.put(NodeClass.STATE, "#FFCC00");
        return new ColorClassifier(colors);
    }

    /**
     * @param color fill color, compared case-insensitively
     * @param path  where the node sits, reported on failure
     * @throws UnknownColorClassException if the color belongs to no class
     */
    public NodeClass classify(String color, LabelPath path) {
        if (color != null) {
            String key = normalize(color);
            for (Map.Entry<NodeClass, String> entry : colors.entrySet()) {
                if (normalize(entry.getValue()).equals(key)) {
                    return entry.getKey();
                }
            }
        }
        throw new UnknownColorClassException(color, path);
    }

    private static String normalize(String color) {
        return color.trim().toUpperCase(Locale.ROOT);
    }
}
