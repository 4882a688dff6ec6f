package com.gdiff.maven.diff;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

import com.gdiff.maven.graph.NodeClass;

/**
 * Fill colors per provenance slot and node class.
 */
public final class Palette {

    private final Map<Provenance, Map<NodeClass, String>> slots;

    private Palette(Map<Provenance, Map<NodeClass, String>> slots) {
        this.slots = slots;
    }

    /**
     * Blue for source-only, red for other-only, green for shared nodes; darker shades for outer tiers.
     */
    public static Palette defaults() {
        return of(
                colors("#dadbfd", "#e6e7fe", "#f3f3ff"),
                colors("#ff9e81", "#ffbfaa", "#ffdfd4"),
                colors("#c4ed9e", "#d9f4be", "#ecf9df"));
    }

    public static Palette of(Map<NodeClass, String> sourceOnly, Map<NodeClass, String> otherOnly,
            Map<NodeClass, String> intersect) {
        Map<Provenance, Map<NodeClass, String>> slots = new EnumMap<>(Provenance.class);
        slots.put(Provenance.SOURCE_ONLY, checked(Provenance.SOURCE_ONLY, sourceOnly));
        slots.put(Provenance.OTHER_ONLY, checked(Provenance.OTHER_ONLY, otherOnly));
        slots.put(Provenance.INTERSECT, checked(Provenance.INTERSECT, intersect));
        return new Palette(Collections.unmodifiableMap(slots));
    }

    /**
     * Builds a species/component/state color table.
     */
    public static Map<NodeClass, String> colors(String species, String component, String state) {
        Map<NodeClass, String> colors = new EnumMap<>(NodeClass.class);
        colors.put(NodeClass.SPECIES, species);
        colors.put(NodeClass.COMPONENT, component);
        colors.put(NodeClass.STATE, state);
        return colors;
    }

    public String color(Provenance slot, NodeClass nodeClass) {
        return slots.get(slot).get(nodeClass);
    }

    public Map<NodeClass, String> slot(Provenance slot) {
        return slots.get(slot);
    }

    /**
     * Palette for the reverse direction: the source-only and other-only slots trade places.
     */
    public Palette mirrored() {
        return of(slot(Provenance.OTHER_ONLY), slot(Provenance.SOURCE_ONLY), slot(Provenance.INTERSECT));
    }

    private static Map<NodeClass, String> checked(Provenance slot, Map<NodeClass, String> colors) {
        if (colors == null) {
            throw new InvalidPaletteException("Palette slot " + slot.key() + " is missing");
        }
        Map<NodeClass, String> copy = new EnumMap<>(NodeClass.class);
        for (NodeClass nodeClass : NodeClass.values()) {
            String color = colors.get(nodeClass);
            if (color == null || color.isBlank()) {
                throw new InvalidPaletteException("Palette slot " + slot.key() + " has no color for " + nodeClass.key());
            }
            copy.put(nodeClass, color.trim());
        }
        return Collections.unmodifiableMap(copy);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Palette)) return false;
        return slots.equals(((Palette) o).slots);
    }

    @Override
    public int hashCode() {
        return slots.hashCode();
    }

    @Override
    public String toString() {
        return "Palette" + slots;
    }
}
