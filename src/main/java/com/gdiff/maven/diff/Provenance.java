package com.gdiff.maven.diff;

import java.util.Locale;

/**
 * Where a node of a diff or union document comes from. Doubles as the palette slot the node is painted with.
 */
public enum Provenance {
    SOURCE_ONLY("sourceOnly"),
    OTHER_ONLY("otherOnly"),
    INTERSECT("intersect");

    private final String key;

    Provenance(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public static Provenance fromKey(String key) {
        if (key != null) {
            for (Provenance provenance : values()) {
                if (provenance.key.equalsIgnoreCase(key.trim())) {
                    return provenance;
                }
            }
        }
        throw new IllegalArgumentException("Unknown palette slot: " + key
                + " (expected sourceOnly, otherOnly or intersect)");
    }

    @Override
    public String toString() {
        return name().toLowerCase(Locale.ROOT).replace('_', '-');
    }
}
