package com.gdiff.maven.config;

import java.util.EnumMap;
import java.util.Map;

import com.gdiff.maven.diff.CosmeticPass;
import com.gdiff.maven.diff.DiffMode;
import com.gdiff.maven.diff.DuplicateLabelPolicy;
import com.gdiff.maven.diff.GraphDiffJob;
import com.gdiff.maven.diff.InvalidPaletteException;
import com.gdiff.maven.diff.Palette;
import com.gdiff.maven.diff.Provenance;
import com.gdiff.maven.graph.NodeClass;
import com.gdiff.maven.graphml.ColorClassifier;

/**
 * Settings of a diff run: mode, palette, node classification colors, font enlargement and
 * duplicate label handling.
 */
public class DiffConfig {
    private DiffMode mode = DiffMode.MATRIX;
    private Palette palette = Palette.defaults();
    private ColorClassifier classifier = ColorClassifier.defaults();
    private int fontSizeDelta = CosmeticPass.DEFAULT_FONT_SIZE_DELTA;
    private DuplicateLabelPolicy duplicateLabels = DuplicateLabelPolicy.WARN;

    public DiffMode getMode() {
        return mode;
    }

    public void setMode(DiffMode mode) {
        this.mode = mode;
    }

    public Palette getPalette() {
        return palette;
    }

    public void setPalette(Palette palette) {
        this.palette = palette;
    }

    public ColorClassifier getClassifier() {
        return classifier;
    }

    public void setClassifier(ColorClassifier classifier) {
        this.classifier = classifier;
    }

    public int getFontSizeDelta() {
        return fontSizeDelta;
    }

    public void setFontSizeDelta(int fontSizeDelta) {
        this.fontSizeDelta = fontSizeDelta;
    }

    public DuplicateLabelPolicy getDuplicateLabels() {
        return duplicateLabels;
    }

    public void setDuplicateLabels(DuplicateLabelPolicy duplicateLabels) {
        this.duplicateLabels = duplicateLabels;
    }

    public GraphDiffJob createJob() {
        return new GraphDiffJob(mode, palette, fontSizeDelta, duplicateLabels);
    }

    /**
     * Reads a configuration map as loaded from YAML. Keys that are absent keep their defaults;
     * a palette slot that is present must name a color for every node class.
     */
    @SuppressWarnings("unchecked")
    public static DiffConfig fromMap(Map<String, Object> map) {
        DiffConfig config = new DiffConfig();
        if (map == null) {
            return config;
        }
        if (map.get("mode") != null) {
            config.setMode(DiffMode.parse(map.get("mode").toString()));
        }
        if (map.get("fontSizeDelta") != null) {
            config.setFontSizeDelta(toInt("fontSizeDelta", map.get("fontSizeDelta")));
        }
        if (map.get("duplicateLabels") != null) {
            config.setDuplicateLabels(DuplicateLabelPolicy.parse(map.get("duplicateLabels").toString()));
        }
        if (map.get("classification") instanceof Map) {
            config.setClassifier(new ColorClassifier(colors("classification", (Map<String, Object>) map.get("classification"))));
        }
        if (map.get("palette") instanceof Map) {
            Map<String, Object> slots = (Map<String, Object>) map.get("palette");
            Palette defaults = config.getPalette();
            config.setPalette(Palette.of(
                    slot(slots, Provenance.SOURCE_ONLY, defaults),
                    slot(slots, Provenance.OTHER_ONLY, defaults),
                    slot(slots, Provenance.INTERSECT, defaults)));
        }
        return config;
    }

    @SuppressWarnings("unchecked")
    private static Map<NodeClass, String> slot(Map<String, Object> slots, Provenance slot, Palette defaults) {
        Object value = slots.get(slot.key());
        if (value == null) {
            return defaults.slot(slot);
        }
        if (!(value instanceof Map)) {
            throw new InvalidPaletteException("Palette slot " + slot.key() + " must map node classes to colors");
        }
        return colors("palette." + slot.key(), (Map<String, Object>) value);
    }

    private static Map<NodeClass, String> colors(String section, Map<String, Object> values) {
        Map<NodeClass, String> colors = new EnumMap<>(NodeClass.class);
        for (Map.Entry<String, Object> entry : values.entrySet()) {
            try {
                colors.put(NodeClass.fromKey(entry.getKey()), String.valueOf(entry.getValue()));
            } catch (IllegalArgumentException e) {
                throw new InvalidPaletteException("Unknown node class '" + entry.getKey() + "' in " + section);
            }
        }
        return colors;
    }

    private static int toInt(String key, Object value) {
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be a whole number: " + value, e);
        }
    }
}
