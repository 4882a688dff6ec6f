package com.gdiff.maven.graph;

import java.util.Objects;

/**
 * Rendering metadata of a node: display label, fill color and label font size.
 */
public final class NodeStyle {

    private final String label;
    private final String fillColor;
    private final int fontSize;

    public NodeStyle(String label, String fillColor, int fontSize) {
        this.label = Objects.requireNonNull(label, "label");
        this.fillColor = Objects.requireNonNull(fillColor, "fillColor");
        this.fontSize = fontSize;
    }

    public String getLabel() {
        return label;
    }

    public String getFillColor() {
        return fillColor;
    }

    public int getFontSize() {
        return fontSize;
    }

    public NodeStyle withFillColor(String color) {
        return new NodeStyle(label, color, fontSize);
    }

    public NodeStyle withFontSize(int size) {
        return new NodeStyle(label, fillColor, size);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NodeStyle)) return false;
        NodeStyle that = (NodeStyle) o;
        return fontSize == that.fontSize
                && label.equals(that.label)
                && fillColor.equals(that.fillColor);
    }

    @Override
    public int hashCode() {
        return Objects.hash(label, fillColor, fontSize);
    }

    @Override
    public String toString() {
        return label + " [" + fillColor + ", " + fontSize + "pt]";
    }
}
