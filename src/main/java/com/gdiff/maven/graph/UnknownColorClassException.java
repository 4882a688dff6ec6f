package com.gdiff.maven.graph;

/**
 * A node's fill color matches none of the classification colors.
 */
public class UnknownColorClassException extends GraphDiffException {

    private final String color;

    public UnknownColorClassException(String color, LabelPath labelPath) {
        super("Node color " + color + " doesn't match known colors", labelPath);
        this.color = color;
    }

    public String getColor() {
        return color;
    }
}
