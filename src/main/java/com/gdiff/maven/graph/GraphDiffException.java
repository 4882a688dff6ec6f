package com.gdiff.maven.graph;

/**
 * Base class for every failure raised while reading, diffing, merging or writing graph documents.
 * <p>
 * Carries the label path of the offending node when one is known, so the problem can be located
 * in the input document.
 */
public class GraphDiffException extends RuntimeException {

    private final LabelPath labelPath;

    public GraphDiffException(String message) {
        this(message, null, null);
    }

    public GraphDiffException(String message, LabelPath labelPath) {
        this(message, labelPath, null);
    }

    public GraphDiffException(String message, LabelPath labelPath, Throwable cause) {
        super(withLocation(message, labelPath), cause);
        this.labelPath = labelPath;
    }

    /**
     * Label path of the node the error refers to, or null when the error is not tied to a node.
     */
    public LabelPath getLabelPath() {
        return labelPath;
    }

    private static String withLocation(String message, LabelPath labelPath) {
        if (labelPath == null) {
            return message;
        }
        return message + " (at " + labelPath + ")";
    }
}
