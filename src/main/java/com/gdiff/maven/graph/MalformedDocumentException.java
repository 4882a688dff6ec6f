package com.gdiff.maven.graph;

/**
 * A document lacks structure the engine needs: a node without a style block, label or fill,
 * an identifier that cannot be split into segments, or an edge pointing at a node that is not there.
 */
public class MalformedDocumentException extends GraphDiffException {

    public MalformedDocumentException(String message) {
        super(message);
    }

    public MalformedDocumentException(String message, LabelPath labelPath) {
        super(message, labelPath);
    }

    public MalformedDocumentException(String message, LabelPath labelPath, Throwable cause) {
        super(message, labelPath, cause);
    }
}
