package com.gdiff.maven.diff;

import com.gdiff.maven.graph.GraphDiffException;

/**
 * A palette or classification table is incomplete or cannot be read.
 */
public class InvalidPaletteException extends GraphDiffException {

    public InvalidPaletteException(String message) {
        super(message);
    }
}
