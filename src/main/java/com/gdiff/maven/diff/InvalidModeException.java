package com.gdiff.maven.diff;

import com.gdiff.maven.graph.GraphDiffException;

/**
 * The requested diff mode is not one of {@link DiffMode}.
 */
public class InvalidModeException extends GraphDiffException {

    public InvalidModeException(String mode) {
        super("Mode " + mode + " is not a valid mode, please choose from " + DiffMode.keys());
    }
}
