package com.gdiff.maven.graph;

/**
 * Two or more sibling nodes share a label, so a label path does not identify a single node.
 */
public class AmbiguousLabelPathException extends GraphDiffException {

    private final LabelPath duplicatedAt;

    public AmbiguousLabelPathException(LabelPath requested, LabelPath duplicatedAt) {
        super("Label path is ambiguous, duplicate sibling label at " + duplicatedAt, requested);
        this.duplicatedAt = duplicatedAt;
    }

    /**
     * The shortest prefix of the requested path whose last label occurs more than once among its siblings.
     */
    public LabelPath getDuplicatedAt() {
        return duplicatedAt;
    }
}
