package com.gdiff.maven.diff;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import com.gdiff.maven.graph.AmbiguousLabelPathException;
import com.gdiff.maven.graph.GraphNode;
import com.gdiff.maven.graph.LabelPath;
import com.gdiff.maven.graph.Resolution;

/**
 * What to do when a label path crosses duplicate sibling labels.
 */
public enum DuplicateLabelPolicy {
    /** Take the first match and record a warning. */
    WARN,
    /** Abort with {@link AmbiguousLabelPathException}. */
    FAIL;

    public static DuplicateLabelPolicy parse(String value) {
        if (value != null) {
            for (DuplicateLabelPolicy policy : values()) {
                if (policy.name().equalsIgnoreCase(value.trim())) {
                    return policy;
                }
            }
        }
        throw new IllegalArgumentException("Unknown duplicate label policy: " + value + " (expected warn or fail)");
    }

    /**
     * Turns a resolution into the node to use, applying this policy to ambiguous outcomes.
     *
     * @param requested path that was resolved
     * @param document  name of the document it was resolved in, for the warning text
     * @param warnings  receives one line per ambiguity under {@link #WARN}
     */
    Optional<GraphNode> select(Resolution resolution, LabelPath requested, String document, List<String> warnings) {
        if (resolution.isAmbiguous()) {
            if (this == FAIL) {
                throw new AmbiguousLabelPathException(requested, resolution.getDuplicatedAt());
            }
            String warning = "Duplicate sibling label at " + resolution.getDuplicatedAt() + " in " + document
                    + ", using first match for " + requested;
            if (!warnings.contains(warning)) {
                warnings.add(warning);
            }
        }
        return resolution.getNode();
    }

    /**
     * Applies this policy to every label that occurs on more than one of {@code siblings}.
     *
     * @param parentPath label path of the level the siblings sit at
     */
    void checkSiblings(List<GraphNode> siblings, LabelPath parentPath, String document, List<String> warnings) {
        Set<String> seen = new HashSet<>();
        for (GraphNode sibling : siblings) {
            if (!seen.add(sibling.getLabel())) {
                LabelPath duplicated = parentPath.append(sibling.getLabel());
                select(Resolution.ambiguous(sibling, duplicated), duplicated, document, warnings);
            }
        }
    }
}
