package com.gdiff.maven.diff;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.gdiff.maven.graph.GraphDocument;
import com.gdiff.maven.graph.LabelPath;

/**
 * Output of a diff or merge: the painted document, the identifier translation built on the way, the
 * provenance assigned to every label path, and warnings about duplicate labels.
 */
public final class DiffResult {

    private final GraphDocument document;
    private final RenameMap renameMap;
    private final Map<LabelPath, Provenance> provenance;
    private final List<String> warnings;

    public DiffResult(GraphDocument document, RenameMap renameMap, Map<LabelPath, Provenance> provenance,
            List<String> warnings) {
        this.document = document;
        this.renameMap = renameMap;
        this.provenance = Collections.unmodifiableMap(new LinkedHashMap<>(provenance));
        this.warnings = List.copyOf(warnings);
    }

    public GraphDocument getDocument() {
        return document;
    }

    public RenameMap getRenameMap() {
        return renameMap;
    }

    /**
     * Provenance per label path, in traversal order.
     */
    public Map<LabelPath, Provenance> getProvenance() {
        return provenance;
    }

    public List<String> getWarnings() {
        return warnings;
    }

    public List<LabelPath> pathsWith(Provenance wanted) {
        List<LabelPath> paths = new ArrayList<>();
        provenance.forEach((path, value) -> {
            if (value == wanted) {
                paths.add(path);
            }
        });
        return paths;
    }

    public int count(Provenance wanted) {
        return pathsWith(wanted).size();
    }
}
