package com.gdiff.maven.diff;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.gdiff.maven.graph.GraphDocument;

/**
 * Everything one diff run produced: the documents to write, keyed by file name, and the diff or union
 * results they came from.
 */
public final class DiffRun {

    private final DiffMode mode;
    private final Map<String, GraphDocument> outputs = new LinkedHashMap<>();
    private final Map<String, DiffResult> results = new LinkedHashMap<>();

    DiffRun(DiffMode mode) {
        this.mode = mode;
    }

    void addOutput(String name, GraphDocument document) {
        outputs.put(name, document);
    }

    void addResult(String name, DiffResult result, GraphDocument document) {
        results.put(name, result);
        outputs.put(name, document);
    }

    public DiffMode getMode() {
        return mode;
    }

    /**
     * Documents to write, in the order they were produced.
     */
    public Map<String, GraphDocument> getOutputs() {
        return Collections.unmodifiableMap(outputs);
    }

    /**
     * Diff and union results keyed by the name of the output they were written to.
     */
    public Map<String, DiffResult> getResults() {
        return Collections.unmodifiableMap(results);
    }

    public List<String> getWarnings() {
        List<String> warnings = new ArrayList<>();
        for (DiffResult result : results.values()) {
            for (String warning : result.getWarnings()) {
                if (!warnings.contains(warning)) {
                    warnings.add(warning);
                }
            }
        }
        return warnings;
    }
}
