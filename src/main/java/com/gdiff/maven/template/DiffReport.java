package com.gdiff.maven.template;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.gdiff.maven.diff.DiffResult;
import com.gdiff.maven.diff.DiffRun;
import com.gdiff.maven.diff.Provenance;
import com.gdiff.maven.graph.LabelPath;

/**
 * Markdown summary of a diff run: for every diff or union output, which label paths are shared and
 * which belong to one input only.
 */
public class DiffReport {

    public static final String TEMPLATE = "report.md.mustache";

    private final TemplateEngine templateEngine;

    public DiffReport(TemplateEngine templateEngine) {
        this.templateEngine = templateEngine;
    }

    public String render(String sourceName, String otherName, DiffRun run) throws IOException {
        return templateEngine.render(TEMPLATE, context(sourceName, otherName, run));
    }

    public void write(String sourceName, String otherName, DiffRun run, Path target) throws IOException {
        templateEngine.renderTo(TEMPLATE, context(sourceName, otherName, run), target);
    }

    static Map<String, Object> context(String sourceName, String otherName, DiffRun run) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("source", sourceName);
        context.put("other", otherName);
        context.put("mode", run.getMode().key());
        context.put("files", new ArrayList<>(run.getOutputs().keySet()));

        List<Map<String, Object>> results = new ArrayList<>();
        run.getResults().forEach((name, result) -> results.add(resultContext(name, result)));
        context.put("results", results);

        context.put("warnings", run.getWarnings());
        context.put("hasWarnings", !run.getWarnings().isEmpty());
        return context;
    }

    private static Map<String, Object> resultContext(String name, DiffResult result) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("name", name);
        List<Map<String, Object>> sections = new ArrayList<>();
        for (Provenance provenance : Provenance.values()) {
            List<LabelPath> paths = result.pathsWith(provenance);
            if (paths.isEmpty()) {
                continue;
            }
            Map<String, Object> section = new LinkedHashMap<>();
            section.put("provenance", provenance.toString());
            section.put("count", paths.size());
            List<String> labels = new ArrayList<>();
            for (LabelPath path : paths) {
                labels.add(path.toString());
            }
            section.put("paths", labels);
            sections.add(section);
        }
        entry.put("sections", sections);
        entry.put("nodeCount", result.getProvenance().size());
        return entry;
    }
}
