package com.gdiff.maven;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import org.apache.maven.plugin.MojoExecutionException;
import org.apache.maven.plugin.MojoFailureException;
import org.apache.maven.plugins.annotations.Mojo;
import org.apache.maven.plugins.annotations.Parameter;

import com.gdiff.maven.config.DiffConfig;
import com.gdiff.maven.diff.DiffMode;
import com.gdiff.maven.diff.DiffResult;
import com.gdiff.maven.diff.DiffRun;
import com.gdiff.maven.diff.DuplicateLabelPolicy;
import com.gdiff.maven.diff.GraphDiffJob;
import com.gdiff.maven.diff.Provenance;
import com.gdiff.maven.graph.GraphDiffException;
import com.gdiff.maven.graph.GraphDocument;
import com.gdiff.maven.graphml.GraphMlReader;
import com.gdiff.maven.graphml.GraphMlWriter;
import com.gdiff.maven.template.DiffReport;
import com.gdiff.maven.template.MustacheTemplateEngine;
import com.gdiff.maven.template.TemplateLoader;

/**
 * Compares two GraphML contact maps and writes the provenance-colored results.
 * <p>
 * In matrix mode four files are written: both diffs and a recolored copy of each input. In union
 * mode a single merged file is written. Nothing is written when either input can't be processed.
 * <p>
 * Run manually: {@code mvn gdiff:diff -Dgdiff.input1=a.graphml -Dgdiff.input2=b.graphml}
 */
@Mojo(name = "diff", requiresProject = false, threadSafe = true)
public class GraphDiffMojo extends AbstractGraphDiffMojo {

    @Parameter(property = "gdiff.input1", required = true)
    private File input1;

    @Parameter(property = "gdiff.input2", required = true)
    private File input2;

    /** File name of the forward diff, matrix mode only. */
    @Parameter(property = "gdiff.output")
    private String output;

    /** File name of the reverse diff, matrix mode only. */
    @Parameter(property = "gdiff.output2")
    private String output2;

    @Parameter(property = "gdiff.mode")
    private String mode;

    @Parameter(property = "gdiff.duplicateLabels")
    private String duplicateLabels;

    @Parameter(property = "gdiff.reportFile")
    private File reportFile;

    @Parameter(property = "gdiff.templateDir")
    private File templateDir;

    @Override
    public void execute() throws MojoExecutionException, MojoFailureException {
        if (skip) {
            getLog().info("GDiff: Skipping diff");
            return;
        }
        Path source = resolveInput(input1, "input1");
        Path other = resolveInput(input2, "input2");

        try {
            DiffConfig config = loadConfig();
            if (mode != null && !mode.isBlank()) {
                config.setMode(DiffMode.parse(mode));
            }
            if (duplicateLabels != null && !duplicateLabels.isBlank()) {
                config.setDuplicateLabels(DuplicateLabelPolicy.parse(duplicateLabels));
            }

            getLog().info("GDiff: Comparing " + source.getFileName() + " with " + other.getFileName()
                    + " (" + config.getMode().key() + " mode)");

            GraphMlReader reader = new GraphMlReader(config.getClassifier());
            GraphDocument sourceDocument = read(reader, source);
            GraphDocument otherDocument = read(reader, other);

            GraphDiffJob job = config.createJob().withOutputNames(output, output2);
            DiffRun run = job.run(source.getFileName().toString(), sourceDocument,
                    other.getFileName().toString(), otherDocument);

            for (String warning : run.getWarnings()) {
                getLog().warn("GDiff: " + warning);
            }
            writeOutputs(run);
            logSummary(run);

            if (reportFile != null) {
                writeReport(source, other, run);
            }
        } catch (GraphDiffException | IllegalArgumentException e) {
            throw new MojoFailureException("GDiff: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new MojoExecutionException("Failed to diff " + source + " and " + other, e);
        }
    }

    private void writeOutputs(DiffRun run) throws IOException {
        GraphMlWriter writer = new GraphMlWriter();
        // validate everything first so a bad document leaves no partial output behind
        for (GraphDocument document : run.getOutputs().values()) {
            GraphMlWriter.validateEdges(document);
        }
        Path outDir = outputDir.toPath();
        Files.createDirectories(outDir);
        for (Map.Entry<String, GraphDocument> entry : run.getOutputs().entrySet()) {
            Path target = outDir.resolve(entry.getKey());
            writer.write(entry.getValue(), target);
            getLog().info("GDiff: Wrote " + target);
        }
    }

    private void logSummary(DiffRun run) {
        for (Map.Entry<String, DiffResult> entry : run.getResults().entrySet()) {
            DiffResult result = entry.getValue();
            getLog().info(String.format("GDiff: %s: %d shared, %d source-only, %d other-only",
                    entry.getKey(),
                    result.count(Provenance.INTERSECT),
                    result.count(Provenance.SOURCE_ONLY),
                    result.count(Provenance.OTHER_ONLY)));
        }
    }

    private void writeReport(Path source, Path other, DiffRun run) throws IOException {
        Path userTemplates = templateDir != null ? templateDir.toPath() : null;
        DiffReport report = new DiffReport(new MustacheTemplateEngine(new TemplateLoader(userTemplates, getLog())));
        report.write(source.getFileName().toString(), other.getFileName().toString(), run, reportFile.toPath());
        getLog().info("GDiff: Wrote report " + reportFile);
    }
}
