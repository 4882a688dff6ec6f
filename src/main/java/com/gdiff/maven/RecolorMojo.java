package com.gdiff.maven;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;

import org.apache.maven.plugin.MojoExecutionException;
import org.apache.maven.plugin.MojoFailureException;
import org.apache.maven.plugins.annotations.Mojo;
import org.apache.maven.plugins.annotations.Parameter;

import com.gdiff.maven.config.DiffConfig;
import com.gdiff.maven.diff.GraphDiffJob;
import com.gdiff.maven.diff.Provenance;
import com.gdiff.maven.graph.GraphDiffException;
import com.gdiff.maven.graph.GraphDocument;
import com.gdiff.maven.graphml.GraphMlReader;
import com.gdiff.maven.graphml.GraphMlWriter;

/**
 * Writes a flat recolored copy of one contact map, painted by node class with a single palette slot.
 * <p>
 * Run manually: {@code mvn gdiff:recolor -Dgdiff.input=a.graphml}
 */
@Mojo(name = "recolor", requiresProject = false, threadSafe = true)
public class RecolorMojo extends AbstractGraphDiffMojo {

    @Parameter(property = "gdiff.input", required = true)
    private File input;

    /** Palette slot to paint with: sourceOnly or otherOnly. */
    @Parameter(property = "gdiff.slot", defaultValue = "sourceOnly")
    private String slot;

    @Override
    public void execute() throws MojoExecutionException, MojoFailureException {
        if (skip) {
            getLog().info("GDiff: Skipping recolor");
            return;
        }
        Path source = resolveInput(input, "input");

        try {
            Provenance provenance = Provenance.fromKey(slot);
            if (provenance == Provenance.INTERSECT) {
                throw new MojoFailureException("GDiff: Reference copies use the sourceOnly or otherOnly slot, not "
                        + slot);
            }
            DiffConfig config = loadConfig();
            GraphDiffJob job = config.createJob();
            GraphDocument document = read(new GraphMlReader(config.getClassifier()), source);
            GraphDocument recolored = job.resize(job.referenceCopy(document, provenance));

            String name = GraphDiffJob.baseName(source.getFileName().toString()) + "_recolored"
                    + GraphDiffJob.EXTENSION;
            Path target = outputDir.toPath().resolve(name);
            new GraphMlWriter().write(recolored, target);
            getLog().info("GDiff: Wrote " + target);
        } catch (GraphDiffException | IllegalArgumentException e) {
            throw new MojoFailureException("GDiff: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new MojoExecutionException("Failed to recolor " + source, e);
        }
    }
}
