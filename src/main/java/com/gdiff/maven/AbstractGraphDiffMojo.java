package com.gdiff.maven;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;

import org.apache.maven.plugin.AbstractMojo;
import org.apache.maven.plugin.MojoExecutionException;
import org.apache.maven.plugins.annotations.Parameter;

import com.gdiff.maven.config.DiffConfig;
import com.gdiff.maven.config.DiffConfigLoader;
import com.gdiff.maven.graph.GraphDocument;
import com.gdiff.maven.graphml.GraphMlReader;

/**
 * Parameters and helpers shared by the gdiff goals: output directory, configuration file and font
 * enlargement.
 */
public abstract class AbstractGraphDiffMojo extends AbstractMojo {

    @Parameter(defaultValue = "${project.basedir}", readonly = true)
    protected File basedir;

    @Parameter(property = "gdiff.outputDir", defaultValue = "${project.build.directory}/gdiff")
    protected File outputDir;

    @Parameter(property = "gdiff.configFile")
    protected File configFile;

    @Parameter(property = "gdiff.fontSizeDelta")
    protected Integer fontSizeDelta;

    @Parameter(property = "gdiff.skip", defaultValue = "false")
    protected boolean skip;

    /**
     * Bundled defaults, overlaid by {@code configFile} when one is set, then by the goal's own parameters.
     */
    protected DiffConfig loadConfig() throws IOException {
        DiffConfig config;
        if (configFile != null) {
            getLog().debug("GDiff: Loading configuration from " + configFile);
            config = DiffConfigLoader.load(configFile.toPath());
        } else {
            getLog().debug("GDiff: Using bundled configuration " + DiffConfigLoader.DEFAULT_RESOURCE);
            config = DiffConfigLoader.loadDefaults();
        }
        if (fontSizeDelta != null) {
            config.setFontSizeDelta(fontSizeDelta);
        }
        return config;
    }

    protected Path resolveInput(File input, String parameter) throws MojoExecutionException {
        if (input == null) {
            throw new MojoExecutionException("GDiff: Parameter '" + parameter + "' is required");
        }
        File file = input;
        if (!file.isAbsolute() && basedir != null) {
            file = new File(basedir, input.getPath());
        }
        if (!file.isFile()) {
            throw new MojoExecutionException("GDiff: Input file does not exist: " + file);
        }
        return file.toPath();
    }

    protected GraphDocument read(GraphMlReader reader, Path input) throws IOException {
        getLog().debug("GDiff: Reading " + input);
        return reader.read(input);
    }
}
