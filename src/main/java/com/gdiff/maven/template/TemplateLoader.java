package com.gdiff.maven.template;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.apache.maven.plugin.logging.Log;

/**
 * Loads report templates, preferring a user template directory over the bundled ones.
 */
public class TemplateLoader {

    static final String CLASSPATH_DIR = "/gdiff/templates/";

    private final Path userTemplateDir;
    private final Log log;

    public TemplateLoader(Path userTemplateDir, Log log) {
        this.userTemplateDir = userTemplateDir;
        this.log = log;
    }

    /**
     * Loads a template from the user directory if it has one with this name, else from the classpath.
     *
     * @param templatePath relative path to template (e.g., "report.md.mustache")
     * @return template content
     * @throws IOException if template cannot be found
     */
    public String loadTemplate(String templatePath) throws IOException {
        if (userTemplateDir != null) {
            Path userTemplate = userTemplateDir.resolve(templatePath);
            if (Files.exists(userTemplate)) {
                log.debug("GDiff: Using user template: " + userTemplate);
                return Files.readString(userTemplate);
            }
        }

        String resourcePath = CLASSPATH_DIR + templatePath;
        try (InputStream inputStream = TemplateLoader.class.getResourceAsStream(resourcePath)) {
            if (inputStream != null) {
                log.debug("GDiff: Using bundled template: " + resourcePath);
                return new String(inputStream.readAllBytes(), StandardCharsets.UTF_8);
            }
        }

        throw new IOException("Template not found: " + templatePath
                + " (checked user: " + userTemplateDir + ", classpath: " + resourcePath + ")");
    }
}
