package com.gdiff.maven.template;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Renders the plain-text reports of a diff run from named templates.
 */
public interface TemplateEngine {

    /**
     * @param templateName name of the template, resolved by the engine's loader
     * @param context      values the template refers to; lists drive sections
     * @throws IOException if the template can't be found or rendered
     */
    String render(String templateName, Map<String, Object> context) throws IOException;

    /**
     * Renders into {@code target}, creating missing parent directories.
     */
    default void renderTo(String templateName, Map<String, Object> context, Path target) throws IOException {
        String content = render(templateName, context);
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(target, content);
    }
}
