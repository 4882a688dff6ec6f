package com.gdiff.maven.template;

import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.HashMap;
import java.util.Map;

import com.github.mustachejava.DefaultMustacheFactory;
import com.github.mustachejava.Mustache;
import com.github.mustachejava.MustacheFactory;

/**
 * Mustache engine for Markdown reports.
 * <p>
 * Values are written verbatim: label paths may contain characters such as {@code <} or {@code &}
 * that HTML escaping would turn into entities. Compiled templates are kept per name.
 */
public class MustacheTemplateEngine implements TemplateEngine {
    private final TemplateLoader templateLoader;
    private final MustacheFactory mustacheFactory;
    private final Map<String, Mustache> compiled = new HashMap<>();

    public MustacheTemplateEngine(TemplateLoader templateLoader) {
        this.templateLoader = templateLoader;
        this.mustacheFactory = new DefaultMustacheFactory() {
            @Override
            public void encode(String value, Writer writer) {
                try {
                    writer.write(value);
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
            }
        };
    }

    @Override
    public String render(String templateName, Map<String, Object> context) throws IOException {
        Mustache mustache = compiled.get(templateName);
        if (mustache == null) {
            String templateContent = templateLoader.loadTemplate(templateName);
            mustache = mustacheFactory.compile(new StringReader(templateContent), templateName);
            compiled.put(templateName, mustache);
        }
        StringWriter writer = new StringWriter();
        mustache.execute(writer, context).flush();
        return writer.toString();
    }
}
