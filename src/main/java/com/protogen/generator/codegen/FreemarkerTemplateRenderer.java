package com.protogen.generator.codegen;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.file.Path;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import freemarker.template.Configuration;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateExceptionHandler;

/**
 * Renders templates from a directory with FreeMarker. The template object is the data model,
 * so a file template sees {@code name}, {@code messages}, {@code services} and so on at top level.
 */
public class FreemarkerTemplateRenderer implements TemplateRenderer {
    private static final Logger log = LoggerFactory.getLogger(FreemarkerTemplateRenderer.class);

    private final Configuration freemarkerConfig;

    public FreemarkerTemplateRenderer(Path templateDir) throws IOException {
        this.freemarkerConfig = createFreemarkerConfig(templateDir);
    }

    private Configuration createFreemarkerConfig(Path templateDir) throws IOException {
        Configuration cfg = new Configuration(Configuration.VERSION_2_3_32);
        cfg.setDirectoryForTemplateLoading(templateDir.toFile());
        cfg.setDefaultEncoding("UTF-8");
        cfg.setTemplateExceptionHandler(TemplateExceptionHandler.RETHROW_HANDLER);
        cfg.setLogTemplateExceptions(false);
        cfg.setWrapUncheckedExceptions(true);
        return cfg;
    }

    @Override
    public String render(String templateName, Map<String, Object> templateObject) throws IOException {
        Template template = freemarkerConfig.getTemplate(templateName);
        StringWriter out = new StringWriter();
        try {
            template.process(templateObject, out);
        } catch (TemplateException e) {
            throw new IOException("Failed to render template " + templateName + ": " + e.getMessage(), e);
        }
        log.debug("Rendered {} ({} chars)", templateName, out.getBuffer().length());
        return out.toString();
    }
}
