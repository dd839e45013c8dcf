package com.protogen.generator.codegen;

import java.io.IOException;
import java.util.Map;

/**
 * Turns a template object into text.
 */
public interface TemplateRenderer {

    String render(String templateName, Map<String, Object> templateObject) throws IOException;
}
