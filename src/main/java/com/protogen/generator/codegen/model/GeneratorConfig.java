package com.protogen.generator.codegen.model;

import java.nio.file.Path;
import java.util.List;

import lombok.Builder;
import lombok.Data;
import lombok.Singular;

/**
 * Configuration for one generator run.
 *
 * Relative paths are resolved against {@code basePath}.
 */
@Data
@Builder
public class GeneratorConfig {

    /**
     * Root the schema files and output paths are relative to.
     */
    private Path basePath;

    /**
     * Schema files to compile, as import-style names relative to a search root.
     */
    @Singular
    private List<String> protoFiles;

    /**
     * Template file name, looked up in {@link #templateDir}.
     */
    private String templateName;

    /**
     * Appended to each output path; also selects java_outer_classname / ios_classname routing.
     */
    private String suffix;

    /**
     * Import search roots. Empty means the base path only.
     */
    @Singular
    private List<Path> protoPaths;

    private Path templateDir;

    private Path outDir;
}
