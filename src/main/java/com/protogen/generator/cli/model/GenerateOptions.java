package com.protogen.generator.cli.model;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import lombok.Getter;
import picocli.CommandLine.Option;

/**
 * Holds all CLI options for the "generate" command. No validation, no execution
 * logic, no printing.
 */
@Getter
public class GenerateOptions {

    @Option(names = { "--base-dir" }, description = "Directory proto, template and output paths are relative to (defaults to current directory)")
    private Path baseDir;

    @Option(names = { "--proto", "-p" }, required = true, description = "Proto file to compile, relative to a proto path (repeatable)")
    private List<String> protoFiles = new ArrayList<>();

    @Option(names = { "--template", "-t" }, required = true, description = "FreeMarker template file name inside the template directory")
    private String templateName;

    @Option(names = { "--suffix", "-s" }, defaultValue = ".txt", description = "Suffix appended to each output file (default: .txt)")
    private String suffix;

    @Option(names = { "--proto-path", "-I" }, description = "Directory searched for imports, in order (repeatable; defaults to the base directory)")
    private List<Path> protoPaths = new ArrayList<>();

    @Option(names = { "--template-dir" }, description = "Directory containing templates (defaults to the base directory)")
    private Path templateDir;

    @Option(names = { "--out-dir", "-o" }, defaultValue = "genfiles", description = "Output directory (default: genfiles)")
    private Path outDir;

    @Option(names = { "--verbose", "-v" }, description = "Log type bindings and extension merges")
    private boolean verbose;

    // ---- Getters (no setters needed; picocli sets fields reflectively) ----

}
