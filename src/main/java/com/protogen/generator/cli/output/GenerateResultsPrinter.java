package com.protogen.generator.cli.output;

import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.protogen.generator.cli.model.GenerateOptions;
import com.protogen.generator.cli.model.ValidatedGenerateOptions;
import com.protogen.generator.codegen.GeneratorResult;

/**
 * Responsible only for printing CLI output for the "generate" command.
 * No validation, no execution.
 */
public class GenerateResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(GenerateResultsPrinter.class);

    public void printBanner(GenerateOptions o, ValidatedGenerateOptions v) {
        log.info("=================================================");
        log.info("Proto Template Generator");
        log.info("=================================================");
        log.info("Base Directory: {}", v.getBasePath());
        log.info("Proto Files: {}", String.join(", ", o.getProtoFiles()));
        log.info("Proto Paths: {}", v.getProtoPaths().isEmpty() ? v.getBasePath() : v.getProtoPaths());
        log.info("Template: {}", v.getTemplateDir().resolve(o.getTemplateName()));
        log.info("Suffix: {}", o.getSuffix());
        log.info("Output Directory: {}", v.getOutDir());
        log.info("=================================================");
    }

    public void printSuccess(ValidatedGenerateOptions v, GeneratorResult result) {
        log.info("");
        log.info("=================================================");
        log.info("GENERATION SUCCESSFUL");
        log.info("=================================================");
        log.info("Proto Files Loaded: {}", result.getProtosLoaded());
        log.info("Top-level Types: {}", result.getTypesIndexed());
        log.info("Files Generated: {}", result.getFilesGenerated());
        for (Path outputPath : result.getOutputPaths()) {
            log.info("  {}", v.getOutDir().relativize(outputPath));
        }

        if (!result.getInfos().isEmpty()) {
            log.info("");
            log.info("Notes:");
            for (String info : result.getInfos()) {
                log.info("  {}", info);
            }
        }
        log.info("=================================================");
    }

    public void printFailure(GeneratorResult result) {
        log.error("Generation failed: {}", result.getErrorMessage());
    }
}
