package com.protogen.generator.cli;

import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.protogen.generator.cli.exception.OptionsValidationException;
import com.protogen.generator.cli.model.GenerateOptions;
import com.protogen.generator.cli.model.ValidatedGenerateOptions;
import com.protogen.generator.cli.output.GenerateResultsPrinter;
import com.protogen.generator.cli.validation.GenerateOptionsValidator;
import com.protogen.generator.codegen.GeneratorResult;
import com.protogen.generator.codegen.ProtoTemplateGenerator;
import com.protogen.generator.codegen.model.GeneratorConfig;

import ch.qos.logback.classic.Level;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * CLI command for rendering proto files through a template.
 */
@Command(
        name = "generate",
        mixinStandardHelpOptions = true,
        version = "proto-template-gen 1.0.0",
        description = "Parses .proto files with their imports, resolves all types and renders each file through a FreeMarker template."
)
public class GenerateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(GenerateCommand.class);

    @Mixin
    private GenerateOptions options;

    private final GenerateOptionsValidator validator = new GenerateOptionsValidator();
    private final GenerateResultsPrinter printer = new GenerateResultsPrinter();

    @Override
    public Integer call() {
        if (options.isVerbose()) {
            enableDebugLogging();
        }

        ValidatedGenerateOptions validated;
        try {
            validated = validator.validate(options);
        } catch (OptionsValidationException e) {
            e.getErrors().forEach(log::error);
            return 1;
        }

        printer.printBanner(options, validated);

        GeneratorConfig config = GeneratorConfig.builder()
                .basePath(validated.getBasePath())
                .protoFiles(options.getProtoFiles())
                .templateName(options.getTemplateName())
                .suffix(options.getSuffix())
                .protoPaths(validated.getProtoPaths())
                .templateDir(validated.getTemplateDir())
                .outDir(validated.getOutDir())
                .build();

        GeneratorResult result = new ProtoTemplateGenerator(config).generate();
        if (!result.isSuccess()) {
            printer.printFailure(result);
            return 1;
        }

        printer.printSuccess(validated, result);
        return 0;
    }

    private static void enableDebugLogging() {
        ch.qos.logback.classic.Logger appLogger =
                (ch.qos.logback.classic.Logger) LoggerFactory.getLogger("com.protogen.generator");
        appLogger.setLevel(Level.DEBUG);
    }
}
