package com.protogen.generator.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.protogen.generator.cli.exception.OptionsValidationException;
import com.protogen.generator.cli.model.GenerateOptions;
import com.protogen.generator.cli.model.ValidatedGenerateOptions;

public class GenerateOptionsValidator {

    public ValidatedGenerateOptions validate(GenerateOptions o) {
        List<String> errors = new ArrayList<>();

        Path basePath = (o.getBaseDir() == null ? Path.of(".") : o.getBaseDir()).toAbsolutePath().normalize();
        if (!existsDirectory(basePath)) {
            errors.add("Base directory does not exist or is not a directory: " + basePath);
        }

        if (o.getProtoFiles() == null || o.getProtoFiles().isEmpty()) {
            errors.add("At least one proto file is required (--proto / -p).");
        } else {
            for (String protoFile : o.getProtoFiles()) {
                if (isBlank(protoFile)) {
                    errors.add("Proto file name must not be blank.");
                }
            }
        }

        if (isBlank(o.getTemplateName())) {
            errors.add("Template is required (--template / -t).");
        }

        if (isBlank(o.getSuffix())) {
            errors.add("Suffix must not be blank (--suffix / -s).");
        }

        // Relative roots resolve against the base directory, like every other path
        List<Path> protoPaths = new ArrayList<>();
        for (Path p : o.getProtoPaths()) {
            Path resolved = basePath.resolve(p).normalize();
            if (!existsDirectory(resolved)) {
                errors.add("Proto path does not exist or is not a directory: " + resolved);
            }
            protoPaths.add(resolved);
        }

        Path templateDir = o.getTemplateDir() == null ? basePath : basePath.resolve(o.getTemplateDir()).normalize();
        if (!existsDirectory(templateDir)) {
            errors.add("Template directory does not exist or is not a directory: " + templateDir);
        } else if (!isBlank(o.getTemplateName()) && !Files.isRegularFile(templateDir.resolve(o.getTemplateName()))) {
            errors.add("Template does not exist: " + templateDir.resolve(o.getTemplateName()));
        }

        Path outDir = basePath.resolve(o.getOutDir() == null ? Path.of("genfiles") : o.getOutDir()).normalize();
        if (Files.exists(outDir) && !Files.isDirectory(outDir)) {
            errors.add("Output path exists and is not a directory: " + outDir);
        }

        if (!errors.isEmpty()) {
            throw new OptionsValidationException(errors);
        }

        return new ValidatedGenerateOptions(basePath, List.copyOf(protoPaths), templateDir, outDir);
    }

    private static boolean existsDirectory(Path p) {
        return p != null && Files.exists(p) && Files.isDirectory(p);
    }

    private static boolean isBlank(String s) {
        return s == null || s.trim().isEmpty();
    }
}
