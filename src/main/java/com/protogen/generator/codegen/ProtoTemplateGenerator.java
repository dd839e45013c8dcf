package com.protogen.generator.codegen;

import java.nio.file.Path;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.protogen.generator.codegen.model.GeneratedFile;
import com.protogen.generator.codegen.model.GeneratorConfig;
import com.protogen.generator.exception.SchemaException;

/**
 * Runs one generator configuration end to end: load, resolve, merge, render, write.
 */
public class ProtoTemplateGenerator {
    private static final Logger log = LoggerFactory.getLogger(ProtoTemplateGenerator.class);

    private final GeneratorConfig config;

    public ProtoTemplateGenerator(GeneratorConfig config) {
        this.config = config;
    }

    public GeneratorResult generate() {
        try {
            log.info("Starting generation...");
            Project project = createProject();

            log.info("Step 1: Loading and resolving proto files...");
            for (String protoFile : config.getProtoFiles()) {
                project.addJob(protoFile, config.getTemplateName(), config.getSuffix());
            }

            log.info("Step 2: Rendering {} jobs...", project.getJobs().size());
            List<GeneratedFile> generated = project.compile();

            log.info("Generation complete!");

            return GeneratorResult.builder()
                    .success(true)
                    .protosLoaded(project.getProtos().size())
                    .typesIndexed(countTypes(project))
                    .filesGenerated(generated.size())
                    .outputPaths(generated.stream().map(GeneratedFile::getOutputPath).toList())
                    .infos(List.copyOf(project.getDiagnostics().getInfos()))
                    .build();

        } catch (SchemaException e) {
            log.error("Generation failed: {}", e.getMessage());
            return GeneratorResult.failure(e.getMessage());
        } catch (Exception e) {
            log.error("Generation failed", e);
            return GeneratorResult.failure(e.getMessage());
        }
    }

    private Project createProject() {
        Path basePath = config.getBasePath() != null ? config.getBasePath() : Path.of(".");
        Project project = new Project(basePath);

        if (config.getProtoPaths() != null && !config.getProtoPaths().isEmpty()) {
            project.setProtoPaths(config.getProtoPaths());
        }
        if (config.getTemplateDir() != null) {
            project.setTemplateDir(config.getTemplateDir());
        }
        if (config.getOutDir() != null) {
            project.setOutDir(config.getOutDir());
        }
        return project;
    }

    private static int countTypes(Project project) {
        return project.getProtos().stream()
                .mapToInt(proto -> proto.getMessages().size() + proto.getEnums().size())
                .sum();
    }
}
