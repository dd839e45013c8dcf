package com.protogen.generator.codegen;

import java.nio.file.Path;
import java.util.List;

import lombok.Builder;
import lombok.Data;

/**
 * Result of a generator run.
 */
@Data
@Builder
public class GeneratorResult {
    private boolean success;
    private String errorMessage;

    private int protosLoaded;
    private int typesIndexed;
    private int filesGenerated;
    private List<Path> outputPaths;
    private List<String> infos;

    public static GeneratorResult failure(String errorMessage) {
        return GeneratorResult.builder()
                .success(false)
                .errorMessage(errorMessage)
                .outputPaths(List.of())
                .infos(List.of())
                .build();
    }
}
