package com.protogen.generator.codegen.model;

import java.util.ArrayList;
import java.util.List;

import lombok.Getter;

/**
 * Diagnostics (errors/warnings/info) accumulated during a compilation session.
 *
 * Pure structure only: no logging, no formatting, no IO.
 */
@Getter
public class ToolDiagnostics {
    private final List<String> errors = new ArrayList<>();
    private final List<String> warnings = new ArrayList<>();
    private final List<String> infos = new ArrayList<>();

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
