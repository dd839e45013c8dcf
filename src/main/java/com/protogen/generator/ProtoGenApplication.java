package com.protogen.generator;

import com.protogen.generator.cli.GenerateCommand;
import picocli.CommandLine;

/**
 * Main entry point for the Proto Template Generator.
 * This CLI tool parses .proto schemas, resolves their types across imports and renders them
 * through FreeMarker templates.
 */
public class ProtoGenApplication {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new GenerateCommand()).execute(args);
        System.exit(exitCode);
    }
}
