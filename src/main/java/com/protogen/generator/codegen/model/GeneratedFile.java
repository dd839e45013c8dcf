package com.protogen.generator.codegen.model;

import java.nio.file.Path;

import com.protogen.generator.model.ProtoDescriptor;

import lombok.Value;

@Value
public class GeneratedFile {
    ProtoDescriptor proto;
    Path outputPath;
    String contents;
}
