package com.protogen.generator.codegen.model;

import com.protogen.generator.model.ProtoDescriptor;

import lombok.Value;

/**
 * One file rendered through one template into one output file.
 */
@Value
public class CompileJob {
    ProtoDescriptor proto;
    String templateName;
    String suffix;
}
