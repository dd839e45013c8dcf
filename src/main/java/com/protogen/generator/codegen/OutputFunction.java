package com.protogen.generator.codegen;

import java.io.IOException;
import java.nio.file.Path;

import com.protogen.generator.codegen.util.FileWriteUtil;
import com.protogen.generator.model.ProtoDescriptor;

/**
 * Receives every rendered file. The default writes it to disk.
 */
@FunctionalInterface
public interface OutputFunction {

    OutputFunction WRITE_FILE = (proto, outputPath, contents) -> FileWriteUtil.safeWriteString(outputPath, contents);

    void write(ProtoDescriptor proto, Path outputPath, String contents) throws IOException;
}
