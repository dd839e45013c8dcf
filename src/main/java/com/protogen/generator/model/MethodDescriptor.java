package com.protogen.generator.model;

import lombok.Builder;
import lombok.Getter;

/**
 * An RPC declaration: {@code rpc Name (Input) returns (Output)}.
 */
@Getter
public class MethodDescriptor extends Descriptor {
    private TypeReference inputType;
    private TypeReference outputType;
    private final boolean clientStreaming;
    private final boolean serverStreaming;

    @Builder
    public MethodDescriptor(String name, String rawInputType, String rawOutputType,
                            boolean clientStreaming, boolean serverStreaming,
                            String sourceFile, int sourceLine) {
        super(name, sourceFile, sourceLine);
        this.inputType = TypeReference.of(rawInputType);
        this.outputType = TypeReference.of(rawOutputType);
        this.clientStreaming = clientStreaming;
        this.serverStreaming = serverStreaming;
    }

    public String getRawInputType() {
        return inputType.getRawType();
    }

    public String getRawOutputType() {
        return outputType.getRawType();
    }

    public boolean isNativeInputType() {
        return inputType.isNative();
    }

    public boolean isNativeOutputType() {
        return outputType.isNative();
    }

    public TypeDescriptor getInputTypeDescriptor() {
        return inputType.getTarget();
    }

    public TypeDescriptor getOutputTypeDescriptor() {
        return outputType.getTarget();
    }

    /**
     * Binds the non-native sides of this method. A {@code null} argument leaves that side untouched.
     */
    public void setTypeDescriptors(TypeDescriptor input, TypeDescriptor output) {
        if (input != null) {
            inputType = inputType.bind(input);
        }
        if (output != null) {
            outputType = outputType.bind(output);
        }
    }

    @Override
    public String toString() {
        return "MethodDescriptor(" + name + "(" + getRawInputType() + ") returns (" + getRawOutputType() + "))";
    }
}
