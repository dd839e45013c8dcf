package com.protogen.generator.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.protogen.generator.serialization.TemplateObjectSerializer;

import lombok.Getter;

/**
 * Base class for all schema descriptor nodes.
 */
@Getter
public abstract class Descriptor {
    protected String name;
    protected String sourceFile;
    protected int sourceLine;
    private final Map<String, Object> options = new LinkedHashMap<>();

    protected Descriptor(String name, String sourceFile, int sourceLine) {
        this.name = name;
        this.sourceFile = sourceFile;
        this.sourceLine = sourceLine;
    }

    public Map<String, Object> getOptions() {
        return Collections.unmodifiableMap(options);
    }

    public Object getOption(String key) {
        return options.get(key);
    }

    public void setOption(String key, Object value) {
        options.put(key, value);
    }

    /**
     * Generic nested map/list view of this node, with every type reference inlined.
     */
    public Map<String, Object> toTemplateObject() {
        return new TemplateObjectSerializer().serialize(this);
    }
}
