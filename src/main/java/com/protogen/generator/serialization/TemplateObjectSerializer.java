package com.protogen.generator.serialization;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

import com.protogen.generator.codegen.util.NamingUtil;
import com.protogen.generator.model.Descriptor;
import com.protogen.generator.model.EnumDescriptor;
import com.protogen.generator.model.EnumValueDescriptor;
import com.protogen.generator.model.ExtendDescriptor;
import com.protogen.generator.model.FieldDescriptor;
import com.protogen.generator.model.MessageDescriptor;
import com.protogen.generator.model.MethodDescriptor;
import com.protogen.generator.model.ProtoDescriptor;
import com.protogen.generator.model.ServiceDescriptor;
import com.protogen.generator.model.TypeDescriptor;

/**
 * Converts a resolved descriptor tree into nested maps and lists for template engines.
 *
 * Every referenced message or enum is inlined under {@code typeDescriptor},
 * {@code inputTypeDescriptor} or {@code outputTypeDescriptor}. A message that is already being
 * serialized higher up the same path is emitted as a stub with {@code isRecursiveReference=true},
 * which is what keeps cyclic type graphs finite. A message rendered once is reused for every
 * later reference in the same run, so shared references cost one rendering each.
 *
 * Keys whose value would be {@code null} are left out.
 * Not thread-safe; create one instance per serialization.
 */
public class TemplateObjectSerializer {

    /** Full names of the messages on the current serialization path. */
    private final Set<String> ancestors = new HashSet<>();

    /** Completed message views by full name. */
    private final Map<String, Map<String, Object>> rendered = new HashMap<>();

    /**
     * @throws IllegalStateException if a reachable field or method type is still unresolved
     * @throws IllegalArgumentException for descriptor kinds that have no template view
     */
    public Map<String, Object> serialize(Descriptor descriptor) {
        if (descriptor instanceof ProtoDescriptor proto) {
            return serializeProto(proto);
        } else if (descriptor instanceof MessageDescriptor message) {
            return serializeMessage(message);
        } else if (descriptor instanceof EnumDescriptor enumDescriptor) {
            return serializeEnum(enumDescriptor);
        } else if (descriptor instanceof FieldDescriptor field) {
            return serializeField(field);
        } else if (descriptor instanceof ServiceDescriptor service) {
            return serializeService(service);
        } else if (descriptor instanceof MethodDescriptor method) {
            return serializeMethod(method);
        } else if (descriptor instanceof EnumValueDescriptor value) {
            return serializeEnumValue(value);
        } else if (descriptor instanceof ExtendDescriptor extend) {
            return serializeExtend(extend);
        }
        throw new IllegalArgumentException("No template view for " + descriptor.getClass().getSimpleName());
    }

    private Map<String, Object> serializeProto(ProtoDescriptor proto) {
        Map<String, Object> object = new LinkedHashMap<>();
        object.put("name", proto.getName());
        object.put("filePath", proto.getFilePath());
        object.put("package", proto.getPackageName());
        putIfPresent(object, "syntax", proto.getSyntax());
        object.put("options", options(proto));

        List<Object> imports = new ArrayList<>();
        for (ProtoDescriptor imported : proto.getImports()) {
            Map<String, Object> importObject = new LinkedHashMap<>();
            importObject.put("name", imported.getName());
            importObject.put("filePath", imported.getFilePath());
            importObject.put("package", imported.getPackageName());
            imports.add(importObject);
        }
        object.put("imports", imports);

        object.put("messages", list(proto.getMessages(), this::serializeMessage));
        object.put("enums", list(proto.getEnums(), this::serializeEnum));
        object.put("services", list(proto.getServices(), this::serializeService));
        return object;
    }

    private Map<String, Object> serializeMessage(MessageDescriptor message) {
        String fullName = message.getFullName();
        Map<String, Object> cached = rendered.get(fullName);
        if (cached != null) {
            return cached;
        }
        if (ancestors.contains(fullName)) {
            return recursiveReference(message);
        }

        ancestors.add(fullName);
        try {
            Map<String, Object> object = new LinkedHashMap<>();
            object.put("name", message.getName());
            object.put("fullName", fullName);
            putIfPresent(object, "package", message.getPackageName());
            object.put("camelName", NamingUtil.toCamelCase(message.getName()));
            object.put("titleName", NamingUtil.toTitleCase(message.getName()));
            object.put("isMessage", true);
            object.put("fields", list(message.getFields(), this::serializeField));
            object.put("messages", list(message.getMessages(), this::serializeMessage));
            object.put("enums", list(message.getEnums(), this::serializeEnum));
            object.put("oneofs", new ArrayList<>(message.getOneofs()));
            object.put("options", options(message));
            rendered.put(fullName, object);
            return object;
        } finally {
            ancestors.remove(fullName);
        }
    }

    private Map<String, Object> recursiveReference(MessageDescriptor message) {
        Map<String, Object> stub = new LinkedHashMap<>();
        stub.put("name", message.getName());
        stub.put("fullName", message.getFullName());
        putIfPresent(stub, "package", message.getPackageName());
        stub.put("isMessage", true);
        stub.put("isRecursiveReference", true);
        return stub;
    }

    private Map<String, Object> serializeEnum(EnumDescriptor enumDescriptor) {
        Map<String, Object> object = new LinkedHashMap<>();
        object.put("name", enumDescriptor.getName());
        object.put("values", list(enumDescriptor.getValues(), this::serializeEnumValue));
        object.put("isEnum", true);
        object.put("fullName", enumDescriptor.getFullName());
        if (!enumDescriptor.getOptions().isEmpty()) {
            object.put("options", options(enumDescriptor));
        }
        return object;
    }

    private Map<String, Object> serializeEnumValue(EnumValueDescriptor value) {
        Map<String, Object> object = new LinkedHashMap<>();
        object.put("name", value.getName());
        object.put("titleName", NamingUtil.toTitleCase(value.getName()));
        object.put("number", value.getNumber());
        return object;
    }

    private Map<String, Object> serializeField(FieldDescriptor field) {
        TypeDescriptor type = field.getTypeDescriptor();

        Map<String, Object> object = new LinkedHashMap<>();
        object.put("name", field.getName());
        object.put("camelName", NamingUtil.toCamelCase(field.getName()));
        object.put("titleName", NamingUtil.toTitleCase(field.getName()));
        object.put("upperUnderscoreName", NamingUtil.toUpperUnderscore(field.getName()));
        object.put("number", field.getNumber());
        object.put("rawType", field.getRawType());
        object.put("label", field.getLabel().keyword());
        object.put("isNative", field.isNativeType());
        object.put("isRepeated", field.isRepeated());
        object.put("isOptional", field.isOptional());
        object.put("isRequired", field.isRequired());
        object.put("isEnum", type instanceof EnumDescriptor);
        object.put("isMessage", type instanceof MessageDescriptor);
        object.put("options", options(field));
        putIfPresent(object, "defaultValue", field.getDefaultValue());
        putIfPresent(object, "oneof", field.getOneofName());
        if (field.isExtension()) {
            object.put("isExtension", true);
        }
        if (type != null) {
            object.put("typeDescriptor", serializeType(type));
        }
        return object;
    }

    private Map<String, Object> serializeService(ServiceDescriptor service) {
        Map<String, Object> object = new LinkedHashMap<>();
        object.put("name", service.getName());
        object.put("fullName", service.getFullName());
        putIfPresent(object, "package", service.getPackageName());
        object.put("camelName", NamingUtil.toCamelCase(service.getName()));
        object.put("methods", list(service.getMethods(), this::serializeMethod));
        object.put("options", options(service));
        return object;
    }

    private Map<String, Object> serializeMethod(MethodDescriptor method) {
        Map<String, Object> object = new LinkedHashMap<>();
        object.put("name", method.getName());
        object.put("camelName", NamingUtil.toCamelCase(method.getName()));
        object.put("upperUnderscoreName", NamingUtil.toUpperUnderscore(method.getName()));
        object.put("rawInputType", method.getRawInputType());
        object.put("rawOutputType", method.getRawOutputType());
        object.put("clientStreaming", method.isClientStreaming());
        object.put("serverStreaming", method.isServerStreaming());
        object.put("options", options(method));

        TypeDescriptor inputType = method.getInputTypeDescriptor();
        if (inputType != null) {
            object.put("inputTypeDescriptor", serializeType(inputType));
        }
        TypeDescriptor outputType = method.getOutputTypeDescriptor();
        if (outputType != null) {
            object.put("outputTypeDescriptor", serializeType(outputType));
        }
        return object;
    }

    private Map<String, Object> serializeExtend(ExtendDescriptor extend) {
        Map<String, Object> object = new LinkedHashMap<>();
        object.put("name", extend.getTargetName());
        putIfPresent(object, "package", extend.getPackageName());
        object.put("fields", list(extend.getFields(), this::serializeField));
        return object;
    }

    private Map<String, Object> serializeType(TypeDescriptor type) {
        if (type instanceof MessageDescriptor message) {
            return serializeMessage(message);
        }
        return serializeEnum((EnumDescriptor) type);
    }

    private static Map<String, Object> options(Descriptor descriptor) {
        Map<String, Object> options = new LinkedHashMap<>();
        descriptor.getOptions().forEach((key, value) -> putIfPresent(options, key, value));
        return options;
    }

    private static <T> List<Object> list(List<T> items, Function<T, Map<String, Object>> serializer) {
        List<Object> result = new ArrayList<>(items.size());
        for (T item : items) {
            result.add(serializer.apply(item));
        }
        return result;
    }

    private static void putIfPresent(Map<String, Object> object, String key, Object value) {
        if (value != null) {
            object.put(key, value);
        }
    }
}
