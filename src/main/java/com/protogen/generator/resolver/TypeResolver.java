package com.protogen.generator.resolver;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.protogen.generator.exception.UnresolvedTypeException;
import com.protogen.generator.model.ExtendDescriptor;
import com.protogen.generator.model.FieldDescriptor;
import com.protogen.generator.model.MessageDescriptor;
import com.protogen.generator.model.MethodDescriptor;
import com.protogen.generator.model.ProtoDescriptor;
import com.protogen.generator.model.QualifiedNames;
import com.protogen.generator.model.ServiceDescriptor;
import com.protogen.generator.model.TypeDescriptor;

/**
 * Second resolution pass: binds every non-native field and method type to the message or enum it names.
 *
 * Lookup order for a raw type name:
 * <ol>
 *   <li>a leading '.' means fully qualified: exact lookup only</li>
 *   <li>a message or enum nested directly in the enclosing message</li>
 *   <li>the scope chain, innermost first: {@code a.b.Msg.T}, {@code a.b.T}, {@code a.T}, {@code T}</li>
 * </ol>
 * The first failure aborts resolution.
 */
public class TypeResolver {
    private static final Logger log = LoggerFactory.getLogger(TypeResolver.class);

    private final SymbolTable symbolTable;

    public TypeResolver(SymbolTable symbolTable) {
        this.symbolTable = Objects.requireNonNull(symbolTable, "symbolTable");
    }

    public void resolve(List<ProtoDescriptor> protos) {
        for (ProtoDescriptor proto : protos) {
            resolveMessages(proto, proto.getMessages());
            resolveServices(proto);
            resolveExtends(proto);
        }
    }

    private void resolveMessages(ProtoDescriptor proto, List<MessageDescriptor> messages) {
        for (MessageDescriptor message : messages) {
            for (FieldDescriptor field : message.getFields()) {
                if (field.isResolved()) {
                    continue;
                }
                String typeName = field.getRawType();

                Optional<TypeDescriptor> local = QualifiedNames.isFullyQualified(typeName)
                        ? Optional.empty()
                        : message.findNestedType(typeName);
                TypeDescriptor type = local.orElseGet(() -> resolveGlobalTypeOrFail(message.getFullName(), typeName,
                        () -> new UnresolvedTypeException(typeName, "type of field", field.getName(),
                                "message", message.getFullName(), proto.getFilePath())));

                field.setTypeDescriptor(type);
                log.debug("Resolved {}.{} : {} -> {}", message.getFullName(), field.getName(), typeName, type.getFullName());
            }

            resolveMessages(proto, message.getMessages());
        }
    }

    private void resolveServices(ProtoDescriptor proto) {
        for (ServiceDescriptor service : proto.getServices()) {
            for (MethodDescriptor method : service.getMethods()) {
                TypeDescriptor inputType = null;
                TypeDescriptor outputType = null;

                // only non-native, not yet bound sides are resolved
                if (!method.getInputType().isResolved()) {
                    inputType = resolveGlobalTypeOrFail(service.getPackageName(), method.getRawInputType(),
                            () -> new UnresolvedTypeException(method.getRawInputType(), "input type of method",
                                    method.getName(), "service", service.getName(), proto.getFilePath()));
                }
                if (!method.getOutputType().isResolved()) {
                    outputType = resolveGlobalTypeOrFail(service.getPackageName(), method.getRawOutputType(),
                            () -> new UnresolvedTypeException(method.getRawOutputType(), "output type of method",
                                    method.getName(), "service", service.getName(), proto.getFilePath()));
                }
                method.setTypeDescriptors(inputType, outputType);
            }
        }
    }

    private void resolveExtends(ProtoDescriptor proto) {
        for (ExtendDescriptor extend : proto.getExtends()) {
            for (FieldDescriptor field : extend.getFields()) {
                if (field.isResolved()) {
                    continue;
                }
                TypeDescriptor type = resolveGlobalTypeOrFail(extend.getScope(), field.getRawType(),
                        () -> new UnresolvedTypeException(field.getRawType(), "type of extension field", field.getName(),
                                "extend", extend.getTargetName(), proto.getFilePath()));
                field.setTypeDescriptor(type);
            }
        }
    }

    private TypeDescriptor resolveGlobalTypeOrFail(String scope, String typeName,
                                                   Supplier<UnresolvedTypeException> failure) {
        if (QualifiedNames.isFullyQualified(typeName)) {
            return symbolTable.find(typeName.substring(1)).orElseThrow(failure);
        }
        for (String candidateScope : QualifiedNames.scopeChain(scope)) {
            Optional<TypeDescriptor> type = symbolTable.find(QualifiedNames.join(candidateScope, typeName));
            if (type.isPresent()) {
                return type.get();
            }
        }
        throw failure.get();
    }
}
