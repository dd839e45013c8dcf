package com.protogen.generator.resolver;

import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.protogen.generator.model.EnumDescriptor;
import com.protogen.generator.model.ExtendDescriptor;
import com.protogen.generator.model.MessageDescriptor;
import com.protogen.generator.model.ProtoDescriptor;
import com.protogen.generator.model.QualifiedNames;
import com.protogen.generator.model.ServiceDescriptor;

/**
 * First resolution pass: assigns every message and enum its enclosing scope and registers
 * it in the symbol table under its full name.
 *
 * Must run over every file of a load before {@link TypeResolver} touches any of them.
 */
public class TypeIndexer {
    private static final Logger log = LoggerFactory.getLogger(TypeIndexer.class);

    private final SymbolTable symbolTable;

    public TypeIndexer(SymbolTable symbolTable) {
        this.symbolTable = Objects.requireNonNull(symbolTable, "symbolTable");
    }

    public void index(List<ProtoDescriptor> protos) {
        for (ProtoDescriptor proto : protos) {
            String packageName = proto.getPackageName();
            indexScope(proto.getMessages(), proto.getEnums(), packageName);
            for (ServiceDescriptor service : proto.getServices()) {
                service.setPackageName(packageName);
            }
            for (ExtendDescriptor extend : proto.getExtends()) {
                extend.setPackageName(packageName);
            }
            log.debug("Indexed {}", proto.getName());
        }
        log.debug("Symbol table holds {} types", symbolTable.size());
    }

    private void indexScope(List<MessageDescriptor> messages, List<EnumDescriptor> enums, String scope) {
        for (MessageDescriptor message : messages) {
            message.setPackageName(scope);
            symbolTable.register(message);
            indexScope(message.getMessages(), message.getEnums(), QualifiedNames.join(scope, message.getName()));
        }
        for (EnumDescriptor enumDescriptor : enums) {
            enumDescriptor.setPackageName(scope);
            symbolTable.register(enumDescriptor);
        }
    }
}
