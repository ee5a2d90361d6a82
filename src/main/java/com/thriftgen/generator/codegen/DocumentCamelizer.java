package com.thriftgen.generator.codegen;

import java.util.List;

import com.thriftgen.generator.codegen.util.NamingUtil;
import com.thriftgen.generator.model.Document;
import com.thriftgen.generator.model.Field;
import com.thriftgen.generator.model.FunctionDef;
import com.thriftgen.generator.model.ServiceDef;
import com.thriftgen.generator.model.StructDef;

/**
 * Rewrites a document so member names follow Scala conventions: struct fields,
 * function names, arguments and declared exceptions become camelCase.
 * Type, enum, enum value and constant names are left as declared.
 */
public class DocumentCamelizer {

    public Document camelize(Document document) {
        return document.toBuilder()
                .clearStructs()
                .structs(document.getStructs().stream().map(this::camelize).toList())
                .clearServices()
                .services(document.getServices().stream().map(this::camelize).toList())
                .build();
    }

    StructDef camelize(StructDef struct) {
        return struct.toBuilder()
                .clearFields()
                .fields(camelizeFields(struct.getFields()))
                .build();
    }

    ServiceDef camelize(ServiceDef service) {
        return service.toBuilder()
                .clearFunctions()
                .functions(service.getFunctions().stream().map(this::camelize).toList())
                .build();
    }

    FunctionDef camelize(FunctionDef function) {
        return function.toBuilder()
                .name(NamingUtil.toCamelCase(function.getName()))
                .clearArgs()
                .args(camelizeFields(function.getArgs()))
                .clearThrowsFields()
                .throwsFields(camelizeFields(function.getThrowsFields()))
                .build();
    }

    private List<Field> camelizeFields(List<Field> fields) {
        return fields.stream()
                .map(f -> f.toBuilder().name(NamingUtil.toCamelCase(f.getName())).build())
                .toList();
    }
}
