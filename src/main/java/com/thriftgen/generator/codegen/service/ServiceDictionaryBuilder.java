package com.thriftgen.generator.codegen.service;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.thriftgen.generator.codegen.ServiceOption;
import com.thriftgen.generator.codegen.field.FieldDescriptorBuilder;
import com.thriftgen.generator.codegen.mapper.ScalaTypeMapper;
import com.thriftgen.generator.codegen.struct.StructDictionaryBuilder;
import com.thriftgen.generator.codegen.util.NamingUtil;
import com.thriftgen.generator.model.BaseType;
import com.thriftgen.generator.model.Field;
import com.thriftgen.generator.model.FunctionDef;
import com.thriftgen.generator.model.Requiredness;
import com.thriftgen.generator.model.StructDef;
import com.thriftgen.generator.model.StructKind;
import com.thriftgen.generator.template.Dictionary;
import com.thriftgen.generator.template.Fragment;

/**
 * Builds the {@code service} fragment's dictionary. Each function's argument and result
 * structs are embedded through the struct fragment, which the service fragment calls
 * as the {@code struct} partial.
 */
public class ServiceDictionaryBuilder {
    private static final Logger log = LoggerFactory.getLogger(ServiceDictionaryBuilder.class);

    static final String SUCCESS_FIELD = "success";

    private final Fragment<StructDef> structFragment;
    private final StructDictionaryBuilder fieldDictionaries;

    public ServiceDictionaryBuilder(Fragment<StructDef> structFragment, StructDictionaryBuilder fieldDictionaries) {
        this.structFragment = Objects.requireNonNull(structFragment, "structFragment");
        this.fieldDictionaries = Objects.requireNonNull(fieldDictionaries, "fieldDictionaries");
    }

    public Dictionary build(ScalaService scalaService) {
        var service = scalaService.getService();
        log.debug("Building service dictionary for {} ({} functions)", service.getName(), service.getFunctions().size());

        List<Dictionary> functions = service.getFunctions().stream()
                .map(this::function)
                .toList();

        Dictionary.Builder builder = Dictionary.builder()
                .put("name", service.getName())
                .put("hasParent", service.getParent().isPresent())
                .put("parent", service.getParent().orElse(""))
                .put("hasFunctions", !functions.isEmpty())
                .put("functions", functions)
                .put("struct", structFragment.template());
        for (ServiceOption option : ServiceOption.values()) {
            builder.put(option.getDictionaryKey(), scalaService.has(option));
        }
        return builder.build();
    }

    Dictionary function(FunctionDef function) {
        List<Dictionary> throwsFields = function.getThrowsFields().stream()
                .map(fieldDictionaries::field)
                .toList();

        return Dictionary.builder()
                .put("name", function.getName())
                .put("quotedName", NamingUtil.quoteIdentifier(function.getName()))
                .put("fieldArgs", FieldDescriptorBuilder.formatParams(function.getArgs()))
                .put("args", function.getArgs().stream().map(fieldDictionaries::field).toList())
                .put("returnType", ScalaTypeMapper.scalaType(function.getReturnType()))
                .put("isVoid", isVoid(function))
                .put("oneway", function.isOneway())
                .put("hasThrows", !throwsFields.isEmpty())
                .put("throws", throwsFields)
                .put("argsName", argsStructName(function))
                .put("resultName", resultStructName(function))
                .put("argsStruct", structFragment.unpacker().apply(argsStruct(function)))
                .put("resultStruct", structFragment.unpacker().apply(resultStruct(function)))
                .build();
    }

    static boolean isVoid(FunctionDef function) {
        return function.getReturnType() instanceof BaseType base && base.isVoid();
    }

    static String argsStructName(FunctionDef function) {
        return function.getName() + "_args";
    }

    static String resultStructName(FunctionDef function) {
        return function.getName() + "_result";
    }

    static StructDef argsStruct(FunctionDef function) {
        return StructDef.builder()
                .name(argsStructName(function))
                .fields(function.getArgs())
                .build();
    }

    /**
     * {@code success} (id 0, absent for void functions) followed by every declared
     * exception, all optional: exactly one of them is set in a reply.
     */
    static StructDef resultStruct(FunctionDef function) {
        List<Field> fields = new ArrayList<>();
        if (!isVoid(function)) {
            fields.add(Field.builder()
                    .id(0)
                    .name(SUCCESS_FIELD)
                    .type(function.getReturnType())
                    .requiredness(Requiredness.OPTIONAL)
                    .build());
        }
        for (Field thrown : function.getThrowsFields()) {
            fields.add(thrown.toBuilder()
                    .requiredness(Requiredness.OPTIONAL)
                    .defaultValue(null)
                    .build());
        }
        return StructDef.builder()
                .name(resultStructName(function))
                .kind(StructKind.STRUCT)
                .fields(fields)
                .build();
    }
}
