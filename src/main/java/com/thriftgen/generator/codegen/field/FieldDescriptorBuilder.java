package com.thriftgen.generator.codegen.field;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

import com.thriftgen.generator.codegen.mapper.ConstantRenderer;
import com.thriftgen.generator.codegen.mapper.ScalaTypeMapper;
import com.thriftgen.generator.codegen.util.NamingUtil;
import com.thriftgen.generator.model.BaseType;
import com.thriftgen.generator.model.Field;

/**
 * Computes declared types, defaults and parameter lists for struct fields and
 * function arguments.
 */
public class FieldDescriptorBuilder {

    static final String ABSENT = "None";

    private FieldDescriptorBuilder() {
        // Utility class
    }

    public static FieldDescriptor describe(Field field) {
        return FieldDescriptor.builder()
                .field(field)
                .quotedName(NamingUtil.quoteIdentifier(field.getName()))
                .valueType(ScalaTypeMapper.scalaType(field.getType()))
                .declaredType(declaredType(field))
                .defaultExpression(defaultExpression(field).orElse(null))
                .readDefault(defaultReadValue(field))
                .fieldConst(fieldConstName(field.getName()))
                .build();
    }

    public static String declaredType(Field field) {
        String type = ScalaTypeMapper.scalaType(field.getType());
        return field.isOptional() ? "Option[" + type + "]" : type;
    }

    /**
     * Declaration-site default. An explicit schema default wins (wrapped in {@code Some}
     * for optional fields); an optional field without one defaults to {@code None};
     * anything else has no default and must be supplied.
     */
    public static Optional<String> defaultExpression(Field field) {
        Optional<String> explicit = field.getDefaultValue()
                .map(ConstantRenderer::render)
                .map(v -> field.isOptional() ? "Some(" + v + ")" : v);
        if (explicit.isPresent()) {
            return explicit;
        }
        return field.isOptional() ? Optional.of(ABSENT) : Optional.empty();
    }

    /**
     * The value a field takes when deserializing and the field is not present.
     * Ignores any schema default.
     */
    public static String defaultReadValue(Field field) {
        if (field.isOptional()) {
            return ABSENT;
        }
        if (!(field.getType() instanceof BaseType base)) {
            return "null";
        }
        return switch (base) {
            case BOOL -> "false";
            case BYTE, I16, I32, I64 -> "0";
            case DOUBLE -> "0.0";
            case VOID, STRING, BINARY -> "null";
        };
    }

    /**
     * Comma-separated Scala parameter list, e.g. {@code `id`: Long, `tag`: Option[String] = None}.
     */
    public static String formatParams(List<Field> fields) {
        return fields.stream()
                .map(FieldDescriptorBuilder::describe)
                .map(FieldDescriptor::toParameter)
                .collect(Collectors.joining(", "));
    }

    public static String fieldConstName(String name) {
        return name.toUpperCase(Locale.ROOT) + "_FIELD_DESC";
    }
}
