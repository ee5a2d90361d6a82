package com.thriftgen.generator.codegen.field;

import java.util.Optional;

import com.thriftgen.generator.model.Field;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Everything the struct and service fragments need to know about one field.
 */
@Value
@Builder
public class FieldDescriptor {

    @NonNull
    Field field;

    /** Name wrapped in backticks, safe to use as a Scala identifier. */
    @NonNull
    String quotedName;

    /** Scala type of the value, without the {@code Option} wrapper. */
    @NonNull
    String valueType;

    /** Declared Scala type: {@code Option[valueType]} for optional fields. */
    @NonNull
    String declaredType;

    /** Declaration-site default, e.g. {@code = Some(3)} without the {@code =}. */
    String defaultExpression;

    /** Value used when the field is missing on the wire. */
    @NonNull
    String readDefault;

    /** Name of the companion-object {@code TField} constant. */
    @NonNull
    String fieldConst;

    public Optional<String> getDefaultExpression() {
        return Optional.ofNullable(defaultExpression);
    }

    /**
     * {@code `name`: Type} with {@code  = default} appended when there is one.
     */
    public String toParameter() {
        String param = quotedName + ": " + declaredType;
        return getDefaultExpression().map(d -> param + " = " + d).orElse(param);
    }
}
