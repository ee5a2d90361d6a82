package com.thriftgen.generator.model;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * One service method. A {@link BaseType#VOID} return type means no result value.
 */
@Value
@Builder(toBuilder = true)
public class FunctionDef {
    @NonNull
    String name;

    @NonNull
    @Builder.Default
    SchemaType returnType = BaseType.VOID;

    @Singular
    List<Field> args;

    @Singular("throwsField")
    List<Field> throwsFields;

    boolean oneway;
}
