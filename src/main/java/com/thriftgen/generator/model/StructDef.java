package com.thriftgen.generator.model;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * A struct-like definition: plain struct, union or exception.
 */
@Value
@Builder(toBuilder = true)
public class StructDef {
    @NonNull
    String name;

    @NonNull
    @Builder.Default
    StructKind kind = StructKind.STRUCT;

    @Singular
    List<Field> fields;
}
