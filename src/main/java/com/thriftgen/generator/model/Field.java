package com.thriftgen.generator.model;

import java.util.Optional;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * A struct field, function argument or declared exception.
 */
@Value
@Builder(toBuilder = true)
public class Field {

    /** Wire id from the schema ({@code 1: string name}). */
    int id;

    @NonNull
    String name;

    @NonNull
    SchemaType type;

    @NonNull
    @Builder.Default
    Requiredness requiredness = Requiredness.DEFAULT;

    /** Schema-declared default, absent when the field has none. */
    Constant defaultValue;

    public Optional<Constant> getDefaultValue() {
        return Optional.ofNullable(defaultValue);
    }

    public boolean isOptional() {
        return requiredness.isOptional();
    }
}
