package com.thriftgen.generator.model;

import lombok.NonNull;
import lombok.Value;

/**
 * Reference to an enum definition. Enums travel on the wire as {@code i32}.
 */
@Value
public final class EnumType implements NamedType {
    @NonNull
    String name;

    @Override
    public <R> R accept(SchemaTypeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
