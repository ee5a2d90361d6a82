package com.thriftgen.generator.model;

import lombok.NonNull;
import lombok.Value;

/**
 * Reference to a struct, union or exception definition.
 */
@Value
public final class StructType implements NamedType {
    @NonNull
    String name;

    @Override
    public <R> R accept(SchemaTypeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
