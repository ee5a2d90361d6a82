package com.thriftgen.generator.model;

import lombok.NonNull;
import lombok.Value;

/**
 * A forward or typedef reference that was not resolved to an enum or struct.
 */
@Value
public final class ReferenceType implements NamedType {
    @NonNull
    String name;

    @Override
    public <R> R accept(SchemaTypeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
