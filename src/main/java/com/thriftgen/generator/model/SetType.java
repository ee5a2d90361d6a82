package com.thriftgen.generator.model;

import lombok.NonNull;
import lombok.Value;

@Value
public final class SetType implements SchemaType {
    @NonNull
    SchemaType elementType;

    @Override
    public <R> R accept(SchemaTypeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
