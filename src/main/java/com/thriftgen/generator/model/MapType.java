package com.thriftgen.generator.model;

import lombok.NonNull;
import lombok.Value;

@Value
public final class MapType implements SchemaType {
    @NonNull
    SchemaType keyType;
    @NonNull
    SchemaType valueType;

    @Override
    public <R> R accept(SchemaTypeVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
