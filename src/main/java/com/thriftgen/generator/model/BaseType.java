package com.thriftgen.generator.model;

/**
 * Built-in scalar types, plus {@code void} for function return types.
 */
public enum BaseType implements SchemaType {
    VOID,
    BOOL,
    BYTE,
    I16,
    I32,
    I64,
    DOUBLE,
    STRING,
    BINARY;

    @Override
    public <R> R accept(SchemaTypeVisitor<R> visitor) {
        return visitor.visit(this);
    }

    public boolean isVoid() {
        return this == VOID;
    }
}
