package com.thriftgen.generator.model;

import lombok.NonNull;
import lombok.Value;

@Value
public final class IdentifierConstant implements Constant {
    @NonNull
    String name;

    @Override
    public <R> R accept(ConstantVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
