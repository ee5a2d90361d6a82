package com.thriftgen.generator.model;

import lombok.NonNull;
import lombok.Value;

@Value
public final class StringConstant implements Constant {
    @NonNull
    String value;

    @Override
    public <R> R accept(ConstantVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
