package com.thriftgen.generator.model;

import lombok.Value;

@Value
public final class BoolConstant implements Constant {
    boolean value;

    @Override
    public <R> R accept(ConstantVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
