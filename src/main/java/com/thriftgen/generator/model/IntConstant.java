package com.thriftgen.generator.model;

import lombok.Value;

@Value
public final class IntConstant implements Constant {
    long value;

    @Override
    public <R> R accept(ConstantVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
