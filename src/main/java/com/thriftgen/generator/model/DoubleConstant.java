package com.thriftgen.generator.model;

import lombok.Value;

@Value
public final class DoubleConstant implements Constant {
    double value;

    @Override
    public <R> R accept(ConstantVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
