package com.thriftgen.generator.model;

public enum NullConstant implements Constant {
    INSTANCE;

    @Override
    public <R> R accept(ConstantVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
