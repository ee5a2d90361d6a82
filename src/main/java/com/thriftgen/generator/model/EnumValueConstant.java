package com.thriftgen.generator.model;

import lombok.NonNull;
import lombok.Value;

/**
 * Qualified reference to one value of an enum, e.g. {@code Color.Red}.
 */
@Value
public final class EnumValueConstant implements Constant {
    @NonNull
    String enumName;
    @NonNull
    String valueName;

    @Override
    public <R> R accept(ConstantVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
