package com.thriftgen.generator.model;

import java.util.List;

import lombok.NonNull;
import lombok.Value;

@Value
public final class ListConstant implements Constant {
    @NonNull
    List<Constant> elements;

    public ListConstant(List<Constant> elements) {
        this.elements = List.copyOf(elements);
    }

    public static ListConstant of(Constant... elements) {
        return new ListConstant(List.of(elements));
    }

    @Override
    public <R> R accept(ConstantVisitor<R> visitor) {
        return visitor.visit(this);
    }
}
