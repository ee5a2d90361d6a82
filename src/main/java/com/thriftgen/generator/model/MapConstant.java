package com.thriftgen.generator.model;

import java.util.List;

import lombok.NonNull;
import lombok.Value;

/**
 * Map literal. Pairs keep their declaration order, which is also the rendering order.
 */
@Value
public final class MapConstant implements Constant {
    @NonNull
    List<Entry> entries;

    public MapConstant(List<Entry> entries) {
        this.entries = List.copyOf(entries);
    }

    public static Entry entry(Constant key, Constant value) {
        return new Entry(key, value);
    }

    @Override
    public <R> R accept(ConstantVisitor<R> visitor) {
        return visitor.visit(this);
    }

    @Value
    public static class Entry {
        @NonNull
        Constant key;
        @NonNull
        Constant value;
    }
}
