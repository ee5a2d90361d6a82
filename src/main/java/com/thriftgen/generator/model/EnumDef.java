package com.thriftgen.generator.model;

import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Enum definition. Values keep declaration order, which is the generated order.
 */
@Value
@Builder(toBuilder = true)
public class EnumDef {
    @NonNull
    String name;

    @Singular
    List<EnumValue> values;
}
