package com.thriftgen.generator.model;

import lombok.NonNull;
import lombok.Value;

@Value
public class EnumValue {
    @NonNull
    String name;
    int value;
}
