package com.thriftgen.generator.model;

import lombok.NonNull;
import lombok.Value;

@Value
public class ConstDef {
    @NonNull
    String name;
    @NonNull
    SchemaType type;
    @NonNull
    Constant value;
}
