package com.thriftgen.generator.model;

public enum StructKind {
    STRUCT,
    UNION,
    EXCEPTION
}
