package com.thriftgen.generator.codegen.mapper;

/**
 * Thrift wire type tags, named as the runtime's {@code TType} constants.
 */
public enum WireTag {
    VOID,
    BOOL,
    BYTE,
    DOUBLE,
    I16,
    I32,
    I64,
    STRING,
    STRUCT,
    MAP,
    SET,
    LIST
}
