package com.thriftgen.generator.model;

public enum Requiredness {
    REQUIRED,
    OPTIONAL,
    /** Neither keyword given in the schema. */
    DEFAULT;

    public boolean isOptional() {
        return this == OPTIONAL;
    }
}
