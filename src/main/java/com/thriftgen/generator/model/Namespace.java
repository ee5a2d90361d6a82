package com.thriftgen.generator.model;

import lombok.NonNull;
import lombok.Value;

/**
 * {@code namespace <scope> <name>}, e.g. {@code namespace scala com.example.thrift}.
 */
@Value
public final class Namespace implements Header {
    @NonNull
    String scope;
    @NonNull
    String name;
}
