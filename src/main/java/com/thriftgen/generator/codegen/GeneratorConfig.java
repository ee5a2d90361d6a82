package com.thriftgen.generator.codegen;

import java.util.Set;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

/**
 * Configuration for a generation session.
 */
@Value
@Builder(toBuilder = true)
public class GeneratorConfig {

    public static final String DEFAULT_TEMPLATE_PREFIX = "/scalagen/";

    /** Prefix handed to the fragment loader. */
    @NonNull
    @Builder.Default
    String templatePrefix = DEFAULT_TEMPLATE_PREFIX;

    /** Package used when a document declares neither a scala nor a java namespace. */
    @NonNull
    @Builder.Default
    String defaultNamespace = "thrift";

    @Singular
    Set<ServiceOption> serviceOptions;

    public static GeneratorConfig defaults() {
        return GeneratorConfig.builder().build();
    }
}
