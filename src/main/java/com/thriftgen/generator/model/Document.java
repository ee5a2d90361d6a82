package com.thriftgen.generator.model;

import java.util.List;
import java.util.Optional;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Root of a parsed, validated schema file.
 */
@Value
@Builder(toBuilder = true)
public class Document {

    @Singular
    List<Header> headers;

    @Singular("constant")
    List<ConstDef> consts;

    @Singular("enumDef")
    List<EnumDef> enums;

    @Singular
    List<StructDef> structs;

    @Singular
    List<ServiceDef> services;

    /**
     * Namespace declared for the given scope ({@code scala}, {@code java}, ...).
     */
    public Optional<String> namespace(String scope) {
        return headers.stream()
                .filter(Namespace.class::isInstance)
                .map(Namespace.class::cast)
                .filter(ns -> ns.getScope().equals(scope))
                .map(Namespace::getName)
                .findFirst();
    }

    /**
     * Package the generated Scala code lives in: the {@code scala} namespace,
     * else the {@code java} one, else {@code defaultNamespace}.
     */
    public String targetNamespace(String defaultNamespace) {
        return namespace("scala")
                .or(() -> namespace("java"))
                .orElse(defaultNamespace);
    }
}
