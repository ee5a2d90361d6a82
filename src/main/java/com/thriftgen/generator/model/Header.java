package com.thriftgen.generator.model;

/**
 * Document-level declarations that precede the definitions.
 */
public sealed interface Header permits Include, Namespace {
}
