package com.thriftgen.generator.model;

/**
 * A type that refers to a definition by name. Resolution happens before generation;
 * the generator only needs the name and which kind of definition it names.
 */
public sealed interface NamedType extends SchemaType permits EnumType, StructType, ReferenceType {

    String getName();
}
