package com.thriftgen.generator.model;

/**
 * A type as written in the schema. Container types own their element types by value;
 * enum, struct and unresolved references point to their definitions by name.
 */
public sealed interface SchemaType permits BaseType, ListType, SetType, MapType, NamedType {

    <R> R accept(SchemaTypeVisitor<R> visitor);
}
