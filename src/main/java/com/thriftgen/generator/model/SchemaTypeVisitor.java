package com.thriftgen.generator.model;

/**
 * Visitor over the closed set of {@link SchemaType} variants.
 * Adding a variant breaks every mapper at compile time until it handles the new case.
 */
public interface SchemaTypeVisitor<R> {
    R visit(BaseType type);
    R visit(ListType type);
    R visit(SetType type);
    R visit(MapType type);
    R visit(EnumType type);
    R visit(StructType type);
    R visit(ReferenceType type);
}
