package com.thriftgen.generator.model;

/**
 * A literal value from the schema: a const definition's value or a field default.
 * Each variant carries everything needed to render it, no type information required.
 */
public sealed interface Constant
        permits NullConstant, BoolConstant, IntConstant, DoubleConstant, StringConstant,
                ListConstant, MapConstant, EnumValueConstant, IdentifierConstant {

    <R> R accept(ConstantVisitor<R> visitor);
}
