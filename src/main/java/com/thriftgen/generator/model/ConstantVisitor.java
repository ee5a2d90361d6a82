package com.thriftgen.generator.model;

public interface ConstantVisitor<R> {
    R visit(NullConstant constant);
    R visit(BoolConstant constant);
    R visit(IntConstant constant);
    R visit(DoubleConstant constant);
    R visit(StringConstant constant);
    R visit(ListConstant constant);
    R visit(MapConstant constant);
    R visit(EnumValueConstant constant);
    R visit(IdentifierConstant constant);
}
