package com.thriftgen.generator.codegen.serde;

import com.thriftgen.generator.codegen.exception.MappingException;
import com.thriftgen.generator.codegen.mapper.ScalaTypeMapper;
import com.thriftgen.generator.model.BaseType;
import com.thriftgen.generator.model.EnumType;
import com.thriftgen.generator.model.ListType;
import com.thriftgen.generator.model.MapType;
import com.thriftgen.generator.model.ReferenceType;
import com.thriftgen.generator.model.SchemaType;
import com.thriftgen.generator.model.SchemaTypeVisitor;
import com.thriftgen.generator.model.SetType;
import com.thriftgen.generator.model.StructType;

/**
 * Builds the Scala expressions that read a value of a schema type from a
 * {@code TProtocol}, and the statements that write one.
 *
 * Output is single-line so it can be dropped into any fragment position.
 * Container code nests: each level gets its own suffixed locals.
 */
public class ProtocolExpressions {

    public static final String INPUT_PROTOCOL = "_iprot";
    public static final String OUTPUT_PROTOCOL = "_oprot";

    private ProtocolExpressions() {
        // Utility class
    }

    /**
     * Expression that reads one {@code type} value from {@value #INPUT_PROTOCOL}.
     */
    public static String readExpression(SchemaType type) {
        return type.accept(new Reader(0));
    }

    /**
     * Statement(s) that write {@code value} as {@code type} to {@value #OUTPUT_PROTOCOL}.
     */
    public static String writeStatement(SchemaType type, String value) {
        return type.accept(new Writer(value, 0));
    }

    private static String tag(SchemaType type) {
        return "TType." + ScalaTypeMapper.wireTag(type);
    }

    private static final class Reader implements SchemaTypeVisitor<String> {
        private final int depth;

        private Reader(int depth) {
            this.depth = depth;
        }

        private String nested(SchemaType type) {
            return type.accept(new Reader(depth + 1));
        }

        @Override
        public String visit(BaseType type) {
            return INPUT_PROTOCOL + "." + ScalaTypeMapper.protocolReadMethod(type) + "()";
        }

        @Override
        public String visit(ListType type) {
            String header = "_list" + depth;
            return "{ val " + header + " = " + INPUT_PROTOCOL + ".readListBegin(); "
                    + "val _rv" + depth + " = (0 until " + header + ".size).map { _ => "
                    + nested(type.getElementType()) + " }; "
                    + INPUT_PROTOCOL + ".readListEnd(); _rv" + depth + " }";
        }

        @Override
        public String visit(SetType type) {
            String header = "_set" + depth;
            return "{ val " + header + " = " + INPUT_PROTOCOL + ".readSetBegin(); "
                    + "val _rv" + depth + " = (0 until " + header + ".size).map { _ => "
                    + nested(type.getElementType()) + " }.toSet; "
                    + INPUT_PROTOCOL + ".readSetEnd(); _rv" + depth + " }";
        }

        @Override
        public String visit(MapType type) {
            String header = "_map" + depth;
            return "{ val " + header + " = " + INPUT_PROTOCOL + ".readMapBegin(); "
                    + "val _rv" + depth + " = (0 until " + header + ".size).map { _ => "
                    + "val _k" + depth + " = " + nested(type.getKeyType()) + "; "
                    + "(_k" + depth + ", " + nested(type.getValueType()) + ") }.toMap; "
                    + INPUT_PROTOCOL + ".readMapEnd(); _rv" + depth + " }";
        }

        @Override
        public String visit(EnumType type) {
            return type.getName() + "(" + INPUT_PROTOCOL + ".readI32())";
        }

        @Override
        public String visit(StructType type) {
            return type.getName() + ".decode(" + INPUT_PROTOCOL + ")";
        }

        @Override
        public String visit(ReferenceType type) {
            throw new MappingException("readExpression", type);
        }
    }

    private static final class Writer implements SchemaTypeVisitor<String> {
        private final String value;
        private final int depth;

        private Writer(String value, int depth) {
            this.value = value;
            this.depth = depth;
        }

        private static String nested(SchemaType type, String value, int depth) {
            return type.accept(new Writer(value, depth));
        }

        @Override
        public String visit(BaseType type) {
            return OUTPUT_PROTOCOL + "." + ScalaTypeMapper.protocolWriteMethod(type) + "(" + value + ")";
        }

        @Override
        public String visit(ListType type) {
            String element = "_e" + depth;
            return OUTPUT_PROTOCOL + ".writeListBegin(new TList(" + tag(type.getElementType()) + ", "
                    + value + ".size)); "
                    + value + ".foreach { " + element + " => "
                    + nested(type.getElementType(), element, depth + 1) + " }; "
                    + OUTPUT_PROTOCOL + ".writeListEnd()";
        }

        @Override
        public String visit(SetType type) {
            String element = "_e" + depth;
            return OUTPUT_PROTOCOL + ".writeSetBegin(new TSet(" + tag(type.getElementType()) + ", "
                    + value + ".size)); "
                    + value + ".foreach { " + element + " => "
                    + nested(type.getElementType(), element, depth + 1) + " }; "
                    + OUTPUT_PROTOCOL + ".writeSetEnd()";
        }

        @Override
        public String visit(MapType type) {
            String key = "_k" + depth;
            String val = "_v" + depth;
            return OUTPUT_PROTOCOL + ".writeMapBegin(new TMap(" + tag(type.getKeyType()) + ", "
                    + tag(type.getValueType()) + ", " + value + ".size)); "
                    + value + ".foreach { case (" + key + ", " + val + ") => "
                    + nested(type.getKeyType(), key, depth + 1) + "; "
                    + nested(type.getValueType(), val, depth + 1) + " }; "
                    + OUTPUT_PROTOCOL + ".writeMapEnd()";
        }

        @Override
        public String visit(EnumType type) {
            return OUTPUT_PROTOCOL + ".writeI32(" + value + ".value)";
        }

        @Override
        public String visit(StructType type) {
            return value + ".write(" + OUTPUT_PROTOCOL + ")";
        }

        @Override
        public String visit(ReferenceType type) {
            throw new MappingException("writeStatement", type);
        }
    }
}
