package com.thriftgen.generator.codegen.mapper;

import com.thriftgen.generator.codegen.exception.MappingException;
import com.thriftgen.generator.model.BaseType;
import com.thriftgen.generator.model.EnumType;
import com.thriftgen.generator.model.ListType;
import com.thriftgen.generator.model.MapType;
import com.thriftgen.generator.model.ReferenceType;
import com.thriftgen.generator.model.SchemaType;
import com.thriftgen.generator.model.SchemaTypeVisitor;
import com.thriftgen.generator.model.SetType;
import com.thriftgen.generator.model.StructType;

import lombok.experimental.UtilityClass;

/**
 * Maps schema types to Scala type expressions, wire tags, protocol method names
 * and zero literals. Knows nothing about field optionality.
 */
@UtilityClass
public class ScalaTypeMapper {

    private static final SchemaTypeVisitor<String> SCALA_TYPE = new SchemaTypeVisitor<>() {
        @Override
        public String visit(BaseType type) {
            return switch (type) {
                case VOID -> "Unit";
                case BOOL -> "Boolean";
                case BYTE -> "Byte";
                case I16 -> "Short";
                case I32 -> "Int";
                case I64 -> "Long";
                case DOUBLE -> "Double";
                case STRING -> "String";
                case BINARY -> "ByteBuffer";
            };
        }

        @Override
        public String visit(ListType type) {
            return "Seq[" + scalaType(type.getElementType()) + "]";
        }

        @Override
        public String visit(SetType type) {
            return "Set[" + scalaType(type.getElementType()) + "]";
        }

        @Override
        public String visit(MapType type) {
            return "Map[" + scalaType(type.getKeyType()) + ", " + scalaType(type.getValueType()) + "]";
        }

        @Override
        public String visit(EnumType type) {
            return type.getName();
        }

        @Override
        public String visit(StructType type) {
            return type.getName();
        }

        @Override
        public String visit(ReferenceType type) {
            return type.getName();
        }
    };

    private static final SchemaTypeVisitor<WireTag> WIRE_TAG = new SchemaTypeVisitor<>() {
        @Override
        public WireTag visit(BaseType type) {
            return switch (type) {
                case VOID -> WireTag.VOID;
                case BOOL -> WireTag.BOOL;
                case BYTE -> WireTag.BYTE;
                case I16 -> WireTag.I16;
                case I32 -> WireTag.I32;
                case I64 -> WireTag.I64;
                case DOUBLE -> WireTag.DOUBLE;
                case STRING -> WireTag.STRING;
                // thrift's "string" follows old C++ semantics: binary goes over the wire as a string
                case BINARY -> WireTag.STRING;
            };
        }

        @Override
        public WireTag visit(ListType type) {
            return WireTag.LIST;
        }

        @Override
        public WireTag visit(SetType type) {
            return WireTag.SET;
        }

        @Override
        public WireTag visit(MapType type) {
            return WireTag.MAP;
        }

        @Override
        public WireTag visit(EnumType type) {
            // enums are sent as their integer value
            return WireTag.I32;
        }

        @Override
        public WireTag visit(StructType type) {
            return WireTag.STRUCT;
        }

        @Override
        public WireTag visit(ReferenceType type) {
            throw new MappingException("wireTag", type);
        }
    };

    /**
     * Scala type expression for {@code type}, e.g. {@code Map[String, Seq[Long]]}.
     */
    public String scalaType(SchemaType type) {
        return type.accept(SCALA_TYPE);
    }

    public WireTag wireTag(SchemaType type) {
        return type.accept(WIRE_TAG);
    }

    /**
     * {@code bool, byte, i16, i32, i64, double}: types whose Scala representation is a
     * JVM value type and can never hold {@code null}.
     */
    public boolean isValueType(SchemaType type) {
        if (!(type instanceof BaseType base)) {
            return false;
        }
        return switch (base) {
            case BOOL, BYTE, I16, I32, I64, DOUBLE -> true;
            case VOID, STRING, BINARY -> false;
        };
    }

    public String protocolReadMethod(SchemaType type) {
        return switch (primitive("protocolReadMethod", type)) {
            case BOOL -> "readBool";
            case BYTE -> "readByte";
            case I16 -> "readI16";
            case I32 -> "readI32";
            case I64 -> "readI64";
            case DOUBLE -> "readDouble";
            case STRING -> "readString";
            case BINARY -> "readBinary";
            case VOID -> throw new MappingException("protocolReadMethod", type);
        };
    }

    public String protocolWriteMethod(SchemaType type) {
        return switch (primitive("protocolWriteMethod", type)) {
            case BOOL -> "writeBool";
            case BYTE -> "writeByte";
            case I16 -> "writeI16";
            case I32 -> "writeI32";
            case I64 -> "writeI64";
            case DOUBLE -> "writeDouble";
            case STRING -> "writeString";
            case BINARY -> "writeBinary";
            case VOID -> throw new MappingException("protocolWriteMethod", type);
        };
    }

    /**
     * Zero literal of a primitive type.
     */
    public String zeroValue(SchemaType type) {
        return switch (primitive("zeroValue", type)) {
            case BOOL -> "false";
            case BYTE, I16, I32 -> "0";
            case I64 -> "0L";
            case DOUBLE -> "0.0";
            case STRING -> "\"\"";
            case BINARY -> "ByteBuffer.allocate(0)";
            case VOID -> throw new MappingException("zeroValue", type);
        };
    }

    private BaseType primitive(String mapping, SchemaType type) {
        if (type instanceof BaseType base) {
            return base;
        }
        throw new MappingException(mapping, type);
    }
}
