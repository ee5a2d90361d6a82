package com.thriftgen.generator.codegen.mapper;

import com.thriftgen.generator.codegen.exception.MappingException;
import com.thriftgen.generator.model.BaseType;
import com.thriftgen.generator.model.EnumType;
import com.thriftgen.generator.model.ListType;
import com.thriftgen.generator.model.MapType;
import com.thriftgen.generator.model.ReferenceType;
import com.thriftgen.generator.model.SchemaType;
import com.thriftgen.generator.model.SetType;
import com.thriftgen.generator.model.StructType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.EnumSet;
import java.util.HashSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for ScalaTypeMapper.
 */
class ScalaTypeMapperTest {

    @ParameterizedTest
    @CsvSource({
            "VOID, Unit",
            "BOOL, Boolean",
            "BYTE, Byte",
            "I16, Short",
            "I32, Int",
            "I64, Long",
            "DOUBLE, Double",
            "STRING, String",
            "BINARY, ByteBuffer"
    })
    void testBaseTypeMapping(BaseType type, String expected) {
        assertThat(ScalaTypeMapper.scalaType(type)).isEqualTo(expected);
    }

    @Test
    void testContainerTypesMapStructurally() {
        SchemaType nested = new MapType(BaseType.STRING, new ListType(new SetType(BaseType.I64)));

        assertThat(ScalaTypeMapper.scalaType(new ListType(BaseType.I32))).isEqualTo("Seq[Int]");
        assertThat(ScalaTypeMapper.scalaType(new SetType(BaseType.STRING))).isEqualTo("Set[String]");
        assertThat(ScalaTypeMapper.scalaType(nested)).isEqualTo("Map[String, Seq[Set[Long]]]");
    }

    @Test
    void testNamedTypesUseTheirName() {
        assertThat(ScalaTypeMapper.scalaType(new EnumType("Color"))).isEqualTo("Color");
        assertThat(ScalaTypeMapper.scalaType(new StructType("User"))).isEqualTo("User");
        assertThat(ScalaTypeMapper.scalaType(new ReferenceType("Alias"))).isEqualTo("Alias");
    }

    @Test
    void testScalaTypeIsDeterministic() {
        SchemaType type = new MapType(new EnumType("Color"), new ListType(BaseType.BINARY));

        assertThat(ScalaTypeMapper.scalaType(type)).isEqualTo(ScalaTypeMapper.scalaType(type));
        assertThat(ScalaTypeMapper.scalaType(type))
                .isEqualTo(ScalaTypeMapper.scalaType(new MapType(new EnumType("Color"), new ListType(BaseType.BINARY))));
    }

    @Test
    void testBinaryAndStringShareWireTagButNotScalaType() {
        assertThat(ScalaTypeMapper.wireTag(BaseType.BINARY)).isEqualTo(WireTag.STRING);
        assertThat(ScalaTypeMapper.wireTag(BaseType.STRING)).isEqualTo(WireTag.STRING);
        assertThat(ScalaTypeMapper.scalaType(BaseType.BINARY))
                .isNotEqualTo(ScalaTypeMapper.scalaType(BaseType.STRING));
    }

    @Test
    void testEnumTravelsAsI32() {
        assertThat(ScalaTypeMapper.wireTag(new EnumType("Color"))).isEqualTo(WireTag.I32);
        assertThat(ScalaTypeMapper.scalaType(new EnumType("Color"))).isEqualTo("Color");
    }

    @Test
    void testContainerAndStructWireTags() {
        assertThat(ScalaTypeMapper.wireTag(new ListType(BaseType.I32))).isEqualTo(WireTag.LIST);
        assertThat(ScalaTypeMapper.wireTag(new SetType(BaseType.I32))).isEqualTo(WireTag.SET);
        assertThat(ScalaTypeMapper.wireTag(new MapType(BaseType.I32, BaseType.I32))).isEqualTo(WireTag.MAP);
        assertThat(ScalaTypeMapper.wireTag(new StructType("User"))).isEqualTo(WireTag.STRUCT);
        assertThat(ScalaTypeMapper.wireTag(BaseType.VOID)).isEqualTo(WireTag.VOID);
    }

    @Test
    void testUnresolvedReferenceHasNoWireTag() {
        assertThatThrownBy(() -> ScalaTypeMapper.wireTag(new ReferenceType("Alias")))
                .isInstanceOf(MappingException.class)
                .hasMessageStartingWith("wireTag#");
    }

    @ParameterizedTest
    @EnumSource(value = BaseType.class, names = "VOID", mode = EnumSource.Mode.EXCLUDE)
    void testProtocolMethodsDefinedForEveryPrimitive(BaseType type) {
        assertThat(ScalaTypeMapper.protocolReadMethod(type)).startsWith("read");
        assertThat(ScalaTypeMapper.protocolWriteMethod(type)).startsWith("write");
        assertThat(ScalaTypeMapper.zeroValue(type)).isNotBlank();
    }

    @Test
    void testProtocolMethodsAreDistinctPerPrimitive() {
        Set<BaseType> primitives = EnumSet.complementOf(EnumSet.of(BaseType.VOID));
        Set<String> reads = new HashSet<>();
        Set<String> writes = new HashSet<>();
        for (BaseType type : primitives) {
            reads.add(ScalaTypeMapper.protocolReadMethod(type));
            writes.add(ScalaTypeMapper.protocolWriteMethod(type));
        }

        assertThat(reads).hasSize(primitives.size());
        assertThat(writes).hasSize(primitives.size());
        assertThat(ScalaTypeMapper.protocolReadMethod(BaseType.I64)).isEqualTo("readI64");
        assertThat(ScalaTypeMapper.protocolWriteMethod(BaseType.BINARY)).isEqualTo("writeBinary");
    }

    @Test
    void testProtocolMethodsRejectNonPrimitives() {
        assertThatThrownBy(() -> ScalaTypeMapper.protocolReadMethod(new StructType("User")))
                .isInstanceOf(MappingException.class)
                .hasMessageContaining("protocolReadMethod");
        assertThatThrownBy(() -> ScalaTypeMapper.protocolWriteMethod(new ListType(BaseType.I32)))
                .isInstanceOf(MappingException.class)
                .hasMessageContaining("protocolWriteMethod");
        assertThatThrownBy(() -> ScalaTypeMapper.protocolReadMethod(new EnumType("Color")))
                .isInstanceOf(MappingException.class);
        assertThatThrownBy(() -> ScalaTypeMapper.protocolReadMethod(BaseType.VOID))
                .isInstanceOf(MappingException.class);
    }

    @ParameterizedTest
    @CsvSource({
            "BOOL, false",
            "BYTE, 0",
            "I16, 0",
            "I32, 0",
            "I64, 0L",
            "DOUBLE, 0.0",
            "BINARY, ByteBuffer.allocate(0)"
    })
    void testZeroValues(BaseType type, String expected) {
        assertThat(ScalaTypeMapper.zeroValue(type)).isEqualTo(expected);
    }

    @Test
    void testStringZeroValueIsEmptyLiteral() {
        assertThat(ScalaTypeMapper.zeroValue(BaseType.STRING)).isEqualTo("\"\"");
    }

    @Test
    void testZeroValueRejectsComposites() {
        MappingException e = catchThrowableOfType(
                () -> ScalaTypeMapper.zeroValue(new SetType(BaseType.I32)), MappingException.class);

        assertThat(e.getMapping()).isEqualTo("zeroValue");
        assertThat(e.getSubject()).isEqualTo(new SetType(BaseType.I32));
    }

    @Test
    void testValueTypes() {
        assertThat(ScalaTypeMapper.isValueType(BaseType.I32)).isTrue();
        assertThat(ScalaTypeMapper.isValueType(BaseType.DOUBLE)).isTrue();
        assertThat(ScalaTypeMapper.isValueType(BaseType.STRING)).isFalse();
        assertThat(ScalaTypeMapper.isValueType(BaseType.BINARY)).isFalse();
        assertThat(ScalaTypeMapper.isValueType(new EnumType("Color"))).isFalse();
    }
}
