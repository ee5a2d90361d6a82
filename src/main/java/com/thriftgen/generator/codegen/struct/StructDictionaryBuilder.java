package com.thriftgen.generator.codegen.struct;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.thriftgen.generator.codegen.field.FieldDescriptor;
import com.thriftgen.generator.codegen.field.FieldDescriptorBuilder;
import com.thriftgen.generator.codegen.mapper.ScalaTypeMapper;
import com.thriftgen.generator.codegen.serde.ProtocolExpressions;
import com.thriftgen.generator.model.Field;
import com.thriftgen.generator.model.StructDef;
import com.thriftgen.generator.model.StructKind;
import com.thriftgen.generator.template.Dictionary;

/**
 * Builds the {@code struct} fragment's dictionary: the case class parameter list plus
 * one entry per field with its wire descriptor and read/write code.
 */
public class StructDictionaryBuilder {
    private static final Logger log = LoggerFactory.getLogger(StructDictionaryBuilder.class);

    /** Local bound to the present value of an optional field while writing it. */
    static final String OPTIONAL_VALUE = "_value";

    public Dictionary build(StructDef struct) {
        log.debug("Building struct dictionary for {} ({} fields)", struct.getName(), struct.getFields().size());

        List<Dictionary> fields = struct.getFields().stream()
                .map(this::field)
                .toList();

        return Dictionary.builder()
                .put("name", struct.getName())
                .put("isException", struct.getKind() == StructKind.EXCEPTION)
                .put("isUnion", struct.getKind() == StructKind.UNION)
                .put("fieldArgs", FieldDescriptorBuilder.formatParams(struct.getFields()))
                .put("hasFields", !fields.isEmpty())
                .put("fields", fields)
                .build();
    }

    /**
     * Dictionary for one field. Also used for function arguments and declared exceptions.
     */
    public Dictionary field(Field field) {
        FieldDescriptor descriptor = FieldDescriptorBuilder.describe(field);
        return Dictionary.builder()
                .put("name", field.getName())
                .put("quotedName", descriptor.getQuotedName())
                .put("id", Integer.toString(field.getId()))
                .put("fieldConst", descriptor.getFieldConst())
                .put("wireTag", ScalaTypeMapper.wireTag(field.getType()).name())
                .put("valueType", descriptor.getValueType())
                .put("fieldType", descriptor.getDeclaredType())
                .put("parameter", descriptor.toParameter())
                .put("optional", field.isOptional())
                .put("nullable", !ScalaTypeMapper.isValueType(field.getType()))
                .put("hasDefault", descriptor.getDefaultExpression().isPresent())
                .put("defaultValue", descriptor.getDefaultExpression().orElse(""))
                .put("readDefault", descriptor.getReadDefault())
                .put("readValue", ProtocolExpressions.readExpression(field.getType()))
                .put("writeValue", ProtocolExpressions.writeStatement(field.getType(), descriptor.getQuotedName()))
                .put("writeOptionalValue", ProtocolExpressions.writeStatement(field.getType(), OPTIONAL_VALUE))
                .build();
    }
}
