package com.thriftgen.generator.codegen.mapper;

import java.util.stream.Collectors;

import com.thriftgen.generator.model.BoolConstant;
import com.thriftgen.generator.model.Constant;
import com.thriftgen.generator.model.ConstantVisitor;
import com.thriftgen.generator.model.DoubleConstant;
import com.thriftgen.generator.model.EnumValueConstant;
import com.thriftgen.generator.model.IdentifierConstant;
import com.thriftgen.generator.model.IntConstant;
import com.thriftgen.generator.model.ListConstant;
import com.thriftgen.generator.model.MapConstant;
import com.thriftgen.generator.model.NullConstant;
import com.thriftgen.generator.model.StringConstant;

import lombok.experimental.UtilityClass;

/**
 * Renders constant values as Scala literals.
 *
 * <p>Names are emitted as written: identifiers that collide with Scala keywords are
 * not escaped here.
 */
@UtilityClass
public class ConstantRenderer {

    private static final ConstantVisitor<String> RENDERER = new ConstantVisitor<>() {
        @Override
        public String visit(NullConstant constant) {
            return "null";
        }

        @Override
        public String visit(BoolConstant constant) {
            return Boolean.toString(constant.isValue());
        }

        @Override
        public String visit(IntConstant constant) {
            long value = constant.getValue();
            // Scala reads an unsuffixed literal as Int
            boolean fitsInt = value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE;
            return fitsInt ? Long.toString(value) : value + "L";
        }

        @Override
        public String visit(DoubleConstant constant) {
            return Double.toString(constant.getValue());
        }

        @Override
        public String visit(StringConstant constant) {
            return quote(constant.getValue());
        }

        @Override
        public String visit(ListConstant constant) {
            return constant.getElements().stream()
                    .map(ConstantRenderer::render)
                    .collect(Collectors.joining(", ", "List(", ")"));
        }

        @Override
        public String visit(MapConstant constant) {
            return constant.getEntries().stream()
                    .map(e -> render(e.getKey()) + " -> " + render(e.getValue()))
                    .collect(Collectors.joining(", ", "Map(", ")"));
        }

        @Override
        public String visit(EnumValueConstant constant) {
            return constant.getEnumName() + "." + constant.getValueName();
        }

        @Override
        public String visit(IdentifierConstant constant) {
            return constant.getName();
        }
    };

    public String render(Constant constant) {
        return constant.accept(RENDERER);
    }

    /**
     * Double-quoted string literal with C-style escapes.
     */
    public String quote(String value) {
        return "\"" + escape(value) + "\"";
    }

    public String escape(String value) {
        StringBuilder sb = new StringBuilder(value.length() + 8);
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                case '\b' -> sb.append("\\b");
                case '\f' -> sb.append("\\f");
                default -> {
                    if (c < 0x20 || c == 0x7f) {
                        sb.append(String.format("\\u%04x", (int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        return sb.toString();
    }
}
