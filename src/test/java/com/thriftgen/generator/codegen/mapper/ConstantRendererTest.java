package com.thriftgen.generator.codegen.mapper;

import com.thriftgen.generator.model.BoolConstant;
import com.thriftgen.generator.model.DoubleConstant;
import com.thriftgen.generator.model.EnumValueConstant;
import com.thriftgen.generator.model.IdentifierConstant;
import com.thriftgen.generator.model.IntConstant;
import com.thriftgen.generator.model.ListConstant;
import com.thriftgen.generator.model.MapConstant;
import com.thriftgen.generator.model.NullConstant;
import com.thriftgen.generator.model.StringConstant;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for ConstantRenderer.
 */
class ConstantRendererTest {

    @Test
    void testScalars() {
        assertThat(ConstantRenderer.render(NullConstant.INSTANCE)).isEqualTo("null");
        assertThat(ConstantRenderer.render(new BoolConstant(true))).isEqualTo("true");
        assertThat(ConstantRenderer.render(new BoolConstant(false))).isEqualTo("false");
        assertThat(ConstantRenderer.render(new IntConstant(42))).isEqualTo("42");
        assertThat(ConstantRenderer.render(new IntConstant(-7))).isEqualTo("-7");
        assertThat(ConstantRenderer.render(new DoubleConstant(1.5))).isEqualTo("1.5");
        assertThat(ConstantRenderer.render(new StringConstant("hello"))).isEqualTo("\"hello\"");
    }

    @Test
    void testIntegersOutsideIntRangeGetLongSuffix() {
        assertThat(ConstantRenderer.render(new IntConstant(10000000000L))).isEqualTo("10000000000L");
        assertThat(ConstantRenderer.render(new IntConstant(Long.MIN_VALUE))).isEqualTo("-9223372036854775808L");
        assertThat(ConstantRenderer.render(new IntConstant(Integer.MAX_VALUE))).isEqualTo("2147483647");
        assertThat(ConstantRenderer.render(new IntConstant(Integer.MIN_VALUE))).isEqualTo("-2147483648");
        assertThat(ConstantRenderer.render(new IntConstant(Integer.MAX_VALUE + 1L))).isEqualTo("2147483648L");
    }

    @Test
    void testListKeepsElementOrder() {
        ListConstant list = ListConstant.of(new IntConstant(1), new IntConstant(2));

        assertThat(ConstantRenderer.render(list)).isEqualTo("List(1, 2)");
        assertThat(ConstantRenderer.render(new ListConstant(List.of()))).isEqualTo("List()");
    }

    @Test
    void testMapRendersPairsWithArrows() {
        MapConstant map = new MapConstant(List.of(
                MapConstant.entry(new StringConstant("a"), new IntConstant(1))));

        assertThat(ConstantRenderer.render(map)).isEqualTo("Map(\"a\" -> 1)");
    }

    @Test
    void testNestedCollections() {
        MapConstant map = new MapConstant(List.of(
                MapConstant.entry(new StringConstant("evens"), ListConstant.of(new IntConstant(2), new IntConstant(4))),
                MapConstant.entry(new StringConstant("none"), ListConstant.of())));

        assertThat(ConstantRenderer.render(map))
                .isEqualTo("Map(\"evens\" -> List(2, 4), \"none\" -> List())");
    }

    @Test
    void testReferences() {
        assertThat(ConstantRenderer.render(new EnumValueConstant("Color", "Red"))).isEqualTo("Color.Red");
        assertThat(ConstantRenderer.render(new IdentifierConstant("MaxUsers"))).isEqualTo("MaxUsers");
    }

    @Test
    void testKeywordIdentifiersAreNotEscaped() {
        assertThat(ConstantRenderer.render(new IdentifierConstant("type"))).isEqualTo("type");
    }

    @Test
    void testEscapesQuotesBackslashesAndControlCharacters() {
        assertThat(ConstantRenderer.quote("say \"hi\"")).isEqualTo("\"say \\\"hi\\\"\"");
        assertThat(ConstantRenderer.escape("C:\\temp")).isEqualTo("C:\\\\temp");
        assertThat(ConstantRenderer.escape("a\nb\tc\r")).isEqualTo("a\\nb\\tc\\r");
        assertThat(ConstantRenderer.escape("\u0001")).isEqualTo("\\u0001");
        assertThat(ConstantRenderer.escape("\u007f")).isEqualTo("\\u007f");
    }

    @Test
    void testNonAsciiPassesThrough() {
        assertThat(ConstantRenderer.escape("caf\u00e9 \u65e5\u672c")).isEqualTo("caf\u00e9 \u65e5\u672c");
    }

    @ParameterizedTest
    @ValueSource(strings = {"plain", "quote\"inside", "back\\slash", "line\nbreak", "tab\tand\\\"both", "\u0000\b\f"})
    void testQuotedLiteralReadsBackToOriginal(String value) {
        String literal = ConstantRenderer.render(new StringConstant(value));

        assertThat(literal).startsWith("\"").endsWith("\"");
        assertThat(unquote(literal)).isEqualTo(value);
    }

    /** Reads a double-quoted literal the way the Scala lexer does. */
    private static String unquote(String literal) {
        String body = literal.substring(1, literal.length() - 1);
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < body.length(); i++) {
            char c = body.charAt(i);
            if (c == '"') {
                fail("unescaped quote in " + literal);
            }
            if (c != '\\') {
                sb.append(c);
                continue;
            }
            char next = body.charAt(++i);
            switch (next) {
                case 'n' -> sb.append('\n');
                case 'r' -> sb.append('\r');
                case 't' -> sb.append('\t');
                case 'b' -> sb.append('\b');
                case 'f' -> sb.append('\f');
                case '"' -> sb.append('"');
                case '\\' -> sb.append('\\');
                case 'u' -> {
                    sb.append((char) Integer.parseInt(body.substring(i + 1, i + 5), 16));
                    i += 4;
                }
                default -> fail("unknown escape \\" + next);
            }
        }
        return sb.toString();
    }
}
