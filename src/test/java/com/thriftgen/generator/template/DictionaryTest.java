package com.thriftgen.generator.template;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for Dictionary.
 */
class DictionaryTest {

    @Test
    void testTypedAccessors() {
        Dictionary item = Dictionary.builder().put("n", "1").build();
        Dictionary dict = Dictionary.builder()
                .put("name", "User")
                .put("hasFields", true)
                .put("fields", List.of(item))
                .build();

        assertThat(dict.scalar("name")).contains("User");
        assertThat(dict.flag("hasFields")).contains(true);
        assertThat(dict.items("fields")).contains(List.of(item));
        assertThat(dict.scalar("fields")).isEmpty();
        assertThat(dict.get("absent")).isEmpty();
        assertThat(dict.keys()).containsExactly("name", "hasFields", "fields");
    }

    @Test
    void testPutAllOverwrites() {
        Dictionary base = Dictionary.builder().put("a", "1").put("b", "2").build();

        Dictionary merged = Dictionary.builder().putAll(base).put("b", "3").build();

        assertThat(merged.scalar("a")).contains("1");
        assertThat(merged.scalar("b")).contains("3");
        assertThat(base.scalar("b")).contains("2");
    }

    @Test
    void testRejectsEmptyKeysAndNullValues() {
        assertThatThrownBy(() -> Dictionary.builder().put("", "x"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Dictionary.builder().put("k", (DictionaryValue) null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("'k'");
    }

    @Test
    void testBuiltDictionaryIsImmutable() {
        Dictionary.Builder builder = Dictionary.builder().put("a", "1");
        Dictionary first = builder.build();

        builder.put("b", "2");

        assertThat(first.keys()).containsExactly("a");
        assertThatThrownBy(() -> first.keys().add("c")).isInstanceOf(UnsupportedOperationException.class);
    }
}
