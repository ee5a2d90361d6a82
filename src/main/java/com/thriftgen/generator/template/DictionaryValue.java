package com.thriftgen.generator.template;

import java.util.List;
import java.util.Objects;

/**
 * The shapes a dictionary entry can take. Each fragment construct accepts only some
 * shapes; rendering reports any other combination as a binding error.
 */
public sealed interface DictionaryValue
        permits DictionaryValue.Scalar, DictionaryValue.Flag, DictionaryValue.Nested,
                DictionaryValue.Items, DictionaryValue.Partial {

    /** Human-readable shape name used in binding error messages. */
    String shape();

    /** Text interpolated by {@code ${key}}. */
    record Scalar(String text) implements DictionaryValue {
        public Scalar {
            Objects.requireNonNull(text, "text");
        }

        @Override
        public String shape() {
            return "scalar";
        }
    }

    /** Condition for {@code <#if key>}. */
    record Flag(boolean value) implements DictionaryValue {
        @Override
        public String shape() {
            return "boolean";
        }
    }

    /** A single nested dictionary, reached as {@code key.inner} or passed to a partial. */
    record Nested(Dictionary dictionary) implements DictionaryValue {
        public Nested {
            Objects.requireNonNull(dictionary, "dictionary");
        }

        @Override
        public String shape() {
            return "dictionary";
        }
    }

    /** Ordered sequence for {@code <#list key as item>}. */
    record Items(List<Dictionary> items) implements DictionaryValue {
        public Items {
            items = List.copyOf(items);
        }

        @Override
        public String shape() {
            return "sequence";
        }
    }

    /** A compiled fragment called as {@code <@key model=item/>}. */
    record Partial(CompiledFragment fragment) implements DictionaryValue {
        public Partial {
            Objects.requireNonNull(fragment, "fragment");
        }

        @Override
        public String shape() {
            return "partial";
        }
    }
}
