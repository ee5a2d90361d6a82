package com.thriftgen.generator.template;

import java.util.List;

import freemarker.template.SimpleScalar;
import freemarker.template.TemplateBooleanModel;
import freemarker.template.TemplateHashModel;
import freemarker.template.TemplateModel;
import freemarker.template.TemplateModelException;
import freemarker.template.TemplateSequenceModel;

/**
 * Exposes a {@link Dictionary} to FreeMarker. Each value keeps its shape: a scalar only
 * interpolates, a flag only tests, a sequence only lists, so a fragment that uses a key
 * the wrong way fails instead of printing something plausible.
 *
 * <p>Keys missing here are looked up in {@code outer}, when there is one. A partial
 * renders with the includer's data model as its outer scope.
 */
final class DictionaryModel implements TemplateHashModel {

    private final Dictionary dictionary;
    private final TemplateHashModel outer;

    DictionaryModel(Dictionary dictionary) {
        this(dictionary, null);
    }

    DictionaryModel(Dictionary dictionary, TemplateHashModel outer) {
        this.dictionary = dictionary;
        this.outer = outer;
    }

    Dictionary dictionary() {
        return dictionary;
    }

    @Override
    public TemplateModel get(String key) throws TemplateModelException {
        var value = dictionary.get(key);
        if (value.isPresent()) {
            return wrap(value.get());
        }
        return outer != null ? outer.get(key) : null;
    }

    @Override
    public boolean isEmpty() {
        return dictionary.keys().isEmpty();
    }

    private static TemplateModel wrap(DictionaryValue value) {
        if (value instanceof DictionaryValue.Scalar scalar) {
            return new SimpleScalar(scalar.text());
        } else if (value instanceof DictionaryValue.Flag flag) {
            return flag.value() ? TemplateBooleanModel.TRUE : TemplateBooleanModel.FALSE;
        } else if (value instanceof DictionaryValue.Nested nested) {
            return new DictionaryModel(nested.dictionary());
        } else if (value instanceof DictionaryValue.Items items) {
            return new ItemsModel(items.items());
        } else if (value instanceof DictionaryValue.Partial partial) {
            return new PartialDirective(partial.fragment());
        }
        throw new IllegalStateException("Unhandled dictionary value " + value);
    }

    private static final class ItemsModel implements TemplateSequenceModel {

        private final List<Dictionary> items;

        private ItemsModel(List<Dictionary> items) {
            this.items = items;
        }

        @Override
        public TemplateModel get(int index) {
            return index >= 0 && index < items.size() ? new DictionaryModel(items.get(index)) : null;
        }

        @Override
        public int size() {
            return items.size();
        }
    }
}
