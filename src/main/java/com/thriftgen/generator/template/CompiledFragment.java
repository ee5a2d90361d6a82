package com.thriftgen.generator.template;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.io.Writer;

import com.thriftgen.generator.template.exception.TemplateBindingException;

import freemarker.core.InvalidReferenceException;
import freemarker.template.Template;
import freemarker.template.TemplateException;
import freemarker.template.TemplateHashModel;
import lombok.Getter;

/**
 * A compiled fragment. Immutable and safe to share between threads.
 */
public final class CompiledFragment {

    @Getter
    private final String name;
    private final Template template;

    CompiledFragment(String name, Template template) {
        this.name = name;
        this.template = template;
    }

    /**
     * Substitute {@code dictionary} into this fragment.
     *
     * @throws TemplateBindingException when a key the fragment uses is missing or has
     *         the wrong shape
     */
    public String render(Dictionary dictionary) {
        StringWriter out = new StringWriter();
        try {
            renderTo(new DictionaryModel(dictionary), out);
        } catch (TemplateException e) {
            throw bindingError(e);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to render fragment '" + name + "'", e);
        }
        return out.toString();
    }

    void renderTo(TemplateHashModel model, Writer out) throws TemplateException, IOException {
        template.process(model, out);
    }

    private TemplateBindingException bindingError(TemplateException e) {
        // errors raised inside an included partial carry the partial's name
        String fragmentName = e.getTemplateSourceName() != null ? e.getTemplateSourceName() : name;
        String key = e.getBlamedExpressionString() != null ? e.getBlamedExpressionString() : "";
        String reason = e instanceof InvalidReferenceException
                ? "undefined key"
                : firstLine(e.getMessageWithoutStackTop());
        if (e.getLineNumber() != null) {
            reason += " (line " + e.getLineNumber() + ")";
        }
        return new TemplateBindingException(fragmentName, key, reason, e);
    }

    private static String firstLine(String message) {
        int end = message.indexOf('\n');
        return end < 0 ? message : message.substring(0, end);
    }

    @Override
    public String toString() {
        return "CompiledFragment(" + name + ")";
    }
}
