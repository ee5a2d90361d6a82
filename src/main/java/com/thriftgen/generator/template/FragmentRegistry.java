package com.thriftgen.generator.template;

import java.io.IOException;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.thriftgen.generator.template.exception.TemplateBindingException;

/**
 * Compiled fragments for one generation session. Loaded once up front and immutable
 * afterwards, so one registry can serve concurrent generators.
 */
public final class FragmentRegistry {
    private static final Logger log = LoggerFactory.getLogger(FragmentRegistry.class);

    private final String prefix;
    private final Map<String, CompiledFragment> templates;

    private FragmentRegistry(String prefix, Map<String, CompiledFragment> templates) {
        this.prefix = prefix;
        this.templates = Map.copyOf(templates);
    }

    /**
     * Load and compile every named fragment.
     *
     * @throws IOException when the loader cannot supply a fragment
     * @throws com.thriftgen.generator.template.exception.TemplateSyntaxException
     *         when a fragment does not compile
     */
    public static FragmentRegistry load(FragmentLoader loader, String prefix, Collection<String> names)
            throws IOException {
        FragmentCompiler compiler = new FragmentCompiler();
        Map<String, CompiledFragment> compiled = new LinkedHashMap<>();
        for (String name : names) {
            compiled.put(name, compiler.compile(name, loader.load(prefix, name)));
        }
        log.info("Loaded {} fragments from {}", compiled.size(), prefix);
        return new FragmentRegistry(prefix, compiled);
    }

    public CompiledFragment template(String name) {
        CompiledFragment template = templates.get(name);
        if (template == null) {
            throw new TemplateBindingException(name, name,
                    "fragment was not loaded from " + prefix + " (loaded: " + templates.keySet() + ")");
        }
        return template;
    }

    /**
     * Bind a loaded fragment to the transform from its model to a dictionary.
     */
    public <M> Fragment<M> bind(String name, Function<M, Dictionary> unpacker) {
        return new Fragment<>(template(name), unpacker);
    }

    public Set<String> names() {
        return templates.keySet();
    }

    public String getPrefix() {
        return prefix;
    }
}
