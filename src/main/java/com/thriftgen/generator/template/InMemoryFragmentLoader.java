package com.thriftgen.generator.template;

import java.nio.file.NoSuchFileException;
import java.util.Map;

/**
 * Serves fragment sources held in a map keyed by {@code prefix + name}.
 */
public class InMemoryFragmentLoader implements FragmentLoader {

    private final Map<String, String> sources;

    public InMemoryFragmentLoader(Map<String, String> sources) {
        this.sources = Map.copyOf(sources);
    }

    @Override
    public String load(String prefix, String name) throws NoSuchFileException {
        String source = sources.get(prefix + name);
        if (source == null) {
            throw new NoSuchFileException(prefix + name);
        }
        return source;
    }
}
