package com.thriftgen.generator.template;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.NoSuchFileException;

/**
 * Loads fragments from classpath resources: {@code <prefix><name>.ftl}.
 */
public class ClasspathFragmentLoader implements FragmentLoader {

    private final ClassLoader classLoader;

    public ClasspathFragmentLoader() {
        this(ClasspathFragmentLoader.class.getClassLoader());
    }

    public ClasspathFragmentLoader(ClassLoader classLoader) {
        this.classLoader = classLoader;
    }

    @Override
    public String load(String prefix, String name) throws IOException {
        String resource = resourcePath(prefix, name);
        try (InputStream in = classLoader.getResourceAsStream(resource)) {
            if (in == null) {
                throw new NoSuchFileException("classpath:" + resource);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    static String resourcePath(String prefix, String name) {
        String path = prefix + name + EXTENSION;
        // ClassLoader resources never start with a slash
        return path.startsWith("/") ? path.substring(1) : path;
    }
}
