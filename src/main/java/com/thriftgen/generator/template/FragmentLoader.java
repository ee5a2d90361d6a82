package com.thriftgen.generator.template;

import java.io.IOException;

/**
 * Supplies raw fragment source by prefix and name. Where the text lives is up to the
 * implementation; the engine only compiles what it is given.
 */
public interface FragmentLoader {

    /** File extension shared by every loader that reads named files. */
    String EXTENSION = ".ftl";

    /**
     * @param prefix namespace or path prefix, e.g. {@code /scalagen/}
     * @param name   fragment name without extension, e.g. {@code struct}
     * @throws java.nio.file.NoSuchFileException when no such fragment exists
     */
    String load(String prefix, String name) throws IOException;
}
