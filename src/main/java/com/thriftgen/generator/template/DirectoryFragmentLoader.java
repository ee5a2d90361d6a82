package com.thriftgen.generator.template;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Loads fragments from files below a root directory: {@code <root>/<prefix>/<name>.ftl}.
 */
public class DirectoryFragmentLoader implements FragmentLoader {

    private final Path root;

    public DirectoryFragmentLoader(Path root) {
        this.root = Objects.requireNonNull(root, "root");
    }

    @Override
    public String load(String prefix, String name) throws IOException {
        return Files.readString(directory(prefix).resolve(name + EXTENSION));
    }

    /**
     * Names of all fragments under {@code prefix}, sorted.
     */
    public List<String> fragmentNames(String prefix) throws IOException {
        try (Stream<Path> files = Files.list(directory(prefix))) {
            return files.filter(Files::isRegularFile)
                    .map(p -> p.getFileName().toString())
                    .filter(f -> f.endsWith(EXTENSION))
                    .map(f -> f.substring(0, f.length() - EXTENSION.length()))
                    .sorted()
                    .toList();
        }
    }

    private Path directory(String prefix) {
        String relative = prefix.replaceAll("^/+", "");
        return relative.isEmpty() ? root : root.resolve(relative);
    }
}
