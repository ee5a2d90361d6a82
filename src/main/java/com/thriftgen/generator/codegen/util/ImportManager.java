package com.thriftgen.generator.codegen.util;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Collects the namespaces a generated file has to import.
 * Keeps first-seen order, drops duplicates and the file's own namespace.
 */
public class ImportManager {

    private final Set<String> namespaces = new LinkedHashSet<>();
    private final String currentNamespace;

    public ImportManager(String currentNamespace) {
        this.currentNamespace = currentNamespace;
    }

    /**
     * Adds an imported namespace. Skips if empty or the current namespace.
     */
    public void addNamespace(String namespace) {
        if (namespace == null || namespace.isEmpty()) {
            return;
        }
        // Skip self-import
        if (namespace.equals(currentNamespace)) {
            return;
        }
        namespaces.add(namespace);
    }

    public void addNamespaces(Iterable<String> names) {
        for (String ns : names) {
            addNamespace(ns);
        }
    }

    public List<String> getNamespaces() {
        return new ArrayList<>(namespaces);
    }

    public boolean isEmpty() {
        return namespaces.isEmpty();
    }
}
