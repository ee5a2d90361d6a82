package com.thriftgen.generator.model;

import java.util.List;
import java.util.Optional;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class ServiceDef {
    @NonNull
    String name;

    /** Name of the extended service, if any. */
    String parent;

    @Singular
    List<FunctionDef> functions;

    public Optional<String> getParent() {
        return Optional.ofNullable(parent);
    }
}
