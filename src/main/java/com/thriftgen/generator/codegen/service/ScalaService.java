package com.thriftgen.generator.codegen.service;

import java.util.Set;

import com.thriftgen.generator.codegen.ServiceOption;
import com.thriftgen.generator.model.ServiceDef;

import lombok.NonNull;
import lombok.Value;

/**
 * A service together with the extras to generate for it.
 */
@Value
public class ScalaService {
    @NonNull
    ServiceDef service;
    @NonNull
    Set<ServiceOption> options;

    public boolean has(ServiceOption option) {
        return options.contains(option);
    }
}
