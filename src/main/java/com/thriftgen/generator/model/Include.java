package com.thriftgen.generator.model;

import lombok.NonNull;
import lombok.Value;

/**
 * {@code include "path"}; carries the already-parsed included document.
 */
@Value
public final class Include implements Header {
    @NonNull
    String path;
    @NonNull
    Document document;
}
