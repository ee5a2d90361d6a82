package com.thriftgen.generator.codegen;

/**
 * Optional extras generated alongside every service.
 */
public enum ServiceOption {
    WITH_FINAGLE_CLIENT("withFinagleClient"),
    WITH_FINAGLE_SERVICE("withFinagleService"),
    WITH_OSTRICH_SERVER("withOstrichServer");

    private final String dictionaryKey;

    ServiceOption(String dictionaryKey) {
        this.dictionaryKey = dictionaryKey;
    }

    /** Boolean key that gates this option's section in the service fragment. */
    public String getDictionaryKey() {
        return dictionaryKey;
    }
}
