package com.thriftgen.generator.codegen.exception;

/**
 * A schema type or constant reached a mapping function that has no case for it.
 * The schema already passed validation, so this is a generator defect and aborts
 * generation of the document.
 */
public class MappingException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String mapping;
    private final transient Object subject;

    public MappingException(String mapping, Object subject) {
        super(mapping + "#" + subject);
        this.mapping = mapping;
        this.subject = subject;
    }

    /** Name of the mapping function that had no case, e.g. {@code protocolReadMethod}. */
    public String getMapping() {
        return mapping;
    }

    public Object getSubject() {
        return subject;
    }
}
