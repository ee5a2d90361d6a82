package com.thriftgen.generator.template.exception;

/**
 * The dictionary handed to a fragment does not match what the fragment source expects:
 * a key is missing, or its value has the wrong shape for the tag that uses it.
 */
public class TemplateBindingException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String fragmentName;
    private final String key;

    public TemplateBindingException(String fragmentName, String key, String message) {
        this(fragmentName, key, message, null);
    }

    public TemplateBindingException(String fragmentName, String key, String message, Throwable cause) {
        super("Fragment '" + fragmentName + "', key '" + key + "': " + message, cause);
        this.fragmentName = fragmentName;
        this.key = key;
    }

    public String getFragmentName() {
        return fragmentName;
    }

    public String getKey() {
        return key;
    }
}
