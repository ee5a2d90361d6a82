package com.thriftgen.generator.template.exception;

/**
 * Fragment source that FreeMarker cannot parse.
 */
public class TemplateSyntaxException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String fragmentName;
    private final int line;

    public TemplateSyntaxException(String fragmentName, int line, String message, Throwable cause) {
        super("Fragment '" + fragmentName + "' line " + line + ": " + message, cause);
        this.fragmentName = fragmentName;
        this.line = line;
    }

    public String getFragmentName() {
        return fragmentName;
    }

    public int getLine() {
        return line;
    }
}
