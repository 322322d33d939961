package com.mainframe.migration.codegen.template;

/**
 * Raised when a source template cannot be loaded or processed.
 */
public class TemplateRenderingException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public TemplateRenderingException(String message, Throwable cause) {
        super(message, cause);
    }
}
