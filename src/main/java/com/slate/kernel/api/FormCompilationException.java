package com.slate.kernel.api;

/**
 * Raised by a {@link TerminalFormCompiler} when a terminal tensor cannot be
 * lowered to a subkernel (for example an unsupported element).
 *
 * <p>
 * Compilation of a given terminal is deterministic, so callers never retry on
 * this exception; it is propagated unchanged to whoever asked for the context
 * kernels.
 */
public class FormCompilationException extends RuntimeException {
    private final String formName;

    public FormCompilationException(String formName, String message) {
        super("Failed to compile form '" + formName + "': " + message);
        this.formName = formName;
    }

    public FormCompilationException(String formName, String message, Throwable cause) {
        super("Failed to compile form '" + formName + "': " + message, cause);
        this.formName = formName;
    }

    public String formName() {
        return formName;
    }
}
