package com.astwriter.core.writer;

/**
 * Base exception for failures while rendering a tree.
 *
 * <p>Render failures are programming or configuration errors (an incomplete writer mapping,
 * a writer passing garbage to {@link AstWriter#desc(Object...)}), never expected runtime
 * conditions. A failed render produces no output and leaves the caller's source map untouched.
 */
public class WriterException extends RuntimeException {

    public WriterException(String message) {
        super(message);
    }

    public WriterException(String message, Throwable cause) {
        super(message, cause);
    }
}
