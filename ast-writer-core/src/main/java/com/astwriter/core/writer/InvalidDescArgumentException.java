package com.astwriter.core.writer;

import com.astwriter.core.util.DebugDump;

/**
 * Thrown when {@link AstWriter#desc(Object...)} receives an argument that is neither
 * {@code null}, a {@link String} nor an {@link com.astwriter.core.ast.AstNode}.
 */
public class InvalidDescArgumentException extends WriterException {

    private final String argumentType;
    private final String diagnostic;

    public InvalidDescArgumentException(Object argument) {
        this(argument.getClass().getName(), DebugDump.toJson(argument));
    }

    private InvalidDescArgumentException(String argumentType, String diagnostic) {
        super("Expected null, a String or an AstNode but got " + argumentType + ":\n" + diagnostic);
        this.argumentType = argumentType;
        this.diagnostic = diagnostic;
    }

    public String getArgumentType() {
        return argumentType;
    }

    public String getDiagnostic() {
        return diagnostic;
    }
}
