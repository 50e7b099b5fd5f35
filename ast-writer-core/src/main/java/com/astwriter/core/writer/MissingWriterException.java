package com.astwriter.core.writer;

import com.astwriter.core.ast.AstNode;
import com.astwriter.core.ast.IrNode;

/**
 * Thrown when no writer is registered for the type of a node being rendered.
 *
 * <p>Carries the node type and a dump of the offending node so the gap in the mapping can
 * be found: {@link AstNode#print()} for structured nodes, {@link IrNode#dump()} for IR nodes.
 */
public class MissingWriterException extends WriterException {

    private final String nodeType;
    private final String diagnostic;

    public MissingWriterException(String message, String nodeType, String diagnostic) {
        super(message);
        this.nodeType = nodeType;
        this.diagnostic = diagnostic;
    }

    /**
     * Creates the exception for a structured node without a registered writer.
     *
     * @param node offending node
     * @return new exception
     */
    public static MissingWriterException forAstNode(AstNode node) {
        String dump = node.print();
        return new MissingWriterException(
            "Unable to find writer for AST node " + node.getClass().getName() + ":\n" + dump,
            node.nodeType(),
            dump
        );
    }

    /**
     * Creates the exception for an IR node without a registered writer.
     *
     * @param node offending node
     * @return new exception
     */
    public static MissingWriterException forIrNode(IrNode node) {
        String dump = node.dump();
        return new MissingWriterException(
            "Unable to find writer for IR node " + node.nodeType() + ":\n" + dump,
            node.nodeType(),
            dump
        );
    }

    public String getNodeType() {
        return nodeType;
    }

    public String getDiagnostic() {
        return diagnostic;
    }
}
