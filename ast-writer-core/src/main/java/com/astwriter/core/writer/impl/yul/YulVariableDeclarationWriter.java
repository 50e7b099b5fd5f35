package com.astwriter.core.writer.impl.yul;

import com.astwriter.core.ast.IrNode;
import com.astwriter.core.writer.IrNodeWriter;
import com.astwriter.core.writer.IrWriter;

/**
 * Writes {@code let a, b := value}; the value is optional.
 */
public class YulVariableDeclarationWriter implements IrNodeWriter {

    @Override
    public String write(IrNode node, IrWriter writer) {
        String variables = writer.writeAll(node.nodes("variables"), ", ");

        return node.optionalNode("value")
            .map(value -> "let " + variables + " := " + writer.write(value))
            .orElse("let " + variables);
    }
}
