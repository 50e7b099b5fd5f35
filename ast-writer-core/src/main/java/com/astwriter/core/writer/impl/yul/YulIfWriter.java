package com.astwriter.core.writer.impl.yul;

import com.astwriter.core.ast.IrNode;
import com.astwriter.core.writer.IrNodeWriter;
import com.astwriter.core.writer.IrWriter;

/**
 * Writes {@code if condition { ... }}.
 */
public class YulIfWriter implements IrNodeWriter {

    @Override
    public String write(IrNode node, IrWriter writer) {
        return "if " + writer.write(node.node("condition")) + " " + writer.write(node.node("body"));
    }
}
