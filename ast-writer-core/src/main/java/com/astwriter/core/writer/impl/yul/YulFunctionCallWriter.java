package com.astwriter.core.writer.impl.yul;

import com.astwriter.core.ast.IrNode;
import com.astwriter.core.writer.IrNodeWriter;
import com.astwriter.core.writer.IrWriter;

/**
 * Writes {@code name(arg1, arg2)}.
 */
public class YulFunctionCallWriter implements IrNodeWriter {

    @Override
    public String write(IrNode node, IrWriter writer) {
        return writer.write(node.node("functionName")) + "(" + writer.writeAll(node.nodes("arguments"), ", ") + ")";
    }
}
