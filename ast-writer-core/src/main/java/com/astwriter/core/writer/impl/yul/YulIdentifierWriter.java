package com.astwriter.core.writer.impl.yul;

import com.astwriter.core.ast.IrNode;
import com.astwriter.core.writer.IrNodeWriter;
import com.astwriter.core.writer.IrWriter;

public class YulIdentifierWriter implements IrNodeWriter {

    @Override
    public String write(IrNode node, IrWriter writer) {
        return node.string("name");
    }
}
