package com.astwriter.core.writer.impl.yul;

import com.astwriter.core.ast.IrNode;
import com.astwriter.core.writer.IrNodeWriter;
import com.astwriter.core.writer.IrWriter;

/**
 * Writes a name, with a {@code :type} suffix when a non-empty type is given.
 */
public class YulTypedNameWriter implements IrNodeWriter {

    @Override
    public String write(IrNode node, IrWriter writer) {
        Object type = node.data().get("type");
        if (type == null || type.toString().isEmpty()) {
            return node.string("name");
        }
        return node.string("name") + ":" + type;
    }
}
