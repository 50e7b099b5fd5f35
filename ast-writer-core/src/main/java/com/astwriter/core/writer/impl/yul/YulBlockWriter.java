package com.astwriter.core.writer.impl.yul;

import com.astwriter.core.ast.IrNode;
import com.astwriter.core.writer.IrNodeWriter;
import com.astwriter.core.writer.IrWriter;

import java.util.List;

/**
 * Writes a Yul block, one statement per line.
 *
 * <p>Yul statements have no terminator, so a formatter without line breaks separates
 * them with a single space.
 */
public class YulBlockWriter implements IrNodeWriter {

    @Override
    public String write(IrNode node, IrWriter writer) {
        List<IrNode> statements = node.nodes("statements");
        if (statements.isEmpty()) {
            return "{ }";
        }

        String wrap = writer.getFormatter().renderWrap();
        if (wrap.isEmpty()) {
            return "{" + writer.nested().writeAll(statements, " ") + "}";
        }

        IrWriter inner = writer.nested();
        String innerIndent = inner.getFormatter().renderIndent();

        StringBuilder sb = new StringBuilder("{").append(wrap);
        for (IrNode statement : statements) {
            sb.append(innerIndent).append(inner.write(statement)).append(wrap);
        }
        return sb.append(writer.getFormatter().renderIndent()).append('}').toString();
    }
}
