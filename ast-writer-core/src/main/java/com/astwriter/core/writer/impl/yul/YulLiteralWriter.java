package com.astwriter.core.writer.impl.yul;

import com.astwriter.core.ast.IrNode;
import com.astwriter.core.util.StringLiterals;
import com.astwriter.core.writer.IrNodeWriter;
import com.astwriter.core.writer.IrWriter;

/**
 * Writes literals: {@code kind} "string" is double-quoted with escapes, anything else
 * (number, bool) is written as is.
 */
public class YulLiteralWriter implements IrNodeWriter {

    static final String STRING_KIND = "string";

    @Override
    public String write(IrNode node, IrWriter writer) {
        String value = node.string("value");
        if (STRING_KIND.equals(node.data().get("kind"))) {
            return StringLiterals.quote(value);
        }
        return value;
    }
}
