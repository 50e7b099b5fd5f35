package com.astwriter.core.writer.impl.solidity;

import com.astwriter.core.model.Literal;
import com.astwriter.core.util.StringLiterals;
import com.astwriter.core.writer.AstNodeWriter;
import com.astwriter.core.writer.AstWriter;
import com.astwriter.core.writer.SrcDesc;

/**
 * Writes literals. Numbers and booleans are written as is, strings are double-quoted with
 * escapes, unicode strings as {@code unicode"..."} and hex strings as {@code hex"..."}.
 */
public class LiteralWriter implements AstNodeWriter<Literal> {

    @Override
    public SrcDesc writeInner(Literal node, AstWriter writer) {
        String text = switch (node.kind()) {
            case NUMBER, BOOL -> node.value();
            case STRING -> StringLiterals.quote(node.value());
            case UNICODE_STRING -> "unicode" + StringLiterals.quote(node.value());
            case HEX_STRING -> "hex\"" + node.value() + "\"";
        };
        return writer.desc(text);
    }
}
