package com.astwriter.core.writer.impl.solidity;

import com.astwriter.core.model.Return;
import com.astwriter.core.writer.AstNodeWriter;
import com.astwriter.core.writer.AstWriter;
import com.astwriter.core.writer.SrcDesc;

/**
 * Writes {@code return x;} or {@code return;}. The semicolon is outside the statement's range.
 */
public class ReturnWriter implements AstNodeWriter<Return> {

    @Override
    public SrcDesc writeInner(Return node, AstWriter writer) {
        return writer.desc("return", node.expression() == null ? null : " ", node.expression());
    }

    @Override
    public SrcDesc writeWhole(Return node, AstWriter writer) {
        return SrcDesc.builder()
            .span(node, writeInner(node, writer))
            .text(";")
            .build();
    }
}
