package com.astwriter.core.writer.impl.solidity;

import com.astwriter.core.model.ExpressionStatement;
import com.astwriter.core.writer.AstNodeWriter;
import com.astwriter.core.writer.AstWriter;
import com.astwriter.core.writer.SrcDesc;

/**
 * Writes an expression followed by {@code ;}. The semicolon is outside the statement's range.
 */
public class ExpressionStatementWriter implements AstNodeWriter<ExpressionStatement> {

    @Override
    public SrcDesc writeInner(ExpressionStatement node, AstWriter writer) {
        return writer.desc(node.expression());
    }

    @Override
    public SrcDesc writeWhole(ExpressionStatement node, AstWriter writer) {
        return SrcDesc.builder()
            .span(node, writeInner(node, writer))
            .text(";")
            .build();
    }
}
