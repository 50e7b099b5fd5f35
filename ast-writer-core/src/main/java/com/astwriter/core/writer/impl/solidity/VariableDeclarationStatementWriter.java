package com.astwriter.core.writer.impl.solidity;

import com.astwriter.core.model.VariableDeclarationStatement;
import com.astwriter.core.writer.AstNodeWriter;
import com.astwriter.core.writer.AstWriter;
import com.astwriter.core.writer.SrcDesc;

/**
 * Writes {@code uint256 a = 1;}. The semicolon is outside the statement's range.
 */
public class VariableDeclarationStatementWriter implements AstNodeWriter<VariableDeclarationStatement> {

    @Override
    public SrcDesc writeInner(VariableDeclarationStatement node, AstWriter writer) {
        return writer.desc(
            node.declaration(),
            node.initialValue() == null ? null : " = ",
            node.initialValue()
        );
    }

    @Override
    public SrcDesc writeWhole(VariableDeclarationStatement node, AstWriter writer) {
        return SrcDesc.builder()
            .span(node, writeInner(node, writer))
            .text(";")
            .build();
    }
}
