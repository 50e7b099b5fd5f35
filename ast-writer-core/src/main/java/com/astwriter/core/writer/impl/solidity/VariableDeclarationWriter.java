package com.astwriter.core.writer.impl.solidity;

import com.astwriter.core.model.VariableDeclaration;
import com.astwriter.core.writer.AstNodeWriter;
import com.astwriter.core.writer.AstWriter;
import com.astwriter.core.writer.SrcDesc;

/**
 * Writes {@code type [location] [name]}, e.g. {@code string memory s}.
 */
public class VariableDeclarationWriter implements AstNodeWriter<VariableDeclaration> {

    @Override
    public SrcDesc writeInner(VariableDeclaration node, AstWriter writer) {
        return writer.desc(
            node.typeName(),
            node.storageLocation() == null ? null : " " + node.storageLocation(),
            node.name().isEmpty() ? null : " " + node.name()
        );
    }
}
