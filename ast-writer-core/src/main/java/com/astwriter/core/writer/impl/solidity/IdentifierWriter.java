package com.astwriter.core.writer.impl.solidity;

import com.astwriter.core.model.Identifier;
import com.astwriter.core.writer.AstNodeWriter;
import com.astwriter.core.writer.AstWriter;
import com.astwriter.core.writer.SrcDesc;

public class IdentifierWriter implements AstNodeWriter<Identifier> {

    @Override
    public SrcDesc writeInner(Identifier node, AstWriter writer) {
        return writer.desc(node.name());
    }
}
