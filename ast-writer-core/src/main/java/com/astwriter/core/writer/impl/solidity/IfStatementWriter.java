package com.astwriter.core.writer.impl.solidity;

import com.astwriter.core.model.IfStatement;
import com.astwriter.core.writer.AstNodeWriter;
import com.astwriter.core.writer.AstWriter;
import com.astwriter.core.writer.SrcDesc;

/**
 * Writes {@code if (condition) trueBody [else falseBody]}.
 */
public class IfStatementWriter implements AstNodeWriter<IfStatement> {

    @Override
    public SrcDesc writeInner(IfStatement node, AstWriter writer) {
        return writer.desc(
            "if (", node.condition(), ") ", node.trueBody(),
            node.falseBody() == null ? null : " else ",
            node.falseBody()
        );
    }
}
