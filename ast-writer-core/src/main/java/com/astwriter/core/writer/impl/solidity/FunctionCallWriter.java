package com.astwriter.core.writer.impl.solidity;

import com.astwriter.core.model.FunctionCall;
import com.astwriter.core.writer.AstNodeWriter;
import com.astwriter.core.writer.AstWriter;
import com.astwriter.core.writer.SrcDesc;

/**
 * Writes {@code callee(arg1, arg2)}.
 */
public class FunctionCallWriter implements AstNodeWriter<FunctionCall> {

    @Override
    public SrcDesc writeInner(FunctionCall node, AstWriter writer) {
        return SrcDesc.builder()
            .append(writer.desc(node.expression(), "("))
            .append(writer.join(node.arguments(), ", "))
            .text(")")
            .build();
    }
}
