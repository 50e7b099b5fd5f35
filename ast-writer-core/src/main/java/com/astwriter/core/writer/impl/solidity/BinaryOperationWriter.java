package com.astwriter.core.writer.impl.solidity;

import com.astwriter.core.model.BinaryOperation;
import com.astwriter.core.writer.AstNodeWriter;
import com.astwriter.core.writer.AstWriter;
import com.astwriter.core.writer.SrcDesc;

public class BinaryOperationWriter implements AstNodeWriter<BinaryOperation> {

    @Override
    public SrcDesc writeInner(BinaryOperation node, AstWriter writer) {
        return writer.desc(node.leftExpression(), " " + node.operator() + " ", node.rightExpression());
    }
}
