package com.astwriter.core.writer.impl.solidity;

import com.astwriter.core.model.Assignment;
import com.astwriter.core.writer.AstNodeWriter;
import com.astwriter.core.writer.AstWriter;
import com.astwriter.core.writer.SrcDesc;

public class AssignmentWriter implements AstNodeWriter<Assignment> {

    @Override
    public SrcDesc writeInner(Assignment node, AstWriter writer) {
        return writer.desc(node.leftHandSide(), " " + node.operator() + " ", node.rightHandSide());
    }
}
