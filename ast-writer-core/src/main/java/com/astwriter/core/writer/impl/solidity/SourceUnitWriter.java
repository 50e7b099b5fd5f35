package com.astwriter.core.writer.impl.solidity;

import com.astwriter.core.ast.AstNode;
import com.astwriter.core.model.SourceUnit;
import com.astwriter.core.writer.AstNodeWriter;
import com.astwriter.core.writer.AstWriter;
import com.astwriter.core.writer.SrcDesc;

/**
 * Writes a source unit: top-level nodes separated by an empty line.
 */
public class SourceUnitWriter implements AstNodeWriter<SourceUnit> {

    @Override
    public SrcDesc writeInner(SourceUnit node, AstWriter writer) {
        String wrap = writer.getFormatter().renderWrap();
        String indent = writer.getFormatter().renderIndent();

        SrcDesc.Builder builder = SrcDesc.builder();
        boolean first = true;
        for (AstNode child : node.nodes()) {
            if (!first) {
                builder.text(wrap + wrap);
            }
            builder.text(indent).append(writer.desc(child));
            first = false;
        }
        return builder.build();
    }
}
