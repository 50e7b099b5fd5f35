package com.astwriter.core.writer.impl.solidity;

import com.astwriter.core.model.Block;
import com.astwriter.core.writer.AstNodeWriter;
import com.astwriter.core.writer.AstWriter;
import com.astwriter.core.writer.SrcDesc;

/**
 * Writes a braced block, one statement per line.
 */
public class BlockWriter implements AstNodeWriter<Block> {

    @Override
    public SrcDesc writeInner(Block node, AstWriter writer) {
        return StatementBlocks.describe(node.statements(), writer);
    }
}
