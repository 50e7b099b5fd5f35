package com.astwriter.core.writer.impl.solidity;

import com.astwriter.core.model.UncheckedBlock;
import com.astwriter.core.util.Versions;
import com.astwriter.core.writer.AstNodeWriter;
import com.astwriter.core.writer.AstWriter;
import com.astwriter.core.writer.SrcDesc;

/**
 * Writes {@code unchecked { ... }}.
 *
 * <p>Unchecked blocks exist since 0.8.0. Older versions never check arithmetic, so for
 * those targets the block is written as a plain block with the same meaning.
 */
public class UncheckedBlockWriter implements AstNodeWriter<UncheckedBlock> {

    static final String MIN_VERSION = "0.8.0";

    @Override
    public SrcDesc writeInner(UncheckedBlock node, AstWriter writer) {
        SrcDesc block = StatementBlocks.describe(node.statements(), writer);

        if (Versions.atLeast(writer.getTargetVersion(), MIN_VERSION)) {
            return SrcDesc.concat(SrcDesc.text("unchecked "), block);
        }
        return block;
    }
}
