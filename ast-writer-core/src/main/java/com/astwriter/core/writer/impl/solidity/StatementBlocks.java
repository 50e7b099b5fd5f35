package com.astwriter.core.writer.impl.solidity;

import com.astwriter.core.ast.AstNode;
import com.astwriter.core.format.SourceFormatter;
import com.astwriter.core.writer.AstWriter;
import com.astwriter.core.writer.SrcDesc;

import java.util.List;

/**
 * Shared layout of braced statement lists: one indented statement per line.
 */
final class StatementBlocks {

    private StatementBlocks() {
        // Utility class
    }

    /**
     * Describes {@code statements} as a braced block.
     *
     * <p>With a pretty formatter:
     * <pre>
     * {
     *     a = 1;
     *     return a;
     * }
     * </pre>
     * An empty list yields {@code {}}.
     *
     * @param statements statements in order
     * @param writer writer at the block's own nesting level
     * @return block description
     */
    static SrcDesc describe(List<AstNode> statements, AstWriter writer) {
        if (statements.isEmpty()) {
            return SrcDesc.text("{}");
        }

        SourceFormatter formatter = writer.getFormatter();
        AstWriter inner = writer.nested();
        String wrap = formatter.renderWrap();
        String innerIndent = inner.getFormatter().renderIndent();

        SrcDesc.Builder builder = SrcDesc.builder().text("{" + wrap);
        for (AstNode statement : statements) {
            builder.text(innerIndent)
                .append(inner.desc(statement))
                .text(wrap);
        }
        return builder.text(formatter.renderIndent() + "}").build();
    }
}
