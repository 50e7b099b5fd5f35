package com.astwriter.core.writer.impl.solidity;

import com.astwriter.core.model.PragmaDirective;
import com.astwriter.core.writer.AstNodeWriter;
import com.astwriter.core.writer.AstWriter;
import com.astwriter.core.writer.SrcDesc;

import java.util.List;

/**
 * Writes {@code pragma solidity ^0.8.0;}. The terminating semicolon is outside the
 * directive's range.
 *
 * <p>The first literal names the pragma; the remaining tokens are concatenated without
 * spaces, so {@code ["solidity", "^", "0.8", ".0"]} becomes {@code solidity ^0.8.0}.
 */
public class PragmaDirectiveWriter implements AstNodeWriter<PragmaDirective> {

    @Override
    public SrcDesc writeInner(PragmaDirective node, AstWriter writer) {
        List<String> literals = node.literals();
        String value = String.join("", literals.subList(1, literals.size()));

        return writer.desc("pragma ", literals.get(0), value.isEmpty() ? null : " " + value);
    }

    @Override
    public SrcDesc writeWhole(PragmaDirective node, AstWriter writer) {
        return SrcDesc.builder()
            .span(node, writeInner(node, writer))
            .text(";")
            .build();
    }
}
