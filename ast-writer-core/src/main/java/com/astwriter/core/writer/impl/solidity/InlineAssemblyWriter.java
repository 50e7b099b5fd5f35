package com.astwriter.core.writer.impl.solidity;

import com.astwriter.core.model.InlineAssembly;
import com.astwriter.core.util.Versions;
import com.astwriter.core.writer.AstNodeWriter;
import com.astwriter.core.writer.AstWriter;
import com.astwriter.core.writer.IrWriter;
import com.astwriter.core.writer.IrWriterMapping;
import com.astwriter.core.writer.SrcDesc;

import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Writes {@code assembly { ... }}, rendering the body with the IR writers.
 *
 * <p>Assembly flags ({@code assembly ("memory-safe") { ... }}) exist since 0.8.13 and are
 * dropped for older targets. The IR body is part of the statement's range but has no
 * ranges of its own.
 */
public class InlineAssemblyWriter implements AstNodeWriter<InlineAssembly> {

    static final String FLAGS_MIN_VERSION = "0.8.13";

    private final IrWriterMapping irMapping;

    public InlineAssemblyWriter(IrWriterMapping irMapping) {
        this.irMapping = Objects.requireNonNull(irMapping, "irMapping must not be null");
    }

    @Override
    public SrcDesc writeInner(InlineAssembly node, AstWriter writer) {
        IrWriter irWriter = new IrWriter(irMapping, writer.getFormatter());

        String flags = "";
        if (!node.flags().isEmpty() && Versions.atLeast(writer.getTargetVersion(), FLAGS_MIN_VERSION)) {
            flags = node.flags().stream()
                .map(flag -> "\"" + flag + "\"")
                .collect(Collectors.joining(", ", "(", ") "));
        }

        return writer.desc("assembly ", flags, irWriter.write(node.body()));
    }
}
