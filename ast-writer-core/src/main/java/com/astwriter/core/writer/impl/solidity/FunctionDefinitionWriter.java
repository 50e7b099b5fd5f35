package com.astwriter.core.writer.impl.solidity;

import com.astwriter.core.model.FunctionDefinition;
import com.astwriter.core.writer.AstNodeWriter;
import com.astwriter.core.writer.AstWriter;
import com.astwriter.core.writer.SrcDesc;

/**
 * Writes function definitions:
 *
 * <pre>
 * /// Adds two numbers
 * function add(uint256 a, uint256 b) public pure returns (uint256) {
 *     return a + b;
 * }
 * </pre>
 *
 * <p>Documentation is emitted before the function's span, so the function's range starts
 * at the {@code function} keyword. Line comments need line breaks; with a formatter that
 * emits none, documentation is written as a block comment instead.
 */
public class FunctionDefinitionWriter implements AstNodeWriter<FunctionDefinition> {

    @Override
    public SrcDesc writeInner(FunctionDefinition node, AstWriter writer) {
        SrcDesc.Builder builder = SrcDesc.builder()
            .text("function " + node.name() + "(")
            .append(writer.join(node.parameters(), ", "))
            .text(")");

        if (node.visibility() != null) {
            builder.text(" " + node.visibility());
        }
        if (node.stateMutability() != null) {
            builder.text(" " + node.stateMutability());
        }
        if (!node.returnParameters().isEmpty()) {
            builder.text(" returns (")
                .append(writer.join(node.returnParameters(), ", "))
                .text(")");
        }

        if (node.body() == null) {
            return builder.text(";").build();
        }
        return builder.append(writer.desc(" ", node.body())).build();
    }

    @Override
    public SrcDesc writeWhole(FunctionDefinition node, AstWriter writer) {
        SrcDesc.Builder builder = SrcDesc.builder();

        if (node.documentation() != null) {
            builder.text(renderDocumentation(node.documentation(), writer));
        }
        return builder.span(node, writeInner(node, writer)).build();
    }

    private String renderDocumentation(String documentation, AstWriter writer) {
        String wrap = writer.getFormatter().renderWrap();
        String indent = writer.getFormatter().renderIndent();

        if (wrap.isEmpty()) {
            return "/** " + documentation.replace("\n", " ") + " */ ";
        }

        StringBuilder sb = new StringBuilder();
        for (String line : documentation.split("\n", -1)) {
            sb.append(line.isEmpty() ? "///" : "/// " + line).append(wrap).append(indent);
        }
        return sb.toString();
    }
}
