package com.astwriter.core.writer.impl.solidity;

import com.astwriter.core.SampleTrees;
import com.astwriter.core.ast.AstNode;
import com.astwriter.core.format.PrettyFormatter;
import com.astwriter.core.format.SpacelessFormatter;
import com.astwriter.core.model.Assignment;
import com.astwriter.core.model.Block;
import com.astwriter.core.model.ExpressionStatement;
import com.astwriter.core.model.FunctionCall;
import com.astwriter.core.model.FunctionDefinition;
import com.astwriter.core.model.Identifier;
import com.astwriter.core.model.IfStatement;
import com.astwriter.core.model.InlineAssembly;
import com.astwriter.core.model.Literal;
import com.astwriter.core.model.LiteralKind;
import com.astwriter.core.model.PragmaDirective;
import com.astwriter.core.model.Return;
import com.astwriter.core.model.SourceUnit;
import com.astwriter.core.model.UncheckedBlock;
import com.astwriter.core.model.VariableDeclaration;
import com.astwriter.core.writer.AstWriter;
import com.astwriter.core.writer.SourceMap;
import com.astwriter.core.writer.SourceRange;
import com.astwriter.core.writer.impl.SolidityMappingProvider;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for the Solidity writers registered by {@link SolidityMappingProvider}.
 */
class SolidityWritersTest {

    private static final SolidityMappingProvider PROVIDER = new SolidityMappingProvider();

    private static AstWriter pretty(String version) {
        return PROVIDER.createAstWriter(new PrettyFormatter(4, 0), version);
    }

    private static AstWriter spaceless() {
        return PROVIDER.createAstWriter(new SpacelessFormatter(), "0.8.20");
    }

    @Test
    void write_contract_rendersPrettySource() {
        assertThat(pretty("0.8.20").write(SampleTrees.contract())).isEqualTo(SampleTrees.CONTRACT_SOURCE);
    }

    @Test
    void write_contractSpaceless_rendersWithoutLayout() {
        assertThat(spaceless().write(SampleTrees.contract())).isEqualTo(
            "pragma solidity ^0.8.0;/** Adds numbers */ function add(uint256 a, uint256 b) public pure returns (uint256) "
                + "{string memory s = unicode\"héllo €\";unchecked {a += b;}if (a > 0) {return a;}return a + b;}");
    }

    @Test
    void write_contract_excludesTerminatorsAndDocumentation() {
        SourceUnit unit = SampleTrees.contract();
        SourceMap sourceMap = new SourceMap();

        String source = pretty("0.8.20").write(unit, sourceMap);
        FunctionDefinition function = (FunctionDefinition) unit.nodes().get(1);
        AstNode pragma = unit.nodes().get(0);
        AstNode declarationStatement = function.body().statements().get(0);

        assertThat(sourceMap.get(pragma).extract(source)).isEqualTo("pragma solidity ^0.8.0");
        assertThat(sourceMap.get(function).extract(source)).startsWith("function add(").endsWith("return a + b;\n}");
        assertThat(sourceMap.get(declarationStatement).extract(source)).isEqualTo("string memory s = unicode\"héllo €\"");
        assertThat(sourceMap.get(unit)).isEqualTo(new SourceRange(0, source.getBytes(StandardCharsets.UTF_8).length));
    }

    @Test
    void write_uncheckedBlockBefore080_rendersPlainBlock() {
        UncheckedBlock block = new UncheckedBlock(3, List.of(
            new ExpressionStatement(2, new Assignment(1, "+=", new Identifier(4, "a"), new Identifier(5, "b")))));

        assertThat(pretty("0.7.6").write(block)).isEqualTo("{\n    a += b;\n}");
        assertThat(pretty("0.8.0").write(block)).isEqualTo("unchecked {\n    a += b;\n}");
    }

    @Test
    void write_emptyBlock_rendersBraces() {
        FunctionDefinition function = new FunctionDefinition(1, null, "f", null, null, "public", null, new Block(2, null));

        assertThat(pretty("0.8.20").write(function)).isEqualTo("function f() public {}");
    }

    @Test
    void write_unimplementedFunction_endsWithSemicolon() {
        FunctionDefinition function = new FunctionDefinition(1, null, "f",
            List.of(new VariableDeclaration(2, "address", null, "to")),
            List.of(new VariableDeclaration(3, "bool", null, null)),
            "external", "view", null);

        assertThat(pretty("0.8.20").write(function))
            .isEqualTo("function f(address to) external view returns (bool);");
    }

    @Test
    void write_multiLineDocumentation_writesOneCommentPerLine() {
        FunctionDefinition function = new FunctionDefinition(1, "@notice Does it\n\n@dev Twice", "f",
            null, null, null, null, null);

        assertThat(pretty("0.8.20").write(function))
            .isEqualTo("/// @notice Does it\n///\n/// @dev Twice\nfunction f();");
    }

    @Test
    void write_ifElse_rendersBothBranches() {
        IfStatement statement = new IfStatement(1,
            new Identifier(2, "ok"),
            new ExpressionStatement(3, new Assignment(4, "=", new Identifier(5, "b"), new Literal(6, LiteralKind.NUMBER, "1"))),
            new ExpressionStatement(7, new Assignment(8, "=", new Identifier(9, "b"), new Literal(10, LiteralKind.NUMBER, "2"))));

        assertThat(spaceless().write(statement)).isEqualTo("if (ok) b = 1; else b = 2;");
    }

    @Test
    void write_literals_quoteAndEscapeStrings() {
        AstWriter writer = spaceless();

        assertThat(writer.write(new Literal(1, LiteralKind.STRING, "say \"hi\"\n"))).isEqualTo("\"say \\\"hi\\\"\\n\"");
        assertThat(writer.write(new Literal(2, LiteralKind.HEX_STRING, "00ff"))).isEqualTo("hex\"00ff\"");
        assertThat(writer.write(new Literal(5, LiteralKind.UNICODE_STRING, "€ \"x\"")))
            .isEqualTo("unicode\"€ \\\"x\\\"\"");
        assertThat(writer.write(new Literal(3, LiteralKind.BOOL, "true"))).isEqualTo("true");
        assertThat(writer.write(new Literal(4, LiteralKind.NUMBER, "0x10"))).isEqualTo("0x10");
    }

    @Test
    void write_functionCall_joinsArguments() {
        AstWriter writer = spaceless();
        FunctionCall call = new FunctionCall(1, new Identifier(2, "transfer"),
            List.of(new Identifier(3, "to"), new Literal(4, LiteralKind.NUMBER, "1")));
        SourceMap sourceMap = new SourceMap();

        assertThat(writer.write(call, sourceMap)).isEqualTo("transfer(to, 1)");
        assertThat(sourceMap.get(call.arguments().get(1))).isEqualTo(new SourceRange(13, 1));
        assertThat(writer.write(new FunctionCall(5, new Identifier(6, "f"), null))).isEqualTo("f()");
    }

    @Test
    void write_return_withAndWithoutExpression() {
        AstWriter writer = spaceless();

        assertThat(writer.write(new Return(1, null))).isEqualTo("return;");
        assertThat(writer.write(new Return(2, new Identifier(3, "x")))).isEqualTo("return x;");
    }

    @Test
    void write_pragma_joinsVersionTokens() {
        AstWriter writer = spaceless();

        assertThat(writer.write(new PragmaDirective(1, List.of("abicoder", "v2")))).isEqualTo("pragma abicoder v2;");
        assertThat(writer.write(new PragmaDirective(2, List.of("solidity", ">=", "0.8", ".0", "<", "0.9", ".0"))))
            .isEqualTo("pragma solidity >=0.8.0<0.9.0;");
    }

    @Test
    void write_inlineAssemblyWithFlags_gatedOnVersion() {
        InlineAssembly assembly = SampleTrees.assembly(1, List.of("memory-safe"));
        String body = """
            {
                let x := add(1, 2)
                if x {
                    sstore(0, x)
                }
            }""";

        assertThat(pretty("0.8.13").write(assembly)).isEqualTo("assembly (\"memory-safe\") " + body);
        assertThat(pretty("0.8.12").write(assembly)).isEqualTo("assembly " + body);
    }

    @Test
    void write_inlineAssemblyInBlock_indentsIrBody() {
        InlineAssembly assembly = SampleTrees.assembly(2, List.of());
        SourceMap sourceMap = new SourceMap();

        String source = pretty("0.8.20").write(new Block(1, List.of(assembly)), sourceMap);

        assertThat(source).isEqualTo("""
            {
                assembly {
                    let x := add(1, 2)
                    if x {
                        sstore(0, x)
                    }
                }
            }""");
        assertThat(sourceMap.get(assembly).extract(source)).startsWith("assembly {").endsWith("    }");
        assertThat(sourceMap.size()).isEqualTo(2);
    }

    @Test
    void provider_registersEveryModelType() {
        assertThat(PROVIDER.getAstMapping().size()).isEqualTo(16);
        assertThat(PROVIDER.getIrMapping().size()).isEqualTo(9);
        assertThat(PROVIDER.getId()).isEqualTo("solidity");
    }
}
