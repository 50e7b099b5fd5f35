package com.astwriter.core.json;

import com.astwriter.core.ast.AstNode;
import com.astwriter.core.ast.IrNode;
import com.astwriter.core.format.PrettyFormatter;
import com.astwriter.core.model.BinaryOperation;
import com.astwriter.core.model.Block;
import com.astwriter.core.model.FunctionDefinition;
import com.astwriter.core.model.Identifier;
import com.astwriter.core.model.InlineAssembly;
import com.astwriter.core.model.Literal;
import com.astwriter.core.model.LiteralKind;
import com.astwriter.core.model.SourceUnit;
import com.astwriter.core.model.VariableDeclarationStatement;
import com.astwriter.core.writer.impl.SolidityMappingProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link AstJsonReader}.
 */
class AstJsonReaderTest {

    private AstJsonReader reader;

    @BeforeEach
    void setUp() {
        reader = new AstJsonReader();
    }

    @Test
    void read_compilerStyleContract_buildsTree() throws IOException {
        AstNode root = reader.read(resource("/json/contract.json"));

        assertThat(root).isInstanceOf(SourceUnit.class);
        FunctionDefinition function = (FunctionDefinition) ((SourceUnit) root).nodes().get(1);
        assertThat(function.documentation()).isEqualTo("Stores a value");
        assertThat(function.stateMutability()).isNull();
        assertThat(function.parameters()).hasSize(1);
        assertThat(function.parameters().get(0).typeName()).isEqualTo("uint256");
        assertThat(function.parameters().get(0).storageLocation()).isNull();

        InlineAssembly assembly = (InlineAssembly) function.body().statements().get(0);
        assertThat(assembly.flags()).containsExactly("memory-safe");
        assertThat(assembly.body().nodeType()).isEqualTo("YulBlock");
        assertThat(assembly.body().nodes("statements")).hasSize(1);
    }

    @Test
    void read_missingIds_assignedAfterLargestExplicitId() throws IOException {
        SourceUnit root = (SourceUnit) reader.read(resource("/json/contract.json"));
        FunctionDefinition function = (FunctionDefinition) root.nodes().get(1);

        assertThat(function.body().statements().get(1).id()).isEqualTo(101);
    }

    @Test
    void read_compilerStyleContract_rendersSource() throws IOException {
        AstNode root = reader.read(resource("/json/contract.json"));

        String source = new SolidityMappingProvider()
            .createAstWriter(new PrettyFormatter(4, 0), "0.8.20")
            .write(root);

        assertThat(source).isEqualTo("""
            pragma solidity ^0.8.0;

            /// Stores a value
            function store(uint256 value) external {
                assembly ("memory-safe") {
                    sstore(0, value)
                }
                return;
            }""");
    }

    @Test
    void read_expressionTree_mapsRecordComponents() {
        AstNode root = reader.read("""
            {
              "id": 3, "nodeType": "BinaryOperation", "operator": "*",
              "leftExpression": { "id": 1, "nodeType": "Identifier", "name": "x" },
              "rightExpression": { "id": 2, "nodeType": "Literal", "kind": "hexString", "hexValue": "ff", "value": null }
            }
            """);

        assertThat(root).isEqualTo(new BinaryOperation(3, "*",
            new Identifier(1, "x"), new Literal(2, LiteralKind.HEX_STRING, "ff")));
    }

    @Test
    void read_unicodeStringLiteral_mapsToUnicodeKind() {
        AstNode root = reader.read("""
            { "id": 1, "nodeType": "Literal", "kind": "unicodeString", "value": "héllo" }
            """);

        assertThat(root).isEqualTo(new Literal(1, LiteralKind.UNICODE_STRING, "héllo"));
    }

    @Test
    void read_declarationsArray_usesSingleDeclaration() {
        AstNode root = reader.read("""
            {
              "nodeType": "VariableDeclarationStatement",
              "declarations": [ { "nodeType": "VariableDeclaration", "typeName": "bool", "name": "ok" } ],
              "initialValue": { "nodeType": "Literal", "kind": "bool", "value": "true" }
            }
            """);

        VariableDeclarationStatement statement = (VariableDeclarationStatement) root;
        assertThat(statement.declaration().name()).isEqualTo("ok");
        assertThat(statement.id()).isEqualTo(1);
        assertThat(statement.declaration().id()).isEqualTo(2);
    }

    @Test
    void read_unknownNodeType_throwsException() {
        assertThatThrownBy(() -> reader.read("{\"nodeType\": \"ContractDefinition\"}"))
            .isInstanceOf(AstJsonException.class)
            .hasMessageContaining("Unknown nodeType 'ContractDefinition'");
    }

    @Test
    void read_missingRequiredProperty_namesNodeAndProperty() {
        assertThatThrownBy(() -> reader.read("{\"nodeType\": \"Identifier\"}"))
            .isInstanceOf(AstJsonException.class)
            .hasMessage("Identifier is missing required property 'name'");
    }

    @Test
    void read_wrongChildType_throwsException() {
        assertThatThrownBy(() -> reader.read("""
            { "nodeType": "FunctionDefinition", "name": "f", "body": { "nodeType": "Identifier", "name": "x" } }
            """))
            .isInstanceOf(AstJsonException.class)
            .hasMessageContaining("FunctionDefinition.body must be a Block but got Identifier");
    }

    @Test
    void read_malformedJson_throwsException() {
        assertThatThrownBy(() -> reader.read("{\"nodeType\": "))
            .isInstanceOf(AstJsonException.class)
            .hasMessageStartingWith("Malformed JSON");
    }

    @Test
    void read_arrayAtRoot_throwsException() {
        assertThatThrownBy(() -> reader.read("[]"))
            .isInstanceOf(AstJsonException.class);
    }

    @Test
    void readIr_convertsValuesGenerically() {
        IrNode node = reader.readIr("""
            { "nodeType": "YulLiteral", "kind": "number", "value": "1", "type": "", "nested": false, "depth": 2, "src": null }
            """);

        assertThat(node.nodeType()).isEqualTo("YulLiteral");
        assertThat(node.data())
            .containsEntry("kind", "number")
            .containsEntry("nested", false)
            .containsEntry("depth", 2)
            .containsKey("src");
    }

    @Test
    void readIr_objectWithoutNodeType_throwsException() {
        assertThatThrownBy(() -> reader.readIr("{ \"nodeType\": \"YulBlock\", \"statements\": [ { \"name\": \"x\" } ] }"))
            .isInstanceOf(AstJsonException.class)
            .hasMessageContaining("nodeType");
    }

    @Test
    void read_emptyBlock_hasNoStatements() {
        assertThat(((Block) reader.read("{\"nodeType\": \"Block\"}")).statements()).isEmpty();
    }

    private static String resource(String name) throws IOException {
        try (InputStream in = AstJsonReaderTest.class.getResourceAsStream(name)) {
            assertThat(in).as(name).isNotNull();
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
}
