package com.astwriter.core.ast;

import com.astwriter.core.model.BinaryOperation;
import com.astwriter.core.model.Identifier;
import com.astwriter.core.model.Literal;
import com.astwriter.core.model.LiteralKind;
import com.astwriter.core.model.PragmaDirective;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link AstNode} defaults, {@link AstPrinter} and {@link IrNode}.
 */
class AstNodeTest {

    @Test
    void nodeType_defaultsToSimpleClassName() {
        assertThat(new Identifier(1, "a").nodeType()).isEqualTo("Identifier");
    }

    @Test
    void print_listsScalarsAndChildren() {
        BinaryOperation node = new BinaryOperation(3, "+",
            new Identifier(1, "a"), new Literal(2, LiteralKind.STRING, "line\nbreak"));

        assertThat(node.print()).isEqualTo("""
            BinaryOperation #3
              operator: "+"
              Identifier #1
                name: "a"
              Literal #2
                kind: "STRING"
                value: "line\\nbreak"
            """);
    }

    @Test
    void print_rendersScalarListsAsJson() {
        PragmaDirective pragma = new PragmaDirective(1, List.of("solidity", "^0.8.0"));

        assertThat(pragma.print()).isEqualTo("""
            PragmaDirective #1
              literals: ["solidity","^0.8.0"]
            """);
    }

    @Test
    void print_truncatesLongValues() {
        String longName = "x".repeat(80);

        assertThat(new Identifier(1, longName).print()).contains("x".repeat(50) + "...");
    }

    @Test
    void pragmaDirective_withoutLiterals_throwsException() {
        assertThatThrownBy(() -> new PragmaDirective(1, List.of()))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void irNode_of_readsTypedProperties() {
        IrNode child = IrNode.of("YulIdentifier", "name", "x");
        IrNode node = IrNode.of("YulAssignment", "variableNames", List.of(child), "value", child);

        assertThat(node.nodes("variableNames")).containsExactly(child);
        assertThat(node.node("value")).isSameAs(child);
        assertThat(node.optionalNode("missing")).isEmpty();
        assertThat(node.nodes("missing")).isEmpty();
        assertThat(child.string("name")).isEqualTo("x");
    }

    @Test
    void irNode_missingProperty_throwsException() {
        IrNode node = IrNode.of("YulIdentifier");

        assertThatThrownBy(() -> node.string("name"))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("YulIdentifier has no property 'name'");
    }

    @Test
    void irNode_of_oddArguments_throwsException() {
        assertThatThrownBy(() -> IrNode.of("YulIdentifier", "name"))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void irNode_dump_rendersJson() {
        assertThat(IrNode.of("YulIdentifier", "name", "x").dump())
            .contains("\"nodeType\" : \"YulIdentifier\"")
            .contains("\"name\" : \"x\"");
    }
}
