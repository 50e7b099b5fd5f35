package com.astwriter.cli;

import com.astwriter.AstWriterCLI;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link RenderCommand}.
 */
class RenderCommandTest {

    private static final String ASSIGNMENT_JSON = """
        {
          "id": 4, "nodeType": "ExpressionStatement",
          "expression": {
            "id": 3, "nodeType": "Assignment", "operator": "=",
            "leftHandSide": { "id": 1, "nodeType": "Identifier", "name": "a" },
            "rightHandSide": { "id": 2, "nodeType": "Literal", "kind": "string", "value": "€" }
          }
        }
        """;

    @TempDir
    Path tempDir;

    private CommandLine commandLine;
    private StringWriter out;

    @BeforeEach
    void setUp() {
        out = new StringWriter();
        commandLine = AstWriterCLI.createCommandLine();
        commandLine.setOut(new PrintWriter(out));
    }

    private Path writeInput(String json) throws IOException {
        Path input = tempDir.resolve("input.json");
        Files.writeString(input, json);
        return input;
    }

    @Test
    void render_toStdout_printsSource() throws IOException {
        Path input = writeInput(ASSIGNMENT_JSON);

        int exitCode = commandLine.execute("render", input.toString());

        assertThat(exitCode).isZero();
        assertThat(out.toString()).isEqualToIgnoringNewLines("a = \"€\";");
    }

    @Test
    void render_withOutputAndSourceMap_writesBothFiles() throws IOException {
        Path input = writeInput(ASSIGNMENT_JSON);
        Path output = tempDir.resolve("out.sol");
        Path sourceMap = tempDir.resolve("out.map.json");

        int exitCode = commandLine.execute("-q", "render", input.toString(),
            "-o", output.toString(), "-m", sourceMap.toString());

        assertThat(exitCode).isZero();
        assertThat(Files.readString(output)).isEqualTo("a = \"€\";");

        JsonNode map = new ObjectMapper().readTree(sourceMap.toFile());
        assertThat(map).hasSize(4);
        assertThat(map.get(0).get("nodeType").asText()).isEqualTo("ExpressionStatement");
        // statement range excludes the semicolon; the literal is 5 bytes
        assertThat(map.get(0).get("src").asText()).isEqualTo("0:9");
        assertThat(map.get(3).get("src").asText()).isEqualTo("4:5");
    }

    @Test
    void render_withConfigFile_usesConfiguredFormatter() throws IOException {
        Path input = writeInput("""
            { "nodeType": "Block", "statements": [ { "nodeType": "Return" } ] }
            """);
        Path config = tempDir.resolve("astwriter.yaml");
        Files.writeString(config, """
            formatter:
              style: spaceless
            """);

        int exitCode = commandLine.execute("render", input.toString(), "-c", config.toString());

        assertThat(exitCode).isZero();
        assertThat(out.toString()).isEqualToIgnoringNewLines("{return;}");
    }

    @Test
    void render_targetVersionOverride_gatesSyntax() throws IOException {
        Path input = writeInput("""
            { "nodeType": "UncheckedBlock", "statements": [] }
            """);

        commandLine.execute("render", input.toString(), "--target-version", "0.7.6");

        assertThat(out.toString()).isEqualToIgnoringNewLines("{}");
    }

    @Test
    void render_irInput_rendersWithIrWriters() throws IOException {
        Path input = writeInput("""
            { "nodeType": "YulFunctionCall",
              "functionName": { "nodeType": "YulIdentifier", "name": "mstore" },
              "arguments": [ { "nodeType": "YulLiteral", "kind": "number", "value": "64" } ] }
            """);

        int exitCode = commandLine.execute("render", "--ir", input.toString());

        assertThat(exitCode).isZero();
        assertThat(out.toString()).isEqualToIgnoringNewLines("mstore(64)");
    }

    @Test
    void render_missingInput_returnsInputError() {
        int exitCode = commandLine.execute("render", tempDir.resolve("missing.json").toString());

        assertThat(exitCode).isEqualTo(RenderCommand.EXIT_INPUT_ERROR);
    }

    @Test
    void render_invalidJson_returnsInputError() throws IOException {
        Path input = writeInput("{ \"nodeType\": \"ContractDefinition\" }");

        assertThat(commandLine.execute("render", input.toString())).isEqualTo(RenderCommand.EXIT_INPUT_ERROR);
    }

    @Test
    void render_unknownMapping_returnsInputError() throws IOException {
        Path input = writeInput(ASSIGNMENT_JSON);

        assertThat(commandLine.execute("render", input.toString(), "--mapping", "vyper"))
            .isEqualTo(RenderCommand.EXIT_INPUT_ERROR);
    }

    @Test
    void render_invalidTargetVersion_returnsInputError() throws IOException {
        Path input = writeInput(ASSIGNMENT_JSON);

        assertThat(commandLine.execute("render", input.toString(), "--target-version", "latest"))
            .isEqualTo(RenderCommand.EXIT_INPUT_ERROR);
    }

    @Test
    void render_irWithoutWriter_returnsWriterError() throws IOException {
        Path input = writeInput("{ \"nodeType\": \"YulSwitch\" }");

        assertThat(commandLine.execute("render", "--ir", input.toString()))
            .isEqualTo(RenderCommand.EXIT_WRITER_ERROR);
        assertThat(out.toString()).isEmpty();
    }
}
