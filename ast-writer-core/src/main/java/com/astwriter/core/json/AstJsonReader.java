package com.astwriter.core.json;

import com.astwriter.core.ast.AstNode;
import com.astwriter.core.ast.IrNode;
import com.astwriter.core.model.Assignment;
import com.astwriter.core.model.BinaryOperation;
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
import com.astwriter.core.model.VariableDeclarationStatement;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads trees of the reference node model from JSON.
 *
 * <p>Every object carries a {@code nodeType}; the remaining properties follow the record
 * components of the node ({@code {"id": 1, "nodeType": "Identifier", "name": "a"}}). A few
 * compiler-style spellings are accepted as well: parameter lists wrapped in a
 * {@code ParameterList} object, {@code declarations} arrays, documentation objects with a
 * {@code text} property, type name objects and the {@code AST} property of inline assembly.
 *
 * <p>Objects without an {@code id} get ids counting up from the largest explicit id in the
 * document. IR trees are converted generically: every object becomes an {@link IrNode}
 * tagged with its {@code nodeType}.
 */
public class AstJsonReader {

    private static final Logger log = LoggerFactory.getLogger(AstJsonReader.class);
    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();

    private static final String NODE_TYPE = "nodeType";

    private int nextId;

    /**
     * Reads a structured tree from a JSON file.
     *
     * @param path JSON file
     * @return root node
     * @throws IOException if the file cannot be read
     * @throws AstJsonException if the content is not a valid tree
     */
    public AstNode read(Path path) throws IOException {
        log.debug("Reading AST from: {}", path);
        return read(Files.readString(path));
    }

    /**
     * Reads a structured tree from a JSON string.
     *
     * @param json JSON text
     * @return root node
     * @throws AstJsonException if the content is not a valid tree
     */
    public AstNode read(String json) {
        JsonNode root = parse(json);
        nextId = maxId(root) + 1;
        return toAst(root);
    }

    /**
     * Reads an IR tree from a JSON file.
     *
     * @param path JSON file
     * @return root IR node
     * @throws IOException if the file cannot be read
     * @throws AstJsonException if the content is not a valid tree
     */
    public IrNode readIr(Path path) throws IOException {
        log.debug("Reading IR from: {}", path);
        return readIr(Files.readString(path));
    }

    /**
     * Reads an IR tree from a JSON string.
     *
     * @param json JSON text
     * @return root IR node
     * @throws AstJsonException if the content is not a valid tree
     */
    public IrNode readIr(String json) {
        return toIr(parse(json), "root");
    }

    private JsonNode parse(String json) {
        try {
            JsonNode root = JSON_MAPPER.readTree(json);
            if (root == null || !root.isObject()) {
                throw new AstJsonException("Expected a JSON object at the root");
            }
            return root;
        } catch (JsonProcessingException e) {
            throw new AstJsonException("Malformed JSON: " + e.getOriginalMessage(), e);
        }
    }

    private static int maxId(JsonNode root) {
        int max = 0;
        for (JsonNode id : root.findValues("id")) {
            if (id.canConvertToInt()) {
                max = Math.max(max, id.asInt());
            }
        }
        return max;
    }

    // Structured nodes

    private AstNode toAst(JsonNode json) {
        if (json == null || !json.isObject()) {
            throw new AstJsonException("Expected a node object but got: " + json);
        }
        String nodeType = requireText(json, NODE_TYPE, "node");
        int id = json.hasNonNull("id") ? json.get("id").asInt() : nextId++;

        return switch (nodeType) {
            case "SourceUnit" -> new SourceUnit(id, children(json, "nodes"));
            case "PragmaDirective" -> new PragmaDirective(id, strings(json, "literals", true));
            case "FunctionDefinition" -> functionDefinition(id, json);
            case "VariableDeclaration" -> variableDeclaration(id, json);
            case "Block" -> new Block(id, children(json, "statements"));
            case "UncheckedBlock" -> new UncheckedBlock(id, children(json, "statements"));
            case "ExpressionStatement" -> new ExpressionStatement(id, child(json, "expression"));
            case "VariableDeclarationStatement" -> variableDeclarationStatement(id, json);
            case "Return" -> new Return(id, optionalChild(json, "expression"));
            case "IfStatement" -> new IfStatement(id,
                child(json, "condition"), child(json, "trueBody"), optionalChild(json, "falseBody"));
            case "Assignment" -> new Assignment(id,
                requireText(json, "operator", nodeType), child(json, "leftHandSide"), child(json, "rightHandSide"));
            case "BinaryOperation" -> new BinaryOperation(id,
                requireText(json, "operator", nodeType), child(json, "leftExpression"), child(json, "rightExpression"));
            case "FunctionCall" -> new FunctionCall(id, child(json, "expression"), children(json, "arguments"));
            case "Identifier" -> new Identifier(id, requireText(json, "name", nodeType));
            case "Literal" -> literal(id, json);
            case "InlineAssembly" -> inlineAssembly(id, json);
            default -> throw new AstJsonException("Unknown nodeType '" + nodeType + "'");
        };
    }

    private FunctionDefinition functionDefinition(int id, JsonNode json) {
        JsonNode body = json.get("body");
        return new FunctionDefinition(
            id,
            documentation(json.get("documentation")),
            requireText(json, "name", "FunctionDefinition"),
            parameters(json, "parameters"),
            parameters(json, "returnParameters"),
            optionalText(json, "visibility"),
            stateMutability(optionalText(json, "stateMutability")),
            body == null || body.isNull() ? null : castNode(toAst(body), Block.class, "FunctionDefinition.body")
        );
    }

    private VariableDeclaration variableDeclaration(int id, JsonNode json) {
        String location = optionalText(json, "storageLocation");
        return new VariableDeclaration(
            id,
            typeName(json),
            "default".equals(location) ? null : location,
            optionalText(json, "name")
        );
    }

    private VariableDeclarationStatement variableDeclarationStatement(int id, JsonNode json) {
        JsonNode declaration = json.get("declaration");
        if (declaration == null && json.path("declarations").isArray() && json.get("declarations").size() == 1) {
            declaration = json.get("declarations").get(0);
        }
        if (declaration == null || declaration.isNull()) {
            throw missing("VariableDeclarationStatement", "declaration");
        }
        return new VariableDeclarationStatement(
            id,
            castNode(toAst(declaration), VariableDeclaration.class, "VariableDeclarationStatement.declaration"),
            optionalChild(json, "initialValue")
        );
    }

    private Literal literal(int id, JsonNode json) {
        String kindName = requireText(json, "kind", "Literal");
        LiteralKind kind = switch (kindName) {
            case "number" -> LiteralKind.NUMBER;
            case "bool" -> LiteralKind.BOOL;
            case "string" -> LiteralKind.STRING;
            case "unicodeString" -> LiteralKind.UNICODE_STRING;
            case "hexString" -> LiteralKind.HEX_STRING;
            default -> throw new AstJsonException("Literal has unknown kind '" + kindName + "'");
        };
        String value = kind == LiteralKind.HEX_STRING && json.hasNonNull("hexValue")
            ? json.get("hexValue").asText()
            : requireText(json, "value", "Literal");
        return new Literal(id, kind, value);
    }

    private InlineAssembly inlineAssembly(int id, JsonNode json) {
        JsonNode body = json.hasNonNull("AST") ? json.get("AST") : json.get("body");
        if (body == null || body.isNull()) {
            throw missing("InlineAssembly", "AST");
        }
        return new InlineAssembly(id, strings(json, "flags", false), toIr(body, "InlineAssembly.AST"));
    }

    private AstNode child(JsonNode json, String property) {
        JsonNode value = json.get(property);
        if (value == null || value.isNull()) {
            throw missing(json.path(NODE_TYPE).asText(), property);
        }
        return toAst(value);
    }

    private AstNode optionalChild(JsonNode json, String property) {
        JsonNode value = json.get(property);
        return value == null || value.isNull() ? null : toAst(value);
    }

    private List<AstNode> children(JsonNode json, String property) {
        JsonNode value = json.get(property);
        if (value == null || value.isNull()) {
            return List.of();
        }
        if (!value.isArray()) {
            throw new AstJsonException(json.path(NODE_TYPE).asText() + "." + property + " must be an array");
        }
        List<AstNode> nodes = new ArrayList<>(value.size());
        for (JsonNode element : value) {
            nodes.add(toAst(element));
        }
        return nodes;
    }

    private List<VariableDeclaration> parameters(JsonNode json, String property) {
        JsonNode value = json.get(property);
        // ParameterList wrapper
        if (value != null && value.isObject() && value.has("parameters")) {
            value = value.get("parameters");
        }
        if (value == null || value.isNull()) {
            return List.of();
        }
        if (!value.isArray()) {
            throw new AstJsonException("FunctionDefinition." + property + " must be an array");
        }
        List<VariableDeclaration> parameters = new ArrayList<>(value.size());
        for (JsonNode element : value) {
            parameters.add(castNode(toAst(element), VariableDeclaration.class, "FunctionDefinition." + property));
        }
        return parameters;
    }

    private static String documentation(JsonNode value) {
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isObject()) {
            return value.hasNonNull("text") ? value.get("text").asText() : null;
        }
        return value.asText();
    }

    private static String stateMutability(String value) {
        // Non-payable is the default and has no keyword
        return "nonpayable".equals(value) ? null : value;
    }

    private static String typeName(JsonNode json) {
        JsonNode value = json.get("typeName");
        if (value != null && value.isTextual()) {
            return value.asText();
        }
        if (value != null && value.isObject()) {
            if (value.hasNonNull("name")) {
                return value.get("name").asText();
            }
            JsonNode typeString = value.path("typeDescriptions").path("typeString");
            if (typeString.isTextual()) {
                return typeString.asText();
            }
        }
        throw missing("VariableDeclaration", "typeName");
    }

    private static List<String> strings(JsonNode json, String property, boolean required) {
        JsonNode value = json.get(property);
        if (value == null || value.isNull()) {
            if (required) {
                throw missing(json.path(NODE_TYPE).asText(), property);
            }
            return List.of();
        }
        if (!value.isArray()) {
            throw new AstJsonException(json.path(NODE_TYPE).asText() + "." + property + " must be an array");
        }
        List<String> strings = new ArrayList<>(value.size());
        value.forEach(element -> strings.add(element.asText()));
        if (required && strings.isEmpty()) {
            throw new AstJsonException(json.path(NODE_TYPE).asText() + "." + property + " must not be empty");
        }
        return strings;
    }

    private static <T extends AstNode> T castNode(AstNode node, Class<T> type, String location) {
        if (!type.isInstance(node)) {
            throw new AstJsonException(location + " must be a " + type.getSimpleName() + " but got " + node.nodeType());
        }
        return type.cast(node);
    }

    // IR nodes

    private IrNode toIr(JsonNode json, String location) {
        if (!json.isObject()) {
            throw new AstJsonException(location + " must be an IR node object but got: " + json);
        }
        String nodeType = requireText(json, NODE_TYPE, location);

        Map<String, Object> data = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = json.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!field.getKey().equals(NODE_TYPE)) {
                data.put(field.getKey(), irValue(field.getValue(), nodeType + "." + field.getKey()));
            }
        }
        return new IrNode(nodeType, data);
    }

    private Object irValue(JsonNode value, String location) {
        if (value.isNull()) {
            return null;
        }
        if (value.isObject()) {
            return toIr(value, location);
        }
        if (value.isArray()) {
            List<IrNode> nodes = new ArrayList<>(value.size());
            for (JsonNode element : value) {
                nodes.add(toIr(element, location));
            }
            return nodes;
        }
        if (value.isBoolean()) {
            return value.booleanValue();
        }
        if (value.isNumber()) {
            return value.numberValue();
        }
        return value.asText();
    }

    private static String requireText(JsonNode json, String property, String owner) {
        JsonNode value = json.get(property);
        if (value == null || value.isNull() || value.isContainerNode()) {
            throw missing(owner, property);
        }
        return value.asText();
    }

    private static String optionalText(JsonNode json, String property) {
        JsonNode value = json.get(property);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static AstJsonException missing(String nodeType, String property) {
        return new AstJsonException(nodeType + " is missing required property '" + property + "'");
    }
}
