package com.astwriter.core.ast;

import com.astwriter.core.util.DebugDump;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Iterator;
import java.util.Map;

/**
 * Formats syntax trees into human-readable, indented text.
 *
 * <p>Used for error messages when a tree cannot be rendered. The scalar properties Jackson
 * finds on a node are listed under it; child nodes follow, one level deeper.
 *
 * <p>Example output:
 * <pre>
 * Assignment #3
 *   operator: "="
 *   Identifier #1
 *     name: "a"
 *   Literal #2
 *     kind: "NUMBER"
 *     value: "1"
 * </pre>
 */
public final class AstPrinter {

    private static final String INDENT = "  ";
    private static final int MAX_TEXT_LENGTH = 50;

    private AstPrinter() {
        // Utility class
    }

    /**
     * Formats a tree into human-readable text.
     *
     * @param node root of the tree
     * @return formatted representation
     */
    public static String print(AstNode node) {
        if (node == null) {
            return "(null node)";
        }
        StringBuilder sb = new StringBuilder();
        printNode(node, 0, sb);
        return sb.toString();
    }

    private static void printNode(AstNode node, int depth, StringBuilder sb) {
        indent(sb, depth);
        sb.append(node.nodeType()).append(" #").append(node.id()).append('\n');

        Iterator<Map.Entry<String, JsonNode>> properties = DebugDump.toTree(node).fields();
        while (properties.hasNext()) {
            Map.Entry<String, JsonNode> property = properties.next();
            JsonNode value = property.getValue();
            if (property.getKey().equals("id") || value.isNull() || isNodeValue(value)) {
                continue;
            }
            indent(sb, depth + 1);
            sb.append(property.getKey()).append(": ").append(describe(value)).append('\n');
        }

        for (AstNode child : node.children()) {
            printNode(child, depth + 1, sb);
        }
    }

    // Objects and lists of objects are child nodes, printed separately
    private static boolean isNodeValue(JsonNode value) {
        if (value.isObject()) {
            return true;
        }
        return value.isArray() && !value.isEmpty() && value.get(0).isObject();
    }

    private static String describe(JsonNode value) {
        if (value.isTextual()) {
            return "\"" + escapeAndTruncate(value.asText()) + "\"";
        }
        return escapeAndTruncate(value.toString());
    }

    private static String escapeAndTruncate(String text) {
        text = text.replace("\n", "\\n")
                   .replace("\r", "\\r")
                   .replace("\t", "\\t");

        if (text.length() > MAX_TEXT_LENGTH) {
            text = text.substring(0, MAX_TEXT_LENGTH) + "...";
        }

        return text;
    }

    private static void indent(StringBuilder sb, int depth) {
        for (int i = 0; i < depth; i++) {
            sb.append(INDENT);
        }
    }
}
