package com.astwriter.core.model;

import com.astwriter.core.ast.AstNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Function definition.
 *
 * @param id node id
 * @param documentation NatSpec documentation text, or null
 * @param name function name
 * @param parameters parameter declarations
 * @param returnParameters return parameter declarations
 * @param visibility visibility keyword ("public", "internal", ...), or null
 * @param stateMutability mutability keyword ("pure", "view", "payable"), or null for non-payable
 * @param body function body, or null for an unimplemented function
 */
public record FunctionDefinition(
    int id,
    String documentation,
    String name,
    List<VariableDeclaration> parameters,
    List<VariableDeclaration> returnParameters,
    String visibility,
    String stateMutability,
    Block body
) implements AstNode {
    /**
     * Compact constructor with validation.
     */
    public FunctionDefinition {
        Objects.requireNonNull(name, "name must not be null");
        parameters = parameters != null ? List.copyOf(parameters) : List.of();
        returnParameters = returnParameters != null ? List.copyOf(returnParameters) : List.of();
    }

    @Override
    public List<AstNode> children() {
        List<AstNode> children = new ArrayList<>(parameters);
        children.addAll(returnParameters);
        if (body != null) {
            children.add(body);
        }
        return children;
    }
}
