package com.astwriter.core.writer.impl;

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
import com.astwriter.core.model.PragmaDirective;
import com.astwriter.core.model.Return;
import com.astwriter.core.model.SourceUnit;
import com.astwriter.core.model.UncheckedBlock;
import com.astwriter.core.model.VariableDeclaration;
import com.astwriter.core.model.VariableDeclarationStatement;
import com.astwriter.core.writer.AstWriterMapping;
import com.astwriter.core.writer.IrWriterMapping;
import com.astwriter.core.writer.WriterMappingProvider;
import com.astwriter.core.writer.impl.solidity.AssignmentWriter;
import com.astwriter.core.writer.impl.solidity.BinaryOperationWriter;
import com.astwriter.core.writer.impl.solidity.BlockWriter;
import com.astwriter.core.writer.impl.solidity.ExpressionStatementWriter;
import com.astwriter.core.writer.impl.solidity.FunctionCallWriter;
import com.astwriter.core.writer.impl.solidity.FunctionDefinitionWriter;
import com.astwriter.core.writer.impl.solidity.IdentifierWriter;
import com.astwriter.core.writer.impl.solidity.IfStatementWriter;
import com.astwriter.core.writer.impl.solidity.InlineAssemblyWriter;
import com.astwriter.core.writer.impl.solidity.LiteralWriter;
import com.astwriter.core.writer.impl.solidity.PragmaDirectiveWriter;
import com.astwriter.core.writer.impl.solidity.ReturnWriter;
import com.astwriter.core.writer.impl.solidity.SourceUnitWriter;
import com.astwriter.core.writer.impl.solidity.UncheckedBlockWriter;
import com.astwriter.core.writer.impl.solidity.VariableDeclarationStatementWriter;
import com.astwriter.core.writer.impl.solidity.VariableDeclarationWriter;
import com.astwriter.core.writer.impl.yul.YulAssignmentWriter;
import com.astwriter.core.writer.impl.yul.YulBlockWriter;
import com.astwriter.core.writer.impl.yul.YulExpressionStatementWriter;
import com.astwriter.core.writer.impl.yul.YulFunctionCallWriter;
import com.astwriter.core.writer.impl.yul.YulIdentifierWriter;
import com.astwriter.core.writer.impl.yul.YulIfWriter;
import com.astwriter.core.writer.impl.yul.YulLiteralWriter;
import com.astwriter.core.writer.impl.yul.YulTypedNameWriter;
import com.astwriter.core.writer.impl.yul.YulVariableDeclarationWriter;

/**
 * Reference writer catalog for a Solidity subset, with Yul as the inline assembly IR.
 *
 * <p>Both mappings are immutable and shared by every writer this provider creates.
 */
public class SolidityMappingProvider implements WriterMappingProvider {

    public static final String ID = "solidity";

    private static final IrWriterMapping IR_MAPPING = IrWriterMapping.builder()
        .register("YulBlock", new YulBlockWriter())
        .register("YulVariableDeclaration", new YulVariableDeclarationWriter())
        .register("YulTypedName", new YulTypedNameWriter())
        .register("YulAssignment", new YulAssignmentWriter())
        .register("YulExpressionStatement", new YulExpressionStatementWriter())
        .register("YulFunctionCall", new YulFunctionCallWriter())
        .register("YulIdentifier", new YulIdentifierWriter())
        .register("YulLiteral", new YulLiteralWriter())
        .register("YulIf", new YulIfWriter())
        .build();

    private static final AstWriterMapping AST_MAPPING = AstWriterMapping.builder()
        .register(SourceUnit.class, new SourceUnitWriter())
        .register(PragmaDirective.class, new PragmaDirectiveWriter())
        .register(FunctionDefinition.class, new FunctionDefinitionWriter())
        .register(VariableDeclaration.class, new VariableDeclarationWriter())
        .register(Block.class, new BlockWriter())
        .register(UncheckedBlock.class, new UncheckedBlockWriter())
        .register(ExpressionStatement.class, new ExpressionStatementWriter())
        .register(VariableDeclarationStatement.class, new VariableDeclarationStatementWriter())
        .register(Return.class, new ReturnWriter())
        .register(IfStatement.class, new IfStatementWriter())
        .register(Assignment.class, new AssignmentWriter())
        .register(BinaryOperation.class, new BinaryOperationWriter())
        .register(FunctionCall.class, new FunctionCallWriter())
        .register(Identifier.class, new IdentifierWriter())
        .register(Literal.class, new LiteralWriter())
        .register(InlineAssembly.class, new InlineAssemblyWriter(IR_MAPPING))
        .build();

    @Override
    public String getId() {
        return ID;
    }

    @Override
    public String getDisplayName() {
        return "Solidity (with Yul inline assembly)";
    }

    @Override
    public AstWriterMapping getAstMapping() {
        return AST_MAPPING;
    }

    @Override
    public IrWriterMapping getIrMapping() {
        return IR_MAPPING;
    }
}
