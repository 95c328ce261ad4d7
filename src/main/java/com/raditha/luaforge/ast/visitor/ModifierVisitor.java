package com.raditha.luaforge.ast.visitor;

import com.raditha.luaforge.ast.*;

import java.util.ArrayList;
import java.util.List;

/**
 * Depth-first visitor that can replace any node it visits.
 * <p>
 * Each {@code visit} method receives a node, visits its children in source order
 * (storing back whatever the child visit returned) and returns the node that
 * should take its place. Overriding a method without calling {@code super}
 * stops the descent into that subtree. Statement visits may return null to
 * remove the statement from its block.
 * <p>
 * Blocks are traversed over a snapshot of their statements; a statement that an
 * earlier visit removed from the block is not visited.
 */
public class ModifierVisitor {

    // ================= blocks and statements =================

    public Block visit(Block block) {
        for (Statement statement : block.getAllStatements()) {
            if (block.indexOf(statement) < 0) {
                continue;
            }
            Statement replacement = statement.accept(this);
            int index = block.indexOf(statement);
            if (index < 0 || replacement == statement) {
                continue;
            }
            if (replacement == null) {
                block.remove(index);
            } else {
                block.replace(index, replacement);
            }
        }
        return block;
    }

    public Statement visit(LocalAssignStatement statement) {
        visitTypedIdentifiers(statement.getVariables());
        visitExpressions(statement.getValues());
        return statement;
    }

    public Statement visit(AssignStatement statement) {
        visitExpressions(statement.getVariables());
        visitExpressions(statement.getValues());
        return statement;
    }

    public Statement visit(CompoundAssignStatement statement) {
        statement.setVariable(visitExpression(statement.getVariable()));
        statement.setValue(visitExpression(statement.getValue()));
        return statement;
    }

    public Statement visit(FunctionStatement statement) {
        visit(statement.getBody());
        return statement;
    }

    public Statement visit(LocalFunctionStatement statement) {
        visit(statement.getBody());
        return statement;
    }

    public Statement visit(IfStatement statement) {
        for (IfBranch branch : statement.getBranches()) {
            branch.setCondition(visitExpression(branch.getCondition()));
            visit(branch.getBlock());
        }
        if (statement.getElseBlock() != null) {
            visit(statement.getElseBlock());
        }
        return statement;
    }

    public Statement visit(WhileStatement statement) {
        statement.setCondition(visitExpression(statement.getCondition()));
        visit(statement.getBlock());
        return statement;
    }

    public Statement visit(RepeatStatement statement) {
        visit(statement.getBlock());
        statement.setCondition(visitExpression(statement.getCondition()));
        return statement;
    }

    public Statement visit(NumericForStatement statement) {
        visit(statement.getVariable());
        statement.setStart(visitExpression(statement.getStart()));
        statement.setEnd(visitExpression(statement.getEnd()));
        if (statement.getStep() != null) {
            statement.setStep(visitExpression(statement.getStep()));
        }
        visit(statement.getBlock());
        return statement;
    }

    public Statement visit(GenericForStatement statement) {
        visitTypedIdentifiers(statement.getVariables());
        visitExpressions(statement.getExpressions());
        visit(statement.getBlock());
        return statement;
    }

    public Statement visit(DoStatement statement) {
        visit(statement.getBlock());
        return statement;
    }

    public Statement visit(CallStatement statement) {
        Expression call = visitExpression(statement.getCall());
        if (call instanceof FunctionCallExpression functionCall) {
            statement.setCall(functionCall);
            return statement;
        }
        throw new AstInvariantException("a call statement can only hold a function call, got "
                + call.getClass().getSimpleName());
    }

    public Statement visit(TypeDeclarationStatement statement) {
        visitGenericParameters(statement.getGenericParameters());
        statement.setType(visitType(statement.getType()));
        return statement;
    }

    public Statement visit(ReturnStatement statement) {
        visitExpressions(statement.getValues());
        return statement;
    }

    public Statement visit(BreakStatement statement) {
        return statement;
    }

    public Statement visit(ContinueStatement statement) {
        return statement;
    }

    // ================= expressions =================

    public Expression visit(NilExpression expression) {
        return expression;
    }

    public Expression visit(BooleanExpression expression) {
        return expression;
    }

    public Expression visit(NumberExpression expression) {
        return expression;
    }

    public Expression visit(StringExpression expression) {
        return expression;
    }

    public Expression visit(VariableArgumentsExpression expression) {
        return expression;
    }

    /**
     * Called for identifiers in expression position only. Declarations go
     * through {@link #visit(TypedIdentifier)}; field, method and type names are not visited.
     */
    public Expression visit(Identifier expression) {
        return expression;
    }

    public Expression visit(BinaryExpression expression) {
        expression.setLeft(visitExpression(expression.getLeft()));
        expression.setRight(visitExpression(expression.getRight()));
        return expression;
    }

    public Expression visit(UnaryExpression expression) {
        expression.setOperand(visitExpression(expression.getOperand()));
        return expression;
    }

    public Expression visit(FunctionExpression expression) {
        visit(expression.getBody());
        return expression;
    }

    public Expression visit(TableExpression expression) {
        for (TableEntry entry : expression.getEntries()) {
            if (entry instanceof TableIndexEntry indexEntry) {
                indexEntry.setKey(visitExpression(indexEntry.getKey()));
            }
            entry.setValue(visitExpression(entry.getValue()));
        }
        return expression;
    }

    public Expression visit(FieldExpression expression) {
        expression.setPrefix(visitExpression(expression.getPrefix()));
        return expression;
    }

    public Expression visit(IndexExpression expression) {
        expression.setPrefix(visitExpression(expression.getPrefix()));
        expression.setIndex(visitExpression(expression.getIndex()));
        return expression;
    }

    public Expression visit(FunctionCallExpression expression) {
        expression.setPrefix(visitExpression(expression.getPrefix()));
        visitExpressions(expression.getArguments());
        return expression;
    }

    public Expression visit(ParentheseExpression expression) {
        expression.setInner(visitExpression(expression.getInner()));
        return expression;
    }

    public Expression visit(TypeCastExpression expression) {
        expression.setExpression(visitExpression(expression.getExpression()));
        expression.setType(visitType(expression.getType()));
        return expression;
    }

    public Expression visit(IfExpression expression) {
        expression.setCondition(visitExpression(expression.getCondition()));
        expression.setResult(visitExpression(expression.getResult()));
        for (ElseIfExpressionBranch branch : expression.getBranches()) {
            branch.setCondition(visitExpression(branch.getCondition()));
            branch.setResult(visitExpression(branch.getResult()));
        }
        expression.setElseResult(visitExpression(expression.getElseResult()));
        return expression;
    }

    public Expression visit(InterpolatedStringExpression expression) {
        for (InterpolationSegment segment : expression.getSegments()) {
            if (!segment.isText()) {
                segment.setExpression(visitExpression(segment.getExpression()));
            }
        }
        return expression;
    }

    // ================= shared parts =================

    public FunctionBody visit(FunctionBody body) {
        visitGenericParameters(body.getGenericParameters());
        visitTypedIdentifiers(body.getParameters());
        if (body.getVariadicType() != null) {
            body.setVariadicType(visitType(body.getVariadicType()));
        }
        if (body.getReturnType() != null) {
            body.setReturnType(visitType(body.getReturnType()));
        }
        visit(body.getBlock());
        return body;
    }

    public TypedIdentifier visit(TypedIdentifier identifier) {
        if (identifier.getType() != null) {
            identifier.setType(visitType(identifier.getType()));
        }
        return identifier;
    }

    public GenericParameter visit(GenericParameter parameter) {
        if (parameter.getDefaultType() != null) {
            parameter.setDefaultType(visitType(parameter.getDefaultType()));
        }
        return parameter;
    }

    // ================= types =================

    public TypeNode visit(NamedType type) {
        visitTypes(type.getArguments());
        return type;
    }

    public TypeNode visit(LiteralType type) {
        return type;
    }

    public TypeNode visit(TypeofType type) {
        type.setExpression(visitExpression(type.getExpression()));
        return type;
    }

    public TypeNode visit(TableType type) {
        for (TableTypeEntry entry : type.getEntries()) {
            if (entry.getKey() != null) {
                entry.setKey(visitType(entry.getKey()));
            }
            entry.setValue(visitType(entry.getValue()));
        }
        return type;
    }

    public TypeNode visit(ArrayType type) {
        type.setElement(visitType(type.getElement()));
        return type;
    }

    public TypeNode visit(FunctionType type) {
        visitGenericParameters(type.getGenericParameters());
        for (FunctionTypeParameter parameter : type.getParameters()) {
            parameter.setType(visitType(parameter.getType()));
        }
        type.setReturnType(visitType(type.getReturnType()));
        return type;
    }

    public TypeNode visit(UnionType type) {
        visitTypes(type.getTypes());
        return type;
    }

    public TypeNode visit(IntersectionType type) {
        visitTypes(type.getTypes());
        return type;
    }

    public TypeNode visit(OptionalType type) {
        type.setInner(visitType(type.getInner()));
        return type;
    }

    public TypeNode visit(ParenthesizedType type) {
        type.setInner(visitType(type.getInner()));
        return type;
    }

    public TypeNode visit(TypePack type) {
        visitTypes(type.getTypes());
        return type;
    }

    public TypeNode visit(VariadicTypePack type) {
        type.setType(visitType(type.getType()));
        return type;
    }

    public TypeNode visit(GenericTypePack type) {
        return type;
    }

    // ================= helpers =================

    protected Expression visitExpression(Expression expression) {
        Expression replacement = expression.accept(this);
        if (replacement == null) {
            throw new AstInvariantException("an expression slot cannot be emptied (visiting "
                    + expression.getClass().getSimpleName() + ")");
        }
        return replacement;
    }

    protected TypeNode visitType(TypeNode type) {
        TypeNode replacement = type.accept(this);
        if (replacement == null) {
            throw new AstInvariantException("a type slot cannot be emptied (visiting "
                    + type.getClass().getSimpleName() + ")");
        }
        return replacement;
    }

    protected void visitExpressions(List<Expression> expressions) {
        for (int i = 0; i < expressions.size(); i++) {
            expressions.set(i, visitExpression(expressions.get(i)));
        }
    }

    protected void visitTypes(List<TypeNode> types) {
        for (int i = 0; i < types.size(); i++) {
            types.set(i, visitType(types.get(i)));
        }
    }

    protected void visitTypedIdentifiers(List<TypedIdentifier> identifiers) {
        for (TypedIdentifier identifier : new ArrayList<>(identifiers)) {
            visit(identifier);
        }
    }

    protected void visitGenericParameters(List<GenericParameter> parameters) {
        for (GenericParameter parameter : parameters) {
            visit(parameter);
        }
    }
}
