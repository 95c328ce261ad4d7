package com.raditha.luaforge.analysis;

import com.raditha.luaforge.ast.*;
import com.raditha.luaforge.ast.visitor.ModifierVisitor;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Resolves identifiers to local declarations following Lua scoping rules.
 * <ul>
 *     <li>a local is visible after its whole declaration statement, so its own
 *     initializer still sees the outer name</li>
 *     <li>a local function is visible inside its own body</li>
 *     <li>the condition of a repeat loop sees the locals of the loop body</li>
 *     <li>method definitions receive an implicit {@code self} parameter</li>
 * </ul>
 * The analyzer never modifies the tree.
 */
public class ScopeAnalyzer extends ModifierVisitor {

    private final Deque<Frame> frames = new ArrayDeque<>();
    private final List<Binding> bindings = new ArrayList<>();
    private final Map<Identifier, Binding> resolved = new IdentityHashMap<>();
    private final Map<Identifier, Binding> declared = new IdentityHashMap<>();
    private final List<Identifier> freeReferences = new ArrayList<>();
    private Scope root;

    private ScopeAnalyzer() {
    }

    public static ScopeResolution analyze(Block block) {
        ScopeAnalyzer analyzer = new ScopeAnalyzer();
        analyzer.root = analyzer.push(block);
        analyzer.visitStatements(block);
        analyzer.pop();
        return new ScopeResolution(analyzer.root, analyzer.bindings, analyzer.resolved,
                analyzer.declared, analyzer.freeReferences);
    }

    // ================= scopes =================

    @Override
    public Block visit(Block block) {
        push(block);
        visitStatements(block);
        pop();
        return block;
    }

    private void visitStatements(Block block) {
        super.visit(block);
    }

    @Override
    public Statement visit(RepeatStatement statement) {
        push(statement);
        visitStatements(statement.getBlock());
        statement.setCondition(visitExpression(statement.getCondition()));
        pop();
        return statement;
    }

    @Override
    public Statement visit(NumericForStatement statement) {
        visitExpression(statement.getStart());
        visitExpression(statement.getEnd());
        if (statement.getStep() != null) {
            visitExpression(statement.getStep());
        }
        push(statement);
        visit(statement.getVariable());
        declare(statement.getVariable(), Binding.Kind.FOR_VARIABLE);
        visitStatements(statement.getBlock());
        pop();
        return statement;
    }

    @Override
    public Statement visit(GenericForStatement statement) {
        visitExpressions(statement.getExpressions());
        push(statement);
        for (TypedIdentifier variable : statement.getVariables()) {
            visit(variable);
            declare(variable, Binding.Kind.FOR_VARIABLE);
        }
        visitStatements(statement.getBlock());
        pop();
        return statement;
    }

    @Override
    public FunctionBody visit(FunctionBody body) {
        visitFunctionBody(body, false);
        return body;
    }

    private void visitFunctionBody(FunctionBody body, boolean method) {
        push(body);
        if (method) {
            declareSelf();
        }
        visitGenericParameters(body.getGenericParameters());
        for (TypedIdentifier parameter : body.getParameters()) {
            visit(parameter);
            declare(parameter, Binding.Kind.PARAMETER);
        }
        if (body.getVariadicType() != null) {
            visitType(body.getVariadicType());
        }
        if (body.getReturnType() != null) {
            visitType(body.getReturnType());
        }
        visitStatements(body.getBlock());
        pop();
    }

    // ================= declarations =================

    @Override
    public Statement visit(LocalAssignStatement statement) {
        visitExpressions(statement.getValues());
        for (TypedIdentifier variable : statement.getVariables()) {
            visit(variable);
        }
        for (TypedIdentifier variable : statement.getVariables()) {
            declare(variable, Binding.Kind.LOCAL);
        }
        return statement;
    }

    @Override
    public Statement visit(LocalFunctionStatement statement) {
        declare(statement.getName(), Binding.Kind.LOCAL_FUNCTION);
        visit(statement.getBody());
        return statement;
    }

    @Override
    public Statement visit(FunctionStatement statement) {
        FunctionName name = statement.getName();
        boolean plain = name.getFields().isEmpty() && !name.hasMethod();
        reference(name.getRoot(), plain ? Binding.Access.WRITE : Binding.Access.READ);
        visitFunctionBody(statement.getBody(), name.hasMethod());
        return statement;
    }

    // ================= references =================

    @Override
    public Statement visit(AssignStatement statement) {
        for (Expression variable : statement.getVariables()) {
            if (variable instanceof Identifier identifier) {
                reference(identifier, Binding.Access.WRITE);
            } else {
                visitExpression(variable);
            }
        }
        visitExpressions(statement.getValues());
        return statement;
    }

    @Override
    public Statement visit(CompoundAssignStatement statement) {
        if (statement.getVariable() instanceof Identifier identifier) {
            reference(identifier, Binding.Access.READ_WRITE);
        } else {
            visitExpression(statement.getVariable());
        }
        visitExpression(statement.getValue());
        return statement;
    }

    @Override
    public Expression visit(Identifier expression) {
        reference(expression, Binding.Access.READ);
        return expression;
    }

    // ================= bookkeeping =================

    private Scope push(Node owner) {
        Frame parent = frames.peek();
        Scope scope = new Scope(parent == null ? null : parent.scope, owner);
        if (parent != null) {
            parent.scope.add(scope);
        }
        frames.push(new Frame(scope));
        return scope;
    }

    private void pop() {
        frames.pop();
    }

    private void declare(Identifier identifier, Binding.Kind kind) {
        Frame frame = frames.peek();
        Binding binding = new Binding(identifier.getName(), kind, identifier, frame.scope);
        frame.scope.add(binding);
        frame.visible.put(identifier.getName(), binding);
        bindings.add(binding);
        declared.put(identifier, binding);
    }

    private void declareSelf() {
        Frame frame = frames.peek();
        Binding binding = new Binding("self", Binding.Kind.SELF, null, frame.scope);
        frame.scope.add(binding);
        frame.visible.put("self", binding);
        bindings.add(binding);
    }

    private void reference(Identifier identifier, Binding.Access access) {
        Binding binding = lookup(identifier.getName());
        if (binding == null) {
            freeReferences.add(identifier);
        } else {
            binding.addReference(identifier, access);
            resolved.put(identifier, binding);
        }
    }

    private Binding lookup(String name) {
        for (Frame frame : frames) {
            Binding binding = frame.visible.get(name);
            if (binding != null) {
                return binding;
            }
        }
        return null;
    }

    private static final class Frame {
        private final Scope scope;
        private final Map<String, Binding> visible = new HashMap<>();

        private Frame(Scope scope) {
            this.scope = scope;
        }
    }
}
