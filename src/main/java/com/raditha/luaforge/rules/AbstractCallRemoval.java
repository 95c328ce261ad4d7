package com.raditha.luaforge.rules;

import com.raditha.luaforge.analysis.ScopeAnalyzer;
import com.raditha.luaforge.analysis.ScopeResolution;
import com.raditha.luaforge.ast.*;
import com.raditha.luaforge.ast.visitor.ModifierVisitor;
import com.raditha.luaforge.evaluator.Evaluator;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Base for rules that delete calls to a global function used as statements.
 * <p>
 * With {@code preserve_arguments_side_effects} (the default) arguments that may have
 * side effects are kept: calls stay as call statements, anything else is assigned to
 * a throwaway local.
 */
public abstract class AbstractCallRemoval implements Rule {

    static final String PRESERVE_PROPERTY = "preserve_arguments_side_effects";

    private final Evaluator evaluator = new Evaluator();
    private boolean preserveArgumentsSideEffects = true;

    @Override
    public void configure(RuleProperties properties) throws RuleConfigurationException {
        this.preserveArgumentsSideEffects = properties.getBoolean(PRESERVE_PROPERTY, true);
        properties.requireNoneLeft();
    }

    /**
     * Whether the call targets the removed function. Globals are only matched when no
     * local of the same name is visible.
     */
    protected abstract boolean isRemovedCall(FunctionCallExpression call, ScopeResolution resolution);

    /**
     * Whether the prefix is an unshadowed reference to the given global.
     */
    protected static boolean isGlobal(Expression prefix, String name, ScopeResolution resolution) {
        return prefix instanceof Identifier identifier && identifier.getName().equals(name)
                && resolution.isGlobalReference(identifier);
    }

    @Override
    public void process(Block block, RuleContext context) {
        ScopeResolution resolution = ScopeAnalyzer.analyze(block);
        new ModifierVisitor() {
            @Override
            public Statement visit(CallStatement statement) {
                super.visit(statement);
                if (!isRemovedCall(statement.getCall(), resolution)) {
                    return statement;
                }
                return preserveArgumentsSideEffects ? keepSideEffects(statement.getCall()) : null;
            }
        }.visit(block);
    }

    private Statement keepSideEffects(FunctionCallExpression call) {
        List<Statement> kept = new ArrayList<>();
        for (Expression argument : call.getArguments()) {
            if (!evaluator.hasSideEffects(argument)) {
                continue;
            }
            if (argument instanceof FunctionCallExpression argumentCall) {
                kept.add(new CallStatement(argumentCall));
            } else {
                kept.add(new LocalAssignStatement(List.of(new TypedIdentifier("_")), List.of(argument)));
            }
        }
        if (kept.isEmpty()) {
            return null;
        }
        if (kept.size() == 1 && kept.get(0) instanceof CallStatement) {
            return kept.get(0);
        }
        Block block = new Block();
        kept.forEach(block::append);
        return new DoStatement(block);
    }

    @Override
    public Map<String, Object> serializeToProperties() {
        Map<String, Object> properties = new LinkedHashMap<>();
        if (!preserveArgumentsSideEffects) {
            properties.put(PRESERVE_PROPERTY, false);
        }
        return properties;
    }
}
