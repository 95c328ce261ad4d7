package com.raditha.luaforge.rules;

import com.raditha.luaforge.analysis.ScopeResolution;
import com.raditha.luaforge.ast.FieldExpression;
import com.raditha.luaforge.ast.FunctionCallExpression;

import java.util.Set;

/**
 * Removes {@code debug.profilebegin(...)} and {@code debug.profileend()} calls.
 */
public class RemoveDebugProfiling extends AbstractCallRemoval {

    public static final String NAME = "remove_debug_profiling";

    private static final Set<String> PROFILING_FUNCTIONS = Set.of("profilebegin", "profileend");

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    protected boolean isRemovedCall(FunctionCallExpression call, ScopeResolution resolution) {
        return call.getMethod() == null
                && call.getPrefix() instanceof FieldExpression field
                && PROFILING_FUNCTIONS.contains(field.getField().getName())
                && isGlobal(field.getPrefix(), "debug", resolution);
    }
}
