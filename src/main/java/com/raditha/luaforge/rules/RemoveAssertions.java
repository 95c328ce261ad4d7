package com.raditha.luaforge.rules;

import com.raditha.luaforge.analysis.ScopeResolution;
import com.raditha.luaforge.ast.FunctionCallExpression;

/**
 * Removes {@code assert(...)} calls.
 */
public class RemoveAssertions extends AbstractCallRemoval {

    public static final String NAME = "remove_assertions";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    protected boolean isRemovedCall(FunctionCallExpression call, ScopeResolution resolution) {
        return call.getMethod() == null && isGlobal(call.getPrefix(), "assert", resolution);
    }
}
