package com.raditha.luaforge.analysis;

/**
 * Something a scope contains, in declaration order: a binding or a nested scope.
 */
public interface ScopeEntry {
}
