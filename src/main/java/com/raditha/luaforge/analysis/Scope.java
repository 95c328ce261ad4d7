package com.raditha.luaforge.analysis;

import com.raditha.luaforge.ast.Node;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A lexical scope. Entries keep declaration order so that walking a scope tree
 * visits bindings in the order the program introduces them.
 */
public class Scope implements ScopeEntry {

    private final Scope parent;
    private final Node owner;
    private final List<ScopeEntry> entries = new ArrayList<>();

    Scope(Scope parent, Node owner) {
        this.parent = parent;
        this.owner = owner;
    }

    void add(ScopeEntry entry) {
        entries.add(entry);
    }

    public Scope getParent() {
        return parent;
    }

    /**
     * The node that opened this scope: a block, a function body or a loop.
     */
    public Node getOwner() {
        return owner;
    }

    public List<ScopeEntry> getEntries() {
        return Collections.unmodifiableList(entries);
    }

    public List<Binding> getBindings() {
        List<Binding> bindings = new ArrayList<>();
        for (ScopeEntry entry : entries) {
            if (entry instanceof Binding binding) {
                bindings.add(binding);
            }
        }
        return bindings;
    }

    public List<Scope> getChildren() {
        List<Scope> children = new ArrayList<>();
        for (ScopeEntry entry : entries) {
            if (entry instanceof Scope scope) {
                children.add(scope);
            }
        }
        return children;
    }
}
