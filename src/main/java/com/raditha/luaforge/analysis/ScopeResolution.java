package com.raditha.luaforge.analysis;

import com.raditha.luaforge.ast.Identifier;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Result of resolving every identifier of a tree against its local declarations.
 * <p>
 * A resolution describes the tree as it was when {@link ScopeAnalyzer} ran.
 * Any structural change to the tree makes it stale.
 */
public class ScopeResolution {

    private final Scope root;
    private final List<Binding> bindings;
    private final Map<Identifier, Binding> resolved;
    private final Map<Identifier, Binding> declared;
    private final List<Identifier> freeReferences;
    private final Set<Identifier> freeReferenceSet;
    private final Set<String> freeNames;

    ScopeResolution(Scope root, List<Binding> bindings, Map<Identifier, Binding> resolved,
                    Map<Identifier, Binding> declared, List<Identifier> freeReferences) {
        this.root = root;
        this.bindings = bindings;
        this.resolved = resolved;
        this.declared = declared;
        this.freeReferences = freeReferences;
        this.freeReferenceSet = Collections.newSetFromMap(new IdentityHashMap<>());
        this.freeReferenceSet.addAll(freeReferences);
        Set<String> names = new TreeSet<>();
        for (Identifier identifier : freeReferences) {
            names.add(identifier.getName());
        }
        this.freeNames = Collections.unmodifiableSet(names);
    }

    public Scope getRoot() {
        return root;
    }

    /**
     * All bindings in the order their declarations were met.
     */
    public List<Binding> getBindings() {
        return Collections.unmodifiableList(bindings);
    }

    /**
     * The binding a referencing identifier resolves to, or null when it names a global.
     */
    public Binding bindingOf(Identifier reference) {
        return resolved.get(reference);
    }

    /**
     * The binding introduced by a declaring identifier, or null.
     */
    public Binding declaredBy(Identifier declaration) {
        return declared.get(declaration);
    }

    public boolean isGlobalReference(Identifier reference) {
        return freeReferenceSet.contains(reference);
    }

    public List<Identifier> getFreeReferences() {
        return Collections.unmodifiableList(freeReferences);
    }

    /**
     * Names of globals the tree reads or writes, sorted.
     */
    public Set<String> getFreeNames() {
        return freeNames;
    }
}
