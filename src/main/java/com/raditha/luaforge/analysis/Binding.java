package com.raditha.luaforge.analysis;

import com.raditha.luaforge.ast.Identifier;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A local name introduced by a declaration, together with every identifier that
 * resolves to it.
 */
public class Binding implements ScopeEntry {

    public enum Kind {
        LOCAL,
        LOCAL_FUNCTION,
        PARAMETER,
        FOR_VARIABLE,
        /** the implicit {@code self} parameter of a method */
        SELF
    }

    public enum Access {
        READ,
        WRITE,
        READ_WRITE;

        public boolean reads() {
            return this != WRITE;
        }
    }

    public record Reference(Identifier identifier, Access access) {
    }

    private final String name;
    private final Kind kind;
    private final Identifier declaration;
    private final Scope scope;
    private final List<Reference> references = new ArrayList<>();

    Binding(String name, Kind kind, Identifier declaration, Scope scope) {
        this.name = name;
        this.kind = kind;
        this.declaration = declaration;
        this.scope = scope;
    }

    void addReference(Identifier identifier, Access access) {
        references.add(new Reference(identifier, access));
    }

    public String getName() {
        return name;
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * The declaring identifier, or null for the implicit {@code self}.
     */
    public Identifier getDeclaration() {
        return declaration;
    }

    public Scope getScope() {
        return scope;
    }

    public List<Reference> getReferences() {
        return Collections.unmodifiableList(references);
    }

    public boolean isReferenced() {
        return !references.isEmpty();
    }

    public boolean isRead() {
        return references.stream().anyMatch(reference -> reference.access().reads());
    }

    public boolean isWritten() {
        return references.stream().anyMatch(reference -> reference.access() != Access.READ);
    }

    /**
     * Renames the declaration and every reference.
     */
    public void rename(String newName) {
        if (declaration != null) {
            declaration.setName(newName);
        }
        for (Reference reference : references) {
            reference.identifier().setName(newName);
        }
    }

    @Override
    public String toString() {
        return kind + " " + name + " (" + references.size() + " references)";
    }
}
