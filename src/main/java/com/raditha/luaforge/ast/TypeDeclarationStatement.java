package com.raditha.luaforge.ast;

import com.raditha.luaforge.ast.visitor.ModifierVisitor;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code [export] type Name<T> = Type}
 */
public class TypeDeclarationStatement extends Statement {

    private final Identifier name;
    private final boolean exported;
    private final List<GenericParameter> genericParameters;
    private TypeNode type;

    public TypeDeclarationStatement(Identifier name, boolean exported, List<GenericParameter> genericParameters,
            TypeNode type) {
        this.name = name;
        this.exported = exported;
        this.genericParameters = new ArrayList<>(genericParameters);
        this.type = type;
    }

    public Identifier getName() {
        return name;
    }

    public boolean isExported() {
        return exported;
    }

    public List<GenericParameter> getGenericParameters() {
        return genericParameters;
    }

    public TypeNode getType() {
        return type;
    }

    public void setType(TypeNode type) {
        this.type = type;
    }

    @Override
    public Statement accept(ModifierVisitor visitor) {
        return visitor.visit(this);
    }

    @Override
    public List<Node> getChildren() {
        return children(name, genericParameters, type);
    }

    @Override
    public TypeDeclarationStatement copy() {
        return new TypeDeclarationStatement(name.copy(), exported, copyAll(genericParameters), type.copy());
    }
}
