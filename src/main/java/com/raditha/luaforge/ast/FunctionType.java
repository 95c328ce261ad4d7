package com.raditha.luaforge.ast;

import com.raditha.luaforge.ast.visitor.ModifierVisitor;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code <T>(a: A, ...B) -> R}
 */
public class FunctionType extends TypeNode {

    private final List<GenericParameter> genericParameters;
    private final List<FunctionTypeParameter> parameters;
    private TypeNode returnType;

    public FunctionType(List<GenericParameter> genericParameters, List<FunctionTypeParameter> parameters,
            TypeNode returnType) {
        this.genericParameters = new ArrayList<>(genericParameters);
        this.parameters = new ArrayList<>(parameters);
        this.returnType = returnType;
    }

    public List<GenericParameter> getGenericParameters() {
        return genericParameters;
    }

    public List<FunctionTypeParameter> getParameters() {
        return parameters;
    }

    public TypeNode getReturnType() {
        return returnType;
    }

    public void setReturnType(TypeNode returnType) {
        this.returnType = returnType;
    }

    @Override
    public TypeNode accept(ModifierVisitor visitor) {
        return visitor.visit(this);
    }

    @Override
    public List<Node> getChildren() {
        return children(genericParameters, parameters, returnType);
    }

    @Override
    public FunctionType copy() {
        return new FunctionType(copyAll(genericParameters), copyAll(parameters), returnType.copy());
    }
}
