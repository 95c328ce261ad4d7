package com.raditha.luaforge.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * Parameters, annotations and block shared by function statements and function expressions.
 */
public class FunctionBody extends Node {

    private final List<GenericParameter> genericParameters;
    private final List<TypedIdentifier> parameters;
    private boolean variadic;
    private TypeNode variadicType;
    private TypeNode returnType;
    private Block block;

    public FunctionBody(List<TypedIdentifier> parameters, boolean variadic, Block block) {
        this.genericParameters = new ArrayList<>();
        this.parameters = new ArrayList<>(parameters);
        this.variadic = variadic;
        this.block = block;
    }

    public List<GenericParameter> getGenericParameters() {
        return genericParameters;
    }

    public List<TypedIdentifier> getParameters() {
        return parameters;
    }

    public boolean isVariadic() {
        return variadic;
    }

    public void setVariadic(boolean variadic) {
        this.variadic = variadic;
    }

    public TypeNode getVariadicType() {
        return variadicType;
    }

    public void setVariadicType(TypeNode variadicType) {
        this.variadicType = variadicType;
    }

    public TypeNode getReturnType() {
        return returnType;
    }

    public void setReturnType(TypeNode returnType) {
        this.returnType = returnType;
    }

    public Block getBlock() {
        return block;
    }

    public void setBlock(Block block) {
        this.block = block;
    }

    @Override
    public List<Node> getChildren() {
        return children(genericParameters, parameters, variadicType, returnType, block);
    }

    @Override
    public FunctionBody copy() {
        FunctionBody copy = new FunctionBody(copyAll(parameters), variadic, block.copy());
        copy.genericParameters.addAll(copyAll(genericParameters));
        copy.variadicType = copyOrNull(variadicType);
        copy.returnType = copyOrNull(returnType);
        return copy;
    }
}
