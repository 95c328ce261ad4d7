package com.raditha.luaforge.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * Name of a function statement: {@code root.field1.field2:method}.
 */
public class FunctionName extends Node {

    private Identifier root;
    private final List<Identifier> fields;
    private Identifier method;

    public FunctionName(Identifier root, List<Identifier> fields, Identifier method) {
        this.root = root;
        this.fields = new ArrayList<>(fields);
        this.method = method;
    }

    public Identifier getRoot() {
        return root;
    }

    public void setRoot(Identifier root) {
        this.root = root;
    }

    public List<Identifier> getFields() {
        return fields;
    }

    public Identifier getMethod() {
        return method;
    }

    public void setMethod(Identifier method) {
        this.method = method;
    }

    public boolean hasMethod() {
        return method != null;
    }

    @Override
    public List<Node> getChildren() {
        return children(root, fields, method);
    }

    @Override
    public FunctionName copy() {
        return new FunctionName(root.copy(), copyAll(fields), copyOrNull(method));
    }
}
