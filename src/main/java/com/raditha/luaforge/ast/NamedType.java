package com.raditha.luaforge.ast;

import com.raditha.luaforge.ast.visitor.ModifierVisitor;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code Name}, {@code module.Name} or {@code Name<Args>}.
 */
public class NamedType extends TypeNode {

    private final Identifier module;
    private final Identifier name;
    private final List<TypeNode> arguments;

    public NamedType(Identifier module, Identifier name, List<TypeNode> arguments) {
        this.module = module;
        this.name = name;
        this.arguments = new ArrayList<>(arguments);
    }

    public NamedType(String name) {
        this(null, new Identifier(name), List.of());
    }

    public Identifier getModule() {
        return module;
    }

    public Identifier getName() {
        return name;
    }

    public List<TypeNode> getArguments() {
        return arguments;
    }

    @Override
    public TypeNode accept(ModifierVisitor visitor) {
        return visitor.visit(this);
    }

    @Override
    public List<Node> getChildren() {
        return children(module, name, arguments);
    }

    @Override
    public NamedType copy() {
        return new NamedType(copyOrNull(module), name.copy(), copyAll(arguments));
    }
}
