package com.raditha.luaforge.ast;

import com.raditha.luaforge.ast.visitor.ModifierVisitor;
import com.raditha.luaforge.model.Token;

import java.util.ArrayList;
import java.util.List;

/**
 * A function or method call, {@code prefix(args)} or {@code prefix:method(args)}.
 * Calls written {@code f"text"} or {@code f{...}} keep their argument style.
 */
public class FunctionCallExpression extends Expression {

    /**
     * How the arguments were written.
     */
    public enum ArgumentStyle {
        PARENTHESES,
        STRING,
        TABLE
    }

    private Expression prefix;
    private Identifier method;
    private final List<Expression> arguments;
    private ArgumentStyle argumentStyle;

    public FunctionCallExpression(Expression prefix, Identifier method, List<Expression> arguments) {
        this(prefix, method, arguments, ArgumentStyle.PARENTHESES);
    }

    public FunctionCallExpression(Expression prefix, Identifier method, List<Expression> arguments,
            ArgumentStyle argumentStyle) {
        this.prefix = prefix;
        this.method = method;
        this.arguments = new ArrayList<>(arguments);
        this.argumentStyle = argumentStyle;
    }

    public Expression getPrefix() {
        return prefix;
    }

    public void setPrefix(Expression prefix) {
        this.prefix = prefix;
    }

    public Identifier getMethod() {
        return method;
    }

    public void setMethod(Identifier method) {
        this.method = method;
    }

    public List<Expression> getArguments() {
        return arguments;
    }

    public ArgumentStyle getArgumentStyle() {
        return argumentStyle;
    }

    public void setArgumentStyle(ArgumentStyle argumentStyle) {
        this.argumentStyle = argumentStyle;
    }

    @Override
    public Token firstToken() {
        return prefix.firstToken();
    }

    @Override
    public Expression accept(ModifierVisitor visitor) {
        return visitor.visit(this);
    }

    @Override
    public List<Node> getChildren() {
        return children(prefix, method, arguments);
    }

    @Override
    public FunctionCallExpression copy() {
        return new FunctionCallExpression(prefix.copy(), copyOrNull(method), copyAll(arguments), argumentStyle);
    }
}
