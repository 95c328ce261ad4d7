package com.raditha.luaforge.rules;

import com.raditha.luaforge.ast.*;
import com.raditha.luaforge.ast.visitor.ModifierVisitor;
import com.raditha.luaforge.model.LuaStrings;
import com.raditha.luaforge.model.Token;
import com.raditha.luaforge.model.TokenType;

import java.io.ByteArrayOutputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Rewrites interpolated strings as {@code string.format} calls. Every embedded value is
 * passed through {@code tostring} and formatted with {@code %s}.
 */
public class RemoveInterpolatedString implements Rule {

    public static final String NAME = "remove_interpolated_string";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public void process(Block block, RuleContext context) {
        new ModifierVisitor() {
            @Override
            public Expression visit(InterpolatedStringExpression expression) {
                super.visit(expression);
                return convert(expression);
            }
        }.visit(block);
    }

    private static Expression convert(InterpolatedStringExpression expression) {
        ByteArrayOutputStream format = new ByteArrayOutputStream();
        List<Expression> values = new ArrayList<>();
        for (InterpolationSegment segment : expression.getSegments()) {
            if (segment.isText()) {
                for (byte b : LuaStrings.unescape(segment.getRawText())) {
                    if (b == '%') {
                        format.write('%');
                    }
                    format.write(b);
                }
            } else {
                format.write('%');
                format.write('s');
                values.add(call(new Identifier("tostring"), List.of(segment.getExpression())));
            }
        }
        if (values.isEmpty()) {
            return TokenInheritance.inherit(expression, StringExpression.of(unescapedText(expression)));
        }
        Identifier string = new Identifier("string");
        Token first = expression.firstToken();
        if (first != null) {
            string.addToken(first.withType(TokenType.NAME, "string"));
        }
        List<Expression> arguments = new ArrayList<>();
        arguments.add(StringExpression.of(format.toByteArray()));
        arguments.addAll(values);
        return call(new FieldExpression(string, new Identifier("format")), arguments);
    }

    private static byte[] unescapedText(InterpolatedStringExpression expression) {
        ByteArrayOutputStream text = new ByteArrayOutputStream();
        for (InterpolationSegment segment : expression.getSegments()) {
            text.writeBytes(LuaStrings.unescape(segment.getRawText()));
        }
        return text.toByteArray();
    }

    private static FunctionCallExpression call(Expression prefix, List<Expression> arguments) {
        return new FunctionCallExpression(prefix, null, new ArrayList<>(arguments));
    }
}
