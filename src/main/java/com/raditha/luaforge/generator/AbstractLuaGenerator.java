package com.raditha.luaforge.generator;

import com.raditha.luaforge.ast.*;
import com.raditha.luaforge.model.Token;

import java.util.List;
import java.util.Set;

/**
 * Walks a syntax tree in source order and reports every token to the concrete generator.
 * <p>
 * This class decides what has to be written: keywords, punctuation, the parentheses
 * required by operator precedence and the semicolons that keep a statement starting
 * with {@code (} from being read as a call. Subclasses decide how it is laid out.
 */
public abstract class AbstractLuaGenerator implements LuaGenerator {

    /**
     * How a token relates to the text around it.
     */
    protected enum Spacing {
        /** Glued to the previous token */
        ATTACHED,
        /** Surrounded by spaces, e.g. binary operators and keywords */
        SPACED,
        /** Glued to the previous token, followed by a space */
        COMMA,
        /** Separated from the previous token only after a spaced token */
        OPEN,
        /** Always separated from the previous token */
        LEADING
    }

    private static final Set<String> TWO_CHARACTER_SYMBOLS = Set.of(
            "==", "~=", "<=", ">=", "//", "..", "::", "->",
            "+=", "-=", "*=", "/=", "%=", "^=");

    private String previousText = "";
    private int interpolationDepth;

    @Override
    public String generate(Block block) {
        writeBlock(block);
        endOfFile(block.getEndOfFile());
        return result();
    }

    // ================= output hooks =================

    /**
     * Writes one token.
     *
     * @param token    the source token carrying trivia and position, or null when synthesized
     * @param text     the text to write
     * @param spacing  relation to the surrounding tokens
     * @param separate whether the token would merge with the previous one without whitespace
     */
    protected abstract void write(Token token, String text, Spacing spacing, boolean separate);

    /**
     * Writes text that is part of an interpolated string literal.
     */
    protected abstract void raw(String text);

    protected abstract void endOfFile(Token token);

    protected abstract String result();

    protected void beginStatement(Statement statement) {
    }

    protected void enterBlock() {
    }

    protected void exitBlock(Block block) {
    }

    protected void semicolon(Statement statement, boolean required) {
        if (required) {
            synthetic(";", Spacing.ATTACHED);
        }
    }

    /**
     * The source token to use for a keyword or punctuation of the node, or null.
     */
    protected Token findToken(Node owner, String text) {
        return null;
    }

    /**
     * The source token holding the value of a leaf node, or null.
     */
    protected Token leafToken(Node owner) {
        return null;
    }

    /**
     * The source token separating two entries of a table or table type, or null.
     */
    protected Token findSeparator(Node owner) {
        return null;
    }

    /**
     * The source separator written after the last entry, or null when there was none.
     */
    protected Token findTrailingSeparator(Node owner, int entryCount) {
        return null;
    }

    protected boolean insideInterpolation() {
        return interpolationDepth > 0;
    }

    // ================= token emission =================

    protected final void symbol(Node owner, String text, Spacing spacing) {
        emit(findToken(owner, text), text, spacing);
    }

    protected final void leaf(Node owner, String text) {
        emit(leafToken(owner), text, Spacing.OPEN);
    }

    protected final void synthetic(String text, Spacing spacing) {
        emit(null, text, spacing);
    }

    private void emit(Token token, String text, Spacing spacing) {
        write(token, text, spacing, needsSpace(previousText, text));
        previousText = text;
    }

    private void separator(Node owner) {
        Token token = findSeparator(owner);
        emit(token, token == null ? "," : token.text(), Spacing.COMMA);
    }

    private void trailingSeparator(Node owner, int entryCount) {
        Token token = findTrailingSeparator(owner, entryCount);
        if (token != null) {
            emit(token, token.text(), Spacing.COMMA);
        }
    }

    private void rawText(String text) {
        raw(text);
        previousText = "";
    }

    /**
     * Whether two tokens written next to each other would be read back as something else.
     */
    static boolean needsSpace(String previous, String next) {
        if (previous.isEmpty() || next.isEmpty()) {
            return false;
        }
        char left = previous.charAt(previous.length() - 1);
        char right = next.charAt(0);
        if (isWordCharacter(left) && isWordCharacter(right)) {
            return true;
        }
        if (right == '.' && (isNumber(previous) || left == '.')) {
            return true;
        }
        if (left == '-' && right == '-') {
            return true;
        }
        if (left == '[' && (right == '[' || right == '=')) {
            return true;
        }
        if (left == '{' && right == '{') {
            return true;
        }
        return TWO_CHARACTER_SYMBOLS.contains(String.valueOf(new char[]{left, right}));
    }

    private static boolean isWordCharacter(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c > 127;
    }

    private static boolean isNumber(String text) {
        char first = text.charAt(0);
        return Character.isDigit(first) || first == '.' && text.length() > 1 && Character.isDigit(text.charAt(1));
    }

    // ================= blocks and statements =================

    protected void writeBlock(Block block) {
        List<Statement> statements = block.getAllStatements();
        for (int i = 0; i < statements.size(); i++) {
            Statement statement = statements.get(i);
            beginStatement(statement);
            writeStatement(statement);
            boolean required = i + 1 < statements.size() && startsWithParenthesis(statements.get(i + 1));
            semicolon(statement, required);
        }
    }

    private void writeNestedBlock(Block block) {
        enterBlock();
        writeBlock(block);
        exitBlock(block);
    }

    protected void writeStatement(Statement statement) {
        if (statement instanceof LocalAssignStatement local) {
            writeLocalAssign(local);
        } else if (statement instanceof AssignStatement assign) {
            writeExpressionList(assign, assign.getVariables());
            symbol(assign, "=", Spacing.SPACED);
            writeExpressionList(assign, assign.getValues());
        } else if (statement instanceof CompoundAssignStatement compound) {
            writeExpression(compound.getVariable());
            symbol(compound, compound.getOperator().getSymbol(), Spacing.SPACED);
            writeExpression(compound.getValue());
        } else if (statement instanceof CallStatement call) {
            writeExpression(call.getCall());
        } else if (statement instanceof FunctionStatement function) {
            writeFunctionStatement(function);
        } else if (statement instanceof LocalFunctionStatement function) {
            symbol(function, "local", Spacing.SPACED);
            symbol(function, "function", Spacing.SPACED);
            leaf(function.getName(), function.getName().getName());
            writeFunctionBody(function.getBody());
        } else if (statement instanceof IfStatement ifStatement) {
            writeIf(ifStatement);
        } else if (statement instanceof WhileStatement whileStatement) {
            symbol(whileStatement, "while", Spacing.SPACED);
            writeExpression(whileStatement.getCondition());
            symbol(whileStatement, "do", Spacing.SPACED);
            writeNestedBlock(whileStatement.getBlock());
            symbol(whileStatement, "end", Spacing.SPACED);
        } else if (statement instanceof RepeatStatement repeat) {
            symbol(repeat, "repeat", Spacing.SPACED);
            writeNestedBlock(repeat.getBlock());
            symbol(repeat, "until", Spacing.SPACED);
            writeExpression(repeat.getCondition());
        } else if (statement instanceof DoStatement doStatement) {
            symbol(doStatement, "do", Spacing.SPACED);
            writeNestedBlock(doStatement.getBlock());
            symbol(doStatement, "end", Spacing.SPACED);
        } else if (statement instanceof NumericForStatement numericFor) {
            writeNumericFor(numericFor);
        } else if (statement instanceof GenericForStatement genericFor) {
            writeGenericFor(genericFor);
        } else if (statement instanceof ReturnStatement returnStatement) {
            symbol(returnStatement, "return", Spacing.SPACED);
            writeExpressionList(returnStatement, returnStatement.getValues());
        } else if (statement instanceof BreakStatement breakStatement) {
            symbol(breakStatement, "break", Spacing.SPACED);
        } else if (statement instanceof ContinueStatement continueStatement) {
            symbol(continueStatement, "continue", Spacing.SPACED);
        } else if (statement instanceof TypeDeclarationStatement declaration) {
            writeTypeDeclaration(declaration);
        } else {
            throw new AstInvariantException("cannot generate " + statement.getClass().getSimpleName());
        }
    }

    private void writeLocalAssign(LocalAssignStatement statement) {
        symbol(statement, "local", Spacing.SPACED);
        List<TypedIdentifier> variables = statement.getVariables();
        for (int i = 0; i < variables.size(); i++) {
            if (i > 0) {
                symbol(statement, ",", Spacing.COMMA);
            }
            writeTypedIdentifier(variables.get(i));
        }
        if (!statement.getValues().isEmpty()) {
            symbol(statement, "=", Spacing.SPACED);
            writeExpressionList(statement, statement.getValues());
        }
    }

    private void writeFunctionStatement(FunctionStatement statement) {
        symbol(statement, "function", Spacing.SPACED);
        FunctionName name = statement.getName();
        leaf(name.getRoot(), name.getRoot().getName());
        for (Identifier field : name.getFields()) {
            symbol(name, ".", Spacing.ATTACHED);
            leaf(field, field.getName());
        }
        if (name.getMethod() != null) {
            symbol(name, ":", Spacing.ATTACHED);
            leaf(name.getMethod(), name.getMethod().getName());
        }
        writeFunctionBody(statement.getBody());
    }

    private void writeIf(IfStatement statement) {
        List<IfBranch> branches = statement.getBranches();
        for (int i = 0; i < branches.size(); i++) {
            IfBranch branch = branches.get(i);
            symbol(branch, i == 0 ? "if" : "elseif", Spacing.SPACED);
            writeExpression(branch.getCondition());
            symbol(branch, "then", Spacing.SPACED);
            writeNestedBlock(branch.getBlock());
        }
        if (statement.getElseBlock() != null) {
            symbol(statement, "else", Spacing.SPACED);
            writeNestedBlock(statement.getElseBlock());
        }
        symbol(statement, "end", Spacing.SPACED);
    }

    private void writeNumericFor(NumericForStatement statement) {
        symbol(statement, "for", Spacing.SPACED);
        writeTypedIdentifier(statement.getVariable());
        symbol(statement, "=", Spacing.SPACED);
        writeExpression(statement.getStart());
        symbol(statement, ",", Spacing.COMMA);
        writeExpression(statement.getEnd());
        if (statement.getStep() != null) {
            symbol(statement, ",", Spacing.COMMA);
            writeExpression(statement.getStep());
        }
        symbol(statement, "do", Spacing.SPACED);
        writeNestedBlock(statement.getBlock());
        symbol(statement, "end", Spacing.SPACED);
    }

    private void writeGenericFor(GenericForStatement statement) {
        symbol(statement, "for", Spacing.SPACED);
        List<TypedIdentifier> variables = statement.getVariables();
        for (int i = 0; i < variables.size(); i++) {
            if (i > 0) {
                symbol(statement, ",", Spacing.COMMA);
            }
            writeTypedIdentifier(variables.get(i));
        }
        symbol(statement, "in", Spacing.SPACED);
        writeExpressionList(statement, statement.getExpressions());
        symbol(statement, "do", Spacing.SPACED);
        writeNestedBlock(statement.getBlock());
        symbol(statement, "end", Spacing.SPACED);
    }

    private void writeTypeDeclaration(TypeDeclarationStatement statement) {
        if (statement.isExported()) {
            symbol(statement, "export", Spacing.SPACED);
        }
        symbol(statement, "type", Spacing.SPACED);
        leaf(statement.getName(), statement.getName().getName());
        writeGenericParameters(statement, statement.getGenericParameters(), Spacing.ATTACHED);
        symbol(statement, "=", Spacing.SPACED);
        writeType(statement.getType());
    }

    private void writeTypedIdentifier(TypedIdentifier identifier) {
        leaf(identifier, identifier.getName());
        if (identifier.getType() != null) {
            symbol(identifier, ":", Spacing.COMMA);
            writeType(identifier.getType());
        }
        if (identifier.getAttribute() != null) {
            symbol(identifier, "<", Spacing.LEADING);
            symbol(identifier, identifier.getAttribute(), Spacing.ATTACHED);
            symbol(identifier, ">", Spacing.ATTACHED);
        }
    }

    private void writeFunctionBody(FunctionBody body) {
        writeGenericParameters(body, body.getGenericParameters(), Spacing.ATTACHED);
        symbol(body, "(", Spacing.ATTACHED);
        List<TypedIdentifier> parameters = body.getParameters();
        for (int i = 0; i < parameters.size(); i++) {
            if (i > 0) {
                symbol(body, ",", Spacing.COMMA);
            }
            writeTypedIdentifier(parameters.get(i));
        }
        if (body.isVariadic()) {
            if (!parameters.isEmpty()) {
                symbol(body, ",", Spacing.COMMA);
            }
            symbol(body, "...", Spacing.OPEN);
            if (body.getVariadicType() != null) {
                symbol(body, ":", Spacing.COMMA);
                writeType(body.getVariadicType());
            }
        }
        symbol(body, ")", Spacing.ATTACHED);
        if (body.getReturnType() != null) {
            symbol(body, ":", Spacing.COMMA);
            writeType(body.getReturnType());
        }
        writeNestedBlock(body.getBlock());
        symbol(body, "end", Spacing.SPACED);
    }

    private void writeGenericParameters(Node owner, List<GenericParameter> parameters, Spacing opening) {
        if (parameters.isEmpty()) {
            return;
        }
        symbol(owner, "<", opening);
        for (int i = 0; i < parameters.size(); i++) {
            if (i > 0) {
                symbol(owner, ",", Spacing.COMMA);
            }
            GenericParameter parameter = parameters.get(i);
            leaf(parameter.getName(), parameter.getName().getName());
            if (parameter.isPack()) {
                symbol(parameter, "...", Spacing.ATTACHED);
            }
            if (parameter.getDefaultType() != null) {
                symbol(parameter, "=", Spacing.SPACED);
                writeType(parameter.getDefaultType());
            }
        }
        symbol(owner, ">", Spacing.ATTACHED);
    }

    /**
     * Whether the statement's output starts with an opening parenthesis, in which case the
     * previous statement must end with a semicolon.
     */
    static boolean startsWithParenthesis(Statement statement) {
        Expression current;
        if (statement instanceof CallStatement call) {
            current = call.getCall();
        } else if (statement instanceof AssignStatement assign && !assign.getVariables().isEmpty()) {
            current = assign.getVariables().get(0);
        } else if (statement instanceof CompoundAssignStatement compound) {
            current = compound.getVariable();
        } else {
            return false;
        }
        while (true) {
            Expression prefix;
            if (current instanceof FunctionCallExpression call) {
                prefix = call.getPrefix();
            } else if (current instanceof FieldExpression field) {
                prefix = field.getPrefix();
            } else if (current instanceof IndexExpression index) {
                prefix = index.getPrefix();
            } else {
                return current instanceof ParentheseExpression;
            }
            if (!isPrefix(prefix)) {
                return true;
            }
            current = prefix;
        }
    }

    private static boolean isPrefix(Expression expression) {
        return expression instanceof Identifier || expression instanceof FieldExpression
                || expression instanceof IndexExpression || expression instanceof FunctionCallExpression
                || expression instanceof ParentheseExpression;
    }

    // ================= expressions =================

    private void writeExpressionList(Node owner, List<Expression> expressions) {
        for (int i = 0; i < expressions.size(); i++) {
            if (i > 0) {
                symbol(owner, ",", Spacing.COMMA);
            }
            writeExpression(expressions.get(i));
        }
    }

    protected void writeExpression(Expression expression) {
        writeExpression(expression, true);
    }

    /**
     * @param rightmost whether nothing of the enclosing expression follows, so that an
     *                  if-expression (which extends as far right as possible) needs no parentheses
     */
    private void writeExpression(Expression expression, boolean rightmost) {
        if (expression instanceof NilExpression) {
            leaf(expression, "nil");
        } else if (expression instanceof BooleanExpression bool) {
            leaf(expression, bool.getValue() ? "true" : "false");
        } else if (expression instanceof NumberExpression number) {
            leaf(expression, number.getRaw());
        } else if (expression instanceof StringExpression string) {
            leaf(expression, string.getSourceText());
        } else if (expression instanceof VariableArgumentsExpression) {
            leaf(expression, "...");
        } else if (expression instanceof Identifier identifier) {
            leaf(expression, identifier.getName());
        } else if (expression instanceof BinaryExpression binary) {
            writeBinary(binary, rightmost);
        } else if (expression instanceof UnaryExpression unary) {
            symbol(unary, unary.getOperator().getSymbol(), Spacing.OPEN);
            Expression operand = unary.getOperand();
            boolean parentheses = operand instanceof BinaryExpression inner
                    && inner.getOperator().getLeftPriority() <= BinaryOperator.UNARY_PRIORITY
                    || operand instanceof IfExpression && !rightmost;
            writeOperand(operand, parentheses, rightmost);
        } else if (expression instanceof FunctionExpression function) {
            symbol(function, "function", Spacing.OPEN);
            writeFunctionBody(function.getBody());
        } else if (expression instanceof IfExpression ifExpression) {
            writeIfExpression(ifExpression, rightmost);
        } else if (expression instanceof TableExpression table) {
            writeTable(table);
        } else if (expression instanceof FieldExpression field) {
            writePrefix(field.getPrefix());
            symbol(field, ".", Spacing.ATTACHED);
            leaf(field.getField(), field.getField().getName());
        } else if (expression instanceof IndexExpression index) {
            writePrefix(index.getPrefix());
            symbol(index, "[", Spacing.ATTACHED);
            writeExpression(index.getIndex());
            symbol(index, "]", Spacing.ATTACHED);
        } else if (expression instanceof FunctionCallExpression call) {
            writeCall(call);
        } else if (expression instanceof ParentheseExpression parenthese) {
            symbol(parenthese, "(", Spacing.OPEN);
            writeExpression(parenthese.getInner());
            symbol(parenthese, ")", Spacing.ATTACHED);
        } else if (expression instanceof TypeCastExpression cast) {
            Expression subject = cast.getExpression();
            boolean parentheses = subject instanceof BinaryExpression || subject instanceof UnaryExpression
                    || subject instanceof IfExpression;
            writeOperand(subject, parentheses, false);
            symbol(cast, "::", Spacing.SPACED);
            writeType(cast.getType());
        } else if (expression instanceof InterpolatedStringExpression interpolated) {
            writeInterpolatedString(interpolated);
        } else {
            throw new AstInvariantException("cannot generate " + expression.getClass().getSimpleName());
        }
    }

    private void writeBinary(BinaryExpression binary, boolean rightmost) {
        BinaryOperator operator = binary.getOperator();
        Expression left = binary.getLeft();
        Expression right = binary.getRight();

        boolean leftParentheses;
        if (left instanceof BinaryExpression inner) {
            leftParentheses = operator.getLeftPriority() > inner.getOperator().getRightPriority();
        } else if (left instanceof UnaryExpression) {
            leftParentheses = operator.getLeftPriority() > BinaryOperator.UNARY_PRIORITY;
        } else {
            leftParentheses = left instanceof IfExpression;
        }
        writeOperand(left, leftParentheses, false);

        symbol(binary, operator.getSymbol(), Spacing.SPACED);

        boolean rightParentheses;
        if (right instanceof BinaryExpression inner) {
            rightParentheses = inner.getOperator().getLeftPriority() <= operator.getRightPriority();
        } else {
            rightParentheses = right instanceof IfExpression && !rightmost;
        }
        writeOperand(right, rightParentheses, rightmost);
    }

    private void writeOperand(Expression operand, boolean parentheses, boolean rightmost) {
        if (parentheses) {
            writeWrapped(operand);
        } else {
            writeExpression(operand, rightmost);
        }
    }

    private void writeWrapped(Expression expression) {
        synthetic("(", Spacing.OPEN);
        writeExpression(expression);
        synthetic(")", Spacing.ATTACHED);
    }

    private void writePrefix(Expression prefix) {
        if (isPrefix(prefix)) {
            writeExpression(prefix);
        } else {
            writeWrapped(prefix);
        }
    }

    private void writeIfExpression(IfExpression expression, boolean rightmost) {
        symbol(expression, "if", Spacing.OPEN);
        writeExpression(expression.getCondition());
        symbol(expression, "then", Spacing.SPACED);
        writeExpression(expression.getResult());
        for (ElseIfExpressionBranch branch : expression.getBranches()) {
            symbol(branch, "elseif", Spacing.SPACED);
            writeExpression(branch.getCondition());
            symbol(branch, "then", Spacing.SPACED);
            writeExpression(branch.getResult());
        }
        symbol(expression, "else", Spacing.SPACED);
        writeExpression(expression.getElseResult(), rightmost);
    }

    private void writeTable(TableExpression table) {
        symbol(table, "{", Spacing.OPEN);
        List<TableEntry> entries = table.getEntries();
        for (int i = 0; i < entries.size(); i++) {
            if (i > 0) {
                separator(table);
            }
            TableEntry entry = entries.get(i);
            if (entry instanceof TableValueEntry value) {
                writeExpression(value.getValue());
            } else if (entry instanceof TableFieldEntry field) {
                leaf(field.getField(), field.getField().getName());
                symbol(field, "=", Spacing.SPACED);
                writeExpression(field.getValue());
            } else if (entry instanceof TableIndexEntry index) {
                symbol(index, "[", Spacing.OPEN);
                writeExpression(index.getKey());
                symbol(index, "]", Spacing.ATTACHED);
                symbol(index, "=", Spacing.SPACED);
                writeExpression(index.getValue());
            }
        }
        trailingSeparator(table, entries.size());
        symbol(table, "}", Spacing.ATTACHED);
    }

    private void writeCall(FunctionCallExpression call) {
        writePrefix(call.getPrefix());
        if (call.getMethod() != null) {
            symbol(call, ":", Spacing.ATTACHED);
            leaf(call.getMethod(), call.getMethod().getName());
        }
        List<Expression> arguments = call.getArguments();
        FunctionCallExpression.ArgumentStyle style = call.getArgumentStyle();
        boolean single = arguments.size() == 1;
        if (style == FunctionCallExpression.ArgumentStyle.STRING && single
                && arguments.get(0) instanceof StringExpression
                || style == FunctionCallExpression.ArgumentStyle.TABLE && single
                && arguments.get(0) instanceof TableExpression) {
            writeExpression(arguments.get(0));
            return;
        }
        symbol(call, "(", Spacing.ATTACHED);
        writeExpressionList(call, arguments);
        symbol(call, ")", Spacing.ATTACHED);
    }

    private void writeInterpolatedString(InterpolatedStringExpression expression) {
        interpolationDepth++;
        symbol(expression, "`", Spacing.OPEN);
        for (InterpolationSegment segment : expression.getSegments()) {
            if (segment.isText()) {
                rawText(segment.getRawText());
            } else {
                symbol(segment, "{", Spacing.ATTACHED);
                writeExpression(segment.getExpression());
                symbol(segment, "}", Spacing.ATTACHED);
            }
        }
        symbol(expression, "`", Spacing.ATTACHED);
        interpolationDepth--;
    }

    // ================= types =================

    protected void writeType(TypeNode type) {
        if (type instanceof NamedType named) {
            if (named.getModule() != null) {
                leaf(named.getModule(), named.getModule().getName());
                symbol(named, ".", Spacing.ATTACHED);
            }
            leaf(named.getName(), named.getName().getName());
            if (!named.getArguments().isEmpty()) {
                symbol(named, "<", Spacing.ATTACHED);
                writeTypeList(named, named.getArguments());
                symbol(named, ">", Spacing.ATTACHED);
            }
        } else if (type instanceof LiteralType literal) {
            leaf(literal, literal.getText());
        } else if (type instanceof TypeofType typeof) {
            symbol(typeof, "typeof", Spacing.OPEN);
            symbol(typeof, "(", Spacing.ATTACHED);
            writeExpression(typeof.getExpression());
            symbol(typeof, ")", Spacing.ATTACHED);
        } else if (type instanceof TableType table) {
            writeTableType(table);
        } else if (type instanceof ArrayType array) {
            symbol(array, "{", Spacing.OPEN);
            writeType(array.getElement());
            symbol(array, "}", Spacing.ATTACHED);
        } else if (type instanceof FunctionType function) {
            writeGenericParameters(function, function.getGenericParameters(), Spacing.OPEN);
            symbol(function, "(", function.getGenericParameters().isEmpty() ? Spacing.OPEN : Spacing.ATTACHED);
            List<FunctionTypeParameter> parameters = function.getParameters();
            for (int i = 0; i < parameters.size(); i++) {
                if (i > 0) {
                    symbol(function, ",", Spacing.COMMA);
                }
                FunctionTypeParameter parameter = parameters.get(i);
                if (parameter.getName() != null) {
                    leaf(parameter.getName(), parameter.getName().getName());
                    symbol(parameter, ":", Spacing.COMMA);
                }
                writeType(parameter.getType());
            }
            symbol(function, ")", Spacing.ATTACHED);
            symbol(function, "->", Spacing.SPACED);
            writeType(function.getReturnType());
        } else if (type instanceof UnionType union) {
            writeTypeSequence(union, "|", union.getTypes(), union.hasLeadingSeparator());
        } else if (type instanceof IntersectionType intersection) {
            writeTypeSequence(intersection, "&", intersection.getTypes(), intersection.hasLeadingSeparator());
        } else if (type instanceof OptionalType optional) {
            writeType(optional.getInner());
            symbol(optional, "?", Spacing.ATTACHED);
        } else if (type instanceof ParenthesizedType parenthesized) {
            symbol(parenthesized, "(", Spacing.OPEN);
            writeType(parenthesized.getInner());
            symbol(parenthesized, ")", Spacing.ATTACHED);
        } else if (type instanceof TypePack pack) {
            symbol(pack, "(", Spacing.OPEN);
            writeTypeList(pack, pack.getTypes());
            symbol(pack, ")", Spacing.ATTACHED);
        } else if (type instanceof VariadicTypePack variadic) {
            symbol(variadic, "...", Spacing.OPEN);
            writeType(variadic.getType());
        } else if (type instanceof GenericTypePack generic) {
            leaf(generic.getName(), generic.getName().getName());
            symbol(generic, "...", Spacing.ATTACHED);
        } else {
            throw new AstInvariantException("cannot generate " + type.getClass().getSimpleName());
        }
    }

    private void writeTypeList(Node owner, List<TypeNode> types) {
        for (int i = 0; i < types.size(); i++) {
            if (i > 0) {
                symbol(owner, ",", Spacing.COMMA);
            }
            writeType(types.get(i));
        }
    }

    private void writeTypeSequence(Node owner, String operator, List<TypeNode> types, boolean leading) {
        if (leading) {
            symbol(owner, operator, Spacing.OPEN);
        }
        for (int i = 0; i < types.size(); i++) {
            if (i > 0) {
                symbol(owner, operator, Spacing.SPACED);
            }
            writeType(types.get(i));
        }
    }

    private void writeTableType(TableType table) {
        symbol(table, "{", Spacing.OPEN);
        List<TableTypeEntry> entries = table.getEntries();
        for (int i = 0; i < entries.size(); i++) {
            if (i > 0) {
                separator(table);
            }
            TableTypeEntry entry = entries.get(i);
            if (entry.getAccess() != null) {
                symbol(entry, entry.getAccess(), Spacing.OPEN);
            }
            if (entry.isProperty()) {
                leaf(entry.getName(), entry.getName().getName());
            } else {
                symbol(entry, "[", Spacing.OPEN);
                writeType(entry.getKey());
                symbol(entry, "]", Spacing.ATTACHED);
            }
            symbol(entry, ":", Spacing.COMMA);
            writeType(entry.getValue());
        }
        trailingSeparator(table, entries.size());
        symbol(table, "}", Spacing.ATTACHED);
    }
}
