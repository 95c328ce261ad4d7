package com.raditha.luaforge.parser;

import com.raditha.luaforge.ast.*;
import com.raditha.luaforge.model.Token;
import com.raditha.luaforge.model.TokenType;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Recursive-descent parser for Lua 5.1 and Luau.
 * <p>
 * Every node receives the tokens of its own keywords and punctuation, in source
 * order, so that the line-preserving generator can reproduce the input.
 */
public class Parser {

    /**
     * Deepest nesting of blocks, expressions and types accepted before giving up.
     * Operator and suffix chains count one level per link, so the limit bounds the
     * depth of the tree handed to visitors and generators.
     */
    public static final int MAX_DEPTH = 1000;

    private static final Set<String> BLOCK_END = Set.of("end", "else", "elseif", "until");
    private static final Set<String> CONTINUE_AS_EXPRESSION = Set.of(
            "(", ".", "[", ":", "{", "=", ",", "::",
            "+=", "-=", "*=", "/=", "//=", "%=", "^=", "..=");

    private final List<Token> tokens;
    private int current;
    private int depth;

    public Parser(List<Token> tokens) {
        this.tokens = tokens;
    }

    /**
     * Tokenize and parse a complete chunk.
     */
    public static Block parse(String source) throws ParseException {
        return new Parser(new Lexer(source).tokenize()).parseChunk();
    }

    public Block parseChunk() throws ParseException {
        Block block;
        try {
            block = parseBlock();
        } catch (StackOverflowError e) {
            throw error(peek(), "nesting is too deep");
        }
        Token last = peek();
        if (last.type() != TokenType.EOF) {
            throw error(last, "unexpected '" + last.text() + "'");
        }
        block.setEndOfFile(last);
        return block;
    }

    /**
     * Parse a single expression that must span every token.
     */
    public Expression parseStandaloneExpression() throws ParseException {
        Expression expression = parseExpression();
        if (peek().type() != TokenType.EOF) {
            throw error(peek(), "unexpected '" + peek().text() + "'");
        }
        return expression;
    }

    // ================= blocks =================

    private Block parseBlock() throws ParseException {
        enter(peek());
        Block block = new Block();
        Statement previous = null;
        while (!isBlockEnd()) {
            if (check(";")) {
                Token semicolon = advance();
                if (previous != null && previous.getSemicolon() == null) {
                    previous.setSemicolon(semicolon);
                }
                continue;
            }
            Statement statement = parseStatement();
            block.append(statement);
            previous = statement;
            if (statement instanceof LastStatement) {
                if (check(";")) {
                    statement.setSemicolon(advance());
                }
                if (!isBlockEnd()) {
                    throw error(peek(), "'end' expected, a block cannot continue after '"
                            + describe(statement) + "'");
                }
            }
        }
        leave();
        return block;
    }

    private boolean isBlockEnd() {
        Token token = peek();
        return token.type() == TokenType.EOF
                || (token.type() == TokenType.KEYWORD && BLOCK_END.contains(token.text()));
    }

    // ================= statements =================

    private Statement parseStatement() throws ParseException {
        Token token = peek();
        if (token.type() == TokenType.KEYWORD) {
            switch (token.text()) {
                case "if" -> {
                    return parseIf();
                }
                case "while" -> {
                    return parseWhile();
                }
                case "do" -> {
                    return parseDo();
                }
                case "for" -> {
                    return parseFor();
                }
                case "repeat" -> {
                    return parseRepeat();
                }
                case "function" -> {
                    return parseFunctionStatement();
                }
                case "local" -> {
                    return parseLocal();
                }
                case "return" -> {
                    return parseReturn();
                }
                case "break" -> {
                    BreakStatement statement = new BreakStatement();
                    statement.addToken(advance());
                    return statement;
                }
                default -> {
                    // expression statement
                }
            }
        } else if (token.isName("continue") && isContinueStatement()) {
            ContinueStatement statement = new ContinueStatement();
            statement.addToken(advance());
            return statement;
        } else if (token.isName("type") && peekAt(1).type() == TokenType.NAME
                && (peekAt(2).is("=") || peekAt(2).is("<"))) {
            return parseTypeDeclaration(null);
        } else if (token.isName("export") && peekAt(1).isName("type") && peekAt(2).type() == TokenType.NAME) {
            return parseTypeDeclaration(advance());
        }
        return parseExpressionStatement();
    }

    private boolean isContinueStatement() {
        Token next = peekAt(1);
        if (next.type() == TokenType.STRING || next.type() == TokenType.INTERPOLATED_STRING) {
            return false;
        }
        return !(next.type() == TokenType.SYMBOL && CONTINUE_AS_EXPRESSION.contains(next.text()));
    }

    private IfStatement parseIf() throws ParseException {
        Token start = peek();
        List<IfBranch> branches = new ArrayList<>();
        branches.add(parseIfBranch());
        while (check("elseif")) {
            branches.add(parseIfBranch());
        }
        List<Token> own = new ArrayList<>();
        Block elseBlock = null;
        if (check("else")) {
            own.add(advance());
            elseBlock = parseBlock();
        }
        own.add(consumeClosing("end", "if", start));
        IfStatement statement = new IfStatement(branches, elseBlock);
        statement.setTokens(own);
        return statement;
    }

    private IfBranch parseIfBranch() throws ParseException {
        Token keyword = advance();
        Expression condition = parseExpression();
        Token then = consume("then", "'then' expected");
        IfBranch branch = new IfBranch(condition, parseBlock());
        branch.setTokens(List.of(keyword, then));
        return branch;
    }

    private WhileStatement parseWhile() throws ParseException {
        Token whileToken = advance();
        Expression condition = parseExpression();
        Token doToken = consume("do", "'do' expected");
        Block block = parseBlock();
        Token end = consumeClosing("end", "while", whileToken);
        WhileStatement statement = new WhileStatement(condition, block);
        statement.setTokens(List.of(whileToken, doToken, end));
        return statement;
    }

    private DoStatement parseDo() throws ParseException {
        Token doToken = advance();
        Block block = parseBlock();
        Token end = consumeClosing("end", "do", doToken);
        DoStatement statement = new DoStatement(block);
        statement.setTokens(List.of(doToken, end));
        return statement;
    }

    private RepeatStatement parseRepeat() throws ParseException {
        Token repeat = advance();
        Block block = parseBlock();
        Token until = consumeClosing("until", "repeat", repeat);
        RepeatStatement statement = new RepeatStatement(block, parseExpression());
        statement.setTokens(List.of(repeat, until));
        return statement;
    }

    private Statement parseFor() throws ParseException {
        Token forToken = advance();
        List<Token> own = new ArrayList<>();
        own.add(forToken);
        TypedIdentifier first = parseTypedIdentifier(false);
        if (check("=")) {
            own.add(advance());
            Expression start = parseExpression();
            own.add(consume(",", "',' expected in numeric for"));
            Expression end = parseExpression();
            Expression step = null;
            if (check(",")) {
                own.add(advance());
                step = parseExpression();
            }
            own.add(consume("do", "'do' expected"));
            Block block = parseBlock();
            own.add(consumeClosing("end", "for", forToken));
            NumericForStatement statement = new NumericForStatement(first, start, end, step, block);
            statement.setTokens(own);
            return statement;
        }
        List<TypedIdentifier> variables = new ArrayList<>();
        variables.add(first);
        while (check(",")) {
            own.add(advance());
            variables.add(parseTypedIdentifier(false));
        }
        own.add(consume("in", "'=' or 'in' expected"));
        List<Expression> expressions = parseExpressionList(own);
        own.add(consume("do", "'do' expected"));
        Block block = parseBlock();
        own.add(consumeClosing("end", "for", forToken));
        GenericForStatement statement = new GenericForStatement(variables, expressions, block);
        statement.setTokens(own);
        return statement;
    }

    private FunctionStatement parseFunctionStatement() throws ParseException {
        Token functionToken = advance();
        List<Token> nameTokens = new ArrayList<>();
        Identifier root = parseName();
        List<Identifier> fields = new ArrayList<>();
        while (check(".")) {
            nameTokens.add(advance());
            fields.add(parseName());
        }
        Identifier method = null;
        if (check(":")) {
            nameTokens.add(advance());
            method = parseName();
        }
        FunctionName name = new FunctionName(root, fields, method);
        name.setTokens(nameTokens);
        FunctionStatement statement = new FunctionStatement(name, parseFunctionBody(functionToken));
        statement.setTokens(List.of(functionToken));
        return statement;
    }

    private Statement parseLocal() throws ParseException {
        Token local = advance();
        if (check("function")) {
            Token functionToken = advance();
            Identifier name = parseName();
            LocalFunctionStatement statement = new LocalFunctionStatement(name, parseFunctionBody(functionToken));
            statement.setTokens(List.of(local, functionToken));
            return statement;
        }
        List<Token> own = new ArrayList<>();
        own.add(local);
        List<TypedIdentifier> variables = new ArrayList<>();
        variables.add(parseTypedIdentifier(true));
        while (check(",")) {
            own.add(advance());
            variables.add(parseTypedIdentifier(true));
        }
        List<Expression> values = List.of();
        if (check("=")) {
            own.add(advance());
            values = parseExpressionList(own);
        }
        LocalAssignStatement statement = new LocalAssignStatement(variables, values);
        statement.setTokens(own);
        return statement;
    }

    private ReturnStatement parseReturn() throws ParseException {
        List<Token> own = new ArrayList<>();
        own.add(advance());
        List<Expression> values = List.of();
        if (!isBlockEnd() && !check(";")) {
            values = parseExpressionList(own);
        }
        ReturnStatement statement = new ReturnStatement(values);
        statement.setTokens(own);
        return statement;
    }

    private TypeDeclarationStatement parseTypeDeclaration(Token export) throws ParseException {
        List<Token> own = new ArrayList<>();
        if (export != null) {
            own.add(export);
        }
        own.add(advance());
        Identifier name = parseName();
        List<GenericParameter> generics = check("<") ? parseGenericParameters(own, true) : List.of();
        own.add(consume("=", "'=' expected in type declaration"));
        TypeNode type = parseType();
        TypeDeclarationStatement statement = new TypeDeclarationStatement(name, export != null, generics, type);
        statement.setTokens(own);
        return statement;
    }

    private Statement parseExpressionStatement() throws ParseException {
        Token start = peek();
        Expression first = parseSuffixedExpression();
        if (check("=") || check(",")) {
            List<Token> own = new ArrayList<>();
            List<Expression> variables = new ArrayList<>();
            variables.add(requireAssignable(first, start));
            while (check(",")) {
                own.add(advance());
                Token variableStart = peek();
                variables.add(requireAssignable(parseSuffixedExpression(), variableStart));
            }
            own.add(consume("=", "'=' expected"));
            List<Expression> values = parseExpressionList(own);
            AssignStatement statement = new AssignStatement(variables, values);
            statement.setTokens(own);
            return statement;
        }
        Token operatorToken = peek();
        CompoundOperator compound = operatorToken.type() == TokenType.SYMBOL
                ? CompoundOperator.fromSymbol(operatorToken.text()) : null;
        if (compound != null) {
            advance();
            CompoundAssignStatement statement = new CompoundAssignStatement(compound,
                    requireAssignable(first, start), parseExpression());
            statement.setTokens(List.of(operatorToken));
            return statement;
        }
        if (first instanceof FunctionCallExpression call) {
            return new CallStatement(call);
        }
        throw error(start, "syntax error, expression is not a statement");
    }

    private Expression requireAssignable(Expression expression, Token start) throws ParseException {
        if (expression instanceof Identifier || expression instanceof FieldExpression
                || expression instanceof IndexExpression) {
            return expression;
        }
        throw error(start, "syntax error, cannot assign to this expression");
    }

    // ================= functions =================

    private FunctionBody parseFunctionBody(Token opening) throws ParseException {
        List<Token> own = new ArrayList<>();
        List<GenericParameter> generics = check("<") ? parseGenericParameters(own, false) : List.of();
        own.add(consume("(", "'(' expected"));
        List<TypedIdentifier> parameters = new ArrayList<>();
        boolean variadic = false;
        TypeNode variadicType = null;
        if (!check(")")) {
            while (true) {
                if (check("...")) {
                    own.add(advance());
                    variadic = true;
                    if (check(":")) {
                        own.add(advance());
                        variadicType = isGenericPackAhead() ? parseGenericTypePack() : parseType();
                    }
                    break;
                }
                parameters.add(parseTypedIdentifier(false));
                if (!check(",")) {
                    break;
                }
                own.add(advance());
            }
        }
        own.add(consume(")", "')' expected"));
        TypeNode returnType = null;
        if (check(":")) {
            own.add(advance());
            returnType = parseReturnType();
        }
        Block block = parseBlock();
        own.add(consumeClosing("end", "function", opening));
        FunctionBody body = new FunctionBody(parameters, variadic, block);
        body.getGenericParameters().addAll(generics);
        body.setVariadicType(variadicType);
        body.setReturnType(returnType);
        body.setTokens(own);
        return body;
    }

    private TypedIdentifier parseTypedIdentifier(boolean allowAttribute) throws ParseException {
        Token name = consumeName("name expected");
        TypedIdentifier identifier = new TypedIdentifier(name.text());
        identifier.addToken(name);
        if (check(":")) {
            identifier.addToken(advance());
            identifier.setType(parseType());
        }
        if (allowAttribute && check("<")) {
            identifier.addToken(advance());
            Token attribute = consumeName("attribute name expected");
            identifier.addToken(attribute);
            identifier.setAttribute(attribute.text());
            identifier.addToken(consume(">", "'>' expected"));
        }
        return identifier;
    }

    private Identifier parseName() throws ParseException {
        Token name = consumeName("name expected");
        Identifier identifier = new Identifier(name.text());
        identifier.addToken(name);
        return identifier;
    }

    // ================= expressions =================

    private List<Expression> parseExpressionList(List<Token> separators) throws ParseException {
        List<Expression> expressions = new ArrayList<>();
        expressions.add(parseExpression());
        while (check(",")) {
            separators.add(advance());
            expressions.add(parseExpression());
        }
        return expressions;
    }

    public Expression parseExpression() throws ParseException {
        return parseSubExpression(0);
    }

    private Expression parseSubExpression(int limit) throws ParseException {
        enter(peek());
        int chained = 0;
        Expression left;
        Token token = peek();
        UnaryOperator unary = (token.type() == TokenType.SYMBOL || token.type() == TokenType.KEYWORD)
                ? UnaryOperator.fromSymbol(token.text()) : null;
        if (unary != null) {
            advance();
            left = new UnaryExpression(unary, parseSubExpression(BinaryOperator.UNARY_PRIORITY));
            left.addToken(token);
        } else {
            left = parseSimpleExpression();
        }
        while (true) {
            Token operatorToken = peek();
            BinaryOperator operator = (operatorToken.type() == TokenType.SYMBOL
                    || operatorToken.type() == TokenType.KEYWORD)
                    ? BinaryOperator.fromSymbol(operatorToken.text()) : null;
            if (operator == null || operator.getLeftPriority() <= limit) {
                break;
            }
            if (left instanceof BinaryExpression) {
                // a left-leaning chain nests one level per operator
                enter(operatorToken);
                chained++;
            }
            advance();
            Expression right = parseSubExpression(operator.getRightPriority());
            left = new BinaryExpression(operator, left, right);
            left.addToken(operatorToken);
        }
        leave(chained + 1);
        return left;
    }

    private Expression parseSimpleExpression() throws ParseException {
        Token token = peek();
        Expression expression;
        switch (token.type()) {
            case NUMBER -> {
                advance();
                expression = new NumberExpression(token.text());
                expression.addToken(token);
            }
            case STRING -> {
                advance();
                expression = stringLiteral(token);
            }
            case INTERPOLATED_STRING -> {
                advance();
                expression = parseInterpolatedString(token);
            }
            case KEYWORD -> expression = switch (token.text()) {
                case "nil" -> leaf(new NilExpression());
                case "true" -> leaf(new BooleanExpression(true));
                case "false" -> leaf(new BooleanExpression(false));
                case "function" -> {
                    advance();
                    FunctionExpression function = new FunctionExpression(parseFunctionBody(token));
                    function.addToken(token);
                    yield function;
                }
                case "if" -> parseIfExpression();
                default -> parseSuffixedExpression();
            };
            case SYMBOL -> expression = switch (token.text()) {
                case "..." -> leaf(new VariableArgumentsExpression());
                case "{" -> parseTable();
                default -> parseSuffixedExpression();
            };
            default -> expression = parseSuffixedExpression();
        }
        int casts = 0;
        while (check("::")) {
            Token cast = advance();
            enter(cast);
            casts++;
            expression = new TypeCastExpression(expression, parseType());
            expression.addToken(cast);
        }
        leave(casts);
        return expression;
    }

    private Expression leaf(Expression expression) {
        expression.addToken(advance());
        return expression;
    }

    private StringExpression stringLiteral(Token token) throws ParseException {
        try {
            StringExpression string = StringExpression.fromSource(token.text());
            string.addToken(token);
            return string;
        } catch (IllegalArgumentException | IndexOutOfBoundsException e) {
            throw error(token, "malformed escape sequence in string");
        }
    }

    private IfExpression parseIfExpression() throws ParseException {
        List<Token> own = new ArrayList<>();
        own.add(advance());
        Expression condition = parseExpression();
        own.add(consume("then", "'then' expected"));
        Expression result = parseExpression();
        List<ElseIfExpressionBranch> branches = new ArrayList<>();
        while (check("elseif")) {
            Token elseif = advance();
            Expression branchCondition = parseExpression();
            Token then = consume("then", "'then' expected");
            ElseIfExpressionBranch branch = new ElseIfExpressionBranch(branchCondition, parseExpression());
            branch.setTokens(List.of(elseif, then));
            branches.add(branch);
        }
        own.add(consume("else", "'else' expected in if expression"));
        IfExpression expression = new IfExpression(condition, result, branches, parseExpression());
        expression.setTokens(own);
        return expression;
    }

    private Expression parseSuffixedExpression() throws ParseException {
        Expression expression = parsePrimaryExpression();
        int suffixes = 0;
        while (true) {
            Token token = peek();
            if (isSuffixStart(token)) {
                enter(token);
                suffixes++;
            }
            if (token.is(".")) {
                advance();
                expression = new FieldExpression(expression, parseName());
                expression.addToken(token);
            } else if (token.is("[")) {
                advance();
                Expression index = parseExpression();
                Token close = consume("]", "']' expected");
                expression = new IndexExpression(expression, index);
                expression.setTokens(List.of(token, close));
            } else if (token.is(":")) {
                advance();
                Identifier method = parseName();
                List<Token> own = new ArrayList<>();
                own.add(token);
                expression = parseCallArguments(expression, method, own);
            } else if (token.is("(") || token.is("{") || token.type() == TokenType.STRING) {
                expression = parseCallArguments(expression, null, new ArrayList<>());
            } else {
                leave(suffixes);
                return expression;
            }
        }
    }

    private static boolean isSuffixStart(Token token) {
        return token.is(".") || token.is("[") || token.is(":") || token.is("(") || token.is("{")
                || token.type() == TokenType.STRING;
    }

    private FunctionCallExpression parseCallArguments(Expression prefix, Identifier method, List<Token> own)
            throws ParseException {
        Token token = peek();
        FunctionCallExpression call;
        if (token.type() == TokenType.STRING) {
            advance();
            call = new FunctionCallExpression(prefix, method, List.of(stringLiteral(token)),
                    FunctionCallExpression.ArgumentStyle.STRING);
        } else if (token.is("{")) {
            call = new FunctionCallExpression(prefix, method, List.of(parseTable()),
                    FunctionCallExpression.ArgumentStyle.TABLE);
        } else {
            own.add(consume("(", "function arguments expected"));
            List<Expression> arguments = check(")") ? List.of() : parseExpressionList(own);
            own.add(consume(")", "')' expected"));
            call = new FunctionCallExpression(prefix, method, arguments);
        }
        call.setTokens(own);
        return call;
    }

    private Expression parsePrimaryExpression() throws ParseException {
        Token token = peek();
        if (token.type() == TokenType.NAME) {
            return parseName();
        }
        if (token.is("(")) {
            advance();
            Expression inner = parseExpression();
            Token close = consume(")", "')' expected");
            ParentheseExpression expression = new ParentheseExpression(inner);
            expression.setTokens(List.of(token, close));
            return expression;
        }
        throw error(token, token.type() == TokenType.EOF ? "unexpected end of input"
                : "unexpected symbol near '" + token.text() + "'");
    }

    private TableExpression parseTable() throws ParseException {
        List<Token> own = new ArrayList<>();
        Token open = consume("{", "'{' expected");
        own.add(open);
        List<TableEntry> entries = new ArrayList<>();
        while (!check("}")) {
            entries.add(parseTableEntry());
            if (check(",") || check(";")) {
                own.add(advance());
            } else {
                break;
            }
        }
        own.add(consumeClosing("}", "{", open));
        TableExpression table = new TableExpression(entries);
        table.setTokens(own);
        return table;
    }

    private TableEntry parseTableEntry() throws ParseException {
        Token token = peek();
        if (token.is("[")) {
            advance();
            Expression key = parseExpression();
            Token close = consume("]", "']' expected");
            Token equal = consume("=", "'=' expected");
            TableIndexEntry entry = new TableIndexEntry(key, parseExpression());
            entry.setTokens(List.of(token, close, equal));
            return entry;
        }
        if (token.type() == TokenType.NAME && peekAt(1).is("=")) {
            Identifier field = parseName();
            Token equal = advance();
            TableFieldEntry entry = new TableFieldEntry(field, parseExpression());
            entry.addToken(equal);
            return entry;
        }
        return new TableValueEntry(parseExpression());
    }

    private InterpolatedStringExpression parseInterpolatedString(Token token) throws ParseException {
        String raw = token.text();
        List<InterpolationSegment> segments = new ArrayList<>();
        int line = token.line();
        int column = token.column() + 1;
        StringBuilder text = new StringBuilder();
        int i = 1;
        int end = raw.length() - 1;
        while (i < end) {
            char c = raw.charAt(i);
            if (c == '\\' && i + 1 < end) {
                text.append(c).append(raw.charAt(i + 1));
                if (raw.charAt(i + 1) == '\n') {
                    line++;
                    column = 1;
                } else {
                    column += 2;
                }
                i += 2;
            } else if (c == '{') {
                if (text.length() > 0) {
                    segments.add(InterpolationSegment.text(text.toString()));
                    text.setLength(0);
                }
                int close = findInterpolationEnd(raw, i + 1, token);
                String source = raw.substring(i + 1, close);
                segments.add(parseInterpolationValue(source, line, column, token));
                for (int k = i; k <= close; k++) {
                    if (raw.charAt(k) == '\n') {
                        line++;
                        column = 1;
                    } else {
                        column++;
                    }
                }
                i = close + 1;
            } else {
                text.append(c);
                column++;
                i++;
            }
        }
        if (text.length() > 0) {
            segments.add(InterpolationSegment.text(text.toString()));
        }
        InterpolatedStringExpression expression = new InterpolatedStringExpression(segments);
        int lastBreak = raw.lastIndexOf('\n');
        int endLine = token.line() + (int) raw.chars().filter(ch -> ch == '\n').count();
        int endColumn = lastBreak < 0 ? token.column() + raw.length() - 1 : raw.length() - lastBreak - 1;
        expression.addToken(new Token(TokenType.SYMBOL, "`", token.leadingTrivia(), List.of(),
                token.line(), token.column(), token.index()));
        expression.addToken(new Token(TokenType.SYMBOL, "`", List.of(), token.trailingTrivia(),
                endLine, endColumn, token.index()));
        return expression;
    }

    private InterpolationSegment parseInterpolationValue(String source, int line, int column, Token owner)
            throws ParseException {
        List<Token> inner = new Lexer(source, line, column + 1).tokenize();
        if (inner.size() == 1) {
            throw error(owner, "empty interpolation expression");
        }
        Token eof = inner.get(inner.size() - 1);
        Parser nested = new Parser(inner);
        nested.depth = depth;
        Expression value = nested.parseStandaloneExpression();
        InterpolationSegment segment = InterpolationSegment.value(value);
        segment.addToken(new Token(TokenType.SYMBOL, "{", List.of(), List.of(), line, column));
        segment.addToken(new Token(TokenType.SYMBOL, "}", eof.leadingTrivia(), List.of(), eof.line(), eof.column()));
        return segment;
    }

    private int findInterpolationEnd(String raw, int from, Token owner) throws ParseException {
        int depth = 1;
        int i = from;
        while (i < raw.length()) {
            char c = raw.charAt(i);
            if (c == '"' || c == '\'') {
                i++;
                while (i < raw.length() && raw.charAt(i) != c) {
                    i += raw.charAt(i) == '\\' ? 2 : 1;
                }
            } else if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
            i++;
        }
        throw error(owner, "unfinished interpolation expression");
    }

    // ================= types =================

    private TypeNode parseType() throws ParseException {
        enter(peek());
        TypeNode type;
        if (check("|") || check("&")) {
            type = parseTypeList(null, true);
        } else {
            type = parseTypeList(parseOptionalType(), false);
        }
        leave();
        return type;
    }

    private TypeNode parseTypeList(TypeNode first, boolean leading) throws ParseException {
        String separator = first == null ? peek().text() : (check("|") ? "|" : check("&") ? "&" : null);
        if (separator == null) {
            return first;
        }
        List<Token> own = new ArrayList<>();
        List<TypeNode> types = new ArrayList<>();
        if (first != null) {
            types.add(first);
        }
        while (check(separator)) {
            own.add(advance());
            types.add(parseOptionalType());
        }
        TypeNode list = separator.equals("|") ? new UnionType(types, leading) : new IntersectionType(types, leading);
        list.setTokens(own);
        return list;
    }

    private TypeNode parseOptionalType() throws ParseException {
        TypeNode type = parseSimpleType();
        while (check("?")) {
            Token question = advance();
            type = new OptionalType(type);
            type.addToken(question);
        }
        return type;
    }

    private TypeNode parseSimpleType() throws ParseException {
        Token token = peek();
        if (token.type() == TokenType.STRING || token.is("nil") || token.is("true") || token.is("false")) {
            advance();
            LiteralType type = new LiteralType(token.text());
            type.addToken(token);
            return type;
        }
        if (token.isName("typeof") && peekAt(1).is("(")) {
            advance();
            Token open = advance();
            Expression expression = parseExpression();
            Token close = consume(")", "')' expected");
            TypeofType type = new TypeofType(expression);
            type.setTokens(List.of(token, open, close));
            return type;
        }
        if (token.type() == TokenType.NAME) {
            return parseNamedType();
        }
        if (token.is("{")) {
            return parseTableType();
        }
        if (token.is("(") || token.is("<")) {
            return parseParenthesizedType(false);
        }
        throw error(token, "type expected near '" + token.text() + "'");
    }

    private NamedType parseNamedType() throws ParseException {
        List<Token> own = new ArrayList<>();
        Identifier module = null;
        Identifier name = parseName();
        if (check(".")) {
            own.add(advance());
            module = name;
            name = parseName();
        }
        List<TypeNode> arguments = new ArrayList<>();
        if (check("<")) {
            own.add(advance());
            if (!check(">")) {
                arguments.add(parseTypeArgument());
                while (check(",")) {
                    own.add(advance());
                    arguments.add(parseTypeArgument());
                }
            }
            own.add(consume(">", "'>' expected"));
        }
        NamedType type = new NamedType(module, name, arguments);
        type.setTokens(own);
        return type;
    }

    private TypeNode parseTypeArgument() throws ParseException {
        if (check("...")) {
            return parseVariadicTypePack();
        }
        if (isGenericPackAhead()) {
            return parseGenericTypePack();
        }
        if (check("(")) {
            return parseParenthesizedType(true);
        }
        return parseType();
    }

    private TypeNode parseReturnType() throws ParseException {
        if (check("(")) {
            return parseParenthesizedType(true);
        }
        if (check("...")) {
            return parseVariadicTypePack();
        }
        if (isGenericPackAhead()) {
            return parseGenericTypePack();
        }
        return parseType();
    }

    private boolean isGenericPackAhead() {
        return peek().type() == TokenType.NAME && peekAt(1).is("...");
    }

    private GenericTypePack parseGenericTypePack() throws ParseException {
        Identifier name = parseName();
        GenericTypePack pack = new GenericTypePack(name);
        pack.addToken(advance());
        return pack;
    }

    private VariadicTypePack parseVariadicTypePack() throws ParseException {
        Token dots = advance();
        VariadicTypePack pack = new VariadicTypePack(parseType());
        pack.addToken(dots);
        return pack;
    }

    /**
     * Parses {@code (...)} types: a function type when followed by {@code ->},
     * otherwise a parenthesized type or, where allowed, a type pack.
     */
    private TypeNode parseParenthesizedType(boolean allowPack) throws ParseException {
        List<Token> own = new ArrayList<>();
        Token start = peek();
        List<GenericParameter> generics = check("<") ? parseGenericParameters(own, false) : List.of();
        own.add(consume("(", "'(' expected"));
        List<FunctionTypeParameter> parameters = new ArrayList<>();
        if (!check(")")) {
            while (true) {
                parameters.add(parseFunctionTypeParameter());
                if (!check(",")) {
                    break;
                }
                own.add(advance());
            }
        }
        own.add(consume(")", "')' expected"));
        if (check("->") || !generics.isEmpty()) {
            own.add(consume("->", "'->' expected"));
            FunctionType type = new FunctionType(generics, parameters, parseReturnType());
            type.setTokens(own);
            return type;
        }
        boolean named = parameters.stream().anyMatch(parameter -> parameter.getName() != null);
        if (named) {
            throw error(start, "'->' expected after named function type parameters");
        }
        boolean singleType = parameters.size() == 1
                && !(parameters.get(0).getType() instanceof VariadicTypePack)
                && !(parameters.get(0).getType() instanceof GenericTypePack);
        if (singleType && !allowPack) {
            ParenthesizedType type = new ParenthesizedType(parameters.get(0).getType());
            type.setTokens(own);
            return type;
        }
        if (!allowPack) {
            throw error(start, "type pack is not allowed here");
        }
        List<TypeNode> types = new ArrayList<>();
        for (FunctionTypeParameter parameter : parameters) {
            types.add(parameter.getType());
        }
        TypePack pack = new TypePack(types);
        pack.setTokens(own);
        return pack;
    }

    private FunctionTypeParameter parseFunctionTypeParameter() throws ParseException {
        if (check("...")) {
            return new FunctionTypeParameter(null, parseVariadicTypePack());
        }
        if (isGenericPackAhead()) {
            return new FunctionTypeParameter(null, parseGenericTypePack());
        }
        if (peek().type() == TokenType.NAME && peekAt(1).is(":")) {
            Identifier name = parseName();
            Token colon = advance();
            FunctionTypeParameter parameter = new FunctionTypeParameter(name, parseType());
            parameter.addToken(colon);
            return parameter;
        }
        return new FunctionTypeParameter(null, parseType());
    }

    private TypeNode parseTableType() throws ParseException {
        List<Token> own = new ArrayList<>();
        Token open = advance();
        own.add(open);
        boolean entryAhead = check("}") || check("[")
                || (peek().type() == TokenType.NAME && peekAt(1).is(":"))
                || (isAccessModifier(peek()) && (peekAt(1).type() == TokenType.NAME || peekAt(1).is("[")));
        if (!entryAhead) {
            TypeNode element = parseType();
            own.add(consumeClosing("}", "{", open));
            ArrayType array = new ArrayType(element);
            array.setTokens(own);
            return array;
        }
        List<TableTypeEntry> entries = new ArrayList<>();
        while (!check("}")) {
            entries.add(parseTableTypeEntry());
            if (check(",") || check(";")) {
                own.add(advance());
            } else {
                break;
            }
        }
        own.add(consumeClosing("}", "{", open));
        TableType table = new TableType(entries);
        table.setTokens(own);
        return table;
    }

    private TableTypeEntry parseTableTypeEntry() throws ParseException {
        List<Token> own = new ArrayList<>();
        String access = null;
        if (isAccessModifier(peek()) && (peekAt(1).type() == TokenType.NAME || peekAt(1).is("["))) {
            Token modifier = advance();
            own.add(modifier);
            access = modifier.text();
        }
        TableTypeEntry entry;
        if (check("[")) {
            own.add(advance());
            TypeNode key = parseType();
            own.add(consume("]", "']' expected"));
            own.add(consume(":", "':' expected"));
            entry = TableTypeEntry.indexer(access, key, parseType());
        } else {
            Identifier name = parseName();
            own.add(consume(":", "':' expected"));
            entry = TableTypeEntry.property(access, name, parseType());
        }
        entry.setTokens(own);
        return entry;
    }

    private static boolean isAccessModifier(Token token) {
        return token.isName("read") || token.isName("write");
    }

    private List<GenericParameter> parseGenericParameters(List<Token> own, boolean allowDefaults)
            throws ParseException {
        own.add(advance());
        List<GenericParameter> parameters = new ArrayList<>();
        while (true) {
            Identifier name = parseName();
            List<Token> parameterTokens = new ArrayList<>();
            boolean pack = false;
            if (check("...")) {
                parameterTokens.add(advance());
                pack = true;
            }
            TypeNode defaultType = null;
            if (allowDefaults && check("=")) {
                parameterTokens.add(advance());
                defaultType = pack ? parseTypeArgument() : parseType();
            }
            GenericParameter parameter = new GenericParameter(name, pack, defaultType);
            parameter.setTokens(parameterTokens);
            parameters.add(parameter);
            if (!check(",")) {
                break;
            }
            own.add(advance());
        }
        own.add(consume(">", "'>' expected"));
        return parameters;
    }

    // ================= helpers =================

    private Token peek() {
        return tokens.get(current);
    }

    private Token peekAt(int offset) {
        return tokens.get(Math.min(current + offset, tokens.size() - 1));
    }

    private Token advance() {
        Token token = tokens.get(current);
        if (token.type() != TokenType.EOF) {
            current++;
        }
        return token;
    }

    private boolean check(String text) {
        return peek().is(text);
    }

    private Token consume(String text, String message) throws ParseException {
        if (check(text)) {
            return advance();
        }
        throw error(peek(), message + " near '" + describe(peek()) + "'");
    }

    private Token consumeClosing(String text, String opening, Token openingToken) throws ParseException {
        if (check(text)) {
            return advance();
        }
        String message = "'" + text + "' expected";
        if (peek().line() != openingToken.line()) {
            message += " (to close '" + opening + "' at line " + openingToken.line() + ")";
        }
        throw error(peek(), message + " near '" + describe(peek()) + "'");
    }

    private Token consumeName(String message) throws ParseException {
        if (peek().type() == TokenType.NAME) {
            return advance();
        }
        throw error(peek(), message + " near '" + describe(peek()) + "'");
    }

    private void enter(Token token) throws ParseException {
        if (++depth > MAX_DEPTH) {
            throw error(token, "nesting is too deep");
        }
    }

    private void leave() {
        depth--;
    }

    private void leave(int levels) {
        depth -= levels;
    }

    private static String describe(Token token) {
        return token.type() == TokenType.EOF ? "<eof>" : token.text();
    }

    private static String describe(Statement statement) {
        return statement instanceof ReturnStatement ? "return"
                : statement instanceof BreakStatement ? "break" : "continue";
    }

    private static ParseException error(Token token, String message) {
        return new ParseException(message, token.line(), token.column());
    }
}
