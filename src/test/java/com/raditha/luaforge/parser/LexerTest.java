package com.raditha.luaforge.parser;

import com.raditha.luaforge.model.Token;
import com.raditha.luaforge.model.TokenType;
import com.raditha.luaforge.model.Trivia;
import com.raditha.luaforge.model.TriviaKind;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.constraints.StringLength;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LexerTest {

    private static String concatenate(List<Token> tokens) {
        StringBuilder text = new StringBuilder();
        for (Token token : tokens) {
            token.leadingTrivia().forEach(trivia -> text.append(trivia.text()));
            text.append(token.text());
            token.trailingTrivia().forEach(trivia -> text.append(trivia.text()));
        }
        return text.toString();
    }

    @Test
    void testTokenTypes() throws ParseException {
        List<Token> tokens = new Lexer("local x = 0x1F .. 'a' ~= nil").tokenize();
        assertEquals(List.of(TokenType.KEYWORD, TokenType.NAME, TokenType.SYMBOL, TokenType.NUMBER,
                        TokenType.SYMBOL, TokenType.STRING, TokenType.SYMBOL, TokenType.KEYWORD, TokenType.EOF),
                tokens.stream().map(Token::type).toList());
        assertEquals("0x1F", tokens.get(3).text());
        assertEquals("~=", tokens.get(6).text());
    }

    @Test
    void testContextualKeywordsAreNames() throws ParseException {
        List<Token> tokens = new Lexer("continue type export").tokenize();
        assertTrue(tokens.get(0).isName("continue"));
        assertTrue(tokens.get(1).isName("type"));
        assertTrue(tokens.get(2).isName("export"));
    }

    @Test
    void testLongestSymbolWins() throws ParseException {
        List<Token> tokens = new Lexer("a ..= b // c ... d //= e").tokenize();
        assertEquals("..=", tokens.get(1).text());
        assertEquals("//", tokens.get(3).text());
        assertEquals("...", tokens.get(5).text());
        assertEquals("//=", tokens.get(7).text());
    }

    @Test
    void testTriviaOwnership() throws ParseException {
        List<Token> tokens = new Lexer("-- header\nlocal a = 1 -- note\n\n--[[ block ]] return a").tokenize();
        Token local = tokens.get(0);
        assertEquals(List.of(Trivia.lineComment("-- header"), Trivia.whitespace("\n")), local.leadingTrivia());
        Token one = tokens.get(3);
        assertEquals(List.of(Trivia.whitespace(" "), Trivia.lineComment("-- note")), one.trailingTrivia());
        Token ret = tokens.get(4);
        assertEquals(TriviaKind.BLOCK_COMMENT, ret.leadingTrivia().get(1).kind());
        assertEquals(4, ret.line());
    }

    @Test
    void testShebang() throws ParseException {
        List<Token> tokens = new Lexer("#!/usr/bin/env lua\nreturn 1").tokenize();
        assertEquals(TriviaKind.SHEBANG, tokens.get(0).leadingTrivia().get(0).kind());
        assertEquals(2, tokens.get(0).line());
    }

    @Test
    void testPositions() throws ParseException {
        List<Token> tokens = new Lexer("a\n  bb").tokenize();
        assertEquals("1:1", tokens.get(0).location());
        assertEquals("2:3", tokens.get(1).location());
        assertEquals(TokenType.EOF, tokens.get(2).type());
    }

    @Test
    void testLongStrings() throws ParseException {
        List<Token> tokens = new Lexer("x = [==[a]]b]==] .. [[\nline]]").tokenize();
        assertEquals("[==[a]]b]==]", tokens.get(2).text());
        assertEquals("[[\nline]]", tokens.get(4).text());
    }

    @Test
    void testInterpolatedString() throws ParseException {
        List<Token> tokens = new Lexer("print(`a {b} c`)").tokenize();
        assertEquals(TokenType.INTERPOLATED_STRING, tokens.get(2).type());
        assertEquals("`a {b} c`", tokens.get(2).text());
    }

    @Test
    void testErrors() {
        ParseException unfinished = assertThrows(ParseException.class, () -> new Lexer("x = 'abc").tokenize());
        assertEquals(1, unfinished.getLine());
        assertEquals(5, unfinished.getColumn());
        assertThrows(ParseException.class, () -> new Lexer("x = \"a\nb\"").tokenize());
        assertThrows(ParseException.class, () -> new Lexer("x = [[never closed").tokenize());
        assertThrows(ParseException.class, () -> new Lexer("--[[ open comment").tokenize());
        assertThrows(ParseException.class, () -> new Lexer("x = 1 $ 2").tokenize());
    }

    @Test
    void testNumeralFollowedByDotIsMalformed() throws ParseException {
        ParseException concat = assertThrows(ParseException.class, () -> new Lexer("a = 1..2").tokenize());
        assertTrue(concat.getMessage().startsWith("malformed number"));
        assertEquals(5, concat.getColumn());
        assertThrows(ParseException.class, () -> new Lexer("a = 1.2.3").tokenize());
        assertThrows(ParseException.class, () -> new Lexer("a = 1...").tokenize());
        assertEquals(List.of(TokenType.NAME, TokenType.SYMBOL, TokenType.NUMBER, TokenType.SYMBOL,
                        TokenType.NUMBER, TokenType.EOF),
                new Lexer("a = 1 .. 2").tokenize().stream().map(Token::type).toList());
    }

    @Test
    void testRoundTripOfSample() throws ParseException {
        String source = "#!/bin/lua\r\n-- c\nlocal t = { 1, 2; x = 'y' } --[==[ z ]==]\n\treturn t[1]  \n";
        assertEquals(source, concatenate(new Lexer(source).tokenize()));
    }

    @Property(tries = 200)
    void testRoundTripOfWords(@ForAll("words") List<String> words) throws ParseException {
        String source = String.join(" ", words);
        assertEquals(source, concatenate(new Lexer(source).tokenize()));
    }

    @Property(tries = 200)
    void testRoundTripOfComments(@ForAll @StringLength(max = 30) String text) throws ParseException {
        String body = text.replace("\n", " ").replace("\r", " ");
        String source = "-- " + body + "\nreturn 1";
        assertEquals(source, concatenate(new Lexer(source).tokenize()));
    }

    @net.jqwik.api.Provide
    net.jqwik.api.Arbitrary<List<String>> words() {
        return net.jqwik.api.Arbitraries.of("local", "x", "=", "1", "+", "0x10", "'s'", "\"t\"", "..", "\n", "--c\n",
                        "(", ")", "{", "}", "1e3", "...", "\t")
                .list().ofMaxSize(20);
    }
}
