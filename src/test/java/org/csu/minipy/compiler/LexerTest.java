package org.csu.minipy.compiler;

import org.csu.minipy.common.exception.CompilerException;
import org.csu.minipy.common.exception.LexicalException;
import org.csu.minipy.compiler.lexer.Lexer;
import org.csu.minipy.compiler.lexer.Token;
import org.csu.minipy.compiler.lexer.TokenType;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.csu.minipy.compiler.lexer.TokenType.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * @description: Lexer 类的单元测试
 */
public class LexerTest {

    private List<Token> tokenize(String source) {
        System.out.println("Input source:\n" + source);
        List<Token> tokens = new Lexer(source).tokenize();
        System.out.println("Generated Tokens: " + tokens);
        return tokens;
    }

    private List<TokenType> types(List<Token> tokens) {
        return tokens.stream().map(Token::type).collect(Collectors.toList());
    }

    @Test
    void testIndentationProducesIndentAndDedent() {
        System.out.println("--- Running test: testIndentationProducesIndentAndDedent ---");
        System.out.println("Goal: Nested blocks are reconstructed from indentation widths.");
        String source = "def f(x):\n"
                + "    if x:\n"
                + "        return 1\n"
                + "    return 2\n";
        List<Token> tokens = tokenize(source);

        assertEquals(List.of(
                DEF, IDENTIFIER, LPAREN, IDENTIFIER, RPAREN, COLON, NEWLINE,
                INDENT, IF, IDENTIFIER, COLON, NEWLINE,
                INDENT, RETURN, INTEGER_CONST, NEWLINE,
                DEDENT, RETURN, INTEGER_CONST, NEWLINE,
                DEDENT, EOF), types(tokens));
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testEndOfInputClosesOpenBlocks() {
        System.out.println("--- Running test: testEndOfInputClosesOpenBlocks ---");
        System.out.println("Goal: A missing final newline is synthesized and every open block is closed.");
        List<Token> tokens = tokenize("class A:\n    def m(self):\n        pass");

        List<TokenType> tail = types(tokens).subList(tokens.size() - 4, tokens.size());
        assertEquals(List.of(NEWLINE, DEDENT, DEDENT, EOF), tail);
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testBlankAndCommentLinesAreIgnored() {
        System.out.println("--- Running test: testBlankAndCommentLinesAreIgnored ---");
        String source = "x = 1\n\n      # just a comment\n\ny = 2  # trailing\n";
        List<Token> tokens = tokenize(source);

        assertEquals(List.of(IDENTIFIER, ASSIGN, INTEGER_CONST, NEWLINE,
                IDENTIFIER, ASSIGN, INTEGER_CONST, NEWLINE, EOF), types(tokens));
        assertEquals("y", tokens.get(4).lexeme());
        assertEquals(5, tokens.get(4).line());
        assertEquals(1, tokens.get(4).column());
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testEmptyInputYieldsOnlyEof() {
        System.out.println("--- Running test: testEmptyInputYieldsOnlyEof ---");
        assertEquals(List.of(EOF), types(tokenize("")));
        assertEquals(List.of(EOF), types(tokenize("\n   \n# nothing here\n")));
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testInconsistentDedentIsRejected() {
        System.out.println("--- Running test: testInconsistentDedentIsRejected ---");
        System.out.println("Goal: Dedenting to a width that matches no enclosing block fails.");
        String source = "if x:\n"
                + "        y = 1\n"
                + "    z = 2\n";
        LexicalException e = assertThrows(LexicalException.class, () -> new Lexer(source).tokenize());
        System.out.println("Caught: " + e.getMessage());

        assertEquals(CompilerException.Kind.LEXICAL, e.getKind());
        assertEquals(3, e.getLine());
        assertEquals(5, e.getColumn());
        assertTrue(e.getMessage().startsWith("Lexical Error at line 3, column 5: Inconsistent dedent"));
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testLineBreaksInsideParenthesesAreJoined() {
        System.out.println("--- Running test: testLineBreaksInsideParenthesesAreJoined ---");
        List<Token> tokens = tokenize("print(1,\n      2)\nx = 3\n");

        assertEquals(List.of(IDENTIFIER, LPAREN, INTEGER_CONST, COMMA, INTEGER_CONST, RPAREN, NEWLINE,
                IDENTIFIER, ASSIGN, INTEGER_CONST, NEWLINE, EOF), types(tokens));
        assertEquals(2, tokens.get(4).line());
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testTabWidthIsConfigurable() {
        System.out.println("--- Running test: testTabWidthIsConfigurable ---");
        String source = "if x:\n\ty\n        z\n";

        // 制表符按 8 列计算时，两行缩进相同
        List<TokenType> wide = types(new Lexer(source, 8).tokenize());
        assertEquals(List.of(IF, IDENTIFIER, COLON, NEWLINE, INDENT, IDENTIFIER, NEWLINE,
                IDENTIFIER, NEWLINE, DEDENT, EOF), wide);

        // 按 4 列计算时，第三行更深一层
        List<TokenType> narrow = types(new Lexer(source, 4).tokenize());
        assertEquals(List.of(IF, IDENTIFIER, COLON, NEWLINE, INDENT, IDENTIFIER, NEWLINE,
                INDENT, IDENTIFIER, NEWLINE, DEDENT, DEDENT, EOF), narrow);

        assertThrows(IllegalArgumentException.class, () -> new Lexer(source, 0));
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testStringLiteralsAndEscapes() {
        System.out.println("--- Running test: testStringLiteralsAndEscapes ---");
        List<Token> tokens = tokenize("s = \"say \\\"hi\\\"\\tnow\\\\\"\n");

        assertEquals(STRING_CONST, tokens.get(2).type());
        assertEquals("say \"hi\"\tnow\\", tokens.get(2).lexeme());
        assertEquals(5, tokens.get(2).column());
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testUnterminatedStringIsRejected() {
        System.out.println("--- Running test: testUnterminatedStringIsRejected ---");
        LexicalException e = assertThrows(LexicalException.class, () -> new Lexer("x = \"abc\ny = 1\n").tokenize());
        System.out.println("Caught: " + e.getMessage());
        assertEquals(1, e.getLine());
        assertEquals(5, e.getColumn());
        assertTrue(e.getMessage().contains("Unterminated string literal"));
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testInvalidEscapeIsRejected() {
        System.out.println("--- Running test: testInvalidEscapeIsRejected ---");
        LexicalException e = assertThrows(LexicalException.class, () -> new Lexer("x = \"a\\qb\"\n").tokenize());
        System.out.println("Caught: " + e.getMessage());
        assertTrue(e.getMessage().contains("Invalid escape sequence '\\q'"));
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testNumbers() {
        System.out.println("--- Running test: testNumbers ---");
        List<Token> tokens = tokenize("a = 12 + 3.5\nb = 1.x\n");

        assertEquals(INTEGER_CONST, tokens.get(2).type());
        assertEquals("12", tokens.get(2).lexeme());
        assertEquals(FLOAT_CONST, tokens.get(4).type());
        assertEquals("3.5", tokens.get(4).lexeme());
        // 1.x 是整数后跟属性访问
        assertEquals(List.of(IDENTIFIER, ASSIGN, INTEGER_CONST, DOT, IDENTIFIER, NEWLINE),
                types(tokens).subList(6, 12));
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testMalformedNumbersAreRejected() {
        System.out.println("--- Running test: testMalformedNumbersAreRejected ---");
        LexicalException twoPoints = assertThrows(LexicalException.class, () -> new Lexer("x = 1.2.3\n").tokenize());
        System.out.println("Caught: " + twoPoints.getMessage());
        assertTrue(twoPoints.getMessage().contains("Malformed number literal '1.2.3'"));
        assertTrue(twoPoints.getMessage().contains("more than one decimal point"));
        assertEquals(5, twoPoints.getColumn());

        LexicalException glued = assertThrows(LexicalException.class, () -> new Lexer("x = 12ab\n").tokenize());
        System.out.println("Caught: " + glued.getMessage());
        assertTrue(glued.getMessage().endsWith("Malformed number literal '12ab'"));
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testOperatorsUseLongestMatch() {
        System.out.println("--- Running test: testOperatorsUseLongestMatch ---");
        List<Token> tokens = tokenize("a<=b==c!=d>=e<f>g=h%i\n");

        assertEquals(List.of(IDENTIFIER, LESS_EQUAL, IDENTIFIER, EQUAL_EQUAL, IDENTIFIER, NOT_EQUAL,
                IDENTIFIER, GREATER_EQUAL, IDENTIFIER, LESS, IDENTIFIER, GREATER, IDENTIFIER, ASSIGN,
                IDENTIFIER, PERCENT, IDENTIFIER, NEWLINE, EOF), types(tokens));
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testPowerOperatorAndLoopKeywords() {
        System.out.println("--- Running test: testPowerOperatorAndLoopKeywords ---");
        List<Token> tokens = tokenize("a**b*c\nbreak continue breaker\n");

        assertEquals(List.of(IDENTIFIER, DOUBLE_STAR, IDENTIFIER, STAR, IDENTIFIER, NEWLINE,
                BREAK, CONTINUE, IDENTIFIER, NEWLINE, EOF), types(tokens));
        assertEquals(new Token(DOUBLE_STAR, "**", 1, 2), tokens.get(1));
        assertTrue(BREAK.isKeyword());
        assertTrue(CONTINUE.isKeyword());
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testUnexpectedCharacters() {
        System.out.println("--- Running test: testUnexpectedCharacters ---");
        LexicalException bang = assertThrows(LexicalException.class, () -> new Lexer("a ! b\n").tokenize());
        assertTrue(bang.getMessage().contains("Unexpected character '!'"));
        assertEquals(3, bang.getColumn());

        LexicalException at = assertThrows(LexicalException.class, () -> new Lexer("x = 1\ny = @\n").tokenize());
        System.out.println("Caught: " + at.getMessage());
        assertEquals("Lexical Error at line 2, column 5: Unexpected character '@'", at.getMessage());
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testKeywordsAreCaseSensitive() {
        System.out.println("--- Running test: testKeywordsAreCaseSensitive ---");
        List<Token> tokens = tokenize("true True none None and_ or not\n");

        assertEquals(List.of(IDENTIFIER, TRUE, IDENTIFIER, NONE, IDENTIFIER, OR, NOT, NEWLINE, EOF),
                types(tokens));
        assertTrue(TRUE.isKeyword());
        assertFalse(IDENTIFIER.isKeyword());
        System.out.println("Result: Test PASSED.\n");
    }

    @Test
    void testTokenPositionsAndRepeatability() {
        System.out.println("--- Running test: testTokenPositionsAndRepeatability ---");
        Lexer lexer = new Lexer("def hello(name):\n    return name\n");
        List<Token> first = lexer.tokenize();

        assertEquals(new Token(DEF, "def", 1, 1), first.get(0));
        assertEquals(new Token(IDENTIFIER, "hello", 1, 5), first.get(1));
        assertEquals(new Token(INDENT, "", 2, 5), first.get(7));
        assertEquals(new Token(RETURN, "return", 2, 5), first.get(8));

        // 同一个实例再次调用得到完全相同的结果
        assertEquals(first, lexer.tokenize());
        System.out.println("Result: Test PASSED.\n");
    }
}
