package org.csu.minipy.compiler.lexer;

import org.csu.minipy.common.exception.LexicalException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * @description: 词法分析器 (Lexer/Scanner)
 *
 * 负责将输入的源代码分解为一系列的Token。
 * 块结构由缩进表示，词法分析器维护一个缩进宽度栈，并据此合成 INDENT / DEDENT。
 * 每次调用 {@link #tokenize()} 都会重置全部状态，因此同一个实例可以重复调用，但不能中途续读。
 */
public class Lexer {

    public static final int DEFAULT_TAB_WIDTH = 4;

    private final String input;
    private final int tabWidth;

    private int position;   // 当前读取的位置
    private int line;       // 当前行号
    private int column;     // 当前列号
    private int parenDepth; // 括号嵌套深度，括号内换行不具有语法意义
    private boolean atLineStart;
    private Deque<Integer> indentStack;

    // 关键字映射表
    private static final Map<String, TokenType> keywords;

    static {
        keywords = new HashMap<>();
        keywords.put("def", TokenType.DEF);
        keywords.put("class", TokenType.CLASS);
        keywords.put("if", TokenType.IF);
        keywords.put("elif", TokenType.ELIF);
        keywords.put("else", TokenType.ELSE);
        keywords.put("while", TokenType.WHILE);
        keywords.put("return", TokenType.RETURN);
        keywords.put("pass", TokenType.PASS);
        keywords.put("break", TokenType.BREAK);
        keywords.put("continue", TokenType.CONTINUE);
        keywords.put("and", TokenType.AND);
        keywords.put("or", TokenType.OR);
        keywords.put("not", TokenType.NOT);
        keywords.put("True", TokenType.TRUE);
        keywords.put("False", TokenType.FALSE);
        keywords.put("None", TokenType.NONE);
    }

    public Lexer(String input) {
        this(input, DEFAULT_TAB_WIDTH);
    }

    public Lexer(String input, int tabWidth) {
        if (tabWidth <= 0) {
            throw new IllegalArgumentException("Tab width must be positive: " + tabWidth);
        }
        this.input = input == null ? "" : input;
        this.tabWidth = tabWidth;
    }

    /**
     * 主方法，执行词法分析并返回所有Token
     * @return Token列表，总是以 EOF 结尾
     */
    public List<Token> tokenize() {
        reset();
        List<Token> tokens = new ArrayList<>();
        while (position < input.length()) {
            if (atLineStart && !readIndentation(tokens)) {
                // 空行或纯注释行，已整体跳过
                continue;
            }
            char currentChar = peek();
            if (currentChar == '\n') {
                if (parenDepth == 0) {
                    tokens.add(new Token(TokenType.NEWLINE, "", line, column));
                    atLineStart = true;
                }
                advance();
                continue;
            }
            if (currentChar == ' ' || currentChar == '\t' || currentChar == '\r' || currentChar == '\f') {
                advance();
                continue;
            }
            if (currentChar == '#') {
                skipComment();
                continue;
            }
            tokens.add(nextToken());
        }
        finish(tokens);
        return tokens;
    }

    private void reset() {
        position = 0;
        line = 1;
        column = 1;
        parenDepth = 0;
        atLineStart = true;
        indentStack = new ArrayDeque<>();
        indentStack.push(0);
    }

    /**
     * 处理逻辑行开头的缩进。
     * @return false 表示这是空行或纯注释行 (已消耗到行尾)，不产生任何Token
     */
    private boolean readIndentation(List<Token> tokens) {
        int width = 0;
        while (position < input.length() && (peek() == ' ' || peek() == '\t' || peek() == '\f')) {
            if (peek() == ' ') {
                width++;
            } else if (peek() == '\t') {
                width += tabWidth;
            }
            advance();
        }
        if (position >= input.length()) {
            return false;
        }
        char ch = peek();
        if (ch == '\n' || ch == '\r' || ch == '#') {
            while (position < input.length() && peek() != '\n') {
                advance();
            }
            if (position < input.length()) {
                advance(); // 吃掉换行符
            }
            return false;
        }

        atLineStart = false;
        int current = indentStack.peek();
        if (width > current) {
            indentStack.push(width);
            tokens.add(new Token(TokenType.INDENT, "", line, column));
        } else if (width < current) {
            while (width < indentStack.peek()) {
                indentStack.pop();
                tokens.add(new Token(TokenType.DEDENT, "", line, column));
            }
            if (width != indentStack.peek()) {
                throw new LexicalException(String.format(
                        "Inconsistent dedent: indentation width %d does not match any enclosing block", width),
                        line, column);
            }
        }
        return true;
    }

    private void finish(List<Token> tokens) {
        if (!tokens.isEmpty() && tokens.get(tokens.size() - 1).type() != TokenType.NEWLINE) {
            tokens.add(new Token(TokenType.NEWLINE, "", line, column));
        }
        while (indentStack.size() > 1) {
            indentStack.pop();
            tokens.add(new Token(TokenType.DEDENT, "", line, column));
        }
        tokens.add(new Token(TokenType.EOF, "", line, column));
    }

    /**
     * 获取下一个Token (调用前已跳过空白与注释)
     * @return 解析出的下一个Token
     */
    private Token nextToken() {
        char currentChar = peek();

        // 识别标识符或关键字
        if (isLetter(currentChar)) {
            return readIdentifierOrKeyword();
        }

        // 识别数字
        if (isDigit(currentChar)) {
            return readNumber();
        }

        // 识别字符串
        if (currentChar == '"') {
            return readString();
        }

        // 识别运算符和分隔符 (最长匹配)
        switch (currentChar) {
            case '(':
                parenDepth++;
                return consumeAndReturn(TokenType.LPAREN, "(");
            case ')':
                if (parenDepth > 0) {
                    parenDepth--;
                }
                return consumeAndReturn(TokenType.RPAREN, ")");
            case ',':
                return consumeAndReturn(TokenType.COMMA, ",");
            case ':':
                return consumeAndReturn(TokenType.COLON, ":");
            case '.':
                return consumeAndReturn(TokenType.DOT, ".");
            case '+':
                return consumeAndReturn(TokenType.PLUS, "+");
            case '-':
                return consumeAndReturn(TokenType.MINUS, "-");
            case '*':
                if (peekNext() == '*') {
                    return consumeAndReturn(TokenType.DOUBLE_STAR, "**");
                }
                return consumeAndReturn(TokenType.STAR, "*");
            case '/':
                return consumeAndReturn(TokenType.SLASH, "/");
            case '%':
                return consumeAndReturn(TokenType.PERCENT, "%");
            case '=':
                if (peekNext() == '=') {
                    return consumeAndReturn(TokenType.EQUAL_EQUAL, "==");
                }
                return consumeAndReturn(TokenType.ASSIGN, "=");
            case '!':
                if (peekNext() == '=') {
                    return consumeAndReturn(TokenType.NOT_EQUAL, "!=");
                }
                throw unexpectedCharacter(currentChar);
            case '<':
                if (peekNext() == '=') {
                    return consumeAndReturn(TokenType.LESS_EQUAL, "<=");
                }
                return consumeAndReturn(TokenType.LESS, "<");
            case '>':
                if (peekNext() == '=') {
                    return consumeAndReturn(TokenType.GREATER_EQUAL, ">=");
                }
                return consumeAndReturn(TokenType.GREATER, ">");
            default:
                throw unexpectedCharacter(currentChar);
        }
    }

    private Token readIdentifierOrKeyword() {
        int startPos = position;
        int startCol = column;
        while (position < input.length() && isLetterOrDigit(peek())) {
            advance();
        }
        String text = input.substring(startPos, position);
        // 关键字区分大小写 (True / False / None 首字母大写)
        TokenType type = keywords.getOrDefault(text, TokenType.IDENTIFIER);
        return new Token(type, text, line, startCol);
    }

    private Token readNumber() {
        int startPos = position;
        int startCol = column;
        while (position < input.length() && isDigit(peek())) {
            advance();
        }

        TokenType type = TokenType.INTEGER_CONST;
        // 小数点后必须紧跟数字，以区分 `1.attr` 这种属性访问
        if (peek() == '.' && isDigit(peekNext())) {
            advance(); // 消耗掉 '.'
            while (position < input.length() && isDigit(peek())) {
                advance();
            }
            type = TokenType.FLOAT_CONST;
            if (peek() == '.' && isDigit(peekNext())) {
                while (position < input.length() && (isDigit(peek()) || peek() == '.')) {
                    advance();
                }
                throw new LexicalException(String.format(
                        "Malformed number literal '%s': more than one decimal point",
                        input.substring(startPos, position)), line, startCol);
            }
        }
        if (isLetter(peek())) {
            while (position < input.length() && isLetterOrDigit(peek())) {
                advance();
            }
            throw new LexicalException(String.format(
                    "Malformed number literal '%s'", input.substring(startPos, position)), line, startCol);
        }
        String number = input.substring(startPos, position);
        return new Token(type, number, line, startCol);
    }

    private Token readString() {
        int startLine = line;
        int startCol = column;
        advance(); // 跳过起始的双引号
        StringBuilder value = new StringBuilder();
        while (true) {
            if (position >= input.length() || peek() == '\n') {
                throw new LexicalException("Unterminated string literal", startLine, startCol);
            }
            char ch = peek();
            if (ch == '"') {
                advance(); // 跳过结束的双引号
                break;
            }
            if (ch == '\\') {
                value.append(readEscape(startLine, startCol));
            } else {
                value.append(ch);
                advance();
            }
        }
        return new Token(TokenType.STRING_CONST, value.toString(), startLine, startCol);
    }

    private char readEscape(int stringLine, int stringCol) {
        int escapeCol = column;
        advance(); // 跳过反斜杠
        if (position >= input.length() || peek() == '\n') {
            throw new LexicalException("Unterminated string literal", stringLine, stringCol);
        }
        char escaped = peek();
        advance();
        switch (escaped) {
            case '"':
                return '"';
            case '\\':
                return '\\';
            case 'n':
                return '\n';
            case 't':
                return '\t';
            case 'r':
                return '\r';
            default:
                throw new LexicalException("Invalid escape sequence '\\" + escaped + "'", line, escapeCol);
        }
    }

    // --- 辅助方法 ---

    private void skipComment() {
        while (position < input.length() && peek() != '\n') {
            advance();
        }
    }

    private LexicalException unexpectedCharacter(char ch) {
        return new LexicalException(String.format("Unexpected character '%s'", ch), line, column);
    }

    private char peek() {
        if (position >= input.length()) return '\0'; // 文件结束符
        return input.charAt(position);
    }

    private char peekNext() {
        if (position + 1 >= input.length()) return '\0';
        return input.charAt(position + 1);
    }

    private void advance() {
        char ch = input.charAt(position++);
        if (ch == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
    }

    private Token consumeAndReturn(TokenType type, String lexeme) {
        Token token = new Token(type, lexeme, line, column);
        for (int i = 0; i < lexeme.length(); i++) {
            advance();
        }
        return token;
    }

    private boolean isLetter(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isLetterOrDigit(char c) {
        return isLetter(c) || isDigit(c);
    }
}
