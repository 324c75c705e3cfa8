package org.csu.minipy.compiler.lexer;

import java.util.EnumSet;
import java.util.Set;

/**
 * @description: 定义词法单元（Token）的类型，即“种别码”
 *
 * 这是 MiniPy 源语言中所有可能出现的“单词”的分类。
 */
public enum TokenType {
    // ---- 关键字 (Keywords) ----
    DEF,        // "def"
    CLASS,      // "class"
    IF,         // "if"
    ELIF,       // "elif"
    ELSE,       // "else"
    WHILE,      // "while"
    RETURN,     // "return"
    PASS,       // "pass"
    BREAK,      // "break"
    CONTINUE,   // "continue"
    AND,        // "and"
    OR,         // "or"
    NOT,        // "not"
    TRUE,       // "True"
    FALSE,      // "False"
    NONE,       // "None"

    // ---- 标识符 (Identifier) ----
    IDENTIFIER, // 函数名、变量名、属性名等

    // ---- 常量 (Constants) ----
    INTEGER_CONST,    // 整数常量, e.g., 123
    FLOAT_CONST,      // 小数常量, e.g., 123.45
    STRING_CONST,     // 字符串常量, e.g., "hello"

    // ---- 运算符 (Operators) ----
    PLUS,           // +
    MINUS,          // -
    STAR,           // *
    DOUBLE_STAR,    // **
    SLASH,          // /
    PERCENT,        // %
    EQUAL_EQUAL,    // ==
    NOT_EQUAL,      // !=
    LESS,           // <
    LESS_EQUAL,     // <=
    GREATER,        // >
    GREATER_EQUAL,  // >=
    ASSIGN,         // =

    // ---- 分隔符 (Delimiters) ----
    LPAREN,     // (
    RPAREN,     // )
    COMMA,      // ,
    COLON,      // :
    DOT,        // .

    // ---- 块结构 Token ----
    NEWLINE,    // 逻辑行结束
    INDENT,     // 缩进层级增加
    DEDENT,     // 缩进层级减少

    // ---- 特殊 Token ----
    EOF;        // End-Of-File，表示输入流结束

    private static final Set<TokenType> KEYWORDS = EnumSet.range(DEF, NONE);

    public boolean isKeyword() {
        return KEYWORDS.contains(this);
    }
}
