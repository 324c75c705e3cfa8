package org.csu.minipy.compiler.parser;

import org.csu.minipy.common.exception.ParseException;
import org.csu.minipy.compiler.lexer.Token;
import org.csu.minipy.compiler.lexer.TokenType;
import org.csu.minipy.compiler.parser.ast.*;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * @description: 语法分析器
 * 采用递归下降法，将Token流转换为抽象语法树(AST)；表达式部分使用优先级爬升 (precedence climbing)。
 *
 * 不做错误恢复：遇到第一个语法错误即抛出 {@link ParseException}，整个单元解析失败。
 * 表达式与语句块的嵌套深度不超过 {@value #MAX_NESTING_DEPTH}，后续的降级与格式化都是递归实现的。
 */
public class Parser {

    // 二元运算符的绑定强度，数值越大绑定越紧
    private static final Map<TokenType, Integer> BINARY_PRECEDENCE = new EnumMap<>(TokenType.class);
    private static final int LOWEST_PRECEDENCE = 1;
    private static final int NOT_PRECEDENCE = 3;

    public static final int MAX_NESTING_DEPTH = 200;

    static {
        BINARY_PRECEDENCE.put(TokenType.OR, 1);
        BINARY_PRECEDENCE.put(TokenType.AND, 2);
        BINARY_PRECEDENCE.put(TokenType.EQUAL_EQUAL, 4);
        BINARY_PRECEDENCE.put(TokenType.NOT_EQUAL, 4);
        BINARY_PRECEDENCE.put(TokenType.LESS, 4);
        BINARY_PRECEDENCE.put(TokenType.LESS_EQUAL, 4);
        BINARY_PRECEDENCE.put(TokenType.GREATER, 4);
        BINARY_PRECEDENCE.put(TokenType.GREATER_EQUAL, 4);
        BINARY_PRECEDENCE.put(TokenType.PLUS, 5);
        BINARY_PRECEDENCE.put(TokenType.MINUS, 5);
        BINARY_PRECEDENCE.put(TokenType.STAR, 6);
        BINARY_PRECEDENCE.put(TokenType.SLASH, 6);
        BINARY_PRECEDENCE.put(TokenType.PERCENT, 6);
    }

    private final List<Token> tokens;
    private int position = 0;

    // 已声明的类名，用于识别构造调用；只包含目前为止解析到的类 (不支持前向引用)
    private final Set<String> declaredClasses = new HashSet<>();
    private int functionDepth = 0;
    private int loopDepth = 0;

    // 递归下降的当前深度 (括号、参数、一元运算、语句块)
    private int nestingDepth = 0;
    // 已构造的表达式节点 -> 子树高度；左结合链不经过递归，需要单独限制
    private final Map<ExpressionNode, Integer> expressionHeights = new IdentityHashMap<>();

    public Parser(List<Token> tokens) {
        if (tokens.isEmpty() || tokens.get(tokens.size() - 1).type() != TokenType.EOF) {
            throw new IllegalArgumentException("Token stream must be terminated by an EOF token");
        }
        this.tokens = List.copyOf(tokens);
    }

    public ModuleNode parse() {
        position = 0;
        declaredClasses.clear();
        functionDepth = 0;
        loopDepth = 0;
        nestingDepth = 0;
        expressionHeights.clear();

        List<StatementNode> body = new ArrayList<>();
        while (!isAtEnd()) {
            body.add(parseStatement());
        }
        return new ModuleNode(body, new SourcePosition(1, 1));
    }

    private StatementNode parseStatement() {
        if (check(TokenType.DEF)) {
            return parseFunctionDef();
        }
        if (check(TokenType.CLASS)) {
            return parseClassDef();
        }
        if (check(TokenType.IF)) {
            return parseIfStatement();
        }
        if (check(TokenType.WHILE)) {
            return parseWhileStatement();
        }
        if (check(TokenType.RETURN)) {
            return parseReturnStatement();
        }
        if (check(TokenType.BREAK) || check(TokenType.CONTINUE)) {
            return parseLoopControl();
        }
        if (check(TokenType.PASS)) {
            Token passToken = advance();
            consumeEndOfStatement();
            return new PassNode(SourcePosition.of(passToken));
        }
        if (check(TokenType.INDENT)) {
            throw new ParseException(peek(), "a statement (unexpected indentation)");
        }
        return parseExpressionStatement();
    }

    private FunctionDefNode parseFunctionDef() {
        Token defToken = consume(TokenType.DEF, "'def' keyword");
        String name = consume(TokenType.IDENTIFIER, "function name after 'def'").lexeme();
        consume(TokenType.LPAREN, "'(' after function name");

        List<String> parameters = new ArrayList<>();
        if (!check(TokenType.RPAREN)) {
            do {
                Token parameter = consume(TokenType.IDENTIFIER, "parameter name");
                if (parameters.contains(parameter.lexeme())) {
                    throw new ParseException(
                            "Duplicate parameter '" + parameter.lexeme() + "' in function '" + name + "'",
                            parameter.line(), parameter.column());
                }
                parameters.add(parameter.lexeme());
            } while (match(TokenType.COMMA));
        }
        consume(TokenType.RPAREN, "')' after parameters");

        // 函数体是新的控制流边界，外层循环对其中的 break / continue 不可见
        int enclosingLoops = loopDepth;
        functionDepth++;
        loopDepth = 0;
        try {
            List<StatementNode> body = parseBlock("function body");
            return new FunctionDefNode(name, parameters, body, SourcePosition.of(defToken));
        } finally {
            functionDepth--;
            loopDepth = enclosingLoops;
        }
    }

    private ClassDefNode parseClassDef() {
        Token classToken = consume(TokenType.CLASS, "'class' keyword");
        String name = consume(TokenType.IDENTIFIER, "class name after 'class'").lexeme();
        // 在解析类体之前登记，方法体内可以实例化自身所在的类
        declaredClasses.add(name);

        String baseName = null;
        if (match(TokenType.LPAREN)) {
            if (!check(TokenType.RPAREN)) {
                baseName = consume(TokenType.IDENTIFIER, "base class name").lexeme();
                if (check(TokenType.COMMA)) {
                    Token comma = peek();
                    throw new ParseException("Multiple inheritance is not supported in class '" + name + "'",
                            comma.line(), comma.column());
                }
            }
            consume(TokenType.RPAREN, "')' after base class");
        }

        consume(TokenType.COLON, "':' after class name");
        consume(TokenType.NEWLINE, "newline after ':'");
        consume(TokenType.INDENT, "an indented class body");
        if (check(TokenType.DEDENT)) {
            throw new ParseException(peek(), "at least one method definition in class body (empty block)");
        }

        List<FunctionDefNode> methods = new ArrayList<>();
        while (!check(TokenType.DEDENT) && !isAtEnd()) {
            if (!check(TokenType.DEF)) {
                throw new ParseException(peek(), "a method definition ('def') in class body");
            }
            methods.add(parseFunctionDef());
        }
        consume(TokenType.DEDENT, "end of class body");
        return new ClassDefNode(name, baseName, methods, SourcePosition.of(classToken));
    }

    /**
     * 解析 if / elif 语句，elif 被表示为 else 分支中嵌套的 IfNode。
     */
    private IfNode parseIfStatement() {
        Token ifToken = advance(); // 'if' 或 'elif'
        ExpressionNode test = parseExpression();
        List<StatementNode> thenBody = parseBlock("'" + ifToken.lexeme() + "' body");

        List<StatementNode> elseBody = List.of();
        if (check(TokenType.ELIF)) {
            // elif 链在 AST 中逐层嵌套，同样计入嵌套深度
            enterNesting(peek());
            elseBody = List.of(parseIfStatement());
            exitNesting();
        } else if (match(TokenType.ELSE)) {
            elseBody = parseBlock("'else' body");
        }
        return new IfNode(test, thenBody, elseBody, SourcePosition.of(ifToken));
    }

    private WhileNode parseWhileStatement() {
        Token whileToken = consume(TokenType.WHILE, "'while' keyword");
        ExpressionNode test = parseExpression();
        loopDepth++;
        try {
            List<StatementNode> body = parseBlock("'while' body");
            return new WhileNode(test, body, SourcePosition.of(whileToken));
        } finally {
            loopDepth--;
        }
    }

    private StatementNode parseLoopControl() {
        Token keyword = advance();
        if (loopDepth == 0) {
            throw new ParseException("'" + keyword.lexeme() + "' outside loop", keyword.line(), keyword.column());
        }
        consumeEndOfStatement();
        SourcePosition position = SourcePosition.of(keyword);
        return keyword.type() == TokenType.BREAK ? new BreakNode(position) : new ContinueNode(position);
    }

    private ReturnNode parseReturnStatement() {
        Token returnToken = consume(TokenType.RETURN, "'return' keyword");
        if (functionDepth == 0) {
            throw new ParseException("'return' outside function", returnToken.line(), returnToken.column());
        }
        ExpressionNode value = null;
        if (!check(TokenType.NEWLINE)) {
            value = parseExpression();
        }
        consumeEndOfStatement();
        return new ReturnNode(value, SourcePosition.of(returnToken));
    }

    private StatementNode parseExpressionStatement() {
        Token start = peek();
        ExpressionNode expression = parseExpression();

        if (check(TokenType.ASSIGN)) {
            advance();
            if (!(expression instanceof NameNode) && !(expression instanceof AttributeNode)) {
                throw new ParseException("Invalid assignment target: cannot assign to " + expression.kind(),
                        start.line(), start.column());
            }
            ExpressionNode value = parseExpression();
            consumeEndOfStatement();
            return new AssignNode(expression, value, SourcePosition.of(start));
        }

        consumeEndOfStatement();
        return new ExpressionStatementNode(expression, SourcePosition.of(start));
    }

    /**
     * 解析 ':' NEWLINE INDENT statement+ DEDENT
     */
    private List<StatementNode> parseBlock(String description) {
        consume(TokenType.COLON, "':' before " + description);
        consume(TokenType.NEWLINE, "newline after ':'");
        Token indent = consume(TokenType.INDENT, "an indented block for " + description);
        if (check(TokenType.DEDENT)) {
            throw new ParseException(peek(), "at least one statement in " + description + " (empty block)");
        }

        enterNesting(indent);
        List<StatementNode> statements = new ArrayList<>();
        while (!check(TokenType.DEDENT) && !isAtEnd()) {
            statements.add(parseStatement());
        }
        consume(TokenType.DEDENT, "end of indented block");
        exitNesting();
        return statements;
    }

    // ---- 表达式 ----

    private ExpressionNode parseExpression() {
        return parseBinary(LOWEST_PRECEDENCE);
    }

    private ExpressionNode parseBinary(int minPrecedence) {
        ExpressionNode left = parseUnary(minPrecedence);
        while (true) {
            Token operator = peek();
            Integer precedence = BINARY_PRECEDENCE.get(operator.type());
            if (precedence == null || precedence < minPrecedence) {
                break;
            }
            advance();
            // 左结合：右操作数只吸收绑定更紧的运算符
            ExpressionNode right = parseBinary(precedence + 1);
            left = track(new BinaryExpressionNode(operator.lexeme(), left, right, left.position()), operator);
        }
        return left;
    }

    private ExpressionNode parseUnary(int minPrecedence) {
        if (check(TokenType.NOT)) {
            if (minPrecedence > NOT_PRECEDENCE) {
                throw new ParseException(peek(), "an operand ('not' must be parenthesized here)");
            }
            Token operator = advance();
            enterNesting(operator);
            ExpressionNode operand = parseBinary(NOT_PRECEDENCE);
            exitNesting();
            return track(new UnaryExpressionNode("not", operand, SourcePosition.of(operator)), operator);
        }
        if (check(TokenType.MINUS)) {
            Token operator = advance();
            enterNesting(operator);
            ExpressionNode operand = parseUnary(Integer.MAX_VALUE);
            exitNesting();
            return track(new UnaryExpressionNode("-", operand, SourcePosition.of(operator)), operator);
        }
        return parsePowerExpression();
    }

    /**
     * 幂运算右结合，且比左侧的一元负号绑定更紧: -2 ** 2 == -(2 ** 2)，2 ** -1 合法。
     */
    private ExpressionNode parsePowerExpression() {
        ExpressionNode base = parsePostfixExpression();
        if (!check(TokenType.DOUBLE_STAR)) {
            return base;
        }
        Token operator = advance();
        enterNesting(operator);
        ExpressionNode exponent = parseUnary(Integer.MAX_VALUE);
        exitNesting();
        return track(new BinaryExpressionNode("**", base, exponent, base.position()), operator);
    }

    /**
     * 解析调用与属性访问后缀。
     * name(args) 是普通调用 (若 name 是已声明的类则标记为构造调用)，
     * expr.name(args) 被显式标记为方法调用。
     */
    private ExpressionNode parsePostfixExpression() {
        ExpressionNode expression = parsePrimaryExpression();
        while (true) {
            if (match(TokenType.DOT)) {
                Token attribute = consume(TokenType.IDENTIFIER, "attribute name after '.'");
                expression = track(new AttributeNode(expression, attribute.lexeme(), expression.position()), attribute);
            } else if (check(TokenType.LPAREN)) {
                Token paren = advance();
                List<ExpressionNode> arguments = parseArguments();
                if (expression instanceof NameNode name) {
                    expression = track(new CallNode(name.identifier(), arguments,
                            declaredClasses.contains(name.identifier()), name.position()), paren);
                } else if (expression instanceof AttributeNode attribute) {
                    expression = track(new MethodCallNode(attribute.receiver(), attribute.name(), arguments,
                            attribute.position()), paren);
                } else {
                    throw new ParseException("Only names and attributes can be called, not " + expression.kind(),
                            paren.line(), paren.column());
                }
            } else {
                return expression;
            }
        }
    }

    private List<ExpressionNode> parseArguments() {
        enterNesting(previous());
        List<ExpressionNode> arguments = new ArrayList<>();
        if (!check(TokenType.RPAREN)) {
            do {
                arguments.add(parseExpression());
            } while (match(TokenType.COMMA));
        }
        consume(TokenType.RPAREN, "')' after arguments");
        exitNesting();
        return arguments;
    }

    private ExpressionNode parsePrimaryExpression() {
        Token token = peek();
        SourcePosition position = SourcePosition.of(token);
        if (match(TokenType.INTEGER_CONST)) {
            return new ConstantNode(LiteralType.INTEGER, token.lexeme(), position);
        }
        if (match(TokenType.FLOAT_CONST)) {
            return new ConstantNode(LiteralType.FLOAT, token.lexeme(), position);
        }
        if (match(TokenType.STRING_CONST)) {
            return new ConstantNode(LiteralType.STRING, token.lexeme(), position);
        }
        if (match(TokenType.TRUE, TokenType.FALSE)) {
            return new ConstantNode(LiteralType.BOOLEAN, token.lexeme(), position);
        }
        if (match(TokenType.NONE)) {
            return new ConstantNode(LiteralType.NONE, token.lexeme(), position);
        }
        if (match(TokenType.IDENTIFIER)) {
            return new NameNode(token.lexeme(), position);
        }
        if (match(TokenType.LPAREN)) {
            enterNesting(token);
            ExpressionNode expression = parseExpression();
            consume(TokenType.RPAREN, "')' after expression");
            exitNesting();
            return expression;
        }
        throw new ParseException(token, "an expression (a literal, a name, or a parenthesized expression)");
    }

    // ---- 嵌套深度 ----

    private void enterNesting(Token at) {
        if (++nestingDepth > MAX_NESTING_DEPTH) {
            throw tooDeep(at);
        }
    }

    private void exitNesting() {
        nestingDepth--;
    }

    /**
     * 记录新节点的子树高度；叶子节点不登记，按高度 1 计算。
     */
    private <T extends ExpressionNode> T track(T node, Token at) {
        int height = 1;
        for (AstChild child : node.children()) {
            if (child.node() instanceof ExpressionNode expression) {
                height = Math.max(height, expressionHeights.getOrDefault(expression, 1) + 1);
            }
        }
        if (height > MAX_NESTING_DEPTH) {
            throw tooDeep(at);
        }
        expressionHeights.put(node, height);
        return node;
    }

    private ParseException tooDeep(Token at) {
        return new ParseException("Too many nested expressions or blocks (maximum depth is " + MAX_NESTING_DEPTH + ")",
                at.line(), at.column());
    }

    // ---- 辅助方法 ----

    private void consumeEndOfStatement() {
        consume(TokenType.NEWLINE, "end of statement (newline)");
    }

    private boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    private Token consume(TokenType type, String message) {
        if (check(type)) return advance();
        throw new ParseException(peek(), message);
    }

    private boolean check(TokenType type) {
        if (isAtEnd()) return false;
        return peek().type() == type;
    }

    private Token advance() {
        if (!isAtEnd()) position++;
        return previous();
    }

    private boolean isAtEnd() {
        return peek().type() == TokenType.EOF;
    }

    private Token peek() {
        return tokens.get(position);
    }

    private Token previous() {
        return tokens.get(position - 1);
    }
}
