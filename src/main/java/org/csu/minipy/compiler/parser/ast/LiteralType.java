package org.csu.minipy.compiler.parser.ast;

/**
 * 字面量的种类
 */
public enum LiteralType {
    INTEGER,
    FLOAT,
    STRING,
    BOOLEAN,
    NONE;

    /**
     * 将字面量文本渲染为源码形式，字符串会重新加上引号并转义。
     */
    public String render(String text) {
        if (this != STRING) {
            return text;
        }
        StringBuilder sb = new StringBuilder("\"");
        for (char ch : text.toCharArray()) {
            switch (ch) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\t' -> sb.append("\\t");
                case '\r' -> sb.append("\\r");
                default -> sb.append(ch);
            }
        }
        return sb.append('"').toString();
    }
}
