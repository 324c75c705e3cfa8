package org.csu.minipy.compiler.ir.operand;

/**
 * 源码中的具名变量 (局部变量、参数或全局名)
 */
public record Variable(String name) implements Operand {

    @Override
    public String render() {
        return name;
    }

    @Override
    public String toString() {
        return render();
    }
}
