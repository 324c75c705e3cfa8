package org.csu.minipy.compiler.ir.operand;

/**
 * 临时变量 t1, t2, ...，在所属作用域内只被定义一次
 */
public record Temp(int index) implements Operand {

    public Temp {
        if (index <= 0) {
            throw new IllegalArgumentException("Temporary index must be positive: " + index);
        }
    }

    @Override
    public String render() {
        return "t" + index;
    }

    @Override
    public String toString() {
        return render();
    }
}
