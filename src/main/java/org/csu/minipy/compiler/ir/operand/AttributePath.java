package org.csu.minipy.compiler.ir.operand;

/**
 * 属性路径，例如 self.name 或 t1.age
 *
 * @param base      接收者的值
 * @param attribute 属性名
 */
public record AttributePath(Operand base, String attribute) implements Operand {

    @Override
    public String render() {
        return base.render() + "." + attribute;
    }

    @Override
    public String toString() {
        return render();
    }
}
