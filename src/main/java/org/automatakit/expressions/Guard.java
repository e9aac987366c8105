package org.automatakit.expressions;

import java.util.Map;
import java.util.Set;

/**
 * 符号迁移上的守卫：命名命题上的布尔公式。
 * 所有实现都是不可变的，并按结构比较相等性。
 * 应通过 {@link Guards} 的工厂方法构造守卫，工厂方法会做结构上的化简。
 * @author Ayalyt
 */
public abstract class Guard implements ToZ3BoolExpr {

    Guard() {
    }

    /**
     * @return 公式中出现的所有命题名。
     */
    public abstract Set<String> getPropositions();

    /**
     * 将赋值中出现的命题替换为常量，并做结构化简。未出现在赋值中的命题保持不变。
     * @param valuation 命题到布尔值的（部分）映射。
     * @return 替换后的守卫。
     */
    public abstract Guard substitute(Map<String, Boolean> valuation);

    /**
     * 在给定赋值下求值，赋值中缺失的命题视为 false。
     * @param valuation 命题到布尔值的（部分）映射。
     * @return 求值结果。
     */
    public abstract boolean evaluate(Map<String, Boolean> valuation);

    /**
     * @return 如果此守卫是常量 TRUE 或 FALSE 则返回 true。
     */
    public boolean isConstant() {
        return false;
    }

    /**
     * 运算符优先级，用于 toString 时决定是否加括号。数值越大结合越紧。
     */
    abstract int precedence();

    String toStringWithin(int outerPrecedence) {
        String text = toString();
        return precedence() < outerPrecedence ? "(" + text + ")" : text;
    }

    @Override
    public abstract boolean equals(Object o);

    @Override
    public abstract int hashCode();

    @Override
    public abstract String toString();
}
