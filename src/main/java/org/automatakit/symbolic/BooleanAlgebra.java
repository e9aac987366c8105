package org.automatakit.symbolic;

import org.automatakit.expressions.Guard;
import org.automatakit.expressions.GuardParser;
import org.automatakit.expressions.Guards;

import java.util.Arrays;
import java.util.Collection;
import java.util.Map;

/**
 * 守卫上的布尔代数能力：构造、替换、可满足性判定与化简。
 * 符号自动机只通过此接口推理守卫，不依赖具体的求解器。
 * 构造运算默认委托给 {@link Guards} 的结构化简；实现只需提供可满足性判定。
 * @author Ayalyt
 */
public interface BooleanAlgebra {

    default Guard trueGuard() {
        return Guards.TRUE;
    }

    default Guard falseGuard() {
        return Guards.FALSE;
    }

    default Guard and(Guard... guards) {
        return Guards.and(Arrays.asList(guards));
    }

    default Guard and(Collection<? extends Guard> guards) {
        return Guards.and(guards);
    }

    default Guard or(Guard... guards) {
        return Guards.or(Arrays.asList(guards));
    }

    default Guard or(Collection<? extends Guard> guards) {
        return Guards.or(guards);
    }

    default Guard not(Guard guard) {
        return Guards.not(guard);
    }

    /**
     * 将赋值代入守卫。赋值中缺失的命题保持为自由命题。
     */
    default Guard substitute(Guard guard, Map<String, Boolean> valuation) {
        return guard.substitute(valuation);
    }

    /**
     * 判断守卫是否存在满足赋值。
     * @param guard 守卫。
     * @return 可满足时返回 true。
     * @throws IllegalStateException 如果无法得出结论。
     */
    boolean isSatisfiable(Guard guard);

    /**
     * @return 守卫在所有赋值下为真时返回 true。
     */
    default boolean isValid(Guard guard) {
        return !isSatisfiable(not(guard));
    }

    /**
     * 语义化简：不可满足的守卫化为 FALSE，永真的守卫化为 TRUE，其余保持结构化简后的形式。
     */
    default Guard simplify(Guard guard) {
        if (guard.isConstant()) {
            return guard;
        }
        if (!isSatisfiable(guard)) {
            return falseGuard();
        }
        if (isValid(guard)) {
            return trueGuard();
        }
        return guard;
    }

    /**
     * 解析文本守卫。
     * @throws org.automatakit.expressions.GuardParseException 如果文本不合法。
     */
    default Guard parse(String expression) {
        return GuardParser.parse(expression);
    }
}
