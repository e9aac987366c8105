package org.automatakit.expressions;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import org.automatakit.symbolic.Z3PropositionManager;

/**
 * 定义将 Java 对象转换为 Z3 布尔表达式 (BoolExpr) 的接口。
 */
public interface ToZ3BoolExpr {

    /**
     * 将此对象转换为 Z3 布尔表达式。
     * @param ctx Z3 Context 实例。
     * @param propositions Z3PropositionManager 实例，用于管理命题名到 Z3 布尔常量的映射。
     * @return 对应的 Z3 BoolExpr。
     */
    BoolExpr toZ3BoolExpr(Context ctx, Z3PropositionManager propositions);
}
