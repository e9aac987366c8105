package org.automatakit.symbolic;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 负责管理命题名到 Z3 布尔常量的映射。
 * 确保每个命题在 Z3 Context 中有唯一的对应 Z3 变量。
 * @author Ayalyt
 */
public class Z3PropositionManager {

    private static final Logger logger = LoggerFactory.getLogger(Z3PropositionManager.class);

    @Getter
    private final Context ctx;
    // 与所属的 Z3BooleanAlgebra 一样只在单线程中使用，HashMap 即可
    private final Map<String, BoolExpr> propositionZ3Vars;

    /**
     * 构造函数。
     * @param ctx Z3 Context 实例。
     */
    public Z3PropositionManager(Context ctx) {
        this.ctx = Objects.requireNonNull(ctx, "Z3 Context cannot be null.");
        this.propositionZ3Vars = new HashMap<>();
    }

    /**
     * 获取指定命题对应的 Z3 布尔常量。
     * 如果变量尚未创建，则会创建并缓存。
     * @param proposition 命题名。
     * @return 对应的 Z3 BoolExpr 变量。
     */
    public BoolExpr getZ3Var(String proposition) {
        return propositionZ3Vars.computeIfAbsent(proposition, p -> {
            logger.debug("创建 Z3 命题变量: {}", p);
            return ctx.mkBoolConst(p);
        });
    }

    /**
     * @return 已创建的命题变量的只读视图。
     */
    public Map<String, BoolExpr> getKnownPropositions() {
        return Collections.unmodifiableMap(propositionZ3Vars);
    }
}
