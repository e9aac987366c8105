package org.automatakit.symbolic;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Solver;
import com.microsoft.z3.Status;
import lombok.Getter;
import org.automatakit.expressions.Guard;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 以 Z3 为可满足性预言机的布尔代数。
 * 每次查询都在同一个 Solver 上 push/add/check/pop，查询结果按守卫缓存。
 * 缓存容量有限，超出时淘汰最久未使用的条目。
 * 实例持有原生资源，使用完毕后必须 {@link #close()}；不是线程安全的。
 * @author Ayalyt
 */
public class Z3BooleanAlgebra implements BooleanAlgebra, AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(Z3BooleanAlgebra.class);

    @Getter
    private final Context context;
    @Getter
    private final Z3PropositionManager propositionManager;
    private final Solver solver;
    private final Map<Guard, Boolean> satisfiabilityCache;

    public static final int DEFAULT_CACHE_CAPACITY = 4096;

    public Z3BooleanAlgebra() {
        this(Map.of());
    }

    public Z3BooleanAlgebra(Map<String, String> z3Config) {
        this(z3Config, DEFAULT_CACHE_CAPACITY);
    }

    /**
     * @param z3Config      传给 Z3 Context 的配置项，例如 "model" -&gt; "false"。
     * @param cacheCapacity 可满足性缓存的最大条目数，0 表示不缓存。
     */
    public Z3BooleanAlgebra(Map<String, String> z3Config, int cacheCapacity) {
        Objects.requireNonNull(z3Config, "Z3 configuration cannot be null.");
        if (cacheCapacity < 0) {
            logger.error("缓存容量 {} 为负数。", cacheCapacity);
            throw new IllegalArgumentException("缓存容量不能为负数：" + cacheCapacity);
        }
        this.context = z3Config.isEmpty() ? new Context() : new Context(new HashMap<>(z3Config));
        this.propositionManager = new Z3PropositionManager(context);
        this.solver = context.mkSolver();
        this.satisfiabilityCache = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<Guard, Boolean> eldest) {
                return size() > cacheCapacity;
            }
        };
        logger.info("Z3BooleanAlgebra 初始化完成，配置：{}", z3Config);
    }

    @Override
    public boolean isSatisfiable(Guard guard) {
        Objects.requireNonNull(guard, "Guard cannot be null.");
        if (guard.isConstant()) {
            return guard.evaluate(Map.of());
        }
        Boolean cached = satisfiabilityCache.get(guard);
        if (cached != null) {
            return cached;
        }
        boolean result = check(guard.toZ3BoolExpr(context, propositionManager), guard);
        satisfiabilityCache.put(guard, result);
        return result;
    }

    private boolean check(BoolExpr expr, Guard guard) {
        solver.push();
        try {
            solver.add(expr);
            Status status = solver.check();
            logger.debug("Z3 检查 {} 结果：{}", guard, status);
            switch (status) {
                case SATISFIABLE:
                    return true;
                case UNSATISFIABLE:
                    return false;
                default:
                    logger.error("Z3 无法判定守卫 {} 的可满足性：{}", guard, solver.getReasonUnknown());
                    throw new IllegalStateException("Z3 返回 UNKNOWN：" + solver.getReasonUnknown());
            }
        } finally {
            solver.pop();
        }
    }

    int cachedResultCount() {
        return satisfiabilityCache.size();
    }

    @Override
    public void close() {
        logger.info("关闭 Z3BooleanAlgebra，共缓存 {} 个查询结果。", satisfiabilityCache.size());
        satisfiabilityCache.clear();
        context.close();
    }
}
