package org.automatakit.symbolic;

import lombok.Getter;
import org.automatakit.expressions.Guard;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 通过枚举真值表判定可满足性的布尔代数，只适用于命题数较少的守卫。
 * @author Ayalyt
 */
public class TruthTableBooleanAlgebra implements BooleanAlgebra {

    private static final Logger logger = LoggerFactory.getLogger(TruthTableBooleanAlgebra.class);

    public static final int DEFAULT_MAX_PROPOSITIONS = 16;

    @Getter
    private final int maxPropositions;

    public TruthTableBooleanAlgebra() {
        this(DEFAULT_MAX_PROPOSITIONS);
    }

    public TruthTableBooleanAlgebra(int maxPropositions) {
        if (maxPropositions < 0 || maxPropositions > 30) {
            logger.error("真值表命题数上限 {} 不合法。", maxPropositions);
            throw new IllegalArgumentException("命题数上限必须位于 [0, 30] 内：" + maxPropositions);
        }
        this.maxPropositions = maxPropositions;
    }

    @Override
    public boolean isSatisfiable(Guard guard) {
        Objects.requireNonNull(guard, "Guard cannot be null.");
        List<String> propositions = new ArrayList<>(guard.getPropositions());
        if (propositions.size() > maxPropositions) {
            logger.error("守卫 {} 含 {} 个命题，超过真值表上限 {}。", guard, propositions.size(), maxPropositions);
            throw new IllegalStateException("命题数 " + propositions.size() + " 超过真值表上限 " + maxPropositions);
        }
        Map<String, Boolean> valuation = new HashMap<>();
        for (long row = 0; row < (1L << propositions.size()); row++) {
            for (int i = 0; i < propositions.size(); i++) {
                valuation.put(propositions.get(i), ((row >> i) & 1) == 1);
            }
            if (guard.evaluate(valuation)) {
                logger.debug("守卫 {} 在赋值 {} 下为真。", guard, valuation);
                return true;
            }
        }
        logger.debug("守卫 {} 不可满足。", guard);
        return false;
    }
}
