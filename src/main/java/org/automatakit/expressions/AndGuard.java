package org.automatakit.expressions;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import org.automatakit.symbolic.Z3PropositionManager;

import java.util.List;
import java.util.Map;

/**
 * 合取 g1 &amp; g2 &amp; ... &amp; gn。
 */
public final class AndGuard extends JunctionGuard {

    AndGuard(List<Guard> operands) {
        super(operands);
    }

    @Override
    String operatorSymbol() {
        return "&";
    }

    @Override
    int precedence() {
        return 40;
    }

    @Override
    public Guard substitute(Map<String, Boolean> valuation) {
        return Guards.and(substituteOperands(valuation));
    }

    @Override
    public boolean evaluate(Map<String, Boolean> valuation) {
        for (Guard operand : getOperands()) {
            if (!operand.evaluate(valuation)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public BoolExpr toZ3BoolExpr(Context ctx, Z3PropositionManager propositions) {
        BoolExpr[] z3Operands = getOperands().stream()
                .map(g -> g.toZ3BoolExpr(ctx, propositions))
                .toArray(BoolExpr[]::new);
        return ctx.mkAnd(z3Operands);
    }
}
