package org.automatakit.expressions;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import org.automatakit.symbolic.Z3PropositionManager;

import java.util.List;
import java.util.Map;

/**
 * 析取 g1 | g2 | ... | gn。
 */
public final class OrGuard extends JunctionGuard {

    OrGuard(List<Guard> operands) {
        super(operands);
    }

    @Override
    String operatorSymbol() {
        return "|";
    }

    @Override
    int precedence() {
        return 30;
    }

    @Override
    public Guard substitute(Map<String, Boolean> valuation) {
        return Guards.or(substituteOperands(valuation));
    }

    @Override
    public boolean evaluate(Map<String, Boolean> valuation) {
        for (Guard operand : getOperands()) {
            if (operand.evaluate(valuation)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public BoolExpr toZ3BoolExpr(Context ctx, Z3PropositionManager propositions) {
        BoolExpr[] z3Operands = getOperands().stream()
                .map(g -> g.toZ3BoolExpr(ctx, propositions))
                .toArray(BoolExpr[]::new);
        return ctx.mkOr(z3Operands);
    }
}
