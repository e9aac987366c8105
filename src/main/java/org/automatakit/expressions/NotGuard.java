package org.automatakit.expressions;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import lombok.Getter;
import org.automatakit.symbolic.Z3PropositionManager;

import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * 否定 ~g。
 */
@Getter
public final class NotGuard extends Guard {

    private static final int PRECEDENCE = 50;

    private final Guard operand;

    NotGuard(Guard operand) {
        this.operand = Objects.requireNonNull(operand, "Operand cannot be null.");
    }

    @Override
    public Set<String> getPropositions() {
        return operand.getPropositions();
    }

    @Override
    public Guard substitute(Map<String, Boolean> valuation) {
        return Guards.not(operand.substitute(valuation));
    }

    @Override
    public boolean evaluate(Map<String, Boolean> valuation) {
        return !operand.evaluate(valuation);
    }

    @Override
    int precedence() {
        return PRECEDENCE;
    }

    @Override
    public BoolExpr toZ3BoolExpr(Context ctx, Z3PropositionManager propositions) {
        return ctx.mkNot(operand.toZ3BoolExpr(ctx, propositions));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return operand.equals(((NotGuard) o).operand);
    }

    @Override
    public int hashCode() {
        return ~operand.hashCode();
    }

    @Override
    public String toString() {
        return "~" + operand.toStringWithin(PRECEDENCE);
    }
}
