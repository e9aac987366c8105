package org.automatakit.expressions;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import org.automatakit.symbolic.Z3PropositionManager;

import java.util.Map;
import java.util.Set;

/**
 * 常量守卫 TRUE / FALSE。只有两个实例，见 {@link Guards#TRUE} 与 {@link Guards#FALSE}。
 */
public final class ConstantGuard extends Guard {

    private final boolean value;

    ConstantGuard(boolean value) {
        this.value = value;
    }

    public boolean getValue() {
        return value;
    }

    @Override
    public Set<String> getPropositions() {
        return Set.of();
    }

    @Override
    public Guard substitute(Map<String, Boolean> valuation) {
        return this;
    }

    @Override
    public boolean evaluate(Map<String, Boolean> valuation) {
        return value;
    }

    @Override
    public boolean isConstant() {
        return true;
    }

    @Override
    int precedence() {
        return Integer.MAX_VALUE;
    }

    @Override
    public BoolExpr toZ3BoolExpr(Context ctx, Z3PropositionManager propositions) {
        return value ? ctx.mkTrue() : ctx.mkFalse();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return value == ((ConstantGuard) o).value;
    }

    @Override
    public int hashCode() {
        return Boolean.hashCode(value);
    }

    @Override
    public String toString() {
        return value ? "true" : "false";
    }
}
