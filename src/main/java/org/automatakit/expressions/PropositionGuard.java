package org.automatakit.expressions;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import lombok.Getter;
import org.automatakit.symbolic.Z3PropositionManager;

import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * 单个命名命题。
 */
@Getter
public final class PropositionGuard extends Guard {

    private final String name;

    PropositionGuard(String name) {
        this.name = Objects.requireNonNull(name, "Proposition name cannot be null.");
    }

    @Override
    public Set<String> getPropositions() {
        return Set.of(name);
    }

    @Override
    public Guard substitute(Map<String, Boolean> valuation) {
        Boolean value = valuation.get(name);
        if (value == null) {
            return this;
        }
        return Guards.constant(value);
    }

    @Override
    public boolean evaluate(Map<String, Boolean> valuation) {
        return Boolean.TRUE.equals(valuation.get(name));
    }

    @Override
    int precedence() {
        return Integer.MAX_VALUE;
    }

    @Override
    public BoolExpr toZ3BoolExpr(Context ctx, Z3PropositionManager propositions) {
        return propositions.getZ3Var(name);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return name.equals(((PropositionGuard) o).name);
    }

    @Override
    public int hashCode() {
        return name.hashCode();
    }

    @Override
    public String toString() {
        return name;
    }
}
