package org.automatakit.expressions;

import lombok.Getter;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * 多元合取/析取的公共部分。操作数至少两个，且已经过 {@link Guards} 的规范化（展平、去重、排序）。
 */
public abstract class JunctionGuard extends Guard {

    @Getter
    private final List<Guard> operands;
    private final int hashCode;

    JunctionGuard(List<Guard> operands) {
        if (operands.size() < 2) {
            throw new IllegalArgumentException("Junction requires at least two operands: " + operands);
        }
        this.operands = Collections.unmodifiableList(operands);
        this.hashCode = 31 * getClass().hashCode() + operands.hashCode();
    }

    abstract String operatorSymbol();

    @Override
    public Set<String> getPropositions() {
        Set<String> propositions = new TreeSet<>();
        for (Guard operand : operands) {
            propositions.addAll(operand.getPropositions());
        }
        return propositions;
    }

    /**
     * 对每个操作数替换后重新交给工厂方法组合。
     */
    List<Guard> substituteOperands(Map<String, Boolean> valuation) {
        return operands.stream().map(g -> g.substitute(valuation)).collect(Collectors.toList());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        JunctionGuard that = (JunctionGuard) o;
        return hashCode == that.hashCode && operands.equals(that.operands);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return operands.stream()
                .map(g -> g.toStringWithin(precedence() + 1))
                .collect(Collectors.joining(" " + operatorSymbol() + " "));
    }
}
