package org.automatakit.automata.symbolic;

import lombok.Getter;
import org.automatakit.automata.exceptions.InvalidSymbolException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * 符号自动机的输入符号：命题名到布尔值的（部分）赋值。未出现的命题视为 false。
 * @author Ayalyt
 */
@Getter
public final class Valuation {

    private static final Logger logger = LoggerFactory.getLogger(Valuation.class);

    private static final Valuation EMPTY = new Valuation(new TreeMap<>());

    private final SortedMap<String, Boolean> assignment;

    private Valuation(SortedMap<String, Boolean> assignment) {
        this.assignment = Collections.unmodifiableSortedMap(assignment);
    }

    /**
     * 工厂方法：从 Map 创建赋值。
     * @param values 命题名到布尔值的映射。
     * @return Valuation 实例。
     * @throws InvalidSymbolException 如果映射为 null，或含有空的命题名、null 值。
     */
    public static Valuation of(Map<String, Boolean> values) {
        if (values == null) {
            logger.error("赋值不能为 null。");
            throw new InvalidSymbolException("赋值不能为 null。");
        }
        SortedMap<String, Boolean> tempAssignment = new TreeMap<>();
        for (Map.Entry<String, Boolean> entry : values.entrySet()) {
            if (entry.getKey() == null || entry.getKey().isBlank()) {
                logger.error("赋值 {} 中含有空的命题名。", values);
                throw new InvalidSymbolException("赋值中的命题名不能为空。");
            }
            if (entry.getValue() == null) {
                logger.error("赋值中命题 {} 的值为 null。", entry.getKey());
                throw new InvalidSymbolException("命题 " + entry.getKey() + " 的值不能为 null。");
            }
            tempAssignment.put(entry.getKey(), entry.getValue());
        }
        return new Valuation(tempAssignment);
    }

    /**
     * 工厂方法：给定的命题为 true，其余为 false。
     * @param trueValues 取值为 true 的命题。
     * @return Valuation 实例。
     */
    public static Valuation trueOf(String... trueValues) {
        Map<String, Boolean> values = new TreeMap<>();
        for (String proposition : trueValues) {
            if (proposition == null) {
                logger.error("命题名不能为 null。");
                throw new InvalidSymbolException("赋值中的命题名不能为空。");
            }
            values.put(proposition, Boolean.TRUE);
        }
        return of(values);
    }

    public static Valuation empty() {
        return EMPTY;
    }

    /**
     * @return 命题的值，未赋值的命题为 false。
     */
    public boolean getValue(String proposition) {
        return assignment.getOrDefault(proposition, Boolean.FALSE);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return assignment.equals(((Valuation) o).assignment);
    }

    @Override
    public int hashCode() {
        return assignment.hashCode();
    }

    @Override
    public String toString() {
        return assignment.toString();
    }
}
