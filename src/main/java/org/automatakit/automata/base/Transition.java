package org.automatakit.automata.base;

import lombok.Getter;

import java.util.Objects;

/**
 * 代表自动机中的一条迁移 (source, label, target)。
 * 显式自动机的标签是符号，符号自动机的标签是守卫。
 * 此类是不可变的。
 *
 * @param <S> 状态类型
 * @param <L> 标签类型
 */
@Getter
public final class Transition<S, L> {

    private final S source;
    private final L label;
    private final S target;

    private final int hashCode;

    /**
     * @param source 源状态 (q)
     * @param label  迁移标签 (a 或 g)
     * @param target 目标状态 (q')
     */
    public Transition(S source, L label, S target) {
        this.source = Objects.requireNonNull(source, "Source state cannot be null.");
        this.label = Objects.requireNonNull(label, "Label cannot be null.");
        this.target = Objects.requireNonNull(target, "Target state cannot be null.");
        this.hashCode = Objects.hash(source, label, target);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Transition<?, ?> that = (Transition<?, ?>) o;
        return source.equals(that.source) &&
                label.equals(that.label) &&
                target.equals(that.target);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return String.format("%s --[%s]--> %s", source, label, target);
    }
}
