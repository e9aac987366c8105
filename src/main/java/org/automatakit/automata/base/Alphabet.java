package org.automatakit.automata.base;

import lombok.Getter;
import org.automatakit.automata.exceptions.InvalidSymbolException;
import org.automatakit.automata.exceptions.StructuralViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 代表一个有限自动机的字母表。
 * Alphabet 是不可变对象：符号序列有序且无重复，符号与其下标之间一一对应。
 * 空字符串保留为 epsilon 标签，不能作为符号出现。
 * @author Ayalyt
 */
public final class Alphabet implements Iterable<String> {

    private static final Logger logger = LoggerFactory.getLogger(Alphabet.class);

    /** 保留的 epsilon 标签。 */
    public static final String EPSILON = "";

    @Getter
    private final List<String> symbols;
    private final Map<String, Integer> indexBySymbol;
    private final int hashCode;

    /**
     * 私有构造函数，通过有序的符号列表创建 Alphabet。
     * @param symbols 符号列表，顺序即下标顺序。
     */
    private Alphabet(List<String> symbols) {
        Objects.requireNonNull(symbols, "Symbols cannot be null");
        Map<String, Integer> tempIndex = new HashMap<>();
        for (int i = 0; i < symbols.size(); i++) {
            String symbol = Objects.requireNonNull(symbols.get(i), "Symbol cannot be null");
            if (EPSILON.equals(symbol)) {
                logger.error("字母表中出现了保留的 epsilon 符号。");
                throw new StructuralViolationException("空字符串是保留名称，不能作为符号。");
            }
            if (tempIndex.put(symbol, i) != null) {
                logger.error("字母表包含重复的符号 {}。", symbol);
                throw new StructuralViolationException("字母表包含重复的符号：" + symbol);
            }
        }
        this.symbols = Collections.unmodifiableList(new ArrayList<>(symbols));
        this.indexBySymbol = Collections.unmodifiableMap(tempIndex);
        this.hashCode = this.symbols.hashCode();
        logger.debug("创建 Alphabet，包含 {} 个符号。详情：{}", this.symbols.size(), this.symbols);
    }

    /**
     * 工厂方法：从一系列符号创建 Alphabet，下标按参数顺序分配。
     * @param symbols 符号。
     * @return Alphabet 实例。
     */
    public static Alphabet of(String... symbols) {
        return new Alphabet(Arrays.asList(symbols));
    }

    /**
     * 工厂方法：从一个符号集合创建 Alphabet，下标按集合的迭代顺序分配。
     * @param symbols 构成字母表的符号集合。
     * @return Alphabet 实例。
     */
    public static Alphabet of(Collection<String> symbols) {
        return new Alphabet(new ArrayList<>(symbols));
    }

    /**
     * 工厂方法：创建符号为 "0", "1", ..., "n-1" 的字母表。
     * @param n 符号数量。
     * @return Alphabet 实例。
     */
    public static Alphabet range(int n) {
        if (n < 0) {
            logger.error("字母表大小 {} 为负数。", n);
            throw new IllegalArgumentException("字母表大小不能为负数：" + n);
        }
        List<String> tempSymbols = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            tempSymbols.add(String.valueOf(i));
        }
        return new Alphabet(tempSymbols);
    }

    /**
     * 根据下标获取符号。
     * @param index 下标，必须位于 [0, size) 内。
     * @return 对应的符号。
     * @throws InvalidSymbolException 如果下标越界。
     */
    public String getSymbol(int index) {
        if (index < 0 || index >= symbols.size()) {
            logger.error("下标 {} 不在 [0, {}) 范围内。", index, symbols.size());
            throw new InvalidSymbolException("下标 " + index + " 没有对应的符号。");
        }
        return symbols.get(index);
    }

    /**
     * 获取符号的下标。
     * @param symbol 符号。
     * @return 下标。
     * @throws InvalidSymbolException 如果符号不属于字母表。
     */
    public int getSymbolIndex(String symbol) {
        Integer index = indexBySymbol.get(symbol);
        if (index == null) {
            logger.error("符号 {} 不属于字母表 {}。", symbol, this);
            throw new InvalidSymbolException("符号 " + symbol + " 不属于字母表。");
        }
        return index;
    }

    public boolean contains(String symbol) {
        return indexBySymbol.containsKey(symbol);
    }

    public boolean containsAll(Collection<String> others) {
        return indexBySymbol.keySet().containsAll(others);
    }

    public int size() {
        return symbols.size();
    }

    @Override
    public Iterator<String> iterator() {
        return symbols.iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Alphabet alphabet = (Alphabet) o;
        return symbols.equals(alphabet.symbols);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return "Alphabet{" + String.join(", ", symbols) + '}';
    }
}
