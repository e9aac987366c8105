package org.automatakit.automata.exceptions;

/**
 * 自动机的结构不合法：状态集为空、初始状态或接受状态不在状态集中、
 * 迁移引用了未声明的状态或符号、或使用了保留名称。
 */
public class StructuralViolationException extends AutomatonException {

    private static final long serialVersionUID = 1L;

    public StructuralViolationException(String message) {
        super(message);
    }
}
