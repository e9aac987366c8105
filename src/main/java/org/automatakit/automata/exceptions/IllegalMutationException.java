package org.automatakit.automata.exceptions;

/**
 * 不允许的修改操作，例如删除符号自动机的初始状态。
 */
public class IllegalMutationException extends AutomatonException {

    private static final long serialVersionUID = 1L;

    public IllegalMutationException(String message) {
        super(message);
    }
}
