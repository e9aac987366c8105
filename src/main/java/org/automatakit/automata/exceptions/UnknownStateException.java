package org.automatakit.automata.exceptions;

import lombok.Getter;

/**
 * 操作了一个不属于该自动机的状态。
 */
@Getter
public class UnknownStateException extends AutomatonException {

    private static final long serialVersionUID = 1L;

    private final transient Object state;

    public UnknownStateException(Object state) {
        super("状态 " + state + " 不存在于自动机中。");
        this.state = state;
    }
}
