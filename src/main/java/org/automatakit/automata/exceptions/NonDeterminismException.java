package org.automatakit.automata.exceptions;

/**
 * 向确定性符号自动机添加的守卫与同一源状态指向其他目标的守卫存在重叠。
 */
public class NonDeterminismException extends AutomatonException {

    private static final long serialVersionUID = 1L;

    public NonDeterminismException(String message) {
        super(message);
    }
}
