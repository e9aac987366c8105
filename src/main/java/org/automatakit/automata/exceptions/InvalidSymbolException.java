package org.automatakit.automata.exceptions;

/**
 * 输入符号不合法：显式自动机中不属于字母表的符号，或符号自动机中不是"命题 -> 布尔值"映射的赋值。
 */
public class InvalidSymbolException extends AutomatonException {

    private static final long serialVersionUID = 1L;

    public InvalidSymbolException(String message) {
        super(message);
    }
}
