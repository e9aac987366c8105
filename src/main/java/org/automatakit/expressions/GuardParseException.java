package org.automatakit.expressions;

import lombok.Getter;

/**
 * 文本守卫无法解析时抛出。
 */
@Getter
public class GuardParseException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    private final String expression;
    private final int position;

    public GuardParseException(String expression, int position, String message) {
        super(message + " (位置 " + position + "，表达式 \"" + expression + "\")");
        this.expression = expression;
        this.position = position;
    }
}
