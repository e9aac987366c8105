package org.automatakit.automata.exceptions;

/**
 * 自动机相关错误的根类型。
 * 所有子类均为非受检异常，在数据被引入的边界（构造或修改时）同步抛出。
 * @author Ayalyt
 */
public class AutomatonException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public AutomatonException(String message) {
        super(message);
    }

    public AutomatonException(String message, Throwable cause) {
        super(message, cause);
    }
}
