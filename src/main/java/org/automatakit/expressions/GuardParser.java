package org.automatakit.expressions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * 文本守卫的递归下降解析器。优先级从低到高：
 * <pre>
 *   iff     := implies ("&lt;-&gt;" implies)*
 *   implies := or (("-&gt;" | "&gt;&gt;") implies)?        右结合
 *   or      := xor (("|" | "||") xor)*
 *   xor     := and ("^" and)*
 *   and     := unary (("&amp;" | "&amp;&amp;") unary)*
 *   unary   := ("~" | "!") unary | atom
 *   atom    := "true" | "True" | "false" | "False" | 命题名 | "(" iff ")"
 * </pre>
 * 命题名形如 [A-Za-z_][A-Za-z0-9_]*。
 * @author Ayalyt
 */
public final class GuardParser {

    private static final Logger logger = LoggerFactory.getLogger(GuardParser.class);

    private final String expression;
    private int position;

    private GuardParser(String expression) {
        this.expression = expression;
        this.position = 0;
    }

    /**
     * 解析文本守卫。
     * @param expression 布尔表达式文本。
     * @return 对应的守卫。
     * @throws GuardParseException 如果文本不是合法的表达式。
     */
    public static Guard parse(String expression) {
        Objects.requireNonNull(expression, "Expression cannot be null.");
        GuardParser parser = new GuardParser(expression);
        Guard result = parser.parseIff();
        parser.skipWhitespace();
        if (parser.position < expression.length()) {
            throw parser.error("无法识别的字符 '" + expression.charAt(parser.position) + "'");
        }
        logger.debug("解析守卫 \"{}\" 得到 {}", expression, result);
        return result;
    }

    private Guard parseIff() {
        Guard left = parseImplies();
        while (consume("<->")) {
            left = Guards.iff(left, parseImplies());
        }
        return left;
    }

    private Guard parseImplies() {
        Guard premise = parseOr();
        if (consume("->") || consume(">>")) {
            return Guards.implies(premise, parseImplies());
        }
        return premise;
    }

    private Guard parseOr() {
        Guard left = parseXor();
        while (consume("||") || consume("|")) {
            left = Guards.or(left, parseXor());
        }
        return left;
    }

    private Guard parseXor() {
        Guard left = parseAnd();
        while (consume("^")) {
            left = Guards.xor(left, parseAnd());
        }
        return left;
    }

    private Guard parseAnd() {
        Guard left = parseUnary();
        while (consume("&&") || consume("&")) {
            left = Guards.and(left, parseUnary());
        }
        return left;
    }

    private Guard parseUnary() {
        if (consume("~") || consume("!")) {
            return Guards.not(parseUnary());
        }
        return parseAtom();
    }

    private Guard parseAtom() {
        skipWhitespace();
        if (position >= expression.length()) {
            throw error("表达式意外结束");
        }
        if (consume("(")) {
            Guard inner = parseIff();
            if (!consume(")")) {
                throw error("缺少右括号");
            }
            return inner;
        }
        char c = expression.charAt(position);
        if (!isIdentifierStart(c)) {
            throw error("期望命题名或常量，但遇到 '" + c + "'");
        }
        int start = position;
        while (position < expression.length() && isIdentifierPart(expression.charAt(position))) {
            position++;
        }
        String identifier = expression.substring(start, position);
        switch (identifier) {
            case "true":
            case "True":
                return Guards.TRUE;
            case "false":
            case "False":
                return Guards.FALSE;
            default:
                return Guards.proposition(identifier);
        }
    }

    private boolean consume(String token) {
        skipWhitespace();
        if (expression.startsWith(token, position)) {
            position += token.length();
            return true;
        }
        return false;
    }

    private void skipWhitespace() {
        while (position < expression.length() && Character.isWhitespace(expression.charAt(position))) {
            position++;
        }
    }

    private static boolean isIdentifierStart(char c) {
        return c == '_' || (c < 128 && Character.isLetter(c));
    }

    private static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || (c >= '0' && c <= '9');
    }

    private GuardParseException error(String message) {
        logger.error("解析守卫 \"{}\" 失败：{}（位置 {}）", expression, message, position);
        return new GuardParseException(expression, position, message);
    }
}
