/**
 * ExpressionEvaluator.java
 *
 * 命令脚本求值器的接口。编排器只负责它的生命周期，具体的语言由实现决定。
 */
package club.ppmc.aidbg.service;

import club.ppmc.aidbg.model.Result;
import java.util.Map;

public interface ExpressionEvaluator extends AutoCloseable {

    /**
     * 对表达式求值。
     *
     * @param expression 表达式文本。
     * @param variables 仅对本次求值有效的变量，优先于全局变量。
     */
    Result<String> evaluate(String expression, Map<String, String> variables);

    default Result<String> evaluate(String expression) {
        return evaluate(expression, Map.of());
    }

    void setVariable(String name, String value);

    Result<String> getVariable(String name);

    @Override
    void close();
}
