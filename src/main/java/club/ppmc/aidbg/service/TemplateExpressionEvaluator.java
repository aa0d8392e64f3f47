/**
 * TemplateExpressionEvaluator.java
 *
 * 最简单的表达式求值器：把文本中的 ${name} 替换为变量值。
 * 变量名只允许字母、数字和下划线；引用未定义的变量会返回 VALIDATION 错误，不做部分替换。
 * 典型用途是在命令脚本中复用地址，例如 "bp ${entry}"。
 */
package club.ppmc.aidbg.service;

import club.ppmc.aidbg.model.ErrorKind;
import club.ppmc.aidbg.model.Result;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class TemplateExpressionEvaluator implements ExpressionEvaluator {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\$\\{([A-Za-z_][A-Za-z0-9_]*)}");
    private static final Pattern VARIABLE_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final Map<String, String> globals = new ConcurrentHashMap<>();

    @Override
    public Result<String> evaluate(String expression, Map<String, String> variables) {
        if (expression == null) {
            return Result.error(ErrorKind.VALIDATION, "表达式不能为空");
        }
        Matcher matcher = PLACEHOLDER.matcher(expression);
        var out = new StringBuilder();
        while (matcher.find()) {
            String name = matcher.group(1);
            String value = variables != null && variables.containsKey(name) ? variables.get(name) : globals.get(name);
            if (value == null) {
                return Result.error(ErrorKind.VALIDATION, "未定义的变量: " + name);
            }
            matcher.appendReplacement(out, Matcher.quoteReplacement(value));
        }
        matcher.appendTail(out);
        return Result.success(out.toString());
    }

    @Override
    public void setVariable(String name, String value) {
        if (name == null || !VARIABLE_NAME.matcher(name).matches()) {
            throw new IllegalArgumentException("变量名无效: " + name);
        }
        if (value == null) {
            globals.remove(name);
        } else {
            globals.put(name, value);
        }
    }

    @Override
    public Result<String> getVariable(String name) {
        String value = name == null ? null : globals.get(name);
        return value != null ? Result.success(value) : Result.error(ErrorKind.VALIDATION, "未定义的变量: " + name);
    }

    @Override
    public void close() {
        globals.clear();
        log.debug("表达式求值器已关闭");
    }
}
