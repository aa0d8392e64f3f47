/**
 * Result.java
 *
 * 一个显式的成功/失败结果类型，用于所有跨模块边界的操作返回值。
 * 调试桥、编排器和 LLM 引擎都不会把异常抛出模块边界，而是返回 Result；
 * 只有在 Web 层才通过 orElseThrow() 转换为 DebuggerOperationException。
 */
package club.ppmc.aidbg.model;

import club.ppmc.aidbg.exception.DebuggerOperationException;
import java.util.Objects;
import java.util.function.Function;

public final class Result<T> {

    private final T value;
    private final ErrorKind errorKind;
    private final String errorMessage;

    private Result(T value, ErrorKind errorKind, String errorMessage) {
        this.value = value;
        this.errorKind = errorKind;
        this.errorMessage = errorMessage;
    }

    public static <T> Result<T> success(T value) {
        return new Result<>(value, null, null);
    }

    /** 无返回值操作的成功结果。 */
    public static Result<Void> ok() {
        return new Result<>(null, null, null);
    }

    public static <T> Result<T> error(ErrorKind kind, String message) {
        return new Result<>(null, Objects.requireNonNull(kind, "kind"), message);
    }

    public boolean isSuccess() {
        return errorKind == null;
    }

    public boolean isError() {
        return errorKind != null;
    }

    /**
     * 获取成功值。
     *
     * @throws IllegalStateException 如果这是一个失败结果。
     */
    public T getValue() {
        if (isError()) {
            throw new IllegalStateException("在失败结果上访问值: " + errorMessage);
        }
        return value;
    }

    public T getValueOr(T defaultValue) {
        return isSuccess() ? value : defaultValue;
    }

    public ErrorKind getErrorKind() {
        if (isSuccess()) {
            throw new IllegalStateException("在成功结果上访问错误类型");
        }
        return errorKind;
    }

    public String getErrorMessage() {
        if (isSuccess()) {
            throw new IllegalStateException("在成功结果上访问错误信息");
        }
        return errorMessage;
    }

    public <U> Result<U> map(Function<? super T, ? extends U> mapper) {
        if (isError()) {
            return propagate();
        }
        return success(mapper.apply(value));
    }

    public <U> Result<U> flatMap(Function<? super T, Result<U>> mapper) {
        if (isError()) {
            return propagate();
        }
        return mapper.apply(value);
    }

    /** 把失败结果转换为另一种值类型，错误类型和信息保持不变。 */
    @SuppressWarnings("unchecked")
    public <U> Result<U> propagate() {
        if (isSuccess()) {
            throw new IllegalStateException("只有失败结果可以被传播");
        }
        return (Result<U>) this;
    }

    public T orElseThrow() {
        if (isError()) {
            throw new DebuggerOperationException(errorKind, errorMessage);
        }
        return value;
    }

    @Override
    public String toString() {
        return isSuccess() ? "Result[success=" + value + "]" : "Result[" + errorKind + ": " + errorMessage + "]";
    }
}
