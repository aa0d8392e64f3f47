/**
 * ApiExceptionHandler.java
 *
 * 全局异常处理器，把 DebuggerOperationException 和请求体校验失败转换为结构化的错误响应。
 * ErrorKind 到 HTTP 状态码的映射：VALIDATION -> 400，CONFIGURATION/NOT_CONNECTED -> 409，
 * CONNECTION/PROTOCOL -> 502，RESOURCE -> 503。
 */
package club.ppmc.aidbg.controller;

import club.ppmc.aidbg.exception.DebuggerOperationException;
import club.ppmc.aidbg.model.ErrorKind;
import java.util.Map;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(DebuggerOperationException.class)
    public ResponseEntity<Map<String, Object>> handleDebuggerOperation(DebuggerOperationException e) {
        HttpStatus status = statusOf(e.getErrorKind());
        if (status.is5xxServerError()) {
            log.warn("调试操作失败 [{}]: {}", e.getErrorKind(), e.getMessage());
        }
        return ResponseEntity.status(status).body(e.toErrorData());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidBody(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getDefaultMessage())
                .collect(Collectors.joining("; "));
        return ResponseEntity.badRequest().body(Map.of("type", ErrorKind.VALIDATION.name(), "message", message));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadableBody(HttpMessageNotReadableException e) {
        return ResponseEntity.badRequest()
                .body(Map.of("type", ErrorKind.VALIDATION.name(), "message", "请求体格式无效"));
    }

    static HttpStatus statusOf(ErrorKind kind) {
        return switch (kind) {
            case VALIDATION -> HttpStatus.BAD_REQUEST;
            case CONFIGURATION, NOT_CONNECTED -> HttpStatus.CONFLICT;
            case CONNECTION, PROTOCOL -> HttpStatus.BAD_GATEWAY;
            case RESOURCE -> HttpStatus.SERVICE_UNAVAILABLE;
        };
    }
}
