/**
 * SecurityService.java
 *
 * 按名称保存 AI 提供方 API 密钥等凭据的内存存储。
 * 密钥以 char[] 保存，关闭或清除时逐个覆写为 0；不做落盘或加密。
 */
package club.ppmc.aidbg.service;

import club.ppmc.aidbg.model.ErrorKind;
import club.ppmc.aidbg.model.Result;
import java.util.Arrays;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class SecurityService implements AutoCloseable {

    static final int MAX_KEY_NAME_LENGTH = 256;
    static final int MAX_CREDENTIAL_LENGTH = 4096;

    private static final Pattern KEY_NAME = Pattern.compile("[A-Za-z0-9_-]+");
    private static final Pattern[] API_KEY_PATTERNS = {
        Pattern.compile("sk-[A-Za-z0-9_-]{20,}"),
        Pattern.compile("AIza[A-Za-z0-9_-]{35}"),
        Pattern.compile("[A-Za-z0-9]{32,128}")
    };

    private final Map<String, char[]> credentials = new ConcurrentHashMap<>();
    private volatile boolean closed;

    public Result<Void> storeCredential(String key, String value) {
        if (closed) {
            return Result.error(ErrorKind.RESOURCE, "安全服务已关闭");
        }
        Result<Void> keyCheck = validateKeyName(key);
        if (keyCheck.isError()) {
            return keyCheck;
        }
        if (value == null || value.isEmpty()) {
            return Result.error(ErrorKind.VALIDATION, "凭据值不能为空");
        }
        if (value.length() > MAX_CREDENTIAL_LENGTH) {
            return Result.error(ErrorKind.VALIDATION, "凭据值过长 (上限 " + MAX_CREDENTIAL_LENGTH + " 字符)");
        }
        char[] previous = credentials.put(key, value.toCharArray());
        if (previous != null) {
            Arrays.fill(previous, '\0');
        }
        log.info("已保存凭据: {}", key);
        return Result.ok();
    }

    public Result<String> retrieveCredential(String key) {
        if (closed) {
            return Result.error(ErrorKind.RESOURCE, "安全服务已关闭");
        }
        Result<Void> keyCheck = validateKeyName(key);
        if (keyCheck.isError()) {
            return keyCheck.propagate();
        }
        char[] secret = credentials.get(key);
        if (secret == null) {
            return Result.error(ErrorKind.CONFIGURATION, "未找到凭据: " + key);
        }
        return Result.success(new String(secret));
    }

    public boolean hasCredential(String key) {
        return key != null && credentials.containsKey(key);
    }

    /**
     * 粗略检查 API 密钥的形态：已知厂商前缀，或足够长的字母数字串。
     */
    public boolean validateApiKey(String apiKey) {
        if (apiKey == null || apiKey.length() < 10) {
            return false;
        }
        for (Pattern pattern : API_KEY_PATTERNS) {
            if (pattern.matcher(apiKey).matches()) {
                return true;
            }
        }
        return apiKey.length() >= 20 && apiKey.length() <= 200;
    }

    public void clearCredentials() {
        credentials.values().forEach(secret -> Arrays.fill(secret, '\0'));
        credentials.clear();
        log.info("所有凭据已清除");
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        clearCredentials();
    }

    private static Result<Void> validateKeyName(String key) {
        if (key == null || key.isEmpty()) {
            return Result.error(ErrorKind.VALIDATION, "凭据名不能为空");
        }
        if (key.length() > MAX_KEY_NAME_LENGTH) {
            return Result.error(ErrorKind.VALIDATION, "凭据名过长 (上限 " + MAX_KEY_NAME_LENGTH + " 字符)");
        }
        if (!KEY_NAME.matcher(key).matches()) {
            return Result.error(ErrorKind.VALIDATION, "凭据名只能包含字母、数字、下划线和短横线: " + key);
        }
        return Result.ok();
    }
}
