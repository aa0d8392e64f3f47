/**
 * ConfigService.java
 *
 * 运行期配置中心，持有当前的 AppSettings。
 * 初始值由 DefaultSubsystemFactory 从 application.properties 构造后传入；
 * 单个配置项可以按 JSON Pointer（例如 "/connectionTimeoutMs"）读取和修改，
 * 修改通过 Jackson 树模型完成，类型不匹配或未知字段会被拒绝且不影响当前配置。
 */
package club.ppmc.aidbg.service;

import club.ppmc.aidbg.model.AppSettings;
import club.ppmc.aidbg.model.ErrorKind;
import club.ppmc.aidbg.model.Result;
import com.fasterxml.jackson.core.JsonPointer;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.HashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class ConfigService implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(ConfigService.class);

    private final ObjectMapper objectMapper = new ObjectMapper();
    private AppSettings currentSettings;

    public ConfigService(AppSettings initialSettings) {
        this.currentSettings = initialSettings != null ? copy(initialSettings) : new AppSettings();
        LOGGER.info("配置服务已初始化，连接模式: {}", currentSettings.getConnectionMode());
    }

    /** 返回当前配置的副本，修改它不会影响本服务。 */
    public synchronized AppSettings getSettings() {
        return copy(currentSettings);
    }

    public synchronized void updateSettings(AppSettings newSettings) {
        this.currentSettings = copy(newSettings);
        LOGGER.info("配置已整体更新");
    }

    /**
     * 按 JSON Pointer 读取一个配置项。
     */
    public synchronized Result<JsonNode> getValue(String pointer) {
        Result<JsonPointer> compiled = compile(pointer);
        if (compiled.isError()) {
            return compiled.propagate();
        }
        JsonNode node = objectMapper.valueToTree(currentSettings).at(compiled.getValue());
        if (node.isMissingNode()) {
            return Result.error(ErrorKind.CONFIGURATION, "配置项不存在: " + pointer);
        }
        return Result.success(node.deepCopy());
    }

    public String getString(String pointer, String defaultValue) {
        Result<JsonNode> node = getValue(pointer);
        return node.isSuccess() && !node.getValue().isNull() ? node.getValue().asText() : defaultValue;
    }

    public int getInt(String pointer, int defaultValue) {
        Result<JsonNode> node = getValue(pointer);
        return node.isSuccess() && node.getValue().canConvertToInt() ? node.getValue().asInt() : defaultValue;
    }

    /**
     * 按 JSON Pointer 修改一个配置项。
     *
     * @param pointer 目标路径，父节点必须已存在。
     * @param value 新值，任何 Jackson 能序列化的对象。
     */
    public synchronized Result<Void> setValue(String pointer, Object value) {
        Result<JsonPointer> compiled = compile(pointer);
        if (compiled.isError()) {
            return compiled.propagate();
        }
        JsonPointer path = compiled.getValue();
        if (path.matches()) {
            return Result.error(ErrorKind.VALIDATION, "不能替换整个配置对象，请使用 updateSettings");
        }

        ObjectNode root = objectMapper.valueToTree(currentSettings);
        JsonNode parent = root.at(path.head());
        if (!(parent instanceof ObjectNode parentObject)) {
            return Result.error(ErrorKind.CONFIGURATION, "配置路径的父节点不存在或不是对象: " + pointer);
        }
        parentObject.set(path.last().getMatchingProperty(), objectMapper.valueToTree(value));

        try {
            this.currentSettings = objectMapper.treeToValue(root, AppSettings.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            LOGGER.warn("拒绝配置修改 {}: {}", pointer, e.getMessage());
            return Result.error(ErrorKind.VALIDATION, "配置项 " + pointer + " 的值无效");
        }
        LOGGER.info("配置项 {} 已更新", pointer);
        return Result.ok();
    }

    /**
     * 取出并清除配置中的 API 密钥，由调用方转存到 SecurityService。
     */
    public synchronized Map<String, String> drainProviderApiKeys() {
        Map<String, String> configured = currentSettings.getProviderApiKeys();
        if (configured == null) {
            return new HashMap<>();
        }
        Map<String, String> keys = new HashMap<>(configured);
        configured.clear();
        return keys;
    }

    @Override
    public void close() {
        LOGGER.debug("配置服务已关闭");
    }

    private AppSettings copy(AppSettings settings) {
        return objectMapper.convertValue(settings, AppSettings.class);
    }

    private static Result<JsonPointer> compile(String pointer) {
        if (pointer == null) {
            return Result.error(ErrorKind.VALIDATION, "配置路径不能为空");
        }
        try {
            return Result.success(JsonPointer.compile(pointer));
        } catch (IllegalArgumentException e) {
            return Result.error(ErrorKind.VALIDATION, "配置路径格式无效: " + pointer);
        }
    }
}
