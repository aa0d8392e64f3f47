/**
 * AddressFormat.java
 *
 * 地址与十六进制字符串之间的转换工具。
 * 地址在 Java 中以 long 表示，按 64 位无符号数格式化和解析。
 */
package club.ppmc.aidbg.util;

import club.ppmc.aidbg.model.ErrorKind;
import club.ppmc.aidbg.model.Result;

public final class AddressFormat {

    /** "0x" 前缀加 16 位十六进制数字的最大长度。 */
    private static final int MAX_ADDRESS_TEXT_LENGTH = 18;

    private AddressFormat() {}

    /**
     * 格式化为调试器命令使用的形式，例如 0x140001000。
     */
    public static String format(long address) {
        return "0x" + Long.toHexString(address);
    }

    /**
     * 解析十六进制地址，接受可选的 0x/0X 前缀。
     */
    public static Result<Long> parse(String text) {
        if (text == null || text.isBlank()) {
            return Result.error(ErrorKind.VALIDATION, "地址字符串为空");
        }
        String trimmed = text.trim();
        if (trimmed.length() > MAX_ADDRESS_TEXT_LENGTH) {
            return Result.error(ErrorKind.VALIDATION, "地址字符串过长: " + trimmed);
        }
        String digits = trimmed.startsWith("0x") || trimmed.startsWith("0X") ? trimmed.substring(2) : trimmed;
        if (digits.isEmpty() || digits.length() > 16) {
            return Result.error(ErrorKind.VALIDATION, "地址格式无效: " + trimmed);
        }
        for (int i = 0; i < digits.length(); i++) {
            if (Character.digit(digits.charAt(i), 16) < 0) {
                return Result.error(ErrorKind.VALIDATION, "地址含有非十六进制字符: " + trimmed);
            }
        }
        return Result.success(Long.parseUnsignedLong(digits, 16));
    }
}
