/**
 * CommandValidator.java
 *
 * 这是一个工具类，负责在命令发送到调试器之前进行严格校验。
 * 校验失败一律直接拒绝 (VALIDATION)，绝不会对命令做部分转义后再发送。
 * 同时提供内存访问范围的校验和响应文本的控制字符清理。
 */
package club.ppmc.aidbg.util;

import club.ppmc.aidbg.model.ErrorKind;
import club.ppmc.aidbg.model.Result;

public final class CommandValidator {

    public static final int MAX_COMMAND_LENGTH = 4096;
    public static final int MAX_MEMORY_SIZE = 1024 * 1024;

    /** 命令分隔、管道、替换、重定向、引号、换行和空字节。 */
    private static final String FORBIDDEN_CHARACTERS = ";|&`$()<>\"'\n\r\0";

    private CommandValidator() {}

    /**
     * 校验一条调试器命令。
     *
     * @param command 原始命令。
     * @return 校验通过时返回原命令本身。
     */
    public static Result<String> validateCommand(String command) {
        if (command == null || command.isEmpty()) {
            return Result.error(ErrorKind.VALIDATION, "命令不能为空");
        }
        if (command.length() > MAX_COMMAND_LENGTH) {
            return Result.error(
                    ErrorKind.VALIDATION,
                    String.format("命令过长 (%d 字符)，上限为 %d", command.length(), MAX_COMMAND_LENGTH));
        }
        for (int i = 0; i < command.length(); i++) {
            char c = command.charAt(i);
            if (FORBIDDEN_CHARACTERS.indexOf(c) >= 0) {
                return Result.error(
                        ErrorKind.VALIDATION, String.format("命令在位置 %d 含有不允许的字符 0x%02X", i, (int) c));
            }
            // 线路协议只承载可打印 ASCII
            if (c < 0x20 || c > 0x7E) {
                return Result.error(
                        ErrorKind.VALIDATION, String.format("命令在位置 %d 含有非可打印字符 0x%04X", i, (int) c));
            }
        }
        return Result.success(command);
    }

    /**
     * 校验一次内存访问。地址按 64 位无符号数处理。
     *
     * @param address 起始地址，不能为 0。
     * @param size 访问长度，必须在 (0, 1 MiB] 之间。
     */
    public static Result<Void> validateMemoryRange(long address, long size) {
        if (address == 0) {
            return Result.error(ErrorKind.VALIDATION, "内存地址不能为 0");
        }
        if (size <= 0) {
            return Result.error(ErrorKind.VALIDATION, "访问长度必须大于 0");
        }
        if (size > MAX_MEMORY_SIZE) {
            return Result.error(ErrorKind.VALIDATION, "访问长度过大 (上限 1 MiB): " + size);
        }
        long end = address + size;
        if (Long.compareUnsigned(end, address) < 0) {
            return Result.error(
                    ErrorKind.VALIDATION,
                    String.format("地址范围溢出: %s + 0x%x", AddressFormat.format(address), size));
        }
        return Result.ok();
    }

    /**
     * 删除响应中除制表符和换行符以外的控制字符。
     */
    public static String stripControlCharacters(String raw) {
        if (raw == null || raw.isEmpty()) {
            return "";
        }
        var cleaned = new StringBuilder(raw.length());
        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            if ((c < 0x20 && c != '\t' && c != '\n') || c == 0x7F) {
                continue;
            }
            cleaned.append(c);
        }
        return cleaned.toString();
    }
}
