/**
 * HexCodec.java
 *
 * 调试器 dump/fill 命令所用十六进制字节流的编解码。
 * 解析是有界的：输入超过 2 MiB 直接拒绝（返回空数组并记录日志），
 * 输出最多 1 MiB，格式错误的两字符组被跳过而不是中止整个解析。
 */
package club.ppmc.aidbg.util;

import java.io.ByteArrayOutputStream;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public final class HexCodec {

    public static final int MAX_HEX_INPUT_LENGTH = 2 * 1024 * 1024;
    public static final int MAX_DECODED_BYTES = 1024 * 1024;

    private static final char[] HEX_DIGITS = "0123456789abcdef".toCharArray();

    private HexCodec() {}

    /**
     * 解析空白分隔或连续书写的十六进制字节流，例如 "48 89 E5" 或 "4889E5"。
     *
     * @param hex 调试器返回的文本。
     * @return 解析出的字节，最多 1 MiB。
     */
    public static byte[] parseHexBytes(String hex) {
        if (hex == null || hex.isEmpty()) {
            return new byte[0];
        }
        if (hex.length() > MAX_HEX_INPUT_LENGTH) {
            log.error("十六进制输入过大 ({} 字符)，上限 {}，已拒绝解析", hex.length(), MAX_HEX_INPUT_LENGTH);
            return new byte[0];
        }

        var out = new ByteArrayOutputStream(Math.min(hex.length() / 2 + 1, MAX_DECODED_BYTES));
        int skipped = 0;
        for (String token : hex.trim().split("\\s+")) {
            for (int i = 0; i + 1 < token.length(); i += 2) {
                if (out.size() >= MAX_DECODED_BYTES) {
                    log.warn("十六进制解析已达到 1 MiB 上限，停止解析");
                    return out.toByteArray();
                }
                int high = Character.digit(token.charAt(i), 16);
                int low = Character.digit(token.charAt(i + 1), 16);
                if (high < 0 || low < 0) {
                    skipped++;
                    continue;
                }
                out.write((high << 4) | low);
            }
        }
        if (skipped > 0) {
            log.debug("十六进制解析跳过了 {} 个格式错误的字节组", skipped);
        }
        return out.toByteArray();
    }

    /**
     * 编码为连续的小写十六进制字符串，用于 fill 命令。
     */
    public static String toHex(byte[] data) {
        var sb = new StringBuilder(data.length * 2);
        for (byte b : data) {
            sb.append(HEX_DIGITS[(b >> 4) & 0xF]).append(HEX_DIGITS[b & 0xF]);
        }
        return sb.toString();
    }
}
