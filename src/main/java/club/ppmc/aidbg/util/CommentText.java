/**
 * CommentText.java
 *
 * 把 AI 返回的自由文本转换为可以安全放进 SetCommentAt 命令参数的形式。
 * 引号以及命令校验器拒绝的其他元字符被写成 \xNN 转义，换行写成 \n，
 * 非 ASCII 字符替换为 '?'，结果不超过 x64dbg 单条注释的长度上限。
 */
package club.ppmc.aidbg.util;

public final class CommentText {

    /** x64dbg 的 MAX_COMMENT_SIZE。 */
    public static final int MAX_COMMENT_LENGTH = 512;

    /** 命令校验器拒绝的字符，再加上参数分隔符 ',' 和转义符 '\'。 */
    private static final String ESCAPED_CHARACTERS = ";|&`$()<>\"',\\";

    private CommentText() {}

    public static String escape(String text) {
        if (text == null) {
            return "";
        }
        var out = new StringBuilder(Math.min(text.length(), MAX_COMMENT_LENGTH));
        String trimmed = text.strip();
        for (int i = 0; i < trimmed.length(); i++) {
            String piece = escapeChar(trimmed.charAt(i));
            if (out.length() + piece.length() > MAX_COMMENT_LENGTH) {
                break;
            }
            out.append(piece);
        }
        return out.toString();
    }

    private static String escapeChar(char c) {
        if (ESCAPED_CHARACTERS.indexOf(c) >= 0) {
            return String.format("\\x%02X", (int) c);
        }
        if (c == '\n') {
            return "\\n";
        }
        if (c == '\r' || c == '\0') {
            return "";
        }
        if (c < 0x20 || c == 0x7F) {
            return " ";
        }
        if (c > 0x7E) {
            return "?";
        }
        return String.valueOf(c);
    }
}
