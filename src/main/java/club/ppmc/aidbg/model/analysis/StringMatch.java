/**
 * StringMatch.java
 *
 * 从内存快照中提取出的一个可打印字符串。
 */
package club.ppmc.aidbg.model.analysis;

/**
 * @param address 字符串起始的绝对地址。
 * @param value 字符串内容。
 * @param encoding "ascii" 或 "utf-16le"。
 * @param length 字符数。
 * @param wide 是否为宽字符串。
 */
public record StringMatch(long address, String value, String encoding, int length, boolean wide) {}
