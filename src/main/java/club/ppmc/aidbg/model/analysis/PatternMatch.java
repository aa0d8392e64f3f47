/**
 * PatternMatch.java
 *
 * DumpAnalyzer 在内存快照中命中的一个字节特征。
 */
package club.ppmc.aidbg.model.analysis;

/**
 * @param address 命中位置的绝对地址。
 * @param size 特征长度。
 * @param patternName 特征名称，例如 "pe_header"。
 * @param description 特征描述。
 * @param confidence 置信度 (0.0 - 1.0)。
 */
public record PatternMatch(long address, int size, String patternName, String description, double confidence) {}
