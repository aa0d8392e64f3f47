/**
 * DumpAnalysisResult.java
 *
 * 一次完整内存快照分析的汇总结果，由 DumpAnalyzer.performFullAnalysis 生成。
 */
package club.ppmc.aidbg.model.analysis;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * @param patterns 命中的字节特征。
 * @param strings 提取出的字符串，按地址排序。
 * @param metadata 格式、大小、熵等元数据。
 * @param timestamp 分析完成时间。
 */
public record DumpAnalysisResult(
        List<PatternMatch> patterns, List<StringMatch> strings, Map<String, String> metadata, Instant timestamp) {}
