/**
 * DumpAnalyzer.java
 *
 * 对 MemoryDump 做离线静态分析：字节特征搜索、ASCII/UTF-16LE 字符串提取、
 * PE/ELF 头部识别以及熵等通用元数据。分析只读取快照的副本，不访问调试器。
 *
 * 每个特征有一个置信度阈值。置信度按特征本身估算：基础 0.8，长度超过 8 字节加 0.1，
 * 超过一半字节是 0x00/0xFF/0x90 这类填充值时减 0.2。
 */
package club.ppmc.aidbg.service;

import club.ppmc.aidbg.model.ErrorKind;
import club.ppmc.aidbg.model.Result;
import club.ppmc.aidbg.model.analysis.DumpAnalysisResult;
import club.ppmc.aidbg.model.analysis.PatternMatch;
import club.ppmc.aidbg.model.analysis.StringMatch;
import club.ppmc.aidbg.model.debug.MemoryDump;
import club.ppmc.aidbg.util.AddressFormat;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class DumpAnalyzer implements AutoCloseable {

    public static final int MIN_STRING_LENGTH = 4;

    static final double BUILTIN_THRESHOLD = 0.5;
    static final double CUSTOM_THRESHOLD = 0.7;

    private static final List<String> MALWARE_MARKERS = List.of("malware", "virus", "trojan");

    private record BytePattern(String name, byte[] bytes, String description, double threshold) {}

    private final List<BytePattern> patterns = new CopyOnWriteArrayList<>();

    public DumpAnalyzer() {
        loadBuiltinPatterns();
        log.info("内存分析器已初始化，内置特征 {} 个", patterns.size());
    }

    // ========================================================================
    // 特征
    // ========================================================================

    /**
     * 以 "名称 at 地址 (confidence: 0.80)" 的形式列出命中的特征。
     */
    public Result<List<String>> analyzePatterns(MemoryDump dump) {
        return searchPatterns(dump)
                .map(matches -> matches.stream()
                        .map(m -> String.format(
                                Locale.ROOT,
                                "%s at %s (confidence: %.2f)",
                                m.patternName(),
                                AddressFormat.format(m.address()),
                                m.confidence()))
                        .toList());
    }

    public Result<List<PatternMatch>> searchPatterns(MemoryDump dump) {
        if (dump == null) {
            return Result.error(ErrorKind.VALIDATION, "内存快照不能为空");
        }
        byte[] data = dump.data();
        var matches = new ArrayList<PatternMatch>();
        for (BytePattern pattern : patterns) {
            double confidence = confidenceOf(pattern.bytes());
            if (confidence < pattern.threshold()) {
                continue;
            }
            int length = pattern.bytes().length;
            for (int i = 0; i + length <= data.length; i++) {
                if (matchesAt(data, i, pattern.bytes())) {
                    matches.add(new PatternMatch(
                            dump.baseAddress() + i, length, pattern.name(), pattern.description(), confidence));
                    // 同一特征不重叠计数
                    i += length - 1;
                }
            }
        }
        return Result.success(matches);
    }

    public Result<List<PatternMatch>> findMalwareSignatures(MemoryDump dump) {
        return searchPatterns(dump)
                .map(matches -> matches.stream()
                        .filter(m -> {
                            String name = m.patternName().toLowerCase(Locale.ROOT);
                            return MALWARE_MARKERS.stream().anyMatch(name::contains);
                        })
                        .toList());
    }

    /**
     * 添加一个自定义特征。自定义特征使用更高的置信度阈值，主要由填充字节组成的特征不会命中。
     */
    public Result<Void> addCustomPattern(String name, byte[] bytes, String description) {
        if (name == null || name.isBlank()) {
            return Result.error(ErrorKind.VALIDATION, "特征名称不能为空");
        }
        if (bytes == null || bytes.length == 0) {
            return Result.error(ErrorKind.VALIDATION, "特征字节不能为空");
        }
        patterns.add(new BytePattern(name, bytes.clone(), description != null ? description : "", CUSTOM_THRESHOLD));
        log.debug("已添加自定义特征: {} ({} 字节)", name, bytes.length);
        return Result.ok();
    }

    public int getPatternCount() {
        return patterns.size();
    }

    // ========================================================================
    // 字符串
    // ========================================================================

    public Result<List<String>> findStrings(MemoryDump dump) {
        return extractStrings(dump, true).map(strings -> strings.stream().map(StringMatch::value).toList());
    }

    /**
     * 提取长度不少于 4 个字符的可打印字符串，结果按地址排序。
     *
     * @param includeWide 是否同时提取 UTF-16LE 字符串。
     */
    public Result<List<StringMatch>> extractStrings(MemoryDump dump, boolean includeWide) {
        if (dump == null) {
            return Result.error(ErrorKind.VALIDATION, "内存快照不能为空");
        }
        byte[] data = dump.data();
        var strings = new ArrayList<StringMatch>(findAsciiStrings(data, dump.baseAddress()));
        if (includeWide) {
            strings.addAll(findWideStrings(data, dump.baseAddress()));
        }
        strings.sort(Comparator.comparing(StringMatch::address, Long::compareUnsigned));
        return Result.success(strings);
    }

    private List<StringMatch> findAsciiStrings(byte[] data, long baseAddress) {
        var found = new ArrayList<StringMatch>();
        var current = new StringBuilder();
        int start = 0;
        for (int i = 0; i <= data.length; i++) {
            if (i < data.length && isPrintable(data[i] & 0xFF)) {
                if (current.length() == 0) {
                    start = i;
                }
                current.append((char) (data[i] & 0xFF));
                continue;
            }
            if (current.length() >= MIN_STRING_LENGTH) {
                found.add(new StringMatch(baseAddress + start, current.toString(), "ascii", current.length(), false));
            }
            current.setLength(0);
        }
        return found;
    }

    /** UTF-16LE 字符串可能从奇数偏移开始，因此按两种对齐各扫描一遍。 */
    private List<StringMatch> findWideStrings(byte[] data, long baseAddress) {
        var found = new ArrayList<StringMatch>();
        scanWideStrings(data, baseAddress, 0, found);
        scanWideStrings(data, baseAddress, 1, found);
        return found;
    }

    private void scanWideStrings(byte[] data, long baseAddress, int firstOffset, List<StringMatch> found) {
        var current = new StringBuilder();
        int start = firstOffset;
        for (int i = firstOffset; i <= data.length; i += 2) {
            boolean printable = i + 1 < data.length && data[i + 1] == 0 && isPrintable(data[i] & 0xFF);
            if (printable) {
                if (current.length() == 0) {
                    start = i;
                }
                current.append((char) (data[i] & 0xFF));
                continue;
            }
            if (current.length() >= MIN_STRING_LENGTH) {
                found.add(new StringMatch(baseAddress + start, current.toString(), "utf-16le", current.length(), true));
            }
            current.setLength(0);
        }
    }

    // ========================================================================
    // 元数据
    // ========================================================================

    public Result<Map<String, String>> extractMetadata(MemoryDump dump) {
        if (dump == null) {
            return Result.error(ErrorKind.VALIDATION, "内存快照不能为空");
        }
        byte[] data = dump.data();
        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put("size", Integer.toString(data.length));
        metadata.put("base_address", AddressFormat.format(dump.baseAddress()));
        metadata.put("module", dump.moduleName());

        if (data.length >= 2 && data[0] == 'M' && data[1] == 'Z') {
            metadata.put("format", "PE");
            putPeMetadata(data, metadata);
        } else if (data.length >= 4 && data[0] == 0x7F && data[1] == 'E' && data[2] == 'L' && data[3] == 'F') {
            metadata.put("format", "ELF");
            putElfMetadata(data, metadata);
        } else {
            metadata.put("format", "Unknown");
        }

        putGenericMetadata(data, metadata);
        return Result.success(metadata);
    }

    private static void putPeMetadata(byte[] data, Map<String, String> metadata) {
        if (data.length < 0x40) {
            return;
        }
        int peOffset = readIntLe(data, 0x3C);
        if (peOffset <= 0 || peOffset > data.length - 24) {
            metadata.put("pe_signature_valid", "false");
            return;
        }
        boolean valid = data[peOffset] == 'P' && data[peOffset + 1] == 'E' && data[peOffset + 2] == 0 && data[peOffset + 3] == 0;
        metadata.put("pe_signature_valid", Boolean.toString(valid));
        if (!valid) {
            return;
        }
        int machine = readShortLe(data, peOffset + 4);
        metadata.put("pe_machine", switch (machine) {
            case 0x8664 -> "x64";
            case 0x014C -> "x86";
            case 0xAA64 -> "arm64";
            default -> String.format("0x%04x", machine);
        });
        metadata.put("pe_sections", Integer.toString(readShortLe(data, peOffset + 6)));
    }

    private static void putElfMetadata(byte[] data, Map<String, String> metadata) {
        if (data.length < 20) {
            return;
        }
        metadata.put("elf_class", data[4] == 2 ? "64-bit" : data[4] == 1 ? "32-bit" : "unknown");
        metadata.put("elf_endianness", data[5] == 1 ? "little" : data[5] == 2 ? "big" : "unknown");
        if (data[5] == 1) {
            int machine = readShortLe(data, 18);
            metadata.put("elf_machine", switch (machine) {
                case 0x3E -> "x86-64";
                case 0x03 -> "x86";
                case 0xB7 -> "aarch64";
                default -> String.format("0x%04x", machine);
            });
        }
    }

    private static void putGenericMetadata(byte[] data, Map<String, String> metadata) {
        if (data.length == 0) {
            return;
        }
        int[] counts = new int[256];
        for (byte b : data) {
            counts[b & 0xFF]++;
        }
        double entropy = 0;
        for (int count : counts) {
            if (count > 0) {
                double p = (double) count / data.length;
                entropy -= p * (Math.log(p) / Math.log(2));
            }
        }
        metadata.put("entropy", String.format(Locale.ROOT, "%.4f", entropy));
        metadata.put("null_byte_percentage", String.format(Locale.ROOT, "%.2f", counts[0] * 100.0 / data.length));
    }

    // ========================================================================
    // 完整分析
    // ========================================================================

    public Result<DumpAnalysisResult> performFullAnalysis(MemoryDump dump) {
        if (dump == null) {
            return Result.error(ErrorKind.VALIDATION, "内存快照不能为空");
        }
        List<PatternMatch> found = searchPatterns(dump).getValue();
        List<StringMatch> strings = extractStrings(dump, true).getValue();
        Map<String, String> metadata = extractMetadata(dump).getValue();
        log.info(
                "完成对 {} 的分析: {} 个特征, {} 个字符串",
                AddressFormat.format(dump.baseAddress()),
                found.size(),
                strings.size());
        return Result.success(new DumpAnalysisResult(List.copyOf(found), List.copyOf(strings), metadata, Instant.now()));
    }

    @Override
    public void close() {
        log.debug("内存分析器已关闭");
    }

    // ========================================================================
    // 内部
    // ========================================================================

    private void loadBuiltinPatterns() {
        builtin("malware_CreateRemoteThread", "Potential process injection", 0xFF, 0x15, 0x00, 0x00, 0x00, 0x00);
        builtin("malware_WriteProcessMemory", "Potential memory modification", 0x6A, 0x04, 0x68, 0x00, 0x10, 0x00, 0x00);
        builtin("pe_mz_header", "PE executable header", 'M', 'Z', 0x90, 0x00);
        builtin("elf_header", "ELF executable header", 0x7F, 'E', 'L', 'F');
        builtin("x64_prologue_rbp", "push rbp; mov rbp, rsp", 0x55, 0x48, 0x89, 0xE5);
        builtin("x64_prologue_frame", "mov [rsp+8], rbx; push rdi", 0x48, 0x89, 0x5C, 0x24, 0x08, 0x57);
        builtin("nop_sled", "NOP sled (potential shellcode)", 0x90, 0x90, 0x90, 0x90, 0x90, 0x90, 0x90, 0x90);
        builtin("int3_padding", "INT3 alignment padding", 0xCC, 0xCC, 0xCC, 0xCC);
        builtin("call_pop", "CALL/POP technique", 0xE8, 0x00, 0x00, 0x00, 0x00, 0x58);
    }

    private void builtin(String name, String description, int... values) {
        byte[] bytes = new byte[values.length];
        for (int i = 0; i < values.length; i++) {
            bytes[i] = (byte) values[i];
        }
        patterns.add(new BytePattern(name, bytes, description, BUILTIN_THRESHOLD));
    }

    static double confidenceOf(byte[] pattern) {
        double confidence = 0.8;
        if (pattern.length > 8) {
            confidence += 0.1;
        }
        int filler = 0;
        for (byte b : pattern) {
            int v = b & 0xFF;
            if (v == 0x00 || v == 0xFF || v == 0x90) {
                filler++;
            }
        }
        if (filler > pattern.length / 2) {
            confidence -= 0.2;
        }
        return Math.max(0.0, Math.min(1.0, confidence));
    }

    private static boolean matchesAt(byte[] data, int offset, byte[] pattern) {
        for (int j = 0; j < pattern.length; j++) {
            if (data[offset + j] != pattern[j]) {
                return false;
            }
        }
        return true;
    }

    private static boolean isPrintable(int c) {
        return (c >= 0x20 && c <= 0x7E) || c == '\t';
    }

    private static int readShortLe(byte[] data, int offset) {
        return (data[offset] & 0xFF) | (data[offset + 1] & 0xFF) << 8;
    }

    private static int readIntLe(byte[] data, int offset) {
        return (data[offset] & 0xFF)
                | (data[offset + 1] & 0xFF) << 8
                | (data[offset + 2] & 0xFF) << 16
                | (data[offset + 3] & 0xFF) << 24;
    }
}
