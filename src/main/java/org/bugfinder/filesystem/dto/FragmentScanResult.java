package org.bugfinder.filesystem.dto;

import java.util.List;

/**
 * {@code finder_scan_fragments} 的返回结果：只执行逐行扫描，不做跨行拼装。
 * <p>
 * 用于排查“为什么没有匹配”：例如某个片段在整份文件中一次都没有命中。
 *
 * @param rootId         根目录标识
 * @param pattern        图案来源（文件相对路径，或 "inline"）
 * @param landscape      被搜索文件（相对 root 的路径）
 * @param landscapeLines 被搜索文件的行数
 * @param sampleSize     本次实际使用的每片段样本数（已应用上限保护）
 * @param fragments      每个片段的扫描统计
 * @param warnings       非致命告警
 */
public record FragmentScanResult(
        String rootId,
        String pattern,
        String landscape,
        int landscapeLines,
        int sampleSize,
        List<FragmentScanEntry> fragments,
        List<String> warnings
) {
}
