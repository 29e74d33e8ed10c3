package org.bugfinder.filesystem.dto;

import java.util.List;

/**
 * 单个片段的扫描统计。
 *
 * @param fragmentIndex   片段序号（0-based）
 * @param text            片段文本（空格为通配字符）
 * @param footprint       非通配字符的偏移量（0-based）
 * @param occurrenceCount 行内命中总数（含重叠）
 * @param sample          前若干条命中（按发现顺序：先行后列）
 * @param sampleTruncated sample 是否只包含部分命中
 */
public record FragmentScanEntry(
        int fragmentIndex,
        String text,
        List<Integer> footprint,
        int occurrenceCount,
        List<FragmentLocation> sample,
        boolean sampleTruncated
) {
}
