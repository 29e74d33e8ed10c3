package org.bugfinder.filesystem.dto;

import java.util.List;

/**
 * {@code finder_search_files} / {@code finder_search_text} 的返回结果。
 * <p>
 * 注意：{@code matchCount} 始终是完整的匹配总数；{@code matches} 只返回前 {@code maxMatches} 条明细，
 * 超出部分通过 {@code truncated=true} 提示。
 *
 * @param rootId             根目录标识
 * @param pattern            图案来源（文件相对路径，或 "inline"）
 * @param landscape          被搜索文件（相对 root 的路径，统一使用 / 分隔）
 * @param fragments          图案片段（已应用 trimCommonIndent）
 * @param landscapeLines     被搜索文件的行数
 * @param occurrenceCounts   每个片段的行内命中数（含重叠，按图案行顺序）
 * @param matchCount         完整匹配总数
 * @param consumedCharacters 被匹配占用的字符数
 * @param maxMatches         本次实际使用的最大返回明细数（已应用上限保护）
 * @param truncated          明细是否因达到上限而被截断
 * @param matches            匹配明细
 * @param warnings           非致命告警
 */
public record PatternSearchResult(
        String rootId,
        String pattern,
        String landscape,
        List<String> fragments,
        int landscapeLines,
        List<Integer> occurrenceCounts,
        int matchCount,
        int consumedCharacters,
        int maxMatches,
        boolean truncated,
        List<PatternMatch> matches,
        List<String> warnings
) {
}
