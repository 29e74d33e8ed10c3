package org.bugfinder.filesystem.dto;

import java.util.List;

/**
 * 一次完整的多行图案匹配。
 *
 * @param matchNumber 匹配序号（1-based，按提交顺序）
 * @param line        第一个片段所在行（1-based）
 * @param column      所有片段共同的起始列（1-based）
 * @param fragments   每个片段的命中位置（按图案行顺序）
 */
public record PatternMatch(
        int matchNumber,
        int line,
        int column,
        List<FragmentLocation> fragments
) {
}
