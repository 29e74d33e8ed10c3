package org.bugfinder.filesystem.dto;

/**
 * 某个片段在被搜索文件中的一次命中位置。
 *
 * @param fragmentIndex    片段序号（0-based，对应图案的第几行）
 * @param line             行号（1-based）
 * @param column           起始列号（1-based）
 * @param excerpt          命中覆盖的原文（仅在 includeExcerpt=true 时返回；否则为 null）
 * @param excerptTruncated excerpt 是否因长度上限被截断（未返回 excerpt 时为 null）
 */
public record FragmentLocation(
        int fragmentIndex,
        int line,
        int column,
        String excerpt,
        Boolean excerptTruncated
) {
}
