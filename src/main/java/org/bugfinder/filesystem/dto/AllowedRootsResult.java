package org.bugfinder.filesystem.dto;

import java.util.List;

/**
 * {@code finder_list_roots} 的返回结果。
 *
 * @param roots             根目录白名单
 * @param patternMaxBytes   图案文件最大字节数
 * @param patternMaxLines   图案最大行数
 * @param landscapeMaxBytes 被搜索文件最大字节数
 */
public record AllowedRootsResult(
        List<AllowedRoot> roots,
        long patternMaxBytes,
        int patternMaxLines,
        long landscapeMaxBytes
) {
}
