package org.bugfinder.search;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 多行图案中的一行（片段）。
 * <p>
 * 约定：
 * <ul>
 *   <li>{@code text} 已去掉行尾换行符与行尾空白；行首空格保留，视为“通配字符”。</li>
 *   <li>片段内部的空格（{@code ' '}）匹配任意单个字符；其他字符按字面值、区分大小写匹配。</li>
 *   <li>{@code footprint} 是片段内“非空格”字符的偏移量（0-based，升序），即匹配成功后需要占用的字符位置。</li>
 * </ul>
 *
 * @param index     片段在图案中的位置（0-based）
 * @param text      片段文本
 * @param footprint 非通配字符的偏移量列表（不可变）
 */
public record Fragment(int index, String text, List<Integer> footprint) {

    public static final char WILDCARD = ' ';

    public Fragment {
        Objects.requireNonNull(text, "text");
        if (index < 0) {
            throw new IllegalArgumentException("片段序号不能为负数：" + index);
        }
        footprint = List.copyOf(footprint);
    }

    /**
     * 由一行图案文本构造片段（调用方需已去除行尾空白）。
     */
    public static Fragment of(int index, String text) {
        Objects.requireNonNull(text, "text");
        List<Integer> offsets = new ArrayList<>(text.length());
        for (int i = 0; i < text.length(); i++) {
            if (text.charAt(i) != WILDCARD) {
                offsets.add(i);
            }
        }
        return new Fragment(index, text, offsets);
    }

    public int length() {
        return text.length();
    }

    /**
     * 空片段（空行）在任何位置都不会匹配。
     */
    public boolean isBlank() {
        return footprint.isEmpty();
    }
}
