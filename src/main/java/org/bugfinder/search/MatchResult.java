package org.bugfinder.search;

import java.util.List;

/**
 * 一次完整的图案匹配：每个片段恰好一个命中，且第 i 个命中紧跟第 i-1 个命中（下一行、同一列）。
 *
 * @param occurrences 按片段顺序排列的命中（不可变）
 */
public record MatchResult(List<Occurrence> occurrences) {

    public MatchResult {
        occurrences = List.copyOf(occurrences);
        if (occurrences.isEmpty()) {
            throw new IllegalArgumentException("匹配结果至少包含一个命中");
        }
        for (int i = 0; i < occurrences.size(); i++) {
            Occurrence current = occurrences.get(i);
            if (current.fragmentIndex() != i) {
                throw new IllegalArgumentException("第 " + i + " 个命中不属于第 " + i + " 个片段：" + current);
            }
            if (i > 0 && !current.follows(occurrences.get(i - 1))) {
                throw new IllegalArgumentException("命中不连续：" + occurrences.get(i - 1) + " -> " + current);
            }
        }
    }

    /**
     * 第一个片段的命中行号（即整个匹配的起始行）。
     */
    public int line() {
        return occurrences.get(0).line();
    }

    /**
     * 所有片段共同的起始列号。
     */
    public int column() {
        return occurrences.get(0).column();
    }

    public int size() {
        return occurrences.size();
    }

    public Occurrence occurrence(int fragmentIndex) {
        return occurrences.get(fragmentIndex);
    }
}
