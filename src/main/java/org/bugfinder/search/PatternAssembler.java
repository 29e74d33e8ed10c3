package org.bugfinder.search;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 跨行拼装：把各片段的行内命中串成完整的图案匹配。
 * <p>
 * 规则（顺序固定为图案的行顺序）：
 * <ol>
 *   <li>只以第一个片段的命中作为起点，按发现顺序（先行后列）逐个尝试；已被占用的起点跳过。</li>
 *   <li>从链尾出发，在下一个片段的命中中找“下一行、同一列”且未被占用的命中；找到第一个就接受并继续，
 *       链条中途断开则直接放弃该起点（不再回头尝试其他分支）。</li>
 *   <li>链条长度等于片段数即为一次完整匹配；立刻把所有命中的 footprint 写入 {@link ExclusionSet}，
 *       再评估下一个起点。</li>
 * </ol>
 * <p>
 * 同一片段在同一 (行, 列) 上最多只有一个命中，所以“下一个片段的候选”用位置索引直接定位，
 * 与按发现顺序线性扫描得到的第一个候选相同。
 * <p>
 * 注意：这是贪心的、非穷举的策略，结果是确定的，但不保证得到“互不重叠匹配数”的最大值：
 * 较早提交的匹配可能占用了本可以组成更多匹配的字符。
 */
public class PatternAssembler {

    private final List<List<Occurrence>> occurrencesByFragment;
    private final List<Map<Long, Occurrence>> positionIndex;
    private final ExclusionSet exclusions;

    public PatternAssembler(List<List<Occurrence>> occurrencesByFragment, ExclusionSet exclusions) {
        Objects.requireNonNull(occurrencesByFragment, "occurrencesByFragment");
        if (occurrencesByFragment.isEmpty()) {
            throw new IllegalArgumentException("至少需要一个片段才能拼装匹配");
        }
        this.occurrencesByFragment = occurrencesByFragment;
        this.exclusions = Objects.requireNonNull(exclusions, "exclusions");
        this.positionIndex = indexByPosition(occurrencesByFragment);
    }

    /**
     * 依次尝试所有起点，返回本次拼装完成的匹配（按提交顺序）。
     */
    public List<MatchResult> assemble() {
        List<MatchResult> completed = new ArrayList<>();
        for (Occurrence seed : occurrencesByFragment.get(0)) {
            if (exclusions.isBlocked(seed)) {
                continue;
            }
            List<Occurrence> chain = extend(seed);
            if (chain == null) {
                continue;
            }
            MatchResult match = new MatchResult(chain);
            commit(match);
            completed.add(match);
        }
        return completed;
    }

    /**
     * 从起点开始逐个片段向下延伸；任一片段找不到可用的后继即返回 null。
     */
    List<Occurrence> extend(Occurrence seed) {
        int fragmentCount = occurrencesByFragment.size();
        List<Occurrence> chain = new ArrayList<>(fragmentCount);
        chain.add(seed);
        Occurrence tail = seed;
        for (int next = 1; next < fragmentCount; next++) {
            Occurrence candidate = positionIndex.get(next).get(key(tail.line() + 1, tail.column()));
            if (candidate == null || exclusions.isBlocked(candidate)) {
                return null;
            }
            chain.add(candidate);
            tail = candidate;
        }
        return chain;
    }

    private void commit(MatchResult match) {
        for (Occurrence occurrence : match.occurrences()) {
            exclusions.mark(occurrence);
        }
    }

    private static List<Map<Long, Occurrence>> indexByPosition(List<List<Occurrence>> occurrencesByFragment) {
        List<Map<Long, Occurrence>> index = new ArrayList<>(occurrencesByFragment.size());
        for (List<Occurrence> occurrences : occurrencesByFragment) {
            Map<Long, Occurrence> byPosition = new HashMap<>();
            for (Occurrence occurrence : occurrences) {
                // 发现顺序中的第一个命中优先
                byPosition.putIfAbsent(key(occurrence.line(), occurrence.column()), occurrence);
            }
            index.add(byPosition);
        }
        return index;
    }

    private static long key(int line, int column) {
        return ((long) line << 32) | (column & 0xFFFFFFFFL);
    }
}
