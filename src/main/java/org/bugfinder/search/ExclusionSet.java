package org.bugfinder.search;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 已被完整匹配占用的字符位置（行号 -> 列号集合）。
 * <p>
 * 只在一次完整匹配“提交”时写入，回溯拼装过程中不做任何试探性写入；没有删除操作，集合只增不减。
 * 重复标记同一位置是幂等的。
 */
public class ExclusionSet {

    private final Map<Integer, Set<Integer>> consumed = new HashMap<>();
    private int consumedCount;

    /**
     * 标记 {@code line} 行上 {@code column + offset}（offset 取自 footprint）为已占用。
     */
    public void mark(int line, int column, List<Integer> footprint) {
        if (footprint.isEmpty()) {
            return;
        }
        Set<Integer> columns = consumed.computeIfAbsent(line, k -> new HashSet<>());
        for (int offset : footprint) {
            if (columns.add(column + offset)) {
                consumedCount++;
            }
        }
    }

    public void mark(Occurrence occurrence) {
        mark(occurrence.line(), occurrence.column(), occurrence.fragment().footprint());
    }

    /**
     * footprint 平移后的任一位置已被占用即返回 true。
     */
    public boolean isBlocked(int line, int column, List<Integer> footprint) {
        Set<Integer> columns = consumed.get(line);
        if (columns == null) {
            return false;
        }
        for (int offset : footprint) {
            if (columns.contains(column + offset)) {
                return true;
            }
        }
        return false;
    }

    public boolean isBlocked(Occurrence occurrence) {
        return isBlocked(occurrence.line(), occurrence.column(), occurrence.fragment().footprint());
    }

    public boolean isConsumed(int line, int column) {
        Set<Integer> columns = consumed.get(line);
        return columns != null && columns.contains(column);
    }

    public int consumedCount() {
        return consumedCount;
    }

    public boolean isEmpty() {
        return consumedCount == 0;
    }
}
