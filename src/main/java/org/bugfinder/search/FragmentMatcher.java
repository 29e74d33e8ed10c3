package org.bugfinder.search;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 单个片段的行内匹配器。
 * <p>
 * 匹配规则：
 * <ul>
 *   <li>片段中的空格匹配任意单个字符，其余字符按字面值匹配（区分大小写）。</li>
 *   <li>返回<strong>所有</strong>起始位置，包括相互重叠的命中：片段 {@code "aa"} 在 {@code "aaa"} 中命中第 1、2 列。</li>
 * </ul>
 * <p>
 * 扫描时以片段的第一个非通配字符作为锚点，用 {@link String#indexOf(int, int)} 跳到下一个候选位置，
 * 每次校验后从 {@code start + 1} 继续，因此不会漏掉重叠命中。
 * <p>
 * 命中会按发现顺序（先行后列）追加到本匹配器的列表中。
 */
public class FragmentMatcher {

    private final Fragment fragment;
    private final List<Occurrence> occurrences = new ArrayList<>();

    public FragmentMatcher(Fragment fragment) {
        this.fragment = Objects.requireNonNull(fragment, "fragment");
    }

    public Fragment fragment() {
        return fragment;
    }

    /**
     * 在一行文本中查找片段的全部命中（含重叠），追加到内部列表并返回本行新增的命中。
     *
     * @param lineNumber 行号（1-based）
     * @param lineText   行内容（不含换行符）
     */
    public List<Occurrence> findOccurrences(int lineNumber, String lineText) {
        if (fragment.isBlank() || lineText == null || lineText.length() < fragment.length()) {
            return List.of();
        }

        int anchorOffset = fragment.footprint().get(0);
        char anchor = fragment.text().charAt(anchorOffset);
        int lastStart = lineText.length() - fragment.length();

        List<Occurrence> found = new ArrayList<>();
        int start = 0;
        while (start <= lastStart) {
            int anchorAt = lineText.indexOf(anchor, start + anchorOffset);
            if (anchorAt < 0) {
                break;
            }
            start = anchorAt - anchorOffset;
            if (start > lastStart) {
                break;
            }
            if (matchesAt(lineText, start)) {
                found.add(new Occurrence(lineNumber, start + 1, fragment));
            }
            start++;
        }
        occurrences.addAll(found);
        return found;
    }

    /**
     * 片段是否在 {@code lineText} 的 {@code start}（0-based）处命中。
     */
    public boolean matchesAt(String lineText, int start) {
        if (start < 0 || start + fragment.length() > lineText.length()) {
            return false;
        }
        String text = fragment.text();
        for (int offset : fragment.footprint()) {
            if (lineText.charAt(start + offset) != text.charAt(offset)) {
                return false;
            }
        }
        return !fragment.isBlank();
    }

    /**
     * 到目前为止记录的全部命中（按发现顺序，只读）。
     */
    public List<Occurrence> occurrences() {
        return Collections.unmodifiableList(occurrences);
    }

    void clear() {
        occurrences.clear();
    }
}
