package org.bugfinder.search;

import java.util.Objects;

/**
 * 某个片段在文本中的一次命中位置。
 * <p>
 * {@code fragment} 只是“来源片段”的引用（用于取 footprint），片段本身由 {@link PatternSearch} 持有。
 *
 * @param line     行号（1-based）
 * @param column   起始列号（1-based）
 * @param fragment 产生该命中的片段
 */
public record Occurrence(int line, int column, Fragment fragment) {

    public Occurrence {
        Objects.requireNonNull(fragment, "fragment");
        if (line < 1 || column < 1) {
            throw new IllegalArgumentException("行号/列号必须从 1 开始：line=" + line + ", column=" + column);
        }
    }

    /**
     * 当前命中是否紧跟在 {@code previous} 之后：下一行、同一起始列。
     */
    public boolean follows(Occurrence previous) {
        return line == previous.line + 1 && column == previous.column;
    }

    public int fragmentIndex() {
        return fragment.index();
    }

    /**
     * 命中覆盖的最后一列（1-based，含）。
     */
    public int endColumn() {
        return column + fragment.length() - 1;
    }

    @Override
    public String toString() {
        return "Occurrence[fragment=" + fragment.index() + ", line=" + line + ", column=" + column + "]";
    }
}
