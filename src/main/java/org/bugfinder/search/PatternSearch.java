package org.bugfinder.search;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 一次多行图案搜索（会话）。
 * <p>
 * 工作流（必须按顺序调用）：
 * <ol>
 *   <li>{@link #loadPattern(List)}：每行图案生成一个 {@link Fragment}。</li>
 *   <li>{@link #scanLandscape(List)}：逐行扫描文本，记录每个片段的全部行内命中（含重叠）。</li>
 *   <li>{@link #detectMatches()}：用 {@link PatternAssembler} 把命中串成完整匹配，并累计匹配数。</li>
 * </ol>
 * <p>
 * 会话是单线程、同步的；{@link ExclusionSet} 与各片段的命中列表只属于当前会话，不可跨线程共享。
 */
public class PatternSearch {

    private static final Logger log = LoggerFactory.getLogger(PatternSearch.class);

    private enum State {
        EMPTY,
        PATTERN_LOADED,
        SCANNED,
        DETECTED
    }

    private final List<FragmentMatcher> matchers = new ArrayList<>();
    private final List<MatchResult> matches = new ArrayList<>();
    private ExclusionSet exclusions = new ExclusionSet();
    private int matchCount;
    private int landscapeLineCount;
    private State state = State.EMPTY;

    /**
     * 一次性完成加载、扫描、拼装。
     */
    public static PatternSearch run(List<String> patternLines, List<String> landscapeLines) {
        PatternSearch search = new PatternSearch();
        search.loadPattern(patternLines);
        search.scanLandscape(landscapeLines);
        search.detectMatches();
        return search;
    }

    /**
     * 加载图案：每行去掉行尾空白后成为一个片段（行首空格保留）。末尾的空行会被忽略。
     * <p>
     * 重新加载会丢弃当前会话的全部扫描与匹配结果。
     *
     * @throws InvalidPatternException 输入或其中某一行为 null，或解析后没有任何片段
     */
    public void loadPattern(List<String> patternLines) {
        if (patternLines == null) {
            throw new InvalidPatternException("未提供图案内容");
        }
        List<String> stripped = new ArrayList<>(patternLines.size());
        for (int i = 0; i < patternLines.size(); i++) {
            String line = patternLines.get(i);
            if (line == null) {
                throw new InvalidPatternException("图案第 " + (i + 1) + " 行为 null");
            }
            stripped.add(PatternText.stripTrailingBlanks(line));
        }
        int size = stripped.size();
        while (size > 0 && stripped.get(size - 1).isEmpty()) {
            size--;
        }
        if (size == 0) {
            throw new InvalidPatternException("图案为空：至少需要一行非空内容");
        }

        reset();
        matchers.clear();
        for (int i = 0; i < size; i++) {
            matchers.add(new FragmentMatcher(Fragment.of(i, stripped.get(i))));
        }
        state = State.PATTERN_LOADED;
        log.debug("Loaded pattern with {} fragment(s)", size);
    }

    /**
     * 扫描文本：对每一行（1-based）调用每个片段的匹配器。空文本是合法输入（不会产生任何命中）。
     * <p>
     * 重复扫描会丢弃上一次的扫描与匹配结果。
     *
     * @throws PatternNotSetException   尚未加载图案
     * @throws InvalidLandscapeException 输入为 null 或包含 null 行
     */
    public void scanLandscape(List<String> landscapeLines) {
        if (state == State.EMPTY) {
            throw new PatternNotSetException("尚未加载图案，无法扫描文本");
        }
        if (landscapeLines == null) {
            throw new InvalidLandscapeException("未提供被搜索的文本");
        }

        reset();
        int lineNumber = 0;
        for (String line : landscapeLines) {
            lineNumber++;
            if (line == null) {
                throw new InvalidLandscapeException("文本第 " + lineNumber + " 行为 null");
            }
            for (FragmentMatcher matcher : matchers) {
                matcher.findOccurrences(lineNumber, line);
            }
        }
        landscapeLineCount = lineNumber;
        state = State.SCANNED;
        if (log.isDebugEnabled()) {
            log.debug("Scanned {} line(s), occurrences per fragment: {}", lineNumber, occurrenceCounts());
        }
    }

    /**
     * 拼装完整匹配。同一会话重复调用时直接返回已有结果。
     *
     * @throws PatternNotSetException 尚未扫描文本
     */
    public List<MatchResult> detectMatches() {
        if (state == State.DETECTED) {
            return matches();
        }
        if (state != State.SCANNED) {
            throw new PatternNotSetException("尚未扫描文本，无法拼装匹配");
        }

        List<List<Occurrence>> occurrencesByFragment = new ArrayList<>(matchers.size());
        for (FragmentMatcher matcher : matchers) {
            occurrencesByFragment.add(matcher.occurrences());
        }
        PatternAssembler assembler = new PatternAssembler(occurrencesByFragment, exclusions);
        for (MatchResult match : assembler.assemble()) {
            matches.add(match);
            matchCount++;
        }
        state = State.DETECTED;
        log.debug("Detected {} match(es), {} character(s) consumed", matchCount, exclusions.consumedCount());
        return matches();
    }

    public int matchCount() {
        return matchCount;
    }

    public List<MatchResult> matches() {
        return Collections.unmodifiableList(matches);
    }

    public List<Fragment> fragments() {
        List<Fragment> fragments = new ArrayList<>(matchers.size());
        for (FragmentMatcher matcher : matchers) {
            fragments.add(matcher.fragment());
        }
        return fragments;
    }

    public int fragmentCount() {
        return matchers.size();
    }

    public List<Occurrence> occurrences(int fragmentIndex) {
        return matchers.get(fragmentIndex).occurrences();
    }

    public List<Integer> occurrenceCounts() {
        List<Integer> counts = new ArrayList<>(matchers.size());
        for (FragmentMatcher matcher : matchers) {
            counts.add(matcher.occurrences().size());
        }
        return counts;
    }

    public int landscapeLineCount() {
        return landscapeLineCount;
    }

    public boolean isConsumed(int line, int column) {
        return exclusions.isConsumed(line, column);
    }

    public int consumedCount() {
        return exclusions.consumedCount();
    }

    private void reset() {
        for (FragmentMatcher matcher : matchers) {
            matcher.clear();
        }
        matches.clear();
        matchCount = 0;
        landscapeLineCount = 0;
        exclusions = new ExclusionSet();
    }
}
