package org.bugfinder.mcp;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.bugfinder.filesystem.PatternFinderProperties;
import org.bugfinder.filesystem.SecurePathResolver;
import org.bugfinder.filesystem.TextFileLoader;
import org.bugfinder.filesystem.dto.AllowedRootsResult;
import org.bugfinder.filesystem.dto.FragmentLocation;
import org.bugfinder.filesystem.dto.FragmentScanEntry;
import org.bugfinder.filesystem.dto.FragmentScanResult;
import org.bugfinder.filesystem.dto.PatternMatch;
import org.bugfinder.filesystem.dto.PatternSearchResult;
import org.bugfinder.search.Fragment;
import org.bugfinder.search.InvalidPatternException;
import org.bugfinder.search.MatchResult;
import org.bugfinder.search.Occurrence;
import org.bugfinder.search.PatternSearch;
import org.bugfinder.search.PatternText;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * 多行图案搜索 MCP 工具集合。
 * <p>
 * 提供能力：
 * <ul>
 *   <li>列出根目录白名单（{@code finder_list_roots}）。</li>
 *   <li>用图案文件搜索文本文件（{@code finder_search_files}）。</li>
 *   <li>用内联图案（文本或 JSON 行数组）搜索文本文件（{@code finder_search_text}）。</li>
 *   <li>只做逐行扫描、输出每个片段的命中统计（{@code finder_scan_fragments}），用于排查“为什么没有匹配”。</li>
 * </ul>
 * <p>
 * 图案规则：每行是一个片段，行尾空白会被去掉，行首空格保留；片段中的空格匹配任意单个字符。
 * 完整匹配要求第 i+1 行片段出现在第 i 行片段的正下方（同一起始列），且不同匹配之间不共享非空格字符。
 * <p>
 * 安全策略：图案文件与被搜索文件都必须位于 {@code app.finder.roots} 白名单内；默认禁止 symlink/junction。
 */
@Component
public class PatternFinderMcpTools {

    private static final Logger log = LoggerFactory.getLogger(PatternFinderMcpTools.class);

    /**
     * 内联图案在结果中的来源标记。
     */
    static final String INLINE_PATTERN = "inline";

    /**
     * patternLines 参数解析用的 JSON 解析器（默认配置即可）。
     */
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    private final PatternFinderProperties properties;
    private final SecurePathResolver pathResolver;
    private final TextFileLoader fileLoader;

    public PatternFinderMcpTools(PatternFinderProperties properties, SecurePathResolver pathResolver, TextFileLoader fileLoader) {
        this.properties = properties;
        this.pathResolver = pathResolver;
        this.fileLoader = fileLoader;
    }

    @Tool(
            name = "finder_list_roots",
            description = "列出允许读取的根目录（rootId + path）以及图案/文本文件的大小上限。"
    )
    public AllowedRootsResult listRoots() {
        return new AllowedRootsResult(
                pathResolver.listRoots(),
                properties.getPatternMaxBytes().toBytes(),
                properties.getPatternMaxLines(),
                properties.getLandscapeMaxBytes().toBytes()
        );
    }

    @Tool(
            name = "finder_search_files",
            description = "在文本文件中查找多行图案：图案文件每行一个片段（空格为通配符），要求各行片段上下对齐；返回匹配总数与每个匹配中各片段的行号/列号。"
    )
    /**
     * 用图案文件搜索被搜索文件。
     * <p>
     * 返回的 {@code matchCount} 是完整匹配总数；明细最多返回 {@code maxMatches} 条。
     */
    public PatternSearchResult searchFiles(
            @ToolParam(required = false, description = "rootId（可从 finder_list_roots 获取；为空默认 root0）") String rootId,
            @ToolParam(description = "图案文件路径（相对 rootId 或绝对路径）") String patternPath,
            @ToolParam(description = "被搜索文件路径（相对 rootId 或绝对路径）") String landscapePath,
            @ToolParam(required = false, description = "是否去掉所有图案行共同的行首空格（默认 false）") Boolean trimCommonIndent,
            @ToolParam(required = false, description = "最多返回多少条匹配明细（默认 app.finder.search-default-max-matches，上限 app.finder.search-max-matches）") Integer maxMatches,
            @ToolParam(required = false, description = "是否返回每个片段命中处的原文（默认 false）") Boolean includeExcerpt
    ) {
        if (patternPath == null || patternPath.isBlank()) {
            throw new IllegalArgumentException("参数错误：patternPath 不能为空");
        }
        SecurePathResolver.ResolvedPath patternFile = pathResolver.resolve(rootId, patternPath);
        List<String> patternLines = fileLoader.loadPatternLines(patternFile);
        return search(rootId, patternFile.displayPath(), patternLines, landscapePath, trimCommonIndent, maxMatches, includeExcerpt);
    }

    @Tool(
            name = "finder_search_text",
            description = "在文本文件中查找多行图案（图案直接内联传入：pattern 为多行文本，或 patternLines 为 JSON 字符串数组，二选一）；返回匹配总数与各片段的行号/列号。"
    )
    /**
     * 用内联图案搜索被搜索文件。
     * <p>
     * {@code patternLines} 适合图案行首有空格、不便在多行字符串里表达的场景，例如 {@code ["  /\\", " /  \\"]}。
     */
    public PatternSearchResult searchText(
            @ToolParam(required = false, description = "rootId（可从 finder_list_roots 获取；为空默认 root0）") String rootId,
            @ToolParam(required = false, description = "图案文本（多行，每行一个片段；与 patternLines 二选一）") String pattern,
            @ToolParam(required = false, description = "图案行（JSON 字符串数组，例如 [\"ab\",\"ab\"]；与 pattern 二选一）") String patternLines,
            @ToolParam(description = "被搜索文件路径（相对 rootId 或绝对路径）") String landscapePath,
            @ToolParam(required = false, description = "是否去掉所有图案行共同的行首空格（默认 false）") Boolean trimCommonIndent,
            @ToolParam(required = false, description = "最多返回多少条匹配明细（默认 app.finder.search-default-max-matches，上限 app.finder.search-max-matches）") Integer maxMatches,
            @ToolParam(required = false, description = "是否返回每个片段命中处的原文（默认 false）") Boolean includeExcerpt
    ) {
        List<String> lines = parseInlinePattern(pattern, patternLines);
        return search(rootId, INLINE_PATTERN, lines, landscapePath, trimCommonIndent, maxMatches, includeExcerpt);
    }

    @Tool(
            name = "finder_scan_fragments",
            description = "只对被搜索文件做逐行扫描（不拼装跨行匹配）：返回每个图案片段的命中总数与前若干条命中位置，用于排查为什么没有匹配。"
    )
    /**
     * 只执行扫描阶段。图案可以来自文件（patternPath）或内联文本（pattern / patternLines），三者只能给一个。
     */
    public FragmentScanResult scanFragments(
            @ToolParam(required = false, description = "rootId（可从 finder_list_roots 获取；为空默认 root0）") String rootId,
            @ToolParam(required = false, description = "图案文件路径（与 pattern/patternLines 三选一）") String patternPath,
            @ToolParam(required = false, description = "图案文本（多行；与 patternPath/patternLines 三选一）") String pattern,
            @ToolParam(required = false, description = "图案行（JSON 字符串数组；与 patternPath/pattern 三选一）") String patternLines,
            @ToolParam(description = "被搜索文件路径（相对 rootId 或绝对路径）") String landscapePath,
            @ToolParam(required = false, description = "是否去掉所有图案行共同的行首空格（默认 false）") Boolean trimCommonIndent,
            @ToolParam(required = false, description = "每个片段返回的命中样本数（默认 app.finder.scan-default-sample-size，上限 app.finder.scan-max-sample-size）") Integer sampleSize,
            @ToolParam(required = false, description = "是否返回命中处的原文（默认 false）") Boolean includeExcerpt
    ) {
        boolean hasPath = patternPath != null && !patternPath.isBlank();
        if (hasPath && (pattern != null || patternLines != null)) {
            throw new IllegalArgumentException("参数错误：patternPath 与 pattern/patternLines 只能提供一个");
        }

        String patternSource;
        List<String> rawLines;
        if (hasPath) {
            SecurePathResolver.ResolvedPath patternFile = pathResolver.resolve(rootId, patternPath);
            patternSource = patternFile.displayPath();
            rawLines = fileLoader.loadPatternLines(patternFile);
        } else {
            patternSource = INLINE_PATTERN;
            rawLines = parseInlinePattern(pattern, patternLines);
        }

        List<String> warnings = new ArrayList<>();
        List<String> fragmentLines = prepareFragments(rawLines, Boolean.TRUE.equals(trimCommonIndent), warnings);
        SecurePathResolver.ResolvedPath landscapeFile = resolveLandscape(rootId, landscapePath);
        List<String> landscape = fileLoader.loadLandscapeLines(landscapeFile);

        PatternSearch search = new PatternSearch();
        search.loadPattern(fragmentLines);
        search.scanLandscape(landscape);

        int resolvedSampleSize = resolveSampleSize(sampleSize);
        boolean withExcerpt = Boolean.TRUE.equals(includeExcerpt);
        List<FragmentScanEntry> entries = new ArrayList<>(search.fragmentCount());
        for (Fragment fragment : search.fragments()) {
            List<Occurrence> occurrences = search.occurrences(fragment.index());
            int shown = Math.min(resolvedSampleSize, occurrences.size());
            List<FragmentLocation> sample = new ArrayList<>(shown);
            for (int i = 0; i < shown; i++) {
                sample.add(toLocation(occurrences.get(i), landscape, withExcerpt));
            }
            entries.add(new FragmentScanEntry(
                    fragment.index(),
                    fragment.text(),
                    fragment.footprint(),
                    occurrences.size(),
                    sample,
                    shown < occurrences.size()
            ));
        }

        log.info("finder_scan_fragments pattern={} landscape={} occurrences={}",
                patternSource, landscapeFile.displayPath(), search.occurrenceCounts());
        return new FragmentScanResult(
                landscapeFile.rootId(),
                patternSource,
                landscapeFile.displayPath(),
                search.landscapeLineCount(),
                resolvedSampleSize,
                entries,
                warnings.isEmpty() ? null : warnings
        );
    }

    private PatternSearchResult search(
            String rootId,
            String patternSource,
            List<String> rawPatternLines,
            String landscapePath,
            Boolean trimCommonIndent,
            Integer maxMatches,
            Boolean includeExcerpt
    ) {
        List<String> warnings = new ArrayList<>();
        List<String> fragmentLines = prepareFragments(rawPatternLines, Boolean.TRUE.equals(trimCommonIndent), warnings);
        SecurePathResolver.ResolvedPath landscapeFile = resolveLandscape(rootId, landscapePath);
        List<String> landscape = fileLoader.loadLandscapeLines(landscapeFile);
        if (landscape.isEmpty()) {
            addWarningLimited(warnings, "被搜索文件为空：" + landscapeFile.displayPath());
        }

        PatternSearch search = PatternSearch.run(fragmentLines, landscape);

        int resolvedMaxMatches = resolveSearchMaxMatches(maxMatches);
        boolean withExcerpt = Boolean.TRUE.equals(includeExcerpt);
        List<MatchResult> found = search.matches();
        int shown = Math.min(resolvedMaxMatches, found.size());
        List<PatternMatch> matches = new ArrayList<>(shown);
        for (int i = 0; i < shown; i++) {
            MatchResult match = found.get(i);
            List<FragmentLocation> locations = new ArrayList<>(match.size());
            for (Occurrence occurrence : match.occurrences()) {
                locations.add(toLocation(occurrence, landscape, withExcerpt));
            }
            matches.add(new PatternMatch(i + 1, match.line(), match.column(), locations));
        }

        log.info("Pattern search pattern={} landscape={} fragments={} matches={}",
                patternSource, landscapeFile.displayPath(), search.fragmentCount(), search.matchCount());
        return new PatternSearchResult(
                landscapeFile.rootId(),
                patternSource,
                landscapeFile.displayPath(),
                fragmentTexts(search),
                search.landscapeLineCount(),
                search.occurrenceCounts(),
                search.matchCount(),
                search.consumedCount(),
                resolvedMaxMatches,
                shown < found.size(),
                matches,
                warnings.isEmpty() ? null : warnings
        );
    }

    private SecurePathResolver.ResolvedPath resolveLandscape(String rootId, String landscapePath) {
        if (landscapePath == null || landscapePath.isBlank()) {
            throw new IllegalArgumentException("参数错误：landscapePath 不能为空");
        }
        return pathResolver.resolve(rootId, landscapePath);
    }

    /**
     * 解析内联图案：{@code pattern}（多行文本）与 {@code patternLines}（JSON 字符串数组）二选一。
     */
    private List<String> parseInlinePattern(String pattern, String patternLines) {
        boolean hasText = pattern != null && !pattern.isEmpty();
        boolean hasLines = patternLines != null && !patternLines.isBlank();
        if (hasText == hasLines) {
            throw new IllegalArgumentException("参数错误：pattern 与 patternLines 必须且只能提供一个");
        }

        List<String> lines;
        if (hasText) {
            if (pattern.getBytes(StandardCharsets.UTF_8).length > properties.getPatternMaxBytes().toBytes()) {
                throw new InvalidPatternException("图案过大（上限 " + properties.getPatternMaxBytes().toBytes() + " 字节）");
            }
            lines = PatternText.patternLines(pattern);
        } else {
            lines = parsePatternLinesJson(patternLines);
        }
        if (lines.size() > properties.getPatternMaxLines()) {
            throw new InvalidPatternException("图案行数过多：" + lines.size() + "（上限 " + properties.getPatternMaxLines() + "）");
        }
        return lines;
    }

    private static List<String> parsePatternLinesJson(String json) {
        JsonNode root;
        try {
            root = OBJECT_MAPPER.readTree(json);
        } catch (Exception e) {
            throw new InvalidPatternException("patternLines 不是合法的 JSON：" + e.getMessage(), e);
        }
        if (root == null || !root.isArray()) {
            throw new InvalidPatternException("patternLines 格式错误：必须是 JSON 字符串数组");
        }
        List<String> lines = new ArrayList<>(root.size());
        for (int i = 0; i < root.size(); i++) {
            JsonNode item = root.get(i);
            if (item == null || !item.isTextual()) {
                throw new InvalidPatternException("patternLines 格式错误：第 " + (i + 1) + " 个元素不是字符串");
            }
            String text = item.asText();
            if (text.indexOf('\n') >= 0 || text.indexOf('\r') >= 0) {
                throw new InvalidPatternException("patternLines 格式错误：第 " + (i + 1) + " 个元素包含换行符");
            }
            lines.add(PatternText.stripTrailingBlanks(text));
        }
        return lines;
    }

    /**
     * 应用 trimCommonIndent，并对“永远不会命中”的空片段给出告警（图案整体为空时由 {@link PatternSearch} 报错）。
     */
    private static List<String> prepareFragments(List<String> patternLines, boolean trimCommonIndent, List<String> warnings) {
        List<String> lines = trimCommonIndent ? PatternText.stripCommonIndent(patternLines) : patternLines;
        int lastNonBlank = -1;
        for (int i = 0; i < lines.size(); i++) {
            if (!lines.get(i).isBlank()) {
                lastNonBlank = i;
            }
        }
        for (int i = 0; i < lastNonBlank; i++) {
            if (lines.get(i).isBlank()) {
                addWarningLimited(warnings, "图案第 " + (i + 1) + " 行为空，该片段不会命中任何位置，因此不会有完整匹配。");
            }
        }
        return lines;
    }

    private FragmentLocation toLocation(Occurrence occurrence, List<String> landscape, boolean withExcerpt) {
        if (!withExcerpt) {
            return new FragmentLocation(occurrence.fragmentIndex(), occurrence.line(), occurrence.column(), null, null);
        }
        String line = landscape.get(occurrence.line() - 1);
        int from = occurrence.column() - 1;
        int to = Math.min(line.length(), occurrence.endColumn());
        int limit = properties.getExcerptMaxLength();
        boolean truncated = to - from > limit;
        String excerpt = line.substring(from, truncated ? from + limit : to);
        return new FragmentLocation(occurrence.fragmentIndex(), occurrence.line(), occurrence.column(), excerpt, truncated);
    }

    private static List<String> fragmentTexts(PatternSearch search) {
        List<String> texts = new ArrayList<>(search.fragmentCount());
        for (Fragment fragment : search.fragments()) {
            texts.add(fragment.text());
        }
        return texts;
    }

    private int resolveSearchMaxMatches(Integer maxMatches) {
        // 匹配明细条数上限保护：避免返回体过大（匹配总数仍完整统计）
        int resolved = (maxMatches == null) ? properties.getSearchDefaultMaxMatches() : maxMatches;
        resolved = Math.max(1, resolved);
        return Math.min(resolved, properties.getSearchMaxMatches());
    }

    private int resolveSampleSize(Integer sampleSize) {
        int resolved = (sampleSize == null) ? properties.getScanDefaultSampleSize() : sampleSize;
        resolved = Math.max(0, resolved);
        return Math.min(resolved, properties.getScanMaxSampleSize());
    }

    private static void addWarningLimited(List<String> warnings, String message) {
        // 避免大量空行告警把返回体撑大
        final int maxWarnings = 50;
        if (warnings.size() < maxWarnings) {
            warnings.add(message);
            return;
        }
        if (warnings.size() == maxWarnings) {
            warnings.add("告警过多，已省略后续告警…");
        }
    }
}
