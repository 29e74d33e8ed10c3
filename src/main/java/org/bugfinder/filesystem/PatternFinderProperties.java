package org.bugfinder.filesystem;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;
import org.springframework.validation.annotation.Validated;

import java.util.List;

/**
 * 多行图案搜索 MCP Server 的业务配置（{@code app.finder.*}）。
 * <p>
 * 重点：
 * <ul>
 *   <li>通过 {@link #roots} 指定允许读取的根目录白名单，图案文件与被搜索文件都必须位于其中。</li>
 *   <li>通过 bytes/lines 上限控制读入内存的文本大小（整份文本会在一次搜索期间常驻内存）。</li>
 *   <li>通过 maxMatches/sampleSize 上限控制返回体积；匹配总数始终完整统计。</li>
 * </ul>
 */
@Validated
@ConfigurationProperties(prefix = "app.finder")
public class PatternFinderProperties {

    /**
     * 允许读取的根目录白名单。
     * <p>
     * 每个 root 会自动分配一个 {@code rootId}（root0、root1...）。
     */
    @NotNull
    private List<String> roots = List.of(".");

    /**
     * 是否允许访问符号链接（symlink）。
     * <p>
     * 安全建议：默认 false；若开启请确保 {@link #roots} 已经非常严格。
     */
    private boolean allowSymlink = false;

    /**
     * 图案文件的最大字节数。
     */
    @NotNull
    private DataSize patternMaxBytes = DataSize.ofKilobytes(64);

    /**
     * 图案的最大行数（片段数）。
     */
    @Min(1)
    @Max(100_000)
    private int patternMaxLines = 1_000;

    /**
     * 被搜索文件的最大字节数（超过则拒绝搜索，而不是截断）。
     */
    @NotNull
    private DataSize landscapeMaxBytes = DataSize.ofMegabytes(16);

    /**
     * 默认最多返回多少条匹配明细。
     */
    @Min(1)
    @Max(1_000_000)
    private int searchDefaultMaxMatches = 200;

    /**
     * 允许返回的匹配明细上限（上限保护）。
     */
    @Min(1)
    @Max(1_000_000)
    private int searchMaxMatches = 5_000;

    /**
     * {@code finder_scan_fragments} 默认每个片段返回的命中样本数。
     */
    @Min(0)
    @Max(100_000)
    private int scanDefaultSampleSize = 20;

    /**
     * {@code finder_scan_fragments} 每个片段允许返回的命中样本上限。
     */
    @Min(0)
    @Max(100_000)
    private int scanMaxSampleSize = 1_000;

    /**
     * 单条命中片段（excerpt）的最大字符数。
     */
    @Min(1)
    @Max(100_000)
    private int excerptMaxLength = 400;

    public List<String> getRoots() {
        return roots;
    }

    public void setRoots(List<String> roots) {
        this.roots = roots;
    }

    public boolean isAllowSymlink() {
        return allowSymlink;
    }

    public void setAllowSymlink(boolean allowSymlink) {
        this.allowSymlink = allowSymlink;
    }

    public DataSize getPatternMaxBytes() {
        return patternMaxBytes;
    }

    public void setPatternMaxBytes(DataSize patternMaxBytes) {
        this.patternMaxBytes = patternMaxBytes;
    }

    public int getPatternMaxLines() {
        return patternMaxLines;
    }

    public void setPatternMaxLines(int patternMaxLines) {
        this.patternMaxLines = patternMaxLines;
    }

    public DataSize getLandscapeMaxBytes() {
        return landscapeMaxBytes;
    }

    public void setLandscapeMaxBytes(DataSize landscapeMaxBytes) {
        this.landscapeMaxBytes = landscapeMaxBytes;
    }

    public int getSearchDefaultMaxMatches() {
        return searchDefaultMaxMatches;
    }

    public void setSearchDefaultMaxMatches(int searchDefaultMaxMatches) {
        this.searchDefaultMaxMatches = searchDefaultMaxMatches;
    }

    public int getSearchMaxMatches() {
        return searchMaxMatches;
    }

    public void setSearchMaxMatches(int searchMaxMatches) {
        this.searchMaxMatches = searchMaxMatches;
    }

    public int getScanDefaultSampleSize() {
        return scanDefaultSampleSize;
    }

    public void setScanDefaultSampleSize(int scanDefaultSampleSize) {
        this.scanDefaultSampleSize = scanDefaultSampleSize;
    }

    public int getScanMaxSampleSize() {
        return scanMaxSampleSize;
    }

    public void setScanMaxSampleSize(int scanMaxSampleSize) {
        this.scanMaxSampleSize = scanMaxSampleSize;
    }

    public int getExcerptMaxLength() {
        return excerptMaxLength;
    }

    public void setExcerptMaxLength(int excerptMaxLength) {
        this.excerptMaxLength = excerptMaxLength;
    }
}
