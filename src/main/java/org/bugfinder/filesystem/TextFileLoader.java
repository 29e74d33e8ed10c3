package org.bugfinder.filesystem;

import org.bugfinder.search.InvalidLandscapeException;
import org.bugfinder.search.InvalidPatternException;
import org.bugfinder.search.PatternSearchException;
import org.bugfinder.search.PatternText;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.List;

/**
 * 读取图案文件与被搜索文件（UTF-8 文本），并按行切分。
 * <p>
 * 说明：
 * <ul>
 *   <li>整份文本会在一次搜索期间常驻内存，因此读取前先按 {@code app.finder.*-max-bytes} 检查文件大小，超过直接拒绝。</li>
 *   <li>严格按 UTF-8 解码；遇到非法字节序列视为“无法读取”，不做替换字符兜底（否则列号会失真）。</li>
 *   <li>开头的 UTF-8 BOM 会被去掉，避免第一行的列号整体偏移一位。</li>
 *   <li>图案文件的错误统一报告为 {@link InvalidPatternException}，被搜索文件的错误报告为 {@link InvalidLandscapeException}。</li>
 * </ul>
 */
public class TextFileLoader {

    private static final char BOM = '\uFEFF';

    private final PatternFinderProperties properties;

    public TextFileLoader(PatternFinderProperties properties) {
        this.properties = properties;
    }

    /**
     * 读取图案文件：每行去掉行尾空白（行首空格保留）。
     */
    public List<String> loadPatternLines(SecurePathResolver.ResolvedPath resolved) {
        String text = readText(resolved, Source.PATTERN, properties.getPatternMaxBytes().toBytes());
        List<String> lines = PatternText.patternLines(text);
        if (lines.size() > properties.getPatternMaxLines()) {
            throw new InvalidPatternException(
                    "图案行数过多：" + lines.size() + "（上限 " + properties.getPatternMaxLines() + "）：" + resolved.displayPath()
            );
        }
        return lines;
    }

    /**
     * 读取被搜索文件：行内容原样保留（不含换行符）。
     */
    public List<String> loadLandscapeLines(SecurePathResolver.ResolvedPath resolved) {
        String text = readText(resolved, Source.LANDSCAPE, properties.getLandscapeMaxBytes().toBytes());
        return PatternText.landscapeLines(text);
    }

    private static String readText(SecurePathResolver.ResolvedPath resolved, Source source, long maxBytes) {
        Path file = resolved.absolutePath();
        String display = resolved.displayPath();
        if (!Files.exists(file, LinkOption.NOFOLLOW_LINKS)) {
            throw source.failure(source.label + "不存在：" + display, null);
        }
        if (!Files.isRegularFile(file, LinkOption.NOFOLLOW_LINKS)) {
            throw source.failure(source.label + "不是普通文件：" + display, null);
        }

        byte[] bytes;
        try {
            long size = Files.size(file);
            if (size > maxBytes) {
                throw source.failure(source.label + "过大：" + size + " 字节（上限 " + maxBytes + "）：" + display, null);
            }
            bytes = Files.readAllBytes(file);
        } catch (IOException e) {
            throw source.failure("读取" + source.label + "失败：" + display + "（" + e.getMessage() + "）", e);
        }

        String text;
        try {
            text = decodeUtf8Strict(bytes);
        } catch (CharacterCodingException e) {
            throw source.failure(source.label + "不是合法的 UTF-8 文本：" + display, e);
        }
        if (!text.isEmpty() && text.charAt(0) == BOM) {
            text = text.substring(1);
        }
        return text;
    }

    static String decodeUtf8Strict(byte[] bytes) throws CharacterCodingException {
        return StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT)
                .decode(ByteBuffer.wrap(bytes))
                .toString();
    }

    private enum Source {
        PATTERN("图案文件") {
            @Override
            PatternSearchException failure(String message, Throwable cause) {
                return new InvalidPatternException(message, cause);
            }
        },
        LANDSCAPE("被搜索文件") {
            @Override
            PatternSearchException failure(String message, Throwable cause) {
                return new InvalidLandscapeException(message, cause);
            }
        };

        private final String label;

        Source(String label) {
            this.label = label;
        }

        abstract PatternSearchException failure(String message, Throwable cause);
    }
}
