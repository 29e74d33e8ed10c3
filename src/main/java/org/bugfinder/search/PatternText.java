package org.bugfinder.search;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * 图案/文本的按行切分工具。
 * <p>
 * 规则：
 * <ul>
 *   <li>只按 \n、\r\n、\r 切分（与 {@link java.io.BufferedReader#readLine()} 一致），换页符等其它控制字符保留在行内。</li>
 *   <li>文本以换行符结尾时，不会多出一个末尾空行（与逐行读取文件的行为一致）。</li>
 *   <li>图案行会去掉行尾空白，行首空格保留；普通文本行原样保留。</li>
 * </ul>
 */
public final class PatternText {

    private static final Pattern LINE_BREAK = Pattern.compile("\r\n|\r|\n");

    private PatternText() {
    }

    /**
     * 把图案文本切成行（已去掉每行的行尾空白）。
     */
    public static List<String> patternLines(String text) {
        List<String> lines = splitLines(text);
        List<String> result = new ArrayList<>(lines.size());
        for (String line : lines) {
            result.add(stripTrailingBlanks(line));
        }
        return result;
    }

    /**
     * 把被搜索的文本切成行（原样保留）。
     */
    public static List<String> landscapeLines(String text) {
        return splitLines(text);
    }

    public static String stripTrailingBlanks(String line) {
        if (line == null) {
            return "";
        }
        int end = line.length();
        while (end > 0 && Character.isWhitespace(line.charAt(end - 1))) {
            end--;
        }
        return line.substring(0, end);
    }

    /**
     * 去掉所有非空行共同拥有的行首空格数。
     * <p>
     * 例如 {@code ["   ab", "  c d"]} 变为 {@code [" ab", "c d"]}。空行不参与计算，结果中保持为空串。
     * 去掉公共缩进后，报告的起始列会相应右移，行首不足缩进宽度的位置也可能产生匹配。
     */
    public static List<String> stripCommonIndent(List<String> lines) {
        int common = Integer.MAX_VALUE;
        for (String line : lines) {
            if (line == null || line.isBlank()) {
                continue;
            }
            common = Math.min(common, leadingSpaces(line));
        }
        if (common == Integer.MAX_VALUE || common == 0) {
            return List.copyOf(lines);
        }
        List<String> result = new ArrayList<>(lines.size());
        for (String line : lines) {
            if (line == null || line.isBlank()) {
                result.add("");
            } else {
                result.add(line.substring(common));
            }
        }
        return result;
    }

    static int leadingSpaces(String line) {
        int count = 0;
        while (count < line.length() && line.charAt(count) == Fragment.WILDCARD) {
            count++;
        }
        return count;
    }

    private static List<String> splitLines(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        String[] parts = LINE_BREAK.split(text, -1);
        int len = parts.length;
        char last = text.charAt(text.length() - 1);
        if (len > 0 && parts[len - 1].isEmpty() && (last == '\n' || last == '\r')) {
            // "a\n" -> ["a", ""]，去掉末尾的空元素
            len--;
        }
        List<String> result = new ArrayList<>(len);
        for (int i = 0; i < len; i++) {
            result.add(parts[i]);
        }
        return result;
    }
}
