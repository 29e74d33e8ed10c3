package org.bugfinder.filesystem;

import org.bugfinder.filesystem.dto.AllowedRoot;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * 安全路径解析器：把调用方传入的图案/文本文件路径解析成“受控的绝对路径”，并确保它不会逃逸出根目录白名单。
 * <p>
 * 规则：
 * <ul>
 *   <li>只允许读取 {@code app.finder.roots} 配置的目录及其子路径。</li>
 *   <li>阻止 {@code ../} 之类的路径穿越。</li>
 *   <li>默认禁止符号链接/junction；对已存在的每一级路径做 realPath 校验。</li>
 * </ul>
 * <p>
 * 注意：这里不要求目标文件存在；“文件不存在”属于图案/文本输入错误，由 {@link TextFileLoader} 报告。
 */
public class SecurePathResolver {

    private final boolean allowSymlink;
    private final List<Root> roots;

    public SecurePathResolver(PatternFinderProperties properties) {
        this.allowSymlink = properties.isAllowSymlink();
        this.roots = normalizeRoots(properties.getRoots());
    }

    public List<AllowedRoot> listRoots() {
        List<AllowedRoot> result = new ArrayList<>(roots.size());
        for (Root root : roots) {
            result.add(new AllowedRoot(root.id(), root.path().toString()));
        }
        return result;
    }

    /**
     * 解析一个待读取的文件路径。
     *
     * @param rootId    根目录标识（为空时：绝对路径自动匹配最深的 root，相对路径默认 root0）
     * @param inputPath 相对 rootId 的路径或绝对路径
     */
    public ResolvedPath resolve(String rootId, String inputPath) {
        if (roots.isEmpty()) {
            throw new IllegalStateException("未配置允许读取的根目录（app.finder.roots）");
        }
        if (inputPath == null || inputPath.isBlank()) {
            throw new IllegalArgumentException("参数错误：文件路径不能为空");
        }

        Path rawPath = Path.of(inputPath);
        boolean noRootId = rootId == null || rootId.isBlank();
        Root root;
        Path absolute;
        if (rawPath.isAbsolute()) {
            absolute = rawPath.normalize();
            root = noRootId ? bestRootFor(absolute) : rootById(rootId);
        } else {
            root = noRootId ? roots.get(0) : rootById(rootId);
            absolute = root.path().resolve(rawPath).normalize();
        }

        // 字符串层面的越界检查，挡掉明显的 ../ 穿越
        if (!absolute.startsWith(root.path())) {
            throw new IllegalArgumentException("路径不在允许读取的根目录范围内：" + inputPath);
        }
        checkNoEscape(root, absolute);

        return new ResolvedPath(root.id(), root.path(), absolute, displayPath(root, absolute));
    }

    private void checkNoEscape(Root root, Path absolute) {
        Path rootReal;
        try {
            rootReal = root.path().toRealPath();
        } catch (IOException e) {
            throw new IllegalStateException("根目录不存在或无法解析：" + root.path(), e);
        }

        // 逐级校验：中间某一级是 symlink/junction 时，后续路径可能已经逃逸出 root
        Path current = root.path();
        for (Path segment : root.path().relativize(absolute)) {
            current = current.resolve(segment);
            if (!Files.exists(current, LinkOption.NOFOLLOW_LINKS)) {
                return;
            }
            if (!allowSymlink && Files.isSymbolicLink(current)) {
                throw new IllegalArgumentException("不允许访问符号链接路径：" + current);
            }
            Path real;
            try {
                real = current.toRealPath();
            } catch (IOException e) {
                throw new IllegalArgumentException("路径无法解析：" + current, e);
            }
            if (!real.startsWith(rootReal)) {
                throw new IllegalArgumentException("路径通过链接/junction 逃逸出根目录：" + current);
            }
        }
    }

    private Root rootById(String rootId) {
        for (Root root : roots) {
            if (root.id().equals(rootId)) {
                return root;
            }
        }
        throw new IllegalArgumentException("未知的 rootId：" + rootId);
    }

    private Root bestRootFor(Path absolute) {
        return roots.stream()
                .filter(r -> absolute.startsWith(r.path()))
                .max(Comparator.comparingInt(r -> r.path().getNameCount()))
                .orElseThrow(() -> new IllegalArgumentException("路径不在允许读取的根目录范围内：" + absolute));
    }

    private static List<Root> normalizeRoots(List<String> configured) {
        if (configured == null || configured.isEmpty()) {
            return List.of();
        }
        List<Root> result = new ArrayList<>(configured.size());
        for (int i = 0; i < configured.size(); i++) {
            String value = Objects.requireNonNull(configured.get(i), "配置项 app.finder.roots[" + i + "] 不能为空");
            result.add(new Root("root" + i, Path.of(value).toAbsolutePath().normalize()));
        }
        return result;
    }

    private static String displayPath(Root root, Path absolute) {
        String relative = root.path().relativize(absolute).toString().replace('\\', '/');
        return relative.isEmpty() ? "." : relative;
    }

    private record Root(String id, Path path) {
    }

    /**
     * @param rootId       命中的根目录标识
     * @param rootPath     根目录绝对路径
     * @param absolutePath 目标文件绝对路径
     * @param displayPath  相对 root 的展示路径（统一使用 / 分隔）
     */
    public record ResolvedPath(String rootId, Path rootPath, Path absolutePath, String displayPath) {
    }
}
