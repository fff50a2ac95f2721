package org.fslogger.scanner;

import org.fslogger.scanner.dto.AllowedRoot;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * 扫描路径解析器：把 MCP 调用方传入的路径解析成受控的绝对路径，并确保它位于 {@code app.scan.roots} 白名单内。
 * <p>
 * 校验规则：
 * <ul>
 *   <li>绝对路径：选取路径层级最长的匹配 root；相对路径：相对 rootId 指定的 root（为空默认 root0）。</li>
 *   <li>先做 startsWith 校验挡掉 {@code ../} 越界，再对 root 到目标的每一级做 realPath 校验，防止链接逃逸。</li>
 *   <li>扫描目标必须已存在。</li>
 * </ul>
 */
public class ScanPathResolver {

    private final boolean allowSymlink;
    private final List<Root> roots;

    public ScanPathResolver(ScannerProperties properties) {
        this.allowSymlink = properties.isAllowSymlink();
        this.roots = normalizeRoots(properties.getRoots());
    }

    public List<AllowedRoot> listRoots() {
        List<AllowedRoot> result = new ArrayList<>(roots.size());
        for (Root root : roots) {
            result.add(new AllowedRoot(root.id(), root.rootPath().toString()));
        }
        return result;
    }

    public ResolvedPath resolve(String rootId, String inputPath) {
        if (roots.isEmpty()) {
            throw new IllegalStateException("未配置允许扫描的根目录（app.scan.roots）");
        }

        Path rawPath;
        try {
            rawPath = (inputPath == null || inputPath.isBlank()) ? null : Path.of(inputPath);
        } catch (InvalidPathException e) {
            throw new IllegalArgumentException("非法的路径：" + inputPath, e);
        }

        Root selectedRoot;
        Path absolute;
        if (rawPath != null && rawPath.isAbsolute()) {
            absolute = rawPath.normalize();
            selectedRoot = (rootId == null || rootId.isBlank()) ? findBestRootForAbsolute(absolute) : findRootById(rootId);
        } else {
            selectedRoot = (rootId == null || rootId.isBlank()) ? roots.get(0) : findRootById(rootId);
            absolute = (rawPath == null) ? selectedRoot.rootPath() : selectedRoot.rootPath().resolve(rawPath).normalize();
        }

        if (!absolute.startsWith(selectedRoot.rootPath())) {
            throw new IllegalArgumentException("路径不在允许扫描的根目录范围内：" + inputPath);
        }

        validateWithinRoot(selectedRoot, absolute);
        return new ResolvedPath(selectedRoot.id(), selectedRoot.rootPath(), absolute);
    }

    private void validateWithinRoot(Root root, Path absolute) {
        Path rootReal;
        try {
            rootReal = root.rootPath().toRealPath();
        } catch (IOException e) {
            throw new IllegalStateException("根目录不存在或无法解析：" + root.rootPath(), e);
        }

        if (!Files.exists(absolute, LinkOption.NOFOLLOW_LINKS)) {
            throw new IllegalArgumentException("路径不存在：" + absolute);
        }

        // 逐级校验：中间某一级是链接时，后续路径可能已经逃逸出 root
        Path current = root.rootPath();
        for (Path segment : root.rootPath().relativize(absolute)) {
            current = current.resolve(segment);
            if (!allowSymlink && Files.isSymbolicLink(current)) {
                throw new IllegalArgumentException("不允许扫描符号链接路径：" + current);
            }
            ensureInside(rootReal, current);
        }
        ensureInside(rootReal, absolute);
    }

    private static void ensureInside(Path rootReal, Path path) {
        try {
            if (!path.toRealPath().startsWith(rootReal)) {
                throw new IllegalArgumentException("路径通过链接逃逸出根目录：" + path);
            }
        } catch (IOException e) {
            throw new IllegalArgumentException("路径无法解析：" + path, e);
        }
    }

    private Root findRootById(String rootId) {
        for (Root root : roots) {
            if (root.id().equals(rootId)) {
                return root;
            }
        }
        throw new IllegalArgumentException("未知的 rootId：" + rootId);
    }

    private Root findBestRootForAbsolute(Path absolute) {
        return roots.stream()
                .filter(r -> absolute.startsWith(r.rootPath()))
                .max(Comparator.comparingInt(r -> r.rootPath().getNameCount()))
                .orElseThrow(() -> new IllegalArgumentException("路径不在允许扫描的根目录范围内：" + absolute));
    }

    private static List<Root> normalizeRoots(List<String> configured) {
        if (configured == null || configured.isEmpty()) {
            return List.of();
        }
        List<Root> result = new ArrayList<>(configured.size());
        for (int i = 0; i < configured.size(); i++) {
            String value = Objects.requireNonNull(configured.get(i), "配置项 app.scan.roots[" + i + "] 不能为空");
            result.add(new Root("root" + i, Path.of(value).toAbsolutePath().normalize()));
        }
        return result;
    }

    private record Root(String id, Path rootPath) {
    }

    /**
     * 解析结果。
     *
     * @param rootId       命中的根目录标识
     * @param rootPath     根目录绝对路径
     * @param absolutePath 扫描目标的绝对路径
     */
    public record ResolvedPath(String rootId, Path rootPath, Path absolutePath) {
    }
}
