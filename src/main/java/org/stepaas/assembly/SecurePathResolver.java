package org.stepaas.assembly;

import org.stepaas.assembly.dto.AllowedRoot;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * 安全路径解析器：把工具参数中的目录/文档路径解析成受控的绝对路径，并确保不会逃逸出输入根目录白名单。
 * <p>
 * 规则：
 * <ul>
 *   <li>只允许读取 {@code app.assembly.roots} 配置的目录。</li>
 *   <li>阻止 {@code ../} 路径穿越；默认禁止经由符号链接/junction 逃逸。</li>
 *   <li>相对路径从 rootId 指定的根目录解析（缺省 root0）；绝对路径自动匹配层级最深的根目录。</li>
 * </ul>
 */
public class SecurePathResolver {

    private final AssemblyServerProperties properties;
    private final List<Root> roots;

    public SecurePathResolver(AssemblyServerProperties properties) {
        this.properties = properties;
        this.roots = normalizeRoots(properties);
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
            throw new IllegalStateException("未配置允许访问的根目录（app.assembly.roots）");
        }

        Path rawPath = (inputPath == null || inputPath.isBlank()) ? null : Path.of(inputPath);
        Root selectedRoot;
        Path absolute;
        if (rawPath != null && rawPath.isAbsolute()) {
            absolute = rawPath.toAbsolutePath().normalize();
            selectedRoot = (rootId == null || rootId.isBlank()) ? findBestRootForAbsolute(absolute) : findRootById(rootId);
        } else {
            selectedRoot = (rootId == null || rootId.isBlank()) ? roots.get(0) : findRootById(rootId);
            absolute = (rawPath == null) ? selectedRoot.rootPath() : selectedRoot.rootPath().resolve(rawPath).normalize();
        }

        if (!absolute.startsWith(selectedRoot.rootPath())) {
            throw new IllegalArgumentException("路径不在允许访问的根目录范围内：" + inputPath);
        }

        validateWithinRoot(selectedRoot, absolute);

        return new ResolvedPath(selectedRoot.id(), selectedRoot.rootPath(), absolute, displayPath(selectedRoot, absolute));
    }

    /**
     * 解析并要求目标是已存在的目录。
     */
    public ResolvedPath resolveDirectory(String rootId, String inputPath) {
        ResolvedPath resolved = resolve(rootId, inputPath);
        if (!Files.isDirectory(resolved.absolutePath())) {
            throw new IllegalArgumentException("不是目录：" + resolved.absolutePath());
        }
        return resolved;
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

        // 逐级校验，防止中间某一级目录是链接导致逃逸
        Path current = root.rootPath();
        for (Path segment : root.rootPath().relativize(absolute)) {
            current = current.resolve(segment);
            if (!properties.isAllowSymlink() && Files.isSymbolicLink(current)) {
                throw new IllegalArgumentException("不允许访问符号链接路径：" + current);
            }
            ensureRealPathInside(current, rootReal);
        }
        ensureRealPathInside(absolute, rootReal);
    }

    private static void ensureRealPathInside(Path path, Path rootReal) {
        try {
            if (!path.toRealPath().startsWith(rootReal)) {
                throw new IllegalArgumentException("路径通过链接/junction 逃逸出根目录：" + path);
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
                .orElseThrow(() -> new IllegalArgumentException("路径不在允许访问的根目录范围内：" + absolute));
    }

    private static List<Root> normalizeRoots(AssemblyServerProperties properties) {
        List<String> configured = properties.getRoots();
        if (configured == null || configured.isEmpty()) {
            return List.of();
        }
        List<Root> result = new ArrayList<>(configured.size());
        for (int i = 0; i < configured.size(); i++) {
            String value = Objects.requireNonNull(configured.get(i), "配置项 app.assembly.roots[" + i + "] 不能为空");
            result.add(new Root("root" + i, Path.of(value).toAbsolutePath().normalize()));
        }
        return result;
    }

    private static String displayPath(Root root, Path absolute) {
        String relative = root.rootPath().relativize(absolute).toString();
        return relative.isEmpty() ? "." : relative;
    }

    private record Root(String id, Path rootPath) {
    }

    public record ResolvedPath(String rootId, Path rootPath, Path absolutePath, String displayPath) {
    }
}
