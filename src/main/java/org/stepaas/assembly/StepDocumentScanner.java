package org.stepaas.assembly;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Stream;

/**
 * 递归发现目录下的 STEP 文档（{@code .stp}/{@code .step}，扩展名大小写无关）。
 * <p>
 * 结果按绝对规范化路径去重并排序，作为本次运行的发现顺序：补充标注按这个顺序处理，
 * 同一输入目录多次运行的结果保持一致。
 */
public final class StepDocumentScanner {

    private StepDocumentScanner() {
    }

    public static boolean isStepDocument(Path file) {
        if (file == null || file.getFileName() == null) {
            return false;
        }
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".stp") || name.endsWith(".step");
    }

    public static List<Path> discover(Path directory) throws IOException {
        if (!Files.isDirectory(directory)) {
            throw new IOException("不是目录：" + directory);
        }
        Set<Path> unique = new LinkedHashSet<>();
        try (Stream<Path> stream = Files.walk(directory)) {
            stream.filter(Files::isRegularFile)
                    .filter(StepDocumentScanner::isStepDocument)
                    .map(p -> p.toAbsolutePath().normalize())
                    .forEach(unique::add);
        }
        List<Path> sorted = new ArrayList<>(unique);
        sorted.sort(null);
        return sorted;
    }

    /**
     * 去掉扩展名后的文件名，例如 {@code Bolt-2.stp -> Bolt-2}。
     */
    public static String baseName(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return (dot > 0) ? name.substring(0, dot) : name;
    }

    /**
     * 扩展名（含点，保持原大小写）；没有扩展名时为空串。
     */
    public static String extension(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return (dot > 0) ? name.substring(dot) : "";
    }
}
