package org.stepaas.mcp;

import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Component;
import org.stepaas.assembly.AssemblyBatchBuilder;
import org.stepaas.assembly.AssemblyRun;
import org.stepaas.assembly.AssemblyServerProperties;
import org.stepaas.assembly.SecurePathResolver;
import org.stepaas.assembly.StepDocumentReader;
import org.stepaas.assembly.StepDocumentScanner;
import org.stepaas.assembly.dto.AllowedRootsResult;
import org.stepaas.assembly.dto.AssemblyBuildResult;
import org.stepaas.assembly.dto.DocumentResolutionResult;
import org.stepaas.assembly.dto.StepDocumentListResult;
import org.stepaas.assembly.dto.step.StepHeader;
import org.stepaas.assembly.dto.step.StepProduct;
import org.stepaas.assembly.model.Annotation;
import org.stepaas.assembly.model.AssemblyEdge;
import org.stepaas.assembly.step.ComponentClassifier;
import org.stepaas.assembly.step.ResolvedDocument;
import org.stepaas.assembly.step.StepHeaderParser;
import org.stepaas.assembly.step.StepRecordExtractor;
import org.stepaas.assembly.step.StepRecords;
import org.stepaas.assembly.step.StepReferenceResolver;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * STEP 装配构建 MCP 工具集合。
 * <p>
 * 提供能力：
 * <ul>
 *   <li>列出输入根目录白名单（{@code step_list_roots}）。</li>
 *   <li>列出目录下的 STEP 文档（{@code step_list_documents}）。</li>
 *   <li>解析单个文档的产品/标注/装配关系（{@code step_resolve_document}）。</li>
 *   <li>批量构建带标注的装配树（{@code step_build_assembly}）。</li>
 * </ul>
 * 路径一律经 {@link SecurePathResolver} 校验，只能读取 {@code app.assembly.roots} 范围内的文件。
 */
@Component
public class AssemblyMcpTools {

    /**
     * 层级视图默认展开深度（报告和结构不受影响）。
     */
    private static final int DEFAULT_HIERARCHY_DEPTH = 32;

    private final AssemblyServerProperties properties;
    private final SecurePathResolver pathResolver;
    private final AssemblyBatchBuilder batchBuilder;
    private final StepDocumentReader reader;
    private final StepRecordExtractor extractor;
    private final StepReferenceResolver resolver;
    private final ComponentClassifier classifier;

    public AssemblyMcpTools(AssemblyServerProperties properties,
                            SecurePathResolver pathResolver,
                            AssemblyBatchBuilder batchBuilder,
                            StepDocumentReader reader,
                            StepRecordExtractor extractor,
                            StepReferenceResolver resolver,
                            ComponentClassifier classifier) {
        this.properties = properties;
        this.pathResolver = pathResolver;
        this.batchBuilder = batchBuilder;
        this.reader = reader;
        this.extractor = extractor;
        this.resolver = resolver;
        this.classifier = classifier;
    }

    @Tool(
            name = "step_list_roots",
            description = "列出允许读取的输入根目录（rootId + path）。"
    )
    public AllowedRootsResult listRoots() {
        return new AllowedRootsResult(pathResolver.listRoots());
    }

    @Tool(
            name = "step_list_documents",
            description = "递归列出目录下的 STEP 文档（.stp/.step），按路径排序，即批量构建时的处理顺序。"
    )
    public StepDocumentListResult listDocuments(
            @ToolParam(required = false, description = "rootId（可从 step_list_roots 获取；为空默认 root0）") String rootId,
            @ToolParam(required = false, description = "目录路径（相对 rootId 或绝对路径；为空表示根目录本身）") String directory
    ) {
        SecurePathResolver.ResolvedPath dir = pathResolver.resolveDirectory(rootId, directory);
        List<Path> documents;
        try {
            documents = StepDocumentScanner.discover(dir.absolutePath());
        } catch (IOException e) {
            throw new IllegalStateException("扫描目录失败：" + dir.displayPath(), e);
        }
        List<StepDocumentListResult.StepDocumentEntry> entries = new ArrayList<>(documents.size());
        for (Path document : documents) {
            Long size;
            try {
                size = Files.size(document);
            } catch (IOException e) {
                size = null;
            }
            entries.add(new StepDocumentListResult.StepDocumentEntry(display(dir, document), size));
        }
        return new StepDocumentListResult(dir.rootId(), normalizeDisplayPath(dir.displayPath()), entries);
    }

    @Tool(
            name = "step_resolve_document",
            description = "解析单个 STEP 文档：HEADER、产品及其标注（经 PROPERTY_DEFINITION 引用链）、装配关系与解析计数。不构建装配树。"
    )
    public DocumentResolutionResult resolveDocument(
            @ToolParam(required = false, description = "rootId（可从 step_list_roots 获取；为空默认 root0）") String rootId,
            @ToolParam(description = "STEP 文件路径（.stp/.step，相对 rootId 或绝对路径）") String path,
            @ToolParam(required = false, description = "是否启用文本包含兜底匹配标注（默认取 app.assembly.annotation-fallback）") Boolean annotationFallback
    ) {
        SecurePathResolver.ResolvedPath resolved = pathResolver.resolve(rootId, path);
        Path file = requireStepFile(resolved);

        StepDocumentReader.DocumentText text;
        try {
            text = reader.read(file);
        } catch (IOException e) {
            throw new IllegalStateException("读取文件失败：" + resolved.displayPath(), e);
        }
        StepHeader header = StepHeaderParser.parse(text.text());
        StepRecords records = extractor.extract(text.text());
        ResolvedDocument document = resolver.resolve(records, fallback(annotationFallback));

        Set<Integer> parents = new HashSet<>();
        for (AssemblyEdge edge : document.edges()) {
            parents.add(edge.parentProductId());
        }
        List<DocumentResolutionResult.ProductEntry> products = new ArrayList<>(document.products().size());
        for (StepProduct product : document.products().values()) {
            List<Annotation> annotations = document.annotationsOf(product.id());
            products.add(new DocumentResolutionResult.ProductEntry(
                    product.id(),
                    product.displayName(),
                    product.description(),
                    classifier.classify(product.displayName(), product.description(), annotations,
                            parents.contains(product.id())).name(),
                    annotations
            ));
        }

        List<String> warnings = new ArrayList<>(text.warnings());
        if (header.warnings() != null) {
            warnings.addAll(header.warnings());
        }
        if (products.isEmpty()) {
            warnings.add("文档中没有可解析的 PRODUCT，不能作为主文档。");
        }
        return new DocumentResolutionResult(
                resolved.rootId(),
                normalizeDisplayPath(resolved.displayPath()),
                text.charset(),
                text.truncated(),
                header,
                products,
                document.edges(),
                document.stats(),
                records.statementsScanned(),
                records.statementsDropped(),
                warnings.isEmpty() ? null : warnings
        );
    }

    @Tool(
            name = "step_build_assembly",
            description = "批量构建：读取目录下全部 STEP 文档，以指定主文档建立单根装配树，并按文件名把其余文档中的标注合并到对应组件上。返回汇总报告与层级视图，可选返回输出元素结构。"
    )
    public AssemblyBuildResult buildAssembly(
            @ToolParam(required = false, description = "rootId（可从 step_list_roots 获取；为空默认 root0）") String rootId,
            @ToolParam(required = false, description = "输入目录（相对 rootId 或绝对路径；为空表示根目录本身）") String directory,
            @ToolParam(description = "主文档（相对输入目录或绝对路径，必须显式指定）") String primaryDocument,
            @ToolParam(required = false, description = "是否启用文本包含兜底匹配标注（默认取 app.assembly.annotation-fallback）") Boolean annotationFallback,
            @ToolParam(required = false, description = "是否返回输出元素结构与引用文件列表（默认 false）") Boolean includeStructure
    ) {
        if (primaryDocument == null || primaryDocument.isBlank()) {
            throw new IllegalArgumentException("primaryDocument 不能为空：必须显式指定主文档");
        }
        SecurePathResolver.ResolvedPath dir = pathResolver.resolveDirectory(rootId, directory);
        Path primaryPath = Path.of(primaryDocument);
        Path primaryAbsolute = primaryPath.isAbsolute() ? primaryPath : dir.absolutePath().resolve(primaryPath);
        SecurePathResolver.ResolvedPath primary = pathResolver.resolve(dir.rootId(), primaryAbsolute.normalize().toString());
        requireStepFile(primary);

        AssemblyRun run = batchBuilder.build(dir.absolutePath(), primary.absolutePath(), fallback(annotationFallback));

        boolean withStructure = Boolean.TRUE.equals(includeStructure);
        return new AssemblyBuildResult(
                dir.rootId(),
                normalizeDisplayPath(dir.displayPath()),
                run.toReport(p -> display(dir, p), properties.getMaxReportedMisses()),
                run.toView(DEFAULT_HIERARCHY_DEPTH),
                withStructure ? run.structure().submodel() : null,
                withStructure ? run.structure().files() : null
        );
    }

    private boolean fallback(Boolean requested) {
        return (requested == null) ? properties.isAnnotationFallback() : requested;
    }

    private static Path requireStepFile(SecurePathResolver.ResolvedPath resolved) {
        Path file = resolved.absolutePath();
        if (!Files.isRegularFile(file, LinkOption.NOFOLLOW_LINKS)) {
            throw new IllegalArgumentException("不是普通文件：" + resolved.displayPath());
        }
        if (!StepDocumentScanner.isStepDocument(file)) {
            throw new IllegalArgumentException("不是 STEP 文件（仅支持 .stp/.step）：" + resolved.displayPath());
        }
        return file;
    }

    private static String display(SecurePathResolver.ResolvedPath base, Path file) {
        Path root = base.rootPath();
        String value = file.startsWith(root) ? root.relativize(file).toString() : file.toString();
        return normalizeDisplayPath(value);
    }

    private static String normalizeDisplayPath(String path) {
        if (path == null) {
            return null;
        }
        return path.replace('\\', '/');
    }
}
