package org.stepaas.assembly;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.stepaas.assembly.dto.AssemblyStructure;
import org.stepaas.assembly.dto.step.StepHeader;
import org.stepaas.assembly.model.ComponentNode;
import org.stepaas.assembly.model.ParentConflict;
import org.stepaas.assembly.step.ComponentClassifier;
import org.stepaas.assembly.step.ResolvedDocument;
import org.stepaas.assembly.step.StepHeaderParser;
import org.stepaas.assembly.step.StepRecordExtractor;
import org.stepaas.assembly.step.StepRecords;
import org.stepaas.assembly.step.StepReferenceResolver;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * 批量构建入口：目录 + 显式指定的主文档 -> 带标注的单根装配树。
 * <p>
 * 处理顺序（顺序本身是正确性要求）：
 * <ol>
 *   <li>发现目录下全部 STEP 文档（排序后的路径顺序）</li>
 *   <li>主文档：抽取记录、解析引用、登记组件、构建装配树（可选提取根节点几何信息）</li>
 *   <li>其余文档按发现顺序逐个补充标注（依赖主文档已建立的名称索引）</li>
 *   <li>把装配树映射为输出结构</li>
 * </ol>
 * 缺少主文档或主文档中没有产品时抛出 {@link AssemblyBuildException}；其他问题都降级为报告中的计数/提示。
 * <p>
 * 每次调用使用独立的 {@link IdentifierAllocator}，不同运行之间互不影响。
 */
public class AssemblyBatchBuilder {

    private static final Logger log = LoggerFactory.getLogger(AssemblyBatchBuilder.class);

    private final AssemblyServerProperties properties;
    private final StepDocumentReader reader;
    private final StepRecordExtractor extractor;
    private final StepReferenceResolver resolver;
    private final ComponentClassifier classifier;
    private final GeometryService geometryService;
    private final AssemblyStructureMapper mapper;

    public AssemblyBatchBuilder(AssemblyServerProperties properties,
                                StepDocumentReader reader,
                                StepRecordExtractor extractor,
                                StepReferenceResolver resolver,
                                ComponentClassifier classifier,
                                GeometryService geometryService,
                                AssemblyStructureMapper mapper) {
        this.properties = properties;
        this.reader = reader;
        this.extractor = extractor;
        this.resolver = resolver;
        this.classifier = classifier;
        this.geometryService = geometryService;
        this.mapper = mapper;
    }

    public AssemblyRun build(Path directory, Path primaryDocument, boolean annotationFallback) {
        if (primaryDocument == null) {
            throw new AssemblyBuildException("必须显式指定主文档");
        }
        Path primary = primaryDocument.toAbsolutePath().normalize();
        if (!Files.isRegularFile(primary)) {
            throw new AssemblyBuildException("主文档不存在：" + primary);
        }

        List<Path> documents;
        try {
            documents = StepDocumentScanner.discover(directory.toAbsolutePath().normalize());
        } catch (IOException e) {
            throw new AssemblyBuildException("扫描目录失败：" + directory, e);
        }
        log.info("开始构建装配：目录 {}，发现 {} 个 STEP 文档，主文档 {}", directory, documents.size(), primary.getFileName());

        List<String> warnings = new ArrayList<>();
        StepDocumentReader.DocumentText primaryText;
        try {
            primaryText = reader.read(primary);
        } catch (IOException e) {
            throw new AssemblyBuildException("主文档读取失败：" + primary, e);
        }
        warnings.addAll(primaryText.warnings());

        StepHeader header = StepHeaderParser.parse(primaryText.text());
        StepRecords records = extractor.extract(primaryText.text());
        ResolvedDocument resolved = resolver.resolve(records, annotationFallback);
        if (resolved.products().isEmpty()) {
            throw new AssemblyBuildException("主文档中没有可解析的 PRODUCT：" + primary.getFileName());
        }
        if (records.statementsDropped() > 0) {
            log.warn("主文档中有 {} 条畸形语句已丢弃", records.statementsDropped());
        }

        IdentifierAllocator allocator = new IdentifierAllocator();
        ComponentRegistry registry = new ComponentRegistry(allocator, classifier);
        registry.registerAll(resolved, primary);
        AssemblyTree tree = new AssemblyTreeBuilder(allocator, properties.getVirtualRootName())
                .build(registry, resolved.edges());
        for (ParentConflict conflict : tree.conflicts()) {
            log.warn("装配关系 #{} 被拒绝（{}）：子节点 {}，保留父节点 {}，拒绝父节点 {}", conflict.usageId(),
                    conflict.reason(), conflict.childId(), conflict.keptParentId(), conflict.rejectedParentId());
        }
        if (!tree.detached().isEmpty()) {
            warnings.add("有 " + tree.detached().size() + " 个组件不在根节点 " + tree.root().name() + " 之下");
        }
        log.info("主文档解析完成：组件 {}，装配关系 {}，根节点 {}{}", registry.size(), resolved.edges().size(),
                tree.root().name(), tree.isVirtualRoot() ? "（虚拟根）" : "");

        if (properties.isExtractRootGeometry() && !tree.isVirtualRoot()) {
            attachRootGeometry(tree.root(), primary, warnings);
        }

        AnnotationSupplementer supplementer = new AnnotationSupplementer(reader, extractor, resolver, allocator);
        List<SupplementOutcome> outcomes = new ArrayList<>();
        for (Path document : documents) {
            if (document.equals(primary)) {
                continue;
            }
            outcomes.add(supplementer.supplement(document, registry, annotationFallback));
        }
        long matched = outcomes.stream().filter(o -> o.status() == SupplementOutcome.Status.MATCHED).count();
        log.info("补充标注完成：辅助文档 {}，匹配 {}", outcomes.size(), matched);

        AssemblyStructure structure = mapper.map(tree, header, primary, allocator);

        return new AssemblyRun(
                directory.toAbsolutePath().normalize(),
                primary,
                List.copyOf(documents),
                header,
                registry,
                tree,
                List.copyOf(outcomes),
                resolved.stats(),
                records.statementsScanned(),
                records.statementsDropped(),
                structure,
                List.copyOf(warnings)
        );
    }

    private void attachRootGeometry(ComponentNode root, Path primary, List<String> warnings) {
        try {
            geometryService.measure(primary).ifPresent(root::setGeometry);
        } catch (RuntimeException e) {
            // 几何信息只是附加项：失败按“没有几何信息”处理
            log.warn("根节点几何信息提取失败：{}", primary, e);
            warnings.add("根节点几何信息提取失败：" + e.getMessage());
        }
    }
}
