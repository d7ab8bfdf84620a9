package org.stepaas.assembly;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.stepaas.assembly.SupplementOutcome.Status;
import org.stepaas.assembly.model.Annotation;
import org.stepaas.assembly.model.ComponentNode;
import org.stepaas.assembly.step.ResolvedDocument;
import org.stepaas.assembly.step.StepKind;
import org.stepaas.assembly.step.StepRecordExtractor;
import org.stepaas.assembly.step.StepRecords;
import org.stepaas.assembly.step.StepReferenceResolver;
import org.stepaas.assembly.step.StepStrings;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * 补充标注：从主文档以外的 STEP 文档中提取标注，按文件名合并到装配树中的组件上。
 * <p>
 * 匹配严格基于文件名：文档基名按 {@link ComponentRegistry#normalizeName(String)} 规范化后查名称索引。
 * 虚拟根永远不参与匹配。合并只追加不存在的 (name, description) 对，同一文档重复处理不会产生变化。
 * <p>
 * 每次运行一个实例；来源文档的逻辑文件名通过本次运行的 {@link IdentifierAllocator} 分配。
 */
public class AnnotationSupplementer {

    private static final Logger log = LoggerFactory.getLogger(AnnotationSupplementer.class);

    public static final String LOGICAL_FILE_PREFIX = "/aasx/stp/annotations/";

    private static final Set<StepKind> ANNOTATION_KINDS = EnumSet.complementOf(EnumSet.of(StepKind.USAGE));

    private final StepDocumentReader reader;
    private final StepRecordExtractor extractor;
    private final StepReferenceResolver resolver;
    private final IdentifierAllocator allocator;

    public AnnotationSupplementer(StepDocumentReader reader, StepRecordExtractor extractor,
                                  StepReferenceResolver resolver, IdentifierAllocator allocator) {
        this.reader = reader;
        this.extractor = extractor;
        this.resolver = resolver;
        this.allocator = allocator;
    }

    public SupplementOutcome supplement(Path document, ComponentRegistry registry, boolean annotationFallback) {
        String text;
        try {
            text = reader.read(document).text();
        } catch (IOException e) {
            log.warn("辅助文档不可读，已跳过：{}（{}）", document, e.getMessage());
            return SupplementOutcome.of(document, Status.UNREADABLE, 0, "读取失败：" + e.getMessage());
        }

        // 快速预检：两种关键实体都不存在时没有可提取的标注
        if (!StepStrings.containsIgnoreCase(text, "DESCRIPTIVE_REPRESENTATION_ITEM")
                && !StepStrings.containsIgnoreCase(text, "PROPERTY_DEFINITION_REPRESENTATION")) {
            return SupplementOutcome.of(document, Status.NO_ANNOTATIONS, 0, null);
        }

        StepRecords records = extractor.extract(text, ANNOTATION_KINDS);
        ResolvedDocument resolved = resolver.resolve(records, annotationFallback);
        List<Annotation> candidates = new ArrayList<>(new LinkedHashSet<>(resolved.allAnnotations()));
        if (candidates.isEmpty()) {
            return SupplementOutcome.of(document, Status.NO_ANNOTATIONS, 0, null);
        }

        String key = ComponentRegistry.normalizeName(StepDocumentScanner.baseName(document));
        Optional<ComponentNode> match = registry.findByNormalizedName(key).filter(n -> !n.isVirtual());
        if (match.isEmpty()) {
            log.debug("辅助文档 {} 未匹配到组件（匹配键 {}）", document.getFileName(), key);
            return SupplementOutcome.of(document, Status.UNMATCHED, candidates.size(), "匹配键：" + key);
        }

        ComponentNode node = match.get();
        int added = node.addAnnotations(candidates);
        if (!node.hasAnnotationSource(document)) {
            node.addAnnotationSource(document, logicalFileName(document, node));
        }
        log.debug("辅助文档 {} -> {}，新增标注 {} 条", document.getFileName(), node.syntheticId(), added);
        return new SupplementOutcome(document, Status.MATCHED, node.syntheticId(), candidates.size(), added, null);
    }

    private String logicalFileName(Path document, ComponentNode node) {
        String safe = allocator.allocate("Annotation_" + StepDocumentScanner.baseName(document), node.syntheticId());
        return LOGICAL_FILE_PREFIX + safe + StepDocumentScanner.extension(document);
    }
}
