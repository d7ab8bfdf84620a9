package org.stepaas.assembly;

import org.stepaas.assembly.dto.step.StepProduct;
import org.stepaas.assembly.model.Annotation;
import org.stepaas.assembly.model.AssemblyEdge;
import org.stepaas.assembly.step.ComponentClassifier;
import org.stepaas.assembly.step.ResolutionStats;
import org.stepaas.assembly.step.ResolvedDocument;
import org.stepaas.assembly.step.StepRecordExtractor;
import org.stepaas.assembly.step.StepReferenceResolver;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 不经过 STEP 文本、直接构造解析结果的小工具。
 */
final class AssemblyTestSupport {

    private AssemblyTestSupport() {
    }

    static ResolvedDocument document(List<String> productNames, List<AssemblyEdge> edges) {
        return document(productNames, edges, Map.of());
    }

    /**
     * 产品 native id 依次为 1、2、3...
     */
    static ResolvedDocument document(List<String> productNames, List<AssemblyEdge> edges,
                                     Map<Integer, List<Annotation>> annotations) {
        Map<Integer, StepProduct> products = new LinkedHashMap<>();
        for (int i = 0; i < productNames.size(); i++) {
            String name = productNames.get(i);
            products.put(i + 1, new StepProduct(i + 1, name, name, ""));
        }
        return new ResolvedDocument(products, annotations, edges, ResolutionStats.zero());
    }

    static AssemblyEdge edge(int usageId, int parent, int child) {
        return new AssemblyEdge(usageId, parent, child, null);
    }

    /**
     * 与 Spring 装配一致的批量构建器；分类字典用标签本身充当语义 ID。
     */
    static AssemblyBatchBuilder batchBuilder(AssemblyServerProperties properties) {
        StepDocumentReader reader = new StepDocumentReader(properties.getMaxDocumentBytes().toBytes());
        ComponentClassifier classifier = new ComponentClassifier();
        return new AssemblyBatchBuilder(properties, reader, new StepRecordExtractor(), new StepReferenceResolver(),
                classifier, new PointCloudGeometryService(reader), new AssemblyStructureMapper(labelTaxonomy(), classifier));
    }

    static TaxonomyService labelTaxonomy() {
        return label -> new SemanticLookup("id:" + label, List.of(label));
    }

    static ComponentRegistry register(IdentifierAllocator allocator, ResolvedDocument document) {
        ComponentRegistry registry = new ComponentRegistry(allocator, new ComponentClassifier());
        registry.registerAll(document, Path.of("primary.stp"));
        return registry;
    }
}
