package org.stepaas.assembly.step;

import org.stepaas.assembly.dto.step.StepDescriptiveItem;
import org.stepaas.assembly.dto.step.StepFormation;
import org.stepaas.assembly.dto.step.StepProduct;
import org.stepaas.assembly.dto.step.StepProductDefinition;
import org.stepaas.assembly.dto.step.StepPropertyDefinition;
import org.stepaas.assembly.dto.step.StepPropertyDefinitionRepresentation;
import org.stepaas.assembly.dto.step.StepRepresentation;
import org.stepaas.assembly.dto.step.StepUsage;
import org.stepaas.assembly.model.Annotation;
import org.stepaas.assembly.model.AssemblyEdge;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * 引用解析器：把记录表组合成“产品 -> 标注”和“父产品 -> 子产品”两类关系（尽力而为）。
 * <p>
 * 标注链路（每一跳都是一张独立的查找表，文档内只构建一次）：
 * <pre>
 * DESCRIPTIVE_REPRESENTATION_ITEM &lt;- REPRESENTATION.items
 * REPRESENTATION &lt;- PROPERTY_DEFINITION_REPRESENTATION -> PROPERTY_DEFINITION
 * PROPERTY_DEFINITION -> PRODUCT_DEFINITION -> FORMATION -> PRODUCT
 * </pre>
 * 装配关系：NAUO 的 relating/related 两端各自经 PRODUCT_DEFINITION -> FORMATION -> PRODUCT 解析，
 * 两端都解析成功才产生一条边。
 * <p>
 * 文本兜底（默认关闭）：引用链没有覆盖到的标注，按名称/描述的大小写无关包含关系挂到产品上。
 * 精度较低，只在调用方显式开启时使用。
 */
public final class StepReferenceResolver {

    public ResolvedDocument resolve(StepRecords records, boolean annotationFallback) {
        Map<Integer, StepProduct> products = records.products();
        Map<Integer, StepDescriptiveItem> annotations = records.annotations();

        // 1) representation -> 其中的标注 id（只保留已知标注）
        Map<Integer, List<Integer>> representationToAnnotations = new LinkedHashMap<>();
        for (StepRepresentation rep : records.representations().values()) {
            List<Integer> ids = new ArrayList<>();
            for (Integer item : rep.itemRefs()) {
                if (annotations.containsKey(item)) {
                    ids.add(item);
                }
            }
            if (!ids.isEmpty()) {
                representationToAnnotations.put(rep.id(), ids);
            }
        }

        // 2) property_definition -> product_definition
        Map<Integer, Integer> propertyToDefinition = new LinkedHashMap<>();
        for (StepPropertyDefinition pd : records.propertyDefinitions().values()) {
            if (pd.definitionRef() != null) {
                propertyToDefinition.put(pd.id(), pd.definitionRef());
            }
        }

        // 3) product_definition -> product（经 formation）
        Map<Integer, Integer> definitionToProduct = definitionToProduct(records);

        Map<Integer, Set<Annotation>> linked = new LinkedHashMap<>();
        Set<Integer> linkedAnnotationIds = new HashSet<>();
        int annotationsLinked = 0;
        int brokenChains = 0;

        // 4) property_definition_representation 把 representation 和 property_definition 串起来
        for (StepPropertyDefinitionRepresentation pdr : records.propertyDefinitionRepresentations().values()) {
            List<Integer> annotationIds = representationToAnnotations.get(pdr.representationRef());
            if (annotationIds == null) {
                // 不含标注的 representation（形状、材料等）不是断链
                continue;
            }
            Integer definitionId = propertyToDefinition.get(pdr.definitionRef());
            Integer productId = (definitionId == null) ? null : definitionToProduct.get(definitionId);
            if (productId == null) {
                brokenChains++;
                continue;
            }
            Set<Annotation> target = linked.computeIfAbsent(productId, k -> new LinkedHashSet<>());
            for (Integer annotationId : annotationIds) {
                StepDescriptiveItem item = annotations.get(annotationId);
                if (target.add(new Annotation(item.name(), item.description()))) {
                    annotationsLinked++;
                }
                linkedAnnotationIds.add(annotationId);
            }
        }

        int fallbackLinks = 0;
        int unlinked = 0;
        for (StepDescriptiveItem item : annotations.values()) {
            if (linkedAnnotationIds.contains(item.id())) {
                continue;
            }
            boolean matched = false;
            if (annotationFallback) {
                Annotation annotation = new Annotation(item.name(), item.description());
                for (StepProduct product : products.values()) {
                    if (textMatches(annotation, product)) {
                        matched = true;
                        if (linked.computeIfAbsent(product.id(), k -> new LinkedHashSet<>()).add(annotation)) {
                            fallbackLinks++;
                        }
                    }
                }
            }
            if (!matched) {
                unlinked++;
            }
        }

        List<AssemblyEdge> edges = new ArrayList<>();
        int unresolvedEdges = 0;
        for (StepUsage usage : records.usages().values()) {
            Integer parent = resolveProduct(usage.relatingDefinitionRef(), definitionToProduct);
            Integer child = resolveProduct(usage.relatedDefinitionRef(), definitionToProduct);
            if (parent == null || child == null) {
                unresolvedEdges++;
                continue;
            }
            edges.add(new AssemblyEdge(usage.id(), parent, child, usage.referenceDesignator()));
        }

        // 按产品的文档顺序输出
        Map<Integer, List<Annotation>> productAnnotations = new LinkedHashMap<>();
        for (Integer productId : products.keySet()) {
            Set<Annotation> set = linked.get(productId);
            if (set != null && !set.isEmpty()) {
                productAnnotations.put(productId, List.copyOf(set));
            }
        }

        ResolutionStats stats = new ResolutionStats(
                annotationsLinked, fallbackLinks, unlinked, brokenChains, edges.size(), unresolvedEdges);
        return new ResolvedDocument(
                Collections.unmodifiableMap(products),
                Collections.unmodifiableMap(productAnnotations),
                List.copyOf(edges),
                stats
        );
    }

    /**
     * product_definition -> formation -> product 的组合表；只保留最终落到已知产品的定义。
     */
    static Map<Integer, Integer> definitionToProduct(StepRecords records) {
        Map<Integer, Integer> out = new LinkedHashMap<>();
        Map<Integer, StepFormation> formations = records.formations();
        for (StepProductDefinition def : records.productDefinitions().values()) {
            StepFormation formation = (def.formationRef() == null) ? null : formations.get(def.formationRef());
            if (formation == null || formation.productRef() == null) {
                continue;
            }
            if (records.products().containsKey(formation.productRef())) {
                out.put(def.id(), formation.productRef());
            }
        }
        return out;
    }

    private static Integer resolveProduct(Integer definitionRef, Map<Integer, Integer> definitionToProduct) {
        return (definitionRef == null) ? null : definitionToProduct.get(definitionRef);
    }

    private static boolean textMatches(Annotation annotation, StepProduct product) {
        String annName = lower(annotation.name());
        String annDesc = lower(annotation.description());
        for (String productText : new String[]{lower(product.displayName()), lower(product.description())}) {
            if (productText.isEmpty()) {
                continue;
            }
            if (!annName.isEmpty() && (annName.contains(productText) || productText.contains(annName))) {
                return true;
            }
            if (!annDesc.isEmpty() && annDesc.contains(productText)) {
                return true;
            }
        }
        return false;
    }

    private static String lower(String value) {
        return (value == null) ? "" : value.strip().toLowerCase(Locale.ROOT);
    }
}
