package org.stepaas.assembly.step;

/**
 * 引用解析计数：每个断开的环节只丢弃对应条目，并在这里计数。
 *
 * @param annotationsLinked      通过引用链挂到产品上的标注条数
 * @param fallbackLinks          通过文本包含兜底挂上的标注条数
 * @param unlinkedAnnotations    最终没有挂到任何产品上的标注数
 * @param brokenAnnotationChains 引用链中途断开的 PROPERTY_DEFINITION_REPRESENTATION 数
 * @param edgesResolved          两端都能解析到产品的装配关系数
 * @param unresolvedEdges        至少一端无法解析的装配关系数
 */
public record ResolutionStats(
        int annotationsLinked,
        int fallbackLinks,
        int unlinkedAnnotations,
        int brokenAnnotationChains,
        int edgesResolved,
        int unresolvedEdges
) {

    public ResolutionStats plus(ResolutionStats other) {
        return new ResolutionStats(
                annotationsLinked + other.annotationsLinked,
                fallbackLinks + other.fallbackLinks,
                unlinkedAnnotations + other.unlinkedAnnotations,
                brokenAnnotationChains + other.brokenAnnotationChains,
                edgesResolved + other.edgesResolved,
                unresolvedEdges + other.unresolvedEdges
        );
    }

    public static ResolutionStats zero() {
        return new ResolutionStats(0, 0, 0, 0, 0, 0);
    }
}
