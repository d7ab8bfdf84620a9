package org.stepaas.assembly.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * 输出结构中的一个元素（属性、集合、文件引用或子模型）。
 *
 * @param idShort    运行内唯一的短标识（保留结构标签除外）
 * @param kind       元素类型
 * @param valueType  属性值类型（{@code xs:string}/{@code xs:int}/{@code xs:double}）；文件为 MIME 类型
 * @param value      属性值或文件逻辑路径；集合为 null
 * @param semanticId 语义 ID
 * @param children   子元素（仅集合/子模型）
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ElementNode(
        String idShort,
        Kind kind,
        String valueType,
        String value,
        String semanticId,
        List<ElementNode> children
) {

    public enum Kind {
        SUBMODEL,
        COLLECTION,
        PROPERTY,
        FILE
    }

    public static ElementNode property(String idShort, String valueType, String value, String semanticId) {
        return new ElementNode(idShort, Kind.PROPERTY, valueType, value, semanticId, null);
    }

    public static ElementNode file(String idShort, String mimeType, String logicalPath) {
        return new ElementNode(idShort, Kind.FILE, mimeType, logicalPath, null, null);
    }

    public static ElementNode collection(String idShort, String semanticId, List<ElementNode> children) {
        return new ElementNode(idShort, Kind.COLLECTION, null, null, semanticId, List.copyOf(children));
    }

    /**
     * 按 idShort 查找直接子元素。
     */
    public ElementNode child(String childIdShort) {
        if (children == null) {
            return null;
        }
        for (ElementNode c : children) {
            if (c.idShort().equals(childIdShort)) {
                return c;
            }
        }
        return null;
    }
}
