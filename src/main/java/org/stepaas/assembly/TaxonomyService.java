package org.stepaas.assembly;

/**
 * 分类字典：把自由文本标签映射到语义 ID。找不到足够相近的条目时返回 {@link SemanticLookup#NONE}，不抛异常。
 */
public interface TaxonomyService {

    SemanticLookup lookup(String label);
}
