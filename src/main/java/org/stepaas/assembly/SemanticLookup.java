package org.stepaas.assembly;

import java.util.List;

/**
 * 分类字典查询结果。
 *
 * @param semanticId  语义 ID
 * @param description {@code [name, definition]}；未找到时为一条提示
 */
public record SemanticLookup(String semanticId, List<String> description) {

    public static final SemanticLookup NONE =
            new SemanticLookup("0000", List.of("No semantic ID is found, please add it manually."));

    public SemanticLookup {
        description = (description == null) ? List.of() : List.copyOf(description);
    }

    public boolean isNone() {
        return NONE.semanticId().equals(semanticId);
    }
}
