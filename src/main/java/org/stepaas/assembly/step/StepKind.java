package org.stepaas.assembly.step;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 装配解析关心的实体种类。每个种类可对应多种拼写（例如 formation 的两种写法）。
 */
public enum StepKind {
    PRODUCT("PRODUCT"),
    PRODUCT_DEFINITION("PRODUCT_DEFINITION"),
    FORMATION("PRODUCT_DEFINITION_FORMATION", "PRODUCT_DEFINITION_FORMATION_WITH_SPECIFIED_SOURCE"),
    USAGE("NEXT_ASSEMBLY_USAGE_OCCURRENCE", "ASSEMBLY_COMPONENT_USAGE"),
    ANNOTATION("DESCRIPTIVE_REPRESENTATION_ITEM"),
    REPRESENTATION("REPRESENTATION"),
    PROPERTY_DEFINITION("PROPERTY_DEFINITION"),
    PROPERTY_DEFINITION_REPRESENTATION("PROPERTY_DEFINITION_REPRESENTATION");

    private static final Map<String, StepKind> BY_TYPE = new HashMap<>();

    static {
        for (StepKind kind : values()) {
            for (String type : kind.typeNames) {
                BY_TYPE.put(type, kind);
            }
        }
    }

    private final List<String> typeNames;

    StepKind(String... typeNames) {
        this.typeNames = List.of(typeNames);
    }

    public List<String> typeNames() {
        return typeNames;
    }

    /**
     * 廉价的存在性检查：文本中没有出现任何一种拼写时，这个种类可以整体跳过。
     */
    public boolean mayOccurIn(String text) {
        for (String type : typeNames) {
            if (StepStrings.containsIgnoreCase(text, type)) {
                return true;
            }
        }
        return false;
    }

    /**
     * @param typeUpper 大写实体类型名
     * @return 对应种类；不关心的类型返回 null
     */
    public static StepKind ofType(String typeUpper) {
        return typeUpper == null ? null : BY_TYPE.get(typeUpper);
    }
}
