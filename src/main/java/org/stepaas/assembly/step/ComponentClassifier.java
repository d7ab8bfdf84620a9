package org.stepaas.assembly.step;

import org.stepaas.assembly.model.Annotation;
import org.stepaas.assembly.model.NodeKind;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * 组件分类：结构证据优先（作为父节点出现过即 ASSEMBLY），其次按关键字/厂商型号判断标准件。
 */
public final class ComponentClassifier {

    private static final List<String> STANDARD_KEYWORDS = List.of(
            "screw", "bolt", "nut", "washer", "bearing", "motor", "sensor",
            "valve", "cylinder", "spring", "pin", "gear", "coupling",
            "fastener", "fitting", "connector", "switch", "relay",
            "actuator", "encoder", "drive", "pump", "filter"
    );

    // 厂商名、"AB-123" 形式的型号、"K12345" 形式的订货号；大小写敏感的两条要在原始文本上匹配
    private static final List<Pattern> MANUFACTURER_PATTERNS = List.of(
            Pattern.compile("(?i)(festo|balluff|hbm|siemens|bosch|parker|smc|omron|keyence|sick|ifm)"),
            Pattern.compile("[A-Z]{2,}-\\d+"),
            Pattern.compile("\\b[A-Z]\\d{4,}\\b")
    );

    public NodeKind classify(String name, String description, List<Annotation> annotations, boolean parentInAnyEdge) {
        if (parentInAnyEdge) {
            return NodeKind.ASSEMBLY;
        }
        String text = combinedText(name, description, annotations);
        return isStandardPart(text) ? NodeKind.STANDARD_PART : NodeKind.PART;
    }

    /**
     * @return 命中的标准件关键字；没有命中关键字时返回 null（可能仍由型号规则判定为标准件）
     */
    public String standardKeyword(String name, String description, List<Annotation> annotations) {
        String lower = combinedText(name, description, annotations).toLowerCase(Locale.ROOT);
        for (String keyword : STANDARD_KEYWORDS) {
            if (lower.contains(keyword)) {
                return keyword;
            }
        }
        return null;
    }

    boolean isStandardPart(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        for (String keyword : STANDARD_KEYWORDS) {
            if (lower.contains(keyword)) {
                return true;
            }
        }
        for (Pattern p : MANUFACTURER_PATTERNS) {
            if (p.matcher(text).find()) {
                return true;
            }
        }
        return false;
    }

    private static String combinedText(String name, String description, List<Annotation> annotations) {
        StringBuilder sb = new StringBuilder();
        sb.append(name == null ? "" : name).append(' ').append(description == null ? "" : description);
        if (annotations != null) {
            for (Annotation a : annotations) {
                sb.append(' ').append(a.name()).append(' ').append(a.description());
            }
        }
        return sb.toString();
    }
}
