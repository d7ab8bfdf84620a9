package org.stepaas.assembly;

import java.text.Normalizer;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * 运行级标识符分配器：保证一次运行内分配出的标识符互不相同，且只含 {@code [A-Za-z0-9_]}。
 * <p>
 * 分配规则：
 * <ol>
 *   <li>清洗标签：德文变音转写、{@code °C -> degreeCelsius}、{@code % -> percentage}，空格/连字符转下划线，
 *       去掉 {@code . / # , ( ) [ ]}，其余重音字符去掉附加符号，剩余非法字符替换为下划线；
 *       首字符不是字母时加前缀 {@code X}，清洗后为空时使用 {@code Component}</li>
 *   <li>冲突时先尝试追加一次 {@code _<上下文>}，再依次尝试 {@code _1}、{@code _2}...</li>
 * </ol>
 * 保留的结构标签（{@link #RESERVED_LABELS}）在树的每一层都会重复出现，只有通过 {@link #allocateStructural(String)}
 * 申请时才免于唯一性检查，由所在位置区分，不进入台账；普通标签清洗后恰好是保留标签时不会得到原名，直接走消歧。
 * <p>
 * 每次运行使用独立实例；非线程安全（单写者）。
 */
public class IdentifierAllocator {

    public static final Set<String> RESERVED_LABELS = Set.of(
            "Type", "Level", "Product_ID", "Source_File", "Standard_Type", "Volume", "Surface_Area",
            "X", "Y", "Z", "Length", "Width", "Height");

    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");
    private static final Pattern DISALLOWED = Pattern.compile("[^A-Za-z0-9_]");

    private final Set<String> ledger = new HashSet<>();
    private int sequence = 0;

    /**
     * @param label        期望的标签
     * @param contextToken 冲突时用于消歧的上下文（可为空）
     * @return 本次运行内唯一的标识符
     */
    public String allocate(String label, String contextToken) {
        String base = sanitize(label);
        if (!RESERVED_LABELS.contains(base) && ledger.add(base)) {
            return base;
        }
        String context = replaceSpecialCharacters(contextToken == null ? "" : contextToken);
        context = DISALLOWED.matcher(context).replaceAll("_");
        if (!context.isEmpty()) {
            String candidate = base + "_" + context;
            if (ledger.add(candidate)) {
                return candidate;
            }
        }
        for (int n = 1; ; n++) {
            String candidate = base + "_" + n;
            if (ledger.add(candidate)) {
                return candidate;
            }
        }
    }

    /**
     * 结构属性标签（{@code Type}、{@code Level}、坐标轴等）：保留标签原样返回且不进入台账，其余按 {@link #allocate} 处理。
     */
    public String allocateStructural(String label) {
        String base = sanitize(label);
        return RESERVED_LABELS.contains(base) ? base : allocate(label, null);
    }

    /**
     * 基于单调计数器的标识符，例如 {@code nextSequenceId("P") -> P00001}。
     */
    public String nextSequenceId(String prefix) {
        while (true) {
            sequence++;
            String candidate = String.format(Locale.ROOT, "%s%05d", prefix, sequence);
            if (ledger.add(candidate)) {
                return candidate;
            }
        }
    }

    /**
     * 预留固定标识符（例如虚拟根的 {@code root_assembly}）。
     *
     * @return 是否为首次预留
     */
    public boolean reserve(String id) {
        return ledger.add(id);
    }

    public boolean isAllocated(String id) {
        return ledger.contains(id);
    }

    public static boolean isReserved(String label) {
        return RESERVED_LABELS.contains(label);
    }

    public static String sanitize(String label) {
        String value = replaceSpecialCharacters(label == null ? "" : label.strip());
        value = DISALLOWED.matcher(value).replaceAll("_");
        if (value.isEmpty()) {
            return "Component";
        }
        if (!Character.isLetter(value.charAt(0))) {
            value = "X" + value;
        }
        return value;
    }

    /**
     * 转写与字符替换（不做首字符处理），也用于输出包中的逻辑文件名。
     */
    public static String replaceSpecialCharacters(String value) {
        String out = value
                .replace("ä", "ae").replace("Ä", "Ae")
                .replace("ö", "oe").replace("Ö", "Oe")
                .replace("ü", "ue").replace("Ü", "Ue")
                .replace("ß", "ss")
                .replace("°C", "degreeCelsius")
                .replace("%", "percentage")
                .replace(' ', '_').replace('-', '_');
        StringBuilder sb = new StringBuilder(out.length());
        for (int i = 0; i < out.length(); i++) {
            char c = out.charAt(i);
            if ("./#,()[]".indexOf(c) < 0) {
                sb.append(c);
            }
        }
        return COMBINING_MARKS.matcher(Normalizer.normalize(sb.toString(), Normalizer.Form.NFD)).replaceAll("");
    }
}
