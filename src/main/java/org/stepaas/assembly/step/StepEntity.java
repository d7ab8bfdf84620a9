package org.stepaas.assembly.step;

import org.stepaas.assembly.step.StepValue.StepEnum;
import org.stepaas.assembly.step.StepValue.StepList;
import org.stepaas.assembly.step.StepValue.StepRef;
import org.stepaas.assembly.step.StepValue.StepString;

import java.util.ArrayList;
import java.util.List;

/**
 * 一条 DATA 段实体语句 {@code #id=TYPE(fields...);} 的原始记录，创建后不可变。
 *
 * @param id     实体实例 id（仅在单个文档内唯一）
 * @param type   实体类型名（大写）
 * @param fields 按顺序解析后的参数
 */
public record StepEntity(int id, String type, List<StepValue> fields) {

    public StepEntity {
        fields = List.copyOf(fields);
    }

    public String string(int idx) {
        StepValue v = field(idx);
        if (v instanceof StepString s) {
            return s.value();
        }
        if (v instanceof StepEnum e) {
            return e.value();
        }
        return null;
    }

    public Integer ref(int idx) {
        return (field(idx) instanceof StepRef r) ? r.id() : null;
    }

    /**
     * 读取列表参数中的全部引用（嵌套列表会被展开）；非列表参数按单个引用处理。
     */
    public List<Integer> refs(int idx) {
        List<Integer> out = new ArrayList<>();
        collectRefs(field(idx), out);
        return out;
    }

    private static void collectRefs(StepValue v, List<Integer> out) {
        if (v instanceof StepRef r) {
            out.add(r.id());
        } else if (v instanceof StepList list) {
            for (StepValue item : list.items()) {
                collectRefs(item, out);
            }
        }
    }

    private StepValue field(int idx) {
        return (idx < 0 || idx >= fields.size()) ? null : fields.get(idx);
    }
}
