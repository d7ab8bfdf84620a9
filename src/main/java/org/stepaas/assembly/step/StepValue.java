package org.stepaas.assembly.step;

import java.util.List;

/**
 * STEP 参数值（最小模型，覆盖实体解析所需的几种形态）。
 * <ul>
 *   <li>字符串：{@code 'text'}（已解码转义）</li>
 *   <li>引用：{@code #123}</li>
 *   <li>枚举：{@code .T.}</li>
 *   <li>数字：{@code 1.0E-3}</li>
 *   <li>列表：{@code (a,b,c)}</li>
 *   <li>带类型值：{@code LENGTH_MEASURE(10.)}</li>
 *   <li>空值：{@code $} / {@code *}</li>
 * </ul>
 */
public interface StepValue {

    record StepNull() implements StepValue {
    }

    record StepString(String value) implements StepValue {
    }

    record StepRef(int id) implements StepValue {
    }

    record StepEnum(String value) implements StepValue {
    }

    record StepNumber(String raw, Double value) implements StepValue {
    }

    record StepList(List<StepValue> items) implements StepValue {
    }

    record StepTyped(String typeUpper, List<StepValue> args) implements StepValue {
    }
}
