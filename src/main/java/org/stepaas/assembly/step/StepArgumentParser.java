package org.stepaas.assembly.step;

import org.stepaas.assembly.step.StepValue.StepEnum;
import org.stepaas.assembly.step.StepValue.StepList;
import org.stepaas.assembly.step.StepValue.StepNull;
import org.stepaas.assembly.step.StepValue.StepNumber;
import org.stepaas.assembly.step.StepValue.StepRef;
import org.stepaas.assembly.step.StepValue.StepString;
import org.stepaas.assembly.step.StepValue.StepTyped;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * STEP 参数表达式解析器（尽力而为）。
 * <p>
 * 输入是实体括号内的参数文本（不含最外层括号），输出 {@link StepValue} 列表。
 * 不依赖正则；遇到无法识别的字符时跳过并返回 {@link StepNull}，不会抛异常。
 */
final class StepArgumentParser {

    private final String text;
    private int i = 0;

    private StepArgumentParser(String text) {
        this.text = text;
    }

    static List<StepValue> parse(String argsText) {
        if (argsText == null || argsText.isBlank()) {
            return List.of();
        }
        StepArgumentParser p = new StepArgumentParser(argsText);
        List<StepValue> out = new ArrayList<>();
        p.parseSequence(out, false);
        return out;
    }

    /**
     * 解析以逗号分隔的值序列；{@code closed=true} 时在 ')' 处结束并消费它。
     */
    private void parseSequence(List<StepValue> out, boolean closed) {
        skipWs();
        if (closed && peek() == ')') {
            i++;
            return;
        }
        while (!eof()) {
            out.add(parseValue());
            skipWs();
            if (peek() == ',') {
                i++;
                continue;
            }
            if (closed && peek() == ')') {
                i++;
            }
            return;
        }
    }

    private StepValue parseValue() {
        skipWs();
        if (eof()) {
            return new StepNull();
        }
        char c = peek();
        if (c == '$' || c == '*') {
            i++;
            return new StepNull();
        }
        if (c == '#') {
            i++;
            Integer id = parseInt();
            return (id == null) ? new StepNull() : new StepRef(id);
        }
        if (c == '\'') {
            return new StepString(parseString());
        }
        if (c == '(') {
            i++;
            List<StepValue> items = new ArrayList<>();
            parseSequence(items, true);
            return new StepList(items);
        }
        if (c == '.' && i + 1 < text.length() && Character.isLetter(text.charAt(i + 1))) {
            return new StepEnum(parseEnum());
        }
        if (Character.isLetter(c) || c == '_') {
            String ident = parseIdent().toUpperCase(Locale.ROOT);
            skipWs();
            if (peek() != '(') {
                return new StepEnum(ident);
            }
            i++;
            List<StepValue> inner = new ArrayList<>();
            parseSequence(inner, true);
            return new StepTyped(ident, inner);
        }
        if (c == '+' || c == '-' || c == '.' || Character.isDigit(c)) {
            return parseNumber();
        }
        i++;
        return new StepNull();
    }

    private StepNumber parseNumber() {
        int start = i;
        while (!eof() && "0123456789+-.EeDd".indexOf(peek()) >= 0) {
            i++;
        }
        String raw = text.substring(start, i);
        Double value;
        try {
            value = Double.parseDouble(raw.replace('D', 'E').replace('d', 'E'));
        } catch (NumberFormatException e) {
            value = null;
        }
        return new StepNumber(raw, value);
    }

    private String parseEnum() {
        int start = i;
        i++;
        while (!eof() && peek() != '.') {
            i++;
        }
        if (!eof()) {
            i++;
        }
        return text.substring(start, i);
    }

    private String parseIdent() {
        int start = i;
        i++;
        while (!eof() && (Character.isLetterOrDigit(peek()) || peek() == '_')) {
            i++;
        }
        return text.substring(start, i);
    }

    private String parseString() {
        i++;
        StringBuilder raw = new StringBuilder();
        while (!eof()) {
            char c = peek();
            if (c == '\'') {
                if (i + 1 < text.length() && text.charAt(i + 1) == '\'') {
                    raw.append('\'');
                    i += 2;
                    continue;
                }
                i++;
                break;
            }
            raw.append(c);
            i++;
        }
        return StepStrings.decodeEscapes(raw.toString());
    }

    private Integer parseInt() {
        int start = i;
        while (!eof() && Character.isDigit(peek())) {
            i++;
        }
        if (i == start) {
            return null;
        }
        try {
            return Integer.parseInt(text.substring(start, i));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private void skipWs() {
        while (!eof() && Character.isWhitespace(peek())) {
            i++;
        }
    }

    private boolean eof() {
        return i >= text.length();
    }

    private char peek() {
        return eof() ? '\0' : text.charAt(i);
    }
}
