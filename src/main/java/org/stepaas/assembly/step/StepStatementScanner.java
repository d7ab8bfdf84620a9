package org.stepaas.assembly.step;

import java.util.Locale;
import java.util.function.Predicate;

/**
 * DATA 段语句扫描器：逐条定位 {@code #id=TYPE(...);}，语句可跨多行。
 * <p>
 * 扫描规则（尽力而为）：
 * <ul>
 *   <li>括号配对与分号结束判断都会跳过字符串字面量（含 {@code ''} 转义）内部的字符</li>
 *   <li>括号不配对、缺少 '=' 或类型名、缺少结束分号的语句视为畸形，计数后丢弃，继续扫描后续语句</li>
 *   <li>复合实例 {@code #id=(A() B());} 不在模型范围内，直接跳过（不计为畸形）</li>
 *   <li>只有 {@code typeFilter} 接受的类型才会解析参数，其余语句仅做定位</li>
 * </ul>
 */
public final class StepStatementScanner {

    private StepStatementScanner() {
    }

    @FunctionalInterface
    public interface Visitor {
        void visit(StepEntity entity);
    }

    /**
     * @param scanned 成功定位的语句数
     * @param dropped 畸形而被丢弃的语句数
     */
    public record ScanStats(int scanned, int dropped) {
    }

    public static ScanStats scan(String text, Predicate<String> typeFilter, Visitor visitor) {
        if (text == null || text.isEmpty()) {
            return new ScanStats(0, 0);
        }
        int dataStart = StepStrings.indexOfIgnoreCase(text, "DATA;", 0);
        int cursor = (dataStart < 0) ? 0 : dataStart + "DATA;".length();
        int scanned = 0;
        int dropped = 0;

        while (cursor < text.length()) {
            int hash = text.indexOf('#', cursor);
            if (hash < 0) {
                break;
            }
            Statement st = locate(text, hash);
            if (st == null) {
                cursor = hash + 1;
                continue;
            }
            if (st.malformed()) {
                dropped++;
                cursor = hash + 1;
                continue;
            }
            cursor = st.nextIndex();
            if (st.type() == null) {
                continue;
            }
            scanned++;
            if (typeFilter.test(st.type())) {
                visitor.visit(new StepEntity(st.id(), st.type(), StepArgumentParser.parse(st.args())));
            }
        }
        return new ScanStats(scanned, dropped);
    }

    private record Statement(int id, String type, String args, int nextIndex, boolean malformed) {
    }

    /**
     * 从 '#' 开始尝试定位一条语句；返回 null 表示该 '#' 不是语句起点（例如参数里的引用）。
     */
    private static Statement locate(String text, int start) {
        int i = start + 1;
        int idStart = i;
        while (i < text.length() && Character.isDigit(text.charAt(i))) {
            i++;
        }
        if (i == idStart) {
            return null;
        }
        int id;
        try {
            id = Integer.parseInt(text.substring(idStart, i));
        } catch (NumberFormatException e) {
            return null;
        }
        i = skipWs(text, i);
        if (i >= text.length() || text.charAt(i) != '=') {
            return null;
        }
        i = skipWs(text, i + 1);
        if (i < text.length() && text.charAt(i) == '(') {
            int close = findMatchingParen(text, i);
            if (close < 0) {
                return new Statement(id, null, null, i, true);
            }
            int end = findStatementEnd(text, close + 1);
            return new Statement(id, null, null, (end < 0 ? close : end) + 1, false);
        }
        int typeStart = i;
        while (i < text.length() && (Character.isLetterOrDigit(text.charAt(i)) || text.charAt(i) == '_')) {
            i++;
        }
        if (i == typeStart) {
            return new Statement(id, null, null, i, true);
        }
        String type = text.substring(typeStart, i).toUpperCase(Locale.ROOT);
        i = skipWs(text, i);
        if (i >= text.length() || text.charAt(i) != '(') {
            return new Statement(id, null, null, i, true);
        }
        int close = findMatchingParen(text, i);
        if (close < 0) {
            return new Statement(id, null, null, i, true);
        }
        int end = findStatementEnd(text, close + 1);
        if (end < 0) {
            // 缺少结束分号：只丢弃本条，从下一个 '#' 继续
            return new Statement(id, null, null, close + 1, true);
        }
        return new Statement(id, type, text.substring(i + 1, close), end + 1, false);
    }

    private static int skipWs(String text, int from) {
        int i = from;
        while (i < text.length() && Character.isWhitespace(text.charAt(i))) {
            i++;
        }
        return i;
    }

    static int findMatchingParen(String text, int open) {
        int depth = 0;
        boolean inString = false;
        for (int i = open; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inString) {
                if (c == '\'') {
                    if (i + 1 < text.length() && text.charAt(i + 1) == '\'') {
                        i++;
                    } else {
                        inString = false;
                    }
                }
                continue;
            }
            if (c == '\'') {
                inString = true;
            } else if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            } else if (c == ';' && looksLikeNextStatement(text, i + 1)) {
                // 语句结束符之后紧跟下一条 "#id=" 说明当前语句括号不配对
                return -1;
            }
        }
        return -1;
    }

    private static boolean looksLikeNextStatement(String text, int from) {
        int i = skipWs(text, from);
        if (i >= text.length()) {
            return true;
        }
        if (text.charAt(i) != '#') {
            return text.regionMatches(true, i, "ENDSEC", 0, "ENDSEC".length());
        }
        int j = i + 1;
        while (j < text.length() && Character.isDigit(text.charAt(j))) {
            j++;
        }
        if (j == i + 1) {
            return false;
        }
        j = skipWs(text, j);
        return j < text.length() && text.charAt(j) == '=';
    }

    private static int findStatementEnd(String text, int from) {
        boolean inString = false;
        int depth = 0;
        for (int i = Math.max(0, from); i < text.length(); i++) {
            char c = text.charAt(i);
            if (inString) {
                if (c == '\'') {
                    if (i + 1 < text.length() && text.charAt(i + 1) == '\'') {
                        i++;
                    } else {
                        inString = false;
                    }
                }
                continue;
            }
            if (c == '\'') {
                inString = true;
            } else if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth = Math.max(0, depth - 1);
            } else if (depth == 0) {
                if (c == ';') {
                    return i;
                }
                if ((c == '#' || c == 'E' || c == 'e') && looksLikeNextStatement(text, i)) {
                    return -1;
                }
            }
        }
        return -1;
    }
}
