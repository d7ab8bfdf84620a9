package org.stepaas.assembly.step;

import java.util.Locale;

/**
 * STEP 字符串工具：转义解码与大小写无关的查找。
 */
public final class StepStrings {

    private StepStrings() {
    }

    /**
     * 解码 STEP 字符串中的非 ASCII 转义。
     * <ul>
     *   <li>{@code \X2\....\X0\}：UCS-2，每 4 位十六进制一个 16-bit code unit</li>
     *   <li>{@code \X4\....\X0\}：UCS-4，每 8 位十六进制一个 code point</li>
     *   <li>{@code \X\hh}：单字节（ISO-8859-1）</li>
     * </ul>
     * 例：{@code '\X2\00E4\X0\'} -> "ä"。无法识别的序列原样保留。
     */
    public static String decodeEscapes(String value) {
        if (value == null || value.indexOf('\\') < 0) {
            return value;
        }
        StringBuilder out = new StringBuilder(value.length());
        int len = value.length();
        int i = 0;
        while (i < len) {
            char c = value.charAt(i);
            boolean escape = c == '\\' && i + 2 < len && (value.charAt(i + 1) == 'X' || value.charAt(i + 1) == 'x');
            if (!escape) {
                out.append(c);
                i++;
                continue;
            }
            char mode = value.charAt(i + 2);
            if ((mode == '2' || mode == '4') && i + 3 < len && value.charAt(i + 3) == '\\') {
                int seqStart = i + 4;
                int end = indexOfEndMarker(value, seqStart);
                String decoded = (end < 0) ? null : decodeHex(value.substring(seqStart, end), mode == '4' ? 8 : 4);
                if (decoded != null) {
                    out.append(decoded);
                    i = end + 4;
                    continue;
                }
            }
            if (mode == '\\' && i + 4 < len) {
                int hi = Character.digit(value.charAt(i + 3), 16);
                int lo = Character.digit(value.charAt(i + 4), 16);
                if (hi >= 0 && lo >= 0) {
                    out.append((char) ((hi << 4) | lo));
                    i += 5;
                    continue;
                }
            }
            out.append(c);
            i++;
        }
        return out.toString();
    }

    private static int indexOfEndMarker(String text, int from) {
        return indexOfIgnoreCase(text, "\\X0\\", from);
    }

    private static String decodeHex(String hexText, int group) {
        StringBuilder hex = new StringBuilder(hexText.length());
        for (int i = 0; i < hexText.length(); i++) {
            char c = hexText.charAt(i);
            if (Character.digit(c, 16) >= 0) {
                hex.append(c);
            }
        }
        int usable = hex.length() - (hex.length() % group);
        if (usable <= 0) {
            return null;
        }
        StringBuilder out = new StringBuilder(usable / group);
        for (int i = 0; i < usable; i += group) {
            int codePoint = Integer.parseInt(hex.substring(i, i + group), 16);
            if (group == 4) {
                out.append((char) codePoint);
            } else if (Character.isValidCodePoint(codePoint)) {
                out.appendCodePoint(codePoint);
            }
        }
        return out.toString();
    }

    public static boolean containsIgnoreCase(String text, String needle) {
        return indexOfIgnoreCase(text, needle, 0) >= 0;
    }

    public static int indexOfIgnoreCase(String text, String needle, int fromIndex) {
        if (text == null || needle == null) {
            return -1;
        }
        int limit = text.length() - needle.length();
        for (int i = Math.max(0, fromIndex); i <= limit; i++) {
            if (text.regionMatches(true, i, needle, 0, needle.length())) {
                return i;
            }
        }
        return -1;
    }

    public static String blankToNull(String value) {
        return (value == null || value.isBlank()) ? null : value;
    }

    public static String upper(String value) {
        return value == null ? null : value.toUpperCase(Locale.ROOT);
    }
}
