package org.stepaas.assembly.step;

import org.stepaas.assembly.dto.step.StepHeader;
import org.stepaas.assembly.step.StepValue.StepList;
import org.stepaas.assembly.step.StepValue.StepString;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * STEP（ISO-10303-21）HEADER 段解析器（尽力而为）。
 * <p>
 * 只读取 {@code FILE_DESCRIPTION}/{@code FILE_NAME}/{@code FILE_SCHEMA} 三条语句；
 * 作者与组织用于装配结构根节点的元信息。字符串中的 {@code \X2\...\X0\} 等转义会被解码。
 */
public final class StepHeaderParser {

    private StepHeaderParser() {
    }

    private static final Pattern HEADER_START = Pattern.compile("(?is)\\bHEADER\\b\\s*;");
    private static final Pattern ENDSEC = Pattern.compile("(?is)\\bENDSEC\\b\\s*;");

    private static final Pattern FILE_DESCRIPTION = Pattern.compile("(?is)\\bFILE_DESCRIPTION\\b\\s*\\(");
    private static final Pattern FILE_NAME = Pattern.compile("(?is)\\bFILE_NAME\\b\\s*\\(");
    private static final Pattern FILE_SCHEMA = Pattern.compile("(?is)\\bFILE_SCHEMA\\b\\s*\\(");

    public static StepHeader parse(String stepText) {
        List<String> warnings = new ArrayList<>();
        if (stepText == null || stepText.isBlank()) {
            warnings.add("STEP 内容为空，无法解析。");
            return new StepHeader(null, null, null, null, null, null, null, null, null, null, warnings);
        }

        String header = extractHeaderSection(stepText, warnings);
        if (header == null) {
            return new StepHeader(null, null, null, null, null, null, null, null, null, null, warnings);
        }

        List<String> fileDescriptions = null;
        String implementationLevel = null;
        // FILE_DESCRIPTION((description_list), 'implementation_level')
        List<StepValue> description = statementArgs(header, FILE_DESCRIPTION);
        if (description != null) {
            fileDescriptions = strings(arg(description, 0));
            implementationLevel = string(arg(description, 1));
        } else {
            warnings.add("未找到 FILE_DESCRIPTION。");
        }

        String fileName = null;
        String timeStamp = null;
        List<String> authors = null;
        List<String> organizations = null;
        String preprocessorVersion = null;
        String originatingSystem = null;
        String authorization = null;
        // FILE_NAME(name, time_stamp, (author), (organization), preprocessor_version, originating_system, authorization)
        List<StepValue> name = statementArgs(header, FILE_NAME);
        if (name != null) {
            fileName = string(arg(name, 0));
            timeStamp = string(arg(name, 1));
            authors = strings(arg(name, 2));
            organizations = strings(arg(name, 3));
            preprocessorVersion = string(arg(name, 4));
            originatingSystem = string(arg(name, 5));
            authorization = string(arg(name, 6));
        } else {
            warnings.add("未找到 FILE_NAME。");
        }

        List<String> schemas = null;
        List<StepValue> schema = statementArgs(header, FILE_SCHEMA);
        if (schema != null) {
            schemas = strings(arg(schema, 0));
        } else {
            warnings.add("未找到 FILE_SCHEMA。");
        }

        return new StepHeader(
                fileDescriptions,
                StepStrings.blankToNull(implementationLevel),
                StepStrings.blankToNull(fileName),
                StepStrings.blankToNull(timeStamp),
                authors,
                organizations,
                StepStrings.blankToNull(preprocessorVersion),
                StepStrings.blankToNull(originatingSystem),
                StepStrings.blankToNull(authorization),
                schemas,
                warnings.isEmpty() ? null : warnings
        );
    }

    private static String extractHeaderSection(String stepText, List<String> warnings) {
        Matcher start = HEADER_START.matcher(stepText);
        if (!start.find()) {
            warnings.add("未找到 HEADER 段，文件可能不是有效的 STEP 物理文件。");
            return null;
        }
        int headerStart = start.end();
        Matcher end = ENDSEC.matcher(stepText);
        end.region(headerStart, stepText.length());
        if (!end.find()) {
            warnings.add("未找到 HEADER 段的 ENDSEC;，解析结果可能不完整。");
            return stepText.substring(headerStart);
        }
        return stepText.substring(headerStart, end.start());
    }

    private static List<StepValue> statementArgs(String header, Pattern statementStart) {
        Matcher m = statementStart.matcher(header);
        if (!m.find()) {
            return null;
        }
        int open = m.end() - 1;
        int close = StepStatementScanner.findMatchingParen(header, open);
        if (close < 0) {
            return null;
        }
        return StepArgumentParser.parse(header.substring(open + 1, close));
    }

    private static StepValue arg(List<StepValue> args, int idx) {
        return idx < args.size() ? args.get(idx) : null;
    }

    private static String string(StepValue v) {
        if (v instanceof StepString s) {
            return s.value();
        }
        if (v instanceof StepList list) {
            for (StepValue item : list.items()) {
                String nested = string(item);
                if (nested != null) {
                    return nested;
                }
            }
        }
        return null;
    }

    private static List<String> strings(StepValue v) {
        List<String> out = new ArrayList<>();
        collectStrings(v, out);
        return out.isEmpty() ? null : out;
    }

    private static void collectStrings(StepValue v, List<String> out) {
        if (v instanceof StepString s) {
            if (!s.value().isBlank()) {
                out.add(s.value());
            }
        } else if (v instanceof StepList list) {
            for (StepValue item : list.items()) {
                collectStrings(item, out);
            }
        }
    }
}
