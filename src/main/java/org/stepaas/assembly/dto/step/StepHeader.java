package org.stepaas.assembly.dto.step;

import java.util.List;

/**
 * STEP HEADER 段信息（FILE_DESCRIPTION / FILE_NAME / FILE_SCHEMA）。
 * <p>
 * 字段缺失时为 null；warnings 为空时为 null。
 */
public record StepHeader(
        List<String> fileDescriptions,
        String implementationLevel,
        String fileName,
        String timeStamp,
        List<String> authors,
        List<String> organizations,
        String preprocessorVersion,
        String originatingSystem,
        String authorization,
        List<String> schemas,
        List<String> warnings
) {

    public String firstAuthor() {
        return first(authors);
    }

    public String firstOrganization() {
        return first(organizations);
    }

    private static String first(List<String> values) {
        if (values == null) {
            return null;
        }
        for (String v : values) {
            if (v != null && !v.isBlank()) {
                return v;
            }
        }
        return null;
    }
}
