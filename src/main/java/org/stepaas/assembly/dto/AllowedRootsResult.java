package org.stepaas.assembly.dto;

import java.util.List;

public record AllowedRootsResult(
        List<AllowedRoot> roots
) {
}
