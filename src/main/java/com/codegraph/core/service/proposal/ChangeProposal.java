package com.codegraph.core.service.proposal;

import com.codegraph.core.service.analysis.Severity;
import lombok.Builder;

/**
 * A suggested change derived from one finding.
 */
@Builder
public record ChangeProposal(
        String id,
        String findingId,
        String repoId,
        String title,
        String rationale,
        String filePath,
        Severity priority
) {
}
