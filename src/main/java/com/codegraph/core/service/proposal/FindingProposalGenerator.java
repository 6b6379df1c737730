package com.codegraph.core.service.proposal;

import com.codegraph.core.service.analysis.Finding;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;

/**
 * Proposes one fix per finding, most severe findings first.
 */
@Slf4j
@Component
public class FindingProposalGenerator implements ProposalGenerator {

    @Override
    public List<ChangeProposal> generate(List<Finding> findings, int limit) {
        List<ChangeProposal> proposals = findings.stream()
                .sorted(Comparator.comparing(Finding::severity).reversed())
                .limit(Math.max(limit, 0))
                .map(this::toProposal)
                .toList();
        log.debug("Generated {} proposals from {} findings", proposals.size(), findings.size());
        return proposals;
    }

    private ChangeProposal toProposal(Finding finding) {
        return ChangeProposal.builder()
                .id(UUID.nameUUIDFromBytes(("proposal:" + finding.id()).getBytes(StandardCharsets.UTF_8)).toString())
                .findingId(finding.id())
                .repoId(finding.repoId())
                .title("Fix " + finding.title())
                .rationale(finding.description())
                .filePath(finding.filePath())
                .priority(finding.severity())
                .build();
    }
}
