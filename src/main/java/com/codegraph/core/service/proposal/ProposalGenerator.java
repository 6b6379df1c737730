package com.codegraph.core.service.proposal;

import com.codegraph.core.service.analysis.Finding;

import java.util.List;

/**
 * Turns findings into change proposals.
 */
public interface ProposalGenerator {

    /**
     * @param findings all findings of the job
     * @param limit maximum number of proposals
     */
    List<ChangeProposal> generate(List<Finding> findings, int limit);
}
