package com.codegraph.core.service.proposal;

import com.codegraph.core.service.ingest.AcquiredRepository;

import java.util.List;

/**
 * Applies proposals to a working copy and opens a pull request.
 */
public interface ChangePublisher {

    PublishResult publish(AcquiredRepository repository, List<ChangeProposal> proposals);
}
