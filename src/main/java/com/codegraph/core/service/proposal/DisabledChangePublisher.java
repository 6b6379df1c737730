package com.codegraph.core.service.proposal;

import com.codegraph.core.service.ingest.AcquiredRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Publisher used when no pull-request integration is configured; records that nothing was published.
 */
@Slf4j
@Component
public class DisabledChangePublisher implements ChangePublisher {

    @Override
    public PublishResult publish(AcquiredRepository repository, List<ChangeProposal> proposals) {
        log.info("Publishing disabled, {} proposals for {} not applied", proposals.size(), repository.getUrl());
        return PublishResult.notPublished("Change publishing is not configured");
    }
}
