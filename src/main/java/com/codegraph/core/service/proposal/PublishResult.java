package com.codegraph.core.service.proposal;

/**
 * Outcome of handing proposals to a {@link ChangePublisher}.
 */
public record PublishResult(
        boolean published,
        Integer pullRequestId,
        String pullRequestUrl,
        String message
) {

    public static PublishResult notPublished(String reason) {
        return new PublishResult(false, null, null, reason);
    }
}
