package com.codegraph.core.service.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * DTO for enhancement job submissions.
 *
 * Describes the repository to index and analyse.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EnhancementRequest {

    /**
     * Repository location: an https or ssh git URL, or a file: URL of a local checkout.
     */
    @NotBlank(message = "repoUrl is required")
    @Pattern(regexp = "^(https://|git@|file:).+", message = "repoUrl must start with https://, git@ or file:")
    private String repoUrl;

    /**
     * Branch to clone; the remote default branch when absent.
     */
    private String branch;

    /**
     * Commit to check out after cloning.
     */
    private String commit;

    /**
     * Languages to index (for example {@code python}); all supported languages when empty.
     */
    private List<String> languages;

    /**
     * Repository-relative paths to restrict indexing to.
     */
    private List<String> paths;

    /**
     * Glob patterns of files to skip.
     */
    private List<String> excludePatterns;

    /**
     * Stop after proposals are generated instead of publishing changes.
     */
    @Builder.Default
    private boolean dryRun = false;

    /**
     * Repository id the graph is stored under; defaults to the job id.
     */
    private String repoId;
}
