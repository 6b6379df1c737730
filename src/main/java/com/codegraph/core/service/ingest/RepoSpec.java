package com.codegraph.core.service.ingest;

import com.codegraph.core.service.model.Language;

import java.util.List;
import java.util.Set;

/**
 * What to acquire and which of its files to index.
 */
public record RepoSpec(
        String repoId,
        String url,
        String branch,
        String commit,
        Set<Language> languages,
        List<String> paths,
        List<String> excludePatterns
) {

    public RepoSpec {
        languages = languages == null ? Set.of() : Set.copyOf(languages);
        paths = paths == null ? List.of() : List.copyOf(paths);
        excludePatterns = excludePatterns == null ? List.of() : List.copyOf(excludePatterns);
    }

    public boolean hasBranch() {
        return branch != null && !branch.isBlank();
    }

    public boolean hasCommit() {
        return commit != null && !commit.isBlank();
    }
}
