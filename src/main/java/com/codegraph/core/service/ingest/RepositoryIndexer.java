package com.codegraph.core.service.ingest;

import java.nio.file.Path;
import java.util.List;

/**
 * Turns an acquired repository into the ordered list of files to parse.
 */
public interface RepositoryIndexer {

    /**
     * @param root repository root
     * @param spec path, exclude and language filters
     * @return parse units ordered by repository-relative path
     */
    List<ParseUnit> index(Path root, RepoSpec spec);
}
