package com.codegraph.core.service.ingest;

/**
 * Makes a repository available locally and disposes of it afterwards.
 */
public interface RepositoryAcquirer {

    /**
     * @throws RepositoryAcquisitionException if the repository cannot be obtained;
     *         partially created directories have been removed by then
     */
    AcquiredRepository acquire(RepoSpec spec);

    /**
     * Releases the repository. Safe to call more than once; failures are logged, not thrown.
     */
    void release(AcquiredRepository repository);
}
