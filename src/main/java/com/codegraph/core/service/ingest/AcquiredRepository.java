package com.codegraph.core.service.ingest;

import lombok.Getter;

import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A repository made available on the local file system for the duration of one job.
 */
@Getter
public class AcquiredRepository {

    private final Path path;
    private final String url;
    private final String branch;
    private final String commit;

    /**
     * Whether the directory was created for this job and must be deleted on release.
     */
    private final boolean temporary;

    private final AtomicBoolean released = new AtomicBoolean(false);

    public AcquiredRepository(Path path, String url, String branch, String commit, boolean temporary) {
        this.path = path;
        this.url = url;
        this.branch = branch;
        this.commit = commit;
        this.temporary = temporary;
    }

    /**
     * Flags the repository as released.
     *
     * @return true for the first call only
     */
    boolean markReleased() {
        return released.compareAndSet(false, true);
    }

    public boolean isReleased() {
        return released.get();
    }
}
