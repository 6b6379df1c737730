package com.codegraph.core.service.ingest;

import com.codegraph.core.service.config.PipelineConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.jgit.api.CloneCommand;
import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.api.errors.GitAPIException;
import org.eclipse.jgit.api.errors.JGitInternalException;
import org.eclipse.jgit.lib.ObjectId;
import org.springframework.stereotype.Component;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Clones repositories with JGit into a per-job temporary directory.
 *
 * A {@code file:} URL that points at a plain directory (no {@code .git}) is indexed in place
 * and never deleted.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GitRepositoryAcquirer implements RepositoryAcquirer {

    private static final String FILE_SCHEME = "file:";
    private static final String DEFAULT_NAME = "repository";

    private final PipelineConfig pipelineConfig;

    // ==================== RepositoryAcquirer Interface ====================

    @Override
    public AcquiredRepository acquire(RepoSpec spec) {
        if (spec.url().startsWith(FILE_SCHEME)) {
            Path local = localPath(spec.url());
            if (Files.isDirectory(local) && !Files.isDirectory(local.resolve(".git"))) {
                log.info("Using local directory {} in place", local);
                return new AcquiredRepository(local, spec.url(), spec.branch(), spec.commit(), false);
            }
        }
        return cloneRepository(spec);
    }

    @Override
    public void release(AcquiredRepository repository) {
        if (!repository.markReleased()) {
            log.debug("Repository {} already released", repository.getPath());
            return;
        }
        if (!repository.isTemporary()) {
            return;
        }
        try {
            FileSystemUtils.deleteRecursively(repository.getPath());
            log.info("Cleaned up clone directory: {}", repository.getPath());
        } catch (IOException e) {
            log.warn("Failed to clean up clone directory {}: {}", repository.getPath(), e.getMessage());
        }
    }

    // ==================== Cloning ====================

    private AcquiredRepository cloneRepository(RepoSpec spec) {
        Path destination = createWorkspace(repoName(spec.url()), spec.url());
        log.info("Cloning repository {} into {}", spec.url(), destination);

        try (Git git = cloneCommand(spec, destination).call()) {
            if (spec.hasCommit()) {
                log.info("Checking out commit {}", spec.commit());
                git.checkout().setName(spec.commit()).call();
            }
            ObjectId head = git.getRepository().resolve("HEAD");
            String commit = head != null ? head.getName() : spec.commit();
            String branch = spec.hasBranch() ? spec.branch() : git.getRepository().getBranch();

            log.info("Successfully cloned {} at {}", spec.url(), commit);
            return new AcquiredRepository(destination, spec.url(), branch, commit, true);
        } catch (GitAPIException | JGitInternalException | IOException e) {
            log.error("Failed to clone repository {}: {}", spec.url(), e.getMessage());
            FileSystemUtils.deleteRecursively(destination.toFile());
            throw new RepositoryAcquisitionException(
                    "Failed to clone repository " + spec.url() + ": " + e.getMessage(), spec.url(), e);
        }
    }

    private CloneCommand cloneCommand(RepoSpec spec, Path destination) {
        CloneCommand command = Git.cloneRepository()
                .setURI(spec.url())
                .setDirectory(destination.toFile())
                .setTimeout(pipelineConfig.getCloneTimeoutSeconds());
        if (spec.hasBranch()) {
            command.setBranch(spec.branch());
        }
        return command;
    }

    private Path createWorkspace(String repoName, String url) {
        String prefix = "codegraph_" + repoName + "_";
        String workspaceDir = pipelineConfig.getWorkspaceDir();
        try {
            if (workspaceDir == null || workspaceDir.isBlank()) {
                return Files.createTempDirectory(prefix);
            }
            Path base = Files.createDirectories(Path.of(workspaceDir));
            return Files.createTempDirectory(base, prefix);
        } catch (IOException e) {
            throw new RepositoryAcquisitionException("Cannot create workspace for " + url, url, e);
        }
    }

    // ==================== Helpers ====================

    static String repoName(String url) {
        String trimmed = url.replaceAll("/+$", "");
        int separator = Math.max(trimmed.lastIndexOf('/'), trimmed.lastIndexOf(':'));
        String name = trimmed.substring(separator + 1);
        if (name.endsWith(".git")) {
            name = name.substring(0, name.length() - 4);
        }
        name = name.replaceAll("[^A-Za-z0-9._-]", "_");
        return name.isEmpty() ? DEFAULT_NAME : name;
    }

    private static Path localPath(String url) {
        try {
            return Path.of(URI.create(url));
        } catch (IllegalArgumentException e) {
            return Path.of(url.substring(FILE_SCHEME.length()));
        }
    }
}
