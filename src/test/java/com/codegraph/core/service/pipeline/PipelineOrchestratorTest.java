package com.codegraph.core.service.pipeline;

import com.codegraph.core.service.api.dto.EnhancementRequest;
import com.codegraph.core.service.ingest.RepoSpec;
import com.codegraph.core.service.model.Language;
import com.codegraph.core.service.model.Symbol;
import com.codegraph.core.service.store.GraphStore;
import org.assertj.core.api.InstanceOfAssertFactories;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.awaitility.Awaitility.await;

/**
 * Runs enhancement jobs end to end against local directories and the in-memory store.
 */
@SpringBootTest
@ActiveProfiles("test")
class PipelineOrchestratorTest {

    @Autowired
    private PipelineOrchestrator orchestrator;

    @Autowired
    private EnhancementPipeline pipeline;

    @Autowired
    private JobRegistry jobRegistry;

    @Autowired
    private GraphStore graphStore;

    @TempDir
    Path repo;

    @Test
    @DisplayName("A submitted job indexes the repository and resolves calls across files")
    void completesJobAndResolvesCrossFileCalls() throws IOException {
        write("pkg/a.py", """
                class Foo:
                    def bar(self):
                        pass
                """);
        write("pkg/b.py", """
                def baz():
                    bar()
                    unknown()
                """);
        write("notes.txt", "not source\n");

        Job submitted = orchestrator.submit(request("repo-cross-file"));
        assertThat(submitted.status()).isEqualTo(JobStatus.PENDING);
        assertThat(submitted.repoId()).isEqualTo("repo-cross-file");

        Job finished = awaitTerminal(submitted.id());

        assertThat(finished.status()).isEqualTo(JobStatus.COMPLETED);
        assertThat(finished.progress()).isEqualTo(1.0);
        assertThat(finished.startedAt()).isNotNull();

        assertThat(finished.result().get("summary"))
                .asInstanceOf(InstanceOfAssertFactories.MAP)
                .containsEntry("files", 2)
                .containsEntry("symbols", 3)
                .containsEntry("failedUnits", 0)
                .containsEntry("unresolvedCalls", 1)
                .extractingByKey("filesByLanguage")
                .asInstanceOf(InstanceOfAssertFactories.MAP)
                .containsEntry("python", 2);
        assertThat(finished.result().get("findings"))
                .asInstanceOf(InstanceOfAssertFactories.MAP)
                .containsOnlyKeys("static", "dynamic", "mutation");
        assertThat(finished.result()).doesNotContainKey("pullRequest");

        assertThat(graphStore.callGraph("repo-cross-file")).containsEntry("baz", List.of("bar"));
        assertThat(graphStore.getSymbolsByFile("repo-cross-file", "pkg/a.py"))
                .extracting(Symbol::name)
                .containsExactly("Foo", "bar");
    }

    @Test
    @DisplayName("TypeScript sources are parsed, extracted and linked across files")
    void completesTypeScriptJob() throws IOException {
        write("src/service.ts", """
                import { helper } from './util';

                export class Service extends Base {
                  run(input: string): void {
                    helper(input);
                  }
                }

                export function main(): void {
                  new Service().run('x');
                }
                """);
        write("src/util.ts", """
                export function helper(value: string): string {
                  return value;
                }
                """);

        EnhancementRequest request = EnhancementRequest.builder()
                .repoUrl(repo.toUri().toString())
                .repoId("repo-typescript")
                .languages(List.of("typescript"))
                .dryRun(true)
                .build();
        Job finished = awaitTerminal(orchestrator.submit(request).id());

        assertThat(finished.status()).isEqualTo(JobStatus.COMPLETED);
        assertThat(finished.result().get("summary"))
                .asInstanceOf(InstanceOfAssertFactories.MAP)
                .containsEntry("files", 2)
                .containsEntry("symbols", 4)
                .containsEntry("unresolvedCalls", 0);

        assertThat(graphStore.getSymbolsByFile("repo-typescript", "src/service.ts"))
                .extracting(Symbol::name, Symbol::language)
                .containsExactly(
                        tuple("Service", Language.TYPESCRIPT),
                        tuple("run", Language.TYPESCRIPT),
                        tuple("main", Language.TYPESCRIPT));
        assertThat(graphStore.callGraph("repo-typescript")).containsEntry("main", List.of("helper", "run"));
    }

    @Test
    @DisplayName("Resubmitting the same repository does not duplicate the graph")
    void resubmissionIsIdempotent() throws IOException {
        write("main.py", """
                def main():
                    helper()

                def helper():
                    pass
                """);

        awaitTerminal(orchestrator.submit(request("repo-idempotent")).id());
        long symbols = graphStore.countSymbols("repo-idempotent");
        long edges = graphStore.countEdges("repo-idempotent");

        Job second = awaitTerminal(orchestrator.submit(request("repo-idempotent")).id());

        assertThat(second.status()).isEqualTo(JobStatus.COMPLETED);
        assertThat(symbols).isEqualTo(2);
        assertThat(graphStore.countSymbols("repo-idempotent")).isEqualTo(symbols);
        assertThat(graphStore.countEdges("repo-idempotent")).isEqualTo(edges);
    }

    @Test
    @DisplayName("A repository that cannot be acquired fails the job")
    void failsWhenRepositoryIsMissing() {
        EnhancementRequest request = EnhancementRequest.builder()
                .repoUrl(repo.resolve("missing").toUri().toString())
                .dryRun(true)
                .build();

        Job submitted = orchestrator.submit(request);
        Job finished = awaitTerminal(submitted.id());

        assertThat(submitted.repoId()).isEqualTo(submitted.id());
        assertThat(finished.status()).isEqualTo(JobStatus.FAILED);
        assertThat(finished.errorMessage()).contains("missing");
    }

    @Test
    @DisplayName("A cancellation request stops the job at the next stage boundary")
    void cancelledRunEndsCancelled() throws IOException {
        write("a.py", "def a():\n    pass\n");
        String jobId = "cancel-" + System.nanoTime();
        jobRegistry.create(Job.pending(jobId, JobKind.ENHANCEMENT, "repo-cancelled", Map.of()));
        var spec = new RepoSpec("repo-cancelled", repo.toUri().toString(), null, null, Set.of(), List.of(), List.of());

        pipeline.run(new JobWorkItem(jobId, spec, true), () -> true);

        Job job = orchestrator.getStatus(jobId);
        assertThat(job.status()).isEqualTo(JobStatus.CANCELLED);
        assertThat(job.completedAt()).isNotNull();
        assertThat(graphStore.countSymbols("repo-cancelled")).isZero();
    }

    @Test
    @DisplayName("A cancellation request during extraction stops before the next file")
    void cancellationBetweenFiles() throws IOException {
        write("a.py", "def a():\n    pass\n");
        write("b.py", "def b():\n    pass\n");
        write("c.py", "def c():\n    pass\n");
        String jobId = "cancel-files-" + System.nanoTime();
        jobRegistry.create(Job.pending(jobId, JobKind.ENHANCEMENT, "repo-cancel-files", Map.of()));
        var spec = new RepoSpec("repo-cancel-files", repo.toUri().toString(), null, null, Set.of(), List.of(), List.of());

        // requested as soon as the first file is stored
        pipeline.run(new JobWorkItem(jobId, spec, true), () -> graphStore.countSymbols("repo-cancel-files") > 0);

        assertThat(orchestrator.getStatus(jobId).status()).isEqualTo(JobStatus.CANCELLED);
        assertThat(graphStore.getSymbolsByRepo("repo-cancel-files"))
                .extracting(Symbol::name)
                .containsExactly("a");
    }

    @Test
    @DisplayName("Cancelling a finished job returns it unchanged")
    void cancelFinishedJobIsNoOp() throws IOException {
        write("a.py", "def a():\n    pass\n");
        Job finished = awaitTerminal(orchestrator.submit(request("repo-finished")).id());

        Job afterCancel = orchestrator.cancel(finished.id());

        assertThat(afterCancel.status()).isEqualTo(JobStatus.COMPLETED);
        assertThat(orchestrator.list()).extracting(Job::id).contains(finished.id());
    }

    // ==================== Helper Methods ====================

    private Job awaitTerminal(String jobId) {
        await().atMost(30, TimeUnit.SECONDS)
                .pollInterval(50, TimeUnit.MILLISECONDS)
                .until(() -> orchestrator.getStatus(jobId).isTerminal());
        return orchestrator.getStatus(jobId);
    }

    private EnhancementRequest request(String repoId) {
        return EnhancementRequest.builder()
                .repoUrl(repo.toUri().toString())
                .repoId(repoId)
                .languages(List.of("python"))
                .dryRun(true)
                .build();
    }

    private void write(String relativePath, String content) throws IOException {
        Path file = repo.resolve(relativePath);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
    }
}
