package com.codegraph.core.service.pipeline;

import com.codegraph.core.service.analysis.AnalysisCategory;
import com.codegraph.core.service.analysis.AnalysisContext;
import com.codegraph.core.service.analysis.Finding;
import com.codegraph.core.service.analysis.RepositoryAnalyzer;
import com.codegraph.core.service.config.CodeGraphConfig;
import com.codegraph.core.service.config.MetricsConfig;
import com.codegraph.core.service.config.PipelineConfig;
import com.codegraph.core.service.extract.ExtractionResult;
import com.codegraph.core.service.extract.SymbolExtractor;
import com.codegraph.core.service.ingest.AcquiredRepository;
import com.codegraph.core.service.ingest.ParseUnit;
import com.codegraph.core.service.ingest.RepositoryAcquirer;
import com.codegraph.core.service.ingest.RepositoryIndexer;
import com.codegraph.core.service.model.Edge;
import com.codegraph.core.service.model.EdgeKind;
import com.codegraph.core.service.model.Symbol;
import com.codegraph.core.service.parse.SourceParserRegistry;
import com.codegraph.core.service.parse.SyntaxNode;
import com.codegraph.core.service.proposal.ChangeProposal;
import com.codegraph.core.service.proposal.ChangePublisher;
import com.codegraph.core.service.proposal.ProposalGenerator;
import com.codegraph.core.service.proposal.PublishResult;
import com.codegraph.core.service.store.GraphStore;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.BooleanSupplier;

/**
 * Runs one enhancement job through its stages: acquire, index, extract and store,
 * resolve cross-file calls, analyse, propose and publish.
 *
 * Cancellation is cooperative and checked between stages and between files.
 * The acquired repository is released on every exit path.
 */
@Slf4j
@Component
public class EnhancementPipeline {

    static final double PROGRESS_ACQUIRE = 0.1;
    static final double PROGRESS_INDEX = 0.2;
    static final double PROGRESS_EXTRACT_START = 0.3;
    static final double PROGRESS_EXTRACT_END = 0.4;
    static final double PROGRESS_RESOLVE = 0.45;
    static final double PROGRESS_RANK = 0.8;
    static final double PROGRESS_PROPOSE = 0.9;
    static final double PROGRESS_PUBLISH = 0.95;

    private static final Map<AnalysisCategory, Double> ANALYSIS_PROGRESS = Map.of(
            AnalysisCategory.STATIC, 0.5,
            AnalysisCategory.DYNAMIC, 0.6,
            AnalysisCategory.MUTATION, 0.7);

    private final JobRegistry jobRegistry;
    private final RepositoryAcquirer repositoryAcquirer;
    private final RepositoryIndexer repositoryIndexer;
    private final SourceParserRegistry parserRegistry;
    private final SymbolExtractor symbolExtractor;
    private final CrossFileCallResolver callResolver;
    private final GraphStore graphStore;
    private final List<RepositoryAnalyzer> analyzers;
    private final ProposalGenerator proposalGenerator;
    private final ChangePublisher changePublisher;
    private final PipelineConfig pipelineConfig;
    private final CodeGraphConfig codeGraphConfig;
    private final MetricsConfig metricsConfig;
    private final Executor extractionExecutor;

    public EnhancementPipeline(JobRegistry jobRegistry,
                               RepositoryAcquirer repositoryAcquirer,
                               RepositoryIndexer repositoryIndexer,
                               SourceParserRegistry parserRegistry,
                               SymbolExtractor symbolExtractor,
                               CrossFileCallResolver callResolver,
                               GraphStore graphStore,
                               List<RepositoryAnalyzer> analyzers,
                               ProposalGenerator proposalGenerator,
                               ChangePublisher changePublisher,
                               PipelineConfig pipelineConfig,
                               CodeGraphConfig codeGraphConfig,
                               MetricsConfig metricsConfig,
                               @Qualifier("extractionExecutor") Executor extractionExecutor) {
        this.jobRegistry = jobRegistry;
        this.repositoryAcquirer = repositoryAcquirer;
        this.repositoryIndexer = repositoryIndexer;
        this.parserRegistry = parserRegistry;
        this.symbolExtractor = symbolExtractor;
        this.callResolver = callResolver;
        this.graphStore = graphStore;
        this.analyzers = analyzers;
        this.proposalGenerator = proposalGenerator;
        this.changePublisher = changePublisher;
        this.pipelineConfig = pipelineConfig;
        this.codeGraphConfig = codeGraphConfig;
        this.metricsConfig = metricsConfig;
        this.extractionExecutor = extractionExecutor;
    }

    /**
     * Runs the job described by the work item. Never throws: the outcome is recorded in
     * the job registry as completed, failed or cancelled.
     *
     * @param cancelRequested polled between stages and between files
     */
    public void run(JobWorkItem item, BooleanSupplier cancelRequested) {
        String jobId = item.jobId();
        Job job = jobRegistry.markRunning(jobId);
        if (job.status() != JobStatus.RUNNING) {
            log.info("Skipping job {} in state {}", jobId, job.status());
            return;
        }

        log.info("Starting job {} for {}", jobId, item.repoSpec().url());
        Timer.Sample sample = Timer.start(metricsConfig.getRegistry());
        AcquiredRepository repository = null;
        try {
            var stage = new Stage(jobId, cancelRequested);

            stage.enter(PROGRESS_ACQUIRE, "Cloning repository");
            repository = repositoryAcquirer.acquire(item.repoSpec());

            stage.enter(PROGRESS_INDEX, "Indexing repository");
            List<ParseUnit> units = repositoryIndexer.index(repository.getPath(), item.repoSpec());

            stage.enter(PROGRESS_EXTRACT_START, "Parsing " + units.size() + " files");
            var stats = extractAndStore(stage, units);

            stage.enter(PROGRESS_RESOLVE, "Resolving cross-file calls");
            resolveCalls(units, stats);

            Map<AnalysisCategory, List<Finding>> findings = analyze(stage, job.repoId(), repository, units);

            stage.enter(PROGRESS_RANK, "Ranking findings");
            List<Finding> allFindings = new ArrayList<>();
            findings.values().forEach(allFindings::addAll);

            stage.enter(PROGRESS_PROPOSE, "Generating change proposals");
            List<ChangeProposal> proposals = proposalGenerator.generate(allFindings, pipelineConfig.getMaxProposals());

            PublishResult publishResult = null;
            if (!item.dryRun() && !proposals.isEmpty()) {
                stage.enter(PROGRESS_PUBLISH, "Publishing changes");
                publishResult = changePublisher.publish(repository, proposals);
            }
            stage.check();

            jobRegistry.complete(jobId, buildResult(findings, proposals, stats, publishResult));
            metricsConfig.getJobsCompleted().increment();
            log.info("Job {} completed: {} files, {} symbols, {} edges, {} findings",
                    jobId, stats.files, stats.symbols, stats.edges, allFindings.size());
        } catch (PipelineException e) {
            if (PipelineException.JOB_CANCELLED.equals(e.getErrorCode())) {
                jobRegistry.cancel(jobId);
                metricsConfig.getJobsCancelled().increment();
                log.info("Job {} cancelled", jobId);
            } else {
                markFailed(jobId, e);
            }
        } catch (RuntimeException e) {
            markFailed(jobId, e);
        } finally {
            if (repository != null) {
                repositoryAcquirer.release(repository);
            }
            sample.stop(metricsConfig.getJobTimer());
        }
    }

    // ==================== Extraction ====================

    private ExtractionStats extractAndStore(Stage stage, List<ParseUnit> units) {
        // extraction runs in parallel, writes happen in file order
        List<CompletableFuture<Boolean>> futures = units.stream()
                .map(unit -> CompletableFuture.supplyAsync(() -> extract(unit), extractionExecutor))
                .toList();

        var stats = new ExtractionStats();
        stats.files = units.size();
        double span = PROGRESS_EXTRACT_END - PROGRESS_EXTRACT_START;
        for (int i = 0; i < units.size(); i++) {
            stage.check();
            ParseUnit unit = units.get(i);
            stats.filesByLanguage.merge(unit.getLanguage().getValue(), 1, Integer::sum);
            boolean extracted = futures.get(i).join();
            if (extracted) {
                store(unit, stats);
            } else {
                stats.failedUnits++;
            }
            stage.progress(PROGRESS_EXTRACT_START + span * (i + 1) / units.size(),
                    "Parsing file " + (i + 1) + "/" + units.size());
        }
        return stats;
    }

    /**
     * Parses and extracts one file. Failures stay local to the file.
     *
     * @return whether extraction output was recorded
     */
    private boolean extract(ParseUnit unit) {
        Timer.Sample sample = Timer.start(metricsConfig.getRegistry());
        try {
            Optional<SyntaxNode> tree = parserRegistry.parse(unit.getContent(), unit.getLanguage());
            if (tree.isEmpty()) {
                log.debug("No parser for {} ({}), skipping", unit.getFilePath(), unit.getLanguage().getValue());
            }
            ExtractionResult result = tree
                    .map(root -> symbolExtractor.extract(root, unit.getFilePath(), unit.getLanguage(), unit.getRepoId()))
                    .orElseGet(ExtractionResult::empty);
            unit.recordExtraction(tree.orElse(null), result);
            return true;
        } catch (RuntimeException e) {
            metricsConfig.getExtractionFailures().increment();
            log.warn("Failed to parse {}: {}", unit.getFilePath(), e.getMessage());
            return false;
        } finally {
            sample.stop(metricsConfig.getExtractionTimer());
        }
    }

    private void store(ParseUnit unit, ExtractionStats stats) {
        boolean deferCalls = codeGraphConfig.getFeatures().isCrossFileResolutionEnabled();
        for (Symbol symbol : unit.getSymbols()) {
            graphStore.upsertSymbol(symbol);
            stats.symbols++;
            stats.symbolsByKind.merge(symbol.kind().getValue(), 1, Integer::sum);
        }
        for (Edge edge : unit.getEdges()) {
            if (deferCalls && isUnresolvedCall(edge)) {
                stats.pendingCalls.add(edge);
                continue;
            }
            graphStore.upsertEdge(edge);
            stats.edges++;
        }
        metricsConfig.getSymbolsWritten().increment(unit.getSymbols().size());
        log.debug("Stored {} symbols and {} edges from {}",
                unit.getSymbols().size(), unit.getEdges().size(), unit.getFilePath());
    }

    private static boolean isUnresolvedCall(Edge edge) {
        return edge.kind() == EdgeKind.CALLS && !edge.isResolved();
    }

    // ==================== Cross-File Resolution ====================

    private void resolveCalls(List<ParseUnit> units, ExtractionStats stats) {
        if (stats.pendingCalls.isEmpty()) {
            metricsConfig.getEdgesWritten().increment(stats.edges);
            return;
        }
        var resolution = callResolver.resolve(units, stats.pendingCalls);
        resolution.resolved().forEach(graphStore::upsertEdge);
        stats.edges += resolution.resolved().size();
        stats.unresolvedCalls = resolution.unresolved();
        metricsConfig.getEdgesWritten().increment(stats.edges);
        log.debug("Resolved {} cross-file calls, {} left unresolved",
                resolution.resolved().size(), resolution.unresolved());
    }

    // ==================== Analysis ====================

    private Map<AnalysisCategory, List<Finding>> analyze(Stage stage, String repoId,
                                                        AcquiredRepository repository, List<ParseUnit> units) {
        Map<AnalysisCategory, List<Finding>> findings = new LinkedHashMap<>();
        var context = new AnalysisContext(repoId, repository.getPath(), units, graphStore);

        for (AnalysisCategory category : AnalysisCategory.values()) {
            stage.enter(ANALYSIS_PROGRESS.get(category), "Running " + category.getValue() + " analysis");
            List<Finding> categoryFindings = new ArrayList<>();
            if (codeGraphConfig.getFeatures().isAnalysisEnabled()) {
                for (RepositoryAnalyzer analyzer : analyzers) {
                    if (analyzer.getCategory() == category) {
                        List<Finding> produced = analyzer.analyze(context);
                        log.debug("Analyzer {} produced {} findings", analyzer.getName(), produced.size());
                        categoryFindings.addAll(produced);
                    }
                }
            }
            findings.put(category, categoryFindings);
        }
        return findings;
    }

    // ==================== Result ====================

    private Map<String, Object> buildResult(Map<AnalysisCategory, List<Finding>> findings,
                                            List<ChangeProposal> proposals,
                                            ExtractionStats stats,
                                            PublishResult publishResult) {
        Map<String, Object> findingsByCategory = new LinkedHashMap<>();
        findings.forEach((category, list) -> findingsByCategory.put(category.getValue(), list));

        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("files", stats.files);
        summary.put("filesByLanguage", stats.filesByLanguage);
        summary.put("symbols", stats.symbols);
        summary.put("symbolsByKind", stats.symbolsByKind);
        summary.put("edges", stats.edges);
        summary.put("failedUnits", stats.failedUnits);
        summary.put("unresolvedCalls", stats.unresolvedCalls);

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("findings", findingsByCategory);
        result.put("proposals", proposals);
        result.put("summary", summary);
        if (publishResult != null) {
            result.put("pullRequest", publishResult);
        }
        return result;
    }

    private void markFailed(String jobId, RuntimeException e) {
        String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        jobRegistry.fail(jobId, message);
        metricsConfig.getJobsFailed().increment();
        log.error("Job {} failed: {}", jobId, message, e);
    }

    // ==================== Helper Types ====================

    /**
     * Progress reporting and cancellation checks for one running job.
     */
    private final class Stage {

        private final String jobId;
        private final BooleanSupplier cancelRequested;

        private Stage(String jobId, BooleanSupplier cancelRequested) {
            this.jobId = jobId;
            this.cancelRequested = cancelRequested;
        }

        void enter(double progress, String message) {
            check();
            progress(progress, message);
        }

        void progress(double progress, String message) {
            jobRegistry.updateProgress(jobId, progress, message);
        }

        void check() {
            if (cancelRequested.getAsBoolean()) {
                throw PipelineException.cancelled(jobId);
            }
        }
    }

    private static final class ExtractionStats {
        private int files;
        private final Map<String, Integer> filesByLanguage = new TreeMap<>();
        private int symbols;
        private final Map<String, Integer> symbolsByKind = new TreeMap<>();
        private int edges;
        private int failedUnits;
        private int unresolvedCalls;
        private final List<Edge> pendingCalls = new ArrayList<>();
    }
}
