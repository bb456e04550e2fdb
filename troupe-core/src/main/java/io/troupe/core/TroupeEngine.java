package io.troupe.core;

import io.troupe.core.agent.AgentSpec;
import io.troupe.core.compose.AgentComposer;
import io.troupe.core.compose.AgentPlanning;
import io.troupe.core.compose.CompositionResult;
import io.troupe.core.execution.AgentResult;
import io.troupe.core.execution.CancellationToken;
import io.troupe.core.execution.CompositeExecutionListener;
import io.troupe.core.execution.ExecutionOutcome;
import io.troupe.core.execution.ExecutionPlan;
import io.troupe.core.execution.ExecutionScheduler;
import io.troupe.core.execution.PlanStatus;
import io.troupe.core.execution.ProgressSnapshot;
import io.troupe.core.execution.ProgressTracker;
import io.troupe.core.form.FormResponse;
import io.troupe.core.report.Report;
import io.troupe.core.report.ResultAggregator;
import io.troupe.core.result.EngineError;
import io.troupe.core.result.Result;
import io.troupe.core.run.RunRecord;
import io.troupe.core.run.RunRepository;
import io.troupe.core.template.Template;
import io.troupe.core.template.TemplateSource;
import java.io.Serial;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs a template end to end: load, compose, execute, aggregate, save.
 *
 * <h2>Contracts</h2>
 *
 * <ul>
 *   <li>Only configuration errors abort a run, and only before it starts: unknown or invalid
 *       templates, unusable category definitions
 *   <li>Once started, a run always yields a {@link RunRecord} with a report, even when every
 *       agent failed or the plan was rejected
 *   <li>The previous report of the same template, if any, sets the trend
 * </ul>
 *
 * @implNote Thread-safe. Concurrent runs share the scheduler, the circuit breakers and the run
 *     repository.
 */
public class TroupeEngine {

    private static final Logger logger = Logger.getLogger(TroupeEngine.class.getName());

    private final TemplateSource templateSource;
    private final AgentComposer composer;
    private final ExecutionScheduler scheduler;
    private final ResultAggregator aggregator;
    private final RunRepository runRepository;
    private final ExecutorService submitExecutor;
    private final Clock clock;
    private final Map<String, ProgressTracker> trackers = new ConcurrentHashMap<>();
    private final Map<String, ProgressSnapshot> finished;

    /**
     * Creates an engine.
     *
     * @param retainedRuns number of finished runs whose final progress stays pollable, not
     *     negative; older ones are evicted first
     */
    public TroupeEngine(
            TemplateSource templateSource,
            AgentComposer composer,
            ExecutionScheduler scheduler,
            ResultAggregator aggregator,
            RunRepository runRepository,
            ExecutorService submitExecutor,
            Clock clock,
            int retainedRuns) {
        this.templateSource = Objects.requireNonNull(templateSource, "templateSource required");
        this.composer = Objects.requireNonNull(composer, "composer must not be null");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
        this.aggregator = Objects.requireNonNull(aggregator, "aggregator must not be null");
        this.runRepository = Objects.requireNonNull(runRepository, "runRepository required");
        this.submitExecutor = Objects.requireNonNull(submitExecutor, "submitExecutor required");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        if (retainedRuns < 0) {
            throw new IllegalArgumentException("retainedRuns must not be negative");
        }
        this.finished =
                Collections.synchronizedMap(
                        new LinkedHashMap<>() {
                            @Serial private static final long serialVersionUID = 1L;

                            @Override
                            protected boolean removeEldestEntry(
                                    Map.Entry<String, ProgressSnapshot> eldest) {
                                return size() > retainedRuns;
                            }
                        });
    }

    public RunRecord run(String templateId, FormResponse response) {
        return run(templateId, response, RunOptions.defaults());
    }

    /**
     * Runs a template synchronously.
     *
     * @param templateId template to run, not null
     * @param response user answers, not null
     * @param options run options, not null
     * @return the finished run, never null
     * @throws io.troupe.core.template.TemplateNotFoundException if the template is unknown
     * @throws io.troupe.core.template.TemplateInvalidException if the template is invalid
     * @throws IllegalArgumentException if the options' categories are unusable
     */
    public RunRecord run(String templateId, FormResponse response, RunOptions options) {
        Template template = prepare(templateId, response, options);
        String runId = newRunId();
        ProgressTracker tracker = track(runId, options);
        return execute(runId, template, response, options, CancellationToken.none(), tracker);
    }

    /**
     * Starts a run in the background. Configuration errors are thrown from this call, not
     * through the future.
     *
     * @param templateId template to run, not null
     * @param response user answers, not null
     * @param options run options, not null
     * @return handle to poll, cancel or await the run, never null
     * @throws io.troupe.core.template.TemplateNotFoundException if the template is unknown
     * @throws io.troupe.core.template.TemplateInvalidException if the template is invalid
     * @throws IllegalArgumentException if the options' categories are unusable
     */
    public ExecutionHandle submit(String templateId, FormResponse response, RunOptions options) {
        Template template = prepare(templateId, response, options);
        String runId = newRunId();
        ProgressTracker tracker = track(runId, options);
        CancellationToken cancellation = new CancellationToken();
        CompletableFuture<RunRecord> future;
        try {
            future =
                    CompletableFuture.supplyAsync(
                            () ->
                                    execute(
                                            runId,
                                            template,
                                            response,
                                            options,
                                            cancellation,
                                            tracker),
                            submitExecutor);
        } catch (RejectedExecutionException e) {
            trackers.remove(runId);
            throw e;
        }
        return new ExecutionHandle(runId, future, cancellation, tracker);
    }

    /**
     * Polls the progress of a run started by this engine.
     *
     * <p>A running execution reports live progress. Once it settles, its final snapshot stays
     * available until it is among the oldest beyond the retained-runs limit.
     *
     * @param executionId run id, not null
     * @return latest progress, empty for unknown or evicted ids
     */
    public Optional<ProgressSnapshot> progress(String executionId) {
        ProgressTracker tracker = trackers.get(executionId);
        if (tracker != null) {
            return Optional.of(tracker.snapshot());
        }
        return Optional.ofNullable(finished.get(executionId));
    }

    private Template prepare(String templateId, FormResponse response, RunOptions options) {
        Objects.requireNonNull(templateId, "templateId must not be null");
        Objects.requireNonNull(response, "response must not be null");
        Objects.requireNonNull(options, "options must not be null");
        aggregator
                .validateCategories(options.getCategories())
                .ifPresent(
                        problem -> {
                            throw new IllegalArgumentException("Invalid categories: " + problem);
                        });
        return templateSource.load(templateId);
    }

    private ProgressTracker track(String runId, RunOptions options) {
        ProgressTracker tracker = new ProgressTracker(runId, options.getListener());
        trackers.put(runId, tracker);
        return tracker;
    }

    private RunRecord execute(
            String runId,
            Template template,
            FormResponse response,
            RunOptions options,
            CancellationToken cancellation,
            ProgressTracker tracker) {
        try {
            return doExecute(runId, template, response, options, cancellation, tracker);
        } catch (RuntimeException e) {
            tracker.stage(ProgressTracker.STAGE_FAILED);
            logger.log(Level.SEVERE, "Run " + runId + " failed", e);
            throw e;
        } finally {
            settle(runId, tracker);
        }
    }

    private void settle(String runId, ProgressTracker tracker) {
        finished.put(runId, tracker.snapshot());
        trackers.remove(runId);
    }

    private RunRecord doExecute(
            String runId,
            Template template,
            FormResponse response,
            RunOptions options,
            CancellationToken cancellation,
            ProgressTracker tracker) {
        logger.info("Starting run " + runId + " of template " + template.getId());
        tracker.stage(ProgressTracker.STAGE_COMPOSING);
        CompositionResult composition = composer.compose(template, response);
        List<String> warnings =
                new ArrayList<>(AgentPlanning.validateDependencies(composition.specs()));

        Map<String, Object> context = new LinkedHashMap<>(options.getInitialContext());
        context.put("template_id", template.getId());
        context.put("response_id", response.getResponseId());
        ExecutionPlan plan =
                ExecutionPlan.builder()
                        .planId(runId)
                        .specs(composition.specs())
                        .strategy(options.getStrategy())
                        .initialContext(context)
                        .build();

        Instant startedAt = clock.instant();
        Result<ExecutionOutcome> executed =
                scheduler.execute(
                        plan,
                        new CompositeExecutionListener(tracker, options.getListener()),
                        cancellation);
        ExecutionOutcome outcome;
        if (executed instanceof Result.Ok<ExecutionOutcome> ok) {
            outcome = ok.value();
        } else {
            EngineError error = executed.toError().orElseThrow();
            logger.warning("Plan " + runId + " rejected: " + error);
            warnings.add("Plan rejected: " + error.message());
            outcome = rejectedOutcome(plan, error, startedAt);
        }

        tracker.stage(ProgressTracker.STAGE_AGGREGATING);
        Double previousScore =
                runRepository
                        .findPreviousReport(template.getId())
                        .map(Report::getOverallScore)
                        .orElse(null);
        Report report =
                aggregator
                        .aggregate(
                                outcome.results(),
                                options.getCategories(),
                                previousScore,
                                options.getReportKind())
                        .orElseThrow()
                        .toBuilder()
                        .runId(runId)
                        .templateId(template.getId())
                        .build();

        RunRecord record =
                new RunRecord(
                        runId,
                        template.getId(),
                        response,
                        composition,
                        outcome,
                        report,
                        outcome.allAttempts(),
                        warnings);
        runRepository.save(record);
        tracker.stage(ProgressTracker.STAGE_COMPLETED);
        logger.info(
                "Run "
                        + runId
                        + " completed: "
                        + String.format("%.1f", report.getOverallScore())
                        + " ("
                        + report.getGrade()
                        + ")");
        return record;
    }

    /** Outcome for a plan the scheduler refused: every agent fails with the plan error. */
    private ExecutionOutcome rejectedOutcome(
            ExecutionPlan plan, EngineError error, Instant startedAt) {
        List<AgentResult> results = new ArrayList<>();
        for (AgentSpec spec : plan.getSpecs()) {
            results.add(
                    AgentResult.failed(
                            spec,
                            error.kind(),
                            error.message(),
                            Map.of(),
                            null,
                            List.of(),
                            List.of()));
        }
        return new ExecutionOutcome(
                plan.getPlanId(),
                plan.getStrategy(),
                PlanStatus.COMPLETED,
                results,
                0,
                startedAt,
                clock.instant());
    }

    private static String newRunId() {
        return "run-" + UUID.randomUUID().toString().substring(0, 12);
    }
}
