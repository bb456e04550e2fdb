package io.troupe.core;

import io.troupe.core.compose.AgentComposer;
import io.troupe.core.execution.ExecutionScheduler;
import io.troupe.core.report.ResultAggregator;
import io.troupe.core.role.RoleRegistry;
import io.troupe.core.routing.TierRouter;
import io.troupe.core.run.RunRepository;
import io.troupe.core.template.TemplateSource;
import java.util.concurrent.ExecutorService;

/**
 * Wired engine components created by {@link TroupeFactory}.
 *
 * <p>Owns the worker pool shared by agent tasks, runtime calls and submitted runs; {@link
 * #close()} shuts it down.
 */
public final class TroupeEnvironment implements AutoCloseable {

    private final TroupeConfig config;
    private final TroupeEngine engine;
    private final AgentComposer composer;
    private final ExecutionScheduler scheduler;
    private final ResultAggregator aggregator;
    private final TierRouter router;
    private final RoleRegistry roleRegistry;
    private final TemplateSource templateSource;
    private final RunRepository runRepository;
    private final ExecutorService executorService;

    TroupeEnvironment(
            TroupeConfig config,
            TroupeEngine engine,
            AgentComposer composer,
            ExecutionScheduler scheduler,
            ResultAggregator aggregator,
            TierRouter router,
            RoleRegistry roleRegistry,
            TemplateSource templateSource,
            RunRepository runRepository,
            ExecutorService executorService) {
        this.config = config;
        this.engine = engine;
        this.composer = composer;
        this.scheduler = scheduler;
        this.aggregator = aggregator;
        this.router = router;
        this.roleRegistry = roleRegistry;
        this.templateSource = templateSource;
        this.runRepository = runRepository;
        this.executorService = executorService;
    }

    public TroupeConfig getConfig() {
        return config;
    }

    public TroupeEngine getEngine() {
        return engine;
    }

    public AgentComposer getComposer() {
        return composer;
    }

    public ExecutionScheduler getScheduler() {
        return scheduler;
    }

    public ResultAggregator getAggregator() {
        return aggregator;
    }

    public TierRouter getRouter() {
        return router;
    }

    public RoleRegistry getRoleRegistry() {
        return roleRegistry;
    }

    public TemplateSource getTemplateSource() {
        return templateSource;
    }

    public RunRepository getRunRepository() {
        return runRepository;
    }

    @Override
    public void close() {
        executorService.shutdown();
    }
}
