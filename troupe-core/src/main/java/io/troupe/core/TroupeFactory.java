package io.troupe.core;

import io.troupe.core.agent.AgentRuntime;
import io.troupe.core.compose.AgentComposer;
import io.troupe.core.execution.AgentExecutor;
import io.troupe.core.execution.ExecutionScheduler;
import io.troupe.core.report.ResultAggregator;
import io.troupe.core.role.DefaultRoleRegistry;
import io.troupe.core.role.RoleRegistry;
import io.troupe.core.routing.CircuitBreakerTable;
import io.troupe.core.routing.TierRouter;
import io.troupe.core.run.InMemoryRunRepository;
import io.troupe.core.run.RunRepository;
import io.troupe.core.template.InMemoryTemplateSource;
import io.troupe.core.template.TemplateSource;
import io.troupe.core.template.TemplateValidator;
import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;
import java.util.Objects;
import java.util.Properties;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Logger;

/**
 * Creates {@link TroupeEnvironment} instances.
 *
 * <p>The only mandatory collaborator is the {@link AgentRuntime}. Everything else defaults to
 * the in-memory implementations and the built-in role handlers:
 *
 * <pre>{@code
 * try (TroupeEnvironment env = TroupeFactory.builder()
 *         .config(TroupeConfig.fromProperties(props))
 *         .agentRuntime(runtime)
 *         .templateSource(templates)
 *         .build()) {
 *     RunRecord run = env.getEngine().run("release-prep", response);
 * }
 * }</pre>
 */
public final class TroupeFactory {

    private static final Logger logger = Logger.getLogger(TroupeFactory.class.getName());

    public static final String DEFAULT_PROPERTIES = "troupe.properties";

    private TroupeFactory() {}

    public static TroupeEnvironment createEnvironment(AgentRuntime runtime) {
        return builder().agentRuntime(runtime).build();
    }

    public static TroupeEnvironment createEnvironment(TroupeConfig config, AgentRuntime runtime) {
        return builder().config(config).agentRuntime(runtime).build();
    }

    /**
     * Loads {@value #DEFAULT_PROPERTIES} from the classpath, falling back to defaults when absent.
     *
     * @return loaded config, never null
     * @throws IllegalStateException if the resource exists but cannot be read
     */
    public static TroupeConfig loadConfig() {
        Properties properties = new Properties();
        try (InputStream in =
                TroupeFactory.class.getClassLoader().getResourceAsStream(DEFAULT_PROPERTIES)) {
            if (in == null) {
                logger.fine("No " + DEFAULT_PROPERTIES + " on classpath, using defaults");
                return new TroupeConfig();
            }
            properties.load(in);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read " + DEFAULT_PROPERTIES, e);
        }
        return TroupeConfig.fromProperties(properties);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private TroupeConfig config = new TroupeConfig();
        private AgentRuntime agentRuntime;
        private RoleRegistry roleRegistry;
        private TemplateSource templateSource;
        private RunRepository runRepository;
        private ExecutorService executorService;
        private Clock clock = Clock.systemUTC();

        private Builder() {}

        public Builder config(TroupeConfig config) {
            this.config = config;
            return this;
        }

        public Builder agentRuntime(AgentRuntime agentRuntime) {
            this.agentRuntime = agentRuntime;
            return this;
        }

        public Builder roleRegistry(RoleRegistry roleRegistry) {
            this.roleRegistry = roleRegistry;
            return this;
        }

        /**
         * Sets the template source. Defaults to an empty {@link InMemoryTemplateSource} validated
         * against the role registry.
         */
        public Builder templateSource(TemplateSource templateSource) {
            this.templateSource = templateSource;
            return this;
        }

        public Builder runRepository(RunRepository runRepository) {
            this.runRepository = runRepository;
            return this;
        }

        /** Sets the worker pool. It must not bound its thread count: agent tasks wait on it. */
        public Builder executorService(ExecutorService executorService) {
            this.executorService = executorService;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public TroupeEnvironment build() {
            Objects.requireNonNull(config, "config must not be null");
            Objects.requireNonNull(agentRuntime, "agentRuntime must not be null");
            Objects.requireNonNull(clock, "clock must not be null");

            RoleRegistry roles =
                    roleRegistry != null ? roleRegistry : DefaultRoleRegistry.withBuiltins();
            TemplateSource templates =
                    templateSource != null
                            ? templateSource
                            : new InMemoryTemplateSource(new TemplateValidator(roles));
            RunRepository runs =
                    runRepository != null ? runRepository : new InMemoryRunRepository();
            ExecutorService executor =
                    executorService != null
                            ? executorService
                            : Executors.newCachedThreadPool(new DaemonThreadFactory());

            TierRouter router =
                    new TierRouter(
                            config.toProviderCatalog(),
                            new CircuitBreakerTable(config.toCircuitBreakerConfig(), clock));
            AgentExecutor agentExecutor =
                    new AgentExecutor(
                            router,
                            agentRuntime,
                            executor,
                            config.getAttemptTimeout(),
                            config.getCooldownWait(),
                            clock);
            ExecutionScheduler scheduler =
                    new ExecutionScheduler(
                            agentExecutor,
                            executor,
                            config.getMaxWorkers(),
                            config.getMaxRefinementRounds(),
                            clock);
            AgentComposer composer = new AgentComposer(roles);
            ResultAggregator aggregator =
                    new ResultAggregator(
                            roles,
                            clock,
                            config.getTrendEpsilon(),
                            config.getSmallMargin(),
                            config.getWideMargin());
            TroupeEngine engine =
                    new TroupeEngine(
                            templates,
                            composer,
                            scheduler,
                            aggregator,
                            runs,
                            executor,
                            clock,
                            config.getRetainedRuns());

            logger.info(
                    "Troupe environment ready: maxWorkers="
                            + config.getMaxWorkers()
                            + ", attemptTimeout="
                            + config.getAttemptTimeout()
                            + ", roles="
                            + roles.roles().size());
            return new TroupeEnvironment(
                    config,
                    engine,
                    composer,
                    scheduler,
                    aggregator,
                    router,
                    roles,
                    templates,
                    runs,
                    executor);
        }
    }

    private static final class DaemonThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable task) {
            Thread thread = new Thread(task, "troupe-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
