package io.troupe.core.role;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/**
 * Thread-safe {@link RoleRegistry} backed by a {@link ConcurrentHashMap}.
 *
 * <p>{@link #withBuiltins()} registers the analysis roles that feed the default score
 * categories together with generic handlers for the pipeline roles used by the bundled
 * templates.
 */
public class DefaultRoleRegistry implements RoleRegistry {

    private static final Logger logger = Logger.getLogger(DefaultRoleRegistry.class.getName());

    /** Pipeline roles that only report a generic {@code score}. */
    public static final Set<String> GENERIC_ROLES =
            Set.of(
                    "test_runner",
                    "publisher",
                    "package_builder",
                    "version_manager",
                    "changelog_updater",
                    "writer",
                    "reviewer");

    private final Map<String, RoleHandler> handlers = new ConcurrentHashMap<>();

    public static DefaultRoleRegistry withBuiltins() {
        DefaultRoleRegistry registry = new DefaultRoleRegistry();
        registry.register(new SecurityRoleHandler());
        registry.register(new CoverageRoleHandler());
        registry.register(new QualityRoleHandler());
        registry.register(new DocumentationRoleHandler());
        registry.register(new PerformanceRoleHandler());
        for (String role : GENERIC_ROLES) {
            registry.register(new GenericRoleHandler(role));
        }
        return registry;
    }

    @Override
    public void register(RoleHandler handler) {
        Objects.requireNonNull(handler, "handler must not be null");
        RoleHandler previous = handlers.put(handler.role(), handler);
        if (previous != null) {
            logger.warning("Replaced handler for role: " + handler.role());
        }
    }

    @Override
    public Optional<RoleHandler> find(String role) {
        return Optional.ofNullable(handlers.get(role));
    }

    @Override
    public boolean isRegistered(String role) {
        return handlers.containsKey(role);
    }

    @Override
    public Set<String> roles() {
        return Set.copyOf(handlers.keySet());
    }
}
