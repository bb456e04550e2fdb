package io.troupe.core.role;

import java.util.Optional;
import java.util.Set;

/**
 * Role name to {@link RoleHandler} lookup, populated at startup.
 *
 * @see DefaultRoleRegistry
 */
public interface RoleRegistry {

    /**
     * Registers a handler, replacing any handler for the same role.
     *
     * @param handler handler to register, not null
     */
    void register(RoleHandler handler);

    Optional<RoleHandler> find(String role);

    boolean isRegistered(String role);

    Set<String> roles();
}
