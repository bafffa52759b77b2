package io.shepherd.core.manager;

import io.shepherd.api.pool.Pool;
import io.shepherd.api.pool.PoolType;

import java.util.Objects;

/**
 * Administrative request consumed exactly once by the manager's control loop.
 */
sealed interface PoolCommand {

    String name();

    record Start(String name, PoolType type, Pool pool) implements PoolCommand {
        public Start {
            requireName(name);
            Objects.requireNonNull(type, "type");
            Objects.requireNonNull(pool, "pool");
        }
    }

    record Stop(String name) implements PoolCommand {
        public Stop {
            requireName(name);
        }
    }

    static void requireName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Pool name must not be blank");
        }
    }
}
