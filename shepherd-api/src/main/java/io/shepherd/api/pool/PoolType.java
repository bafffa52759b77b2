package io.shepherd.api.pool;

import java.util.Objects;

/**
 * Descriptive classification of a pool, carried for logs and metrics only.
 * The manager never changes behavior based on it.
 */
public record PoolType(String value) {

    public static final PoolType WORKING = new PoolType("working");
    public static final PoolType SCHEDULER = new PoolType("scheduler");

    public PoolType {
        Objects.requireNonNull(value, "value");
        if (value.isBlank()) {
            throw new IllegalArgumentException("Pool type must not be blank");
        }
    }

    public static PoolType of(String value) {
        return new PoolType(value);
    }

    @Override
    public String toString() {
        return value;
    }
}
