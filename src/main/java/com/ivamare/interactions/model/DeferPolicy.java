package com.ivamare.interactions.model;

import java.time.Duration;

/**
 * Auto-defer policy.
 *
 * <p>At handler level every field is nullable and a null field inherits the
 * client default. {@link #resolve(DeferPolicy)} merges field by field.
 *
 * @param enabled Whether the handler is raced against the defer timer
 * @param timeout How long to wait before acknowledging with a deferral
 * @param ephemeral Whether the deferred acknowledgment is only visible to the invoking user
 */
public record DeferPolicy(
    Boolean enabled,
    Duration timeout,
    Boolean ephemeral
) {
    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(2);

    public DeferPolicy {
        if (timeout != null && timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must not be negative");
        }
    }

    /**
     * Client default: auto-defer disabled, 2 second timeout, public acknowledgment.
     *
     * @return default policy
     */
    public static DeferPolicy defaults() {
        return new DeferPolicy(false, DEFAULT_TIMEOUT, false);
    }

    /**
     * Handler-level policy that inherits every field.
     *
     * @return inheriting policy
     */
    public static DeferPolicy inherit() {
        return new DeferPolicy(null, null, null);
    }

    public static DeferPolicy enabled(Duration timeout, boolean ephemeral) {
        return new DeferPolicy(true, timeout, ephemeral);
    }

    public static DeferPolicy disabled() {
        return new DeferPolicy(false, null, null);
    }

    /**
     * Resolve this handler-level policy against the client default.
     *
     * @param defaults client default, expected to be fully populated
     * @return policy with no null fields
     */
    public DeferPolicy resolve(DeferPolicy defaults) {
        return new DeferPolicy(
            enabled != null ? enabled : defaultIfNull(defaults.enabled, false),
            timeout != null ? timeout : defaultIfNull(defaults.timeout, DEFAULT_TIMEOUT),
            ephemeral != null ? ephemeral : defaultIfNull(defaults.ephemeral, false)
        );
    }

    public boolean isEnabled() {
        return Boolean.TRUE.equals(enabled);
    }

    public boolean isEphemeral() {
        return Boolean.TRUE.equals(ephemeral);
    }

    private static <T> T defaultIfNull(T value, T fallback) {
        return value != null ? value : fallback;
    }
}
