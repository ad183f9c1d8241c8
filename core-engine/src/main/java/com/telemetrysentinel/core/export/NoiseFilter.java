package com.telemetrysentinel.core.export;

import java.util.List;
import java.util.Objects;

/**
 * Drops faults whose message contains a known-noisy substring.
 *
 * @since 1.0.0
 */
public final class NoiseFilter {

    /** Browser and bundler noise that carries no actionable signal. */
    public static final List<String> DEFAULT_DENYLIST = List.of(
            "Script error",
            "Network request failed",
            "ChunkLoadError",
            "Loading chunk");

    private final List<String> denylist;

    public NoiseFilter() {
        this(DEFAULT_DENYLIST);
    }

    public NoiseFilter(List<String> denylist) {
        this.denylist = List.copyOf(Objects.requireNonNull(denylist, "denylist must not be null"));
    }

    /**
     * Matching is case-sensitive substring containment.
     *
     * @param message fault message; {@code null} is never noise
     * @return {@code true} if the fault must not reach the sink
     */
    public boolean isNoise(String message) {
        if (message == null) {
            return false;
        }
        for (String noise : denylist) {
            if (message.contains(noise)) {
                return true;
            }
        }
        return false;
    }

    public List<String> getDenylist() {
        return denylist;
    }
}
