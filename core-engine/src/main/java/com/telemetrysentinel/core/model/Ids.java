package com.telemetrysentinel.core.model;

import java.time.Instant;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Generates identifiers of the form {@code <kind>_<epochMillis>_<random>}.
 *
 * <p>
 * The random part is nine base-36 characters, enough to keep ids unique
 * within one millisecond across ingestion threads.
 * </p>
 *
 * @since 1.0.0
 */
public final class Ids {

    private static final int RANDOM_CHARS = 9;
    private static final char[] ALPHABET = "0123456789abcdefghijklmnopqrstuvwxyz".toCharArray();

    private Ids() {
        // utility class, not instantiable
    }

    public static String error(Instant at) {
        return generate("err", at);
    }

    public static String performance(Instant at) {
        return generate("perf", at);
    }

    public static String pattern(Instant at) {
        return generate("pattern", at);
    }

    public static String correlation(Instant at) {
        return generate("corr", at);
    }

    private static String generate(String kind, Instant at) {
        ThreadLocalRandom random = ThreadLocalRandom.current();
        StringBuilder sb = new StringBuilder(kind.length() + 24)
                .append(kind).append('_').append(at.toEpochMilli()).append('_');
        for (int i = 0; i < RANDOM_CHARS; i++) {
            sb.append(ALPHABET[random.nextInt(ALPHABET.length)]);
        }
        return sb.toString();
    }
}
