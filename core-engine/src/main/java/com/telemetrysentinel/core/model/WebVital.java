package com.telemetrysentinel.core.model;

import java.util.Locale;

/**
 * Well-known browser performance metrics and their rating thresholds.
 *
 * @since 1.0.0
 */
public enum WebVital {

    /** First Contentful Paint. */
    FCP(1800, 3000, 4000, "ms"),
    /** Largest Contentful Paint. */
    LCP(2500, 4000, 5000, "ms"),
    /** First Input Delay. */
    FID(100, 300, 500, "ms"),
    /** Cumulative Layout Shift, a unitless score. */
    CLS(0.1, 0.25, 0.4, "score"),
    /** Time To First Byte. */
    TTFB(600, 1000, 1500, "ms"),
    /** Time To Interactive. */
    TTI(3800, 7300, 10000, "ms");

    private final PerformanceThreshold thresholds;
    private final String unit;

    WebVital(double target, double warning, double critical, String unit) {
        this.thresholds = PerformanceThreshold.of(target, warning, critical);
        this.unit = unit;
    }

    public PerformanceThreshold thresholds() {
        return thresholds;
    }

    public String unit() {
        return unit;
    }

    /**
     * @param name metric name, case-insensitive
     * @return the matching vital
     * @throws IllegalArgumentException if the name is not a known web vital
     */
    public static WebVital fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Web vital name must not be blank");
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown web vital: '" + name
                    + "'. Supported: FCP, LCP, FID, CLS, TTFB, TTI", e);
        }
    }
}
