package com.telemetrysentinel.core.detection;

import com.telemetrysentinel.core.model.AnomalyDetection;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link AnomalyDetector}.
 */
class AnomalyDetectorTest {

    private AnomalyDetector detector;

    @BeforeEach
    void setUp() {
        detector = new AnomalyDetector(2.0, 100);
    }

    @Test
    @DisplayName("Threshold is 2 + sensitivity / 10")
    void shouldDeriveThresholdFromSensitivity() {
        assertThat(detector.threshold()).isCloseTo(2.2, within(1e-9));
        assertThat(new AnomalyDetector(0, 10).threshold()).isEqualTo(2.0);
    }

    @Test
    @DisplayName("Should never flag the first nine samples of a key, whatever their values")
    void shouldSuppressDuringColdStart() {
        double[] wild = {1, 1_000_000, 3, 0.0001, 99_999, 5, -42, 7e9, 9};
        for (double v : wild) {
            AnomalyDetection result = detector.evaluate("LCP", "checkout", v);
            assertThat(result.isDetected()).isFalse();
            assertThat(result.getReason()).isEqualTo("insufficient baseline data");
        }
    }

    @Test
    @DisplayName("Should not flag a value equal to a constant baseline")
    void shouldNotFlagMatchingConstant() {
        for (int i = 0; i < 10; i++) {
            detector.evaluate("LCP", "checkout", 100);
        }

        AnomalyDetection result = detector.evaluate("LCP", "checkout", 100);

        assertThat(result.isDetected()).isFalse();
        assertThat(result.getBaseline()).isEqualTo(100.0);
        assertThat(result.getDeviation()).isZero();
    }

    @Test
    @DisplayName("Should flag a large jump over a constant baseline")
    void shouldFlagOutlierOverConstantBaseline() {
        for (int i = 0; i < 10; i++) {
            detector.evaluate("LCP", "checkout", 100);
        }

        AnomalyDetection result = detector.evaluate("LCP", "checkout", 1000);

        assertThat(result.isDetected()).isTrue();
        assertThat(result.getConfidence()).isGreaterThan(0).isLessThanOrEqualTo(1);
        assertThat(result.getDeviation()).isPositive();
        assertThat(result.getReason()).contains("standard deviations");
    }

    @Test
    @DisplayName("Should flag a large drop as well as a large jump")
    void shouldFlagOutlierBelowBaseline() {
        for (int i = 0; i < 10; i++) {
            detector.evaluate("TTFB", "api", 1000);
        }

        AnomalyDetection result = detector.evaluate("TTFB", "api", 1);

        assertThat(result.isDetected()).isTrue();
        assertThat(result.getDeviation()).isNegative();
    }

    @Test
    @DisplayName("Should not flag values within the normal spread")
    void shouldNotFlagNormalValue() {
        for (int i = 0; i < 20; i++) {
            detector.evaluate("FID", "web", i % 2 == 0 ? 90 : 110);
        }

        AnomalyDetection result = detector.evaluate("FID", "web", 105);

        assertThat(result.isDetected()).isFalse();
        assertThat(result.getReason()).isEqualTo("Within normal range");
    }

    @Test
    @DisplayName("Baselines are kept per metric and service")
    void shouldSeparateKeys() {
        for (int i = 0; i < 10; i++) {
            detector.evaluate("LCP", "checkout", 100);
        }

        AnomalyDetection otherService = detector.evaluate("LCP", "search", 1000);

        assertThat(otherService.isDetected()).isFalse();
        assertThat(detector.baselineCount()).isEqualTo(2);
        assertThat(detector.baselineValues("LCP", "search")).containsExactly(1000.0);
    }

    @Test
    @DisplayName("Window evicts the oldest samples first")
    void shouldEvictOldestSamples() {
        AnomalyDetector small = new AnomalyDetector(2.0, 10);
        for (int i = 1; i <= 15; i++) {
            small.evaluate("CLS", "web", i);
        }

        assertThat(small.baselineValues("CLS", "web"))
                .containsExactly(6.0, 7.0, 8.0, 9.0, 10.0, 11.0, 12.0, 13.0, 14.0, 15.0);
    }

    @Test
    @DisplayName("Should reject a window smaller than the cold-start minimum")
    void shouldRejectSmallWindow() {
        assertThatThrownBy(() -> new AnomalyDetector(2.0, 9))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("windowSize");
    }
}
