package com.telemetrysentinel.core.classification;

import com.telemetrysentinel.core.config.ClassificationRulesLoader;
import com.telemetrysentinel.core.model.Classification;
import com.telemetrysentinel.core.model.ErrorCategory;
import com.telemetrysentinel.core.model.Severity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link ErrorClassifier} with the stock rule table.
 */
class ErrorClassifierTest {

    private ErrorClassifier classifier;

    @BeforeEach
    void setUp() {
        classifier = new ErrorClassifier(ClassificationRulesLoader.fromClasspath("classification-rules.yml"));
    }

    @Test
    @DisplayName("Stock rules are evaluated database, network, auth, validation, resource-exhaustion")
    void shouldKeepRuleOrder() {
        assertThat(classifier.ruleNames())
                .containsExactly("database", "network", "auth", "validation", "resource-exhaustion");
    }

    @Test
    @DisplayName("A database pattern yields the database rule with fixed confidence")
    void shouldClassifyDatabaseError() {
        Classification c = classifier.classify("Deadlock found when trying to get lock");

        assertThat(c.getCategory()).isEqualTo(ErrorCategory.DATABASE);
        assertThat(c.getType()).isEqualTo("database");
        assertThat(c.getSeverity()).isEqualTo(Severity.HIGH);
        assertThat(c.getPriority()).isEqualTo(8);
        assertThat(c.isAutomated()).isTrue();
        assertThat(c.getConfidence()).isEqualTo(0.8);
    }

    @Test
    @DisplayName("A message matching database and network patterns resolves to the rule listed first")
    void shouldResolveOverlapByOrder() {
        for (int i = 0; i < 5; i++) {
            assertThat(classifier.classify("Connection timeout after 30s").getCategory())
                    .isEqualTo(ErrorCategory.DATABASE);
        }
        assertThat(classifier.classify("Request timeout").getCategory()).isEqualTo(ErrorCategory.NETWORK);
    }

    @Test
    @DisplayName("Matching ignores case")
    void shouldIgnoreCase() {
        assertThat(classifier.classify("UNAUTHORIZED access to /admin").getType()).isEqualTo("auth");
        assertThat(classifier.classify("Invalid Input: email").getCategory()).isEqualTo(ErrorCategory.USER);
    }

    @Test
    @DisplayName("Auth rule maps to application/high/7")
    void shouldClassifyAuth() {
        Classification c = classifier.classify("Authentication failed for user bob");

        assertThat(c.getCategory()).isEqualTo(ErrorCategory.APPLICATION);
        assertThat(c.getSeverity()).isEqualTo(Severity.HIGH);
        assertThat(c.getPriority()).isEqualTo(7);
    }

    @Test
    @DisplayName("Resource exhaustion is critical")
    void shouldClassifyResourceExhaustionAsCritical() {
        Classification c = classifier.classify("java.lang.OutOfMemoryError: Java heap space");

        assertThat(c.getCategory()).isEqualTo(ErrorCategory.SYSTEM);
        assertThat(c.getSeverity()).isEqualTo(Severity.CRITICAL);
        assertThat(c.getPriority()).isEqualTo(10);
    }

    @Test
    @DisplayName("Unmatched messages get the low-confidence default")
    void shouldFallBackToDefault() {
        Classification c = classifier.classify("Cannot read property 'x' of undefined");

        assertThat(c.getCategory()).isEqualTo(ErrorCategory.APPLICATION);
        assertThat(c.getType()).isEqualTo(Classification.UNKNOWN_TYPE);
        assertThat(c.getSeverity()).isEqualTo(Severity.MEDIUM);
        assertThat(c.getPriority()).isEqualTo(5);
        assertThat(c.getConfidence()).isEqualTo(0.3);
    }

    @Test
    @DisplayName("A null message is classified as empty")
    void shouldHandleNullMessage() {
        assertThat(classifier.classify(null).getType()).isEqualTo(Classification.UNKNOWN_TYPE);
    }

    @Test
    @DisplayName("Reordering the rules changes the winner for overlapping messages")
    void shouldFollowConfiguredOrder() {
        ErrorClassifier networkFirst =
                new ErrorClassifier(ClassificationRulesLoader.fromClasspath("test-classification-rules.yml"));

        assertThat(networkFirst.classify("connection timeout").getCategory()).isEqualTo(ErrorCategory.NETWORK);
        assertThat(networkFirst.classify("deadlock detected").getCategory()).isEqualTo(ErrorCategory.DATABASE);
    }
}
