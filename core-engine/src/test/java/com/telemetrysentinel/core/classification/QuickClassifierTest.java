package com.telemetrysentinel.core.classification;

import com.telemetrysentinel.core.model.Severity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link QuickClassifier}.
 */
class QuickClassifierTest {

    private final QuickClassifier classifier = new QuickClassifier();

    @Test
    @DisplayName("Database and SQL substrings map to database_error/high")
    void shouldClassifyDatabase() {
        QuickClassification c = classifier.classify("SQLSTATE[42000]: syntax error");

        assertThat(c.getCategory()).isEqualTo("database");
        assertThat(c.getType()).isEqualTo("database_error");
        assertThat(c.getSeverity()).isEqualTo(Severity.HIGH);
    }

    @Test
    @DisplayName("Database check runs before the timeout check")
    void shouldPreferDatabaseOverTimeout() {
        assertThat(classifier.classify("database timeout").getCategory()).isEqualTo("database");
        assertThat(classifier.classify("gateway timeout").getCategory()).isEqualTo("network");
    }

    @Test
    @DisplayName("Forbidden maps to auth_error")
    void shouldClassifyAuth() {
        assertThat(classifier.classify("403 Forbidden").asTags())
                .containsEntry("error_category", "auth")
                .containsEntry("error_type", "auth_error");
    }

    @Test
    @DisplayName("Anything else is application/unknown/medium")
    void shouldFallBack() {
        QuickClassification c = classifier.classify(null);

        assertThat(c.getCategory()).isEqualTo("application");
        assertThat(c.getType()).isEqualTo("unknown");
        assertThat(c.getSeverity()).isEqualTo(Severity.MEDIUM);
    }
}
