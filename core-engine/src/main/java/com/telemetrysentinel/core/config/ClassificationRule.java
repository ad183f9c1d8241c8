package com.telemetrysentinel.core.config;

import com.telemetrysentinel.core.model.ErrorCategory;
import com.telemetrysentinel.core.model.Severity;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * One named error-classification rule loaded from configuration.
 *
 * <p>
 * A rule matches a message when <em>any</em> of its {@code patterns} is found
 * in the lower-cased message (regular-expression {@code find}, compiled
 * case-insensitively). A match yields the rule's fixed category, severity and
 * priority.
 * </p>
 *
 * <p>
 * Call {@link #validate()} after construction / deserialization to verify
 * that every field is present and every pattern compiles.
 * </p>
 *
 * @since 1.0.0
 */
public class ClassificationRule {

    /** Lowest accepted priority. */
    public static final int MIN_PRIORITY = 1;

    /** Highest accepted priority. */
    public static final int MAX_PRIORITY = 10;

    /** Rule name; becomes the classification's type label. */
    private String name;

    /** Category label: application, system, network, database, external or user. */
    private String category;

    /** Severity label: low, medium, high or critical. */
    private String severity;

    /** Numeric priority in [{@value #MIN_PRIORITY}, {@value #MAX_PRIORITY}]. */
    private int priority;

    /** Regular expressions; any one matching is enough. */
    private List<String> patterns = new ArrayList<>();

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Validate that all fields are present and contain legal values.
     *
     * @throws IllegalStateException if validation fails
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (name == null || name.isBlank()) {
            errors.add("Rule 'name' is required");
        }
        try {
            ErrorCategory.fromLabel(category);
        } catch (IllegalArgumentException e) {
            errors.add("Rule '" + name + "': " + e.getMessage());
        }
        try {
            Severity.fromLabel(severity);
        } catch (IllegalArgumentException e) {
            errors.add("Rule '" + name + "': " + e.getMessage());
        }
        if (priority < MIN_PRIORITY || priority > MAX_PRIORITY) {
            errors.add("Rule '" + name + "' requires 'priority' in [" + MIN_PRIORITY + ", "
                    + MAX_PRIORITY + "], got: " + priority);
        }
        if (patterns == null || patterns.isEmpty()) {
            errors.add("Rule '" + name + "' requires at least one pattern");
        } else {
            for (String p : patterns) {
                if (p == null || p.isBlank()) {
                    errors.add("Rule '" + name + "' contains a blank pattern");
                    continue;
                }
                try {
                    Pattern.compile(p);
                } catch (PatternSyntaxException e) {
                    errors.add("Rule '" + name + "' has invalid pattern '" + p + "': "
                            + e.getDescription());
                }
            }
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Invalid ClassificationRule: " + String.join("; ", errors));
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getCategory() {
        return category;
    }

    public void setCategory(String category) {
        this.category = category;
    }

    public String getSeverity() {
        return severity;
    }

    public void setSeverity(String severity) {
        this.severity = severity;
    }

    public int getPriority() {
        return priority;
    }

    public void setPriority(int priority) {
        this.priority = priority;
    }

    /**
     * @return unmodifiable list of pattern sources, in declaration order
     */
    public List<String> getPatterns() {
        return Collections.unmodifiableList(patterns);
    }

    public void setPatterns(List<String> patterns) {
        this.patterns = patterns != null ? new ArrayList<>(patterns) : new ArrayList<>();
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ClassificationRule that))
            return false;
        return Objects.equals(name, that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name);
    }

    @Override
    public String toString() {
        return "ClassificationRule{" +
                "name='" + name + '\'' +
                ", category='" + category + '\'' +
                ", severity='" + severity + '\'' +
                ", priority=" + priority +
                ", patterns=" + patterns +
                '}';
    }
}
