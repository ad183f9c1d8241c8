package com.telemetrysentinel.core.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Top-level POJO for the classification rules YAML configuration.
 *
 * <p>
 * Expected YAML structure:
 * </p>
 *
 * <pre>
 * rules:
 *   - name: database
 *     category: database
 *     severity: high
 *     priority: 8
 *     patterns:
 *       - "connection.*timeout"
 *       - "deadlock"
 * </pre>
 *
 * <p>
 * The order of {@code rules} is the evaluation order: the first rule with a
 * matching pattern wins, so reordering the list changes classification.
 * Call {@link #validate()} after loading to verify every rule is valid.
 * </p>
 *
 * @since 1.0.0
 */
public class ClassificationRulesConfig {

    private List<ClassificationRule> rules = new ArrayList<>();

    /**
     * @return a table with no rules, so every message falls through to the
     *         default classification
     */
    public static ClassificationRulesConfig defaultOnly() {
        return new ClassificationRulesConfig();
    }

    /**
     * Return the rules list in evaluation order. The returned list is
     * <strong>unmodifiable</strong>.
     *
     * @return unmodifiable list of classification rules
     */
    public List<ClassificationRule> getRules() {
        return Collections.unmodifiableList(rules);
    }

    /**
     * Set the rules list (used by SnakeYAML during deserialization).
     *
     * @param rules the classification rules, in evaluation order
     */
    public void setRules(List<ClassificationRule> rules) {
        this.rules = rules != null ? new ArrayList<>(rules) : new ArrayList<>();
    }

    /**
     * Validate every rule and check that rule names are unique.
     *
     * <p>
     * Collects all errors and throws a single exception if any rule is
     * invalid.
     * </p>
     *
     * @throws IllegalStateException if one or more rules are invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        Set<String> names = new HashSet<>();

        for (int i = 0; i < rules.size(); i++) {
            ClassificationRule rule = rules.get(i);
            if (rule == null) {
                errors.add("Rule at position " + (i + 1) + " is empty");
                continue;
            }
            try {
                rule.validate();
            } catch (IllegalStateException e) {
                errors.add(e.getMessage());
            }
            if (rule.getName() != null && !names.add(rule.getName())) {
                errors.add("Duplicate rule name: '" + rule.getName() + "'");
            }
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Classification rules validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
    }

    /**
     * @return rule names in evaluation order
     */
    public List<String> ruleNames() {
        return rules.stream().map(r -> r == null ? null : r.getName()).toList();
    }

    @Override
    public String toString() {
        return "ClassificationRulesConfig{rules=" + rules + '}';
    }
}
