package com.telemetrysentinel.core.classification;

import com.telemetrysentinel.core.config.ClassificationRule;
import com.telemetrysentinel.core.config.ClassificationRulesConfig;
import com.telemetrysentinel.core.config.ClassificationRulesLoader;
import com.telemetrysentinel.core.model.Classification;
import com.telemetrysentinel.core.model.ErrorCategory;
import com.telemetrysentinel.core.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Rule-based error classifier.
 *
 * <p>
 * Rules are evaluated in configuration order against the lower-cased message
 * and the <strong>first</strong> rule with any matching pattern wins. Rule
 * order is therefore part of the configuration's meaning: a message such as
 * {@code "connection timeout"} matches both a database pattern and a network
 * pattern and is classified by whichever rule is listed first.
 * </p>
 *
 * <ul>
 * <li>match: the rule's category, severity and priority; type = rule name;
 * confidence {@value #MATCH_CONFIDENCE}</li>
 * <li>no match: application / unknown / medium / priority
 * {@value #DEFAULT_PRIORITY}; confidence {@value #DEFAULT_CONFIDENCE}</li>
 * </ul>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Stateless after construction; safe for concurrent use.
 * </p>
 *
 * @since 1.0.0
 */
public class ErrorClassifier {

    private static final Logger LOG = LoggerFactory.getLogger(ErrorClassifier.class);

    static final double MATCH_CONFIDENCE = 0.8;
    static final double DEFAULT_CONFIDENCE = 0.3;
    static final int DEFAULT_PRIORITY = 5;

    private final List<CompiledRule> rules;

    /**
     * @param config validated rules configuration; must not be {@code null}
     */
    public ErrorClassifier(ClassificationRulesConfig config) {
        Objects.requireNonNull(config, "ClassificationRulesConfig must not be null");
        this.rules = config.getRules().stream()
                .map(CompiledRule::new)
                .toList();
        LOG.debug("Classifier ready with rules {}", rules.stream().map(r -> r.name).toList());
    }

    /**
     * Create a classifier from the stock rule table (or the file named by
     * {@value ClassificationRulesLoader#ENV_RULES_PATH}).
     *
     * @return classifier
     */
    public static ErrorClassifier withDefaultRules() {
        return new ErrorClassifier(ClassificationRulesLoader.load());
    }

    /**
     * Classify an error message.
     *
     * @param message the error message; {@code null} is treated as empty
     * @return the classification of the first matching rule, or the default
     *         low-confidence classification
     */
    public Classification classify(String message) {
        String normalised = message == null ? "" : message.toLowerCase(Locale.ROOT);

        for (CompiledRule rule : rules) {
            if (rule.matches(normalised)) {
                LOG.trace("Message matched rule [{}]", rule.name);
                return rule.classification;
            }
        }
        return new Classification(ErrorCategory.APPLICATION, Classification.UNKNOWN_TYPE,
                Severity.MEDIUM, DEFAULT_PRIORITY, true, DEFAULT_CONFIDENCE);
    }

    /**
     * @return rule names in evaluation order
     */
    public List<String> ruleNames() {
        return rules.stream().map(r -> r.name).toList();
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static final class CompiledRule {
        private final String name;
        private final List<Pattern> patterns;
        private final Classification classification;

        private CompiledRule(ClassificationRule rule) {
            this.name = rule.getName();
            this.patterns = rule.getPatterns().stream()
                    .map(p -> Pattern.compile(p, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE))
                    .toList();
            this.classification = new Classification(
                    ErrorCategory.fromLabel(rule.getCategory()),
                    rule.getName(),
                    Severity.fromLabel(rule.getSeverity()),
                    rule.getPriority(),
                    true,
                    MATCH_CONFIDENCE);
        }

        private boolean matches(String message) {
            for (Pattern p : patterns) {
                if (p.matcher(message).find()) {
                    return true;
                }
            }
            return false;
        }
    }
}
