package com.telemetrysentinel.core.engine;

import com.telemetrysentinel.core.classification.ErrorClassifier;
import com.telemetrysentinel.core.config.EngineConfig;
import com.telemetrysentinel.core.detection.AnomalyDetector;
import com.telemetrysentinel.core.export.ExportForwarder;
import com.telemetrysentinel.core.export.ExportSink;
import com.telemetrysentinel.core.fingerprint.Fingerprinter;
import com.telemetrysentinel.core.model.AnomalyDetection;
import com.telemetrysentinel.core.model.Classification;
import com.telemetrysentinel.core.model.ErrorContext;
import com.telemetrysentinel.core.model.ErrorEvent;
import com.telemetrysentinel.core.model.ErrorPattern;
import com.telemetrysentinel.core.model.ErrorReport;
import com.telemetrysentinel.core.model.Ids;
import com.telemetrysentinel.core.model.PerformanceContext;
import com.telemetrysentinel.core.model.PerformanceEvent;
import com.telemetrysentinel.core.model.PerformanceMeasurement;
import com.telemetrysentinel.core.model.PerformanceThreshold;
import com.telemetrysentinel.core.model.PerformanceType;
import com.telemetrysentinel.core.model.Severity;
import com.telemetrysentinel.core.model.WebVital;
import com.telemetrysentinel.core.pattern.ErrorStats;
import com.telemetrysentinel.core.pattern.PatternTracker;
import com.telemetrysentinel.core.pattern.SweepResult;
import com.telemetrysentinel.core.signal.Signal;
import com.telemetrysentinel.core.signal.SignalBus;
import com.telemetrysentinel.core.signal.SignalType;
import com.telemetrysentinel.core.storage.InMemoryKeyValueStore;
import com.telemetrysentinel.core.storage.KeyValueStore;
import com.telemetrysentinel.core.storage.TelemetryRepository;
import com.telemetrysentinel.core.trend.RegressionResult;
import com.telemetrysentinel.core.trend.TrendAnalyzer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Entry point for error and performance telemetry.
 *
 * <h3>Error path</h3>
 * <ol>
 *   <li>Default the context (blank service or module becomes {@code unknown}).</li>
 *   <li>Classify the message, when auto-classification is on.</li>
 *   <li>Fingerprint (message, service, module) and fold into the pattern table.</li>
 *   <li>Decide once whether the event is exported (noise filter, sampling),
 *       then persist the event and pattern snapshot and deliver the export,
 *       all on the background dispatcher.</li>
 *   <li>Publish {@code error-recorded}, plus {@code critical-error} for
 *       critical severity.</li>
 * </ol>
 *
 * <h3>Performance path</h3>
 * <ol>
 *   <li>Evaluate against the (metric, service) baseline, when anomaly
 *       detection is on, publishing {@code anomaly-detected} on a hit.</li>
 *   <li>Persist the event and its time-series sample in the background.</li>
 *   <li>Publish {@code performance-critical} or, failing that,
 *       {@code performance-warning}, then {@code performance-recorded}.</li>
 * </ol>
 *
 * <h3>Sweeps</h3>
 * <p>
 * {@link #start()} schedules the pattern sweep and the regression sweep.
 * Each sweep is guarded so it never runs concurrently with itself, and a
 * failing run is logged without cancelling the schedule.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * All record and query methods may be called concurrently. Pattern and
 * baseline state is owned by this engine and is only reachable through it.
 * </p>
 *
 * @since 1.0.0
 */
public class TelemetryEngine implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(TelemetryEngine.class);

    /** Tag added to events whose automatic classification is not trusted. */
    public static final String NEEDS_TRIAGE_TAG = "needs_triage";

    static final String PATTERN_ALERT_DETAILS = "Error frequency increasing rapidly";

    private static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(10);

    private final EngineConfig config;
    private final Clock clock;
    private final ErrorClassifier classifier;
    private final PatternTracker patternTracker;
    private final AnomalyDetector anomalyDetector;
    private final TrendAnalyzer trendAnalyzer;
    private final TelemetryRepository repository;
    private final ExportForwarder exportForwarder;
    private final SignalBus signalBus;
    private final BackgroundDispatcher dispatcher;

    private final ScheduledExecutorService providedScheduler;
    private ScheduledExecutorService scheduler;
    private final List<ScheduledFuture<?>> schedules = new ArrayList<>();

    private final AtomicBoolean started = new AtomicBoolean();
    private final AtomicBoolean patternSweepRunning = new AtomicBoolean();
    private final AtomicBoolean regressionSweepRunning = new AtomicBoolean();

    private TelemetryEngine(Builder b) {
        this.config = b.config;
        this.clock = b.clock;
        this.classifier = b.classifier != null ? b.classifier : ErrorClassifier.withDefaultRules();
        this.patternTracker = new PatternTracker(config.patternIdleTimeout());
        this.anomalyDetector = new AnomalyDetector(config.getSensitivity(), config.getWindowSize());
        this.repository = new TelemetryRepository(b.store, config.getKeyPrefix());
        this.trendAnalyzer = new TrendAnalyzer(repository, clock);
        this.exportForwarder = b.exportForwarder != null
                ? b.exportForwarder
                : (b.exportSink != null ? new ExportForwarder(b.exportSink, config.getExportSampleRate()) : null);
        this.signalBus = b.signalBus;
        this.dispatcher = b.dispatchExecutor != null
                ? new BackgroundDispatcher(b.dispatchExecutor, config.getDispatchAttempts(), config.getDispatchBackoff())
                : BackgroundDispatcher.pooled(config.getDispatchThreads(), config.getDispatchAttempts(),
                        config.getDispatchBackoff());
        this.providedScheduler = b.scheduler;
    }

    public static Builder builder() {
        return new Builder();
    }

    // ---------------------------------------------------------------
    // Errors
    // ---------------------------------------------------------------

    public String recordError(String message, ErrorContext context) {
        return recordError(ErrorReport.of(message, context));
    }

    public String recordError(Throwable throwable, ErrorContext context) {
        return recordError(ErrorReport.of(throwable, context));
    }

    /**
     * Record one error occurrence.
     *
     * @param report the fault; must not be {@code null}
     * @return the new event id
     */
    public String recordError(ErrorReport report) {
        Objects.requireNonNull(report, "report must not be null");
        Instant now = clock.instant();
        String id = Ids.error(now);

        ErrorContext context = (report.getContext() != null ? report.getContext() : ErrorContext.unknown())
                .withDefaults();

        Map<String, String> tags = new LinkedHashMap<>(report.getTags());
        Classification classification = Classification.unclassified();
        if (config.isAutoClassify()) {
            classification = classifier.classify(report.getMessage());
            if (classification.getConfidence() < config.getConfidenceThreshold()) {
                tags.put(NEEDS_TRIAGE_TAG, "true");
            }
        }

        ErrorEvent event = ErrorEvent.builder()
                .id(id)
                .timestamp(now)
                .level(report.getLevel())
                .message(report.getMessage())
                .stack(report.getStack() != null ? report.getStack() : stackOf(report.getThrowable()))
                .correlationId(report.getCorrelationId())
                .context(context)
                .tags(tags)
                .extra(report.getExtra())
                .user(report.getUser())
                .request(report.getRequest())
                .environment(config.getEnvironment())
                .release(config.getRelease())
                .classification(classification)
                .fingerprint(Fingerprinter.fingerprint(report.getMessage(), context.getService(), context.getModule()))
                .build();

        ErrorPattern pattern = patternTracker.observe(event);

        dispatcher.dispatch("store error " + id, () -> repository.saveError(event));
        dispatcher.dispatch("store pattern " + pattern.getFingerprint(), () -> repository.savePattern(pattern));
        if (exportForwarder != null) {
            exportForwarder.prepare(event).ifPresent(fault ->
                    dispatcher.dispatch("export error " + id, () -> exportForwarder.send(fault)));
        }

        LOG.info("Error recorded: id={} fingerprint={} category={} severity={} message='{}'",
                id, event.getFingerprint(), classification.getCategory().label(),
                classification.getSeverity().label(), event.getMessage());

        publish(SignalType.ERROR_RECORDED, now, event.getFingerprint(), null, event);
        if (classification.getSeverity() == Severity.CRITICAL) {
            LOG.warn("Critical error {} in {}/{}", id, context.getService(), context.getModule());
            publish(SignalType.CRITICAL_ERROR, now, event.getFingerprint(), classification.getType(), event);
        }
        return id;
    }

    // ---------------------------------------------------------------
    // Performance
    // ---------------------------------------------------------------

    /**
     * Record one performance measurement.
     *
     * @param measurement the measurement; must not be {@code null}
     * @return the new event id
     */
    public String recordPerformance(PerformanceMeasurement measurement) {
        Objects.requireNonNull(measurement, "measurement must not be null");
        Instant now = clock.instant();
        String id = Ids.performance(now);
        if (measurement.getCorrelationId() == null) {
            measurement = measurement.withCorrelationId(Ids.correlation(now));
        }

        AnomalyDetection anomaly = null;
        if (config.isAnomalyEnabled()) {
            anomaly = anomalyDetector.evaluate(measurement.getMetric(),
                    measurement.getContext().serviceOrUnknown(), measurement.getValue());
        }
        PerformanceEvent event = new PerformanceEvent(id, now, measurement, anomaly);

        if (anomaly != null && anomaly.isDetected()) {
            LOG.warn("Performance anomaly: id={} metric={} value={} baseline={} deviation={}",
                    id, event.getMetric(), event.getValue(), anomaly.getBaseline(), anomaly.getDeviation());
            publish(SignalType.ANOMALY_DETECTED, now, event.getMetric(), anomaly.getReason(), event);
        }

        dispatcher.dispatch("store performance " + id, () -> repository.savePerformance(event));

        PerformanceThreshold thresholds = event.getThresholds();
        if (thresholds.isCritical(event.getValue())) {
            publish(SignalType.PERFORMANCE_CRITICAL, now, event.getMetric(), null, event);
        } else if (thresholds.isWarning(event.getValue())) {
            publish(SignalType.PERFORMANCE_WARNING, now, event.getMetric(), null, event);
        }
        publish(SignalType.PERFORMANCE_RECORDED, now, event.getMetric(), null, event);
        return id;
    }

    /**
     * Record a web vital with its standard thresholds and unit.
     *
     * @param vital   which vital
     * @param value   measured value
     * @param context where it was measured; the session id, if any, becomes
     *                the correlation id
     * @return the new event id
     */
    public String recordWebVital(WebVital vital, double value, PerformanceContext context) {
        Objects.requireNonNull(vital, "vital must not be null");
        PerformanceContext ctx = context != null ? context : PerformanceContext.builder().build();
        return recordPerformance(PerformanceMeasurement.builder()
                .correlationId(ctx.getSessionId())
                .type(PerformanceType.WEB_VITAL)
                .metric(vital.name())
                .value(value)
                .unit(vital.unit())
                .context(ctx)
                .thresholds(vital.thresholds())
                .build());
    }

    /**
     * @throws IllegalArgumentException if {@code vitalName} is not a known web vital
     */
    public String recordWebVital(String vitalName, double value, PerformanceContext context) {
        return recordWebVital(WebVital.fromName(vitalName), value, context);
    }

    // ---------------------------------------------------------------
    // Queries
    // ---------------------------------------------------------------

    public List<ErrorPattern> listPatterns(int limit) {
        return patternTracker.list(limit);
    }

    public ErrorStats errorStats(Duration window) {
        return patternTracker.stats(window, clock.instant());
    }

    public RegressionResult checkRegression(String metric) {
        return trendAnalyzer.checkRegression(metric);
    }

    // ---------------------------------------------------------------
    // Sweeps
    // ---------------------------------------------------------------

    /**
     * Run one pattern sweep now, publishing {@code pattern-alert} for each
     * pattern it flags.
     *
     * @return the sweep result, or {@code null} if a sweep was already running
     */
    public SweepResult runPatternSweep() {
        if (!patternSweepRunning.compareAndSet(false, true)) {
            LOG.debug("Pattern sweep already running; skipping");
            return null;
        }
        try {
            Instant now = clock.instant();
            SweepResult result = patternTracker.sweep(now);
            for (ErrorPattern alert : result.getAlerts()) {
                LOG.warn("Pattern alert: fingerprint={} frequency={}/h count={}",
                        alert.getFingerprint(), String.format("%.1f", alert.getFrequency()), alert.getCount());
                publish(SignalType.PATTERN_ALERT, now, alert.getFingerprint(), PATTERN_ALERT_DETAILS, alert);
            }
            if (result.getEvicted() > 0) {
                LOG.info("Pattern sweep evicted {} idle pattern(s)", result.getEvicted());
            }
            return result;
        } finally {
            patternSweepRunning.set(false);
        }
    }

    /**
     * Check every configured regression metric now, publishing
     * {@code performance-regression} for each regression found.
     *
     * @return results per metric checked, or an empty list if a sweep was
     *         already running
     */
    public List<RegressionResult> runRegressionSweep() {
        if (!regressionSweepRunning.compareAndSet(false, true)) {
            LOG.debug("Regression sweep already running; skipping");
            return List.of();
        }
        try {
            List<RegressionResult> results = new ArrayList<>();
            for (String metric : config.getRegressionMetrics()) {
                RegressionResult result;
                try {
                    result = trendAnalyzer.checkRegression(metric);
                } catch (RuntimeException e) {
                    LOG.error("Regression check failed for {}", metric, e);
                    continue;
                }
                results.add(result);
                if (result.isRegression()) {
                    publish(SignalType.PERFORMANCE_REGRESSION, clock.instant(), metric,
                            metric + " performance regression detected", result);
                }
            }
            return results;
        } finally {
            regressionSweepRunning.set(false);
        }
    }

    // ---------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------

    /**
     * Schedule the periodic sweeps. Calling it twice has no further effect.
     */
    public synchronized void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        scheduler = providedScheduler != null
                ? providedScheduler
                : Executors.newScheduledThreadPool(2, BackgroundDispatcher.namedDaemonThreads("telemetry-sweep"));

        long patternPeriod = config.getPatternSweepInterval().toMillis();
        long regressionPeriod = config.getRegressionSweepInterval().toMillis();
        schedules.add(scheduler.scheduleAtFixedRate(
                () -> runSafely("pattern sweep", this::runPatternSweep),
                patternPeriod, patternPeriod, TimeUnit.MILLISECONDS));
        schedules.add(scheduler.scheduleAtFixedRate(
                () -> runSafely("regression sweep", this::runRegressionSweep),
                regressionPeriod, regressionPeriod, TimeUnit.MILLISECONDS));
        LOG.info("Telemetry engine started: {}", config);
    }

    private static void runSafely(String name, Runnable sweep) {
        try {
            sweep.run();
        } catch (RuntimeException e) {
            LOG.error("{} failed; next run stays scheduled", name, e);
        }
    }

    /**
     * Cancel the sweeps, let a running sweep finish, and drain background work.
     */
    @Override
    public synchronized void close() {
        schedules.forEach(f -> f.cancel(false));
        schedules.clear();
        if (scheduler != null && scheduler != providedScheduler) {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(SHUTDOWN_GRACE.toMillis(), TimeUnit.MILLISECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                scheduler.shutdownNow();
            }
        }
        dispatcher.close();
        LOG.info("Telemetry engine stopped");
    }

    // ---------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------

    public SignalBus getSignalBus() {
        return signalBus;
    }

    public EngineConfig getConfig() {
        return config;
    }

    public boolean isStarted() {
        return started.get();
    }

    public int patternCount() {
        return patternTracker.size();
    }

    BackgroundDispatcher dispatcher() {
        return dispatcher;
    }

    AnomalyDetector anomalyDetector() {
        return anomalyDetector;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private void publish(SignalType type, Instant at, String key, String details, Object payload) {
        signalBus.publish(Signal.builder()
                .type(type)
                .timestamp(at)
                .key(key)
                .details(details)
                .payload(payload)
                .build());
    }

    private static String stackOf(Throwable throwable) {
        if (throwable == null) {
            return null;
        }
        StringWriter out = new StringWriter();
        throwable.printStackTrace(new PrintWriter(out));
        return out.toString();
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Assembles a {@link TelemetryEngine}. Only {@code config} is required.
     */
    public static class Builder {
        private EngineConfig config;
        private KeyValueStore store;
        private ErrorClassifier classifier;
        private ExportSink exportSink;
        private ExportForwarder exportForwarder;
        private SignalBus signalBus;
        private Clock clock;
        private Executor dispatchExecutor;
        private ScheduledExecutorService scheduler;

        private Builder() {
        }

        public Builder config(EngineConfig config) {
            this.config = config;
            return this;
        }

        /** Defaults to an {@link InMemoryKeyValueStore}. */
        public Builder store(KeyValueStore store) {
            this.store = store;
            return this;
        }

        /** Defaults to the stock rule table. */
        public Builder classifier(ErrorClassifier classifier) {
            this.classifier = classifier;
            return this;
        }

        /** Without a sink (or forwarder) nothing is exported. */
        public Builder exportSink(ExportSink exportSink) {
            this.exportSink = exportSink;
            return this;
        }

        /** Takes precedence over {@link #exportSink(ExportSink)}. */
        public Builder exportForwarder(ExportForwarder exportForwarder) {
            this.exportForwarder = exportForwarder;
            return this;
        }

        public Builder signalBus(SignalBus signalBus) {
            this.signalBus = signalBus;
            return this;
        }

        /** Defaults to the UTC system clock. */
        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * Executor for persistence and export. The engine does not shut it
         * down. Defaults to an owned bounded pool.
         */
        public Builder dispatchExecutor(Executor dispatchExecutor) {
            this.dispatchExecutor = dispatchExecutor;
            return this;
        }

        /** Scheduler for the sweeps. The engine does not shut it down. */
        public Builder scheduler(ScheduledExecutorService scheduler) {
            this.scheduler = scheduler;
            return this;
        }

        public TelemetryEngine build() {
            Objects.requireNonNull(config, "config is required");
            if (store == null) {
                store = new InMemoryKeyValueStore(clock != null ? clock : Clock.systemUTC());
            }
            if (clock == null) {
                clock = Clock.systemUTC();
            }
            if (signalBus == null) {
                signalBus = new SignalBus();
            }
            return new TelemetryEngine(this);
        }
    }
}
