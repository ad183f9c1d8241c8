package com.telemetrysentinel.core.export;

import com.telemetrysentinel.core.classification.QuickClassification;
import com.telemetrysentinel.core.classification.QuickClassifier;
import com.telemetrysentinel.core.model.ErrorEvent;
import com.telemetrysentinel.core.model.ErrorLevel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Prepares error events for the export sink and hands them over.
 *
 * <h3>Pipeline</h3>
 * <ol>
 *   <li>Noise: messages matching the {@link NoiseFilter} denylist are dropped.</li>
 *   <li>Sampling: the event is kept with probability {@code sampleRate}.</li>
 *   <li>Tagging: the {@link QuickClassifier} result is added as
 *       {@code error_category} / {@code error_type} tags on top of the
 *       event's own tags, and its severity picks the sink level.</li>
 * </ol>
 *
 * <p>
 * {@link #forward(ErrorEvent)} calls the sink on the current thread; the
 * engine runs it on its background dispatcher.
 * </p>
 *
 * @since 1.0.0
 */
public class ExportForwarder {

    private static final Logger LOG = LoggerFactory.getLogger(ExportForwarder.class);

    private final ExportSink sink;
    private final NoiseFilter noiseFilter;
    private final QuickClassifier quickClassifier;
    private final double sampleRate;
    private final DoubleSupplier random;

    public ExportForwarder(ExportSink sink, double sampleRate) {
        this(sink, new NoiseFilter(), new QuickClassifier(), sampleRate,
                () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * @param sink            destination; must not be {@code null}
     * @param noiseFilter     denylist filter
     * @param quickClassifier tagger
     * @param sampleRate      share of events forwarded, in [0, 1]
     * @param random          source of uniform values in [0, 1)
     */
    public ExportForwarder(ExportSink sink, NoiseFilter noiseFilter, QuickClassifier quickClassifier,
            double sampleRate, DoubleSupplier random) {
        if (sampleRate < 0 || sampleRate > 1 || Double.isNaN(sampleRate)) {
            throw new IllegalArgumentException("sampleRate must be in [0, 1], got: " + sampleRate);
        }
        this.sink = Objects.requireNonNull(sink, "sink must not be null");
        this.noiseFilter = Objects.requireNonNull(noiseFilter, "noiseFilter must not be null");
        this.quickClassifier = Objects.requireNonNull(quickClassifier, "quickClassifier must not be null");
        this.sampleRate = sampleRate;
        this.random = Objects.requireNonNull(random, "random must not be null");
    }

    /**
     * Filter, sample and tag one event.
     *
     * @param event the recorded error event
     * @return the fault to deliver, or empty if the event is noise or was
     *         sampled out
     */
    public Optional<ExportedFault> prepare(ErrorEvent event) {
        if (noiseFilter.isNoise(event.getMessage())) {
            LOG.debug("Dropping noisy error {} before export", event.getId());
            return Optional.empty();
        }
        if (sampleRate < 1 && random.getAsDouble() >= sampleRate) {
            LOG.trace("Error {} sampled out of export", event.getId());
            return Optional.empty();
        }
        return Optional.of(toFault(event));
    }

    /**
     * Deliver a prepared fault. Safe to retry.
     *
     * @throws ExportException if the sink failed
     */
    public void send(ExportedFault fault) {
        sink.send(fault);
    }

    /**
     * {@link #prepare(ErrorEvent)} then {@link #send(ExportedFault)} on the
     * current thread.
     *
     * @return {@code true} if the event was handed to the sink
     * @throws ExportException if the sink failed
     */
    public boolean forward(ErrorEvent event) {
        Optional<ExportedFault> fault = prepare(event);
        fault.ifPresent(this::send);
        return fault.isPresent();
    }

    ExportedFault toFault(ErrorEvent event) {
        QuickClassification quick = quickClassifier.classify(event.getMessage());
        Map<String, String> tags = new LinkedHashMap<>(event.getTags());
        tags.putAll(quick.asTags());

        return new ExportedFault(
                event.getId(),
                event.getTimestamp(),
                ErrorLevel.forSeverity(quick.getSeverity()),
                event.getMessage(),
                event.getStack(),
                event.getFingerprint(),
                event.getEnvironment(),
                event.getRelease(),
                event.getContext(),
                tags,
                event.getExtra());
    }

    public ExportSink getSink() {
        return sink;
    }
}
