package com.telemetrysentinel.service;

import com.telemetrysentinel.core.engine.TelemetryEngine;
import com.telemetrysentinel.core.model.ErrorContext;
import com.telemetrysentinel.core.model.ErrorLevel;
import com.telemetrysentinel.core.model.ErrorReport;
import com.telemetrysentinel.core.model.PerformanceContext;
import com.telemetrysentinel.core.model.PerformanceMeasurement;
import com.telemetrysentinel.core.model.PerformanceThreshold;
import com.telemetrysentinel.core.model.PerformanceType;
import com.telemetrysentinel.core.model.RequestContext;
import com.telemetrysentinel.core.model.UserContext;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Maps an ingested {@link TelemetryRecord} onto the matching
 * {@link TelemetryEngine} operation.
 *
 * <h3>Kinds</h3>
 * <ul>
 * <li>{@code error} - {@link TelemetryEngine#recordError(ErrorReport)}</li>
 * <li>{@code performance} -
 * {@link TelemetryEngine#recordPerformance(PerformanceMeasurement)}</li>
 * <li>{@code web_vital} - {@link TelemetryEngine#recordWebVital(String, double, PerformanceContext)}</li>
 * </ul>
 *
 * <p>
 * A record the engine cannot accept (unknown kind, missing message or metric,
 * non-numeric value) raises {@link IllegalArgumentException}; the caller
 * counts it as rejected.
 * </p>
 *
 * @since 1.0.0
 */
public class RecordHandler {

    private final TelemetryEngine engine;

    public RecordHandler(TelemetryEngine engine) {
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
    }

    /**
     * @param record the record; must not be {@code null}
     * @return the id the engine assigned
     * @throws IllegalArgumentException if the record cannot be recorded
     */
    public String handle(TelemetryRecord record) {
        Objects.requireNonNull(record, "record must not be null");
        String kind = record.getKind()
                .orElseThrow(() -> new IllegalArgumentException("Record has no 'kind'"));
        return switch (kind) {
            case TelemetryRecord.KIND_ERROR -> engine.recordError(toErrorReport(record));
            case TelemetryRecord.KIND_PERFORMANCE -> engine.recordPerformance(toMeasurement(record));
            case TelemetryRecord.KIND_WEB_VITAL -> engine.recordWebVital(
                    record.getStringField("name")
                            .orElseThrow(() -> new IllegalArgumentException("web_vital record has no 'name'")),
                    requiredValue(record),
                    toPerformanceContext(record.getObjectField("context")));
            default -> throw new IllegalArgumentException("Unknown record kind: '" + kind + "'");
        };
    }

    // ---------------------------------------------------------------
    // Errors
    // ---------------------------------------------------------------

    ErrorReport toErrorReport(TelemetryRecord record) {
        String message = record.getStringField("message")
                .orElseThrow(() -> new IllegalArgumentException("error record has no 'message'"));

        Map<String, Object> ctx = record.getObjectField("context");
        ErrorContext context = ErrorContext.builder()
                .service(string(ctx, "service"))
                .module(string(ctx, "module"))
                .function(string(ctx, "function"))
                .file(string(ctx, "file"))
                .line(integer(ctx, "line"))
                .column(integer(ctx, "column"))
                .component(string(ctx, "component"))
                .build();

        ErrorReport.Builder report = ErrorReport.builder()
                .message(message)
                .stack(record.getStringField("stack").orElse(null))
                .level(ErrorLevel.fromLabel(record.getStringField("level").orElse(null)))
                .context(context)
                .correlationId(record.getStringField("correlationId").orElse(null))
                .tags(stringMap(record.getObjectField("tags")))
                .extra(record.getObjectField("extra"));

        Map<String, Object> user = record.getObjectField("user");
        if (!user.isEmpty()) {
            report.user(UserContext.builder()
                    .id(string(user, "id"))
                    .email(string(user, "email"))
                    .username(string(user, "username"))
                    .ipAddress(string(user, "ipAddress"))
                    .userAgent(string(user, "userAgent"))
                    .sessionId(string(user, "sessionId"))
                    .build());
        } else {
            report.userId(record.getStringField("userId").orElse(null));
        }

        Map<String, Object> request = record.getObjectField("request");
        if (!request.isEmpty()) {
            Long responseTime = TelemetryRecord.numeric(request.get("responseTimeMs"))
                    .map(Double::longValue).orElse(null);
            report.request(new RequestContext(string(request, "method"), string(request, "url"),
                    stringMap(objectMap(request.get("headers"))), objectMap(request.get("query")),
                    integer(request, "statusCode"), responseTime));
        }
        return report.build();
    }

    // ---------------------------------------------------------------
    // Performance
    // ---------------------------------------------------------------

    PerformanceMeasurement toMeasurement(TelemetryRecord record) {
        PerformanceMeasurement.Builder measurement = PerformanceMeasurement.builder()
                .metric(record.getStringField("metric").orElse(null))
                .value(requiredValue(record))
                .unit(record.getStringField("unit").orElse(""))
                .correlationId(record.getStringField("correlationId").orElse(null))
                .context(toPerformanceContext(record.getObjectField("context")));
        record.getStringField("type").map(PerformanceType::fromLabel).ifPresent(measurement::type);

        Map<String, Object> thresholds = record.getObjectField("thresholds");
        if (!thresholds.isEmpty()) {
            double critical = number(thresholds, "critical").orElse(Double.MAX_VALUE);
            double warning = number(thresholds, "warning").orElse(critical);
            double target = number(thresholds, "target").orElse(warning);
            measurement.thresholds(PerformanceThreshold.of(target, warning, critical));
        }
        return measurement.build();
    }

    static PerformanceContext toPerformanceContext(Map<String, Object> ctx) {
        return PerformanceContext.builder()
                .service(string(ctx, "service"))
                .endpoint(string(ctx, "endpoint"))
                .method(string(ctx, "method"))
                .userId(string(ctx, "userId"))
                .sessionId(string(ctx, "sessionId"))
                .browser(string(ctx, "browser"))
                .device(string(ctx, "device"))
                .connection(string(ctx, "connection"))
                .region(string(ctx, "region"))
                .build();
    }

    // ---------------------------------------------------------------
    // Field coercion
    // ---------------------------------------------------------------

    private static double requiredValue(TelemetryRecord record) {
        return record.getNumericField("value")
                .orElseThrow(() -> new IllegalArgumentException("Record has no numeric 'value'"));
    }

    private static String string(Map<String, Object> map, String key) {
        Object raw = map.get(key);
        return raw == null ? null : raw.toString();
    }

    private static Integer integer(Map<String, Object> map, String key) {
        return TelemetryRecord.numeric(map.get(key)).map(Double::intValue).orElse(null);
    }

    private static Optional<Double> number(Map<String, Object> map, String key) {
        return TelemetryRecord.numeric(map.get(key));
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> objectMap(Object raw) {
        return raw instanceof Map<?, ?> map ? (Map<String, Object>) map : Map.of();
    }

    private static Map<String, String> stringMap(Map<String, Object> raw) {
        Map<String, String> out = new LinkedHashMap<>();
        raw.forEach((k, v) -> {
            if (v != null) {
                out.put(k, v.toString());
            }
        });
        return out;
    }
}
