package com.telemetrysentinel.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Objects;

/**
 * Where in the code base an error was raised.
 *
 * <p>
 * Only {@code service} and {@code module} take part in fingerprinting; the
 * remaining fields are descriptive.
 * </p>
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ErrorContext {

    /** Substituted for a missing service or module. */
    public static final String UNKNOWN = "unknown";

    private final String service;
    private final String module;
    private final String function;
    private final String file;
    private final Integer line;
    private final Integer column;
    private final String component;

    private ErrorContext(Builder b) {
        this.service = b.service;
        this.module = b.module;
        this.function = b.function;
        this.file = b.file;
        this.line = b.line;
        this.column = b.column;
        this.component = b.component;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return a context with both service and module set to {@value #UNKNOWN}
     */
    public static ErrorContext unknown() {
        return new Builder().build().withDefaults();
    }

    /**
     * Return a copy in which a blank service or module is replaced by
     * {@value #UNKNOWN}.
     *
     * @return normalised context
     */
    public ErrorContext withDefaults() {
        if (!isBlank(service) && !isBlank(module)) {
            return this;
        }
        return toBuilder()
                .service(isBlank(service) ? UNKNOWN : service)
                .module(isBlank(module) ? UNKNOWN : module)
                .build();
    }

    public Builder toBuilder() {
        return new Builder()
                .service(service)
                .module(module)
                .function(function)
                .file(file)
                .line(line)
                .column(column)
                .component(component);
    }

    public String getService() {
        return service;
    }

    public String getModule() {
        return module;
    }

    public String getFunction() {
        return function;
    }

    public String getFile() {
        return file;
    }

    public Integer getLine() {
        return line;
    }

    public Integer getColumn() {
        return column;
    }

    public String getComponent() {
        return component;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    /**
     * Fluent builder for {@link ErrorContext}.
     */
    public static class Builder {
        private String service;
        private String module;
        private String function;
        private String file;
        private Integer line;
        private Integer column;
        private String component;

        public Builder service(String service) {
            this.service = service;
            return this;
        }

        public Builder module(String module) {
            this.module = module;
            return this;
        }

        public Builder function(String function) {
            this.function = function;
            return this;
        }

        public Builder file(String file) {
            this.file = file;
            return this;
        }

        public Builder line(Integer line) {
            this.line = line;
            return this;
        }

        public Builder column(Integer column) {
            this.column = column;
            return this;
        }

        public Builder component(String component) {
            this.component = component;
            return this;
        }

        public ErrorContext build() {
            return new ErrorContext(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ErrorContext that))
            return false;
        return Objects.equals(service, that.service)
                && Objects.equals(module, that.module)
                && Objects.equals(function, that.function)
                && Objects.equals(file, that.file)
                && Objects.equals(line, that.line)
                && Objects.equals(column, that.column)
                && Objects.equals(component, that.component);
    }

    @Override
    public int hashCode() {
        return Objects.hash(service, module, function, file, line, column, component);
    }

    @Override
    public String toString() {
        return "ErrorContext{service='" + service + "', module='" + module + "'}";
    }
}
