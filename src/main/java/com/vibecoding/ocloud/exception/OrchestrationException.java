package com.vibecoding.ocloud.exception;

import com.vibecoding.ocloud.model.orchestration.ErrorSeverity;
import lombok.Getter;

import java.time.LocalDateTime;

/**
 * 오케스트레이션 단계 실패 (불변)
 */
@Getter
public class OrchestrationException extends RuntimeException {

    private final String code;
    private final String component;
    private final String intent;
    private final String resource;
    private final ErrorSeverity severity;
    private final String correlationId;
    private final LocalDateTime timestamp;
    private final boolean retryable;

    private OrchestrationException(Builder builder) {
        super(builder.message, builder.cause);
        this.code = builder.code;
        this.component = builder.component;
        this.intent = builder.intent;
        this.resource = builder.resource;
        this.severity = builder.severity;
        this.correlationId = builder.correlationId;
        this.timestamp = LocalDateTime.now();
        this.retryable = builder.retryable;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "[" + code + "] " + getMessage() + " (component=" + component
            + ", severity=" + severity + ", retryable=" + retryable + ", correlationId=" + correlationId + ")";
    }

    public static class Builder {
        private String code;
        private String message;
        private String component;
        private String intent;
        private String resource;
        private ErrorSeverity severity = ErrorSeverity.ERROR;
        private String correlationId;
        private boolean retryable;
        private Throwable cause;

        public Builder code(String code) {
            this.code = code;
            return this;
        }

        public Builder message(String message) {
            this.message = message;
            return this;
        }

        public Builder component(String component) {
            this.component = component;
            return this;
        }

        public Builder intent(String intent) {
            this.intent = intent;
            return this;
        }

        public Builder resource(String resource) {
            this.resource = resource;
            return this;
        }

        public Builder severity(ErrorSeverity severity) {
            this.severity = severity;
            return this;
        }

        public Builder correlationId(String correlationId) {
            this.correlationId = correlationId;
            return this;
        }

        public Builder retryable(boolean retryable) {
            this.retryable = retryable;
            return this;
        }

        public Builder cause(Throwable cause) {
            this.cause = cause;
            return this;
        }

        public OrchestrationException build() {
            return new OrchestrationException(this);
        }
    }
}
