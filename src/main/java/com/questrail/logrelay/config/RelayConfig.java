package com.questrail.logrelay.config;

import com.questrail.logrelay.admission.AdmissionPolicy;
import com.questrail.logrelay.fetch.RetryPolicy;
import com.questrail.logrelay.polling.PollingPolicy;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Aggregated configuration for the relay runtime.
 *
 * <p>{@link #toString()} redacts the auth token.</p>
 */
public record RelayConfig(
    String environment,
    int port,
    String websocketPath,
    String apiBaseUrl,
    String authToken,
    Duration apiTimeout,
    RetryPolicy retryPolicy,
    String messagesField,
    List<String> corsOrigins,
    Duration pingInterval,
    Duration pingTimeout,
    PollingPolicy pollingPolicy,
    int pollingThreads,
    int maxMessagesPerBatch,
    AdmissionPolicy admissionPolicy
) {
    public static final String ANY_ORIGIN = "*";

    public RelayConfig {
        Objects.requireNonNull(environment, "environment");
        Objects.requireNonNull(websocketPath, "websocketPath");
        Objects.requireNonNull(apiBaseUrl, "apiBaseUrl");
        Objects.requireNonNull(authToken, "authToken");
        Objects.requireNonNull(apiTimeout, "apiTimeout");
        Objects.requireNonNull(retryPolicy, "retryPolicy");
        Objects.requireNonNull(messagesField, "messagesField");
        Objects.requireNonNull(corsOrigins, "corsOrigins");
        Objects.requireNonNull(pingInterval, "pingInterval");
        Objects.requireNonNull(pingTimeout, "pingTimeout");
        Objects.requireNonNull(pollingPolicy, "pollingPolicy");
        Objects.requireNonNull(admissionPolicy, "admissionPolicy");
        corsOrigins = List.copyOf(corsOrigins);

        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("port must be within 0..65535");
        }
        if (!websocketPath.startsWith("/")) {
            throw new IllegalArgumentException("websocketPath must start with '/'");
        }
        if (pingInterval.isNegative() || pingInterval.isZero() || pingInterval.compareTo(pingTimeout) >= 0) {
            throw new IllegalArgumentException("pingInterval must be positive and shorter than pingTimeout");
        }
        if (pollingThreads < 1) {
            throw new IllegalArgumentException("pollingThreads must be >= 1");
        }
        if (maxMessagesPerBatch < 1) {
            throw new IllegalArgumentException("maxMessagesPerBatch must be >= 1");
        }
    }

    public boolean isProduction() {
        return "production".equalsIgnoreCase(environment);
    }

    /**
     * Whether a browser {@code Origin} header is acceptable for a WebSocket upgrade.
     * Requests without an {@code Origin} header (non-browser clients) are accepted.
     */
    public boolean allowsOrigin(String origin) {
        if (origin == null || corsOrigins.contains(ANY_ORIGIN)) {
            return true;
        }
        return corsOrigins.contains(origin);
    }

    @Override
    public String toString() {
        return "RelayConfig[environment=" + environment
            + ", port=" + port
            + ", websocketPath=" + websocketPath
            + ", apiBaseUrl=" + apiBaseUrl
            + ", authToken=***"
            + ", apiTimeout=" + apiTimeout
            + ", retryPolicy=" + retryPolicy
            + ", messagesField=" + messagesField
            + ", corsOrigins=" + corsOrigins
            + ", pingInterval=" + pingInterval
            + ", pingTimeout=" + pingTimeout
            + ", pollingPolicy=" + pollingPolicy
            + ", pollingThreads=" + pollingThreads
            + ", maxMessagesPerBatch=" + maxMessagesPerBatch
            + ", admissionPolicy=" + admissionPolicy + "]";
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String environment = "development";
        private int port = 4000;
        private String websocketPath = "/ws";
        private String apiBaseUrl;
        private String authToken;
        private Duration apiTimeout = Duration.ofSeconds(10);
        private RetryPolicy retryPolicy = RetryPolicy.defaults();
        private String messagesField = "messages";
        private List<String> corsOrigins = List.of(ANY_ORIGIN);
        private Duration pingInterval = Duration.ofSeconds(25);
        private Duration pingTimeout = Duration.ofSeconds(60);
        private PollingPolicy pollingPolicy = PollingPolicy.defaults();
        private int pollingThreads = 4;
        private int maxMessagesPerBatch = 100;
        private AdmissionPolicy admissionPolicy = AdmissionPolicy.defaults();

        public Builder withEnvironment(String environment) {
            this.environment = environment;
            return this;
        }

        public Builder withPort(int port) {
            this.port = port;
            return this;
        }

        public Builder withWebsocketPath(String websocketPath) {
            this.websocketPath = websocketPath;
            return this;
        }

        public Builder withApiBaseUrl(String apiBaseUrl) {
            this.apiBaseUrl = apiBaseUrl;
            return this;
        }

        public Builder withAuthToken(String authToken) {
            this.authToken = authToken;
            return this;
        }

        public Builder withApiTimeout(Duration apiTimeout) {
            this.apiTimeout = apiTimeout;
            return this;
        }

        public Builder withRetryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = retryPolicy;
            return this;
        }

        public Builder withMessagesField(String messagesField) {
            this.messagesField = messagesField;
            return this;
        }

        public Builder withCorsOrigins(List<String> corsOrigins) {
            this.corsOrigins = corsOrigins;
            return this;
        }

        public Builder withPingInterval(Duration pingInterval) {
            this.pingInterval = pingInterval;
            return this;
        }

        public Builder withPingTimeout(Duration pingTimeout) {
            this.pingTimeout = pingTimeout;
            return this;
        }

        public Builder withPollingPolicy(PollingPolicy pollingPolicy) {
            this.pollingPolicy = pollingPolicy;
            return this;
        }

        public Builder withPollingThreads(int pollingThreads) {
            this.pollingThreads = pollingThreads;
            return this;
        }

        public Builder withMaxMessagesPerBatch(int maxMessagesPerBatch) {
            this.maxMessagesPerBatch = maxMessagesPerBatch;
            return this;
        }

        public Builder withAdmissionPolicy(AdmissionPolicy admissionPolicy) {
            this.admissionPolicy = admissionPolicy;
            return this;
        }

        public RelayConfig build() {
            return new RelayConfig(environment, port, websocketPath, apiBaseUrl, authToken, apiTimeout,
                retryPolicy, messagesField, corsOrigins, pingInterval, pingTimeout, pollingPolicy, pollingThreads,
                maxMessagesPerBatch, admissionPolicy);
        }
    }
}
