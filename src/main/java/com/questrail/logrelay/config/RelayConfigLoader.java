package com.questrail.logrelay.config;

import com.questrail.logrelay.admission.AdmissionPolicy;
import com.questrail.logrelay.fetch.RetryPolicy;
import com.questrail.logrelay.polling.PollingPolicy;
import okhttp3.HttpUrl;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * RelayConfigLoader
 * =============================================================================
 * Builds a {@link RelayConfig} from environment variables.
 *
 * <table>
 *   <tr><th>Variable</th><th>Default</th><th>Constraint</th></tr>
 *   <tr><td>NODE_ENV / RELAY_ENV</td><td>development</td><td></td></tr>
 *   <tr><td>PORT</td><td>4000</td><td>1..65535</td></tr>
 *   <tr><td>WEBSOCKET_PATH</td><td>/ws</td><td>starts with /</td></tr>
 *   <tr><td>API_BASE_URL</td><td>required</td><td>http(s) URL</td></tr>
 *   <tr><td>AUTH_TOKEN</td><td>required</td><td>at least 10 characters</td></tr>
 *   <tr><td>API_TIMEOUT</td><td>10000 ms</td><td>&gt; 0</td></tr>
 *   <tr><td>API_RETRY_ATTEMPTS</td><td>3</td><td>1..30</td></tr>
 *   <tr><td>API_RETRY_BASE_DELAY</td><td>1000 ms</td><td>&gt;= 0</td></tr>
 *   <tr><td>API_MESSAGES_FIELD</td><td>messages</td><td>non-blank</td></tr>
 *   <tr><td>CORS_ORIGIN</td><td>*</td><td>comma-separated</td></tr>
 *   <tr><td>PING_INTERVAL</td><td>25000 ms</td><td>&gt; 0, &lt; PING_TIMEOUT</td></tr>
 *   <tr><td>PING_TIMEOUT</td><td>60000 ms</td><td>&gt; 0</td></tr>
 *   <tr><td>POLLING_INTERVAL</td><td>3000 ms</td><td>&gt;= 1000</td></tr>
 *   <tr><td>POLLING_FAILURE_THRESHOLD</td><td>5</td><td>&gt;= 1</td></tr>
 *   <tr><td>POLLING_THREADS</td><td>4</td><td>&gt;= 1</td></tr>
 *   <tr><td>MAX_MESSAGES_PER_BATCH</td><td>100</td><td>&gt;= 1</td></tr>
 *   <tr><td>RATE_LIMIT_WINDOW</td><td>900000 ms</td><td>&gt; 0</td></tr>
 *   <tr><td>RATE_LIMIT_MAX_REQUESTS</td><td>100</td><td>&gt;= 1</td></tr>
 * </table>
 *
 * All problems are collected and reported together in one
 * {@link RelayConfigException}.
 */
public final class RelayConfigLoader
{
    public static final int MIN_AUTH_TOKEN_LENGTH = 10;
    public static final long MIN_POLLING_INTERVAL_MS = 1000;

    private RelayConfigLoader() {
    }

    public static RelayConfig fromSystemEnvironment()
    {
        return fromEnvironment(System.getenv());
    }

    public static RelayConfig fromEnvironment(Map<String, String> env)
    {
        Objects.requireNonNull(env, "env");
        Reader r = new Reader(env);

        String environment = r.string("RELAY_ENV", r.string("NODE_ENV", "development"));
        int port = r.integer("PORT", 4000, 1, 65535);
        String websocketPath = r.string("WEBSOCKET_PATH", "/ws");
        if (!websocketPath.startsWith("/")) {
            r.problem("WEBSOCKET_PATH must start with '/'");
        }

        String apiBaseUrl = r.required("API_BASE_URL");
        if (apiBaseUrl != null && HttpUrl.parse(apiBaseUrl) == null) {
            r.problem("API_BASE_URL must be a valid http or https URL");
        }

        String authToken = r.required("AUTH_TOKEN");
        if (authToken != null && authToken.length() < MIN_AUTH_TOKEN_LENGTH) {
            r.problem("AUTH_TOKEN must be at least " + MIN_AUTH_TOKEN_LENGTH + " characters");
        }

        long apiTimeout = r.integer("API_TIMEOUT", 10_000, 1, Integer.MAX_VALUE);
        int retryAttempts = r.integer("API_RETRY_ATTEMPTS", 3, 1, 30);
        long retryBaseDelay = r.integer("API_RETRY_BASE_DELAY", 1000, 0, Integer.MAX_VALUE);
        String messagesField = r.string("API_MESSAGES_FIELD", "messages");
        if (messagesField.isBlank()) {
            r.problem("API_MESSAGES_FIELD must not be blank");
        }

        List<String> corsOrigins = Arrays.stream(r.string("CORS_ORIGIN", RelayConfig.ANY_ORIGIN).split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
        if (corsOrigins.isEmpty()) {
            r.problem("CORS_ORIGIN must name at least one origin or '*'");
        }

        long pingInterval = r.integer("PING_INTERVAL", 25_000, 1, Integer.MAX_VALUE);
        long pingTimeout = r.integer("PING_TIMEOUT", 60_000, 1, Integer.MAX_VALUE);
        if (pingInterval >= pingTimeout) {
            r.problem("PING_INTERVAL must be less than PING_TIMEOUT");
        }
        long pollingInterval = r.integer("POLLING_INTERVAL", 3000, MIN_POLLING_INTERVAL_MS, Integer.MAX_VALUE);
        int failureThreshold = r.integer("POLLING_FAILURE_THRESHOLD", 5, 1, 1000);
        int pollingThreads = r.integer("POLLING_THREADS", 4, 1, 256);
        int maxBatch = r.integer("MAX_MESSAGES_PER_BATCH", 100, 1, 100_000);
        long rateWindow = r.integer("RATE_LIMIT_WINDOW", 900_000, 1, Integer.MAX_VALUE);
        int rateMax = r.integer("RATE_LIMIT_MAX_REQUESTS", 100, 1, Integer.MAX_VALUE);

        if (!r.problems.isEmpty()) {
            throw new RelayConfigException(r.problems);
        }

        return RelayConfig.builder()
                .withEnvironment(environment)
                .withPort(port)
                .withWebsocketPath(websocketPath)
                .withApiBaseUrl(apiBaseUrl)
                .withAuthToken(authToken)
                .withApiTimeout(Duration.ofMillis(apiTimeout))
                .withRetryPolicy(new RetryPolicy(retryAttempts, Duration.ofMillis(retryBaseDelay)))
                .withMessagesField(messagesField)
                .withCorsOrigins(corsOrigins)
                .withPingInterval(Duration.ofMillis(pingInterval))
                .withPingTimeout(Duration.ofMillis(pingTimeout))
                .withPollingPolicy(new PollingPolicy(Duration.ofMillis(pollingInterval), failureThreshold))
                .withPollingThreads(pollingThreads)
                .withMaxMessagesPerBatch(maxBatch)
                .withAdmissionPolicy(new AdmissionPolicy(Duration.ofMillis(rateWindow), rateMax))
                .build();
    }

    /**
     * Typed access to the environment that records problems instead of throwing.
     */
    private static final class Reader
    {
        private final Map<String, String> env;
        private final List<String> problems = new ArrayList<>();

        private Reader(Map<String, String> env) {
            this.env = env;
        }

        void problem(String message) {
            problems.add(message);
        }

        String string(String name, String defaultValue) {
            String value = env.get(name);
            return value == null || value.isBlank() ? defaultValue : value.trim();
        }

        String required(String name) {
            String value = string(name, null);
            if (value == null) {
                problem(name + " is required");
            }
            return value;
        }

        int integer(String name, int defaultValue, long min, long max) {
            String value = string(name, null);
            if (value == null) {
                return defaultValue;
            }
            try {
                long parsed = Long.parseLong(value);
                if (parsed < min || parsed > max) {
                    problem(name + " must be between " + min + " and " + max + " (was " + value + ")");
                    return defaultValue;
                }
                return (int) parsed;
            } catch (NumberFormatException e) {
                problem(name + " must be an integer (was '" + value + "')");
                return defaultValue;
            }
        }
    }
}
