package com.questrail.logrelay.fetch;

import com.questrail.logrelay.internal.time.Sleeper;
import com.questrail.logrelay.internal.time.ThreadSleeper;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.time.Duration;
import java.util.Objects;

/**
 * OkHttpRemoteLogFetcher
 * =============================================================================
 * {@link RemoteLogFetcher} that issues {@code GET <baseUrl>?key=<key>} with
 * OkHttp and parses the body with a {@link RemoteLogResponseParser}.
 *
 * <h2>Requests</h2>
 * Every attempt carries {@code Authorization: <token>} (sent verbatim),
 * {@code Accept: application/json} and a {@code User-Agent}. The per-attempt
 * timeout bounds connect, read and the call as a whole.
 *
 * <h2>Retries</h2>
 * Non-2xx statuses, timeouts and connection failures are all retried up to
 * {@link RetryPolicy#maxAttempts()} times with {@link RetryPolicy#backoffAfter(int)}
 * pauses in between. The last failure is returned once attempts run out.
 *
 * <h2>Threading</h2>
 * {@link #fetch(String)} blocks for the whole retry sequence. An interrupt
 * during backoff ends the sequence with an {@link FetchFailureKind#UNKNOWN}
 * failure and restores the thread's interrupt flag.
 */
public final class OkHttpRemoteLogFetcher implements RemoteLogFetcher
{
    private static final Logger log = LoggerFactory.getLogger(OkHttpRemoteLogFetcher.class);

    public static final String DEFAULT_USER_AGENT = "log-relay/0.1";

    private final OkHttpClient client;
    private final HttpUrl baseUrl;
    private final String authToken;
    private final String userAgent;
    private final RetryPolicy retryPolicy;
    private final RemoteLogResponseParser parser;
    private final Sleeper sleeper;

    private OkHttpRemoteLogFetcher(Builder b)
    {
        this.baseUrl = Objects.requireNonNull(b.baseUrl, "baseUrl");
        this.authToken = Objects.requireNonNull(b.authToken, "authToken");
        this.userAgent = Objects.requireNonNull(b.userAgent, "userAgent");
        this.retryPolicy = Objects.requireNonNull(b.retryPolicy, "retryPolicy");
        this.parser = Objects.requireNonNull(b.parser, "parser");
        this.sleeper = Objects.requireNonNull(b.sleeper, "sleeper");
        Objects.requireNonNull(b.timeout, "timeout");

        this.client = new OkHttpClient.Builder()
                .connectTimeout(b.timeout)
                .readTimeout(b.timeout)
                .writeTimeout(b.timeout)
                .callTimeout(b.timeout)
                .retryOnConnectionFailure(false)
                .build();
    }

    public static Builder builder()
    {
        return new Builder();
    }

    @Override
    public FetchResult fetch(String key)
    {
        Objects.requireNonNull(key, "key");
        Request request = buildRequest(key);

        FetchResult last = null;
        for (int attempt = 1; attempt <= retryPolicy.maxAttempts(); attempt++) {
            last = attempt(key, request);
            if (last.isSuccess()) {
                if (attempt > 1) {
                    log.info("Fetch for key {} succeeded on attempt {}", key, attempt);
                }
                return last;
            }

            FetchFailure failure = ((FetchResult.Failure) last).failure();
            if (attempt == retryPolicy.maxAttempts()) {
                break;
            }

            Duration backoff = retryPolicy.backoffAfter(attempt);
            log.warn("Fetch attempt {}/{} for key {} failed ({}); retrying in {} ms",
                    attempt, retryPolicy.maxAttempts(), key, failure, backoff.toMillis());
            try {
                sleeper.sleep(backoff);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return FetchResult.failure(FetchFailureKind.UNKNOWN, "Interrupted while backing off");
            }
        }

        log.error("Fetch for key {} failed after {} attempts: {}",
                key, retryPolicy.maxAttempts(), ((FetchResult.Failure) last).failure());
        return last;
    }

    /**
     * Single request used at startup to report whether the remote is
     * reachable. Never retries.
     */
    public boolean testConnection()
    {
        FetchResult result = attempt("test", buildRequest("test"));
        if (result.isSuccess()) {
            log.info("Remote log source {} is reachable", baseUrl);
            return true;
        }
        log.warn("Remote log source {} is not reachable: {}", baseUrl, ((FetchResult.Failure) result).failure());
        return false;
    }

    /**
     * Release pooled connections and dispatcher threads.
     */
    public void close()
    {
        client.dispatcher().executorService().shutdown();
        client.connectionPool().evictAll();
    }

    private Request buildRequest(String key)
    {
        HttpUrl url = baseUrl.newBuilder()
                .addQueryParameter("key", key)
                .build();
        return new Request.Builder()
                .url(url)
                .get()
                .header("Authorization", authToken)
                .header("Accept", "application/json")
                .header("User-Agent", userAgent)
                .build();
    }

    private FetchResult attempt(String key, Request request)
    {
        log.debug("GET {}", request.url());
        try (Response response = client.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                return FetchResult.failure(FetchFailureKind.HTTP_STATUS,
                        "HTTP " + response.code() + describe(response.message()));
            }
            ResponseBody body = response.body();
            String text = body == null ? "" : body.string();
            return FetchResult.success(parser.parse(key, text));
        } catch (InterruptedIOException e) {
            // SocketTimeoutException and OkHttp's call timeout both land here.
            return FetchResult.failure(FetchFailureKind.TIMEOUT, "Request timed out: " + e.getMessage());
        } catch (IOException e) {
            return FetchResult.failure(FetchFailureKind.CONNECTION,
                    e.getClass().getSimpleName() + ": " + e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unexpected error fetching key {}", key, e);
            return FetchResult.failure(FetchFailureKind.UNKNOWN,
                    e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private static String describe(String reason)
    {
        return reason == null || reason.isBlank() ? "" : " " + reason;
    }

    public static final class Builder
    {
        private HttpUrl baseUrl;
        private String authToken;
        private String userAgent = DEFAULT_USER_AGENT;
        private Duration timeout = Duration.ofSeconds(10);
        private RetryPolicy retryPolicy = RetryPolicy.defaults();
        private RemoteLogResponseParser parser = new RemoteLogResponseParser(RemoteLogResponseParser.DEFAULT_MESSAGES_FIELD);
        private Sleeper sleeper = ThreadSleeper.INSTANCE;

        public Builder withBaseUrl(String baseUrl) {
            this.baseUrl = HttpUrl.get(baseUrl);
            return this;
        }

        public Builder withBaseUrl(HttpUrl baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        public Builder withAuthToken(String authToken) {
            this.authToken = authToken;
            return this;
        }

        public Builder withUserAgent(String userAgent) {
            this.userAgent = userAgent;
            return this;
        }

        public Builder withTimeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder withRetryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = retryPolicy;
            return this;
        }

        public Builder withParser(RemoteLogResponseParser parser) {
            this.parser = parser;
            return this;
        }

        public Builder withSleeper(Sleeper sleeper) {
            this.sleeper = sleeper;
            return this;
        }

        public OkHttpRemoteLogFetcher build() {
            return new OkHttpRemoteLogFetcher(this);
        }
    }
}
