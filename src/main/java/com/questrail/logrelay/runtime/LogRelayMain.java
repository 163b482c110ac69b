package com.questrail.logrelay.runtime;

import com.questrail.logrelay.config.RelayConfig;
import com.questrail.logrelay.config.RelayConfigException;
import com.questrail.logrelay.config.RelayConfigLoader;
import com.questrail.logrelay.observability.Slf4jRelayObservabilitySink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.CountDownLatch;

/**
 * Process entry point. Reads configuration from the environment, starts the
 * relay and stops it on JVM shutdown.
 */
public final class LogRelayMain
{
    static final String LOG_LEVEL_PROPERTY = "org.slf4j.simpleLogger.defaultLogLevel";

    private LogRelayMain() {
    }

    public static void main(String[] args) throws InterruptedException
    {
        Map<String, String> env = System.getenv();
        configureLogLevel(env.getOrDefault("RELAY_ENV", env.getOrDefault("NODE_ENV", "development")));
        Logger log = LoggerFactory.getLogger(LogRelayMain.class);

        RelayConfig config;
        try {
            config = RelayConfigLoader.fromEnvironment(env);
        } catch (RelayConfigException e) {
            for (String problem : e.problems()) {
                log.error("Configuration: {}", problem);
            }
            System.exit(1);
            return;
        }

        LogRelayRuntime runtime = LogRelayRuntime.builder()
                .withConfig(config)
                .withObservabilitySink(new Slf4jRelayObservabilitySink())
                .build();

        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            runtime.stop();
            stopped.countDown();
        }, "log-relay-shutdown"));

        try {
            runtime.start();
        } catch (Exception e) {
            // Bind failures surface here as undeclared checked exceptions.
            log.error("Failed to start log relay", e);
            runtime.stop();
            System.exit(1);
            return;
        }
        stopped.await();
    }

    /**
     * Default log level per environment unless one was set explicitly.
     * Must run before the first logger is created.
     */
    static String configureLogLevel(String environment)
    {
        String existing = System.getProperty(LOG_LEVEL_PROPERTY);
        if (existing != null) {
            return existing;
        }
        String level;
        switch (environment.toLowerCase()) {
            case "production":
                level = "info";
                break;
            case "test":
                level = "warn";
                break;
            default:
                level = "debug";
        }
        System.setProperty(LOG_LEVEL_PROPERTY, level);
        return level;
    }
}
