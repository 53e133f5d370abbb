package com.p14n.eventbridge;

import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.Map;

import com.p14n.eventbridge.broker.EventBus;
import com.p14n.eventbridge.data.ConfigData;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.sdk.OpenTelemetrySdk;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the bridge as a process. Configuration comes from the environment;
 * monitoring events are read as JSON lines from standard input.
 *
 * <p>
 * Environment variables:
 * </p>
 * <ul>
 * <li>{@code BRIDGE_NAME}: instance name, default {@code event-bridge}</li>
 * <li>{@code BRIDGE_STORE_HOST} / {@code BRIDGE_STORE_PORT}: store address,
 * default {@code 127.0.0.1:6379}</li>
 * <li>{@code BRIDGE_STORE_PATH}: local socket path, wins over host and
 * port</li>
 * <li>{@code BRIDGE_STORE_PASSWORD}: sent with AUTH after connecting</li>
 * <li>{@code BRIDGE_KEY_PREFIX}: default {@code icinga}</li>
 * <li>{@code BRIDGE_RECONNECT_INTERVAL}, {@code BRIDGE_SUBSCRIPTION_INTERVAL}:
 * seconds, default 15</li>
 * <li>{@code BRIDGE_EVENT_TTL}: seconds, default 3600</li>
 * <li>{@code BRIDGE_OTLP_ENDPOINT}: enables span export to this collector</li>
 * </ul>
 */
public class App {

    private static final Logger logger = LoggerFactory.getLogger(App.class);

    private static String env(Map<String, String> env, String name, String defaultValue) {
        var e = env.get(name);
        if (e != null && !e.isBlank()) {
            return e.trim();
        }
        return defaultValue;
    }

    private static int envInt(Map<String, String> env, String name, int defaultValue) {
        var e = env(env, name, null);
        if (e == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(e);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(name + " must be a number but was '" + e + "'", ex);
        }
    }

    static ConfigData configFromEnv(Map<String, String> env) {
        return new ConfigData(
                env(env, "BRIDGE_NAME", "event-bridge"),
                env(env, "BRIDGE_STORE_HOST", "127.0.0.1"),
                envInt(env, "BRIDGE_STORE_PORT", 6379),
                env(env, "BRIDGE_STORE_PATH", null),
                env(env, "BRIDGE_STORE_PASSWORD", null),
                env(env, "BRIDGE_KEY_PREFIX", "icinga"),
                envInt(env, "BRIDGE_RECONNECT_INTERVAL", 15),
                envInt(env, "BRIDGE_SUBSCRIPTION_INTERVAL", 15),
                envInt(env, "BRIDGE_EVENT_TTL", 3600));
    }

    public static void main(String[] args) throws Exception {
        Map<String, String> env = System.getenv();
        ConfigData cfg = configFromEnv(env);
        String endpoint = env(env, "BRIDGE_OTLP_ENDPOINT", null);
        OpenTelemetry ot = endpoint == null ? OpenTelemetry.noop() : Opentelemetry.create(cfg.name(), endpoint);

        var bus = new EventBus();
        try (var bridge = new EventBridge(cfg, bus, ot)) {
            bridge.start();
            int count = new EventFeed(bus).pump(new InputStreamReader(System.in, StandardCharsets.UTF_8));
            logger.atInfo().addArgument(count).log("Input closed after {} events");
        } finally {
            bus.close();
            if (ot instanceof OpenTelemetrySdk) {
                ((OpenTelemetrySdk) ot).close();
            }
        }
    }
}
