package com.amqpit.config;

import io.vertx.proton.ProtonClientOptions;

import java.util.HashMap;
import java.util.Map;
import java.util.Properties;
import java.util.UUID;

/**
 * Connection settings for the types receiver.
 * Defaults are overridden by environment variables, then by properties (normally the JVM system properties).
 */
public class ReceiverConfig {

    public static final String PROPERTY_PREFIX = "amqp.types.";

    // Client configuration
    private String saslMechanism = "ANONYMOUS";
    private int maxFrameSize = 1024 * 1024; // 1MB
    private int connectTimeout = 60000; // milliseconds
    private int heartbeat = 0; // milliseconds, 0 = disabled

    // Link configuration
    private int prefetch = 10;
    private String containerId = "amqp-types-receiver-" + UUID.randomUUID().toString().substring(0, 8);

    public ReceiverConfig() {
        this(System.getenv());
    }

    public ReceiverConfig(Map<String, String> env) {
        loadFromEnvironment(env);
    }

    /**
     * Load configuration from environment variables.
     */
    private void loadFromEnvironment(Map<String, String> env) {
        if (env.containsKey("AMQP_TYPES_SASL_MECHANISM")) {
            saslMechanism = env.get("AMQP_TYPES_SASL_MECHANISM");
        }
        if (env.containsKey("AMQP_TYPES_MAX_FRAME_SIZE")) {
            maxFrameSize = parseInt("AMQP_TYPES_MAX_FRAME_SIZE", env.get("AMQP_TYPES_MAX_FRAME_SIZE"));
        }
        if (env.containsKey("AMQP_TYPES_CONNECT_TIMEOUT")) {
            connectTimeout = parseInt("AMQP_TYPES_CONNECT_TIMEOUT", env.get("AMQP_TYPES_CONNECT_TIMEOUT"));
        }
        if (env.containsKey("AMQP_TYPES_HEARTBEAT")) {
            heartbeat = parseInt("AMQP_TYPES_HEARTBEAT", env.get("AMQP_TYPES_HEARTBEAT"));
        }
        if (env.containsKey("AMQP_TYPES_PREFETCH")) {
            prefetch = parseInt("AMQP_TYPES_PREFETCH", env.get("AMQP_TYPES_PREFETCH"));
        }
        if (env.containsKey("AMQP_TYPES_CONTAINER_ID")) {
            containerId = env.get("AMQP_TYPES_CONTAINER_ID");
        }
    }

    /**
     * Load configuration from Properties object. Only keys under {@link #PROPERTY_PREFIX} are read.
     */
    public void loadFromProperties(Properties properties) {
        String key = PROPERTY_PREFIX + "sasl.mechanism";
        if (properties.containsKey(key)) {
            saslMechanism = properties.getProperty(key);
        }
        key = PROPERTY_PREFIX + "max-frame-size";
        if (properties.containsKey(key)) {
            maxFrameSize = parseInt(key, properties.getProperty(key));
        }
        key = PROPERTY_PREFIX + "connect-timeout";
        if (properties.containsKey(key)) {
            connectTimeout = parseInt(key, properties.getProperty(key));
        }
        key = PROPERTY_PREFIX + "heartbeat";
        if (properties.containsKey(key)) {
            heartbeat = parseInt(key, properties.getProperty(key));
        }
        key = PROPERTY_PREFIX + "prefetch";
        if (properties.containsKey(key)) {
            prefetch = parseInt(key, properties.getProperty(key));
        }
        key = PROPERTY_PREFIX + "container-id";
        if (properties.containsKey(key)) {
            containerId = properties.getProperty(key);
        }
    }

    private static int parseInt(String name, String value) {
        try {
            int parsed = Integer.parseInt(value.trim());
            if (parsed < 0) {
                throw new IllegalArgumentException(name + " must not be negative (was " + value + ")");
            }
            return parsed;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " is not a number: " + value, e);
        }
    }

    /**
     * Client options for connecting to {@code address}. PLAIN is offered as well when the
     * address carries credentials.
     */
    public ProtonClientOptions toClientOptions(BrokerAddress address) {
        ProtonClientOptions options = new ProtonClientOptions()
                .setMaxFrameSize(maxFrameSize)
                .setHeartbeat(heartbeat)
                .setConnectTimeout(connectTimeout);
        if (address.hasCredentials()) {
            options.addEnabledSaslMechanism("PLAIN");
        }
        options.addEnabledSaslMechanism(saslMechanism);
        return options;
    }

    /**
     * Export configuration as a map.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new HashMap<>();
        map.put("saslMechanism", saslMechanism);
        map.put("maxFrameSize", maxFrameSize);
        map.put("connectTimeout", connectTimeout);
        map.put("heartbeat", heartbeat);
        map.put("prefetch", prefetch);
        map.put("containerId", containerId);
        return map;
    }

    // Getters and setters

    public String getSaslMechanism() {
        return saslMechanism;
    }

    public void setSaslMechanism(String saslMechanism) {
        this.saslMechanism = saslMechanism;
    }

    public int getMaxFrameSize() {
        return maxFrameSize;
    }

    public void setMaxFrameSize(int maxFrameSize) {
        this.maxFrameSize = maxFrameSize;
    }

    public int getConnectTimeout() {
        return connectTimeout;
    }

    public void setConnectTimeout(int connectTimeout) {
        this.connectTimeout = connectTimeout;
    }

    public int getHeartbeat() {
        return heartbeat;
    }

    public void setHeartbeat(int heartbeat) {
        this.heartbeat = heartbeat;
    }

    public int getPrefetch() {
        return prefetch;
    }

    public void setPrefetch(int prefetch) {
        this.prefetch = prefetch;
    }

    public String getContainerId() {
        return containerId;
    }

    public void setContainerId(String containerId) {
        this.containerId = containerId;
    }
}
