package com.amqpit.config;

import io.vertx.proton.ProtonClientOptions;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;
import java.util.Properties;

import static org.assertj.core.api.Assertions.*;

@DisplayName("Receiver Config Tests")
class ReceiverConfigTest {

    @Test
    @DisplayName("Defaults without environment")
    void testDefaults() {
        ReceiverConfig config = new ReceiverConfig(new HashMap<>());

        assertThat(config.getSaslMechanism()).isEqualTo("ANONYMOUS");
        assertThat(config.getMaxFrameSize()).isEqualTo(1024 * 1024);
        assertThat(config.getConnectTimeout()).isEqualTo(60000);
        assertThat(config.getHeartbeat()).isEqualTo(0);
        assertThat(config.getPrefetch()).isEqualTo(10);
        assertThat(config.getContainerId()).startsWith("amqp-types-receiver-");
    }

    @Test
    @DisplayName("Environment variables override defaults")
    void testEnvironment() {
        Map<String, String> env = new HashMap<>();
        env.put("AMQP_TYPES_PREFETCH", "50");
        env.put("AMQP_TYPES_CONTAINER_ID", "env-container");
        env.put("AMQP_TYPES_SASL_MECHANISM", "EXTERNAL");

        ReceiverConfig config = new ReceiverConfig(env);

        assertThat(config.getPrefetch()).isEqualTo(50);
        assertThat(config.getContainerId()).isEqualTo("env-container");
        assertThat(config.getSaslMechanism()).isEqualTo("EXTERNAL");
    }

    @Test
    @DisplayName("Properties override environment")
    void testProperties() {
        Map<String, String> env = new HashMap<>();
        env.put("AMQP_TYPES_PREFETCH", "50");
        Properties properties = new Properties();
        properties.setProperty("amqp.types.prefetch", "5");
        properties.setProperty("amqp.types.heartbeat", "30000");
        properties.setProperty("unrelated.key", "ignored");

        ReceiverConfig config = new ReceiverConfig(env);
        config.loadFromProperties(properties);

        assertThat(config.getPrefetch()).isEqualTo(5);
        assertThat(config.getHeartbeat()).isEqualTo(30000);
        assertThat(config.toMap()).containsEntry("prefetch", 5).containsEntry("heartbeat", 30000);
    }

    @Test
    @DisplayName("Invalid numbers are rejected")
    void testInvalidNumbers() {
        Map<String, String> env = new HashMap<>();
        env.put("AMQP_TYPES_MAX_FRAME_SIZE", "big");
        assertThatThrownBy(() -> new ReceiverConfig(env))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("AMQP_TYPES_MAX_FRAME_SIZE");

        Properties properties = new Properties();
        properties.setProperty("amqp.types.prefetch", "-1");
        ReceiverConfig config = new ReceiverConfig(new HashMap<>());
        assertThatThrownBy(() -> config.loadFromProperties(properties))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("must not be negative");
    }

    @Test
    @DisplayName("Client options carry frame size, timeouts and SASL mechanisms")
    void testClientOptions() {
        ReceiverConfig config = new ReceiverConfig(new HashMap<>());
        config.setMaxFrameSize(65536);
        config.setHeartbeat(10000);

        ProtonClientOptions anonymous = config.toClientOptions(BrokerAddress.parse("localhost:5672"));
        assertThat(anonymous.getMaxFrameSize()).isEqualTo(65536);
        assertThat(anonymous.getHeartbeat()).isEqualTo(10000);
        assertThat(anonymous.getConnectTimeout()).isEqualTo(60000);
        assertThat(anonymous.getEnabledSaslMechanisms()).containsExactly("ANONYMOUS");

        ProtonClientOptions plain = config.toClientOptions(BrokerAddress.parse("user:pw@localhost:5672"));
        assertThat(plain.getEnabledSaslMechanisms()).containsExactlyInAnyOrder("PLAIN", "ANONYMOUS");
    }
}
