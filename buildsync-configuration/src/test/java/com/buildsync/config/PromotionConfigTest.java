package com.buildsync.config;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class PromotionConfigTest {

    private static Map<String, String> requiredVariables() {
        Map<String, String> env = new HashMap<>();
        env.put("SOURCE_HOST_URL", "https://dev.example.com");
        env.put("SOURCE_TOKEN", "dev-token");
        env.put("TARGET_HOST_URL", " https://prod.example.com ");
        env.put("TARGET_TOKEN", "prod-token");
        return env;
    }

    @Test
    void fromEnvironment_appliesDefaults() {
        PromotionConfig config = PromotionConfig.fromEnvironment(requiredVariables());

        assertEquals("https://dev.example.com", config.getSourceHostUrl());
        assertEquals("https://prod.example.com", config.getTargetHostUrl());
        assertEquals("prod-token", config.getTargetToken());
        assertNull(config.getClientCertPath());
        assertEquals(Path.of("config.json"), config.getSettingsFile());
        assertEquals(Duration.ofSeconds(10), config.getPromptUdfSettleDelay());
        assertEquals(Duration.ofSeconds(120), config.getHttpTimeout());
    }

    @Test
    void fromEnvironment_readsOptionalVariables() {
        Map<String, String> env = requiredVariables();
        env.put("IB_CLIENT_CERT_PATH", "/etc/certs/client.pem");
        env.put("BUILDSYNC_SETTINGS_FILE", "promote.json");
        env.put("BUILDSYNC_PROMPT_UDF_SETTLE_SECONDS", "0");
        env.put("BUILDSYNC_HTTP_TIMEOUT_SECONDS", "not-a-number");

        PromotionConfig config = PromotionConfig.fromEnvironment(env);

        assertEquals(Path.of("/etc/certs/client.pem"), config.getClientCertPath());
        assertEquals(Path.of("promote.json"), config.getSettingsFile());
        assertEquals(Duration.ZERO, config.getPromptUdfSettleDelay());
        assertEquals(Duration.ofSeconds(120), config.getHttpTimeout());
    }

    @Test
    void fromEnvironment_missingTokenFails() {
        Map<String, String> env = requiredVariables();
        env.put("SOURCE_TOKEN", "  ");

        PromotionConfigException e = assertThrows(PromotionConfigException.class,
                () -> PromotionConfig.fromEnvironment(env));

        assertEquals("SOURCE_TOKEN", e.getSetting());
    }
}
