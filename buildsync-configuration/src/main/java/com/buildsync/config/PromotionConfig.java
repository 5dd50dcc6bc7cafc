package com.buildsync.config;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Configuration loaded from environment variables for a promotion run.
 * <p>
 * Environments: SOURCE_HOST_URL, SOURCE_TOKEN, TARGET_HOST_URL, TARGET_TOKEN (all required).
 * Client certificate: IB_CLIENT_CERT_PATH (optional). Settings file: BUILDSYNC_SETTINGS_FILE, default {@code config.json}.
 */
public final class PromotionConfig {

    static final String ENV_SOURCE_HOST_URL = "SOURCE_HOST_URL";
    static final String ENV_SOURCE_TOKEN = "SOURCE_TOKEN";
    static final String ENV_TARGET_HOST_URL = "TARGET_HOST_URL";
    static final String ENV_TARGET_TOKEN = "TARGET_TOKEN";
    static final String ENV_CLIENT_CERT_PATH = "IB_CLIENT_CERT_PATH";
    static final String ENV_SETTINGS_FILE = "BUILDSYNC_SETTINGS_FILE";
    static final String ENV_PROMPT_UDF_SETTLE_SECONDS = "BUILDSYNC_PROMPT_UDF_SETTLE_SECONDS";
    static final String ENV_HTTP_TIMEOUT_SECONDS = "BUILDSYNC_HTTP_TIMEOUT_SECONDS";

    private static final String DEFAULT_SETTINGS_FILE = "config.json";
    private static final int DEFAULT_PROMPT_UDF_SETTLE_SECONDS = 10;
    private static final int DEFAULT_HTTP_TIMEOUT_SECONDS = 120;

    private final String sourceHostUrl;
    private final String sourceToken;
    private final String targetHostUrl;
    private final String targetToken;
    private final Path clientCertPath;
    private final Path settingsFile;
    private final Duration promptUdfSettleDelay;
    private final Duration httpTimeout;

    private PromotionConfig(Builder b) {
        this.sourceHostUrl = require(ENV_SOURCE_HOST_URL, b.sourceHostUrl);
        this.sourceToken = require(ENV_SOURCE_TOKEN, b.sourceToken);
        this.targetHostUrl = require(ENV_TARGET_HOST_URL, b.targetHostUrl);
        this.targetToken = require(ENV_TARGET_TOKEN, b.targetToken);
        this.clientCertPath = b.clientCertPath;
        this.settingsFile = b.settingsFile;
        this.promptUdfSettleDelay = b.promptUdfSettleDelay;
        this.httpTimeout = b.httpTimeout;
    }

    /** Base URL of the environment rules are copied from, e.g. {@code https://dev.example.com}. */
    public String getSourceHostUrl() {
        return sourceHostUrl;
    }

    public String getSourceToken() {
        return sourceToken;
    }

    /** Base URL of the environment being updated. */
    public String getTargetHostUrl() {
        return targetHostUrl;
    }

    public String getTargetToken() {
        return targetToken;
    }

    /** PEM file sent base64-encoded as {@code IB-Certificate}; {@code null} when not configured. */
    public Path getClientCertPath() {
        return clientCertPath;
    }

    /** JSON file with the source and target project ids. Default {@code config.json}. */
    public Path getSettingsFile() {
        return settingsFile;
    }

    /** Wait after each prompt-UDF trigger so the target can finish generating. Default 10s. */
    public Duration getPromptUdfSettleDelay() {
        return promptUdfSettleDelay;
    }

    /** Per-request HTTP timeout. Default 120s. */
    public Duration getHttpTimeout() {
        return httpTimeout;
    }

    public static PromotionConfig fromEnvironment() {
        return fromEnvironment(System::getenv);
    }

    /** Same as {@link #fromEnvironment()} over an explicit variable map. */
    public static PromotionConfig fromEnvironment(Map<String, String> variables) {
        Objects.requireNonNull(variables, "variables");
        return fromEnvironment(variables::get);
    }

    private static PromotionConfig fromEnvironment(Function<String, String> env) {
        String certPath = getEnv(env, ENV_CLIENT_CERT_PATH, null);
        return builder()
                .sourceHostUrl(getEnv(env, ENV_SOURCE_HOST_URL, null))
                .sourceToken(getEnv(env, ENV_SOURCE_TOKEN, null))
                .targetHostUrl(getEnv(env, ENV_TARGET_HOST_URL, null))
                .targetToken(getEnv(env, ENV_TARGET_TOKEN, null))
                .clientCertPath(certPath != null ? Path.of(certPath) : null)
                .settingsFile(Path.of(getEnv(env, ENV_SETTINGS_FILE, DEFAULT_SETTINGS_FILE)))
                .promptUdfSettleDelay(Duration.ofSeconds(
                        parseInt(getEnv(env, ENV_PROMPT_UDF_SETTLE_SECONDS, null), DEFAULT_PROMPT_UDF_SETTLE_SECONDS)))
                .httpTimeout(Duration.ofSeconds(
                        parseInt(getEnv(env, ENV_HTTP_TIMEOUT_SECONDS, null), DEFAULT_HTTP_TIMEOUT_SECONDS)))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    private static String require(String name, String value) {
        if (value == null || value.isBlank()) {
            throw new PromotionConfigException(name, "required but not set");
        }
        return value.trim();
    }

    private static int parseInt(String value, int defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            int parsed = Integer.parseInt(value.trim());
            return parsed >= 0 ? parsed : defaultValue;
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    private static String getEnv(Function<String, String> env, String key, String defaultValue) {
        String v = env.apply(key);
        return (v != null && !v.isBlank()) ? v.trim() : defaultValue;
    }

    @Override
    public String toString() {
        return "PromotionConfig{source=" + sourceHostUrl + ", target=" + targetHostUrl
                + ", settingsFile=" + settingsFile + ", clientCert=" + (clientCertPath != null) + "}";
    }

    public static final class Builder {
        private String sourceHostUrl;
        private String sourceToken;
        private String targetHostUrl;
        private String targetToken;
        private Path clientCertPath;
        private Path settingsFile = Path.of(DEFAULT_SETTINGS_FILE);
        private Duration promptUdfSettleDelay = Duration.ofSeconds(DEFAULT_PROMPT_UDF_SETTLE_SECONDS);
        private Duration httpTimeout = Duration.ofSeconds(DEFAULT_HTTP_TIMEOUT_SECONDS);

        public Builder sourceHostUrl(String sourceHostUrl) {
            this.sourceHostUrl = sourceHostUrl;
            return this;
        }

        public Builder sourceToken(String sourceToken) {
            this.sourceToken = sourceToken;
            return this;
        }

        public Builder targetHostUrl(String targetHostUrl) {
            this.targetHostUrl = targetHostUrl;
            return this;
        }

        public Builder targetToken(String targetToken) {
            this.targetToken = targetToken;
            return this;
        }

        public Builder clientCertPath(Path clientCertPath) {
            this.clientCertPath = clientCertPath;
            return this;
        }

        public Builder settingsFile(Path settingsFile) {
            this.settingsFile = settingsFile != null ? settingsFile : Path.of(DEFAULT_SETTINGS_FILE);
            return this;
        }

        public Builder promptUdfSettleDelay(Duration promptUdfSettleDelay) {
            this.promptUdfSettleDelay = Objects.requireNonNull(promptUdfSettleDelay, "promptUdfSettleDelay");
            return this;
        }

        public Builder httpTimeout(Duration httpTimeout) {
            this.httpTimeout = Objects.requireNonNull(httpTimeout, "httpTimeout");
            return this;
        }

        public PromotionConfig build() {
            return new PromotionConfig(this);
        }
    }
}
