package com.buildsync.config;

/**
 * Thrown when promotion configuration is missing or invalid: a required environment variable is unset,
 * or the settings file cannot be read, parsed or written.
 */
public final class PromotionConfigException extends RuntimeException {

    private final String setting;

    public PromotionConfigException(String setting, String message) {
        super(String.format("Invalid configuration %s: %s", setting, message));
        this.setting = setting;
    }

    public PromotionConfigException(String setting, String message, Throwable cause) {
        super(String.format("Invalid configuration %s: %s", setting, message), cause);
        this.setting = setting;
    }

    /** Environment variable or settings file path the error is about. */
    public String getSetting() {
        return setting;
    }
}
