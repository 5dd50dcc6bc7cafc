package com.buildsync.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Reads and rewrites the promotion settings file.
 */
public final class PromotionSettingsLoader {

    private static final Logger log = LoggerFactory.getLogger(PromotionSettingsLoader.class);
    private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private final Path file;

    public PromotionSettingsLoader(Path file) {
        this.file = Objects.requireNonNull(file, "file");
    }

    /**
     * @throws PromotionConfigException when the file is missing, unreadable, not a JSON object,
     *                                  or has no {@code source.project_id}
     */
    public PromotionSettings load() {
        if (!Files.isRegularFile(file)) {
            throw new PromotionConfigException(file.toString(), "settings file not found");
        }
        JsonNode root;
        try {
            root = MAPPER.readTree(file.toFile());
        } catch (IOException e) {
            throw new PromotionConfigException(file.toString(), "cannot parse settings file: " + e.getMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new PromotionConfigException(file.toString(), "settings file must contain a JSON object");
        }
        PromotionSettings settings = new PromotionSettings(root);
        if (settings.getSourceProjectId() == null) {
            throw new PromotionConfigException(file.toString(), "source.project_id is required");
        }
        log.info("Loaded promotion settings file={} source={} target={}",
                file, settings.getSourceProjectId(), settings.getTargetProjectId());
        return settings;
    }

    /** Overwrites the settings file with the given settings. */
    public void save(PromotionSettings settings) {
        Objects.requireNonNull(settings, "settings");
        try {
            MAPPER.writeValue(file.toFile(), settings.toTree());
        } catch (IOException e) {
            throw new PromotionConfigException(file.toString(), "cannot write settings file: " + e.getMessage(), e);
        }
        log.info("Saved promotion settings file={} target={}", file, settings.getTargetProjectId());
    }
}
