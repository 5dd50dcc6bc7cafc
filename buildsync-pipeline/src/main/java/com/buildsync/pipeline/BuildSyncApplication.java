package com.buildsync.pipeline;

import com.buildsync.client.BuildProjectHttpClient;
import com.buildsync.client.CertificateHeader;
import com.buildsync.config.PromotionConfig;
import com.buildsync.config.PromotionSettings;
import com.buildsync.config.PromotionSettingsLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command-line entry point: promotes the source build project named in the settings file to the target
 * environment. Environments and credentials come from environment variables (see {@link PromotionConfig}).
 * <p>
 * Exit status 0 on success, 1 on failure, 2 when the target was left part-migrated.
 */
public final class BuildSyncApplication {

    private static final Logger log = LoggerFactory.getLogger(BuildSyncApplication.class);

    private BuildSyncApplication() {
    }

    public static void main(String[] args) {
        System.exit(run());
    }

    static int run() {
        try {
            PromotionConfig config = PromotionConfig.fromEnvironment();
            log.info("Starting promotion: {}", config);
            PromotionSettingsLoader settingsLoader = new PromotionSettingsLoader(config.getSettingsFile());
            PromotionSettings settings = settingsLoader.load();

            CertificateHeader certificate = new CertificateHeader(config.getClientCertPath());
            BuildProjectHttpClient source = new BuildProjectHttpClient(
                    config.getSourceHostUrl(), config.getSourceToken(), certificate, config.getHttpTimeout());
            BuildProjectHttpClient target = new BuildProjectHttpClient(
                    config.getTargetHostUrl(), config.getTargetToken(), certificate, config.getHttpTimeout());

            MigrationReport report = MigrationPipeline.builder()
                    .source(source)
                    .target(target, target)
                    .targetFactory(target)
                    .settingsLoader(settingsLoader)
                    .promptUdfCodeGenerator(new PromptUdfCodeGenerator(Sleeper.SYSTEM, config.getPromptUdfSettleDelay()))
                    .build()
                    .run(settings);
            log.info("Build project promoted to target project={}", report.getTargetProjectId());
            return 0;
        } catch (PartialMigrationException e) {
            log.error("Promotion failed; target project={} needs attention (last completed stage {})",
                    e.getTargetProjectId(), e.getLastCompletedStage(), e);
            return 2;
        } catch (RuntimeException e) {
            log.error("Promotion failed: {}", e.getMessage(), e);
            return 1;
        }
    }
}
