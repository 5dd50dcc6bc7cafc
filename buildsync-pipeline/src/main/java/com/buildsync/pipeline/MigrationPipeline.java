package com.buildsync.pipeline;

import com.buildsync.config.PromotionConfigException;
import com.buildsync.config.PromotionSettings;
import com.buildsync.config.PromotionSettingsLoader;
import com.buildsync.model.SchemaDocument;
import com.buildsync.model.UdfCatalog;
import com.buildsync.model.ValidationDocument;
import com.buildsync.model.ValidationKind;
import com.buildsync.reconcile.FieldIdMapper;
import com.buildsync.reconcile.IdMapping;
import com.buildsync.reconcile.SchemaPayload;
import com.buildsync.reconcile.SchemaReconciler;
import com.buildsync.reconcile.SettingsReconciler;
import com.buildsync.reconcile.UdfReplicator;
import com.buildsync.reconcile.UdfSanitizer;
import com.buildsync.reconcile.ValidationPayload;
import com.buildsync.reconcile.ValidationReconciler;
import com.buildsync.reconcile.api.BuildProjectFactory;
import com.buildsync.reconcile.api.BuildProjectReader;
import com.buildsync.reconcile.api.BuildProjectWriter;
import com.buildsync.reconcile.match.MatchKeyStrategy;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Promotes a build project from a source environment to a target environment.
 * <p>
 * Stages run strictly in {@link MigrationStage} order and the first failure ends the run. When no target
 * project id is configured, the target project is created first (named like the source project) and the
 * settings file is rewritten with its id. Project settings are copied before the schema.
 * <p>
 * A failure before anything was written to the target propagates unchanged. A failure after the target
 * was changed is wrapped in {@link PartialMigrationException}.
 */
public final class MigrationPipeline {

    private static final Logger log = LoggerFactory.getLogger(MigrationPipeline.class);

    private final BuildProjectReader source;
    private final BuildProjectReader targetReader;
    private final BuildProjectWriter targetWriter;
    private final BuildProjectFactory targetFactory;
    private final PromotionSettingsLoader settingsLoader;
    private final PromptUdfCodeGenerator promptUdfCodeGenerator;
    private final MatchKeyStrategy matchKeys;

    private MigrationPipeline(Builder b) {
        this.source = Objects.requireNonNull(b.source, "source");
        this.targetReader = Objects.requireNonNull(b.targetReader, "targetReader");
        this.targetWriter = Objects.requireNonNull(b.targetWriter, "targetWriter");
        this.targetFactory = b.targetFactory;
        this.settingsLoader = b.settingsLoader;
        this.promptUdfCodeGenerator = Objects.requireNonNull(b.promptUdfCodeGenerator, "promptUdfCodeGenerator");
        this.matchKeys = b.matchKeys;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Runs all stages.
     *
     * @return report of the completed run
     * @throws PartialMigrationException when a stage fails after the target was changed
     */
    public MigrationReport run(PromotionSettings settings) {
        Objects.requireNonNull(settings, "settings");
        String sourceProjectId = settings.getSourceProjectId();
        if (sourceProjectId == null) {
            throw new PromotionConfigException("source.project_id", "required but not set");
        }

        TrackingBuildProjectWriter target = new TrackingBuildProjectWriter(targetWriter);
        MigrationStage completed = null;
        String targetProjectId = settings.getTargetProjectId();
        boolean projectCreated = false;
        try {
            log.info("Fetching source project={}", sourceProjectId);
            JsonNode projects = source.fetchSettings(sourceProjectId);
            UdfCatalog udfs = source.fetchUdfs(sourceProjectId);
            SchemaDocument sourceSchema = source.fetchSchema(sourceProjectId);
            ValidationDocument sourceValidations = source.fetchValidations(sourceProjectId);
            completed = MigrationStage.FETCHED;
            log.info("Fetched source project={}: {} class(es), {} UDF(s), {} rule(s)", sourceProjectId,
                    sourceSchema.getClasses().size(), udfs.size(), sourceValidations.getRules().size());

            SettingsReconciler settingsReconciler = new SettingsReconciler();
            if (targetProjectId == null) {
                targetProjectId = createTargetProject(settings, settingsReconciler.projectName(projects, sourceProjectId));
                projectCreated = true;
            }
            target.postSettings(targetProjectId, settingsReconciler.reconcile(projects, sourceProjectId));

            SchemaDocument targetSchema = targetReader.fetchSchema(targetProjectId);
            UdfCatalog sanitizedUdfs = new UdfSanitizer().sanitize(udfs);
            UdfReplicator replicator = new UdfReplicator(target, targetProjectId, sanitizedUdfs);
            SchemaPayload schemaPayload = new SchemaReconciler(matchKeys).reconcile(sourceSchema, targetSchema, replicator);
            completed = MigrationStage.SCHEMA_RECONCILED;

            SchemaDocument persistedSchema = target.postSchema(targetProjectId, schemaPayload);
            completed = MigrationStage.SCHEMA_PERSISTED;

            IdMapping mapping = new FieldIdMapper(matchKeys).map(sourceSchema, persistedSchema);
            completed = MigrationStage.IDS_MAPPED;
            log.info("Mapped {} source id(s) to target project={}", mapping.size(), targetProjectId);

            List<ValidationPayload> payloads = new ValidationReconciler(target, targetProjectId).reconcile(
                    targetReader.fetchValidations(targetProjectId), sourceValidations, mapping, replicator);
            completed = MigrationStage.VALIDATIONS_RECONCILED;

            List<String> validationIds = new ArrayList<>(payloads.size());
            for (ValidationPayload payload : payloads) {
                String ruleId = target.postValidation(targetProjectId, payload);
                validationIds.add(ruleId);
                log.debug("Persisted rule '{}' id={}", payload.getName(), ruleId);
                if (payload.getKind() == ValidationKind.PROMPT_UDF) {
                    promptUdfCodeGenerator.generate(target, targetProjectId, ruleId);
                }
            }
            completed = MigrationStage.VALIDATIONS_PERSISTED;

            MigrationReport report = new MigrationReport(targetProjectId, projectCreated, completed,
                    schemaPayload.getClasses().size(), schemaPayload.getNewClasses().size(),
                    replicator.getCreatedCount(), validationIds);
            log.info("Migration finished: {}", report);
            return report;
        } catch (RuntimeException e) {
            if (projectCreated || target.hasCommitted()) {
                log.error("Migration failed after changing target project={} lastStage={}: {}",
                        targetProjectId, completed, e.getMessage());
                throw new PartialMigrationException(targetProjectId, completed, target.getCommittedCount(), e);
            }
            log.error("Migration failed before changing the target: {}", e.getMessage());
            throw e;
        }
    }

    private String createTargetProject(PromotionSettings settings, String projectName) {
        if (targetFactory == null) {
            throw new PromotionConfigException("target.project_id", "not set and project creation is not available");
        }
        String org = settings.getTargetOrg();
        String workspace = settings.getTargetWorkspace();
        if (org == null || workspace == null) {
            throw new PromotionConfigException("target.org/target.workspace",
                    "required to create the target project");
        }
        String projectId = targetFactory.createProject(projectName, org, workspace);
        if (settingsLoader != null) {
            settingsLoader.save(settings.withTargetProjectId(projectId));
        }
        return projectId;
    }

    public static final class Builder {
        private BuildProjectReader source;
        private BuildProjectReader targetReader;
        private BuildProjectWriter targetWriter;
        private BuildProjectFactory targetFactory;
        private PromotionSettingsLoader settingsLoader;
        private PromptUdfCodeGenerator promptUdfCodeGenerator;
        private MatchKeyStrategy matchKeys = MatchKeyStrategy.BY_NAME;

        public Builder source(BuildProjectReader source) {
            this.source = source;
            return this;
        }

        /** Target environment; a single object usually implements both sides. */
        public Builder target(BuildProjectReader targetReader, BuildProjectWriter targetWriter) {
            this.targetReader = targetReader;
            this.targetWriter = targetWriter;
            return this;
        }

        /** Used only when the settings carry no target project id. */
        public Builder targetFactory(BuildProjectFactory targetFactory) {
            this.targetFactory = targetFactory;
            return this;
        }

        /** Receives the settings with the new target project id after a project is created. */
        public Builder settingsLoader(PromotionSettingsLoader settingsLoader) {
            this.settingsLoader = settingsLoader;
            return this;
        }

        public Builder promptUdfCodeGenerator(PromptUdfCodeGenerator promptUdfCodeGenerator) {
            this.promptUdfCodeGenerator = promptUdfCodeGenerator;
            return this;
        }

        public Builder matchKeys(MatchKeyStrategy matchKeys) {
            this.matchKeys = matchKeys != null ? matchKeys : MatchKeyStrategy.BY_NAME;
            return this;
        }

        public MigrationPipeline build() {
            return new MigrationPipeline(this);
        }
    }
}
