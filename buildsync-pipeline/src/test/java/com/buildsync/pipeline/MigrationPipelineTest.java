package com.buildsync.pipeline;

import com.buildsync.config.PromotionConfigException;
import com.buildsync.config.PromotionSettings;
import com.buildsync.config.PromotionSettingsLoader;
import com.buildsync.model.BuildJson;
import com.buildsync.model.SchemaDocument;
import com.buildsync.model.UdfCatalog;
import com.buildsync.model.ValidationDocument;
import com.buildsync.reconcile.MissingEntityException;
import com.buildsync.reconcile.UnmappedReferenceException;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MigrationPipelineTest {

    @TempDir
    Path tempDir;

    private final List<String> calls = new ArrayList<>();
    private FakeBuildEnvironment source;
    private FakeBuildEnvironment target;

    @BeforeEach
    void setUp() {
        source = new FakeBuildEnvironment(new ArrayList<>());
        source.settings = BuildJson.readTree("""
                {"projects": [{"id": "src", "name": "Invoices", "workspace": "dev-ws", "ocr_mode": "accurate"}]}
                """);
        source.schema = SchemaDocument.fromJson("""
                {"2": {"name": "Invoice", "description": "", "fields": {
                   "3": {"name": "Total", "lines": []},
                   "4": {"name": "Date", "lines": []}}}}
                """);
        source.udfs = UdfCatalog.fromJson("{\"42\": {\"name\": \"date_ok\", \"docstring\": \"d\"}}");
        source.validations = ValidationDocument.fromJson("""
                {"rules": [
                  {"id": 1, "name": "Total confident", "type": "FIELD_CONFIDENCE", "affected_fields": [3]},
                  {"id": 2, "name": "Date plausible", "type": "PROMPT_UDF", "affected_fields": [4],
                   "params": {"udf_id": 42}}]}
                """);

        target = new FakeBuildEnvironment(calls);
        target.schema = SchemaDocument.fromJson("""
                {"5": {"name": "Invoice", "description": "", "fields": {"7": {"name": "Total", "lines": []}}}}
                """);
        target.persistedSchema = SchemaDocument.fromJson("""
                {"5": {"name": "Invoice", "fields": {"7": {"name": "Total"}, "8": {"name": "Date"}}},
                 "last_edited_at": 1}
                """);
    }

    private MigrationPipeline pipeline(PromotionSettingsLoader loader) {
        Sleeper recordingSleeper = duration -> calls.add("sleep:" + duration.getSeconds());
        return MigrationPipeline.builder()
                .source(source)
                .target(target, target)
                .targetFactory(target)
                .settingsLoader(loader)
                .promptUdfCodeGenerator(new PromptUdfCodeGenerator(recordingSleeper, Duration.ofSeconds(10)))
                .build();
    }

    private static PromotionSettings settings(String json) {
        return new PromotionSettings(BuildJson.readTree(json));
    }

    @Test
    void run_migratesIntoExistingTargetInStageOrder() {
        MigrationReport report = pipeline(null).run(settings("""
                {"source": {"project_id": "src"}, "target": {"project_id": "tgt"}}
                """));

        assertEquals(List.of(
                "postSettings:tgt",
                "postSchema:tgt",
                "createUdf:100",
                "triggerExamples:100",
                "postValidation:500",
                "postValidation:501",
                "triggerExamples:501",
                "sleep:10",
                "triggerCodeGeneration:501",
                "sleep:10"), calls);
        assertEquals("tgt", report.getTargetProjectId());
        assertFalse(report.isProjectCreated());
        assertEquals(MigrationStage.VALIDATIONS_PERSISTED, report.getStage());
        assertEquals(1, report.getClassesUpdated());
        assertEquals(0, report.getClassesAdded());
        assertEquals(1, report.getCreatedUdfCount());
        assertEquals(List.of("500", "501"), report.getValidationIds());

        JsonNode total = target.postedValidations.get(0);
        assertEquals(7, total.get("affected_fields").get(0).asInt());
        JsonNode date = target.postedValidations.get(1);
        assertEquals(8, date.get("affected_fields").get(0).asInt());
        assertEquals(100, date.get("params").get("udf_id").asInt());
    }

    @Test
    void run_createsTargetProjectAndSavesSettingsFile() throws IOException {
        Path file = tempDir.resolve("config.json");
        Files.writeString(file, """
                {"source": {"project_id": "src"}, "target": {"org": "acme", "workspace": "prod-ws"}}
                """);
        PromotionSettingsLoader loader = new PromotionSettingsLoader(file);

        MigrationReport report = pipeline(loader).run(loader.load());

        assertEquals("createProject:Invoices/acme/prod-ws", calls.get(0));
        assertEquals("postSettings:created-project", calls.get(1));
        assertTrue(report.isProjectCreated());
        assertEquals("created-project", report.getTargetProjectId());
        assertEquals("created-project", loader.load().getTargetProjectId());
    }

    @Test
    void run_missingOrgForNewProjectFailsBeforeAnyChange() {
        PromotionConfigException e = assertThrows(PromotionConfigException.class,
                () -> pipeline(null).run(settings("{\"source\": {\"project_id\": \"src\"}}")));

        assertTrue(e.getMessage().contains("target.org"));
        assertTrue(calls.isEmpty());
    }

    @Test
    void run_failureBeforeTargetChangesPropagatesUnchanged() {
        RuntimeException boom = new IllegalStateException("source unavailable");
        source.failOnFetchSchema = boom;

        RuntimeException e = assertThrows(RuntimeException.class, () -> pipeline(null).run(settings("""
                {"source": {"project_id": "src"}, "target": {"project_id": "tgt"}}
                """)));

        assertSame(boom, e);
        assertTrue(calls.isEmpty());
    }

    @Test
    void run_unmappedReferenceAfterSchemaPersistedIsPartial() {
        target.persistedSchema = SchemaDocument.fromJson("""
                {"5": {"name": "Invoice", "fields": {"7": {"name": "Total"}}}}
                """);

        PartialMigrationException e = assertThrows(PartialMigrationException.class, () -> pipeline(null).run(settings("""
                {"source": {"project_id": "src"}, "target": {"project_id": "tgt"}}
                """)));

        assertEquals(MigrationStage.IDS_MAPPED, e.getLastCompletedStage());
        assertEquals("tgt", e.getTargetProjectId());
        assertTrue(e.getCause() instanceof UnmappedReferenceException);
        assertEquals(2, e.getCommittedCalls());
        assertFalse(calls.stream().anyMatch(c -> c.startsWith("postValidation")));
    }

    @Test
    void run_missingUdfDuringSchemaReconciliationIsPartialAfterSettingsCopied() {
        source.schema = SchemaDocument.fromJson("""
                {"2": {"name": "Invoice", "fields": {"3": {"name": "Total", "lines": [{"line_type": "UDF", "function_id": 77}]}}}}
                """);

        PartialMigrationException e = assertThrows(PartialMigrationException.class, () -> pipeline(null).run(settings("""
                {"source": {"project_id": "src"}, "target": {"project_id": "tgt"}}
                """)));

        assertEquals(MigrationStage.FETCHED, e.getLastCompletedStage());
        assertTrue(e.getCause() instanceof MissingEntityException);
        assertEquals(List.of("postSettings:tgt"), calls);
    }

    @Test
    void run_replacesSameNamedTargetRule() {
        target.validations = ValidationDocument.fromJson("""
                {"rules": [{"id": 90, "name": "Total confident", "type": "FIELD_CONFIDENCE", "affected_fields": [7]}]}
                """);

        pipeline(null).run(settings("""
                {"source": {"project_id": "src"}, "target": {"project_id": "tgt"}}
                """));

        assertTrue(calls.indexOf("deleteValidation:90") < calls.indexOf("postValidation:500"));
    }
}
