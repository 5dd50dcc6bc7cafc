package com.buildsync.reconcile;

import com.buildsync.model.BuildJson;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SettingsReconcilerTest {

    private static final JsonNode LISTING = BuildJson.readTree("""
            {"projects": [
              {"id": "p-1", "name": "Other", "ocr_mode": "fast"},
              {"id": "p-2", "name": "Invoices", "project_root": "/a", "data_root": "/b", "workspace": "ws",
               "ocr_mode": "accurate", "languages": ["en", "de"]}
            ]}
            """);

    @Test
    void reconcile_keepsSettingsAndDropsProjectLocalAttributes() {
        ObjectNode settings = new SettingsReconciler().reconcile(LISTING, "p-2");

        assertEquals("accurate", settings.get("ocr_mode").asText());
        assertEquals(2, settings.get("languages").size());
        for (String attribute : SettingsReconciler.PROJECT_LOCAL_ATTRIBUTES) {
            assertFalse(settings.has(attribute), attribute);
        }
        assertTrue(LISTING.get("projects").get(1).has("project_root"));
    }

    @Test
    void reconcile_unknownProjectFails() {
        MissingEntityException e = assertThrows(MissingEntityException.class,
                () -> new SettingsReconciler().reconcile(LISTING, "p-3"));

        assertEquals(EntityKind.PROJECT, e.getKind());
        assertEquals("p-3", e.getKey());
    }

    @Test
    void projectName_readsNameOfProject() {
        assertEquals("Invoices", new SettingsReconciler().projectName(LISTING, "p-2"));
    }

    @Test
    void reconcile_numericProjectIdMatches() {
        JsonNode listing = BuildJson.readTree("{\"projects\": [{\"id\": 17, \"name\": \"n\", \"mode\": \"x\"}]}");

        assertEquals("x", new SettingsReconciler().reconcile(listing, "17").get("mode").asText());
    }
}
