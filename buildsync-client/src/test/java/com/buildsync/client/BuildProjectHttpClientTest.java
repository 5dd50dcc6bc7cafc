package com.buildsync.client;

import com.buildsync.model.BuildJson;
import com.buildsync.model.SchemaDocument;
import com.buildsync.model.UdfCatalog;
import com.buildsync.model.ValidationDocument;
import com.fasterxml.jackson.databind.JsonNode;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BuildProjectHttpClientTest {

    private static final String BASE = "/api/v2/aihub/build/projects";

    /** Request as seen by the server. */
    private static final class Recorded {
        final String method;
        final String uri;
        final String authorization;
        final String certificate;
        final String context;
        final String body;

        Recorded(HttpExchange exchange, String body) {
            this.method = exchange.getRequestMethod();
            this.uri = exchange.getRequestURI().toString();
            this.authorization = exchange.getRequestHeaders().getFirst("Authorization");
            this.certificate = exchange.getRequestHeaders().getFirst(CertificateHeader.NAME);
            this.context = exchange.getRequestHeaders().getFirst("Ib-Context");
            this.body = body;
        }
    }

    private HttpServer server;
    private String hostUrl;
    private final List<Recorded> requests = new CopyOnWriteArrayList<>();
    /** "METHOD path" → {status, body}; unmatched requests get 200 with an empty body. */
    private final Map<String, Object[]> responses = new ConcurrentHashMap<>();

    @TempDir
    Path tempDir;

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/", exchange -> {
            String body = new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
            requests.add(new Recorded(exchange, body));
            Object[] canned = responses.getOrDefault(
                    exchange.getRequestMethod() + " " + exchange.getRequestURI().getPath(), new Object[]{200, ""});
            byte[] out = ((String) canned[1]).getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().add("Content-Type", "application/json");
            exchange.sendResponseHeaders((Integer) canned[0], out.length == 0 ? -1 : out.length);
            if (out.length > 0) {
                try (OutputStream os = exchange.getResponseBody()) {
                    os.write(out);
                }
            }
            exchange.close();
        });
        server.start();
        hostUrl = "http://127.0.0.1:" + server.getAddress().getPort() + "/";
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
    }

    private BuildProjectHttpClient client() {
        return new BuildProjectHttpClient(hostUrl, "secret", CertificateHeader.none(), Duration.ofSeconds(5));
    }

    private void respond(String methodAndPath, int status, String body) {
        responses.put(methodAndPath, new Object[]{status, body});
    }

    @Test
    void fetchSettings_usesProjectQueryAndBearerToken() {
        respond("GET " + BASE, 200, "{\"projects\": [{\"id\": \"p1\", \"name\": \"Invoices\"}]}");

        JsonNode listing = client().fetchSettings("p1");

        assertEquals("Invoices", listing.get("projects").get(0).get("name").asText());
        Recorded request = requests.get(0);
        assertEquals("GET", request.method);
        assertEquals(BASE + "?proj_id=p1&query_option=uuid", request.uri);
        assertEquals("Bearer secret", request.authorization);
        assertNull(request.certificate);
    }

    @Test
    void fetchers_parseDocuments() {
        respond("GET " + BASE + "/p1/schema", 200,
                "{\"2\": {\"name\": \"Invoice\", \"fields\": {\"3\": {\"name\": \"Total\"}}}, \"last_edited_at\": 1}");
        respond("GET " + BASE + "/p1/udfs", 200, "{\"42\": {\"name\": \"clean\"}}");
        respond("GET " + BASE + "/p1/validations", 200,
                "{\"rules\": [{\"id\": 9, \"name\": \"Check\", \"type\": \"FIELD_CONFIDENCE\", \"affected_fields\": [3]}]}");

        SchemaDocument schema = client().fetchSchema("p1");
        UdfCatalog udfs = client().fetchUdfs("p1");
        ValidationDocument validations = client().fetchValidations("p1");

        assertEquals("Total", schema.getClasses().get("2").getFields().get("3").getName());
        assertEquals("clean", udfs.get("42").orElseThrow().getName());
        assertEquals("9", validations.getRules().get(0).getId());
    }

    @Test
    void writers_hitExpectedEndpoints() {
        respond("POST " + BASE + "/p1/udfs", 200, "{\"udf_id\": 100}");
        respond("POST " + BASE + "/p1/validations", 200, "{\"id\": 55}");
        respond("POST " + BASE + "/p1/schema", 200, "{\"5\": {\"name\": \"Invoice\", \"fields\": {}}}");
        BuildProjectHttpClient client = client();

        client.postSettings("p1", BuildJson.readTree("{\"ocr_mode\": \"fast\"}"));
        SchemaDocument echoed = client.postSchema("p1", BuildJson.readTree("{\"classes\": {}, \"new_classes\": []}"));
        String udfId = client.createUdf("p1", BuildJson.readTree("{\"name\": \"clean\"}"));
        String ruleId = client.postValidation("p1", BuildJson.readTree("{\"name\": \"Check\"}"));
        client.deleteValidation("p1", "9");
        client.triggerExamples("p1", "100");
        client.triggerCodeGeneration("p1", "55");

        assertEquals("Invoice", echoed.getClasses().get("5").getName());
        assertEquals("100", udfId);
        assertEquals("55", ruleId);
        assertEquals(List.of(
                "PATCH " + BASE + "?project_id=p1",
                "POST " + BASE + "/p1/schema",
                "POST " + BASE + "/p1/udfs",
                "POST " + BASE + "/p1/validations",
                "DELETE " + BASE + "/p1/validations?id=9",
                "PUT " + BASE + "/p1/validations/100/examples",
                "PUT " + BASE + "/p1/validations/55/code-generation"),
                requests.stream().map(r -> r.method + " " + r.uri).toList());
        assertEquals("fast", BuildJson.readTree(requests.get(0).body).get("ocr_mode").asText());
        assertEquals("clean", BuildJson.readTree(requests.get(2).body).get("name").asText());
    }

    @Test
    void createProject_sendsOrgContextAndReturnsProjectId() {
        respond("POST " + BASE, 200, "{\"project_id\": \"new-proj\"}");

        String projectId = client().createProject("Invoices", "acme", "prod-ws");

        assertEquals("new-proj", projectId);
        Recorded request = requests.get(0);
        assertEquals("acme", request.context);
        JsonNode body = BuildJson.readTree(request.body);
        assertEquals("Invoices", body.get("name").asText());
        assertEquals("Invoices", body.get("desc").asText());
        assertEquals("prod-ws", body.get("workspace").asText());
        assertEquals("NONE", body.get("creation_base").asText());
        assertTrue(body.get("reader_profile").has("createdOn"));
    }

    @Test
    void nonSuccessStatus_raisesWithStatusAndBody() {
        respond("GET " + BASE + "/p1/schema", 403, "{\"error\": \"forbidden\"}");

        BuildApiException e = assertThrows(BuildApiException.class, () -> client().fetchSchema("p1"));

        assertEquals(403, e.getStatusCode());
        assertEquals("GET", e.getMethod());
        assertTrue(e.getResponseBody().contains("forbidden"));
    }

    @Test
    void createUdf_responseWithoutIdFails() {
        respond("POST " + BASE + "/p1/udfs", 200, "{\"status\": \"OK\"}");

        BuildApiException e = assertThrows(BuildApiException.class,
                () -> client().createUdf("p1", BuildJson.readTree("{}")));

        assertEquals(-1, e.getStatusCode());
    }

    @Test
    void certificateHeader_sendsBase64OfTrimmedFile() throws IOException {
        Path pem = tempDir.resolve("client.pem");
        Files.writeString(pem, "-----BEGIN CERTIFICATE-----\nabc\n-----END CERTIFICATE-----\n\n");
        BuildProjectHttpClient client = new BuildProjectHttpClient(
                hostUrl, "secret", new CertificateHeader(pem), Duration.ofSeconds(5));

        client.triggerExamples("p1", "7");

        String expected = Base64.getEncoder().encodeToString(
                "-----BEGIN CERTIFICATE-----\nabc\n-----END CERTIFICATE-----".getBytes(StandardCharsets.US_ASCII));
        assertEquals(expected, requests.get(0).certificate);
    }

    @Test
    void certificateHeader_missingFileSendsNoHeader() {
        CertificateHeader header = new CertificateHeader(tempDir.resolve("absent.pem"));

        assertTrue(header.value().isEmpty());
        assertTrue(CertificateHeader.none().value().isEmpty());
    }
}
