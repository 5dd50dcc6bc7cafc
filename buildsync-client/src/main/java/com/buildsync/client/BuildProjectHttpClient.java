package com.buildsync.client;

import com.buildsync.model.BuildJson;
import com.buildsync.model.Identifiers;
import com.buildsync.model.SchemaDocument;
import com.buildsync.model.UdfCatalog;
import com.buildsync.model.ValidationDocument;
import com.buildsync.reconcile.api.BuildProjectFactory;
import com.buildsync.reconcile.api.BuildProjectReader;
import com.buildsync.reconcile.api.BuildProjectWriter;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Build project API of one environment over HTTP.
 * <p>
 * All endpoints live under {@code {hostUrl}/api/v2/aihub/build/projects}. Every request carries
 * {@code Authorization: Bearer <token>} and, when configured, the {@value CertificateHeader#NAME} header.
 * Non-2xx responses raise {@link BuildApiException}; nothing is retried.
 */
public final class BuildProjectHttpClient implements BuildProjectReader, BuildProjectWriter, BuildProjectFactory {

    private static final Logger log = LoggerFactory.getLogger(BuildProjectHttpClient.class);

    static final String PROJECTS_PATH = "/api/v2/aihub/build/projects";
    static final String CONTEXT_HEADER = "Ib-Context";
    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(10);

    private final String projectsUrl;
    private final String token;
    private final CertificateHeader certificate;
    private final Duration requestTimeout;
    private final HttpClient httpClient;

    /**
     * @param hostUrl        environment base URL (e.g. "https://prod.example.com"); a trailing slash is ignored
     * @param token          bearer token for that environment
     * @param certificate    client certificate header; {@link CertificateHeader#none()} to send none
     * @param requestTimeout per-request timeout
     */
    public BuildProjectHttpClient(String hostUrl, String token, CertificateHeader certificate, Duration requestTimeout) {
        this(hostUrl, token, certificate, requestTimeout,
                HttpClient.newBuilder().connectTimeout(CONNECT_TIMEOUT).build());
    }

    BuildProjectHttpClient(String hostUrl, String token, CertificateHeader certificate, Duration requestTimeout,
                           HttpClient httpClient) {
        Objects.requireNonNull(hostUrl, "hostUrl");
        String base = hostUrl.trim();
        while (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        this.projectsUrl = base + PROJECTS_PATH;
        this.token = Objects.requireNonNull(token, "token");
        this.certificate = certificate != null ? certificate : CertificateHeader.none();
        this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout");
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
    }

    @Override
    public JsonNode fetchSettings(String projectId) {
        return send("GET", projectsUrl + "?proj_id=" + query(projectId) + "&query_option=uuid", null, null);
    }

    @Override
    public SchemaDocument fetchSchema(String projectId) {
        return SchemaDocument.fromTree(send("GET", projectUrl(projectId, "/schema"), null, null));
    }

    @Override
    public UdfCatalog fetchUdfs(String projectId) {
        return UdfCatalog.fromTree(send("GET", projectUrl(projectId, "/udfs"), null, null));
    }

    @Override
    public ValidationDocument fetchValidations(String projectId) {
        JsonNode body = send("GET", projectUrl(projectId, "/validations"), null, null);
        if (!body.isObject()) {
            return ValidationDocument.empty();
        }
        try {
            return BuildJson.fromTree(body, ValidationDocument.class);
        } catch (UncheckedIOException e) {
            throw new BuildApiException("GET", projectUrl(projectId, "/validations"),
                    "unexpected validations body", e);
        }
    }

    @Override
    public void postSettings(String projectId, JsonNode settings) {
        send("PATCH", projectsUrl + "?project_id=" + query(projectId), settings, null);
    }

    @Override
    public SchemaDocument postSchema(String projectId, Object schemaPayload) {
        return SchemaDocument.fromTree(send("POST", projectUrl(projectId, "/schema"), schemaPayload, null));
    }

    @Override
    public String postValidation(String projectId, Object validationPayload) {
        String uri = projectUrl(projectId, "/validations");
        return requireId("POST", uri, send("POST", uri, validationPayload, null), "id");
    }

    @Override
    public void deleteValidation(String projectId, String ruleId) {
        send("DELETE", projectUrl(projectId, "/validations") + "?id=" + query(ruleId), null, null);
    }

    @Override
    public String createUdf(String projectId, JsonNode udf) {
        String uri = projectUrl(projectId, "/udfs");
        return requireId("POST", uri, send("POST", uri, udf, null), "udf_id");
    }

    @Override
    public void triggerExamples(String projectId, String udfOrRuleId) {
        send("PUT", projectUrl(projectId, "/validations/" + segment(udfOrRuleId) + "/examples"), null, null);
    }

    @Override
    public void triggerCodeGeneration(String projectId, String ruleId) {
        send("PUT", projectUrl(projectId, "/validations/" + segment(ruleId) + "/code-generation"), null, null);
    }

    @Override
    public String createProject(String name, String org, String workspace) {
        long now = Instant.now().getEpochSecond();
        ObjectNode body = BuildJson.newObject();
        body.put("name", name);
        body.put("desc", name);
        body.put("llm", "");
        ObjectNode profile = body.putObject("reader_profile");
        profile.put("foundationVersion", "");
        profile.put("schema", "1");
        profile.put("createdOn", now);
        profile.put("createdBy", "");
        profile.put("lastModifiedOn", now);
        profile.put("lastModifiedBy", "");
        profile.putNull("inputPath");
        profile.putNull("outputPath");
        profile.put("defaultProfile", "");
        body.putNull("extraction_mode");
        body.put("org", org);
        body.put("workspace", workspace);
        body.put("creation_base", "NONE");

        String projectId = requireId("POST", projectsUrl, send("POST", projectsUrl, body, org), "project_id");
        log.info("Created build project name={} org={} workspace={} id={}", name, org, workspace, projectId);
        return projectId;
    }

    private JsonNode send(String method, String uri, Object body, String context) {
        HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create(uri))
                .timeout(requestTimeout)
                .header("Authorization", "Bearer " + token)
                .header("Accept", "application/json");
        certificate.value().ifPresent(v -> builder.header(CertificateHeader.NAME, v));
        if (context != null) {
            builder.header(CONTEXT_HEADER, context);
        }
        if (body != null) {
            builder.header("Content-Type", "application/json")
                    .method(method, HttpRequest.BodyPublishers.ofString(BuildJson.toJson(body), StandardCharsets.UTF_8));
        } else {
            builder.method(method, HttpRequest.BodyPublishers.noBody());
        }

        HttpResponse<String> response;
        try {
            response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new BuildApiException(method, uri, e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BuildApiException(method, uri, "interrupted", e);
        }

        int status = response.statusCode();
        log.debug("method={} uri={} status={}", method, uri, status);
        if (status < 200 || status >= 300) {
            throw new BuildApiException(method, uri, status, response.body());
        }
        String text = response.body();
        if (text == null || text.isBlank()) {
            return BuildJson.newObject();
        }
        try {
            return BuildJson.readTree(text);
        } catch (UncheckedIOException e) {
            // some endpoints answer with plain text
            return BuildJson.mapper().getNodeFactory().textNode(text);
        }
    }

    private static String requireId(String method, String uri, JsonNode response, String attribute) {
        String id = Identifiers.asKey(response.get(attribute));
        if (id == null || id.isBlank()) {
            throw new BuildApiException(method, uri, "response has no " + attribute + ": " + response,
                    null);
        }
        return id;
    }

    private String projectUrl(String projectId, String suffix) {
        return projectsUrl + "/" + segment(projectId) + suffix;
    }

    private static String segment(String value) {
        return query(value).replace("+", "%20");
    }

    private static String query(String value) {
        return URLEncoder.encode(Objects.requireNonNull(value, "id"), StandardCharsets.UTF_8);
    }
}
