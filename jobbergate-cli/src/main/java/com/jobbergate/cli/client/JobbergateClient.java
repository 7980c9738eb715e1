package com.jobbergate.cli.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.jobbergate.cli.CliSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.StringJoiner;
import java.util.UUID;

/**
 * HTTP client for the Jobbergate API.
 *
 * Every call names the status it expects; any other status, or a transport
 * failure, becomes an {@link Abort} carrying the caller's message and the
 * API's problem {@code detail}.
 */
public class JobbergateClient {

    private static final Logger log = LoggerFactory.getLogger(JobbergateClient.class);

    public static final String OWNER_HEADER = "X-Jobbergate-Owner";

    private static final String REQUEST_FAILED = "REQUEST FAILED";

    private final HttpClient   http;
    private final ObjectMapper json;
    private final CliSettings  settings;

    public JobbergateClient(CliSettings settings, ObjectMapper objectMapper) {
        this.settings = settings;
        this.json     = objectMapper;
        this.http     = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(settings.requestTimeout())
                .build();
    }

    // ------------------------------------------------------------------
    // JSON calls
    // ------------------------------------------------------------------

    public JsonNode get(String path, Map<String, ?> params, String abortMessage) {
        return send(builder(path, params).GET(), 200, abortMessage);
    }

    public JsonNode post(String path, Object body, String abortMessage) {
        return send(withJson(builder(path, Map.of())).method("POST", bodyOf(body)), 201, abortMessage);
    }

    public JsonNode put(String path, Object body, String abortMessage) {
        return send(withJson(builder(path, Map.of())).method("PUT", bodyOf(body)), 200, abortMessage);
    }

    public void delete(String path, String abortMessage) {
        send(builder(path, Map.of()).DELETE(), 204, abortMessage);
    }

    // ------------------------------------------------------------------
    // Multipart upload
    // ------------------------------------------------------------------

    /**
     * POST {@code file} as the multipart field {@code field}.
     *
     * @return the HTTP status; only a transport failure aborts
     */
    public int upload(String path, String field, Path file) {
        String boundary = "jobbergate-" + UUID.randomUUID();
        byte[] body;
        try {
            body = multipartBody(boundary, field, file);
        } catch (IOException e) {
            throw new Abort("Could not read " + file + ": " + e.getMessage(), "UPLOAD FAILED", false, e);
        }
        HttpRequest req = builder(path, Map.of())
                .header("Content-Type", "multipart/form-data; boundary=" + boundary)
                .POST(HttpRequest.BodyPublishers.ofByteArray(body))
                .build();
        HttpResponse<String> resp = execute(req, "Request to upload " + file.getFileName() + " failed");
        if (resp.statusCode() != 201) {
            log.warn("Upload to {} returned HTTP {}: {}", path, resp.statusCode(), resp.body());
        }
        return resp.statusCode();
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private HttpRequest.Builder builder(String path, Map<String, ?> params) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(settings.apiUrl() + path + queryString(params)))
                .timeout(settings.requestTimeout())
                .header("Accept", "application/json");
        if (settings.userEmail() != null) {
            builder.header(OWNER_HEADER, settings.userEmail());
        }
        return builder;
    }

    private static HttpRequest.Builder withJson(HttpRequest.Builder builder) {
        return builder.header("Content-Type", "application/json");
    }

    private HttpRequest.BodyPublisher bodyOf(Object body) {
        try {
            return HttpRequest.BodyPublishers.ofString(json.writeValueAsString(body));
        } catch (JsonProcessingException e) {
            throw new Abort("Could not serialize the request body", REQUEST_FAILED, false, e);
        }
    }

    private JsonNode send(HttpRequest.Builder builder, int expectedStatus, String abortMessage) {
        HttpRequest req = builder.build();
        HttpResponse<String> resp = execute(req, abortMessage);
        if (resp.statusCode() != expectedStatus) {
            String detail = problemDetail(resp.body());
            log.debug("{} {} returned HTTP {} (expected {}): {}",
                    req.method(), req.uri(), resp.statusCode(), expectedStatus, resp.body());
            throw new Abort(abortMessage + " [HTTP " + resp.statusCode() + "]"
                    + (detail.isEmpty() ? "" : ": " + detail), REQUEST_FAILED, true);
        }
        if (resp.body() == null || resp.body().isBlank()) {
            return NullNode.getInstance();
        }
        try {
            return json.readTree(resp.body());
        } catch (JsonProcessingException e) {
            throw new Abort("Failed unpacking json from the API response", "UNPARSEABLE RESPONSE", true, e);
        }
    }

    private HttpResponse<String> execute(HttpRequest req, String abortMessage) {
        log.debug("Making request: {} {}", req.method(), req.uri());
        try {
            return http.send(req, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new Abort(abortMessage + ": communication with the API failed (" + e.getMessage() + ")",
                    REQUEST_FAILED, true, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new Abort(abortMessage + ": interrupted", REQUEST_FAILED, false, e);
        }
    }

    /** The {@code detail} of a problem body, or the raw body when it is not one. */
    private String problemDetail(String body) {
        if (body == null || body.isBlank()) {
            return "";
        }
        try {
            JsonNode node = json.readTree(body);
            if (node.hasNonNull("detail")) {
                return node.get("detail").asText();
            }
        } catch (JsonProcessingException e) {
            log.trace("Error body is not JSON", e);
        }
        return body.strip();
    }

    private static String queryString(Map<String, ?> params) {
        if (params == null || params.isEmpty()) {
            return "";
        }
        StringJoiner joiner = new StringJoiner("&", "?", "");
        params.forEach((key, value) -> {
            if (value != null) {
                joiner.add(encode(key) + "=" + encode(String.valueOf(value)));
            }
        });
        return joiner.length() == 1 ? "" : joiner.toString();
    }

    private static String encode(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8);
    }

    private static byte[] multipartBody(String boundary, String field, Path file) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        String head = "--" + boundary + "\r\n"
                + "Content-Disposition: form-data; name=\"" + field + "\"; filename=\"" + file.getFileName() + "\"\r\n"
                + "Content-Type: application/gzip\r\n\r\n";
        out.write(head.getBytes(StandardCharsets.UTF_8));
        out.write(Files.readAllBytes(file));
        out.write(("\r\n--" + boundary + "--\r\n").getBytes(StandardCharsets.UTF_8));
        return out.toByteArray();
    }
}
