package com.openforge.toolrelay.tool.interpreter;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.toolrelay.llm.model.Attachment;
import lombok.extern.slf4j.Slf4j;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.UUID;

/**
 * Uploads files into the caller's DIAL application-data folder so they can
 * be attached to a response by url.
 *
 *   GET /v1/bucket                    → { "bucket": …, "appdata": "<bucket>/appdata/<app>" }
 *   PUT /v1/files/{appdata}/{name}    ← multipart/form-data, part "file"
 *
 * The attachment url is the path relative to /v1 ("files/…"), the form DIAL
 * expects in custom_content.attachments.
 */
@Slf4j
public class DialFileStorage {

    private static final String API_KEY_HEADER = "Api-Key";

    private final HttpClient   httpClient;
    private final ObjectMapper objectMapper;
    private final String       endpoint;
    private final String       defaultApiKey;
    private final Duration     timeout;

    public DialFileStorage(HttpClient httpClient,
                           ObjectMapper objectMapper,
                           String endpoint,
                           String defaultApiKey,
                           Duration timeout) {
        this.httpClient    = httpClient;
        this.objectMapper  = objectMapper;
        this.endpoint      = endpoint.endsWith("/") ? endpoint.substring(0, endpoint.length() - 1) : endpoint;
        this.defaultApiKey = defaultApiKey;
        this.timeout       = timeout;
    }

    /**
     * Stores {@code content} under {@code fileName} and returns the attachment
     * pointing at it.
     *
     * @param apiKey per-request credential; null or blank means the configured key
     */
    public Attachment upload(String fileName, String mimeType, byte[] content, String apiKey)
            throws IOException, InterruptedException {
        String key = apiKey != null && !apiKey.isBlank() ? apiKey : defaultApiKey;
        String url = "files/" + appdataHome(key) + "/" + encodeSegment(fileName);
        String boundary = "toolrelay-" + UUID.randomUUID();

        HttpRequest request = authorized(HttpRequest.newBuilder(URI.create(endpoint + "/v1/" + url)), key)
                .header("Content-Type", "multipart/form-data; boundary=" + boundary)
                .timeout(timeout)
                .PUT(HttpRequest.BodyPublishers.ofByteArray(multipart(boundary, fileName, mimeType, content)))
                .build();
        HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            throw new IOException("DIAL rejected upload of %s with HTTP %d: %s"
                    .formatted(fileName, response.statusCode(), response.body()));
        }

        log.info("[DialFiles] Uploaded {} ({} bytes) to {}", fileName, content.length, url);
        return Attachment.ofUrl(mimeType, fileName, url);
    }

    // ── Private helpers ──────────────────────────────────────────────────────

    private String appdataHome(String key) throws IOException, InterruptedException {
        HttpRequest request = authorized(HttpRequest.newBuilder(URI.create(endpoint + "/v1/bucket")), key)
                .header("Accept", "application/json")
                .timeout(timeout)
                .GET()
                .build();
        HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            throw new IOException("DIAL bucket lookup failed with HTTP %d".formatted(response.statusCode()));
        }
        JsonNode bucket = objectMapper.readTree(response.body());
        String appdata = bucket.path("appdata").asText("");
        if (appdata.isBlank()) {
            throw new IOException("DIAL returned no appdata folder for this key");
        }
        return appdata;
    }

    private static HttpRequest.Builder authorized(HttpRequest.Builder builder, String key) {
        if (key != null && !key.isBlank()) {
            builder.header(API_KEY_HEADER, key);
        }
        return builder;
    }

    private static byte[] multipart(String boundary, String fileName, String mimeType, byte[] content) {
        String head = "--" + boundary + "\r\n"
                + "Content-Disposition: form-data; name=\"file\"; filename=\""
                + fileName.replace("\"", "%22") + "\"\r\n"
                + "Content-Type: " + mimeType + "\r\n\r\n";
        String tail = "\r\n--" + boundary + "--\r\n";

        ByteArrayOutputStream body = new ByteArrayOutputStream(content.length + 256);
        body.writeBytes(head.getBytes(StandardCharsets.UTF_8));
        body.writeBytes(content);
        body.writeBytes(tail.getBytes(StandardCharsets.UTF_8));
        return body.toByteArray();
    }

    static String encodeSegment(String fileName) {
        return URLEncoder.encode(fileName, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
