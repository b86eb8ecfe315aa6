package com.signalwatch.scan.cache;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.signalwatch.config.ScannerProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Optional;

/**
 * Object store over the GitHub repository contents API. Objects live under the configured base
 * path on one branch; writes replace the existing blob by its sha.
 */
public class GitHubObjectStore implements ObjectStore {
    private static final Logger log = LoggerFactory.getLogger(GitHubObjectStore.class);
    private static final String ACCEPT = "application/vnd.github+json";

    private final ScannerProperties.Github github;
    private final HttpClient client;
    private final ObjectMapper objectMapper;
    private final Duration timeout;

    public GitHubObjectStore(ScannerProperties.Github github, HttpClient client, ObjectMapper objectMapper, Duration timeout) {
        this.github = github;
        this.client = client;
        this.objectMapper = objectMapper;
        this.timeout = timeout;
    }

    @Override
    public boolean exists(String key) {
        HttpResponse<byte[]> response = send(request(contentsUri(key, true)).method("HEAD", HttpRequest.BodyPublishers.noBody()), key);
        if (response.statusCode() == 404) {
            return false;
        }
        requireSuccess(response, key);
        return true;
    }

    @Override
    public Optional<byte[]> get(String key) {
        Optional<JsonNode> metadata = metadata(key);
        if (metadata.isEmpty()) {
            return Optional.empty();
        }
        JsonNode node = metadata.get();
        String content = node.path("content").asText("");
        if (!content.isBlank() && "base64".equals(node.path("encoding").asText())) {
            return Optional.of(Base64.getMimeDecoder().decode(content));
        }
        // files above the inline size limit come back without content
        String downloadUrl = node.path("download_url").asText(null);
        if (downloadUrl == null || downloadUrl.isBlank()) {
            throw new CacheUnavailableException("GitHub returned no content for " + key);
        }
        HttpResponse<byte[]> raw = send(request(URI.create(downloadUrl)).GET(), key);
        requireSuccess(raw, key);
        return Optional.of(raw.body());
    }

    @Override
    public void put(String key, byte[] content) {
        String sha = metadata(key).map(node -> node.path("sha").asText(null)).orElse(null);
        ObjectNode body = objectMapper.createObjectNode();
        body.put("message", "Update " + key);
        body.put("content", Base64.getEncoder().encodeToString(content));
        body.put("branch", github.getBranch());
        if (sha != null) {
            body.put("sha", sha);
        }
        byte[] payload;
        try {
            payload = objectMapper.writeValueAsBytes(body);
        } catch (IOException e) {
            throw new CacheUnavailableException("Could not encode GitHub request for " + key, e);
        }
        HttpResponse<byte[]> response = send(
            request(contentsUri(key, false))
                .header("Content-Type", "application/json")
                .PUT(HttpRequest.BodyPublishers.ofByteArray(payload)),
            key
        );
        requireSuccess(response, key);
        log.debug("Stored {} bytes at {}", content.length, key);
    }

    private Optional<JsonNode> metadata(String key) {
        HttpResponse<byte[]> response = send(request(contentsUri(key, true)).GET(), key);
        if (response.statusCode() == 404) {
            return Optional.empty();
        }
        requireSuccess(response, key);
        try {
            JsonNode node = objectMapper.readTree(response.body());
            if (node == null || !node.isObject()) {
                throw new CacheUnavailableException("GitHub returned a listing instead of a file for " + key);
            }
            return Optional.of(node);
        } catch (IOException e) {
            throw new CacheUnavailableException("Malformed GitHub response for " + key, e);
        }
    }

    private HttpRequest.Builder request(URI uri) {
        HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
            .timeout(timeout)
            .header("Accept", ACCEPT)
            .header("X-GitHub-Api-Version", "2022-11-28");
        if (github.getToken() != null && !github.getToken().isBlank()) {
            builder.header("Authorization", "Bearer " + github.getToken());
        }
        return builder;
    }

    private HttpResponse<byte[]> send(HttpRequest.Builder builder, String key) {
        try {
            return client.send(builder.build(), HttpResponse.BodyHandlers.ofByteArray());
        } catch (IOException e) {
            throw new CacheUnavailableException("GitHub request failed for " + key, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CacheUnavailableException("Interrupted talking to GitHub for " + key, e);
        }
    }

    private void requireSuccess(HttpResponse<byte[]> response, String key) {
        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw new CacheUnavailableException("GitHub responded HTTP " + status + " for " + key);
        }
    }

    URI contentsUri(String key, boolean withRef) {
        List<String> segments = new ArrayList<>();
        addSegments(segments, github.getBasePath());
        addSegments(segments, key);
        StringBuilder uri = new StringBuilder(github.getApiBaseUrl())
            .append("/repos/")
            .append(encode(github.getOwner()))
            .append('/')
            .append(encode(github.getRepository()))
            .append("/contents/")
            .append(String.join("/", segments));
        if (withRef && github.getBranch() != null && !github.getBranch().isBlank()) {
            uri.append("?ref=").append(encode(github.getBranch()));
        }
        return URI.create(uri.toString());
    }

    private static void addSegments(List<String> segments, String path) {
        if (path == null) {
            return;
        }
        for (String segment : path.split("/")) {
            if (!segment.isBlank()) {
                segments.add(encode(segment));
            }
        }
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
