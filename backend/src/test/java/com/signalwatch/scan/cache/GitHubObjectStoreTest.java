package com.signalwatch.scan.cache;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.signalwatch.config.ScannerProperties;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GitHubObjectStoreTest {
    private final ObjectMapper objectMapper = new ObjectMapper();
    private MockWebServer server;
    private GitHubObjectStore store;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        ScannerProperties.Github github = new ScannerProperties.Github();
        github.setApiBaseUrl(server.url("/").toString());
        github.setOwner("acme");
        github.setRepository("scan-cache");
        github.setBranch("main");
        github.setBasePath("results");
        github.setToken("gh-token");
        store = new GitHubObjectStore(github, HttpClient.newHttpClient(), objectMapper, Duration.ofSeconds(5));
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
    }

    @Test
    void missingObjectIsAbsent() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(404));

        assertThat(store.get("01234567/Directors/result.json")).isEmpty();

        RecordedRequest request = server.takeRequest();
        assertThat(request.getPath())
            .isEqualTo("/repos/acme/scan-cache/contents/results/01234567/Directors/result.json?ref=main");
        assertThat(request.getHeader("Authorization")).isEqualTo("Bearer gh-token");
    }

    @Test
    void decodesInlineBase64Content() {
        String encoded = Base64.getMimeEncoder().encodeToString("{\"ok\":true}".getBytes(StandardCharsets.UTF_8));
        server.enqueue(new MockResponse().setBody(
            "{\"sha\":\"abc\",\"encoding\":\"base64\",\"content\":\"" + encoded.replace("\r\n", "\\n") + "\"}"
        ));

        assertThat(store.get("01234567/Only Active Directors/result.json"))
            .hasValueSatisfying(bytes -> assertThat(new String(bytes, StandardCharsets.UTF_8)).isEqualTo("{\"ok\":true}"));
    }

    @Test
    void putReplacesExistingBlobBySha() throws Exception {
        server.enqueue(new MockResponse().setBody("{\"sha\":\"abc123\",\"encoding\":\"base64\",\"content\":\"\"}"));
        server.enqueue(new MockResponse().setResponseCode(200).setBody("{}"));

        store.put("01234567/Only Active Directors/result.json", "{}".getBytes(StandardCharsets.UTF_8));

        server.takeRequest();
        RecordedRequest put = server.takeRequest();
        assertThat(put.getMethod()).isEqualTo("PUT");
        assertThat(put.getPath()).isEqualTo("/repos/acme/scan-cache/contents/results/01234567/Only%20Active%20Directors/result.json");
        JsonNode body = objectMapper.readTree(put.getBody().readUtf8());
        assertThat(body.path("sha").asText()).isEqualTo("abc123");
        assertThat(body.path("branch").asText()).isEqualTo("main");
        assertThat(new String(Base64.getDecoder().decode(body.path("content").asText()), StandardCharsets.UTF_8)).isEqualTo("{}");
    }

    @Test
    void serverErrorIsCacheUnavailable() {
        server.enqueue(new MockResponse().setResponseCode(502));

        assertThatThrownBy(() -> store.exists("01234567/Directors/result.json"))
            .isInstanceOf(CacheUnavailableException.class)
            .hasMessageContaining("502");
    }
}
