package io.serverhive.gameserver.infra.remote;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.serverhive.gameserver.app.NodeForwarder;
import io.serverhive.gameserver.app.RemoteOperation;
import io.serverhive.gameserver.config.GameServerProperties;
import io.serverhive.gameserver.domain.GameServerOperationException;
import io.serverhive.gameserver.domain.NodeCandidate;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP client for the internal lifecycle endpoints of peer nodes.
 */
public class HttpNodeForwarder implements NodeForwarder {
    private static final Logger log = LoggerFactory.getLogger(HttpNodeForwarder.class);
    private static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(5);
    private static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofMinutes(20);

    private final HttpClient http;
    private final ObjectMapper json;
    private final boolean enabled;
    private final String apiUrlTemplate;
    private final Duration requestTimeout;

    public HttpNodeForwarder(ObjectMapper json, GameServerProperties properties) {
        this.json = Objects.requireNonNull(json, "json");
        GameServerProperties.Forwarding forwarding = Objects.requireNonNull(properties, "properties").getForwarding();
        this.enabled = forwarding.isEnabled();
        this.apiUrlTemplate = forwarding.getApiUrlTemplate();
        this.http = HttpClient.newBuilder()
            .connectTimeout(resolveTimeout(forwarding.getConnectTimeout(), DEFAULT_CONNECT_TIMEOUT))
            .build();
        this.requestTimeout = resolveTimeout(forwarding.getRequestTimeout(), DEFAULT_REQUEST_TIMEOUT);
    }

    @Override
    public boolean canForward(NodeCandidate node) {
        return enabled && resolveApiUrl(node).isPresent();
    }

    @Override
    public void forward(NodeCandidate node, RemoteOperation operation, String gameServerId, String command) {
        String baseUrl = resolveApiUrl(node).orElseThrow(() -> new GameServerOperationException(gameServerId,
            "no API URL known for node " + node.id()));
        String url = baseUrl + "/internal/game-servers/" + encode(gameServerId) + "/" + operation.pathSegment();
        String label = operation.pathSegment() + " " + gameServerId + " on node " + node.id();
        try {
            String body = operation == RemoteOperation.COMMAND
                ? json.writeValueAsString(Map.of("command", command == null ? "" : command))
                : "{}";
            sendPost(url, label, body, gameServerId);
        } catch (IOException ex) {
            throw new GameServerOperationException(gameServerId, label + " failed: " + ex.getMessage(), ex);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new GameServerOperationException(gameServerId, label + " interrupted", ex);
        }
    }

    Optional<String> resolveApiUrl(NodeCandidate node) {
        if (node == null) {
            return Optional.empty();
        }
        if (node.apiUrl() != null && !node.apiUrl().isBlank()) {
            return Optional.of(stripTrailingSlash(node.apiUrl()));
        }
        if (apiUrlTemplate == null) {
            return Optional.empty();
        }
        String ip = node.ip() != null ? node.ip() : node.hostname();
        String hostname = node.hostname() != null ? node.hostname() : node.ip();
        if ((apiUrlTemplate.contains("{ip}") && ip == null)
            || (apiUrlTemplate.contains("{hostname}") && hostname == null)) {
            return Optional.empty();
        }
        String url = apiUrlTemplate;
        if (ip != null) {
            url = url.replace("{ip}", ip);
        }
        if (hostname != null) {
            url = url.replace("{hostname}", hostname);
        }
        return Optional.of(stripTrailingSlash(url));
    }

    private void sendPost(String url, String label, String body, String gameServerId)
        throws IOException, InterruptedException {
        log.info("forwarding {} to {}", label, url);
        HttpRequest req = HttpRequest.newBuilder()
            .uri(URI.create(url))
            .header("Accept", "application/json")
            .header("Content-Type", "application/json")
            .timeout(requestTimeout)
            .POST(HttpRequest.BodyPublishers.ofString(body))
            .build();
        HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
        log.info("{} response status {}", label, resp.statusCode());
        if (resp.statusCode() != 200) {
            throw new GameServerOperationException(gameServerId,
                label + " failed with status " + resp.statusCode() + ": " + errorMessage(resp.body()));
        }
    }

    private String errorMessage(String body) {
        if (body == null || body.isBlank()) {
            return "no details";
        }
        try {
            JsonNode node = json.readTree(body);
            String error = node.path("error").asText(null);
            return error == null || error.isBlank() ? body : error;
        } catch (IOException ex) {
            return body;
        }
    }

    private static String encode(String segment) {
        return URLEncoder.encode(segment, StandardCharsets.UTF_8).replace("+", "%20");
    }

    private static String stripTrailingSlash(String url) {
        String trimmed = url.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }

    private static Duration resolveTimeout(Duration candidate, Duration fallback) {
        if (candidate == null || candidate.isZero() || candidate.isNegative()) {
            return fallback;
        }
        return candidate;
    }
}
