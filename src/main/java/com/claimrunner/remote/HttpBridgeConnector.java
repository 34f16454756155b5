package com.claimrunner.remote;

import com.claimrunner.shared.config.RemoteConfig;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Talks to an MTProto bridge service that holds the user-account connections.
 *
 * <p>The bridge reports remote errors verbatim (for example {@code FLOOD_WAIT_45}); they are
 * surfaced as {@link RemoteCallException} messages so rate limits can be recognised upstream.
 */
public class HttpBridgeConnector implements MessengerConnector {

    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(20);

    private final String baseUrl;
    private final int apiId;
    private final String apiHash;
    private final HttpClient httpClient;
    private final ObjectMapper mapper = new ObjectMapper();

    public HttpBridgeConnector(RemoteConfig config) {
        this.baseUrl = config.bridgeUrl().replaceAll("/+$", "");
        this.apiId = config.apiId();
        this.apiHash = config.apiHash();
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    @Override
    public MessengerClient connect(String accountIdentifier, String credentialPayload) {
        var body = new LinkedHashMap<String, Object>();
        body.put("api_id", apiId);
        body.put("api_hash", apiHash);
        body.put("session_string", credentialPayload);
        var resp = call("POST", "/sessions", body);
        var sessionId = resp.path("session_id").asText("");
        if (sessionId.isEmpty()) {
            throw new RemoteCallException("Bridge returned no session_id");
        }
        return new BridgeClient(sessionId);
    }

    private JsonNode call(String method, String path, Map<String, Object> body) {
        try {
            var builder = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + path))
                    .header("Accept", "application/json")
                    .timeout(REQUEST_TIMEOUT);
            if (body != null) {
                builder.header("Content-Type", "application/json")
                        .method(method, HttpRequest.BodyPublishers.ofString(mapper.writeValueAsString(body)));
            } else {
                builder.method(method, HttpRequest.BodyPublishers.noBody());
            }
            var resp = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
            return handle(resp);
        } catch (IOException e) {
            throw new RemoteCallException("Bridge call failed: " + method + " " + path, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RemoteCallException("Interrupted during bridge call: " + method + " " + path, e);
        }
    }

    private JsonNode handle(HttpResponse<String> resp) throws IOException {
        int status = resp.statusCode();
        var text = resp.body() == null ? "" : resp.body().trim();
        if (status >= 200 && status < 300) {
            return text.isEmpty() ? mapper.createObjectNode() : mapper.readTree(text);
        }
        var error = errorText(text);
        if (status == 401 || status == 403) {
            throw new RemoteAuthException("Bridge rejected credentials (" + status + "): " + error);
        }
        throw new RemoteCallException("Bridge error " + status + ": " + error);
    }

    private String errorText(String body) {
        if (body.startsWith("{")) {
            try {
                return mapper.readTree(body).path("error").asText(body);
            } catch (IOException e) {
                return body;
            }
        }
        return body;
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    private class BridgeClient implements MessengerClient {

        private final String sessionPath;

        BridgeClient(String sessionId) {
            this.sessionPath = "/sessions/" + encode(sessionId);
        }

        @Override
        public void sendMessage(String peer, String text) {
            call("POST", sessionPath + "/messages", Map.of("peer", peer, "text", text));
        }

        @Override
        public List<BotMessage> recentMessages(String peer, int limit) {
            var root = call("GET", sessionPath + "/messages?peer=" + encode(peer) + "&limit=" + limit, null);
            var messages = new ArrayList<BotMessage>();
            for (var node : root.path("messages")) {
                messages.add(new BotMessage(
                        node.path("id").asLong(),
                        node.path("text").asText(""),
                        parseButtons(node.path("buttons"))));
            }
            return messages;
        }

        @Override
        public void pressButton(String peer, long messageId, byte[] callbackData) {
            call("POST", sessionPath + "/callbacks", Map.of(
                    "peer", peer,
                    "message_id", messageId,
                    "data", Base64.getEncoder().encodeToString(callbackData)));
        }

        @Override
        public void disconnect() {
            call("DELETE", sessionPath, null);
        }

        private List<List<InlineButton>> parseButtons(JsonNode rows) {
            var result = new ArrayList<List<InlineButton>>();
            for (var row : rows) {
                var buttons = new ArrayList<InlineButton>();
                for (var btn : row) {
                    var data = btn.path("data").asText("");
                    buttons.add(new InlineButton(
                            btn.path("text").asText(""),
                            data.isEmpty() ? null : Base64.getDecoder().decode(data)));
                }
                result.add(buttons);
            }
            return result;
        }
    }
}
