package com.claimrunner.remote;

import com.claimrunner.shared.config.RemoteConfig;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class HttpBridgeConnectorTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private HttpServer server;
    private HttpBridgeConnector connector;
    private final List<String> requests = new CopyOnWriteArrayList<>();
    private final List<JsonNode> bodies = new CopyOnWriteArrayList<>();
    private volatile int messagesStatus = 200;
    private volatile String messagesBody = "{}";
    private boolean stopped;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/sessions", this::handle);
        server.start();
        var url = "http://127.0.0.1:" + server.getAddress().getPort() + "/";
        connector = new HttpBridgeConnector(new RemoteConfig(url, 99, "hash", "@Bot", "Бонус", "sub", 0, 5));
    }

    @AfterEach
    void tearDown() {
        if (!stopped) server.stop(0);
    }

    private void handle(HttpExchange exchange) throws IOException {
        var method = exchange.getRequestMethod();
        var uri = exchange.getRequestURI();
        requests.add(method + " " + uri);
        var raw = new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
        if (!raw.isEmpty()) bodies.add(MAPPER.readTree(raw));

        int status = 200;
        String body = "{}";
        var path = uri.getPath();
        if (method.equals("POST") && path.equals("/sessions")) {
            var payload = MAPPER.readTree(raw).path("session_string").asText();
            if (payload.equals("revoked")) {
                status = 401;
                body = "{\"error\":\"AUTH_KEY_UNREGISTERED\"}";
            } else {
                body = "{\"session_id\":\"s-1\"}";
            }
        } else if (method.equals("POST") && path.endsWith("/messages")) {
            status = messagesStatus;
            body = messagesBody;
        } else if (method.equals("GET") && path.endsWith("/messages")) {
            var data = Base64.getEncoder().encodeToString("claim".getBytes(StandardCharsets.UTF_8));
            body = "{\"messages\":[{\"id\":42,\"text\":\"menu\",\"buttons\":[[{\"text\":\"Бонус\",\"data\":\""
                    + data + "\"},{\"text\":\"Link\",\"data\":\"\"}]]}]}";
        }
        var bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, bytes.length);
        try (var out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }

    @Test
    void connectSendsCredentialsAndUsesReturnedSession() {
        var client = connector.connect("+100", "payload");
        client.sendMessage("@Bot", "/start");

        assertEquals("POST /sessions", requests.get(0));
        assertEquals(99, bodies.get(0).path("api_id").asInt());
        assertEquals("payload", bodies.get(0).path("session_string").asText());
        assertEquals("POST /sessions/s-1/messages", requests.get(1));
        assertEquals("/start", bodies.get(1).path("text").asText());
    }

    @Test
    void readsMessagesWithDecodedButtons() {
        var client = connector.connect("+100", "payload");

        var messages = client.recentMessages("@Bot", 5);

        assertTrue(requests.get(1).startsWith("GET /sessions/s-1/messages?peer="));
        assertEquals(1, messages.size());
        var msg = messages.get(0);
        assertEquals(42, msg.id());
        var button = msg.callbackButton("Бонус").orElseThrow();
        assertArrayEquals("claim".getBytes(StandardCharsets.UTF_8), button.callbackData());
        assertTrue(msg.callbackButton("Link").isEmpty());
    }

    @Test
    void pressesButtonAndDisconnects() {
        var client = connector.connect("+100", "payload");

        client.pressButton("@Bot", 42, "claim".getBytes(StandardCharsets.UTF_8));
        client.disconnect();

        assertEquals("POST /sessions/s-1/callbacks", requests.get(1));
        assertEquals(42, bodies.get(1).path("message_id").asLong());
        assertEquals("Y2xhaW0=", bodies.get(1).path("data").asText());
        assertEquals("DELETE /sessions/s-1", requests.get(2));
    }

    @Test
    void rejectedCredentialsRaiseAuthException() {
        var e = assertThrows(RemoteAuthException.class, () -> connector.connect("+100", "revoked"));
        assertTrue(e.getMessage().contains("AUTH_KEY_UNREGISTERED"));
    }

    @Test
    void remoteErrorTextIsSurfaced() {
        var client = connector.connect("+100", "payload");
        messagesStatus = 420;
        messagesBody = "{\"error\":\"FLOOD_WAIT_45\"}";

        var e = assertThrows(RemoteCallException.class, () -> client.sendMessage("@Bot", "/start"));
        assertEquals("Bridge error 420: FLOOD_WAIT_45", e.getMessage());
    }

    @Test
    void unreachableBridgeIsRemoteCallFailure() {
        server.stop(0);
        stopped = true;

        assertThrows(RemoteCallException.class, () -> connector.connect("+100", "payload"));
    }
}
