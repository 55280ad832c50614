package net.spookly.tierline.bid;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MarketcallBidClientTest {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private HttpServer server;
    private final AtomicReference<String> path = new AtomicReference<>();
    private final AtomicReference<String> apiKey = new AtomicReference<>();
    private final AtomicReference<String> body = new AtomicReference<>();
    private volatile int responseStatus = 200;
    private volatile String responseBody = "{\"id\":\"bid-42\"}";

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/", exchange -> {
            path.set(exchange.getRequestURI().getPath());
            apiKey.set(exchange.getRequestHeaders().getFirst("X-Api-Key"));
            body.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            byte[] payload = responseBody.getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(responseStatus, payload.length == 0 ? -1 : payload.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(payload);
            }
        });
        server.start();
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
    }

    @Test
    void postsBidToOfferEndpoint() throws IOException {
        BidResult result = client().submit(new BidRequest("11558", "323747", "+15550100", "10001"));

        assertEquals("/api/v1/affiliate/offers/11558/bid-requests", path.get());
        assertEquals("secret", apiKey.get());
        JsonNode sent = MAPPER.readTree(body.get());
        assertEquals("323747", sent.get("campaign_id").asText());
        assertEquals("+15550100", sent.get("caller_id").asText());
        assertEquals("10001", sent.get("zip_code").asText());
        assertTrue(result.success());
        assertEquals(200, result.httpStatus());
        assertEquals("bid-42", result.externalCallId());
    }

    @Test
    void nonSuccessStatusIsRejected() {
        responseStatus = 422;
        responseBody = "{\"error\":\"invalid zip\"}";

        BidResult result = client().submit(new BidRequest("11558", "323747", "+15550100", "10001"));

        assertFalse(result.success());
        assertEquals(422, result.httpStatus());
        assertEquals("invalid zip", result.body().get("error").asText());
        assertNull(result.externalCallId());
    }

    @Test
    void nonJsonBodyIsKeptOpaque() {
        responseBody = "<html>ok</html>";

        BidResult result = client().submit(new BidRequest("11558", "323747", "+15550100", "10001"));

        assertTrue(result.success());
        assertNull(result.body());
    }

    @Test
    void unreachableHostThrowsBidException() throws IOException {
        int port;
        try (ServerSocket socket = new ServerSocket(0)) {
            port = socket.getLocalPort();
        }
        MarketcallBidClient client = new MarketcallBidClient("http://127.0.0.1:" + port, "secret", Duration.ofSeconds(2));

        assertThrows(BidException.class,
                () -> client.submit(new BidRequest("11558", "323747", "+15550100", "10001")));
    }

    @Test
    void externalIdFallsBackToNestedFields() throws IOException {
        assertEquals("b-1", MarketcallBidClient.externalId(MAPPER.readTree("{\"bid_request_id\":\"b-1\"}")));
        assertEquals("7", MarketcallBidClient.externalId(MAPPER.readTree("{\"data\":{\"id\":7}}")));
        assertNull(MarketcallBidClient.externalId(MAPPER.readTree("[1,2]")));
    }

    private MarketcallBidClient client() {
        return new MarketcallBidClient("http://127.0.0.1:" + server.getAddress().getPort() + "/",
                "secret", Duration.ofSeconds(5));
    }
}
