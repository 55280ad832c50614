package net.spookly.tierline.bid;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import net.spookly.tierline.config.TierlineConfig;

/**
 * HTTP client for the Marketcall affiliate bid-request endpoint.
 */
public final class MarketcallBidClient implements BidClient {
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final String BID_PATH = "/api/v1/affiliate/offers/%s/bid-requests";

    private final HttpClient httpClient;
    private final String baseUrl;
    private final String apiKey;
    private final Duration timeout;

    public MarketcallBidClient(String baseUrl, String apiKey, Duration timeout) {
        this(HttpClient.newBuilder().connectTimeout(timeout).build(), baseUrl, apiKey, timeout);
    }

    MarketcallBidClient(HttpClient httpClient, String baseUrl, String apiKey, Duration timeout) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.baseUrl = stripTrailingSlash(Objects.requireNonNull(baseUrl, "baseUrl"));
        this.apiKey = Objects.requireNonNull(apiKey, "apiKey");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
    }

    public static MarketcallBidClient fromConfig(TierlineConfig config) {
        TierlineConfig.BidConfig bid = config.bid;
        return new MarketcallBidClient(bid.baseUrl.trim(), bid.apiKey, Duration.ofMillis(bid.timeoutMs));
    }

    @Override
    public BidResult submit(BidRequest request) {
        Objects.requireNonNull(request, "request");
        byte[] payload = payload(request);
        URI uri = URI.create(baseUrl + String.format(BID_PATH,
                URLEncoder.encode(request.offerId(), StandardCharsets.UTF_8)));
        HttpRequest httpRequest = HttpRequest.newBuilder(uri)
                .timeout(timeout)
                .header("X-Api-Key", apiKey)
                .header("Content-Type", "application/json; charset=utf-8")
                .POST(HttpRequest.BodyPublishers.ofByteArray(payload))
                .build();
        HttpResponse<byte[]> response;
        try {
            response = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofByteArray());
        } catch (IOException e) {
            throw new BidException("Bid request failed for offer " + request.offerId(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BidException("Bid request interrupted for offer " + request.offerId(), e);
        }
        int status = response.statusCode();
        JsonNode body = parseBody(response.body());
        if (status >= 200 && status < 300) {
            return BidResult.accepted(status, externalId(body), body);
        }
        return BidResult.rejected(status, body);
    }

    private byte[] payload(BidRequest request) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("campaign_id", request.campaignId());
        payload.put("caller_id", request.callerId());
        payload.put("zip_code", request.zipCode());
        try {
            return MAPPER.writeValueAsBytes(payload);
        } catch (JsonProcessingException e) {
            throw new BidException("Failed to encode bid payload", e);
        }
    }

    static JsonNode parseBody(byte[] body) {
        if (body == null || body.length == 0) {
            return null;
        }
        try {
            return MAPPER.readTree(body);
        } catch (IOException e) {
            // Non-JSON bodies stay opaque.
            return null;
        }
    }

    static String externalId(JsonNode body) {
        if (body == null || !body.isObject()) {
            return null;
        }
        String id = text(body.get("id"));
        if (id == null) {
            id = text(body.get("bid_request_id"));
        }
        if (id == null) {
            id = text(body.path("data").get("id"));
        }
        return id;
    }

    private static String text(JsonNode node) {
        if (node == null || node.isNull() || node.isContainerNode()) {
            return null;
        }
        String value = node.asText();
        return value.isBlank() ? null : value;
    }

    private static String stripTrailingSlash(String value) {
        String trimmed = value.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }
}
