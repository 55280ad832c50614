package net.spookly.tierline.bid;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Response of the bidding API as seen by the call pipeline.
 */
@Getter
@Accessors(fluent = true)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class BidResult {
    private final boolean success;
    private final int httpStatus;
    /**
     * Identifier assigned by the bidding API, when it returned one.
     */
    private final String externalCallId;
    /**
     * Parsed response body, or null when the body was empty or not JSON.
     */
    private final JsonNode body;

    public static BidResult accepted(int httpStatus, String externalCallId, JsonNode body) {
        return new BidResult(true, httpStatus, externalCallId, body);
    }

    public static BidResult rejected(int httpStatus, JsonNode body) {
        return new BidResult(false, httpStatus, null, body);
    }
}
