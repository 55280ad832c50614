package net.spookly.tierline.bid;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Bid request for one routed call.
 */
@Getter
@Accessors(fluent = true)
@AllArgsConstructor
public final class BidRequest {
    private final String offerId;
    private final String campaignId;
    private final String callerId;
    private final String zipCode;
}
