package net.spookly.tierline.bid;

/**
 * Submits a bid for a routed call to the external bidding API.
 */
@FunctionalInterface
public interface BidClient {
    /**
     * @throws BidException when the request could not be completed
     */
    BidResult submit(BidRequest request);
}
