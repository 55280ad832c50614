package net.spookly.tierline.bid;

/**
 * Transport failure of a bid call (connect error, timeout, interrupted).
 */
public class BidException extends RuntimeException {
    public BidException(String message, Throwable cause) {
        super(message, cause);
    }
}
