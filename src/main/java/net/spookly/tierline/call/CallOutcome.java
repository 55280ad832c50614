package net.spookly.tierline.call;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.experimental.Accessors;
import net.spookly.tierline.bid.BidResult;
import net.spookly.tierline.outcome.CallRecord;
import net.spookly.tierline.routing.RoutingDecision;

/**
 * Everything known about a handled call: the routing decision, the bid result and the
 * record written to the history.
 */
@Getter
@Accessors(fluent = true)
@AllArgsConstructor
public final class CallOutcome {
    private final RoutingDecision decision;
    /**
     * Bid response, or null when no bid was sent or the bid call failed.
     */
    private final BidResult bidResult;
    private final CallRecord record;
    /**
     * Failure message for {@code exception} outcomes.
     */
    private final String error;
}
