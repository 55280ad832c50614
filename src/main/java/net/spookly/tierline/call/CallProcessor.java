package net.spookly.tierline.call;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

import net.spookly.tierline.bid.BidClient;
import net.spookly.tierline.bid.BidRequest;
import net.spookly.tierline.bid.BidResult;
import net.spookly.tierline.outcome.CallRecord;
import net.spookly.tierline.outcome.CallStatus;
import net.spookly.tierline.outcome.OutcomeRecorder;
import net.spookly.tierline.routing.RoutingDecision;
import net.spookly.tierline.routing.RoutingEngine;
import net.spookly.tierline.routing.ZipIndex;

/**
 * Handles one inbound call event end to end: route, bid, record.
 *
 * <p>Routing is final before the bid is sent; a failed bid is recorded, never re-routed.
 * Every accepted event produces exactly one call record, including failure paths.
 */
public final class CallProcessor {
    private final RoutingEngine engine;
    private final BidClient bidClient;
    private final String campaignId;
    private final Clock clock;

    public CallProcessor(RoutingEngine engine, BidClient bidClient, String campaignId) {
        this(engine, bidClient, campaignId, Clock.systemUTC());
    }

    public CallProcessor(RoutingEngine engine, BidClient bidClient, String campaignId, Clock clock) {
        this.engine = Objects.requireNonNull(engine, "engine");
        this.bidClient = Objects.requireNonNull(bidClient, "bidClient");
        this.campaignId = Objects.requireNonNull(campaignId, "campaignId");
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    /**
     * Process a call event.
     *
     * @throws IllegalArgumentException when the caller id or ZIP code is missing
     */
    public CallOutcome handle(String callerId, String zipCode) {
        String caller = requireNonBlank(callerId, "caller_id");
        String zip = requireNonBlank(zipCode, "zip_code");
        Instant now = clock.instant();
        long startNanos = System.nanoTime();
        OutcomeRecorder recorder = engine.state().outcomeRecorder();

        CallRecord.CallRecordBuilder record = CallRecord.builder()
                .timestamp(now)
                .callerId(caller)
                .zipCode(ZipIndex.normalizeZip(zip).orElse(zip))
                .status(CallStatus.EXCEPTION);
        RoutingDecision decision = null;
        BidResult bidResult = null;
        String error = null;
        CallRecord finalRecord;
        try {
            decision = engine.routeCall(zip, caller, now);
            if (!decision.routed()) {
                record.status(CallStatus.NO_TIER);
            } else {
                record.originalTier(decision.originalTier())
                        .chosenTier(decision.chosenTier())
                        .fallbackUsed(decision.fallbackUsed())
                        .businessHoursOk(decision.businessHoursOk())
                        .rateLimitOk(decision.rateLimitOk());
                bidResult = bidClient.submit(new BidRequest(decision.offerId(), campaignId, caller, zip));
                record.status(bidResult.success() ? CallStatus.SUCCESS : CallStatus.API_ERROR)
                        .externalCallId(bidResult.externalCallId());
            }
        } catch (RuntimeException e) {
            error = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            System.err.println("Call handling failed for zip " + zip + ": " + error);
        } finally {
            record.responseTimeMs(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos));
            finalRecord = record.build();
            recorder.record(finalRecord);
        }
        return new CallOutcome(decision, bidResult, finalRecord, error);
    }

    private String requireNonBlank(String value, String field) {
        if (value == null || value.trim().isEmpty()) {
            throw new IllegalArgumentException("Missing " + field);
        }
        return value.trim();
    }
}
