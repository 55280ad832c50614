package net.spookly.tierline.outcome;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.time.Instant;

import net.spookly.tierline.tier.TierId;
import org.junit.jupiter.api.Test;

class CallAuditLoggerTest {
    @Test
    void formatsRoutedRecord() {
        CallRecord record = CallRecord.builder()
                .timestamp(Instant.parse("2024-07-15T14:00:00Z"))
                .callerId("+15550100")
                .zipCode("10001")
                .originalTier(TierId.TIER_1)
                .chosenTier(TierId.TIER_2)
                .fallbackUsed(true)
                .businessHoursOk(true)
                .rateLimitOk(true)
                .status(CallStatus.SUCCESS)
                .responseTimeMs(42)
                .externalCallId("bid-7")
                .build();

        assertEquals("call_record timestamp=2024-07-15T14:00:00Z status=success callerId=+15550100 zip=10001"
                + " originalTier=tier_1 chosenTier=tier_2 fallbackUsed=true businessHoursOk=true"
                + " rateLimitOk=true responseTimeMs=42 externalCallId=bid-7", CallAuditLogger.format(record));
    }

    @Test
    void omitsMissingFields() {
        CallRecord record = CallRecord.builder()
                .timestamp(Instant.parse("2024-07-15T14:00:00Z"))
                .callerId("+15550100")
                .zipCode("00000")
                .status(CallStatus.NO_TIER)
                .build();

        assertEquals("call_record timestamp=2024-07-15T14:00:00Z status=no_tier callerId=+15550100 zip=00000"
                + " fallbackUsed=false businessHoursOk=false rateLimitOk=false responseTimeMs=0",
                CallAuditLogger.format(record));
    }
}
