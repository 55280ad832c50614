package net.spookly.tierline.outcome;

/**
 * Default call audit logger that emits one line per recorded call.
 */
public final class CallAuditLogger implements CallRecordListener {
    public static final CallAuditLogger INSTANCE = new CallAuditLogger();

    private CallAuditLogger() {
    }

    @Override
    public void onRecord(CallRecord record) {
        System.out.println(format(record));
    }

    static String format(CallRecord record) {
        StringBuilder builder = new StringBuilder("call_record");
        append(builder, "timestamp", record.timestamp());
        append(builder, "status", record.status());
        append(builder, "callerId", record.callerId());
        append(builder, "zip", record.zipCode());
        append(builder, "originalTier", record.originalTier());
        append(builder, "chosenTier", record.chosenTier());
        append(builder, "fallbackUsed", record.fallbackUsed());
        append(builder, "businessHoursOk", record.businessHoursOk());
        append(builder, "rateLimitOk", record.rateLimitOk());
        append(builder, "responseTimeMs", record.responseTimeMs());
        append(builder, "externalCallId", record.externalCallId());
        return builder.toString();
    }

    private static void append(StringBuilder builder, String key, Object value) {
        if (value == null) {
            return;
        }
        builder.append(' ').append(key).append('=').append(value);
    }
}
