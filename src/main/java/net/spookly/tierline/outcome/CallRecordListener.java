package net.spookly.tierline.outcome;

/**
 * Listener notified after a call record has been appended to the history.
 */
@FunctionalInterface
public interface CallRecordListener {
    CallRecordListener NOOP = record -> {
    };

    void onRecord(CallRecord record);
}
