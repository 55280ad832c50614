package net.spookly.tierline.routing;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import net.spookly.tierline.tier.TierId;

/**
 * Immutable ZIP to tier lookup table.
 *
 * <p>When the source lists a ZIP for several tiers, the higher priority tier
 * (lower {@link TierId} ordinal) owns it.
 */
public final class ZipIndex {
    private static final int ZIP_LENGTH = 5;
    private static final ZipIndex EMPTY = new ZipIndex(Map.of(), 0, 0);

    private final Map<String, TierId> tiersByZip;
    private final int skippedRows;
    private final int conflicts;

    private ZipIndex(Map<String, TierId> tiersByZip, int skippedRows, int conflicts) {
        this.tiersByZip = tiersByZip;
        this.skippedRows = skippedRows;
        this.conflicts = conflicts;
    }

    public static ZipIndex empty() {
        return EMPTY;
    }

    /**
     * Build an index, skipping rows with a malformed ZIP or an unknown tier label.
     */
    public static ZipIndex build(Iterable<ZipRecord> records) {
        if (records == null) {
            return EMPTY;
        }
        Map<String, TierId> tiersByZip = new HashMap<>();
        int skipped = 0;
        int conflicts = 0;
        for (ZipRecord record : records) {
            if (record == null) {
                skipped++;
                continue;
            }
            Optional<String> zip = normalizeZip(record.zip());
            Optional<TierId> tier = TierId.fromLabel(record.tierLabel());
            if (zip.isEmpty() || tier.isEmpty()) {
                skipped++;
                continue;
            }
            TierId existing = tiersByZip.get(zip.get());
            if (existing == null) {
                tiersByZip.put(zip.get(), tier.get());
                continue;
            }
            if (existing != tier.get()) {
                conflicts++;
                if (tier.get().ordinal() < existing.ordinal()) {
                    tiersByZip.put(zip.get(), tier.get());
                }
            }
        }
        return new ZipIndex(Collections.unmodifiableMap(tiersByZip), skipped, conflicts);
    }

    /**
     * Tier owning the ZIP, or empty when no tier does or the ZIP is malformed.
     */
    public Optional<TierId> lookup(String zip) {
        Optional<String> normalized = normalizeZip(zip);
        if (normalized.isEmpty()) {
            return Optional.empty();
        }
        return Optional.ofNullable(tiersByZip.get(normalized.get()));
    }

    public int size() {
        return tiersByZip.size();
    }

    public int skippedRows() {
        return skippedRows;
    }

    public int conflicts() {
        return conflicts;
    }

    /**
     * Normalize to a zero-padded five digit ZIP.
     *
     * <p>Accepts spreadsheet numbers ({@code 2134.0}) and ZIP+4 ({@code 02134-1234}).
     */
    public static Optional<String> normalizeZip(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String value = raw.trim();
        if (value.endsWith(".0")) {
            value = value.substring(0, value.length() - 2);
        }
        int dash = value.indexOf('-');
        if (dash >= 0) {
            value = value.substring(0, dash).trim();
        }
        if (value.isEmpty() || value.length() > ZIP_LENGTH) {
            return Optional.empty();
        }
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c < '0' || c > '9') {
                return Optional.empty();
            }
        }
        if (value.length() == ZIP_LENGTH) {
            return Optional.of(value);
        }
        return Optional.of("0".repeat(ZIP_LENGTH - value.length()) + value);
    }
}
