package net.spookly.tierline.routing;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import net.spookly.tierline.config.ConfigException;
import net.spookly.tierline.config.TierlineConfig;
import net.spookly.tierline.tier.TierId;

/**
 * Reads one delimited ZIP list per tier; the first column of every row is the ZIP code.
 *
 * <p>Header rows and malformed values are passed through and dropped by the index build.
 * A missing or unreadable file fails the whole fetch so the previous snapshot stays in use.
 */
public final class CsvZipSource implements ZipSource {
    private final Map<TierId, Path> files;

    public CsvZipSource(Map<TierId, Path> files) {
        Objects.requireNonNull(files, "files");
        this.files = new EnumMap<>(TierId.class);
        this.files.putAll(files);
    }

    public static CsvZipSource fromConfig(TierlineConfig config) {
        Map<TierId, Path> files = new EnumMap<>(TierId.class);
        if (config.zips != null && config.zips.sources != null) {
            for (Map.Entry<String, String> entry : config.zips.sources.entrySet()) {
                TierId tierId = TierId.fromLabel(entry.getKey())
                        .orElseThrow(() -> new ConfigException("unknown tier in zips.sources: " + entry.getKey()));
                files.put(tierId, Paths.get(entry.getValue()));
            }
        }
        return new CsvZipSource(files);
    }

    @Override
    public List<ZipRecord> fetch() throws IOException {
        List<ZipRecord> records = new ArrayList<>();
        for (Map.Entry<TierId, Path> entry : files.entrySet()) {
            String label = entry.getKey().label();
            try (BufferedReader reader = Files.newBufferedReader(entry.getValue(), StandardCharsets.UTF_8)) {
                String line;
                while ((line = reader.readLine()) != null) {
                    String zip = firstColumn(line);
                    if (zip.isEmpty()) {
                        continue;
                    }
                    records.add(new ZipRecord(zip, label));
                }
            } catch (IOException e) {
                throw new IOException("Failed to read " + label + " ZIP list: " + entry.getValue(), e);
            }
        }
        return records;
    }

    private String firstColumn(String line) {
        String value = line;
        if (!value.isEmpty() && value.charAt(0) == '\uFEFF') {
            value = value.substring(1);
        }
        int end = value.length();
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == ',' || c == ';' || c == '\t') {
                end = i;
                break;
            }
        }
        String column = value.substring(0, end).trim();
        if (column.length() >= 2 && column.startsWith("\"") && column.endsWith("\"")) {
            column = column.substring(1, column.length() - 1).trim();
        }
        return column;
    }
}
