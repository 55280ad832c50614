package net.spookly.tierline.routing;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import net.spookly.tierline.tier.TierId;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CsvZipSourceTest {
    @TempDir
    Path tempDir;

    @Test
    void readsFirstColumnOfEveryTierFile() throws IOException {
        Path tier1 = write("tier1.csv", "\uFEFFzip,city\n10001,New York\n\"02134\",Boston\n\n");
        Path tier2 = write("tier2.csv", "30301;Atlanta\n60601\tChicago\n");
        Map<TierId, Path> files = new EnumMap<>(TierId.class);
        files.put(TierId.TIER_1, tier1);
        files.put(TierId.TIER_2, tier2);

        List<ZipRecord> records = new CsvZipSource(files).fetch();

        assertEquals(List.of(
                new ZipRecord("zip", "tier_1"),
                new ZipRecord("10001", "tier_1"),
                new ZipRecord("02134", "tier_1"),
                new ZipRecord("30301", "tier_2"),
                new ZipRecord("60601", "tier_2")
        ), records);
    }

    @Test
    void headerRowIsDroppedByIndexBuild() throws IOException {
        Path tier1 = write("tier1.csv", "zip\n10001\n");
        ZipIndex index = ZipIndex.build(new CsvZipSource(Map.of(TierId.TIER_1, tier1)).fetch());

        assertEquals(1, index.size());
        assertEquals(1, index.skippedRows());
        assertEquals(Optional.of(TierId.TIER_1), index.lookup("10001"));
    }

    @Test
    void missingFileFailsWholeFetch() throws IOException {
        Path tier1 = write("tier1.csv", "10001\n");
        Map<TierId, Path> files = new EnumMap<>(TierId.class);
        files.put(TierId.TIER_1, tier1);
        files.put(TierId.TIER_2, tempDir.resolve("missing.csv"));

        IOException exception = assertThrows(IOException.class, () -> new CsvZipSource(files).fetch());

        assertTrue(exception.getMessage().contains("tier_2"));
    }

    @Test
    void directoryKeepsSnapshotWhenFileDisappears() throws IOException {
        Path tier1 = write("tier1.csv", "10001\n");
        CsvZipSource source = new CsvZipSource(Map.of(TierId.TIER_1, tier1));
        ZipDirectory directory = new ZipDirectory();
        assertTrue(directory.reload(source).ok());

        Files.delete(tier1);

        assertFalse(directory.reload(source).ok());
        assertEquals(Optional.of(TierId.TIER_1), directory.lookup("10001"));
    }

    private Path write(String name, String content) throws IOException {
        Path file = tempDir.resolve(name);
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }
}
