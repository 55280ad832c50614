package net.spookly.tierline.routing;

import java.io.IOException;
import java.util.List;

/**
 * Supplies raw ZIP reference rows; acquisition and parsing live behind this seam.
 */
@FunctionalInterface
public interface ZipSource {
    List<ZipRecord> fetch() throws IOException;
}
