package net.spookly.tierline.routing;

/**
 * One raw row of ZIP reference data as supplied by a source.
 *
 * @param zip       ZIP code as read, not yet normalized
 * @param tierLabel tier label as read, for example {@code tier_1} or {@code Tier 1}
 */
public record ZipRecord(String zip, String tierLabel) {
}
