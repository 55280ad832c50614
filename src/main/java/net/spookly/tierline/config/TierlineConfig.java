package net.spookly.tierline.config;

import java.util.Map;

public class TierlineConfig {
    public ServerConfig server;
    public BidConfig bid;
    public Map<String, TierConfigEntry> tiers;
    public ZipsConfig zips;
    public HistoryConfig history;

    public static class ServerConfig {
        public String host;
        public Integer port;
        public Integer maxRequestBytes;
        public Integer maxHistoryResults;
        public Integer workerThreads;
    }

    public static class BidConfig {
        public String baseUrl;
        public String apiKey;
        public String campaignId;
        public Integer timeoutMs;
    }

    public static class TierConfigEntry {
        public String offerId;
        public BusinessHoursConfig businessHours;
        public Integer maxCallsPerHour;
        /**
         * Tier label tried when this tier is closed or at its hourly cap.
         */
        public String fallback;
    }

    public static class BusinessHoursConfig {
        public Integer startHour;
        public Integer endHour;
        public String timezone;
    }

    public static class ZipsConfig {
        /**
         * One ZIP list per tier label; the first column of each row is the ZIP code.
         */
        public Map<String, String> sources;
        public Integer reloadIntervalSeconds;
    }

    public static class HistoryConfig {
        public Integer capacity;
        public String reportingTimezone;
    }
}
