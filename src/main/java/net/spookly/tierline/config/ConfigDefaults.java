package net.spookly.tierline.config;

/**
 * Default configuration template written when no config file exists.
 */
public final class ConfigDefaults {
    private static final String DEFAULT_YAML = """
            # Generated default Tierline config.
            # The bid API key is read from the MARKETCALL_API_KEY environment variable.
            server:
              host: 0.0.0.0
              port: 5000
              maxRequestBytes: 16384
              maxHistoryResults: 500
              workerThreads: 8

            bid:
              baseUrl: https://www.marketcall.com
              apiKey: env:MARKETCALL_API_KEY
              campaignId: "323747"
              timeoutMs: 5000

            tiers:
              tier_1:
                offerId: "11558"
                businessHours:
                  startHour: 9
                  endHour: 21
                  timezone: US/Eastern
                maxCallsPerHour: 100
                fallback: tier_2
              tier_2:
                offerId: "22222"
                businessHours:
                  startHour: 8
                  endHour: 22
                  timezone: US/Eastern
                maxCallsPerHour: 150
                fallback: tier_3
              tier_3:
                offerId: "33333"
                businessHours:
                  startHour: 8
                  endHour: 23
                  timezone: US/Central
                maxCallsPerHour: 200

            zips:
              sources:
                tier_1: data/tier_1.csv
                tier_2: data/tier_2.csv
                tier_3: data/tier_3.csv
              reloadIntervalSeconds: 3600

            history:
              capacity: 10000
              reportingTimezone: US/Eastern
            """;

    private ConfigDefaults() {
    }

    /**
     * Default YAML written on first start.
     */
    public static String defaultYaml() {
        return DEFAULT_YAML;
    }
}
