package net.spookly.tierline;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.concurrent.CountDownLatch;

import net.spookly.tierline.bid.MarketcallBidClient;
import net.spookly.tierline.call.CallProcessor;
import net.spookly.tierline.config.ConfigLoader;
import net.spookly.tierline.config.ConfigPrinter;
import net.spookly.tierline.config.ConfigWarnings;
import net.spookly.tierline.config.TierlineConfig;
import net.spookly.tierline.outcome.CallAuditLogger;
import net.spookly.tierline.outcome.OutcomeRecorder;
import net.spookly.tierline.routing.CsvZipSource;
import net.spookly.tierline.routing.HourlyRateLimiter;
import net.spookly.tierline.routing.RoutingEngine;
import net.spookly.tierline.routing.RoutingEngineState;
import net.spookly.tierline.routing.ZipDirectory;
import net.spookly.tierline.routing.ZipLoadResult;
import net.spookly.tierline.routing.ZipReloadService;
import net.spookly.tierline.server.CallEventServer;
import net.spookly.tierline.tier.TierRegistry;

/**
 * Standalone entry point for the Tierline call webhook.
 */
public final class TierlineMain {
    private static final String DEFAULT_CONFIG = "config/tierline.yaml";

    private TierlineMain() {
    }

    /**
     * Boot the routing engine and the webhook listener.
     */
    public static void main(String[] args) {
        CliOptions options = parseArgs(args);
        Path configPath = options.configPath;
        TierlineConfig config = ConfigLoader.load(configPath);
        emitWarnings(config);
        if (options.printEffectiveConfig) {
            System.out.println(ConfigPrinter.toYaml(config));
            return;
        }
        if (options.dryRun) {
            System.out.println("Config OK (--dry-run).");
            return;
        }

        TierRegistry registry = TierRegistry.fromConfig(config);
        OutcomeRecorder recorder = new OutcomeRecorder(historyCapacity(config), reportingZone(config));
        recorder.addListener(CallAuditLogger.INSTANCE);
        RoutingEngineState state = new RoutingEngineState(new ZipDirectory(), new HourlyRateLimiter(registry), recorder);
        RoutingEngine engine = new RoutingEngine(registry, state);

        CsvZipSource zipSource = CsvZipSource.fromConfig(config);
        ZipLoadResult initialLoad = state.zipDirectory().reload(zipSource);
        if (initialLoad.ok()) {
            System.out.println("ZIP data loaded: zips=" + initialLoad.zipCount()
                    + " skipped=" + initialLoad.skippedRows() + " conflicts=" + initialLoad.conflicts());
        }
        System.out.println("Tierline config loaded: tiers=" + registry.tierIds()
                + " listen=" + config.server.host + ":" + config.server.port);

        CallProcessor processor = new CallProcessor(engine, MarketcallBidClient.fromConfig(config), config.bid.campaignId);
        CallEventServer server = CallEventServer.fromConfig(config, processor, engine, zipSource);
        server.start();

        ZipReloadService reloadService = null;
        if (config.zips.reloadIntervalSeconds != null) {
            reloadService = new ZipReloadService(state.zipDirectory(), zipSource, config.zips.reloadIntervalSeconds);
            reloadService.start();
        }

        CountDownLatch latch = new CountDownLatch(1);
        ZipReloadService finalReloadService = reloadService;
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            if (finalReloadService != null) {
                finalReloadService.stop();
            }
            server.stop();
            latch.countDown();
        }));

        try {
            latch.await();
        } catch (InterruptedException ignored) {
            Thread.currentThread().interrupt();
        }
    }

    private static int historyCapacity(TierlineConfig config) {
        if (config.history == null || config.history.capacity == null) {
            return OutcomeRecorder.DEFAULT_CAPACITY;
        }
        return config.history.capacity;
    }

    private static ZoneId reportingZone(TierlineConfig config) {
        if (config.history == null || config.history.reportingTimezone == null
                || config.history.reportingTimezone.isBlank()) {
            return ZoneOffset.UTC;
        }
        try {
            return ZoneId.of(config.history.reportingTimezone.trim());
        } catch (DateTimeException e) {
            // Reported by ConfigWarnings at startup.
            return ZoneOffset.UTC;
        }
    }

    private static CliOptions parseArgs(String[] args) {
        Path configPath = Paths.get(DEFAULT_CONFIG);
        boolean dryRun = false;
        boolean printEffectiveConfig = false;
        if (args == null) {
            return new CliOptions(configPath, dryRun, printEffectiveConfig);
        }
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if ("--config".equals(arg) || "-c".equals(arg)) {
                if (i + 1 < args.length) {
                    configPath = Paths.get(args[++i]);
                    continue;
                }
            }
            if ("--dry-run".equals(arg)) {
                dryRun = true;
                continue;
            }
            if ("--print-effective-config".equals(arg)) {
                printEffectiveConfig = true;
            }
        }
        return new CliOptions(configPath, dryRun, printEffectiveConfig);
    }

    private static void emitWarnings(TierlineConfig config) {
        for (String warning : ConfigWarnings.collect(config)) {
            System.err.println("Config warning: " + warning);
        }
    }

    private record CliOptions(Path configPath, boolean dryRun, boolean printEffectiveConfig) {
    }
}
