package org.carball.rightsizer.config;

import lombok.extern.slf4j.Slf4j;

import java.util.Locale;
import java.util.Map;

@Slf4j
public class ConfigurationLoader {

    static final String ENV_PREFIX = "RIGHTSIZER_";
    public static final String CLI_PREFIX = "--settings.";

    private static final String[] OPTION_KEYS = {
            "lookback-days", "cpu-low", "cpu-high", "memory-low", "memory-high",
            "check-disk", "check-network", "same-family", "allow-burstable",
            "leap-enabled", "leap", "leap-fallback", "workers", "ai-concurrency",
            "instance-timeout", "batch-timeout", "ai-model"
    };

    private final Map<String, String> environment;

    public ConfigurationLoader() {
        this(System.getenv());
    }

    ConfigurationLoader(Map<String, String> environment) {
        this.environment = environment;
    }

    /**
     * Loads configuration using the hierarchy: CLI args > env vars > defaults
     */
    public RightsizingSettings loadConfiguration(String[] args) {
        log.debug("Loading configuration");

        RightsizingSettings.RightsizingSettingsBuilder builder = RightsizingSettings.builder();
        applyEnvironmentVariables(builder);
        applyCLIArguments(builder, args);

        RightsizingSettings settings = builder.build();
        settings.validate();

        log.info("Configuration loaded: {}", settings.getConfigurationSummary());
        return settings;
    }

    public RightsizingSettings loadProfile(String profileName) {
        try {
            SizingProfile profile = SizingProfile.fromName(profileName);
            RightsizingSettings settings = profile.buildSettings();
            log.info("Loaded profile '{}': {}", profileName, settings.getConfigurationSummary());
            return settings;
        } catch (IllegalArgumentException e) {
            log.error("Unknown profile: {}. {}", profileName, e.getMessage());
            throw e;
        }
    }

    /**
     * Loads the profile, then overlays environment variables and CLI arguments.
     */
    public RightsizingSettings loadConfigurationWithProfile(String profileName, String[] args) {
        RightsizingSettings.RightsizingSettingsBuilder builder = loadProfile(profileName).toBuilder();

        applyEnvironmentVariables(builder);
        applyCLIArguments(builder, args);

        RightsizingSettings settings = builder.build();
        settings.validate();

        log.info("Configuration loaded with profile '{}': {}", profileName, settings.getConfigurationSummary());
        return settings;
    }

    private void applyEnvironmentVariables(RightsizingSettings.RightsizingSettingsBuilder builder) {
        for (String key : OPTION_KEYS) {
            String variable = ENV_PREFIX + key.replace('-', '_').toUpperCase(Locale.ROOT);
            String value = environment.get(variable);
            if (value != null) {
                applyOption(builder, key, value, variable);
            }
        }
    }

    private void applyCLIArguments(RightsizingSettings.RightsizingSettingsBuilder builder, String[] args) {
        for (int i = 0; i < args.length - 1; i++) {
            if (args[i].startsWith(CLI_PREFIX)) {
                applyOption(builder, args[i].substring(CLI_PREFIX.length()), args[i + 1], args[i]);
            }
        }
    }

    private void applyOption(RightsizingSettings.RightsizingSettingsBuilder builder,
                             String key, String value, String source) {
        try {
            switch (key) {
                case "lookback-days" -> builder.lookbackDays(Integer.parseInt(value));
                case "cpu-low" -> builder.cpuThresholdLow(Double.parseDouble(value));
                case "cpu-high" -> builder.cpuThresholdHigh(Double.parseDouble(value));
                case "memory-low" -> builder.memoryThresholdLow(Double.parseDouble(value));
                case "memory-high" -> builder.memoryThresholdHigh(Double.parseDouble(value));
                case "check-disk" -> builder.checkDiskRequirements(parseBoolean(value));
                case "check-network" -> builder.checkNetworkRequirements(parseBoolean(value));
                case "same-family" -> builder.preferSameFamily(parseBoolean(value));
                case "allow-burstable" -> builder.allowBurstable(parseBoolean(value));
                case "leap-enabled" -> builder.generationLeapEnabled(parseBoolean(value));
                case "leap" -> builder.generationLeap(Integer.parseInt(value));
                case "leap-fallback" -> builder.generationLeapFallback(parseBoolean(value));
                case "workers" -> builder.maxWorkers(Integer.parseInt(value));
                case "ai-concurrency" -> builder.aiConcurrency(Integer.parseInt(value));
                case "instance-timeout" -> builder.instanceTimeoutSeconds(Long.parseLong(value));
                case "batch-timeout" -> builder.batchTimeoutSeconds(Long.parseLong(value));
                case "ai-model" -> builder.aiModel(value);
                default -> log.warn("Unknown setting {} ignored", source);
            }
        } catch (NumberFormatException e) {
            log.warn("Invalid numeric value for {}: {}", source, value);
        } catch (IllegalArgumentException e) {
            log.warn("Invalid value for {}: {}", source, e.getMessage());
        }
    }

    private static boolean parseBoolean(String value) {
        if ("true".equalsIgnoreCase(value) || "false".equalsIgnoreCase(value)) {
            return Boolean.parseBoolean(value);
        }
        throw new IllegalArgumentException("expected true or false but was '" + value + "'");
    }

    public static String getSettingsHelp() {
        return """
            Settings Options:

            CLI Arguments:
              --settings.lookback-days <num>     Days of metrics history to summarize
              --settings.cpu-low <pct>           Average CPU below this shrinks the vCPU range
              --settings.cpu-high <pct>          Peak CPU above this grows the vCPU range
              --settings.memory-low <pct>        Average memory below this shrinks the memory range
              --settings.memory-high <pct>       Peak memory above this grows the memory range
              --settings.check-disk <bool>       Reject SKUs with fewer data disk slots
              --settings.check-network <bool>    Reject SKUs with a lower bandwidth tier
              --settings.same-family <bool>      Only recommend SKUs from the current family
              --settings.allow-burstable <bool>  Allow burstable B-series SKUs
              --settings.leap-enabled <bool>     Prefer SKUs some generations newer
              --settings.leap <num>              Generations to leap forward (1-3)
              --settings.leap-fallback <bool>    Accept SKUs older than the leap target
              --settings.workers <num>           Worker pool width
              --settings.ai-concurrency <num>    Concurrent language model calls
              --settings.instance-timeout <sec>  Per-instance analysis timeout
              --settings.batch-timeout <sec>     Whole batch timeout
              --settings.ai-model <name>         Language model name

            Environment Variables:
              RIGHTSIZER_<OPTION>                e.g. RIGHTSIZER_CPU_LOW, RIGHTSIZER_LEAP_FALLBACK

            Priority Order (highest to lowest):
              1. CLI arguments
              2. Environment variables
              3. Profile defaults or built-in defaults
            """;
    }
}
