package org.carball.rightsizer.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import lombok.extern.slf4j.Slf4j;
import org.carball.rightsizer.ai.AIRecommendationAdapter;
import org.carball.rightsizer.ai.OpenAiCompletionProvider;
import org.carball.rightsizer.analyzer.AnalysisException;
import org.carball.rightsizer.analyzer.RightsizingAnalyzer;
import org.carball.rightsizer.cache.PriceCache;
import org.carball.rightsizer.cache.SkuCatalogCache;
import org.carball.rightsizer.config.ConfigurationLoader;
import org.carball.rightsizer.config.OutputFormat;
import org.carball.rightsizer.config.ReferenceTables;
import org.carball.rightsizer.config.RightsizerConfig;
import org.carball.rightsizer.config.RightsizingSettings;
import org.carball.rightsizer.config.SizingProfile;
import org.carball.rightsizer.connector.EstateSnapshotConnector;
import org.carball.rightsizer.model.analysis.AnalysisReport;
import org.carball.rightsizer.model.analysis.RecommendationType;
import org.carball.rightsizer.model.analysis.RightsizingResult;
import org.carball.rightsizer.output.FileReportSink;
import org.carball.rightsizer.validation.CatalogConstraintValidator;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

@Slf4j
public class RightsizerCLI {

    private static final String VERSION = "1.0.0";
    private static final String BANNER = """
        ╔═══════════════════════════════════════════════════════════════╗
        ║              VM Rightsizing Recommendation Engine v%s        ║
        ╚═══════════════════════════════════════════════════════════════╝
        """;

    public static void main(String[] args) {
        System.out.printf((BANNER) + "%n", VERSION);

        if (args.length < 1 || isHelpRequested(args)) {
            printUsage();
            System.exit(args.length < 1 ? 1 : 0);
        }

        if (InspectionCommand.isCommand(args[0])) {
            System.exit(new InspectionCommand(System.out, System.err).run(args));
        }

        try {
            RightsizerConfig config = parseArgs(args);
            if (config.isVerbose()) {
                enableVerboseLogging();
            }
            FileReportSink sink = new FileReportSink(config.getOutputFile(), config.getOutputFormat());

            System.out.println("\n🔍 Starting analysis...");
            System.out.println("   Snapshot file: " + config.getSnapshotFile());
            System.out.println("   Profile: " + config.getSettings().getProfileName());
            if (config.getResourceGroup() != null) {
                System.out.println("   Resource group: " + config.getResourceGroup());
            }
            System.out.println("   AI recommendations: " + (config.isIncludeAi() ? "enabled" : "disabled"));
            System.out.println();

            System.out.print("📂 Loading estate snapshot... ");
            EstateSnapshotConnector connector = new EstateSnapshotConnector(config.getSnapshotFile().toString());
            System.out.println("✓");

            RightsizingAnalyzer analyzer = buildAnalyzer(config, connector);

            System.out.print("📊 Analyzing instances... ");
            AnalysisReport report = analyzer.analyze(
                    config.getResourceGroup(), config.isIncludeMetrics(), config.isIncludeAi());
            System.out.println("✓");

            System.out.print("📝 Writing results... ");
            List<Path> written = sink.write(report);
            System.out.println("✓");

            printSummary(report, config.isVerbose());

            System.out.println("\n✅ Analysis complete!");
            System.out.println("   Output files:");
            written.forEach(path -> System.out.println("     - " + path));

            if (report.getInstancesWithRecommendations() == 0) {
                System.out.println("\n💡 No savings opportunities found.");
            }

        } catch (IllegalArgumentException e) {
            System.err.println("\n❌ Configuration error: " + e.getMessage());
            System.err.println("\nRun with --help for usage information.");
            log.debug("Configuration error details", e);
            System.exit(1);
        } catch (IllegalStateException e) {
            System.err.println("\n❌ Invalid snapshot: " + e.getMessage());
            log.debug("Snapshot error details", e);
            System.exit(1);
        } catch (IOException e) {
            System.err.println("\n❌ IO error: " + e.getMessage());
            log.debug("IO error details", e);
            System.exit(1);
        } catch (AnalysisException e) {
            System.err.println("\n❌ Analysis failed: " + e.getMessage());
            log.debug("Analysis error details", e);
            System.exit(1);
        } catch (Exception e) {
            System.err.println("\n❌ Unexpected error: " + e.getMessage());
            log.debug("Unexpected error details", e);
            System.exit(1);
        }
    }

    private static void enableVerboseLogging() {
        Logger packageLogger = (Logger) LoggerFactory.getLogger("org.carball.rightsizer");
        packageLogger.setLevel(Level.DEBUG);
    }

    private static boolean isHelpRequested(String[] args) {
        return Arrays.asList(args).contains("--help") ||
                Arrays.asList(args).contains("-h") ||
                Arrays.asList(args).contains("help");
    }

    private static void printUsage() {
        System.out.println("\nUsage: java -jar vm-rightsizer.jar <snapshot-file> [options]");
        System.out.println("       java -jar vm-rightsizer.jar <command> <snapshot-file> [command options]");
        System.out.println();
        InspectionCommand.printUsage(System.out);
        System.out.println();
        System.out.println("Arguments:");
        System.out.println("  snapshot-file       JSON estate snapshot (instances, metrics, SKUs, prices, quotas)");
        System.out.println();
        System.out.println("Options:");
        System.out.println("  --output, -o        Output file for the report (default: rightsizing-report.json)");
        System.out.println("  --format, -f        Output format: json|markdown|csv|all (default: json)");
        System.out.println("  --profile, -p       Sizing profile: " + SizingProfile.getAvailableProfiles());
        System.out.println("  --tables            YAML file with generation map and region alternatives");
        System.out.println("  --resource-group    Only analyze instances in this resource group");
        System.out.println("  --workers           Worker pool width");
        System.out.println("  --no-ai             Skip AI recommendations");
        System.out.println("  --no-metrics        Skip utilization metrics");
        System.out.println("  --api-key           OpenAI API key (or set OPENAI_API_KEY env var)");
        System.out.println("  --verbose, -v       Enable verbose output");
        System.out.println("  --help, -h          Show this help message");
        System.out.println();
        System.out.println(ConfigurationLoader.getSettingsHelp());
        System.out.println(SizingProfile.getProfileHelp());
        System.out.println("Examples:");
        System.out.println("  # Basic analysis without AI");
        System.out.println("  java -Dskip.ai=true -jar vm-rightsizer.jar estate.json");
        System.out.println();
        System.out.println("  # Conservative profile, every report format");
        System.out.println("  java -jar vm-rightsizer.jar estate.json --profile conservative --format all -o report");
        System.out.println();
        System.out.println("  # Similar SKUs when Standard_D16ds_v5 is constrained");
        System.out.println("  java -jar vm-rightsizer.jar find-alternatives estate.json --sku Standard_D16ds_v5 --region eastus2");
        System.out.println();
        System.out.println("Environment Variables:");
        System.out.println("  OPENAI_API_KEY      Your OpenAI API key for AI-powered recommendations");
    }

    static RightsizerConfig parseArgs(String[] args) {
        RightsizerConfig config = new RightsizerConfig();
        config.setSnapshotFile(Paths.get(args[0]));

        // Set defaults
        config.setOutputFile("rightsizing-report.json");
        config.setOutputFormat(OutputFormat.JSON);

        String profileName = null;
        Integer workers = null;

        for (int i = 1; i < args.length; i++) {
            String arg = args[i];
            if (arg.startsWith(ConfigurationLoader.CLI_PREFIX)) {
                // Consumed by ConfigurationLoader
                i++;
                continue;
            }

            switch (arg) {
                case "--output", "-o" -> config.setOutputFile(requireValue(args, ++i, "Output file not specified"));
                case "--format", "-f" -> {
                    String value = requireValue(args, ++i, "Output format not specified");
                    try {
                        config.setOutputFormat(OutputFormat.valueOf(value.toUpperCase(Locale.ROOT)));
                    } catch (IllegalArgumentException e) {
                        throw new IllegalArgumentException("Invalid output format. Use: json, markdown, csv, or all");
                    }
                }
                case "--profile", "-p" -> profileName = requireValue(args, ++i, "Profile not specified");
                case "--tables" -> config.setTablesFile(requireValue(args, ++i, "Reference tables file not specified"));
                case "--resource-group", "-g" ->
                        config.setResourceGroup(requireValue(args, ++i, "Resource group not specified"));
                case "--workers" -> {
                    String value = requireValue(args, ++i, "Worker count not specified");
                    try {
                        workers = Integer.parseInt(value);
                    } catch (NumberFormatException e) {
                        throw new IllegalArgumentException("Invalid worker count: " + value);
                    }
                    if (workers < 1) {
                        throw new IllegalArgumentException("Worker count must be at least 1");
                    }
                }
                case "--api-key" -> config.setOpenAiApiKey(requireValue(args, ++i, "API key not specified"));
                case "--no-ai" -> config.setIncludeAi(false);
                case "--no-metrics" -> config.setIncludeMetrics(false);
                case "--verbose", "-v" -> config.setVerbose(true);
                default -> throw new IllegalArgumentException("Unknown option: " + arg);
            }
        }

        ConfigurationLoader loader = new ConfigurationLoader();
        RightsizingSettings settings = profileName != null
                ? loader.loadConfigurationWithProfile(profileName, args)
                : loader.loadConfiguration(args);
        if (workers != null) {
            settings = settings.toBuilder().maxWorkers(workers).build();
        }
        config.setSettings(settings);

        if (config.getOutputFormat() != OutputFormat.ALL) {
            config.setOutputFile(FileReportSink.removeFileExtension(config.getOutputFile())
                    + config.getOutputFormat().getExtension());
        }

        validateConfig(config);
        return config;
    }

    private static String requireValue(String[] args, int index, String message) {
        if (index >= args.length) {
            throw new IllegalArgumentException(message);
        }
        return args[index];
    }

    private static void validateConfig(RightsizerConfig config) {
        if (!Files.exists(config.getSnapshotFile())) {
            throw new IllegalArgumentException("Snapshot file not found: " + config.getSnapshotFile());
        }

        if (!config.getSnapshotFile().toString().endsWith(".json")) {
            throw new IllegalArgumentException("Snapshot file must be a .json file");
        }

        // AI is optional: without a key the run continues with the basic summary
        boolean skipAi = "true".equals(System.getProperty("skip.ai"));
        if (skipAi) {
            config.setIncludeAi(false);
        }
        if (config.isIncludeAi() && config.getOpenAiApiKey() == null) {
            config.setOpenAiApiKey(System.getenv("OPENAI_API_KEY"));
            if (config.getOpenAiApiKey() == null) {
                log.warn("No OpenAI API key found; AI recommendations disabled. "
                        + "Use --api-key, set OPENAI_API_KEY, or pass -Dskip.ai=true to silence this");
                config.setIncludeAi(false);
            }
        }

        Path outputDir = Paths.get(config.getOutputFile()).getParent();
        if (outputDir != null && !Files.exists(outputDir)) {
            throw new IllegalArgumentException("Output directory does not exist: " + outputDir);
        }
    }

    private static RightsizingAnalyzer buildAnalyzer(RightsizerConfig config, EstateSnapshotConnector connector) {
        RightsizingSettings settings = config.getSettings();

        AIRecommendationAdapter aiAdapter = config.isIncludeAi()
                ? new AIRecommendationAdapter(
                        new OpenAiCompletionProvider(config.getOpenAiApiKey(), settings.getAiModel()),
                        settings.getAiConcurrency())
                : AIRecommendationAdapter.disabled();

        return RightsizingAnalyzer.builder()
                .settings(settings)
                .inventory(connector)
                .catalogCache(new SkuCatalogCache(connector))
                .priceCache(new PriceCache(connector))
                .priceClient(connector)
                .constraintValidator(new CatalogConstraintValidator(connector, connector))
                .aiAdapter(aiAdapter)
                .referenceTables(ReferenceTables.load(config.getTablesFile()))
                .build();
    }

    private static void printSummary(AnalysisReport report, boolean verbose) {
        System.out.println("\n" + "=".repeat(60));
        System.out.println("📊 ANALYSIS SUMMARY");
        System.out.println("=".repeat(60));

        System.out.println("\nInstances found: " + report.getTotalInstances());
        System.out.println("Instances analyzed: " + report.getAnalyzedInstances());
        System.out.println("With recommendations: " + report.getInstancesWithRecommendations());
        System.out.printf("Current monthly cost: $%,.2f%n", report.getTotalCurrentCost());
        System.out.printf("Potential monthly savings: $%,.2f%n", report.getTotalPotentialSavings());
        System.out.printf("Potential annual savings: $%,.2f%n", report.getTotalAnnualSavings());

        System.out.println("\nRecommendation breakdown:");
        System.out.println("  🛑 Shutdown: " + report.countFor(RecommendationType.SHUTDOWN));
        System.out.println("  📐 Rightsize: " + report.countFor(RecommendationType.RIGHTSIZE));
        System.out.println("  ⬆️ Generation upgrade: " + report.countFor(RecommendationType.GENERATION_UPGRADE));
        System.out.println("  🌍 Region move: " + report.countFor(RecommendationType.REGION_MOVE));

        System.out.println("\n🎯 Top Opportunities:");
        System.out.println("-".repeat(60));

        report.getResults().stream()
                .filter(RightsizingResult::hasSavings)
                .limit(3)
                .forEach(result -> {
                    System.out.printf("%-24s %s → %s%n",
                            result.getInstance().getName(),
                            result.getInstance().getVmSize(),
                            result.recommendedSku());
                    System.out.printf("  └─ %s, %s priority, $%,.2f/month%n",
                            result.getRecommendationType().getDisplayName(),
                            result.getPriority().getDisplayName(),
                            result.getTotalPotentialSavings());
                    if (verbose && !result.getConstraintIssues().isEmpty()) {
                        System.out.println("  └─ Constraints: " + String.join("; ", result.getConstraintIssues()));
                    }
                    System.out.println();
                });
    }
}
