package org.carball.rightsizer.cli;

import lombok.extern.slf4j.Slf4j;
import org.carball.rightsizer.analyzer.RegionPriceComparison;
import org.carball.rightsizer.config.ReferenceTables;
import org.carball.rightsizer.connector.ConnectorException;
import org.carball.rightsizer.connector.EstateSnapshotConnector;
import org.carball.rightsizer.model.instance.InstanceDescriptor;
import org.carball.rightsizer.model.sku.SimilarSku;
import org.carball.rightsizer.model.sku.SkuDescriptor;
import org.carball.rightsizer.model.sku.SkuFeature;
import org.carball.rightsizer.model.validation.QuotaSnapshot;
import org.carball.rightsizer.model.validation.ValidationOutcome;
import org.carball.rightsizer.validation.CatalogConstraintValidator;
import org.carball.rightsizer.validation.QuotaUsageSummary;
import org.carball.rightsizer.validation.SimilarSkuFinder;

import java.io.IOException;
import java.io.PrintStream;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * One-off questions about a snapshot that do not need a full analysis run: can a SKU be
 * deployed, how much quota is left, where is an instance cheaper, what could replace a SKU.
 */
@Slf4j
public class InspectionCommand {

    public static final String VALIDATE_SKU = "validate-sku";
    public static final String CHECK_QUOTA = "check-quota";
    public static final String COMPARE_REGIONS = "compare-regions";
    public static final String FIND_ALTERNATIVES = "find-alternatives";

    private static final List<String> COMMANDS = List.of(VALIDATE_SKU, CHECK_QUOTA, COMPARE_REGIONS, FIND_ALTERNATIVES);

    private static final Map<String, String> OPTION_ALIASES = Map.ofEntries(
            Map.entry("--sku", "sku"), Map.entry("-k", "sku"),
            Map.entry("--region", "region"), Map.entry("-r", "region"),
            Map.entry("--vcpus", "vcpus"), Map.entry("-c", "vcpus"),
            Map.entry("--zones", "zones"), Map.entry("-z", "zones"),
            Map.entry("--features", "features"),
            Map.entry("--family", "family"), Map.entry("-f", "family"),
            Map.entry("--vm", "vm"),
            Map.entry("--resource-group", "resource-group"), Map.entry("-g", "resource-group"),
            Map.entry("--tables", "tables"),
            Map.entry("--max", "max"), Map.entry("-m", "max"),
            Map.entry("--min-similarity", "min-similarity"));

    private final PrintStream out;
    private final PrintStream err;

    public InspectionCommand(PrintStream out, PrintStream err) {
        this.out = out;
        this.err = err;
    }

    public static boolean isCommand(String arg) {
        return COMMANDS.contains(arg);
    }

    static void printUsage(PrintStream out) {
        out.println("Commands:");
        out.println("  validate-sku <snapshot> --sku S --region R [--vcpus N] [--zones 1,2] [--features F1,F2]");
        out.println("  check-quota <snapshot> --region R [--family F]");
        out.println("  compare-regions <snapshot> --vm NAME [--resource-group RG] [--tables file]");
        out.println("  find-alternatives <snapshot> --sku S --region R [--max N] [--min-similarity PCT]");
    }

    /**
     * Runs the command named by the first argument and returns the process exit status.
     */
    public int run(String[] args) {
        String command = args[0];
        try {
            if (args.length < 2) {
                throw new IllegalArgumentException("Snapshot file not specified for " + command);
            }
            Map<String, String> options = parseOptions(Arrays.copyOfRange(args, 2, args.length));
            EstateSnapshotConnector connector = new EstateSnapshotConnector(args[1]);

            switch (command) {
                case VALIDATE_SKU -> validateSku(connector, options);
                case CHECK_QUOTA -> checkQuota(connector, options);
                case COMPARE_REGIONS -> compareRegions(connector, options);
                case FIND_ALTERNATIVES -> findAlternatives(connector, options);
                default -> throw new IllegalArgumentException("Unknown command: " + command);
            }
            return 0;
        } catch (IllegalArgumentException e) {
            err.println("\n❌ Configuration error: " + e.getMessage());
            err.println("\nRun with --help for usage information.");
            log.debug("Configuration error details", e);
        } catch (IllegalStateException e) {
            err.println("\n❌ Invalid snapshot: " + e.getMessage());
            log.debug("Snapshot error details", e);
        } catch (IOException e) {
            err.println("\n❌ IO error: " + e.getMessage());
            log.debug("IO error details", e);
        } catch (ConnectorException e) {
            err.println("\n❌ Could not read snapshot data: " + e.getMessage());
            log.debug("Connector error details", e);
        }
        return 1;
    }

    private void validateSku(EstateSnapshotConnector connector, Map<String, String> options) {
        String sku = required(options, "sku");
        String region = required(options, "region");
        int vcpus = intOption(options, "vcpus", 0);
        List<String> zones = listOption(options, "zones");
        Set<SkuFeature> features = featureOption(options);

        out.println("\nValidating SKU: " + sku + " in " + region);
        ValidationOutcome outcome = new CatalogConstraintValidator(connector, connector)
                .validate(sku, region, vcpus, features, zones);

        out.println(outcome.valid()
                ? "✅ SKU " + sku + " is available in " + region
                : "❌ SKU " + sku + " cannot be deployed in " + region);

        if (outcome.restrictions().isEmpty()) {
            out.println("\nNo restrictions found");
        } else {
            out.println("\nRestrictions:");
            outcome.restrictions().forEach(restriction -> out.println("  • " + restriction));
        }

        outcome.quotaSnapshot().ifPresent(quota -> {
            out.println("\nQuota:");
            out.println("  Family: " + quota.family());
            out.printf("  Used: %d / %d vCPUs (%.1f%%)%n", quota.used(), quota.limit(), quota.usagePercent());
            out.println("  Available: " + quota.available() + " vCPUs");
        });

        out.println("\nAvailable zones: "
                + (outcome.availableZones().isEmpty() ? "None/Not zonal" : String.join(", ", outcome.availableZones())));

        if (!outcome.warnings().isEmpty()) {
            out.println("\nWarnings:");
            outcome.warnings().forEach(warning -> out.println("  • " + warning));
        }
    }

    private void checkQuota(EstateSnapshotConnector connector, Map<String, String> options) {
        String region = required(options, "region");
        QuotaUsageSummary summary = QuotaUsageSummary.of(region, connector.quotaUsage(region), options.get("family"));

        out.println("\nChecking quota for region: " + region);
        if (summary.isEmpty()) {
            out.println("No quota information found for " + region);
            return;
        }

        out.println("\n📊 Quota Summary for " + region);
        out.println("  Total entries: " + summary.quotas().size());
        out.println("  🔴 Critical (≥90%): " + summary.critical().size());
        out.println("  🟡 Warning (70-90%): " + summary.warning().size());
        out.println("  🟢 OK (<70%): " + summary.okCount());

        out.println();
        for (QuotaSnapshot quota : summary.quotas()) {
            out.printf("  %-40s %6d / %-6d %5.1f%%%n", quota.family(), quota.used(), quota.limit(), quota.usagePercent());
        }

        if (!summary.critical().isEmpty()) {
            out.println("\n⚠️ Critical quota warnings:");
            for (QuotaSnapshot quota : summary.critical()) {
                out.printf("  • %s: %d/%d (%.1f%%)%n", quota.family(), quota.used(), quota.limit(), quota.usagePercent());
            }
            out.println("Consider requesting a quota increase for these families");
        }
    }

    private void compareRegions(EstateSnapshotConnector connector, Map<String, String> options) {
        String vmName = required(options, "vm");
        String resourceGroup = options.get("resource-group");

        InstanceDescriptor instance = connector.listInstances(resourceGroup).stream()
                .filter(candidate -> candidate.getName().equalsIgnoreCase(vmName))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Instance '" + vmName + "' not found"
                        + (resourceGroup != null ? " in resource group '" + resourceGroup + "'" : "")));

        RegionPriceComparison.Comparison comparison =
                new RegionPriceComparison(ReferenceTables.load(options.get("tables")), connector).compare(instance);
        if (!comparison.hasAlternatives()) {
            out.println("No alternative regions configured for " + instance.getRegion());
            return;
        }

        out.printf("%n🌍 Regional price comparison for %s (%s)%n", instance.getName(), instance.getVmSize());
        out.printf("  %-22s %12s %14s %16s %10s%n", "Region", "Hourly", "Monthly", "Monthly savings", "Savings %");
        for (RegionPriceComparison.RegionPrice price : comparison.priced()) {
            String savings;
            String percent;
            if (price.current()) {
                savings = "-";
                percent = "-";
            } else if (price.savings() > 0) {
                savings = String.format("$%,.2f", price.savings());
                percent = String.format("%.1f%%", price.savingsPercent());
            } else {
                savings = String.format("+$%,.2f", -price.savings());
                percent = String.format("+%.1f%%", -price.savingsPercent());
            }
            out.printf("  %-22s %12s %14s %16s %10s%n",
                    price.region() + (price.current() ? " ◄ current" : ""),
                    String.format("$%.4f", price.hourly()),
                    String.format("$%,.2f", price.monthly()),
                    savings, percent);
        }

        if (!comparison.unpriced().isEmpty()) {
            out.println("\n⚠️ No pricing found for: " + String.join(", ", comparison.unpriced()));
            out.println("   (SKU may not be available in those regions)");
        }

        comparison.recommendedMove().ifPresent(move -> out.printf(
                "%n💡 Recommendation: move to %s to save $%,.2f/month ($%,.2f/year)%n",
                move.region(), move.savings(), move.savings() * 12));
    }

    private void findAlternatives(EstateSnapshotConnector connector, Map<String, String> options) {
        String sku = required(options, "sku");
        String region = required(options, "region");
        int maxResults = intOption(options, "max", SimilarSkuFinder.DEFAULT_MAX_RESULTS);
        int minSimilarity = intOption(options, "min-similarity", SimilarSkuFinder.DEFAULT_MIN_SIMILARITY);

        out.println("\nFinding alternatives for: " + sku + " in " + region);
        SimilarSkuFinder.Search search = new SimilarSkuFinder(connector).find(sku, region, maxResults, minSimilarity);

        SkuDescriptor target = search.target();
        out.println("\n🎯 Target SKU: " + sku);
        out.println("  Region: " + region);
        out.println("  Available: " + (search.targetAvailable() ? "✅ Yes" : "❌ No"));
        out.println("  vCPUs: " + (target != null ? String.valueOf(target.vcpus()) : "N/A"));
        out.println("  Memory: " + (target != null ? target.memoryGb() + " GB" : "N/A"));

        if (search.alternatives().isEmpty()) {
            out.println("\nNo alternatives found with ≥" + minSimilarity + "% similarity");
            out.println("Try lowering --min-similarity to see more options");
            return;
        }

        out.printf("%n🔄 Available alternatives (similarity ≥ %d%%)%n", minSimilarity);
        out.printf("  %-4s %-28s %6s %10s %-6s %10s  %s%n", "Rank", "SKU", "vCPUs", "Memory", "Family", "Similarity", "Zones");
        int rank = 1;
        for (SimilarSku alternative : search.alternatives()) {
            SkuDescriptor candidate = alternative.sku();
            out.printf("  %-4d %-28s %6d %10s %-6s %9d%%  %s%n",
                    rank++,
                    candidate.name(),
                    candidate.vcpus(),
                    candidate.memoryGb() + " GB",
                    candidate.family() != null ? candidate.family() : "",
                    alternative.similarity(),
                    candidate.availableZones().isEmpty() ? "All" : String.join(", ", candidate.availableZones()));
        }
    }

    static Map<String, String> parseOptions(String[] args) {
        Map<String, String> options = new HashMap<>();
        for (int i = 0; i < args.length; i++) {
            String name = OPTION_ALIASES.get(args[i]);
            if (name == null) {
                throw new IllegalArgumentException("Unknown option: " + args[i]);
            }
            if (i + 1 >= args.length) {
                throw new IllegalArgumentException("Missing value for " + args[i]);
            }
            options.put(name, args[++i]);
        }
        return options;
    }

    private static String required(Map<String, String> options, String name) {
        String value = options.get(name);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("--" + name + " is required");
        }
        return value;
    }

    private static int intOption(Map<String, String> options, String name, int defaultValue) {
        String value = options.get(name);
        if (value == null) {
            return defaultValue;
        }
        try {
            int parsed = Integer.parseInt(value.trim());
            if (parsed < 0) {
                throw new IllegalArgumentException("--" + name + " must not be negative");
            }
            return parsed;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid value for --" + name + ": " + value);
        }
    }

    private static List<String> listOption(Map<String, String> options, String name) {
        String value = options.get(name);
        if (value == null || value.isBlank()) {
            return List.of();
        }
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(item -> !item.isEmpty())
                .toList();
    }

    private static Set<SkuFeature> featureOption(Map<String, String> options) {
        Set<SkuFeature> features = EnumSet.noneOf(SkuFeature.class);
        for (String name : listOption(options, "features")) {
            features.add(SkuFeature.fromName(name).orElseThrow(() -> new IllegalArgumentException(
                    "Unknown feature: " + name + ". Use: " + Arrays.stream(SkuFeature.values())
                            .map(SkuFeature::getDisplayName)
                            .collect(Collectors.joining(", ")))));
        }
        return features;
    }
}
