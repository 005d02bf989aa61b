package org.carball.rightsizer.cli;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

public class InspectionCommandTest {

    @TempDir
    Path tempDir;

    private String snapshot;
    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;
    private InspectionCommand command;

    @BeforeEach
    void setUp() throws IOException {
        Path file = tempDir.resolve("estate.json");
        Files.writeString(file, """
            {
              "instances": [
                {"name": "web-prod-01", "resource_group": "rg-web", "location": "eastus", "vm_size": "Standard_D4s_v5"}
              ],
              "skus": {
                "eastus": [
                  {"name": "Standard_D4s_v5", "zones": ["1", "2", "3"],
                   "capabilities": {"vCPUs": "4", "MemoryGB": "16", "MaxDataDiskCount": "8",
                                    "PremiumIO": "True", "AcceleratedNetworkingEnabled": "True"}},
                  {"name": "Standard_D4as_v5", "zones": ["1", "2"],
                   "capabilities": {"vCPUs": "4", "MemoryGB": "16", "MaxDataDiskCount": "8",
                                    "PremiumIO": "True", "AcceleratedNetworkingEnabled": "True"}},
                  {"name": "Standard_E4s_v5",
                   "capabilities": {"vCPUs": "4", "MemoryGB": "32", "MaxDataDiskCount": "8",
                                    "PremiumIO": "True", "AcceleratedNetworkingEnabled": "True"}},
                  {"name": "Standard_M8ms",
                   "capabilities": {"vCPUs": "8", "MemoryGB": "218.75"},
                   "restrictions": [{"type": "Location", "reason_code": "NotAvailableForSubscription", "locations": ["eastus"]}]}
                ]
              },
              "prices": {
                "Standard_D4s_v5|eastus|Linux": 0.192,
                "Standard_D4s_v5|eastus2|Linux": 0.168
              },
              "quotas": {
                "eastus": [
                  {"name": "Standard DSv5 Family vCPUs", "current_value": 96, "limit": 100},
                  {"name": "Standard ESv5 Family vCPUs", "current_value": 10, "limit": 100},
                  {"name": "Total Regional vCPUs", "current_value": 120, "limit": 350}
                ]
              }
            }
            """);
        snapshot = file.toString();

        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
        command = new InspectionCommand(new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    @Test
    void shouldRecognizeCommandNames() {
        assertThat(InspectionCommand.isCommand("validate-sku")).isTrue();
        assertThat(InspectionCommand.isCommand("check-quota")).isTrue();
        assertThat(InspectionCommand.isCommand("compare-regions")).isTrue();
        assertThat(InspectionCommand.isCommand("find-alternatives")).isTrue();
        assertThat(InspectionCommand.isCommand("estate.json")).isFalse();
    }

    @Test
    void shouldReportQuotaAndZoneProblemsForSku() {
        // When
        int status = command.run(new String[]{"validate-sku", snapshot,
                "--sku", "Standard_D4s_v5", "--region", "eastus", "--vcpus", "8", "--zones", "1,4",
                "--features", "PremiumStorage"});

        // Then
        String output = output();
        assertThat(status).isZero();
        assertThat(output).contains("❌ SKU Standard_D4s_v5 cannot be deployed in eastus");
        assertThat(output).contains("Insufficient quota: need 8 vCPUs, only 4 available");
        assertThat(output).contains("SKU not available in zones: 4");
        assertThat(output).contains("Family: Standard DSv5 Family vCPUs");
        assertThat(output).contains("Available: 4 vCPUs");
        assertThat(output).contains("Available zones: 1, 2, 3");
        assertThat(output).doesNotContain("Missing required features");
    }

    @Test
    void shouldValidateDeployableAndRestrictedSkus() {
        // When
        int available = command.run(new String[]{"validate-sku", snapshot, "-k", "Standard_D4as_v5", "-r", "eastus"});
        String availableOutput = output();
        out.reset();
        int restricted = command.run(new String[]{"validate-sku", snapshot, "--sku", "Standard_M8ms", "--region", "eastus"});

        // Then
        assertThat(available).isZero();
        assertThat(availableOutput).contains("✅ SKU Standard_D4as_v5 is available in eastus", "No restrictions found");
        assertThat(restricted).isZero();
        assertThat(output()).contains("cannot be deployed", "Location: NotAvailableForSubscription");
    }

    @Test
    void shouldRejectUnknownFeature() {
        // When
        int status = command.run(new String[]{"validate-sku", snapshot,
                "--sku", "Standard_D4s_v5", "--region", "eastus", "--features", "Turbo"});

        // Then
        assertThat(status).isEqualTo(1);
        assertThat(errors()).contains("Unknown feature: Turbo", "PremiumStorage");
    }

    @Test
    void shouldSummarizeQuotaUsage() {
        // When
        int status = command.run(new String[]{"check-quota", snapshot, "--region", "eastus"});

        // Then
        String output = output();
        assertThat(status).isZero();
        assertThat(output).contains("Total entries: 3");
        assertThat(output).contains("Critical (≥90%): 1");
        assertThat(output).contains("OK (<70%): 2");
        assertThat(output).contains("Standard DSv5 Family vCPUs: 96/100 (96.0%)");
        assertThat(output).contains("Consider requesting a quota increase");
    }

    @Test
    void shouldFilterQuotaByFamilyAndHandleMissingRegion() {
        // When
        command.run(new String[]{"check-quota", snapshot, "--region", "eastus", "--family", "esv5"});
        String filtered = output();
        out.reset();
        int status = command.run(new String[]{"check-quota", snapshot, "-r", "westus"});

        // Then
        assertThat(filtered).contains("Total entries: 1").doesNotContain("Critical quota warnings");
        assertThat(status).isZero();
        assertThat(output()).contains("No quota information found for westus");
    }

    @Test
    void shouldCompareRegionsAndRecommendCheapest() {
        // When
        int status = command.run(new String[]{"compare-regions", snapshot, "--vm", "WEB-PROD-01"});

        // Then
        String output = output();
        assertThat(status).isZero();
        assertThat(output).contains("Regional price comparison for web-prod-01 (Standard_D4s_v5)");
        assertThat(output).contains("eastus ◄ current");
        assertThat(output).contains("No pricing found for: southcentralus, northcentralus, centralus, westus2");
        assertThat(output).contains("move to eastus2 to save $17.52/month ($210.24/year)");
        assertThat(output.indexOf("eastus2")).isLessThan(output.indexOf("eastus ◄ current"));
    }

    @Test
    void shouldRejectUnknownInstance() {
        // When
        int status = command.run(new String[]{"compare-regions", snapshot, "--vm", "ghost", "-g", "rg-web"});

        // Then
        assertThat(status).isEqualTo(1);
        assertThat(errors()).contains("Instance 'ghost' not found in resource group 'rg-web'");
    }

    @Test
    void shouldListSimilarAvailableSkus() {
        // When
        int status = command.run(new String[]{"find-alternatives", snapshot, "--sku", "Standard_D4s_v5", "--region", "eastus"});

        // Then
        String output = output();
        assertThat(status).isZero();
        assertThat(output).contains("Available: ✅ Yes");
        assertThat(output).contains("vCPUs: 4");
        assertThat(output).contains("Standard_D4as_v5", "Standard_E4s_v5");
        assertThat(output).doesNotContain("Standard_M8ms");
        assertThat(output.indexOf("Standard_D4as_v5")).isLessThan(output.indexOf("Standard_E4s_v5"));
    }

    @Test
    void shouldHonorMinimumSimilarityAndUnknownTarget() {
        // When
        command.run(new String[]{"find-alternatives", snapshot,
                "--sku", "Standard_D4s_v5", "--region", "eastus", "--min-similarity", "100"});
        String strict = output();
        out.reset();
        command.run(new String[]{"find-alternatives", snapshot, "--sku", "Standard_X1_v9", "--region", "eastus"});

        // Then
        assertThat(strict).contains("Standard_D4as_v5").doesNotContain("Standard_E4s_v5");
        assertThat(output()).contains("Available: ❌ No", "vCPUs: N/A", "No alternatives found with ≥60% similarity");
    }

    @Test
    void shouldFailOnUsageErrors() {
        assertThat(command.run(new String[]{"check-quota"})).isEqualTo(1);
        assertThat(errors()).contains("Snapshot file not specified for check-quota");

        assertThat(command.run(new String[]{"check-quota", snapshot})).isEqualTo(1);
        assertThat(errors()).contains("--region is required");

        assertThat(command.run(new String[]{"check-quota", snapshot, "--region"})).isEqualTo(1);
        assertThat(errors()).contains("Missing value for --region");

        assertThat(command.run(new String[]{"find-alternatives", snapshot, "--sku", "S", "--region", "eastus",
                "--max", "many"})).isEqualTo(1);
        assertThat(errors()).contains("Invalid value for --max: many");

        assertThat(command.run(new String[]{"check-quota", snapshot, "--bogus", "x"})).isEqualTo(1);
        assertThat(errors()).contains("Unknown option: --bogus");

        assertThat(command.run(new String[]{"check-quota", tempDir.resolve("missing.json").toString(),
                "--region", "eastus"})).isEqualTo(1);
        assertThat(errors()).contains("IO error", "Estate snapshot file not found");
    }

    private String output() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String errors() {
        return err.toString(StandardCharsets.UTF_8);
    }
}
