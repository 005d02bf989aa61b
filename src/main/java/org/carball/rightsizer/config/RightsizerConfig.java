package org.carball.rightsizer.config;

import lombok.Data;

import java.nio.file.Path;

@Data
public class RightsizerConfig {
    private Path snapshotFile;
    private String outputFile;
    private OutputFormat outputFormat;
    private String openAiApiKey;
    private String resourceGroup;
    private String tablesFile;
    private boolean includeAi = true;
    private boolean includeMetrics = true;
    private boolean verbose;
    private RightsizingSettings settings;
}
