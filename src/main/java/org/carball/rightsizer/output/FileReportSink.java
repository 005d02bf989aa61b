package org.carball.rightsizer.output;

import lombok.extern.slf4j.Slf4j;
import org.carball.rightsizer.config.OutputFormat;
import org.carball.rightsizer.model.analysis.AnalysisReport;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes the report next to the given output path. With {@link OutputFormat#ALL} every format is
 * written under the same base name.
 */
@Slf4j
public class FileReportSink implements ReportSink {

    private final String outputFile;
    private final OutputFormat format;

    public FileReportSink(String outputFile, OutputFormat format) {
        this.outputFile = outputFile;
        this.format = format;
    }

    @Override
    public List<Path> write(AnalysisReport report) throws IOException {
        RightsizingReport rendered = new RightsizingReport(report);
        String baseFileName = removeFileExtension(outputFile);
        List<Path> written = new ArrayList<>();

        for (OutputFormat target : targets()) {
            Path path = Paths.get(baseFileName + target.getExtension());
            Files.writeString(path, render(rendered, target));
            log.info("Wrote {} report to {}", target.name().toLowerCase(), path);
            written.add(path);
        }
        return written;
    }

    /**
     * Files this sink will produce, in write order.
     */
    public List<Path> plannedFiles() {
        String baseFileName = removeFileExtension(outputFile);
        return targets().stream()
                .map(target -> Paths.get(baseFileName + target.getExtension()))
                .toList();
    }

    private List<OutputFormat> targets() {
        return format == OutputFormat.ALL
                ? List.of(OutputFormat.JSON, OutputFormat.MARKDOWN, OutputFormat.CSV)
                : List.of(format);
    }

    private static String render(RightsizingReport report, OutputFormat format) {
        return switch (format) {
            case MARKDOWN -> report.toMarkdown();
            case CSV -> report.toCsv();
            default -> report.toJson();
        };
    }

    public static String removeFileExtension(String filename) {
        int lastDotIndex = filename.lastIndexOf('.');
        if (lastDotIndex > 0 && lastDotIndex < filename.length() - 1) {
            int lastSeparatorIndex = Math.max(filename.lastIndexOf('/'), filename.lastIndexOf('\\'));
            if (lastDotIndex > lastSeparatorIndex) {
                return filename.substring(0, lastDotIndex);
            }
        }
        return filename;
    }
}
