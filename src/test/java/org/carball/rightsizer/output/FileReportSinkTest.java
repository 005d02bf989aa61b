package org.carball.rightsizer.output;

import org.carball.rightsizer.config.OutputFormat;
import org.carball.rightsizer.model.analysis.AnalysisReport;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

public class FileReportSinkTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldWriteSingleFormat() throws IOException {
        // Given
        FileReportSink sink = new FileReportSink(tempDir.resolve("report.md").toString(), OutputFormat.MARKDOWN);

        // When
        List<Path> written = sink.write(new AnalysisReport(Instant.now(), "test"));

        // Then
        assertThat(written).containsExactly(tempDir.resolve("report.md"));
        assertThat(Files.readString(written.get(0))).startsWith("# VM Rightsizing Report");
    }

    @Test
    void shouldWriteEveryFormatUnderSameBaseName() throws IOException {
        // Given
        FileReportSink sink = new FileReportSink(tempDir.resolve("rightsizing").toString(), OutputFormat.ALL);

        // When
        List<Path> written = sink.write(new AnalysisReport(Instant.now(), "test"));

        // Then
        assertThat(written).containsExactly(
                tempDir.resolve("rightsizing.json"),
                tempDir.resolve("rightsizing.md"),
                tempDir.resolve("rightsizing.csv"));
        assertThat(sink.plannedFiles()).isEqualTo(written);
        assertThat(Files.readString(tempDir.resolve("rightsizing.json"))).contains("\"scope\" : \"test\"");
        assertThat(tempDir.resolve("rightsizing.csv")).exists();
    }

    @Test
    void shouldRemoveOnlyFileExtension() {
        assertThat(FileReportSink.removeFileExtension("out/report.json")).isEqualTo("out/report");
        assertThat(FileReportSink.removeFileExtension("out.d/report")).isEqualTo("out.d/report");
        assertThat(FileReportSink.removeFileExtension(".hidden")).isEqualTo(".hidden");
        assertThat(FileReportSink.removeFileExtension("report.")).isEqualTo("report.");
    }
}
