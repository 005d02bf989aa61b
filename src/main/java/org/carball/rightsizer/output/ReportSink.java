package org.carball.rightsizer.output;

import org.carball.rightsizer.model.analysis.AnalysisReport;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

public interface ReportSink {

    /**
     * Writes the report and returns the files produced.
     */
    List<Path> write(AnalysisReport report) throws IOException;
}
