package io.valuation.marketdata;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes each report table to its own CSV file in the output directory, replacing earlier runs.
 */
public class ReportCsvWriter {
    private final Path outDir;

    public ReportCsvWriter(Path outDir) throws IOException {
        this.outDir = outDir;
        Files.createDirectories(outDir);
    }

    /** @return the files written, in table order */
    public List<Path> write(ValuationReport report) throws IOException {
        List<Path> written = new ArrayList<>(3);
        for (ReportTable table : report.tables()) {
            Path out = outDir.resolve(table.fileName());
            Files.writeString(out, table.toCsv(), StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
            written.add(out);
        }
        return written;
    }

    public Path outDir() { return outDir; }
}
