package com.example.alpenglow.theoremmap.report;

import com.example.alpenglow.theoremmap.model.MappingReport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Writes every registered {@link ReportWriter} view of one report into the output directory. The
 * directory is created before any file is opened; write failures propagate to the caller.
 */
@Slf4j
@Service
public class ReportSynthesizer {

    private final List<ReportWriter> orderedWriters;

    public ReportSynthesizer(List<ReportWriter> writers) {
        List<ReportWriter> safeWriters = writers == null ? List.of() : writers;
        this.orderedWriters = safeWriters.stream()
                .filter(Objects::nonNull)
                .sorted(Comparator.comparingInt(ReportWriter::order))
                .toList();
    }

    public List<Path> synthesize(MappingReport report, Path outputDir) {
        Objects.requireNonNull(report, "report");
        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new UncheckedIOException("Could not create output directory " + outputDir, e);
        }

        List<Path> written = new ArrayList<>(orderedWriters.size());
        for (ReportWriter writer : orderedWriters) {
            Path target = outputDir.resolve(writer.fileName());
            try {
                writer.write(report, target);
            } catch (IOException e) {
                throw new UncheckedIOException("Could not write " + target, e);
            }
            log.info("Wrote {}", target);
            written.add(target);
        }
        return written;
    }
}
