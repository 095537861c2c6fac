package com.example.alpenglow.theoremmap.report;

import com.example.alpenglow.theoremmap.model.MappingReport;

import java.io.IOException;
import java.nio.file.Path;

/** One serialized view of a {@link MappingReport}. */
public interface ReportWriter {

    /** File name inside the output directory. */
    String fileName();

    /** Position among the views; lower is written first. */
    int order();

    void write(MappingReport report, Path target) throws IOException;
}
