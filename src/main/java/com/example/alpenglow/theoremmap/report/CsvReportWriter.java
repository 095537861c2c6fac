package com.example.alpenglow.theoremmap.report;

import com.example.alpenglow.theoremmap.model.MappingReport;
import com.example.alpenglow.theoremmap.model.TheoremMapping;
import com.example.alpenglow.theoremmap.model.VerificationStatus;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;

/** One row per mapping candidate, for spreadsheet analysis. */
@Component
public class CsvReportWriter implements ReportWriter {

    private static final CsvMapper CSV_MAPPER = new CsvMapper();
    private static final CsvSchema SCHEMA = CSV_MAPPER.schemaFor(Row.class).withHeader();

    @Override
    public String fileName() {
        return ReportFormats.BASE_NAME + ".csv";
    }

    @Override
    public int order() {
        return 1;
    }

    @Override
    public void write(MappingReport report, Path target) throws IOException {
        try (SequenceWriter rows = CSV_MAPPER.writer(SCHEMA).writeValues(target.toFile())) {
            for (TheoremMapping mapping : report.getMappings()) {
                rows.write(Row.of(mapping));
            }
        }
    }

    @JsonPropertyOrder({
            "Whitepaper ID", "TLA+ ID", "Confidence", "Mapping Type",
            "TLAPS Status", "TLC Status", "Stateright Status",
            "File Location", "Line Range", "Last Verified",
            "Proof Obligations Total", "Proof Obligations Complete"
    })
    static final class Row {
        @JsonProperty("Whitepaper ID") public final String whitepaperId;
        @JsonProperty("TLA+ ID") public final String tlaId;
        @JsonProperty("Confidence") public final double confidence;
        @JsonProperty("Mapping Type") public final String mappingType;
        @JsonProperty("TLAPS Status") public final String tlapsStatus;
        @JsonProperty("TLC Status") public final String tlcStatus;
        @JsonProperty("Stateright Status") public final String staterightStatus;
        @JsonProperty("File Location") public final String fileLocation;
        @JsonProperty("Line Range") public final String lineRange;
        @JsonProperty("Last Verified") public final String lastVerified;
        @JsonProperty("Proof Obligations Total") public final int proofObligationsTotal;
        @JsonProperty("Proof Obligations Complete") public final int proofObligationsComplete;

        private Row(TheoremMapping mapping) {
            VerificationStatus status = mapping.getVerificationStatus();
            this.whitepaperId = mapping.getWhitepaperId();
            this.tlaId = mapping.getTlaId();
            this.confidence = mapping.getConfidence();
            this.mappingType = mapping.getMappingType();
            this.tlapsStatus = status.getTlapsStatus();
            this.tlcStatus = status.getTlcStatus();
            this.staterightStatus = status.getStaterightStatus();
            this.fileLocation = mapping.getFileLocation();
            this.lineRange = mapping.getLineRange().format();
            this.lastVerified = status.getLastVerified() == null ? "" : status.getLastVerified();
            this.proofObligationsTotal = status.getProofObligationsTotal();
            this.proofObligationsComplete = status.getProofObligationsComplete();
        }

        static Row of(TheoremMapping mapping) {
            return new Row(mapping);
        }
    }
}
