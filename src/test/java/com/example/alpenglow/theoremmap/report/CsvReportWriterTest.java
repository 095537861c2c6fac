package com.example.alpenglow.theoremmap.report;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static com.example.alpenglow.theoremmap.report.ReportFixtures.mapping;
import static com.example.alpenglow.theoremmap.report.ReportFixtures.report;
import static org.assertj.core.api.Assertions.assertThat;

class CsvReportWriterTest {

  private final CsvReportWriter writer = new CsvReportWriter();

  @Test
  void writesOneRowPerMappingUnderAFixedHeader(@TempDir Path dir) throws Exception {
    Path target = dir.resolve(writer.fileName());

    writer.write(report(
        mapping("theorem_1", "Safety_SafetyTheorem", "specs/Safety.tla"),
        mapping("theorem_2", "Liveness_Progress", "specs/Liveness.tla")), target);

    List<Map<String, String>> rows = read(target);
    assertThat(rows).hasSize(2);
    assertThat(rows.get(0).keySet()).containsExactly(
        "Whitepaper ID", "TLA+ ID", "Confidence", "Mapping Type",
        "TLAPS Status", "TLC Status", "Stateright Status",
        "File Location", "Line Range", "Last Verified",
        "Proof Obligations Total", "Proof Obligations Complete");
    assertThat(rows.get(0))
        .containsEntry("Whitepaper ID", "theorem_1")
        .containsEntry("TLA+ ID", "Safety_SafetyTheorem")
        .containsEntry("Confidence", "0.7")
        .containsEntry("TLC Status", "verified")
        .containsEntry("Stateright Status", "unknown")
        .containsEntry("Line Range", "5-10")
        .containsEntry("Proof Obligations Total", "2");
    assertThat(rows.get(1)).containsEntry("File Location", "specs/Liveness.tla");
  }

  private static List<Map<String, String>> read(Path file) throws Exception {
    CsvMapper mapper = new CsvMapper();
    try (MappingIterator<Map<String, String>> it = mapper.readerFor(Map.class)
        .with(CsvSchema.emptySchema().withHeader())
        .readValues(file.toFile())) {
      return it.readAll();
    }
  }
}
