package com.example.alpenglow.theoremmap.report;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static com.example.alpenglow.theoremmap.report.ReportFixtures.mapping;
import static com.example.alpenglow.theoremmap.report.ReportFixtures.report;
import static org.assertj.core.api.Assertions.assertThat;

class JsonReportWriterTest {

  private final JsonReportWriter writer = new JsonReportWriter();

  @Test
  void writesSnakeCaseDocument(@TempDir Path dir) throws Exception {
    Path target = dir.resolve(writer.fileName());

    writer.write(report(mapping("theorem_1", "Safety_SafetyTheorem", "specs/Safety.tla")), target);

    JsonNode root = new ObjectMapper().readTree(target.toFile());
    assertThat(writer.fileName()).isEqualTo("theorem_mapping.json");
    assertThat(root.path("total_whitepaper_theorems").asInt()).isEqualTo(2);
    assertThat(root.path("total_tla_theorems").asInt()).isEqualTo(3);
    assertThat(root.path("mapped_theorems").asInt()).isEqualTo(1);
    assertThat(root.has("coverage_percent")).isFalse();
    assertThat(root.path("verification_summary").path("tlc_verified").asInt()).isEqualTo(1);

    JsonNode mapping = root.path("mappings").get(0);
    assertThat(mapping.path("whitepaper_id").asText()).isEqualTo("theorem_1");
    assertThat(mapping.path("tla_id").asText()).isEqualTo("Safety_SafetyTheorem");
    assertThat(mapping.path("confidence").asDouble()).isEqualTo(0.7);
    assertThat(mapping.path("mapping_type").asText()).isEqualTo("keyword_based");
    assertThat(mapping.path("line_range").isArray()).isTrue();
    assertThat(mapping.path("line_range").get(0).asInt()).isEqualTo(5);
    assertThat(mapping.path("line_range").get(1).asInt()).isEqualTo(10);
    assertThat(mapping.path("verification_status").path("tlaps_status").asText()).isEqualTo("complete");
    assertThat(mapping.path("verification_status").path("stateright_status").asText()).isEqualTo("unknown");
    assertThat(mapping.path("verification_status").path("proof_obligations_total").asInt()).isEqualTo(2);
    assertThat(root.path("unmapped_whitepaper").isArray()).isTrue();
  }
}
