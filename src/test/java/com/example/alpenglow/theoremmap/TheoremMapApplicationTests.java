package com.example.alpenglow.theoremmap;

import com.example.alpenglow.theoremmap.cli.TheoremMappingCommand;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(args = {
    "--whitepaper=src/test/resources/fixtures/whitepaper.md",
    "--specs-dir=src/test/resources/fixtures/specs",
    "--proofs-dir=src/test/resources/fixtures/proofs",
    "--output-dir=target/theorem-mapping-it",
    "--project-root=src/test/resources/fixtures"
})
class TheoremMapApplicationTests {

  @Autowired
  TheoremMappingCommand command;

  @Test
  void commandLineRunWritesReports() throws Exception {
    assertThat(command.getExitCode()).isZero();

    Path out = Path.of("target/theorem-mapping-it");
    assertThat(out.resolve("theorem_mapping.csv")).isRegularFile();
    assertThat(out.resolve("theorem_mapping.md")).isRegularFile();
    assertThat(out.resolve("theorem_mapping.html")).isRegularFile();

    JsonNode json = new ObjectMapper().readTree(Files.readString(out.resolve("theorem_mapping.json")));
    assertThat(json.path("total_whitepaper_theorems").asInt()).isEqualTo(3);
    assertThat(json.path("mapped_theorems").asInt()).isEqualTo(5);
  }
}
