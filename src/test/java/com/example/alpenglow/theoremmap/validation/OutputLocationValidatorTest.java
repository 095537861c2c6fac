package com.example.alpenglow.theoremmap.validation;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OutputLocationValidatorTest {

  private final OutputLocationValidator validator = new OutputLocationValidator();

  @Test
  void shouldFillDefaultsWhenBlank() {
    ValidationContext context = new ValidationContext("p.md", "specs", "proofs", "", null);

    validator.validate(context);

    assertThat(Path.of(context.getOutputDir())).isEqualTo(Path.of("./theorem_mapping_reports"));
    assertThat(context.getProjectRoot()).isEqualTo(".");
    assertThat(context.getNotices()).hasSize(1);
  }

  @Test
  void shouldRejectOutputPathThatIsAFile(@TempDir Path dir) throws Exception {
    Path file = Files.writeString(dir.resolve("report.txt"), "x");
    ValidationContext context = new ValidationContext("p.md", "specs", "proofs", file.toString(), ".");

    assertThatThrownBy(() -> validator.validate(context))
        .isInstanceOf(ValidationException.class)
        .hasMessageContaining("is not a directory");
  }

  @Test
  void shouldAcceptExistingOrNewDirectory(@TempDir Path dir) {
    ValidationContext context = new ValidationContext("p.md", "specs", "proofs", dir.resolve("new").toString(), "root");

    validator.validate(context);

    assertThat(context.getOutputDir()).isEqualTo(dir.resolve("new").toString());
    assertThat(context.getProjectRoot()).isEqualTo("root");
    assertThat(context.getNotices()).isEmpty();
  }
}
