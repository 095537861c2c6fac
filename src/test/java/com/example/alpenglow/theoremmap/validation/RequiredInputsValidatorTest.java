package com.example.alpenglow.theoremmap.validation;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class RequiredInputsValidatorTest {

  private final RequiredInputsValidator validator = new RequiredInputsValidator();

  @Test
  void shouldRejectEveryMissingFlag() {
    ValidationContext context = new ValidationContext(null, " ", "", null, null);

    ValidationException e = catchThrowableOfType(() -> validator.validate(context), ValidationException.class);

    assertThat(e).isNotNull();
    assertThat(e.getReasons()).containsExactly(
        "--whitepaper is required", "--specs-dir is required", "--proofs-dir is required");
  }

  @Test
  void shouldRejectSingleMissingFlag() {
    ValidationContext context = new ValidationContext("paper.md", "specs", null, null, null);

    assertThatThrownBy(() -> validator.validate(context))
        .isInstanceOf(ValidationException.class)
        .hasMessage("--proofs-dir is required");
  }

  @Test
  void shouldNoteMissingLocationsWithoutFailing(@TempDir Path dir) throws Exception {
    Path paper = Files.writeString(dir.resolve("paper.md"), "Theorem 1. x");
    Path specs = Files.createDirectories(dir.resolve("specs"));
    ValidationContext context = new ValidationContext(
        " " + paper + " ", specs.toString(), dir.resolve("proofs").toString(), null, null);

    validator.validate(context);

    assertThat(context.getWhitepaper()).isEqualTo(paper.toString());
    assertThat(context.getNotices()).hasSize(1);
    assertThat(context.getNotices().get(0)).contains("proofs");
  }
}
