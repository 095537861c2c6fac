package com.example.alpenglow.theoremmap.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Requires the three source flags. A missing whitepaper file or source directory is only noted:
 * the extractors degrade to empty results for those.
 */
@Component
public class RequiredInputsValidator implements Validator {

  @Override
  public ValidationStage stage() {
    return ValidationStage.INPUTS;
  }

  @Override
  public void validate(ValidationContext context) {
    List<String> missing = new ArrayList<>();
    if (isBlank(context.getWhitepaper())) {
      missing.add("--whitepaper is required");
    }
    if (isBlank(context.getSpecsDir())) {
      missing.add("--specs-dir is required");
    }
    if (isBlank(context.getProofsDir())) {
      missing.add("--proofs-dir is required");
    }
    if (!missing.isEmpty()) {
      throw new ValidationException(missing);
    }

    context.setWhitepaper(context.getWhitepaper().strip());
    context.setSpecsDir(context.getSpecsDir().strip());
    context.setProofsDir(context.getProofsDir().strip());

    if (!Files.exists(Path.of(context.getWhitepaper()))) {
      context.addNotice("Whitepaper " + context.getWhitepaper() + " does not exist; no prose statements will be read.");
    }
    for (String dir : List.of(context.getSpecsDir(), context.getProofsDir())) {
      if (!Files.isDirectory(Path.of(dir))) {
        context.addNotice("Directory " + dir + " does not exist; it contributes no formal modules.");
      }
    }
  }

  private static boolean isBlank(String s) {
    return s == null || s.isBlank();
  }
}
