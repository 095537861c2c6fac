package com.example.alpenglow.theoremmap.validation;

import com.example.alpenglow.theoremmap.config.MappingProperties;
import java.nio.file.Files;
import java.nio.file.Path;
import org.springframework.stereotype.Component;

/** Fills the default output directory and project root, and rejects an output path that is a file. */
@Component
public class OutputLocationValidator implements Validator {

  @Override
  public ValidationStage stage() {
    return ValidationStage.OUTPUTS;
  }

  @Override
  public void validate(ValidationContext context) {
    if (context.getOutputDir() == null || context.getOutputDir().isBlank()) {
      context.setOutputDir(MappingProperties.DEFAULT_OUTPUT_DIR);
      context.addNotice("No --output-dir given; writing to " + MappingProperties.DEFAULT_OUTPUT_DIR + ".");
    }
    if (context.getProjectRoot() == null || context.getProjectRoot().isBlank()) {
      context.setProjectRoot(MappingProperties.DEFAULT_PROJECT_ROOT);
    }

    Path output = Path.of(context.getOutputDir().strip());
    if (Files.exists(output) && !Files.isDirectory(output)) {
      throw new ValidationException("Output location " + output + " exists and is not a directory.");
    }
    context.setOutputDir(output.toString());
  }
}
