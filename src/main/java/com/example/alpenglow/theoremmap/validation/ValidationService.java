package com.example.alpenglow.theoremmap.validation;

import com.example.alpenglow.theoremmap.config.MappingProperties;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import org.springframework.stereotype.Service;

/**
 * Coordinates all registered {@link Validator} beans and executes them in stage order for the
 * configured run.
 */
@Service
public class ValidationService {

  private final List<Validator> orderedValidators;

  public ValidationService(List<Validator> validators) {
    List<Validator> safeValidators = validators == null ? List.of() : validators;
    this.orderedValidators = safeValidators.stream()
        .filter(Objects::nonNull)
        .sorted(Comparator.comparing(Validator::stage))
        .toList();
  }

  public ValidationContext validate(MappingProperties properties) {
    ValidationContext context = new ValidationContext(
        properties.getWhitepaper(),
        properties.getSpecsDir(),
        properties.getProofsDir(),
        properties.getOutputDir(),
        properties.getProjectRoot());
    for (Validator validator : orderedValidators) {
      validator.validate(context);
    }
    return context;
  }
}
