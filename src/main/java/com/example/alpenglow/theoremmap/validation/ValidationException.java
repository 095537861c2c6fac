package com.example.alpenglow.theoremmap.validation;

import java.util.List;

/** Thrown when the run flags cannot form a usable request; carries one reason per problem. */
public class ValidationException extends RuntimeException {

  private final List<String> reasons;

  public ValidationException(String reason) {
    this(List.of(reason));
  }

  public ValidationException(List<String> reasons) {
    super(describe(reasons));
    this.reasons = List.copyOf(reasons);
  }

  public List<String> getReasons() {
    return reasons;
  }

  private static String describe(List<String> reasons) {
    if (reasons == null || reasons.isEmpty()) {
      throw new IllegalArgumentException("at least one reason is required");
    }
    return String.join("; ", reasons);
  }
}
