package com.example.alpenglow.theoremmap.validation;

/** A check on the run flags, executed before any source is read. */
public interface Validator {

  /** Which part of the request this check covers; checks run in stage order. */
  ValidationStage stage();

  /** Throws {@link ValidationException} on unusable values; may fill defaults or add notices. */
  void validate(ValidationContext context);
}
