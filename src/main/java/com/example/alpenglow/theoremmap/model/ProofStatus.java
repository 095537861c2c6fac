package com.example.alpenglow.theoremmap.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Proof status derived from a formal module. Detection is per file: every declaration in a module
 * shares the status of the module text as a whole.
 */
public enum ProofStatus {
  UNKNOWN,
  INCOMPLETE,
  COMPLETE;

  @JsonValue
  public String code() {
    return name().toLowerCase(Locale.ROOT);
  }
}
