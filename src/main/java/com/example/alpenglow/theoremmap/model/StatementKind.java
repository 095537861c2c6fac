package com.example.alpenglow.theoremmap.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum StatementKind {
  THEOREM,
  ASSUMPTION;

  @JsonValue
  public String code() {
    return name().toLowerCase(Locale.ROOT);
  }

  /** Title used when the whitepaper gives no parenthetical name, e.g. {@code Theorem 3}. */
  public String defaultTitle(String ordinal) {
    String code = code();
    return Character.toUpperCase(code.charAt(0)) + code.substring(1) + " " + ordinal;
  }

  public String idFor(String ordinal) {
    return code() + "_" + ordinal;
  }

  public static StatementKind fromKeyword(String keyword) {
    return StatementKind.valueOf(keyword.trim().toUpperCase(Locale.ROOT));
  }
}
